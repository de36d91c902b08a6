//
// Chainlist - a singly-linked sequence container for the JVM
// Distributed under the BSD license; see LICENSE in the project root

package chainlist;

import java.io.PrintStream;
import java.util.Objects;

/** Ye olde log facade. */
public abstract class Log {

  /** A log that discards everything. */
  public static final Log NONE = new Log() {
    @Override public void log (String msg) {}
    @Override public void log (String msg, Throwable error) {}
  };

  /** Returns a log that writes each message as a line to {@code out}. */
  public static Log to (PrintStream out) {
    Objects.requireNonNull(out, "out");
    return new Log() {
      @Override public void log (String msg) {
        out.println(msg);
      }
      @Override public void log (String msg, Throwable error) {
        out.println(msg);
        error.printStackTrace(out);
      }
    };
  }

  /** Records {@code msg} to the log. */
  public abstract void log (String msg);

  /** Records {@code msg} and {@code error} to the log. */
  public abstract void log (String msg, Throwable error);

  /**
   * Records {@code msg} plus {@code [key=value, ...]} to the log. If the last {@code keyVals}
   * argument is a lone exception, its stack trace will be logged.
   */
  public void log (String msg, String key, Object value, Object... keyVals) {
    StringBuilder sb = new StringBuilder(msg);
    sb.append(" [").append(key).append("=").append(value);
    int ii = 0; for (int ll = keyVals.length-1; ii < ll; ii += 2) {
      sb.append(", ").append(keyVals[ii]).append("=").append(keyVals[ii+1]);
    }
    sb.append("]");
    if (ii >= keyVals.length || !(keyVals[ii] instanceof Throwable)) log(sb.toString());
    else log(sb.toString(), (Throwable)keyVals[ii]);
  }
}
