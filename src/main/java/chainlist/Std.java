//
// Chainlist - a singly-linked sequence container for the JVM
// Distributed under the BSD license; see LICENSE in the project root

package chainlist;

/**
 * Provides factory methods for {@code chainlist} data structures.
 */
public class Std {

  /** Returns a new, empty {@link LinkedList}. */
  public static <A> LinkedList<A> list () { return new LinkedList<A>(); }
  /** Returns a {@link LinkedList} containing {@code e0}. */
  public static <A> LinkedList<A> list (A e0) { return new LinkedList<A>().add(e0); }
  /** Returns a {@link LinkedList} containing {@code e0, e1}. */
  public static <A> LinkedList<A> list (A e0, A e1) { return list(e0).add(e1); }
  /** Returns a {@link LinkedList} containing {@code e0, e1, e2}. */
  public static <A> LinkedList<A> list (A e0, A e1, A e2) { return list(e0, e1).add(e2); }

  /**
   * Returns a {@link LinkedList} containing {@code elems}, in order. javac resolves a bare
   * {@code list(null)} to this overload with a null array; that yields a list holding one null.
   */
  @SafeVarargs public static <A> LinkedList<A> list (A... elems) {
    if (elems == null) return list((A)null);
    LinkedList<A> list = new LinkedList<A>();
    for (A elem : elems) list.add(elem);
    return list;
  }

  /** Returns a {@link LinkedList} containing the elements of {@code as}, in iteration order. */
  public static <A> LinkedList<A> from (Iterable<? extends A> as) {
    return copyOf(as);
  }

  /** Returns a list with fresh nodes which holds the same elements as {@code as}. */
  public static <A> LinkedList<A> copyOf (Iterable<? extends A> as) {
    LinkedList<A> copy = new LinkedList<A>();
    for (A a : as) copy.add(a);
    return copy;
  }

  /**
   * Returns the concatenation of {@code as} and {@code bs} as a new list. Unlike {@link
   * LinkedList#concat}, neither argument is modified and the result shares no nodes with them.
   */
  public static <A> LinkedList<A> concat (LinkedList<? extends A> as, LinkedList<? extends A> bs) {
    LinkedList<A> both = copyOf(as);
    for (A b : bs) both.add(b);
    return both;
  }
}
