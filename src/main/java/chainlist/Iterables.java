//
// Chainlist - a singly-linked sequence container for the JVM
// Distributed under the BSD license; see LICENSE in the project root

package chainlist;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

public class Iterables {

  /** An iterator which does not support {@link Iterator#remove}. */
  public static abstract class ImmIterator<A> implements Iterator<A> {
    @Override public void remove () {
      throw new UnsupportedOperationException("remove");
    }
  }

  /**
   * Returns true if the elements in {@code a1s} and {@code a2s} are pairwise equal, per {@link
   * Objects#equals}. If either iterable contains more elements than the other, they are not equal.
   */
  public static boolean equals (Iterable<?> a1s, Iterable<?> a2s) {
    Iterator<?> iter1 = a1s.iterator(), iter2 = a2s.iterator();
    while (iter1.hasNext()) {
      if (!iter2.hasNext() || !Objects.equals(iter1.next(), iter2.next())) return false;
    }
    return !iter2.hasNext();
  }

  /**
   * Returns a hash code computed from the elements of {@code as}. This hash code will be
   * equivalent to {@link java.util.Arrays#hashCode} of an array holding the same elements.
   */
  public static int hashCode (Iterable<?> as) {
    int result = 1;
    for (Object elem : as) result = 31 * result + (elem == null ? 0 : elem.hashCode());
    return result;
  }

  /** Returns an iterator over no elements. */
  public static <A> Iterator<A> emptyIterator () {
    @SuppressWarnings("unchecked") Iterator<A> empty = (Iterator<A>)EMPTY_ITER;
    return empty;
  }

  static final Iterator<Object> EMPTY_ITER = new ImmIterator<Object>() {
    public boolean hasNext() { return false; }
    public Object next () { throw new NoSuchElementException(); }
  };
}
