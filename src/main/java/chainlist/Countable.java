//
// Chainlist - a singly-linked sequence container for the JVM
// Distributed under the BSD license; see LICENSE in the project root

package chainlist;

/**
 * Represents a collection with a countable number of elements.
 */
public interface Countable<E> extends Iterable<E> {

  /** Returns the number of elements in this countable collection. */
  int size ();

  /** Returns true if this collection contains no elements. */
  default boolean isEmpty () { return size() == 0; }
}
