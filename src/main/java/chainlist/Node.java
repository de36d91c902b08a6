//
// Chainlist - a singly-linked sequence container for the JVM
// Distributed under the BSD license; see LICENSE in the project root

package chainlist;

/**
 * A single link in a {@link LinkedList} chain. A node is reachable from exactly one predecessor,
 * or from the list's head slot.
 */
final class Node<E> {

  E data;
  Node<E> next;

  Node (E data, Node<E> next) {
    this.data = data;
    this.next = next;
  }
}
