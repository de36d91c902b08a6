//
// Chainlist - a singly-linked sequence container for the JVM
// Distributed under the BSD license; see LICENSE in the project root

package chainlist;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A mutable, singly-linked sequence. Appending and reading the last element are O(1); all other
 * indexed operations walk forward from the head.
 *
 * <p>Lists never share nodes: {@link #concat} moves the nodes of its argument into this list and
 * leaves the argument empty. Use {@link Std#concat} to combine two lists without disturbing
 * either of them.</p>
 *
 * <p>This class is not thread safe.</p>
 */
public class LinkedList<E> implements Countable<E> {

  /** Creates an empty list. */
  public LinkedList () {}

  @Override public int size () { return size; }

  /** Returns the first element of this list.
    * @throws NoSuchElementException if this list is empty. */
  public E first () {
    if (head == null) throw new NoSuchElementException("first() of empty list");
    return head.data;
  }

  /** Returns the last element of this list.
    * @throws NoSuchElementException if this list is empty. */
  public E last () {
    if (tail == null) throw new NoSuchElementException("last() of empty list");
    return tail.data;
  }

  /**
   * Appends {@code value} to the end of this list.
   * @return this list for call chaining.
   */
  public LinkedList<E> add (E value) {
    Node<E> node = new Node<E>(value, null);
    if (head == null) head = node;
    else tail.next = node;
    tail = node;
    size += 1;
    return this;
  }

  /**
   * Inserts {@code value} before the element currently at {@code index}. Only existing positions
   * are accepted; use {@link #add} to append.
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0,size)}.
   */
  public void insert (int index, E value) {
    checkIndex(index, size);
    if (index == 0) {
      head = new Node<E>(value, head);
    } else {
      Node<E> prev = nodeAt(index-1);
      // index < size, so the new node always has a successor and tail is unchanged
      prev.next = new Node<E>(value, prev.next);
    }
    size += 1;
  }

  /**
   * Removes the element at {@code index} and returns it.
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0,size)}.
   */
  public E removeAt (int index) {
    checkIndex(index, size);
    if (index == 0) {
      E removed = head.data;
      head = head.next;
      if (head == null) tail = null;
      size -= 1;
      return removed;
    }

    Node<E> prev = nodeAt(index-1), target = prev.next;
    prev.next = target.next;
    if (target == tail) tail = prev;
    size -= 1;
    return target.data;
  }

  /**
   * Removes the first element equal to {@code value} (per {@link Objects#equals}). Later equal
   * elements are left in place. Does nothing if no element matches.
   * @return this list for call chaining.
   */
  public LinkedList<E> remove (E value) {
    if (head == null) return this;
    if (Objects.equals(head.data, value)) {
      head = head.next;
      if (head == null) tail = null;
      size -= 1;
      return this;
    }

    for (Node<E> cur = head; cur.next != null; cur = cur.next) {
      if (Objects.equals(cur.next.data, value)) {
        if (cur.next == tail) tail = cur;
        cur.next = cur.next.next;
        size -= 1;
        break;
      }
    }
    return this;
  }

  /** Returns true if this list contains an element equal to {@code value}. */
  public boolean contains (E value) {
    return indexOf(value) >= 0;
  }

  /** Returns the index of the first element equal to {@code value}, or -1. */
  public int indexOf (E value) {
    int index = 0;
    for (Node<E> cur = head; cur != null; cur = cur.next, index += 1) {
      if (Objects.equals(cur.data, value)) return index;
    }
    return -1;
  }

  /** Removes all elements from this list. */
  public void clear () {
    head = null;
    tail = null;
    size = 0;
  }

  /**
   * Returns the element at {@code index}. Reading the last element does not walk the chain.
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0,size)}.
   */
  public E get (int index) {
    checkIndex(index, size);
    return (index == size-1) ? tail.data : nodeAt(index).data;
  }

  /**
   * Replaces the element at {@code index} with {@code value}.
   * @return the element previously at {@code index}.
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0,size)}.
   */
  public E set (int index, E value) {
    checkIndex(index, size);
    Node<E> node = (index == size-1) ? tail : nodeAt(index);
    E old = node.data;
    node.data = value;
    return old;
  }

  /**
   * Moves the elements of {@code other} onto the end of this list. {@code other} is left empty;
   * its nodes now belong to this list.
   * @return this list for call chaining.
   * @throws IllegalArgumentException if {@code other} is this list.
   */
  public LinkedList<E> concat (LinkedList<? extends E> other) {
    Objects.requireNonNull(other, "other");
    if (other == this) throw new IllegalArgumentException("Cannot concat a list onto itself.");
    if (other.head == null) return this;

    @SuppressWarnings("unchecked") LinkedList<E> casted = (LinkedList<E>)other;
    if (head == null) head = casted.head;
    else tail.next = casted.head;
    tail = casted.tail;
    size += casted.size;
    casted.clear();
    return this;
  }

  /** Applies {@code action} to each element, from first to last. */
  @Override public void forEach (Consumer<? super E> action) {
    Objects.requireNonNull(action, "action");
    for (Node<E> cur = head; cur != null; cur = cur.next) action.accept(cur.data);
  }

  /** Returns a new list which contains {@code fn} applied to each of this list's elements. */
  public <F> LinkedList<F> map (Function<? super E, ? extends F> fn) {
    Objects.requireNonNull(fn, "fn");
    LinkedList<F> mapped = new LinkedList<F>();
    for (Node<E> cur = head; cur != null; cur = cur.next) mapped.add(fn.apply(cur.data));
    return mapped;
  }

  /** Returns a new list which contains the elements of this list which satisfy {@code pred}. */
  public LinkedList<E> where (Predicate<? super E> pred) {
    Objects.requireNonNull(pred, "pred");
    LinkedList<E> filtered = new LinkedList<E>();
    for (Node<E> cur = head; cur != null; cur = cur.next) {
      if (pred.test(cur.data)) filtered.add(cur.data);
    }
    return filtered;
  }

  /** Returns the elements of this list, in order, in a new array. */
  public Object[] toArray () {
    Object[] elems = new Object[size];
    int ii = 0;
    for (Node<E> cur = head; cur != null; cur = cur.next) elems[ii++] = cur.data;
    return elems;
  }

  @Override public Iterator<E> iterator () {
    if (head == null) return Iterables.emptyIterator();
    return new Iterables.ImmIterator<E>() {
      private Node<E> cur = head;
      @Override public boolean hasNext () {
        return cur != null;
      }
      @Override public E next () {
        Node<E> cur = this.cur;
        if (cur == null) throw new NoSuchElementException();
        this.cur = cur.next;
        return cur.data;
      }
    };
  }

  /** Logs the shape of this list to {@code log}: a summary line, then one line per node. */
  public void dump (Log log) {
    Objects.requireNonNull(log, "log");
    log.log("LinkedList", "size", size, "head", (head == null) ? null : head.data,
            "tail", (tail == null) ? null : tail.data);
    int index = 0;
    for (Node<E> cur = head; cur != null; cur = cur.next, index += 1) {
      log.log("node", "index", index, "data", cur.data, "tail", cur == tail);
    }
  }

  @Override public boolean equals (Object other) {
    if (other == this) return true;
    if (!(other instanceof LinkedList)) return false;
    LinkedList<?> olist = (LinkedList<?>)other;
    return olist.size == size && Iterables.equals(this, olist);
  }

  @Override public int hashCode () {
    return Iterables.hashCode(this);
  }

  @Override public String toString () {
    StringBuilder sb = new StringBuilder("LinkedList: [");
    for (Node<E> cur = head; cur != null; cur = cur.next) {
      sb.append(cur.data);
      if (cur.next != null) sb.append(',');
    }
    return sb.append(']').toString();
  }

  /**
   * Walks the chain and verifies the size, head/tail and termination invariants.
   * @throws IllegalStateException describing the first violation found.
   */
  void checkInvariants () {
    if ((head == null) != (size == 0) || (tail == null) != (size == 0)) throw new
      IllegalStateException("head/tail do not agree with size " + size);
    int count = 0;
    Node<E> last = null;
    for (Node<E> cur = head; cur != null; cur = cur.next) {
      // a chain longer than size means a cycle or a stale count
      if (++count > size) throw new IllegalStateException("more than " + size + " nodes reachable");
      last = cur;
    }
    if (count != size) throw new IllegalStateException(count + " nodes reachable, size " + size);
    if (last != tail) throw new IllegalStateException("tail is not the last reachable node");
  }

  private Node<E> nodeAt (int index) {
    Node<E> cur = head;
    for (int ii = 0; ii < index; ii++) cur = cur.next;
    return cur;
  }

  private static void checkIndex (int index, int max) {
    if (index < 0 || index >= max) throw new IndexOutOfBoundsException(
      index + " not in [0," + max + ")");
  }

  private Node<E> head;
  private Node<E> tail;
  private int size;
}
