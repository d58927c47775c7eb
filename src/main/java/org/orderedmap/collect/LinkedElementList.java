package org.orderedmap.collect;

import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * <p>
 * A doubly-linked list whose links are stored in parallel arrays rather than in node objects. Each element is addressed by an
 * {@link ElementId} that stays attached to it while it is moved around the list, so elements can be inserted, removed and relocated relative
 * to one another in constant time.
 * </p>
 *
 * <p>
 * Storage slots vacated by removed elements are chained together and reused by later additions. Each slot carries a generation stamp that
 * is advanced when its element is removed, so IDs for removed elements are never mistaken for IDs of the slot's later occupants.
 * </p>
 *
 * <p>
 * This class is not thread-safe.
 * </p>
 *
 * @param <E> The type of values in the list
 */
public class LinkedElementList<E> implements Iterable<E> {
	/**
	 * The maximum size of array to allocate. Some VMs reserve some header words in an array. Attempts to allocate larger arrays may result
	 * in OutOfMemoryError: Requested array size exceeds VM limit
	 */
	private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;
	/** The relative amount by which the internal arrays will grow, by default, when the list's size needs exceed its capacity */
	private static final double DEFAULT_GROWTH_FACTOR = 0.5;
	private static final int DEFAULT_INIT_CAPACITY = 8;
	private static final int NIL = -1;

	/** Builds a {@link LinkedElementList} */
	public static class Builder {
		private int theInitCapacity;
		private double theGrowthFactor;

		private Builder() {
			theInitCapacity = DEFAULT_INIT_CAPACITY;
			theGrowthFactor = DEFAULT_GROWTH_FACTOR;
		}

		/**
		 * @param initCap The initial capacity for the list
		 * @return This builder
		 */
		public Builder withInitCapacity(int initCap) {
			if (initCap < 0)
				throw new IllegalArgumentException(initCap + "<0");
			else if (initCap > MAX_ARRAY_SIZE)
				throw new IllegalArgumentException(initCap + ">" + MAX_ARRAY_SIZE);
			theInitCapacity = initCap;
			return this;
		}

		/**
		 * @param factor The growth factor for the storage, i.e. the relative amount by which the internal arrays will grow, at minimum, when
		 *        the list's size needs exceed its capacity. A value of zero means the arrays will only grow to accommodate the new element.
		 *        A value of 1 means the arrays will at least double in size when new space is needed.
		 * @return This builder
		 */
		public Builder withGrowthFactor(double factor) {
			if (factor < 0)
				throw new IllegalArgumentException("Growth factor must be at least zero");
			if (Double.isNaN(factor) || Double.isInfinite(factor) || factor >= 100)
				throw new IllegalArgumentException("Growth factor must be a finite number less than 100");
			theGrowthFactor = factor;
			return this;
		}

		/**
		 * @param <E> The type of values for the list
		 * @return The new list
		 */
		public <E> LinkedElementList<E> build() {
			return new LinkedElementList<>(theInitCapacity, theGrowthFactor);
		}
	}

	/** @return A builder to create a new {@link LinkedElementList} */
	public static Builder build() {
		return new Builder();
	}

	private final double theGrowthFactor;
	private Object[] theValues;
	private int[] thePrevious;
	private int[] theNext;
	private int[] theGenerations;

	private int theHead;
	private int theTail;
	private int theSize;
	/** The number of slots that have ever been occupied. Slots at or above this index have never been used. */
	private int theUsedSlots;
	/** The first vacated slot, chained through {@link #theNext} */
	private int theFreeHead;
	private long theStamp;

	/** Creates an empty list with default settings */
	public LinkedElementList() {
		this(DEFAULT_INIT_CAPACITY, DEFAULT_GROWTH_FACTOR);
	}

	private LinkedElementList(int initCapacity, double growthFactor) {
		theGrowthFactor = growthFactor;
		theValues = new Object[initCapacity];
		thePrevious = new int[initCapacity];
		theNext = new int[initCapacity];
		theGenerations = new int[initCapacity];
		theHead = theTail = theFreeHead = NIL;
	}

	/** @return The number of elements in this list */
	public int size() {
		return theSize;
	}

	/** @return Whether this list has no elements */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/** @return The number of elements this list can hold without growing its storage */
	public int getCapacity() {
		return theValues.length;
	}

	/**
	 * @return A stamp that changes whenever this list's structure (its set of elements or their order) changes. Replacing an element's
	 *         value does not change the stamp.
	 */
	public long getStamp() {
		return theStamp;
	}

	/**
	 * @param value The value to add
	 * @return The ID of the new element, at the end of the list
	 */
	public ElementId addLast(E value) {
		int slot = allocate(value);
		linkAfter(slot, theTail);
		return new Id(slot, theGenerations[slot]);
	}

	/**
	 * @param value The value to add
	 * @return The ID of the new element, at the beginning of the list
	 */
	public ElementId addFirst(E value) {
		int slot = allocate(value);
		linkBefore(slot, theHead);
		return new Id(slot, theGenerations[slot]);
	}

	/**
	 * @param first Whether to get the first or the last element
	 * @return The first or last element in this list, or null if the list is empty
	 */
	public CollectionElement<E> getTerminalElement(boolean first) {
		int slot = first ? theHead : theTail;
		return slot == NIL ? null : new Element(new Id(slot, theGenerations[slot]));
	}

	/**
	 * @param id The ID of the element to get
	 * @return The element with the given ID
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public CollectionElement<E> getElement(ElementId id) {
		return new Element(check(id));
	}

	/**
	 * @param id The ID of the element to get the neighbor of
	 * @param next Whether to get the element after or before the given one
	 * @return The element adjacent to the given one, or null if the given element is terminal in the given direction
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public CollectionElement<E> getAdjacentElement(ElementId id, boolean next) {
		int slot = check(id).theSlot;
		int adj = next ? theNext[slot] : thePrevious[slot];
		return adj == NIL ? null : new Element(new Id(adj, theGenerations[adj]));
	}

	/**
	 * @param id The ID of the element to get the value of
	 * @return The value of the element
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public E get(ElementId id) {
		return (E) theValues[check(id).theSlot];
	}

	/**
	 * @param id The ID of the element to replace the value of
	 * @param value The new value for the element
	 * @return The element's previous value
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public E set(ElementId id, E value) {
		int slot = check(id).theSlot;
		E old = (E) theValues[slot];
		theValues[slot] = value;
		return old;
	}

	/**
	 * Removes an element from this list. The ID will no longer be {@link ElementId#isPresent() present}.
	 *
	 * @param id The ID of the element to remove
	 * @return The value of the removed element
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public E remove(ElementId id) {
		int slot = check(id).theSlot;
		E value = (E) theValues[slot];
		unlink(slot);
		release(slot);
		theSize--;
		theStamp++;
		return value;
	}

	/**
	 * @param id The ID of the element to move to the beginning of the list
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public void moveToFront(ElementId id) {
		int slot = check(id).theSlot;
		if (slot == theHead)
			return;
		unlink(slot);
		linkBefore(slot, theHead);
		theStamp++;
	}

	/**
	 * @param id The ID of the element to move to the end of the list
	 * @throws IllegalArgumentException If the ID is not present in this list
	 */
	public void moveToBack(ElementId id) {
		int slot = check(id).theSlot;
		if (slot == theTail)
			return;
		unlink(slot);
		linkAfter(slot, theTail);
		theStamp++;
	}

	/**
	 * Moves an element to be immediately after another. Moving an element after itself does nothing.
	 *
	 * @param id The ID of the element to move
	 * @param mark The ID of the element to move the element after
	 * @throws IllegalArgumentException If either ID is not present in this list
	 */
	public void moveAfter(ElementId id, ElementId mark) {
		int slot = check(id).theSlot;
		int markSlot = check(mark).theSlot;
		if (slot == markSlot || theNext[markSlot] == slot)
			return;
		unlink(slot);
		linkAfter(slot, markSlot);
		theStamp++;
	}

	/**
	 * Moves an element to be immediately before another. Moving an element before itself does nothing.
	 *
	 * @param id The ID of the element to move
	 * @param mark The ID of the element to move the element before
	 * @throws IllegalArgumentException If either ID is not present in this list
	 */
	public void moveBefore(ElementId id, ElementId mark) {
		int slot = check(id).theSlot;
		int markSlot = check(mark).theSlot;
		if (slot == markSlot || thePrevious[markSlot] == slot)
			return;
		unlink(slot);
		linkBefore(slot, markSlot);
		theStamp++;
	}

	/** Removes all elements from this list. No ID previously issued by this list will be {@link ElementId#isPresent() present} afterward. */
	public void clear() {
		for (int slot = theHead; slot != NIL;) {
			int next = theNext[slot];
			theValues[slot] = null;
			theGenerations[slot]++;
			slot = next;
		}
		// Vacated slots are re-chained lowest-first so reuse after a clear starts at the beginning of the storage
		theFreeHead = NIL;
		for (int slot = theUsedSlots - 1; slot >= 0; slot--) {
			theNext[slot] = theFreeHead;
			thePrevious[slot] = NIL;
			theFreeHead = slot;
		}
		theHead = theTail = NIL;
		theSize = 0;
		theStamp++;
	}

	@Override
	public Iterator<E> iterator() {
		return new Itr();
	}

	/**
	 * Checks this list's internal state for consistency
	 *
	 * @throws IllegalStateException If this list's structure is corrupt
	 */
	public void checkValid() {
		int count = 0;
		int prev = NIL;
		for (int slot = theHead; slot != NIL; slot = theNext[slot]) {
			if (count == theSize)
				throw new IllegalStateException("More linked elements than the size " + theSize + ", or a cycle in the links");
			if (thePrevious[slot] != prev)
				throw new IllegalStateException("Backward link of slot " + slot + " is " + thePrevious[slot] + ", not " + prev);
			prev = slot;
			count++;
		}
		if (count != theSize)
			throw new IllegalStateException("Linked " + count + " elements, but size is " + theSize);
		if (theTail != prev)
			throw new IllegalStateException("Tail is " + theTail + ", but the last linked slot is " + prev);
		int free = 0;
		for (int slot = theFreeHead; slot != NIL; slot = theNext[slot]) {
			if (free > theUsedSlots)
				throw new IllegalStateException("Cycle in the vacated slot chain");
			if (theValues[slot] != null)
				throw new IllegalStateException("Vacated slot " + slot + " still references a value");
			free++;
		}
		if (free + theSize != theUsedSlots)
			throw new IllegalStateException(
				"Slot accounting is off: " + free + " vacated + " + theSize + " occupied != " + theUsedSlots + " used");
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append('[');
		for (int slot = theHead; slot != NIL; slot = theNext[slot]) {
			if (slot != theHead)
				str.append(", ");
			str.append(theValues[slot]);
		}
		return str.append(']').toString();
	}

	private Id check(ElementId id) {
		if (!(id instanceof LinkedElementList.Id) || ((Id) id).getList() != this)
			throw new IllegalArgumentException("Element does not belong to this list: " + id);
		Id myId = (Id) id;
		if (!myId.isPresent())
			throw new IllegalArgumentException("Element has been removed");
		return myId;
	}

	private int allocate(E value) {
		int slot;
		if (theFreeHead != NIL) {
			slot = theFreeHead;
			theFreeHead = theNext[slot];
		} else {
			if (theUsedSlots == theValues.length)
				grow(theUsedSlots + 1);
			slot = theUsedSlots++;
		}
		theValues[slot] = value;
		theSize++;
		theStamp++;
		return slot;
	}

	private void release(int slot) {
		theValues[slot] = null;
		theGenerations[slot]++;
		thePrevious[slot] = NIL;
		theNext[slot] = theFreeHead;
		theFreeHead = slot;
	}

	private void grow(int minCapacity) {
		if (minCapacity > MAX_ARRAY_SIZE)
			throw new IllegalStateException("Cannot grow beyond " + MAX_ARRAY_SIZE + " elements");
		int newCap = (int) Math.min(MAX_ARRAY_SIZE, theValues.length + (long) Math.ceil(theValues.length * theGrowthFactor));
		if (newCap < minCapacity)
			newCap = minCapacity;
		theValues = Arrays.copyOf(theValues, newCap);
		thePrevious = Arrays.copyOf(thePrevious, newCap);
		theNext = Arrays.copyOf(theNext, newCap);
		theGenerations = Arrays.copyOf(theGenerations, newCap);
	}

	private void unlink(int slot) {
		int prev = thePrevious[slot];
		int next = theNext[slot];
		if (prev == NIL)
			theHead = next;
		else
			theNext[prev] = next;
		if (next == NIL)
			theTail = prev;
		else
			thePrevious[next] = prev;
	}

	/** Links an unlinked slot after another, or at the head if <code>after</code> is {@link #NIL} */
	private void linkAfter(int slot, int after) {
		int next = after == NIL ? theHead : theNext[after];
		thePrevious[slot] = after;
		theNext[slot] = next;
		if (after == NIL)
			theHead = slot;
		else
			theNext[after] = slot;
		if (next == NIL)
			theTail = slot;
		else
			thePrevious[next] = slot;
	}

	/** Links an unlinked slot before another, or at the tail if <code>before</code> is {@link #NIL} */
	private void linkBefore(int slot, int before) {
		linkAfter(slot, before == NIL ? theTail : thePrevious[before]);
	}

	private class Id implements ElementId {
		final int theSlot;
		final int theGeneration;

		Id(int slot, int generation) {
			theSlot = slot;
			theGeneration = generation;
		}

		LinkedElementList<?> getList() {
			return LinkedElementList.this;
		}

		@Override
		public boolean isPresent() {
			return theGenerations[theSlot] == theGeneration;
		}

		@Override
		public int hashCode() {
			return theSlot * 31 + theGeneration;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof LinkedElementList.Id))
				return false;
			Id other = (Id) obj;
			return other.getList() == getList() && other.theSlot == theSlot && other.theGeneration == theGeneration;
		}

		@Override
		public String toString() {
			return "#" + theSlot + "." + theGeneration;
		}
	}

	private class Element implements CollectionElement<E> {
		private final Id theId;

		Element(Id id) {
			theId = id;
		}

		@Override
		public ElementId getElementId() {
			return theId;
		}

		@Override
		public E get() {
			return LinkedElementList.this.get(theId);
		}

		@Override
		public int hashCode() {
			return theId.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof CollectionElement && theId.equals(((CollectionElement<?>) obj).getElementId());
		}

		@Override
		public String toString() {
			return String.valueOf(theId.isPresent() ? theValues[theId.theSlot] : "(removed)");
		}
	}

	private class Itr implements Iterator<E> {
		private int theCursor;
		private long theExpectedStamp;

		Itr() {
			theCursor = theHead;
			theExpectedStamp = theStamp;
		}

		@Override
		public boolean hasNext() {
			return theCursor != NIL;
		}

		@Override
		public E next() {
			if (theExpectedStamp != theStamp)
				throw new ConcurrentModificationException();
			if (theCursor == NIL)
				throw new NoSuchElementException();
			E value = (E) theValues[theCursor];
			theCursor = theNext[theCursor];
			return value;
		}
	}
}
