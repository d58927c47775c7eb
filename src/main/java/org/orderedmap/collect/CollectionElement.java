package org.orderedmap.collect;

/**
 * Represents an element in a {@link LinkedElementList} occupied by a (potentially null) value. The element's {@link #hashCode()} and
 * {@link #equals(Object)} methods are for the element's position in the list, not the value.
 *
 * @param <E> The type of value in the element
 */
public interface CollectionElement<E> {
	/** @return The ID of this element */
	ElementId getElementId();

	/** @return The current value of this element */
	E get();

	/**
	 * @param <E> The type of the element
	 * @param element The element to get the value of
	 * @return The element's {@link #get() value}, or null if the element is null
	 */
	static <E> E get(CollectionElement<E> element) {
		return element == null ? null : element.get();
	}
}
