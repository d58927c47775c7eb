package org.orderedmap.collect;

/**
 * <p>
 * Identifies an element's slot in a {@link LinkedElementList}. An ElementId stays attached to the same element for as long as the element
 * is in the list, no matter how the element is moved relative to the others.
 * </p>
 *
 * <p>
 * Once the element is removed from the list (or the list is {@link LinkedElementList#clear() cleared}), the ID is no longer
 * {@link #isPresent() present} and may not be used with the list again. IDs are never recycled: a new element occupying the same storage
 * will have an ID that is not {@link #equals(Object) equal} to the old one.
 * </p>
 *
 * @see CollectionElement#getElementId()
 */
public interface ElementId {
	/** @return Whether the element with this ID is still present in the list */
	boolean isPresent();

	/**
	 * @param id The element ID to check
	 * @return Whether the given ID is non-null and {@link #isPresent() present}
	 */
	static boolean isPresent(ElementId id) {
		return id != null && id.isPresent();
	}
}
