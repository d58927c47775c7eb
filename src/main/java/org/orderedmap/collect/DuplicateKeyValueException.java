package org.orderedmap.collect;

/**
 * Thrown when an insert operation such as {@link OrderedMap#insertAfter(Object, Object, Object)} is asked to add a key that is already
 * present in the map. Inserts never replace an existing value; callers that intend to do so should {@link OrderedMap#set(Object, Object)
 * set} the value and then move the entry.
 */
public class DuplicateKeyValueException extends RejectedOperationException {
	private final Object theValue;

	/**
	 * @param key The key that is already present
	 * @param value The value currently stored for the key
	 */
	public DuplicateKeyValueException(Object key, Object value) {
		super("key " + key + " already exists with value " + value, key);
		theValue = value;
	}

	/** @return The value currently stored for the duplicate key */
	public Object getValue() {
		return theValue;
	}
}
