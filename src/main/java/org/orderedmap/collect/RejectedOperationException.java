package org.orderedmap.collect;

/**
 * Thrown when an {@link OrderedMap} refuses an operation because of the keys involved. The map is never modified by an operation that
 * throws this.
 */
public abstract class RejectedOperationException extends IllegalArgumentException {
	private final Object theKey;

	/**
	 * @param message The message for the exception
	 * @param key The key that caused the operation to be rejected
	 */
	protected RejectedOperationException(String message, Object key) {
		super(message);
		theKey = key;
	}

	/** @return The key that caused the operation to be rejected */
	public Object getKey() {
		return theKey;
	}
}
