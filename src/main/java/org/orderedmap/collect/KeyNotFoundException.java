package org.orderedmap.collect;

/** Thrown when an operation on an {@link OrderedMap} requires a key, either as its subject or as a position reference, that is not present */
public class KeyNotFoundException extends RejectedOperationException {
	/** @param key The key that was not found */
	public KeyNotFoundException(Object key) {
		super("key not found: " + key, key);
	}
}
