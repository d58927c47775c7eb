package org.orderedmap;

import java.util.Map;
import java.util.Objects;

/**
 * A simple immutable entry. Equality follows the {@link Map.Entry#equals(Object)} contract.
 *
 * @param <K> The key-type of the entry
 * @param <V> The value-type of the entry
 */
public class SimpleMapEntry<K, V> implements Map.Entry<K, V> {
	private final K theKey;
	private final V theValue;

	/**
	 * Creates an immutable entry
	 *
	 * @param key The key for the entry
	 * @param value The value for the entry
	 */
	public SimpleMapEntry(K key, V value) {
		theKey = key;
		theValue = value;
	}

	/**
	 * @param <K> The key-type of the entry
	 * @param <V> The value-type of the entry
	 * @param entry The entry to copy
	 * @return An immutable entry with the given entry's current key and value, or null if the given entry is null
	 */
	public static <K, V> SimpleMapEntry<K, V> snapshot(Map.Entry<? extends K, ? extends V> entry) {
		return entry == null ? null : new SimpleMapEntry<>(entry.getKey(), entry.getValue());
	}

	@Override
	public K getKey() {
		return theKey;
	}

	@Override
	public V getValue() {
		return theValue;
	}

	/** @throws UnsupportedOperationException Always, as this entry is immutable */
	@Override
	public V setValue(V value) throws UnsupportedOperationException {
		throw new UnsupportedOperationException("This entry is immutable");
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(theKey) ^ Objects.hashCode(theValue);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Map.Entry))
			return false;
		Map.Entry<?, ?> other = (Map.Entry<?, ?>) o;
		return Objects.equals(other.getKey(), theKey) && Objects.equals(other.getValue(), theValue);
	}

	@Override
	public String toString() {
		return new StringBuilder().append(theKey).append('=').append(theValue).toString();
	}
}
