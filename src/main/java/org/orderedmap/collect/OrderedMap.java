package org.orderedmap.collect;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;

import org.apache.log4j.Logger;
import org.orderedmap.Equalizer;
import org.orderedmap.SimpleMapEntry;
import org.orderedmap.StringUtils;

import com.google.common.reflect.TypeToken;

/**
 * <p>
 * A map that keeps its entries in a sequence that callers control. New keys are appended to the end of the sequence, and entries can then be
 * moved to either end or next to any other entry, always addressed by key. Setting the value of an existing key does not change its
 * position. This map keeps order; it does not sort.
 * </p>
 *
 * <p>
 * Lookups by key use a hash index and take constant time. Every positional operation also takes constant time, as each entry holds the
 * {@link ElementId} of its slot in a {@link LinkedElementList}. That ID never leaves the map.
 * </p>
 *
 * <p>
 * Operations that cannot be performed because of the keys involved throw a {@link RejectedOperationException} and leave the map exactly as
 * it was. Operations that merely look for a key report its absence with a null return.
 * </p>
 *
 * <p>
 * Equality is order-sensitive: two maps are {@link #equals(Object) equal} only if they hold equal key/value pairs in the same order and
 * share a {@link #getValueEqualizer() value equalizer}. For this reason, this class does not implement {@link Map}, whose equality
 * contract ignores order. Use {@link #toMap()} for a {@link Map} view of the content.
 * </p>
 *
 * <p>
 * This class is not thread-safe. Callers sharing an instance between threads must serialize access to it. Iterators fail fast with a
 * {@link ConcurrentModificationException} if the map's structure changes other than through the iterator itself.
 * </p>
 *
 * @param <K> The type of keys in the map
 * @param <V> The type of values in the map
 */
public class OrderedMap<K, V> implements Iterable<Map.Entry<K, V>> {
	private static final Logger log = Logger.getLogger(OrderedMap.class);

	/** The initial capacity of maps built without one specified */
	public static final int DEFAULT_INIT_CAPACITY = 16;

	/**
	 * Builds an {@link OrderedMap}
	 *
	 * @param <K> The type of keys for the map
	 * @param <V> The type of values for the map
	 */
	public static class Builder<K, V> {
		private final TypeToken<K> theKeyType;
		private final TypeToken<V> theValueType;
		private int theInitCapacity;
		private Equalizer theValueEqualizer;

		Builder(TypeToken<K> keyType, TypeToken<V> valueType) {
			theKeyType = keyType;
			theValueType = valueType;
			theInitCapacity = DEFAULT_INIT_CAPACITY;
			theValueEqualizer = Equalizer.deep;
		}

		/**
		 * @param initCap The number of entries the map should be able to hold before growing its storage
		 * @return This builder
		 */
		public Builder<K, V> withInitCapacity(int initCap) {
			if (initCap < 0)
				throw new IllegalArgumentException(initCap + "<0");
			theInitCapacity = initCap;
			return this;
		}

		/**
		 * @param valueEqualizer The equalizer the map will use to compare values when testing equality with another map. By default this is
		 *        {@link Equalizer#deep}.
		 * @return This builder
		 */
		public Builder<K, V> withValueEqualizer(Equalizer valueEqualizer) {
			if (valueEqualizer == null)
				throw new NullPointerException("Value equalizer may not be null");
			theValueEqualizer = valueEqualizer;
			return this;
		}

		/** @return A new, empty map */
		public OrderedMap<K, V> build() {
			return new OrderedMap<>(theKeyType, theValueType, theInitCapacity, theValueEqualizer);
		}

		/**
		 * @param values The initial key-value pairs to insert into the map
		 * @return A new map with the given content, in the iteration order of the given map
		 */
		public OrderedMap<K, V> build(Map<? extends K, ? extends V> values) {
			OrderedMap<K, V> map = new OrderedMap<>(theKeyType, theValueType, Math.max(theInitCapacity, values.size()),
				theValueEqualizer);
			for (Map.Entry<? extends K, ? extends V> entry : values.entrySet())
				map.set(entry.getKey(), entry.getValue());
			return map;
		}
	}

	/**
	 * @param <K> The type of keys for the map
	 * @param <V> The type of values for the map
	 * @param keyType The type of keys for the map
	 * @param valueType The type of values for the map
	 * @return A builder for a map of the given types
	 */
	public static <K, V> Builder<K, V> build(Class<K> keyType, Class<V> valueType) {
		if (keyType == null || valueType == null)
			throw new NullPointerException("Key and value types are required");
		return build(TypeToken.of(keyType), TypeToken.of(valueType));
	}

	/**
	 * @param <K> The type of keys for the map
	 * @param <V> The type of values for the map
	 * @param keyType The type of keys for the map
	 * @param valueType The type of values for the map
	 * @return A builder for a map of the given types
	 */
	public static <K, V> Builder<K, V> build(TypeToken<K> keyType, TypeToken<V> valueType) {
		if (keyType == null || valueType == null)
			throw new NullPointerException("Key and value types are required");
		return new Builder<>(keyType, valueType);
	}

	/**
	 * @param <K> The type of keys for the map
	 * @param <V> The type of values for the map
	 * @return A new, empty map whose key and value types are not checked
	 */
	@SuppressWarnings("unchecked")
	public static <K, V> OrderedMap<K, V> create() {
		return new OrderedMap<>((TypeToken<K>) TypeToken.of(Object.class), (TypeToken<V>) TypeToken.of(Object.class),
			DEFAULT_INIT_CAPACITY, Equalizer.deep);
	}

	/**
	 * @param <K> The type of keys for the map
	 * @param <V> The type of values for the map
	 * @param values The content for the new map
	 * @return A new map, whose key and value types are not checked, with the given content in the iteration order of the given map
	 */
	public static <K, V> OrderedMap<K, V> of(Map<? extends K, ? extends V> values) {
		OrderedMap<K, V> map = create();
		for (Map.Entry<? extends K, ? extends V> entry : values.entrySet())
			map.set(entry.getKey(), entry.getValue());
		return map;
	}

	private final TypeToken<K> theKeyType;
	private final TypeToken<V> theValueType;
	private final Class<?> theKeyClass;
	private final Class<?> theValueClass;
	private final Equalizer theValueEqualizer;
	private final HashMap<K, Entry> theIndex;
	private final LinkedElementList<Entry> theOrder;

	private OrderedMap(TypeToken<K> keyType, TypeToken<V> valueType, int initCapacity, Equalizer valueEqualizer) {
		theKeyType = keyType;
		theValueType = valueType;
		theKeyClass = keyType.wrap().getRawType();
		theValueClass = valueType.wrap().getRawType();
		theValueEqualizer = valueEqualizer;
		// Sized so the index does not rehash before holding initCapacity entries at the default load factor
		theIndex = new HashMap<>(Math.max((int) (initCapacity / 0.75f) + 1, 16));
		theOrder = LinkedElementList.build().withInitCapacity(initCapacity).build();
	}

	/** @return The type of keys in this map */
	public TypeToken<K> getKeyType() {
		return theKeyType;
	}

	/** @return The type of values in this map */
	public TypeToken<V> getValueType() {
		return theValueType;
	}

	/** @return The equalizer this map uses to compare values with those of another map */
	public Equalizer getValueEqualizer() {
		return theValueEqualizer;
	}

	/** @return The number of entries in this map */
	public int size() {
		return theIndex.size();
	}

	/** @return Whether this map has no entries */
	public boolean isEmpty() {
		return theIndex.isEmpty();
	}

	/**
	 * @param key The key to check
	 * @return Whether this map has an entry for the given key
	 */
	public boolean containsKey(K key) {
		return theIndex.containsKey(key);
	}

	/**
	 * Sets the value for a key. If the key is not present, a new entry is added at the end of this map. Otherwise the value of the existing
	 * entry is replaced and its position is unchanged.
	 *
	 * @param key The key to set the value for
	 * @param value The value for the key
	 * @return This map
	 */
	public OrderedMap<K, V> set(K key, V value) {
		Entry existing = theIndex.get(key);
		if (existing != null)
			existing.theValue = checkValue(value);
		else
			addEntry(key, value);
		return this;
	}

	/**
	 * @param key The key to get the value for
	 * @return The value stored for the key, or null if the key is not present (or if its value is null)
	 * @see #getEntry(Object)
	 */
	public V get(K key) {
		Entry entry = theIndex.get(key);
		return entry == null ? null : entry.theValue;
	}

	/**
	 * @param key The key to get the entry for
	 * @return An immutable copy of the key and its current value, or null if the key is not present
	 */
	public Map.Entry<K, V> getEntry(K key) {
		return SimpleMapEntry.snapshot(theIndex.get(key));
	}

	/**
	 * @param key The key to get the value for
	 * @param defaultValue The value to return if the key is not present
	 * @return The value stored for the key, or the given default if the key is not present
	 */
	public V getOrDefault(K key, V defaultValue) {
		Entry entry = theIndex.get(key);
		return entry == null ? defaultValue : entry.theValue;
	}

	/**
	 * Removes a key and its value from this map
	 *
	 * @param key The key to remove
	 * @return An immutable copy of the removed key and value, or null if the key was not present, in which case this map is unchanged
	 */
	public Map.Entry<K, V> remove(K key) {
		Entry entry = theIndex.get(key);
		if (entry == null)
			return null;
		removeEntry(entry);
		return new SimpleMapEntry<>(entry.theKey, entry.theValue);
	}

	/**
	 * Removes all entries from this map
	 *
	 * @return This map
	 */
	public OrderedMap<K, V> clear() {
		if (log.isDebugEnabled())
			log.debug("Clearing " + theIndex.size() + " entries");
		theIndex.clear();
		theOrder.clear();
		return this;
	}

	/**
	 * @return The first entry in this map, or null if this map is empty. The entry is live: it reflects later changes to its value, and
	 *         {@link Map.Entry#setValue(Object) setting} its value sets the value in this map.
	 */
	public Map.Entry<K, V> getFirst() {
		return CollectionElement.get(theOrder.getTerminalElement(true));
	}

	/**
	 * @return The last entry in this map, or null if this map is empty. The entry is live: it reflects later changes to its value, and
	 *         {@link Map.Entry#setValue(Object) setting} its value sets the value in this map.
	 */
	public Map.Entry<K, V> getLast() {
		return CollectionElement.get(theOrder.getTerminalElement(false));
	}

	/** @return A new list containing this map's keys in order. The list is not affected by later changes to this map. */
	public List<K> keys() {
		List<K> keys = new ArrayList<>(theIndex.size());
		for (Entry entry : theOrder)
			keys.add(entry.theKey);
		return keys;
	}

	/** @return A new list containing this map's values in order. The list is not affected by later changes to this map. */
	public List<V> values() {
		List<V> values = new ArrayList<>(theIndex.size());
		for (Entry entry : theOrder)
			values.add(entry.theValue);
		return values;
	}

	/**
	 * @param action The action to perform on each key and value in this map, in order
	 */
	public void forEach(BiConsumer<? super K, ? super V> action) {
		for (Entry entry : theOrder)
			action.accept(entry.theKey, entry.theValue);
	}

	/**
	 * Creates an iterator over this map's entries, starting at the first. The entries returned are live (see {@link #getFirst()}).
	 * Structural changes to this map (adding, removing or moving entries) while the iterator is in use, other than with the iterator's
	 * {@link Iterator#remove() remove} method, cause the iterator to throw {@link ConcurrentModificationException} when next advanced.
	 */
	@Override
	public EntryIterator iterator() {
		return new EntryIterator();
	}

	/**
	 * Moves an entry to the beginning of this map. Moving the first entry to the front does nothing.
	 *
	 * @param key The key of the entry to move
	 * @throws KeyNotFoundException If the key is not present
	 */
	public void moveToFront(K key) throws KeyNotFoundException {
		Entry entry = theIndex.get(key);
		if (entry == null)
			throw keyNotFound("moveToFront", key);
		theOrder.moveToFront(entry.theId);
	}

	/**
	 * Moves an entry to the end of this map. Moving the last entry to the back does nothing.
	 *
	 * @param key The key of the entry to move
	 * @throws KeyNotFoundException If the key is not present
	 */
	public void moveToBack(K key) throws KeyNotFoundException {
		Entry entry = theIndex.get(key);
		if (entry == null)
			throw keyNotFound("moveToBack", key);
		theOrder.moveToBack(entry.theId);
	}

	/**
	 * Moves an entry to be immediately after another. Moving an entry after itself does nothing.
	 *
	 * @param key The key of the entry to move
	 * @param after The key of the entry to move the entry after
	 * @throws KeyNotFoundException If either key is not present. If neither is, the exception reports <code>key</code>.
	 */
	public void moveAfter(K key, K after) throws KeyNotFoundException {
		Entry entry = theIndex.get(key);
		if (entry == null)
			throw keyNotFound("moveAfter", key);
		Entry mark = theIndex.get(after);
		if (mark == null)
			throw keyNotFound("moveAfter", after);
		theOrder.moveAfter(entry.theId, mark.theId);
	}

	/**
	 * Moves an entry to be immediately before another. Moving an entry before itself does nothing.
	 *
	 * @param key The key of the entry to move
	 * @param before The key of the entry to move the entry before
	 * @throws KeyNotFoundException If either key is not present. If neither is, the exception reports <code>key</code>.
	 */
	public void moveBefore(K key, K before) throws KeyNotFoundException {
		Entry entry = theIndex.get(key);
		if (entry == null)
			throw keyNotFound("moveBefore", key);
		Entry mark = theIndex.get(before);
		if (mark == null)
			throw keyNotFound("moveBefore", before);
		theOrder.moveBefore(entry.theId, mark.theId);
	}

	/**
	 * Adds a new entry immediately after an existing one. This never replaces an existing value.
	 *
	 * @param key The key for the new entry
	 * @param value The value for the new entry
	 * @param after The key of the entry to insert the new entry after
	 * @throws KeyNotFoundException If <code>after</code> is not present
	 * @throws DuplicateKeyValueException If <code>key</code> is already present (including when it is the same as <code>after</code>). The
	 *         exception reports the existing entry's key and value.
	 */
	public void insertAfter(K key, V value, K after) throws KeyNotFoundException, DuplicateKeyValueException {
		Entry mark = checkInsert("insertAfter", key, value, after);
		Entry entry = addEntry(key, value);
		theOrder.moveAfter(entry.theId, mark.theId);
	}

	/**
	 * Adds a new entry immediately before an existing one. This never replaces an existing value.
	 *
	 * @param key The key for the new entry
	 * @param value The value for the new entry
	 * @param before The key of the entry to insert the new entry before
	 * @throws KeyNotFoundException If <code>before</code> is not present
	 * @throws DuplicateKeyValueException If <code>key</code> is already present (including when it is the same as <code>before</code>). The
	 *         exception reports the existing entry's key and value.
	 */
	public void insertBefore(K key, V value, K before) throws KeyNotFoundException, DuplicateKeyValueException {
		Entry mark = checkInsert("insertBefore", key, value, before);
		Entry entry = addEntry(key, value);
		theOrder.moveBefore(entry.theId, mark.theId);
	}

	/** @return A {@link LinkedHashMap} with this map's content, iterating in this map's order */
	public Map<K, V> toMap() {
		Map<K, V> map = new LinkedHashMap<>(Math.max((int) (theIndex.size() / 0.75f) + 1, 16));
		for (Entry entry : theOrder)
			map.put(entry.theKey, entry.theValue);
		return map;
	}

	/** @return A new map with the same types, value equalizer and content (in the same order) as this map */
	public OrderedMap<K, V> copy() {
		OrderedMap<K, V> copy = new OrderedMap<>(theKeyType, theValueType, Math.max(theIndex.size(), DEFAULT_INIT_CAPACITY),
			theValueEqualizer);
		for (Entry entry : theOrder)
			copy.addEntry(entry.theKey, entry.theValue);
		return copy;
	}

	/**
	 * Checks that this map's index and order agree with each other
	 *
	 * @throws IllegalStateException If the structure of this map is corrupt
	 */
	public void checkValid() {
		try {
			theOrder.checkValid();
			if (theOrder.size() != theIndex.size())
				throw new IllegalStateException("Index holds " + theIndex.size() + " entries, but order holds " + theOrder.size());
			for (CollectionElement<Entry> el = theOrder.getTerminalElement(true); el != null; el = theOrder
				.getAdjacentElement(el.getElementId(), true)) {
				Entry entry = el.get();
				if (!el.getElementId().equals(entry.theId))
					throw new IllegalStateException("Entry " + entry + " is at " + el.getElementId() + " but believes it is at " + entry.theId);
				if (theIndex.get(entry.theKey) != entry)
					throw new IllegalStateException("Entry " + entry + " in the order is not indexed, or is a duplicate");
			}
			for (Entry entry : theIndex.values()) {
				if (!ElementId.isPresent(entry.theId) || theOrder.get(entry.theId) != entry)
					throw new IllegalStateException("Indexed entry " + entry + " does not occupy its slot in the order");
			}
		} catch (IllegalStateException e) {
			log.error("Ordered map is corrupt", e);
			throw e;
		}
	}

	/**
	 * @param o The object to compare to
	 * @return Whether the given object is an {@link OrderedMap} with the same {@link #getValueEqualizer() value equalizer} as this map and
	 *         equal keys and values (compared using that equalizer) in the same order as this map
	 * @see OrderedMaps#equal(OrderedMap, OrderedMap)
	 */
	@Override
	public boolean equals(Object o) {
		if (o == this)
			return true;
		else if (!(o instanceof OrderedMap))
			return false;
		OrderedMap<?, ?> other = (OrderedMap<?, ?>) o;
		return theValueEqualizer.equals(other.theValueEqualizer) && OrderedMaps.equal(this, other);
	}

	/** @return An order-sensitive hash of this map's keys and values. Values are hashed with this map's value equalizer. */
	@Override
	public int hashCode() {
		int hash = 1;
		for (Entry entry : theOrder)
			hash = hash * 31 + (Objects.hashCode(entry.theKey) ^ theValueEqualizer.hash(entry.theValue));
		return hash;
	}

	/** @return This map's type and content, one <code>key=value</code> line per entry */
	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("OrderedMap[");
		str.append(typeName(theKeyType)).append(',').append(typeName(theValueType)).append(']');
		if (theOrder.isEmpty())
			return str.append("{}").toString();
		str.append("{\n");
		for (Entry entry : theOrder)
			str.append('\t').append(entry.theKey).append('=').append(entry.theValue).append(",\n");
		return str.append('}').toString();
	}

	/**
	 * @return A representation of this map as java source code that would build a map with the same content. This is useful for comparing
	 *         an expected and actual map.
	 * @see OrderedMaps#describeDifference(OrderedMap, OrderedMap)
	 */
	public String toLiteral() {
		StringBuilder str = new StringBuilder("OrderedMap.");
		if (theKeyClass == Object.class && theValueClass == Object.class)
			str.append("create()");
		else {
			str.append("build(");
			printTypeLiteral(theKeyType, str).append(", ");
			printTypeLiteral(theValueType, str).append(").build()");
		}
		for (Entry entry : theOrder) {
			str.append("\n\t.set(");
			StringUtils.printLiteral(entry.theKey, str).append(", ");
			StringUtils.printLiteral(entry.theValue, str).append(')');
		}
		return str.toString();
	}

	private static String typeName(TypeToken<?> type) {
		Type t = type.getType();
		return t instanceof Class ? ((Class<?>) t).getSimpleName() : t.getTypeName();
	}

	private static StringBuilder printTypeLiteral(TypeToken<?> type, StringBuilder str) {
		Type t = type.getType();
		if (t instanceof Class)
			return str.append(((Class<?>) t).getSimpleName()).append(".class");
		return str.append("new TypeToken<").append(t.getTypeName()).append(">() {}");
	}

	private Entry checkInsert(String operation, K key, V value, K mark) {
		Entry markEntry = theIndex.get(mark);
		if (markEntry == null)
			throw keyNotFound(operation, mark);
		// A key equal to the mark is found here too, reporting the mark's own entry
		Entry existing = theIndex.get(key);
		if (existing != null) {
			if (log.isDebugEnabled())
				log.debug(operation + " rejected: key " + key + " already exists");
			throw new DuplicateKeyValueException(existing.theKey, existing.theValue);
		}
		checkKey(key);
		checkValue(value);
		return markEntry;
	}

	private KeyNotFoundException keyNotFound(String operation, Object key) {
		if (log.isDebugEnabled())
			log.debug(operation + " rejected: key not found: " + key);
		return new KeyNotFoundException(key);
	}

	private K checkKey(K key) {
		if (key != null && !theKeyClass.isInstance(key))
			throw new ClassCastException("Key " + key + " (" + key.getClass().getName() + ") is not an instance of " + theKeyType);
		return key;
	}

	private V checkValue(V value) {
		if (value != null && !theValueClass.isInstance(value))
			throw new ClassCastException("Value " + value + " (" + value.getClass().getName() + ") is not an instance of " + theValueType);
		return value;
	}

	private Entry addEntry(K key, V value) {
		Entry entry = new Entry(checkKey(key), checkValue(value));
		entry.theId = theOrder.addLast(entry);
		theIndex.put(key, entry);
		return entry;
	}

	private void removeEntry(Entry entry) {
		theIndex.remove(entry.theKey);
		theOrder.remove(entry.theId);
	}

	/** An entry in this map. Its ID is only ever used by the map. */
	private class Entry implements Map.Entry<K, V> {
		final K theKey;
		V theValue;
		ElementId theId;

		Entry(K key, V value) {
			theKey = key;
			theValue = value;
		}

		@Override
		public K getKey() {
			return theKey;
		}

		@Override
		public V getValue() {
			return theValue;
		}

		@Override
		public V setValue(V value) {
			if (!theId.isPresent())
				throw new IllegalStateException("Entry for " + theKey + " has been removed");
			V old = theValue;
			theValue = checkValue(value);
			return old;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(theKey) ^ Objects.hashCode(theValue);
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry))
				return false;
			Map.Entry<?, ?> other = (Map.Entry<?, ?>) obj;
			return Objects.equals(theKey, other.getKey()) && Objects.equals(theValue, other.getValue());
		}

		@Override
		public String toString() {
			return theKey + "=" + theValue;
		}
	}

	/**
	 * Iterates over the entries of an {@link OrderedMap}. In addition to the {@link Iterator} methods, {@link #nextEntry()} returns null
	 * instead of throwing an exception when the iteration is finished.
	 */
	public class EntryIterator implements Iterator<Map.Entry<K, V>> {
		private CollectionElement<Entry> theNext;
		private Entry theLastReturned;
		private long theExpectedStamp;

		EntryIterator() {
			theNext = theOrder.getTerminalElement(true);
			theExpectedStamp = theOrder.getStamp();
		}

		@Override
		public boolean hasNext() {
			return theNext != null;
		}

		/** @return The next entry in the map, or null if there are no more entries */
		public Map.Entry<K, V> nextEntry() {
			checkStamp();
			if (theNext == null)
				return null;
			Entry entry = theNext.get();
			theNext = theOrder.getAdjacentElement(theNext.getElementId(), true);
			theLastReturned = entry;
			return entry;
		}

		@Override
		public Map.Entry<K, V> next() {
			Map.Entry<K, V> entry = nextEntry();
			if (entry == null)
				throw new NoSuchElementException();
			return entry;
		}

		@Override
		public void remove() {
			if (theLastReturned == null)
				throw new IllegalStateException("remove() must be called once after each call to next()");
			checkStamp();
			removeEntry(theLastReturned);
			theLastReturned = null;
			theExpectedStamp = theOrder.getStamp();
		}

		private void checkStamp() {
			if (theExpectedStamp != theOrder.getStamp())
				throw new ConcurrentModificationException("The map's structure has changed since this iterator was created");
		}
	}
}
