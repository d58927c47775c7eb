package org.orderedmap;

import java.util.Arrays;
import java.util.Objects;

/** A simple binary predicate testing the equivalence of two objects in some context */
public interface Equalizer {
	/**
	 * @param o1 The first object to test
	 * @param o2 The second object to test
	 * @return Whether the two objects are equivalent in this context
	 */
	boolean equals(Object o1, Object o2);

	/**
	 * @param value The value to hash
	 * @return A hash code for the value that is consistent with this equalizer's {@link #equals(Object, Object) equals} method
	 */
	int hash(Object value);

	/** An equalizer that uses {@link Object#equals(Object)} (allowing for nulls) */
	public static final Equalizer object = new Equalizer() {
		@Override
		public boolean equals(Object o1, Object o2) {
			return Objects.equals(o1, o2);
		}

		@Override
		public int hash(Object value) {
			return Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return "object";
		}
	};

	/** An equalizer that uses {@link Objects#deepEquals(Object, Object)}, so arrays (including nested arrays) compare by content */
	public static final Equalizer deep = new Equalizer() {
		@Override
		public boolean equals(Object o1, Object o2) {
			return Objects.deepEquals(o1, o2);
		}

		@Override
		public int hash(Object value) {
			return Arrays.deepHashCode(new Object[] { value });
		}

		@Override
		public String toString() {
			return "deep";
		}
	};

	/** An equalizer that uses == */
	public static final Equalizer id = new Equalizer() {
		@Override
		public boolean equals(Object o1, Object o2) {
			return o1 == o2;
		}

		@Override
		public int hash(Object value) {
			return System.identityHashCode(value);
		}

		@Override
		public String toString() {
			return "identity";
		}
	};
}
