package org.orderedmap.collect;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import org.orderedmap.StringDiff;

/** Comparison and diagnostic utilities for {@link OrderedMap}s */
public class OrderedMaps {
	private OrderedMaps() {}

	/**
	 * <p>
	 * Tests two maps for equality of content and order. Maps are equal if both are null, or if both have the same number of entries and
	 * each pair of entries at the same position has {@link Object#equals(Object) equal} keys and equivalent values. Values are compared with
	 * the {@link OrderedMap#getValueEqualizer() value equalizer} of the first map only, so when the maps' equalizers differ the result may
	 * depend on the order of the arguments. {@link OrderedMap#equals(Object)} is symmetric because it also requires the same equalizer.
	 * </p>
	 * <p>
	 * The maps are not locked. Callers sharing the maps between threads must prevent modification while this runs.
	 * </p>
	 *
	 * @param x The first map to compare
	 * @param y The second map to compare
	 * @return Whether the two maps have the same content in the same order
	 */
	public static boolean equal(OrderedMap<?, ?> x, OrderedMap<?, ?> y) {
		if (x == y)
			return true;
		else if (x == null || y == null)
			return false;
		else if (x.size() != y.size())
			return false;
		Iterator<? extends Map.Entry<?, ?>> xIter = x.iterator();
		Iterator<? extends Map.Entry<?, ?>> yIter = y.iterator();
		while (xIter.hasNext() && yIter.hasNext()) {
			Map.Entry<?, ?> xEntry = xIter.next();
			Map.Entry<?, ?> yEntry = yIter.next();
			if (!Objects.equals(xEntry.getKey(), yEntry.getKey()))
				return false;
			if (!x.getValueEqualizer().equals(xEntry.getValue(), yEntry.getValue()))
				return false;
		}
		return xIter.hasNext() == yIter.hasNext();
	}

	/**
	 * @param expected The expected map
	 * @param actual The actual map
	 * @return Null if the maps are {@link #equal(OrderedMap, OrderedMap) equal}, or a report of the difference between their
	 *         {@link OrderedMap#toLiteral() literal} forms, highlighted with ANSI colors as in {@link StringDiff#diff(CharSequence, CharSequence)}
	 */
	public static String describeDifference(OrderedMap<?, ?> expected, OrderedMap<?, ?> actual) {
		return describeDifference(expected, actual, true);
	}

	/**
	 * @param expected The expected map
	 * @param actual The actual map
	 * @param color Whether to highlight the difference with ANSI colors, or with the text markers of
	 *        {@link StringDiff#plain(CharSequence, CharSequence)}
	 * @return Null if the maps are {@link #equal(OrderedMap, OrderedMap) equal}, or a report of the difference between their
	 *         {@link OrderedMap#toLiteral() literal} forms
	 */
	public static String describeDifference(OrderedMap<?, ?> expected, OrderedMap<?, ?> actual, boolean color) {
		if (equal(expected, actual))
			return null;
		String expectedText = literal(expected);
		String actualText = literal(actual);
		String diff = color ? StringDiff.diff(expectedText, actualText) : StringDiff.plain(expectedText, actualText);
		StringBuilder report = new StringBuilder("Ordered maps differ");
		if (diff == null) {
			// Same rendering but unequal, e.g. values whose toString() is not distinct
			report.append(" in content not shown by their printed form:\n").append(actualText);
		} else
			report.append(" (expected -> actual):\n").append(diff);
		return report.toString();
	}

	/**
	 * @param expected The expected map
	 * @param actual The actual map
	 * @throws AssertionError If the maps are not {@link #equal(OrderedMap, OrderedMap) equal}, with a message
	 *         {@link #describeDifference(OrderedMap, OrderedMap, boolean) describing} the difference
	 */
	public static void assertEqual(OrderedMap<?, ?> expected, OrderedMap<?, ?> actual) throws AssertionError {
		String difference = describeDifference(expected, actual, false);
		if (difference != null)
			throw new AssertionError(difference);
	}

	private static String literal(OrderedMap<?, ?> map) {
		return map == null ? "null" : map.toLiteral();
	}
}
