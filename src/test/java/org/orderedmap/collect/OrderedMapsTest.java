package org.orderedmap.collect;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.orderedmap.OrderedMapTestUtils.mapOf;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;
import org.orderedmap.Equalizer;
import org.orderedmap.StringDiff;

/** Tests the equality and diagnostic utilities in {@link OrderedMaps} */
public class OrderedMapsTest {
	/** Tests that equality considers order */
	@Test
	@SuppressWarnings("static-method")
	public void testOrderSensitive() {
		OrderedMap<String, Integer> a = mapOf("a", 1, "b", 2);
		OrderedMap<String, Integer> b = mapOf("b", 2, "a", 1);
		assertFalse(OrderedMaps.equal(a, b));
		assertNotEquals(a, b);
		assertEquals(a.toMap(), b.toMap()); // Same content as plain maps

		b.moveToBack("b");
		assertTrue(OrderedMaps.equal(a, b));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}

	/** Tests equality of maps with the same order reached by different histories */
	@Test
	@SuppressWarnings("static-method")
	public void testSameOrderDifferentHistory() {
		OrderedMap<Integer, String> a = OrderedMap.create();
		OrderedMap<Integer, String> b = OrderedMap.create();
		for (int i = 0; i < 100; i++)
			a.set(i, "v" + i);
		for (int i = 99; i >= 0; i--)
			b.set(i, "v" + i);
		for (int i = 0; i < 100; i++)
			b.moveToBack(i);
		assertTrue(OrderedMaps.equal(a, b));
		assertEquals(a.hashCode(), b.hashCode());

		b.set(50, "other");
		assertFalse(OrderedMaps.equal(a, b));
	}

	/** Tests null and size handling */
	@Test
	@SuppressWarnings("static-method")
	public void testNullsAndSizes() {
		OrderedMap<String, Integer> a = mapOf("a", 1);
		assertTrue(OrderedMaps.equal(null, null));
		assertFalse(OrderedMaps.equal(a, null));
		assertFalse(OrderedMaps.equal(null, a));
		assertTrue(OrderedMaps.equal(a, a));
		assertFalse(OrderedMaps.equal(a, mapOf("a", 1, "b", 2)));
		assertFalse(OrderedMaps.equal(a, mapOf("b", 1)));
		assertTrue(OrderedMaps.equal(OrderedMap.create(), OrderedMap.create()));
		assertFalse(a.equals("a=1"));
	}

	/** Tests that values compare by content by default, and by the configured equalizer otherwise */
	@Test
	@SuppressWarnings("static-method")
	public void testValueEquality() {
		OrderedMap<String, int[]> a = OrderedMap.build(String.class, int[].class).build().set("k", new int[] { 1, 2 });
		OrderedMap<String, int[]> b = OrderedMap.build(String.class, int[].class).build().set("k", new int[] { 1, 2 });
		assertTrue(OrderedMaps.equal(a, b));
		assertEquals(a.hashCode(), b.hashCode());

		Map<String, Object> nested1 = new HashMap<>();
		nested1.put("x", Arrays.asList(1, 2));
		Map<String, Object> nested2 = new HashMap<>();
		nested2.put("x", Arrays.asList(1, 2));
		assertTrue(OrderedMaps.equal(mapOf("n", nested1), mapOf("n", nested2)));

		OrderedMap<String, int[]> identity = OrderedMap.build(String.class, int[].class).withValueEqualizer(Equalizer.id).build()
			.set("k", a.get("k"));
		assertTrue(OrderedMaps.equal(identity, a));
		assertFalse(OrderedMaps.equal(identity, b));
		assertEquals(Equalizer.id, identity.getValueEqualizer());

		OrderedMap<String, int[]> shallow = OrderedMap.build(String.class, int[].class).withValueEqualizer(Equalizer.object).build()
			.set("k", new int[] { 1, 2 });
		assertFalse("Arrays are not equal by Object.equals", OrderedMaps.equal(shallow, a));
		assertTrue("The first map's equalizer is used", OrderedMaps.equal(a, shallow));
	}

	/** Tests that {@link OrderedMap#equals(Object)} is symmetric and consistent with hashCode when the maps' equalizers differ */
	@Test
	@SuppressWarnings("static-method")
	public void testEqualsWithDifferentEqualizers() {
		OrderedMap<String, int[]> deep = OrderedMap.build(String.class, int[].class).withValueEqualizer(Equalizer.deep).build()
			.set("k", new int[] { 1, 2 });
		OrderedMap<String, int[]> shallow = OrderedMap.build(String.class, int[].class).withValueEqualizer(Equalizer.object).build()
			.set("k", new int[] { 1, 2 });
		assertFalse(deep.equals(shallow));
		assertFalse(shallow.equals(deep));

		int[] shared = { 3 };
		OrderedMap<String, int[]> deepShared = OrderedMap.build(String.class, int[].class).build().set("k", shared);
		OrderedMap<String, int[]> shallowShared = OrderedMap.build(String.class, int[].class).withValueEqualizer(Equalizer.object).build()
			.set("k", shared);
		assertTrue("Static comparison still applies the first map's equalizer", OrderedMaps.equal(deepShared, shallowShared));
		assertFalse(deepShared.equals(shallowShared));
		assertFalse(shallowShared.equals(deepShared));

		OrderedMap<String, int[]> deep2 = OrderedMap.build(String.class, int[].class).build().set("k", new int[] { 1, 2 });
		assertEquals(deep, deep2);
		assertEquals(deep2, deep);
		assertEquals(deep.hashCode(), deep2.hashCode());

		Set<OrderedMap<String, int[]>> set = new HashSet<>();
		set.add(deep);
		assertTrue(set.contains(deep2));
		assertFalse(set.contains(shallow));
	}

	/** Tests that maps holding other ordered maps compare by content */
	@Test
	@SuppressWarnings("static-method")
	public void testNestedOrderedMaps() {
		OrderedMap<String, OrderedMap<String, Integer>> a = OrderedMap.create();
		OrderedMap<String, OrderedMap<String, Integer>> b = OrderedMap.create();
		a.set("inner", mapOf("x", 1, "y", 2));
		b.set("inner", mapOf("x", 1, "y", 2));
		assertEquals(a, b);
		b.get("inner").moveToFront("y");
		assertNotEquals(a, b);
	}

	/** Tests the difference report */
	@Test
	@SuppressWarnings("static-method")
	public void testDescribeDifference() {
		OrderedMap<String, Integer> expected = mapOf("a", 1, "b", 2);
		OrderedMap<String, Integer> actual = mapOf("a", 1, "b", 3);
		assertNull(OrderedMaps.describeDifference(expected, expected.copy()));

		String plain = OrderedMaps.describeDifference(expected, actual, false);
		assertThat(plain, containsString("Ordered maps differ"));
		assertThat(plain, containsString(".set(\"b\", [-2-]{+3+})"));

		String color = OrderedMaps.describeDifference(expected, actual);
		assertThat(color, containsString(StringDiff.DELETE_COLOR + "2" + StringDiff.RESET_COLOR));
		assertThat(color, containsString(StringDiff.INSERT_COLOR + "3" + StringDiff.RESET_COLOR));

		assertThat(OrderedMaps.describeDifference(expected, null, false), containsString("Ordered maps differ"));
	}

	/** Tests the report for maps that print the same but are not equal */
	@Test
	@SuppressWarnings("static-method")
	public void testIndistinctRendering() {
		OrderedMap<String, Object> a = mapOf("k", new Object() {
			@Override
			public String toString() {
				return "same";
			}
		});
		OrderedMap<String, Object> b = mapOf("k", new Object() {
			@Override
			public String toString() {
				return "same";
			}
		});
		assertThat(OrderedMaps.describeDifference(a, b), containsString("not shown by their printed form"));
	}

	/** Tests the assertion helper */
	@Test
	@SuppressWarnings("static-method")
	public void testAssertEqual() {
		OrderedMaps.assertEqual(mapOf("a", 1), mapOf("a", 1));
		try {
			OrderedMaps.assertEqual(mapOf("a", 1, "b", 2), mapOf("b", 2, "a", 1));
		} catch (AssertionError e) {
			assertThat(e.getMessage(), containsString("expected -> actual"));
			return;
		}
		fail("Maps in different orders should not be equal");
	}
}
