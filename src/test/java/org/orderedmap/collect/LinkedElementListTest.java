package org.orderedmap.collect;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import org.junit.Test;

/** Tests {@link LinkedElementList} */
public class LinkedElementListTest {
	private static <E> List<E> contents(LinkedElementList<E> list) {
		list.checkValid();
		List<E> values = new ArrayList<>();
		for (E value : list)
			values.add(value);
		return values;
	}

	/** Tests adding at either end and reading back through IDs and terminal elements */
	@Test
	@SuppressWarnings("static-method")
	public void testAdd() {
		LinkedElementList<String> list = new LinkedElementList<>();
		assertTrue(list.isEmpty());
		assertNull(list.getTerminalElement(true));
		assertNull(list.getTerminalElement(false));

		ElementId b = list.addLast("b");
		ElementId c = list.addLast("c");
		ElementId a = list.addFirst("a");
		assertEquals(asList("a", "b", "c"), contents(list));
		assertEquals(3, list.size());
		assertEquals("b", list.get(b));
		assertEquals("b", list.getElement(b).get());
		assertEquals(b, list.getElement(b).getElementId());
		assertEquals(a, list.getTerminalElement(true).getElementId());
		assertEquals(c, list.getTerminalElement(false).getElementId());
		assertEquals("c", list.getAdjacentElement(b, true).get());
		assertEquals("a", list.getAdjacentElement(b, false).get());
		assertNull(list.getAdjacentElement(a, false));
		assertNull(list.getAdjacentElement(c, true));

		assertEquals("b", list.set(b, "B"));
		assertEquals(asList("a", "B", "c"), contents(list));
	}

	/** Tests all the relocation operations, including the ones that should do nothing */
	@Test
	@SuppressWarnings("static-method")
	public void testMove() {
		LinkedElementList<Integer> list = new LinkedElementList<>();
		ElementId[] ids = new ElementId[5];
		for (int i = 0; i < ids.length; i++)
			ids[i] = list.addLast(i);

		list.moveToFront(ids[3]);
		assertEquals(asList(3, 0, 1, 2, 4), contents(list));
		list.moveToBack(ids[0]);
		assertEquals(asList(3, 1, 2, 4, 0), contents(list));
		list.moveAfter(ids[3], ids[4]);
		assertEquals(asList(1, 2, 4, 3, 0), contents(list));
		list.moveBefore(ids[0], ids[1]);
		assertEquals(asList(0, 1, 2, 4, 3), contents(list));

		long stamp = list.getStamp();
		list.moveToFront(ids[0]);
		list.moveToBack(ids[3]);
		list.moveAfter(ids[2], ids[2]);
		list.moveBefore(ids[2], ids[2]);
		list.moveAfter(ids[2], ids[1]);
		list.moveBefore(ids[1], ids[2]);
		assertEquals(asList(0, 1, 2, 4, 3), contents(list));
		assertEquals("Moves that change nothing should not change the stamp", stamp, list.getStamp());

		list.moveAfter(ids[0], ids[3]);
		assertEquals(asList(1, 2, 4, 3, 0), contents(list));
		assertNotEquals(stamp, list.getStamp());
	}

	/** Tests that removed elements' IDs are invalidated and that their storage is reused without confusing the IDs */
	@Test
	@SuppressWarnings("static-method")
	public void testRemoveAndReuse() {
		LinkedElementList<String> list = LinkedElementList.build().withInitCapacity(2).build();
		ElementId a = list.addLast("a");
		ElementId b = list.addLast("b");
		ElementId c = list.addLast("c");
		assertTrue(list.getCapacity() >= 3);

		assertEquals("b", list.remove(b));
		assertFalse(b.isPresent());
		assertTrue(a.isPresent());
		assertEquals(asList("a", "c"), contents(list));
		try {
			list.get(b);
			fail("Removed element should not be accessible");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		try {
			list.moveToFront(b);
			fail("Removed element should not be movable");
		} catch (IllegalArgumentException e) {
			// Expected
		}

		ElementId d = list.addLast("d");
		assertNotEquals(b, d);
		assertFalse(b.isPresent());
		assertTrue(d.isPresent());
		assertEquals(asList("a", "c", "d"), contents(list));

		list.remove(a);
		list.remove(d);
		list.remove(c);
		assertTrue(list.isEmpty());
		assertEquals(asList(), contents(list));
		assertNull(list.getTerminalElement(true));
	}

	/** Tests that clearing invalidates every ID */
	@Test
	@SuppressWarnings("static-method")
	public void testClear() {
		LinkedElementList<String> list = new LinkedElementList<>();
		List<ElementId> ids = new ArrayList<>();
		for (int i = 0; i < 20; i++)
			ids.add(list.addLast("v" + i));
		list.remove(ids.get(5));
		list.clear();
		assertTrue(list.isEmpty());
		assertEquals(asList(), contents(list));
		for (ElementId id : ids)
			assertFalse(id.isPresent());

		ElementId x = list.addLast("x");
		assertEquals(asList("x"), contents(list));
		for (ElementId id : ids)
			assertNotEquals(id, x);
	}

	/** Tests that IDs are only usable with the list that issued them */
	@Test
	@SuppressWarnings("static-method")
	public void testForeignId() {
		LinkedElementList<String> list1 = new LinkedElementList<>();
		LinkedElementList<String> list2 = new LinkedElementList<>();
		ElementId id1 = list1.addLast("a");
		list2.addLast("a");
		try {
			list2.remove(id1);
			fail("Another list's ID should be rejected");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		assertEquals(1, list2.size());
	}

	/** Tests the fail-fast value iterator */
	@Test(expected = ConcurrentModificationException.class)
	@SuppressWarnings("static-method")
	public void testIteratorFailsFast() {
		LinkedElementList<String> list = new LinkedElementList<>();
		list.addLast("a");
		ElementId b = list.addLast("b");
		Iterator<String> iter = list.iterator();
		assertEquals("a", iter.next());
		list.moveToFront(b);
		iter.next();
	}

	/** Tests the builder's validation of its settings */
	@Test
	@SuppressWarnings("static-method")
	public void testBuilderValidation() {
		try {
			LinkedElementList.build().withInitCapacity(-1);
			fail("Negative capacity should be rejected");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		try {
			LinkedElementList.build().withGrowthFactor(Double.NaN);
			fail("NaN growth factor should be rejected");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		LinkedElementList<Integer> list = LinkedElementList.build().withInitCapacity(0).withGrowthFactor(0).build();
		for (int i = 0; i < 10; i++)
			list.addLast(i);
		assertEquals(asList(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), contents(list));
	}

	/** Runs random operations against the list and a {@link List} model, checking the structure after each */
	@Test
	@SuppressWarnings("static-method")
	public void testRandomOperations() {
		Random random = new Random(20231017L);
		LinkedElementList<Integer> list = LinkedElementList.build().withInitCapacity(1).build();
		List<Integer> model = new ArrayList<>();
		List<ElementId> ids = new ArrayList<>(); // Parallel to model
		for (int i = 0; i < 5000; i++) {
			int op = model.isEmpty() ? 0 : random.nextInt(7);
			switch (op) {
			case 0:
				model.add(i);
				ids.add(list.addLast(i));
				break;
			case 1:
				model.add(0, i);
				ids.add(0, list.addFirst(i));
				break;
			case 2: {
				int index = random.nextInt(model.size());
				assertEquals(model.remove(index), list.remove(ids.remove(index)));
				break;
			}
			case 3: {
				int index = random.nextInt(model.size());
				model.add(0, model.remove(index));
				ElementId id = ids.remove(index);
				ids.add(0, id);
				list.moveToFront(id);
				break;
			}
			case 4: {
				int index = random.nextInt(model.size());
				model.add(model.remove(index));
				ElementId id = ids.remove(index);
				ids.add(id);
				list.moveToBack(id);
				break;
			}
			default: {
				boolean after = op == 5;
				int index = random.nextInt(model.size());
				int markIndex = random.nextInt(model.size());
				ElementId id = ids.get(index);
				ElementId mark = ids.get(markIndex);
				if (after)
					list.moveAfter(id, mark);
				else
					list.moveBefore(id, mark);
				if (index != markIndex) {
					Integer value = model.remove(index);
					ids.remove(index);
					int newMark = ids.indexOf(mark);
					int target = after ? newMark + 1 : newMark;
					model.add(target, value);
					ids.add(target, id);
				}
				break;
			}
			}
			assertEquals(model, contents(list));
		}
	}
}
