package org.metricshub.aiawk.jrt;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;

public class AssocArrayTest {

	@Test
	public void testInsertionOrder() {
		AssocArray array = new AssocArray();
		array.put("b", AwkValue.of(1));
		array.put("a", AwkValue.of(2));
		array.put("10", AwkValue.of(3));
		array.put("b", AwkValue.of(4));
		assertEquals(Arrays.asList("b", "a", "10"), array.keySet());
		assertEquals(4, array.get("b").toNumber(), 0);
	}

	@Test
	public void testSortedKeys() {
		AssocArray array = new AssocArray(true);
		for (String key : new String[] { "10", "b", "9", "a", "2" }) {
			array.put(key, AwkValue.ONE);
		}
		assertEquals(Arrays.asList("2", "9", "10", "a", "b"), array.keySet());
	}

	@Test
	public void testReferenceCreatesElement() {
		AssocArray array = new AssocArray();
		assertFalse(array.isIn("x"));
		assertEquals(0, array.size());
		assertTrue(array.get("x").isUninitialized());
		assertTrue(array.isIn("x"));
		assertEquals(1, array.size());
	}

	@Test
	public void testRemove() {
		AssocArray array = new AssocArray();
		array.put("1", AwkValue.of("one"));
		array.put("2", AwkValue.of("two"));
		array.remove("1");
		array.remove("3");
		assertFalse(array.isIn("1"));
		assertTrue(array.isIn("2"));
		array.clear();
		assertEquals(0, array.size());
	}

	@Test
	public void testKeySetIsASnapshot() {
		AssocArray array = new AssocArray();
		array.put("a", AwkValue.ONE);
		array.put("b", AwkValue.ONE);
		for (String key : array.keySet()) {
			array.remove(key);
			array.put(key + key, AwkValue.ONE);
		}
		assertEquals(Arrays.asList("aa", "bb"), array.keySet());
	}

	@Test
	public void testArrayIsNotAScalar() {
		AssocArray array = new AssocArray();
		assertThrows(AwkTypeException.class, () -> array.toString());
	}
}
