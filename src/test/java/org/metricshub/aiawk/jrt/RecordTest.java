package org.metricshub.aiawk.jrt;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Locale;
import org.junit.Before;
import org.junit.Test;

public class RecordTest {

	private Record record;

	@Before
	public void setUp() {
		record = new Record(new RegexCache());
	}

	private String field(int index) {
		return record.getField(index).toString(AwkValue.DEFAULT_CONVFMT, Locale.US);
	}

	@Test
	public void testDefaultSplitting() {
		record.setRecord("  alpha  beta\tgamma ");
		assertEquals(3, record.getNF());
		assertEquals("alpha", field(1));
		assertEquals("gamma", field(3));
		assertEquals("  alpha  beta\tgamma ", field(0));
	}

	@Test
	public void testFieldsAreStrnums() {
		record.setRecord("10 abc");
		assertTrue(record.getField(1).isStrnum());
		assertFalse(record.getField(2).isStrnum());
	}

	@Test
	public void testReadingPastNFCreatesNothing() {
		record.setRecord("a b");
		assertTrue(record.getField(7).isUninitialized());
		assertEquals(2, record.getNF());
		assertEquals("a b", record.getText());
	}

	@Test
	public void testAssigningFieldRebuildsRecord() {
		record.setRecord("a   b c");
		record.setField(2, AwkValue.of("B"));
		assertEquals("a B c", record.getText());

		record.setOutputFieldSeparator("-");
		record.setField(5, AwkValue.of("e"));
		assertEquals("a-B-c--e", record.getText());
		assertEquals(5, record.getNF());
	}

	@Test
	public void testReassigningFieldIsIdempotent() {
		record.setRecord(" x   y  z ");
		record.setField(2, record.getField(2));
		String once = record.getText();
		record.setField(2, record.getField(2));
		assertEquals(once, record.getText());
		assertEquals("x y z", once);
	}

	@Test
	public void testAssigningRecordResplits() {
		record.setRecord("a b");
		record.setField(0, AwkValue.of("1 2 3"));
		assertEquals(3, record.getNF());
		assertEquals("3", field(3));
	}

	@Test
	public void testNumericFieldUsesConversionFormat() {
		record.setRecord("a b");
		record.setConversion("%.2f", Locale.US);
		record.setField(2, AwkValue.of(1.0 / 3));
		assertEquals("a 0.33", record.getText());
	}

	@Test
	public void testSetNF() {
		record.setRecord("a b c d");
		record.setNF(2);
		assertEquals("a b", record.getText());
		record.setNF(4);
		assertEquals("a b  ", record.getText());
		assertThrows(AwkRuntimeException.class, () -> record.setNF(-1));
	}

	@Test
	public void testNegativeField() {
		record.setRecord("a");
		assertThrows(AwkRuntimeException.class, () -> record.getField(-1));
		assertThrows(AwkRuntimeException.class, () -> record.setField(-2, AwkValue.ONE));
	}

	@Test
	public void testSeparatorAppliesToNextRecord() {
		record.setRecord("a,b");
		record.setFieldSeparator(",");
		assertEquals(1, record.getNF());
		record.setRecord("a,b");
		assertEquals(2, record.getNF());
		assertEquals(",", record.getFieldSeparator());
	}

	@Test
	public void testParagraphModeSplitsOnNewlines() {
		record.setFieldSeparator(":");
		record.setParagraphMode(true);
		record.setRecord("a:b\nc");
		assertEquals(3, record.getNF());
		assertEquals("c", field(3));
	}

	@Test
	public void testFieldSplitter() {
		RegexCache cache = new RegexCache();
		assertEquals(Arrays.asList("a", "", "b"), FieldSplitter.split("a,,b", ",", false, cache));
		assertEquals(Arrays.asList("a", "b", "c"), FieldSplitter.split("a,,b;c", "[,;]+", false, cache));
		assertEquals(Arrays.asList("a", "b", "c"), FieldSplitter.split("abc", "", false, cache));
		assertEquals(Arrays.asList("a b", "c"), FieldSplitter.split("a b\tc", "\t", false, cache));
		assertEquals(Arrays.asList("a", "b"), FieldSplitter.split("a|b", "|", false, cache));
		assertTrue(FieldSplitter.split("", ",", false, cache).isEmpty());
		assertTrue(FieldSplitter.split("   ", " ", false, cache).isEmpty());
	}

	@Test
	public void testRegexCache() {
		RegexCache cache = new RegexCache();
		assertTrue(cache.compile("^[[:digit:]]+$").matcher("123").matches());
		assertFalse(cache.compile("^[[:digit:]]+$").matcher("12a").matches());
		assertTrue(cache.compile("a{2}").matcher("aa").matches());
		assertTrue(cache.compile("[]a]").matcher("]").matches());
		assertEquals(3, cache.size());
		assertThrows(AwkRuntimeException.class, () -> cache.compile("(abc"));
	}
}
