package org.metricshub.aiawk.jrt;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import org.junit.Test;

public class RecordReaderTest {

	@Test
	public void testNewlineSeparatedRecords() throws IOException {
		try (RecordReader reader = new RecordReader(new StringReader("a\n\nb\n"))) {
			assertEquals("a", reader.readRecord("\n"));
			assertEquals("", reader.readRecord("\n"));
			assertEquals("b", reader.readRecord("\n"));
			assertNull(reader.readRecord("\n"));
		}
	}

	@Test
	public void testLastRecordWithoutTerminator() throws IOException {
		try (RecordReader reader = new RecordReader(new StringReader("a\nb"))) {
			assertEquals("a", reader.readRecord("\n"));
			assertEquals("b", reader.readRecord("\n"));
			assertNull(reader.readRecord("\n"));
		}
	}

	@Test
	public void testOnlyFirstCharacterOfRSCounts() throws IOException {
		try (RecordReader reader = new RecordReader(new StringReader("a;b:c;"))) {
			assertEquals("a", reader.readRecord(";:"));
			assertEquals("b:c", reader.readRecord(";:"));
			assertNull(reader.readRecord(";:"));
		}
	}

	@Test
	public void testParagraphMode() throws IOException {
		try (RecordReader reader = new RecordReader(new StringReader("\n\np1 l1\np1 l2\n\n\n\np2\n"))) {
			assertEquals("p1 l1\np1 l2", reader.readRecord(""));
			assertEquals("p2", reader.readRecord(""));
			assertNull(reader.readRecord(""));
		}
	}

	@Test
	public void testSeparatorChangeBetweenRecords() throws IOException {
		try (RecordReader reader = new RecordReader(new StringReader("a,b\nc,d"))) {
			assertEquals("a", reader.readRecord(","));
			assertEquals("b\nc", reader.readRecord(","));
			assertEquals("d", reader.readRecord("\n"));
		}
	}

	@Test
	public void testEmptyInput() throws IOException {
		try (RecordReader reader = new RecordReader(new StringReader(""))) {
			assertNull(reader.readRecord("\n"));
			assertNull(reader.readRecord(""));
		}
	}
}
