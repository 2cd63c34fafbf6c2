package org.metricshub.aiawk.jrt;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.aiawk.util.AwkSettings;

public class AwkSessionTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static long openHandlesUnder(Path directory) {
		File[] descriptors = new File("/proc/self/fd").listFiles();
		Assume.assumeNotNull((Object) descriptors);
		long count = 0;
		for (File descriptor : descriptors) {
			try {
				if (Files.readSymbolicLink(descriptor.toPath()).startsWith(directory)) {
					count++;
				}
			} catch (IOException e) {
				// the descriptor was closed while listing
			}
		}
		return count;
	}

	private List<String> createFiles(int count) throws IOException {
		List<String> names = new ArrayList<String>();
		for (int i = 0; i < count; i++) {
			File file = folder.newFile("input" + i + ".txt");
			Files.write(file.toPath(), ("line " + i + "\n").getBytes(StandardCharsets.UTF_8));
			names.add(file.getAbsolutePath());
		}
		return names;
	}

	@Test
	public void testInputFilesClosedAtEndOfFile() throws Exception {
		Assume.assumeTrue(new File("/proc/self/fd").isDirectory());
		Path root = folder.getRoot().toPath().toRealPath();
		AwkSettings settings = new AwkSettings();
		for (String name : createFiles(20)) {
			settings.addNameValueOrFileName(name);
		}
		AwkSession session = new AwkSession(settings);
		int records = 0;
		while (session.nextMainRecord() != null) {
			records++;
		}
		assertEquals(20, records);
		assertEquals(0, openHandlesUnder(root));
	}

	@Test
	public void testFinishClosesPartiallyReadFile() throws Exception {
		Assume.assumeTrue(new File("/proc/self/fd").isDirectory());
		Path root = folder.getRoot().toPath().toRealPath();
		File file = folder.newFile("two-lines.txt");
		Files.write(file.toPath(), "a\nb\n".getBytes(StandardCharsets.UTF_8));
		AwkSettings settings = new AwkSettings();
		settings.addNameValueOrFileName(file.getAbsolutePath());
		AwkSession session = new AwkSession(settings);
		assertEquals("a", session.nextMainRecord());
		assertEquals(1, openHandlesUnder(root));
		session.finish();
		assertEquals(0, openHandlesUnder(root));
	}

	@Test
	public void testStandardInputLeftOpen() throws Exception {
		final boolean[] closed = new boolean[1];
		AwkSettings settings = new AwkSettings();
		settings.setInput(new ByteArrayInputStream("x\ny\n".getBytes(StandardCharsets.UTF_8)) {
			@Override
			public void close() throws IOException {
				closed[0] = true;
				super.close();
			}
		});
		AwkSession session = new AwkSession(settings);
		assertEquals("x", session.nextMainRecord());
		assertEquals("y", session.nextMainRecord());
		assertNull(session.nextMainRecord());
		session.finish();
		assertFalse(closed[0]);
	}

	@Test
	public void testRecordCountersAcrossFiles() throws Exception {
		AwkSettings settings = new AwkSettings();
		for (String name : createFiles(3)) {
			settings.addNameValueOrFileName(name);
		}
		AwkSession session = new AwkSession(settings);
		while (session.nextMainRecord() != null) {
			assertEquals(1, session.getVariable("FNR").toNumber(), 0);
		}
		assertEquals(3, session.getVariable("NR").toNumber(), 0);
	}
}
