package com.acrescrypto.assetfs.fs.archivefs;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.acrescrypto.assetfs.TestUtils;
import com.acrescrypto.assetfs.exceptions.EEXISTSException;
import com.acrescrypto.assetfs.exceptions.EISDIRException;
import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.InvalidArchiveHeaderException;
import com.acrescrypto.assetfs.exceptions.InvalidArchiveVersionException;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.FSTestBase;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;
import com.acrescrypto.assetfs.fs.ramfs.RAMFS;
import com.acrescrypto.assetfs.utility.GroupedThreadPool;
import com.acrescrypto.assetfs.utility.Util;

public class ArchiveFSTest {
	/* "Data\a.txt" = "hello world", "b" = "" */
	final static String FIXTURE_V1 = "5247535341440001f4caaddeb1d7898fd9c7a3aa6de216526d38a65b91e6ca979ba3f4691dcf3efd8ac78605799a";

	/* base magic 0x12345678; "Data\a.txt" = "hello world" (magic 0x0BADF00D), "Graphics\x.png" = 89 50 4e 47 (magic 0x7FFFFFFF) */
	final static String FIXTURE_V3 = "52475353414400030d265b57305634127356341275a69919725634123c37407324371a6600222b5634127c56341287a9cb6d765634123f245562103f5761242e1a621631785634126595c16731b0b63ee79e2e76afb138";

	RAMFS storage;
	ArrayList<ArchiveFS> opened = new ArrayList<>();

	@BeforeClass
	public static void beforeAll() {
		TestUtils.startDebugMode();
	}

	@AfterClass
	public static void afterAll() {
		TestUtils.assertTidy();
		TestUtils.stopDebugMode();
	}

	@Before
	public void beforeEach() {
		storage = new RAMFS("archive-storage");
	}

	@After
	public void afterEach() throws IOException {
		for(ArchiveFS archive : opened) archive.close();
	}

	static byte[] hexToBytes(String hex) {
		byte[] bytes = new byte[hex.length()/2];
		for(int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte) Integer.parseInt(hex.substring(2*i, 2*i+2), 16);
		}

		return bytes;
	}

	ArchiveFS load(byte[] contents) throws IOException {
		storage.write("loaded.rgssad", contents);
		File file = storage.open("loaded.rgssad", File.O_RDWR);
		try {
			ArchiveFS archive = new ArchiveFS(file);
			opened.add(archive);
			return archive;
		} catch(IOException|RuntimeException exc) {
			file.close();
			throw exc;
		}
	}

	ArchiveFS reopen(String path) throws IOException {
		ArchiveFS archive = new ArchiveFS(storage.open(path, File.O_RDWR));
		opened.add(archive);
		return archive;
	}

	ArchiveFS build(int version, ArchiveSource... sources) throws IOException {
		File buffer = storage.open("built.rgssad", File.O_RDWR|File.O_CREAT);
		ArchiveFS archive = new ArchiveWriter(buffer, version)
				.setScratchFS(storage)
				.write(Arrays.asList(sources).iterator());
		opened.add(archive);
		return archive;
	}

	byte[] header(int version) {
		byte[] header = Arrays.copyOf(ArchiveFS.HEADER, ArchiveFS.HEADER_SIZE);
		header[ArchiveFS.HEADER_SIZE-1] = (byte) version;
		return header;
	}

	List<ArchiveSource> sampleSources() {
		byte[] random = new byte[70000];
		new Random(1234).nextBytes(random);

		ArrayList<ArchiveSource> sources = new ArrayList<>();
		sources.add(new ArchiveSource("Data/Map001.rxdata", random));
		sources.add(new ArchiveSource("Data/Scripts.rxdata", "scripts".getBytes()));
		sources.add(new ArchiveSource("Graphics/Characters/Hero.png", new byte[] { 1, 2, 3 }));
		sources.add(new ArchiveSource("Game.ini", new byte[0]));
		sources.add(new ArchiveSource("Audio/BGM/Titel Thema.ogg", "ünïcödé".getBytes()));
		return sources;
	}

	void assertMatchesSources(ArchiveFS archive, List<ArchiveSource> sources) throws IOException {
		assertEquals(sources.size(), archive.fileCount());
		for(ArchiveSource source : sources) {
			byte[] expected;
			try(InputStream in = source.open()) {
				expected = IOUtils.toByteArray(in);
			}

			assertArrayEquals(source.getPath(), expected, archive.read(source.getPath()));
		}
	}

	@Test
	public void testParsesVersion1Archive() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		assertEquals(1, archive.getVersion());
		assertEquals(ArchiveKeystream.MAGIC, archive.getBaseMagic());
		assertEquals(2, archive.fileCount());
		assertArrayEquals("hello world".getBytes(), archive.read("Data/a.txt"));
		assertArrayEquals(new byte[0], archive.read("b"));

		ArchiveEntry entry = archive.getEntry("Data/a.txt");
		assertEquals(8, entry.getHeaderOffset());
		assertEquals(26, entry.getBodyOffset());
		assertEquals(11, entry.getSize());

		ArchiveEntry empty = archive.getEntry("b");
		assertEquals(37, empty.getHeaderOffset());
		assertEquals(46, empty.getBodyOffset());
		assertEquals(0, empty.getSize());
	}

	@Test
	public void testParsesVersion3Archive() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		assertEquals(3, archive.getVersion());
		assertEquals(0x12345678, archive.getBaseMagic());
		assertEquals(2, archive.fileCount());
		assertArrayEquals("hello world".getBytes(), archive.read("Data/a.txt"));
		assertArrayEquals(new byte[] { (byte) 0x89, 'P', 'N', 'G' }, archive.read("Graphics/x.png"));

		ArchiveEntry text = archive.getEntry("Data/a.txt");
		assertEquals(12, text.getHeaderOffset());
		assertEquals(72, text.getBodyOffset());
		assertEquals(0x0BADF00D, text.getStartMagic());

		ArchiveEntry png = archive.getEntry("Graphics/x.png");
		assertEquals(38, png.getHeaderOffset());
		assertEquals(83, png.getBodyOffset());
		assertEquals(0x7FFFFFFF, png.getStartMagic());
	}

	@Test
	public void testVersion2ReadsLikeVersion1() throws IOException {
		byte[] contents = hexToBytes(FIXTURE_V1);
		contents[ArchiveFS.HEADER_SIZE-1] = 2;
		ArchiveFS archive = load(contents);
		assertEquals(2, archive.getVersion());
		assertArrayEquals("hello world".getBytes(), archive.read("Data/a.txt"));
	}

	@Test
	public void testLookupsAcceptBackslashes() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		assertArrayEquals("hello world".getBytes(), archive.read("Data\\a.txt"));
		assertTrue(archive.exists("Graphics\\x.png"));
	}

	@Test
	public void testLookupsAreCaseSensitive() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		assertFalse(archive.exists("data/a.txt"));
		FSTestBase.expectENOENT(()->archive.open("DATA/A.TXT", File.O_RDONLY).close());
	}

	@Test
	public void testDirectoriesAreImplied() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		assertEquals(Arrays.asList("Data", "Graphics"), new ArrayList<>(archive.opendir("").list()));
		assertEquals(Arrays.asList("a.txt"), new ArrayList<>(archive.opendir("Data").list()));

		Stat stat = archive.stat("Graphics");
		assertTrue(stat.isDirectory());
		assertEquals(1, stat.getSize());
		assertTrue(archive.stat("").isDirectory());
		assertEquals(4, archive.stat("Graphics/x.png").getSize());
	}

	@Test
	public void testReaddirReportsMissingAndNonDirectories() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		FSTestBase.expectENOENT(()->archive.readdir("Audio"));
		FSTestBase.expectException(EISNOTDIRException.class, ()->archive.readdir("Data/a.txt"));
	}

	@Test
	public void testOpenDirectoryThrowsEISDIR() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		FSTestBase.expectException(EISDIRException.class, ()->archive.open("Data", File.O_RDONLY).close());
	}

	@Test
	public void testStatMissingFileThrowsENOENT() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		FSTestBase.expectENOENT(()->archive.stat("Data/missing.txt"));
	}

	@Test
	public void testRandomAccessReads() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		try(File file = archive.open("Data/a.txt", File.O_RDONLY)) {
			file.seek(6, File.SEEK_SET);
			assertArrayEquals("world".getBytes(), file.read(5));
			assertEquals(-1, file.read(new byte[4], 0, 4));

			file.seek(-9, File.SEEK_END);
			assertArrayEquals("llo".getBytes(), file.read(3));

			file.seek(-5, File.SEEK_CUR);
			assertArrayEquals("hello".getBytes(), file.read(5));
		}
	}

	@Test
	public void testSameLengthOverwritePersists() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V3));
		try(File file = archive.open("Data/a.txt", File.O_RDWR)) {
			file.seek(2, File.SEEK_SET);
			file.write("LLO W".getBytes());
			file.flush();
		}

		assertArrayEquals("heLLO World".getBytes(), archive.read("Data/a.txt"));
		assertArrayEquals(new byte[] { (byte) 0x89, 'P', 'N', 'G' }, archive.read("Graphics/x.png"));

		ArchiveFS reparsed = reopen("loaded.rgssad");
		assertArrayEquals("heLLO World".getBytes(), reparsed.read("Data/a.txt"));
		assertEquals(archive.getEntry("Data/a.txt"), reparsed.getEntry("Data/a.txt"));
	}

	@Test
	public void testWritePastEndIsUnsupported() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		try(File file = archive.open("Data/a.txt", File.O_WRONLY)) {
			file.seek(8, File.SEEK_SET);
			FSTestBase.expectUnsupported(()->file.write("1234".getBytes()));
			FSTestBase.expectUnsupported(()->file.truncate(3));
		}

		assertArrayEquals("hello world".getBytes(), archive.read("Data/a.txt"));
	}

	@Test
	public void testLengthChangingOpenModesAreUnsupported() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		FSTestBase.expectUnsupported(()->archive.open("Data/a.txt", File.O_WRONLY|File.O_TRUNC).close());
		FSTestBase.expectUnsupported(()->archive.open("Data/a.txt", File.O_WRONLY|File.O_APPEND).close());
		FSTestBase.expectUnsupported(()->archive.open("Data/new.txt", File.O_WRONLY|File.O_CREAT).close());
		FSTestBase.expectUnsupported(()->archive.write("Data/a.txt", "hello world".getBytes()));
	}

	@Test
	public void testMkdirpOfExistingDirectoriesSucceeds() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		archive.mkdirp("Data");
		archive.mkdirp("");
		FSTestBase.expectException(EISNOTDIRException.class, ()->archive.mkdirp("b/c"));
		FSTestBase.expectException(EEXISTSException.class, ()->archive.mkdir("Data"));
		assertEquals(2, archive.fileCount());
	}

	@Test
	public void testStructuralChangesAreUnsupported() throws IOException {
		ArchiveFS archive = load(hexToBytes(FIXTURE_V1));
		FSTestBase.expectUnsupported(()->archive.mkdir("Graphics"));
		FSTestBase.expectUnsupported(()->archive.mkdirp("Graphics/Pictures"));
		FSTestBase.expectUnsupported(()->archive.mkdirp("Data/Pictures"));
		FSTestBase.expectUnsupported(()->archive.rmdir("Data"));
		FSTestBase.expectUnsupported(()->archive.unlink("b"));
		FSTestBase.expectUnsupported(()->archive.mv("b", "c"));
		assertEquals(2, archive.fileCount());
	}

	@Test
	public void testRejectsShortHeader() throws IOException {
		FSTestBase.expectException(InvalidArchiveHeaderException.class, ()->load("RGSS".getBytes()));
		FSTestBase.expectException(InvalidArchiveHeaderException.class, ()->load(new byte[0]));
	}

	@Test
	public void testRejectsBadSignature() throws IOException {
		byte[] contents = hexToBytes(FIXTURE_V1);
		contents[0] = 'X';
		FSTestBase.expectException(InvalidArchiveHeaderException.class, ()->load(contents));
	}

	@Test
	public void testVersionBoundaries() throws IOException {
		try {
			load(header(0));
			fail();
		} catch(InvalidArchiveVersionException exc) {
			assertEquals(0, exc.getVersion());
		}

		try {
			load(header(4));
			fail();
		} catch(InvalidArchiveVersionException exc) {
			assertEquals(4, exc.getVersion());
		}

		assertEquals(0, load(header(1)).fileCount());
		assertEquals(0, load(header(2)).fileCount());
	}

	@Test
	public void testVersion3RequiresBaseMagic() throws IOException {
		FSTestBase.expectException(InvalidArchiveHeaderException.class, ()->load(header(3)));
	}

	@Test
	public void testBodyPastEndOfArchiveNamesRecord() throws IOException {
		byte[] truncated = Arrays.copyOf(hexToBytes(FIXTURE_V1), 30);
		try {
			load(truncated);
			fail();
		} catch(InvalidArchiveHeaderException exc) {
			assertTrue(exc.getMessage(), exc.getMessage().contains("file #0 at offset 8"));
		}
	}

	@Test
	public void testTruncatedRecordNamesRecord() throws IOException {
		byte[] truncated = Arrays.copyOf(hexToBytes(FIXTURE_V1), 43);
		try {
			load(truncated);
			fail();
		} catch(InvalidArchiveHeaderException exc) {
			fail("unexpected header exception " + exc.getMessage());
		} catch(IOException exc) {
			assertTrue(exc.getMessage(), exc.getMessage().contains("file #1 at offset 37"));
		}
	}

	@Test
	public void testVersion3BodyPastEndIsRejected() throws IOException {
		byte[] truncated = Arrays.copyOf(hexToBytes(FIXTURE_V3), 80);
		FSTestBase.expectException(InvalidArchiveHeaderException.class, ()->load(truncated));
	}

	@Test
	public void testRoundTripsEveryVersion() throws IOException {
		for(int version = ArchiveFS.MIN_VERSION; version <= ArchiveFS.MAX_VERSION; version++) {
			List<ArchiveSource> sources = sampleSources();
			ArchiveFS written = build(version, sources.toArray(new ArchiveSource[0]));
			assertEquals(version, written.getVersion());
			assertMatchesSources(written, sources);

			ArchiveFS reparsed = reopen("built.rgssad");
			assertEquals(version, reparsed.getVersion());
			assertEquals(written.getBaseMagic(), reparsed.getBaseMagic());
			assertEquals(written.getIndex().snapshot(), reparsed.getIndex().snapshot());
			assertMatchesSources(reparsed, sources);
		}
	}

	@Test
	public void testVersion1WriterMatchesKnownArchive() throws IOException {
		build(1, new ArchiveSource("Data\\a.txt", "hello world".getBytes()), new ArchiveSource("b", new byte[0]));
		assertArrayEquals(hexToBytes(FIXTURE_V1), storage.read("built.rgssad"));
	}

	@Test
	public void testVersion3WriterLaysOutHeaderBeforeBodies() throws IOException {
		ArchiveFS archive = build(3,
				new ArchiveSource("Data/a.txt", "hello world".getBytes()),
				new ArchiveSource("Graphics/x.png", new byte[] { (byte) 0x89, 'P', 'N', 'G' }));
		assertEquals(72, archive.getEntry("Data/a.txt").getBodyOffset());
		assertEquals(83, archive.getEntry("Graphics/x.png").getBodyOffset());
		assertEquals(87, storage.stat("built.rgssad").getSize());

		byte[] raw = storage.read("built.rgssad");
		int terminator = ArchiveKeystream.baseFromStored(Util.deserializeIntLE(raw, 8));
		assertEquals(terminator, Util.deserializeIntLE(raw, 68));
		assertEquals(1, storage.readdir("").size());
	}

	@Test
	public void testEmptyArchivesRoundTrip() throws IOException {
		ArchiveFS v1 = build(1);
		assertEquals(0, v1.fileCount());
		assertEquals(ArchiveFS.HEADER_SIZE, storage.stat("built.rgssad").getSize());
		assertEquals(0, reopen("built.rgssad").fileCount());

		ArchiveFS v3 = build(3);
		assertEquals(0, v3.fileCount());
		assertEquals(ArchiveFS.HEADER_SIZE + 8, storage.stat("built.rgssad").getSize());
		assertEquals(0, reopen("built.rgssad").fileCount());
	}

	@Test
	public void testSmallCopyBuffersProduceIdenticalBodies() throws IOException {
		List<ArchiveSource> sources = sampleSources();
		File buffer = storage.open("chunked.rgssad", File.O_RDWR|File.O_CREAT);
		ArchiveFS archive = new ArchiveWriter(buffer, 1)
				.setCopyBufferSize(7)
				.write(sources.iterator());
		opened.add(archive);
		assertMatchesSources(archive, sources);
	}

	@Test
	public void testDefaultVersionComesFromConfig() throws IOException {
		File buffer = storage.open("default.rgssad", File.O_RDWR|File.O_CREAT);
		ArchiveFS archive = ArchiveFS.fromBufferAndFiles(buffer, sampleSources().iterator());
		opened.add(archive);
		assertEquals(3, archive.getVersion());
		assertMatchesSources(archive, sampleSources());
	}

	@Test
	public void testProgressCountsWrittenFiles() throws IOException {
		AtomicLong progress = new AtomicLong();
		File buffer = storage.open("progress.rgssad", File.O_RDWR|File.O_CREAT);
		opened.add(ArchiveFS.fromBufferAndFiles(buffer, 2, sampleSources().iterator(), progress));
		assertEquals(sampleSources().size(), progress.get());
	}

	@Test
	public void testAsyncBuild() throws Exception {
		AtomicLong progress = new AtomicLong();
		File buffer = storage.open("async.rgssad", File.O_RDWR|File.O_CREAT);
		Future<ArchiveFS> future = ArchiveFS.fromBufferAndFilesAsync(buffer, 1, sampleSources().iterator(), progress);
		ArchiveFS archive = future.get();
		opened.add(archive);
		assertEquals(sampleSources().size(), progress.get());
		assertMatchesSources(archive, sampleSources());
	}

	@Test
	public void testWriterRejectsUnknownVersionBeforeTruncating() throws IOException {
		storage.write("existing.rgssad", "keep me".getBytes());
		try(File buffer = storage.open("existing.rgssad", File.O_RDWR)) {
			Iterator<ArchiveSource> files = sampleSources().iterator();
			FSTestBase.expectUnsupported(()->new ArchiveWriter(buffer, 4).write(files));
			FSTestBase.expectUnsupported(()->new ArchiveWriter(buffer, 0).write(files));
		}

		assertArrayEquals("keep me".getBytes(), storage.read("existing.rgssad"));
	}

	@Test
	public void testShortSourceAbortsWrite() throws IOException {
		ArchiveSource liar = new ArchiveSource("Data/short.rxdata", 10, ()->new ByteArrayInputStream(new byte[4]));
		for(int version : new int[] { 1, 3 }) {
			try(File buffer = storage.open("short.rgssad", File.O_RDWR|File.O_CREAT)) {
				new ArchiveWriter(buffer, version)
					.setScratchFS(storage)
					.write(Arrays.asList(liar).iterator());
				fail();
			} catch(IOException exc) {
				assertTrue(exc.getMessage(), exc.getMessage().contains("file #0 (Data/short.rxdata"));
			}
		}

		assertEquals(1, storage.readdir("").size());
	}

	@Test
	public void testSourcesFromDirectory() throws IOException {
		RAMFS tree = new RAMFS("tree");
		tree.mkdirp("Data");
		tree.mkdirp("Graphics/Pictures");
		tree.write("Data/Map001.rxdata", "map".getBytes());
		tree.write("Graphics/Pictures/title.png", "png".getBytes());
		tree.write("Game.ini", "[Game]".getBytes());

		List<ArchiveSource> sources = ArchiveSource.fromDirectory(tree, "");
		assertEquals(3, sources.size());
		ArchiveFS archive = build(3, sources.toArray(new ArchiveSource[0]));
		assertArrayEquals("png".getBytes(), archive.read("Graphics/Pictures/title.png"));
		assertArrayEquals("[Game]".getBytes(), archive.read("Game.ini"));
		assertArrayEquals("map".getBytes(), archive.read("Data/Map001.rxdata"));

		List<ArchiveSource> nested = ArchiveSource.fromDirectory(tree, "Graphics");
		assertEquals(1, nested.size());
		assertEquals("Pictures/title.png", nested.get(0).getPath());
	}

	/** Version 1 archive holding one record per path, each with a three-byte body. */
	byte[] craftV1(String... paths) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.write(header(1), 0, ArchiveFS.HEADER_SIZE);

		ArchiveKeystream keystream = new ArchiveKeystream(ArchiveKeystream.MAGIC);
		for(String path : paths) {
			byte[] pathBytes = path.getBytes(StandardCharsets.UTF_8);
			out.write(Util.serializeIntLE(pathBytes.length ^ keystream.advance()), 0, 4);
			for(byte b : pathBytes) out.write(b ^ (byte) keystream.advance());
			out.write(Util.serializeIntLE(3 ^ keystream.advance()), 0, 4);
			out.write(new byte[] { 1, 2, 3 }, 0, 3);
		}

		return out.toByteArray();
	}

	void assertRejectedRecord(String expected, byte[] contents) throws IOException {
		try {
			load(contents);
			fail("expected InvalidArchiveHeaderException");
		} catch(InvalidArchiveHeaderException exc) {
			assertTrue(exc.getMessage(), exc.getMessage().contains(expected));
		}
	}

	@Test
	public void testCraftedArchiveOpens() throws IOException {
		ArchiveFS archive = load(craftV1("Data\\Map001.rxdata", "Game.ini"));
		assertEquals(3, archive.stat("Data/Map001.rxdata").getSize());
		assertTrue(archive.exists("Game.ini"));
		assertTrue(archive.stat("").isDirectory());
		assertEquals(2, archive.readdir("").size());
	}

	@Test
	public void testEmptyPathIsRejected() throws IOException {
		assertRejectedRecord("file #0 at offset 8", craftV1(""));
	}

	@Test
	public void testPathCollapsingToRootIsRejected() throws IOException {
		assertRejectedRecord("file #0 at offset 8", craftV1("/"));
		assertRejectedRecord("file #0 at offset 8", craftV1(".."));
	}

	@Test
	public void testPathsCollapsingToSameKeyAreRejected() throws IOException {
		// "a//b" ends at 8 + 4 + 4 + 4 + 3
		assertRejectedRecord("file #1 at offset 23", craftV1("a//b", "a\\b"));
	}

	@Test
	public void testFileClashingWithDirectoryIsRejected() throws IOException {
		assertRejectedRecord("file #1", craftV1("Data", "Data/Map001.rxdata"));
		assertRejectedRecord("file #1", craftV1("Data/Map001.rxdata", "Data"));
	}

	@Test
	public void testSourceNamingRootIsRejected() {
		for(String path : new String[] { "", "/", "..", "Data/.." }) {
			try {
				new ArchiveSource(path, new byte[1]);
				fail(path);
			} catch(IllegalArgumentException exc) {
				assertTrue(exc.getMessage(), exc.getMessage().contains("names the root"));
			}
		}
	}

	@Test
	public void testWriterRejectsConflictingSources() throws IOException {
		ArchiveSource[][] conflicting = {
			{ new ArchiveSource("a//b", new byte[1]), new ArchiveSource("a\\b", new byte[2]) },
			{ new ArchiveSource("Data", new byte[1]), new ArchiveSource("Data/Map001.rxdata", new byte[2]) },
		};

		for(int version = 1; version <= 3; version++) {
			for(ArchiveSource[] sources : conflicting) {
				try(File buffer = storage.open("conflict.rgssad", File.O_RDWR|File.O_CREAT)) {
					new ArchiveWriter(buffer, version)
						.setScratchFS(storage)
						.write(Arrays.asList(sources).iterator());
					fail();
				} catch(IllegalArgumentException exc) {
					assertTrue(exc.getMessage(), exc.getMessage().contains("file #1"));
				}
			}
		}
	}

	static byte[] readInChunks(FS fs, String path, int chunkSize) throws IOException {
		try(File file = fs.open(path, File.O_RDONLY)) {
			byte[] data = new byte[(int) file.getSize()];
			int total = 0;
			while(total < data.length) {
				int n = file.read(data, total, Math.min(chunkSize, data.length - total));
				if(n <= 0) break;
				total += n;
			}

			assertEquals(data.length, total);
			return data;
		}
	}

	@Test
	public void testConcurrentReadersShareArchiveStream() throws Exception {
		Random random = new Random(5678);
		byte[][] contents = new byte[8][];
		ArchiveSource[] sources = new ArchiveSource[contents.length];
		for(int i = 0; i < contents.length; i++) {
			contents[i] = new byte[50000];
			random.nextBytes(contents[i]);
			sources[i] = new ArchiveSource("Data/Map00" + i + ".rxdata", contents[i]);
		}

		GroupedThreadPool pool = GroupedThreadPool.newFixedThreadPool("archive readers", 8);
		try {
			for(int version = 1; version <= 3; version++) {
				ArchiveFS archive = build(version, sources);
				ArrayList<Future<byte[]>> reads = new ArrayList<>();
				for(int task = 0; task < 64; task++) {
					String path = sources[task % sources.length].getPath();
					reads.add(pool.submit(()->readInChunks(archive, path, 777)));
				}

				for(int task = 0; task < reads.size(); task++) {
					assertArrayEquals("version " + version + " task " + task,
							contents[task % contents.length],
							reads.get(task).get());
				}
			}
		} finally {
			pool.shutdownNow();
		}
	}
}
