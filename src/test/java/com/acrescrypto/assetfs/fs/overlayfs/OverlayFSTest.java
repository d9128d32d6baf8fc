package com.acrescrypto.assetfs.fs.overlayfs;

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.acrescrypto.assetfs.TestUtils;
import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.EROFSException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FSTestBase;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.ramfs.RAMFS;

public class OverlayFSTest extends FSTestBase {
	RAMFS top, bottom;
	OverlayFS overlay;

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
	public void beforeEach() throws IOException {
		top = new RAMFS("top");
		bottom = new RAMFS("bottom");
		scratch = overlay = new OverlayFS(top, bottom);
		prepareExamples();
	}

	/** Content that only the lower layer has. Kept out of the root so the shared contract still holds. */
	void populateBottom() throws IOException {
		bottom.mkdirp("directory/base");
		bottom.write("directory/base/Map001.rxdata", "base map".getBytes());
		bottom.write("directory/inner", "shadowed".getBytes());
		bottom.write("directory/lower", "lower only".getBytes());
	}

	@Test
	public void testWritesLandInFirstLayer() throws IOException {
		assertArrayEquals("just a regular ol file".getBytes(), top.read("regularfile"));
		assertFalse(bottom.exists("regularfile"));
	}

	@Test
	public void testFirstLayerWinsOnRead() throws IOException {
		populateBottom();
		assertArrayEquals("inside".getBytes(), overlay.read("directory/inner"));
		assertEquals(6, overlay.stat("directory/inner").getSize());
	}

	@Test
	public void testReadsFallThroughToLowerLayers() throws IOException {
		populateBottom();
		assertArrayEquals("lower only".getBytes(), overlay.read("directory/lower"));
		assertTrue(overlay.stat("directory/base").isDirectory());
		assertArrayEquals("base map".getBytes(), overlay.read("directory/base/Map001.rxdata"));
		assertSame(bottom, overlay.layerFor("directory/lower"));
		assertSame(top, overlay.layerFor("directory/inner"));
		assertNull(overlay.layerFor("directory/nowhere"));
	}

	@Test
	public void testReaddirMergesLayers() throws IOException {
		populateBottom();
		assertEquals(new HashSet<>(Arrays.asList("inner", "base", "lower")), names(overlay.readdir("directory")));
		assertEquals(3, overlay.readdir("directory").size());

		for(DirEntry entry : overlay.readdir("directory")) {
			if(entry.getName().equals("inner")) assertEquals(6, entry.getStat().getSize());
		}
	}

	@Test
	public void testDirectorySizeCountsMergedEntries() throws IOException {
		populateBottom();
		assertEquals(1, top.stat("directory").getSize());
		assertEquals(3, overlay.stat("directory").getSize());

		for(DirEntry entry : overlay.readdir("")) {
			if(entry.getName().equals("directory")) assertEquals(3, entry.getStat().getSize());
		}
	}

	@Test
	public void testReaddirOfLowerOnlyDirectory() throws IOException {
		populateBottom();
		assertEquals(new HashSet<>(Arrays.asList("Map001.rxdata")), names(overlay.readdir("directory/base")));
	}

	@Test
	public void testFileInFirstLayerHidesLowerDirectory() throws IOException {
		bottom.mkdir("regularfile");
		bottom.write("regularfile/hidden", "hidden".getBytes());
		expectException(EISNOTDIRException.class, ()->overlay.readdir("regularfile"));
		assertTrue(overlay.stat("regularfile").isRegularFile());
	}

	@Test
	public void testDirectoryInFirstLayerSkipsLowerFile() throws IOException {
		bottom.write("directory", "a file".getBytes());
		assertEquals(new HashSet<>(Arrays.asList("inner")), names(overlay.readdir("directory")));
	}

	@Test
	public void testWritingLowerOnlyFileThrowsEROFS() throws IOException {
		populateBottom();
		expectException(EROFSException.class, ()->overlay.open("directory/lower", File.O_WRONLY).close());
		expectException(EROFSException.class, ()->overlay.write("directory/lower", "changed".getBytes()));
		assertArrayEquals("lower only".getBytes(), bottom.read("directory/lower"));
		assertFalse(top.exists("directory/lower"));
	}

	@Test
	public void testRemovingLowerOnlyPathsThrowsEROFS() throws IOException {
		populateBottom();
		expectException(EROFSException.class, ()->overlay.unlink("directory/lower"));
		expectException(EROFSException.class, ()->overlay.rmdir("directory/base"));
		expectException(EROFSException.class, ()->overlay.mv("directory/lower", "directory/moved"));
		assertTrue(bottom.exists("directory/lower"));
		assertTrue(bottom.exists("directory/base/Map001.rxdata"));
	}

	@Test
	public void testShadowedFileIsWritable() throws IOException {
		populateBottom();
		overlay.write("directory/inner", "rewritten".getBytes());
		assertArrayEquals("rewritten".getBytes(), overlay.read("directory/inner"));
		assertArrayEquals("shadowed".getBytes(), bottom.read("directory/inner"));
	}

	@Test
	public void testReadOnlyOpenOfLowerFileIsAllowed() throws IOException {
		populateBottom();
		try(File file = overlay.open("directory/lower", File.O_RDONLY)) {
			assertArrayEquals("lower".getBytes(), file.read(5));
		}
	}

	@Test
	public void testUnlinkRevealsLowerLayer() throws IOException {
		populateBottom();
		overlay.unlink("directory/inner");
		assertArrayEquals("shadowed".getBytes(), overlay.read("directory/inner"));
	}

	@Test
	public void testAddLayer() throws IOException {
		RAMFS extra = new RAMFS("extra");
		extra.write("extra.txt", "extra".getBytes());
		assertFalse(overlay.exists("extra.txt"));

		overlay.addLayer(extra);
		assertEquals(Arrays.asList(top, bottom, extra), overlay.getLayers());
		assertArrayEquals("extra".getBytes(), overlay.read("extra.txt"));
	}

	@Test(expected=UnsupportedOperationException.class)
	public void testLayerListIsReadOnly() {
		overlay.getLayers().clear();
	}

	@Test
	public void testEmptyOverlay() throws IOException {
		OverlayFS empty = new OverlayFS();
		assertFalse(empty.exists("anything"));
		expectENOENT(()->empty.stat("anything"));
		try {
			empty.mkdir("anything");
			fail();
		} catch(IllegalStateException exc) {}
	}

	@Test
	public void testCloseClosesEveryLayer() throws IOException {
		HashSet<String> closed = new HashSet<>();
		OverlayFS closing = new OverlayFS(new RAMFS("one") {
			@Override
			public void close() throws IOException {
				closed.add(getName());
				throw new IOException("one failed");
			}
		}, new RAMFS("two") {
			@Override
			public void close() throws IOException {
				closed.add(getName());
			}
		});

		try {
			closing.close();
			fail();
		} catch(IOException exc) {
			assertEquals("one failed", exc.getMessage());
		}

		assertEquals(new HashSet<>(Arrays.asList("one", "two")), closed);
	}
}
