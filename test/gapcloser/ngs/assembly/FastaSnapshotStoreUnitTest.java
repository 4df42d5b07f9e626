package gapcloser.ngs.assembly;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import gapcloser.ngs.model.Sequence;

public class FastaSnapshotStoreUnitTest {

	private File dir;

	@BeforeMethod
	public void setUp() throws IOException {
		dir = Files.createTempDirectory("snapshots").toFile();
	}

	@AfterMethod
	public void tearDown() throws IOException {
		FileUtils.deleteDirectory(dir);
	}

	@Test
	public void testSnapshotsAreReloaded() {
		FastaSnapshotStore store = new FastaSnapshotStore(dir, "s1");
		Assert.assertNull(store.latest());
		store.save(new Snapshot(1, new Sequence("s1", "ACGTNNNNNNNNNNacgt")));
		store.save(new Snapshot(3, new Sequence("s1", "ACGTaaNNNNNNNNNNacgt")));
		Assert.assertTrue(store.file(1).isFile());
		Assert.assertEquals(store.file(3).getName(), "s1.iter3.fa");

		new FastaSnapshotStore(dir, "s2").save(new Snapshot(7, new Sequence("s2", "ACGT")));

		FastaSnapshotStore reopened = new FastaSnapshotStore(dir, "s1");
		Assert.assertEquals(reopened.snapshots().size(), 2);
		Assert.assertEquals(reopened.latest().iteration(), 3);
		Assert.assertEquals(reopened.latest().sequence(), new Sequence("s1", "ACGTaaNNNNNNNNNNacgt"));
	}

	@Test
	public void testMemoryStoreKeepsIterationOrder() {
		MemorySnapshotStore store = new MemorySnapshotStore();
		store.save(new Snapshot(2, new Sequence("s", "CC")));
		store.save(new Snapshot(1, new Sequence("s", "AA")));
		Assert.assertEquals(store.snapshots().get(0).iteration(), 1);
		Assert.assertEquals(store.latest().sequence().seq_str(), "CC");
	}
}
