package gapcloser.ngs.assembly;

import java.util.Arrays;
import java.util.Collections;

import org.testng.Assert;
import org.testng.annotations.Test;

import gapcloser.ngs.external.FakeCollaborators;
import gapcloser.ngs.model.Sequence;

public class ConsensusBuilderUnitTest {

	@Test
	public void testEmptyReadsGiveEmptyConsensus() {
		FakeCollaborators fake = new FakeCollaborators();
		Assert.assertEquals(new ConsensusBuilder(fake).build(Collections.<Sequence>emptyList(), "x"), "");
		Assert.assertTrue(fake.consensusLabels.isEmpty());
	}

	@Test
	public void testAmbiguousColumnsAreDropped() {
		ConsensusBuilder builder = new ConsensusBuilder((reads, label) -> "AC?GT??A");
		Assert.assertEquals(builder.build(Arrays.asList(new Sequence("r", "ACGT")), "x"), "ACGTA");
	}
}
