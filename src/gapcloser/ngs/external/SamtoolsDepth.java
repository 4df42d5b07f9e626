package gapcloser.ngs.external;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.CoverageProfile;
import gapcloser.ngs.model.Sequence;

/**
 * Per-base depth from <tt>samtools depth</tt>, which leaves out uncovered positions.
 */
public class SamtoolsDepth implements CoverageReporter {

	private final WorkDirectory work;

	public SamtoolsDepth(WorkDirectory work) {
		this.work = work;
	}

	@Override
	public CoverageProfile coverage(Sequence reference, AlignmentSet alignments, String label) {
		final String depth = work.path(label+".depth");
		work.run("samtools depth "+WorkDirectory.quote(SamtoolsProcessor.bam(alignments))+" > "+WorkDirectory.quote(depth));
		return CoverageProfile.parse(depth);
	}
}
