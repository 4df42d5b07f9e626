package gapcloser.ngs.external;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.CoverageProfile;
import gapcloser.ngs.model.Sequence;

public interface CoverageReporter {

	/**
	 * Depth per 1-based position of <tt>reference</tt>; positions with no reads are
	 * left out of the profile.
	 */
	CoverageProfile coverage(Sequence reference, AlignmentSet alignments, String label);
}
