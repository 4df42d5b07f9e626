package gapcloser.ngs.external;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.PhasedAlignments;
import gapcloser.ngs.model.Sequence;

public interface Phaser {

	/**
	 * Splits alignments into two haplotypes, or returns them as a single unseparated
	 * bin when they cannot be split.
	 */
	PhasedAlignments phase(Sequence reference, AlignmentSet alignments, String label);
}
