package gapcloser.ngs.external;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.Sequence;

/**
 * Clean-up steps applied to alignments between aligning and using them.
 */
public interface AlignmentProcessor {

	AlignmentSet markDuplicates(Sequence reference, AlignmentSet alignments, String label);

	AlignmentSet realignIndels(Sequence reference, AlignmentSet alignments, String label);

	/**
	 * Keeps each alignment with probability <tt>fraction</tt>.
	 */
	AlignmentSet downsample(AlignmentSet alignments, double fraction, String label);
}
