package gapcloser.ngs.external;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.Sequence;

/**
 * Places the run's reads on a reference. Implementations drop reads without a
 * reference position and reads aligned over less than half their length.
 */
public interface Aligner {

	AlignmentSet align(Sequence reference, String label);
}
