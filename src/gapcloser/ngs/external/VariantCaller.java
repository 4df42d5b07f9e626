package gapcloser.ngs.external;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.Sequence;
import gapcloser.ngs.model.VariantCalls;

public interface VariantCaller {

	VariantCalls call(Sequence reference, AlignmentSet alignments, String label);

	/**
	 * Renders the reference with every called allele substituted in.
	 */
	Sequence apply(Sequence reference, VariantCalls variants, String label);
}
