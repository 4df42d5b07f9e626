package gapcloser.ngs.external;

import java.util.List;

import gapcloser.ngs.model.Sequence;

public interface MultipleSequenceAligner {

	/**
	 * Aligns the sequences and reduces the alignment to one consensus string. Columns
	 * without a clear winner may hold {@link gapcloser.util.Constants#AMBIGUITY_PLACEHOLDER}.
	 */
	String consensus(List<Sequence> sequences, String label);
}
