package gapcloser.ngs.assembly;

import gapcloser.ngs.model.CoverageProfile;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.Constants;

/**
 * Replaces poorly supported bases with N. A position up to the last reported one is
 * masked when it has no reported depth or its depth is at most
 * {@value gapcloser.util.Constants#MASK_DEPTH_FRACTION} of the mean depth. Positions
 * past the last reported one are left alone.
 */
public class CoverageMasker {

	private final double fraction;

	public CoverageMasker() {
		this(Constants.MASK_DEPTH_FRACTION);
	}

	public CoverageMasker(double fraction) {
		this.fraction = fraction;
	}

	public Sequence mask(Sequence sequence, CoverageProfile coverage) {
		final double threshold = coverage.mean()*this.fraction;
		final int last = Math.min(coverage.lastPosition(), sequence.seq_ln());
		final StringBuilder masked = new StringBuilder(sequence.seq_str());
		for(int position=1; position<=last; position++) {
			if(!coverage.isReported(position) || coverage.depth(position)<=threshold)
				masked.setCharAt(position-1, Constants.GAP_BASE);
		}
		return sequence.withSequence(masked.toString());
	}
}
