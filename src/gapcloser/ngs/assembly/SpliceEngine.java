package gapcloser.ngs.assembly;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;

import gapcloser.ngs.model.GapRun;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.Constants;

/**
 * Writes a consensus extension into the reference next to the gap.
 * <p>
 * On the left the anchor is the {@value gapcloser.util.Constants#ANCHOR_PART_LENGTH}
 * bases before the gap; the splice target is that anchor, the gap run and the first
 * {@value gapcloser.util.Constants#SPLICE_CONTEXT_LENGTH} bases after it. The
 * extension runs from the anchor's first match in the consensus to the consensus end
 * and is inserted before the gap run. The right side mirrors this: the anchor is
 * the {@value gapcloser.util.Constants#ANCHOR_PART_LENGTH} bases after the gap, the
 * extension runs from the consensus start to the anchor's last match and is inserted
 * after the gap run. The gap run itself always survives a splice.
 * <p>
 * A splice is applied only when the target occurs exactly once in the reference and
 * the extension is at least {@value gapcloser.util.Constants#MIN_EXTENSION_LENGTH}
 * bases long. Inserted bases are lower case.
 */
public class SpliceEngine {

	private final static Logger myLogger = LogManager.getLogger(SpliceEngine.class);

	public SpliceResult splice(Sequence reference, Side side, String consensus) {
		final GapRun gap = reference.gapRun();
		Preconditions.checkArgument(gap!=null, "reference %s carries no gap run", reference.seq_sn());

		final String anchorPart, anchorAll, context;
		if(side==Side.LEFT) {
			anchorPart = reference.slice(gap.start()-Constants.ANCHOR_PART_LENGTH, gap.start());
			anchorAll = reference.slice(gap.start()-Constants.ANCHOR_PART_LENGTH,
					gap.end()+Constants.SPLICE_CONTEXT_LENGTH);
			context = reference.slice(gap.start(), gap.end()+Constants.SPLICE_CONTEXT_LENGTH);
		} else {
			anchorPart = reference.slice(gap.end(), gap.end()+Constants.ANCHOR_PART_LENGTH);
			anchorAll = reference.slice(gap.start()-Constants.SPLICE_CONTEXT_LENGTH,
					gap.end()+Constants.ANCHOR_PART_LENGTH);
			context = reference.slice(gap.start()-Constants.SPLICE_CONTEXT_LENGTH, gap.end());
		}
		if(anchorPart==null || anchorAll==null || context==null)
			return SpliceResult.unchanged(SpliceOutcome.FLANK_TOO_SHORT, reference);
		if(StringUtils.isEmpty(consensus))
			return SpliceResult.unchanged(SpliceOutcome.EMPTY_EVIDENCE, reference);

		final String extension = extension(consensus, anchorPart, side);
		if(extension==null)
			return SpliceResult.unchanged(SpliceOutcome.ANCHOR_NOT_IN_CONSENSUS, reference);

		final String replacement = side==Side.LEFT ? extension+context : context+extension;
		SpliceResult result = this.apply(reference, anchorAll, extension, replacement);
		myLogger.info(side+" splice: "+result.outcome()+
				(result.outcome().applied() ? ", "+extension.length()+"bp extension" : ""));
		return result;
	}

	/**
	 * Consensus from the anchor to the far end of the extension, lower-cased, or
	 * <tt>null</tt> when the anchor is not in the consensus.
	 */
	static String extension(String consensus, String anchorPart, Side side) {
		if(side==Side.LEFT) {
			int i = StringUtils.indexOfIgnoreCase(consensus, anchorPart);
			return i<0 ? null : consensus.substring(i).toLowerCase();
		} else {
			int i = StringUtils.lastIndexOfIgnoreCase(consensus, anchorPart);
			return i<0 ? null : consensus.substring(0, i+anchorPart.length()).toLowerCase();
		}
	}

	/**
	 * Replaces <tt>anchorAll</tt> with <tt>replacement</tt> when the guards pass.
	 * Otherwise the reference is returned as it is.
	 */
	public SpliceResult apply(Sequence reference, String anchorAll, String extension, String replacement) {
		if(reference.countOccurrences(anchorAll)!=1)
			return SpliceResult.unchanged(SpliceOutcome.AMBIGUOUS_ANCHOR, reference);
		if(extension.length()<Constants.MIN_EXTENSION_LENGTH)
			return SpliceResult.unchanged(SpliceOutcome.SHORT_EXTENSION, reference);
		final Sequence spliced = reference.replace(anchorAll, replacement);
		if(spliced.countGapRuns()!=reference.countGapRuns())
			return SpliceResult.unchanged(SpliceOutcome.GAP_DISRUPTED, reference);
		return new SpliceResult(SpliceOutcome.APPLIED, spliced, extension.length());
	}
}
