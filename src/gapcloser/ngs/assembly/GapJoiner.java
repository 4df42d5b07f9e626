package gapcloser.ngs.assembly;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.ngs.model.GapRun;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.Constants;
import gapcloser.util.UnresolvableGapException;

/**
 * Removes the gap run from an extended reference by overlapping the two sides.
 * The flank right of the gap is looked up in the left side first; failing that, the
 * flank left of the gap is looked up in the right side.
 */
public class GapJoiner {

	private final static Logger myLogger = LogManager.getLogger(GapJoiner.class);

	/**
	 * @return the joined sequence, or the input when it carries no gap run
	 * @throws UnresolvableGapException when neither flank is found across the gap
	 */
	public Sequence join(Sequence reference) {
		final GapRun gap = reference.gapRun();
		if(gap==null) return reference;

		final String left = reference.seq_str().substring(0, gap.start());
		final String right = reference.seq_str().substring(gap.end());
		final String rightAnchor = reference.slice(gap.end(), gap.end()+Constants.MEET_ANCHOR_LENGTH);
		final String leftAnchor = reference.slice(gap.start()-Constants.MEET_ANCHOR_LENGTH, gap.start());

		if(rightAnchor!=null) {
			int i = StringUtils.lastIndexOfIgnoreCase(left, rightAnchor);
			if(i>=0) {
				myLogger.info(reference.seq_sn()+": right flank found "+(left.length()-i)+
						"bp before the gap, sides joined");
				return reference.withSequence(left.substring(0, i)+right);
			}
		}
		if(leftAnchor!=null) {
			int j = StringUtils.indexOfIgnoreCase(right, leftAnchor);
			if(j>=0) {
				myLogger.info(reference.seq_sn()+": left flank found "+j+
						"bp after the gap, sides joined");
				return reference.withSequence(left+right.substring(j+leftAnchor.length()));
			}
		}
		throw new UnresolvableGapException("The gap in "+reference.seq_sn()+" at position "+gap.position()+
				" cannot be used: neither flank is found on the opposite side.");
	}
}
