package gapcloser.util;

/**
 * Fixed parameters of the gap closing heuristics. The anchor widths and boundary
 * offsets decide which reads count as spanning and where a splice may land, so
 * changing any of them changes the assembly.
 */
public class Constants {

	/** Placeholder base marking the unresolved gap. */
	public final static char GAP_BASE = 'N';
	/** Number of placeholder bases in a gap run. */
	public final static int GAP_LENGTH = 10;

	/** Reads must start within this many bases of a boundary to be used as anchors. */
	public final static int PROXIMITY_WINDOW = 50;
	/** Left boundary sits this many bases before the first gap base. */
	public final static int LEFT_BOUNDARY_OFFSET = 5;
	/** Right boundary sits this many bases after the first gap base. */
	public final static int RIGHT_BOUNDARY_OFFSET = 15;

	/** Flank searched for in the consensus. */
	public final static int ANCHOR_PART_LENGTH = 15;
	/** Splice target; its uniqueness gates a splice. */
	public final static int ANCHOR_ALL_LENGTH = 35;
	/** Context kept on the opposite side of the gap during a splice. */
	public final static int SPLICE_CONTEXT_LENGTH = ANCHOR_ALL_LENGTH-ANCHOR_PART_LENGTH-GAP_LENGTH;
	/** Flank used to decide whether the two scaffolds overlap. */
	public final static int MEET_ANCHOR_LENGTH = 20;
	/** Shorter extensions are not trusted. */
	public final static int MIN_EXTENSION_LENGTH = 35;

	/** Alignments covering less of their read than this are dropped. */
	public final static double MIN_ALIGNED_FRACTION = 0.5;
	/** Mean depth the heterozygous path downsamples to. */
	public final static double TARGET_COVERAGE = 100;
	/** Positions at or below this fraction of the mean depth are masked. */
	public final static double MASK_DEPTH_FRACTION = 0.2;
	/** Boundary depth ceiling, as a multiple of the predicted coverage. */
	public final static int COVERAGE_CEILING_FACTOR = 3;

	public final static int DEFAULT_MAX_ITERATIONS = 100;
	public final static int DEFAULT_PREDICTED_COVERAGE = 1000;

	/** Placeholder the multiple sequence aligner leaves in undecided columns. */
	public final static char AMBIGUITY_PLACEHOLDER = '?';
	/** Gap character of a gapped alignment. */
	public final static char ALIGNMENT_GAP = '-';

	private Constants() {}
}
