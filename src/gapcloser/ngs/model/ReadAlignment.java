package gapcloser.ngs.model;

import java.util.Comparator;

import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;
import htsjdk.samtools.SAMRecord;

/**
 * One read placed on the current reference. The read sequence is the full sequence
 * as reported by the aligner, soft-clipped bases included, in reference orientation.
 * Coordinates are 1-based.
 */
public class ReadAlignment {

	private final String read_id;
	private final String read_str;
	private final int start; // first aligned reference base
	private final int ref_span; // reference bases covered by the alignment
	private final int aligned_ln; // read bases placed on the reference

	public ReadAlignment(String read_id,
			String read_str,
			int start,
			int ref_span,
			int aligned_ln) {
		this.read_id = read_id;
		this.read_str = read_str;
		this.start = start;
		this.ref_span = ref_span;
		this.aligned_ln = aligned_ln;
	}

	/** A gapless alignment of the whole read. */
	public ReadAlignment(String read_id,
			String read_str,
			int start) {
		this(read_id, read_str, start, read_str.length(), read_str.length());
	}

	public String read_id() {
		return this.read_id;
	}

	public String read_str() {
		return this.read_str;
	}

	public int start() {
		return this.start;
	}

	/** Last aligned reference base. */
	public int end() {
		return this.start+this.ref_span-1;
	}

	public int aligned_ln() {
		return this.aligned_ln;
	}

	public int read_ln() {
		return this.read_str.length();
	}

	public double alignedFraction() {
		return this.read_str.isEmpty() ? 0 : (double) this.aligned_ln/this.read_str.length();
	}

	/**
	 * Converts an aligner record, or returns <tt>null</tt> when the read has no
	 * reference position. Aligned read bases are those consumed by match, mismatch and
	 * insertion operators; clipped bases do not count.
	 */
	public static ReadAlignment samRecord(SAMRecord sam_rc) {
		if(sam_rc==null || sam_rc.getReadUnmappedFlag() ||
				SAMRecord.NO_ALIGNMENT_REFERENCE_NAME.equals(sam_rc.getReferenceName()) ||
				sam_rc.getCigar()==null || sam_rc.getCigar().isEmpty())
			return null;
		int aligned = 0;
		for(CigarElement cigar : sam_rc.getCigar().getCigarElements()) {
			CigarOperator op = cigar.getOperator();
			if(op.consumesReadBases() && op!=CigarOperator.SOFT_CLIP)
				aligned += cigar.getLength();
		}
		return new ReadAlignment(sam_rc.getReadName(),
				sam_rc.getReadString(),
				sam_rc.getAlignmentStart(),
				sam_rc.getAlignmentEnd()-sam_rc.getAlignmentStart()+1,
				aligned);
	}

	public static class StartComparator
	implements Comparator<ReadAlignment> {
		@Override
		public int compare(ReadAlignment a1, ReadAlignment a2) {
			int c = Integer.compare(a1.start, a2.start);
			return c!=0 ? c : a1.read_id.compareTo(a2.read_id);
		}
	}

	@Override
	public String toString() {
		return this.read_id+"@"+this.start+"("+this.aligned_ln+"/"+this.read_ln()+")";
	}
}
