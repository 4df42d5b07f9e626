package gapcloser.ngs.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Alignments split by haplotype. Either both {@link HaplotypeBin#ZERO} and
 * {@link HaplotypeBin#ONE} are present, or a single {@link HaplotypeBin#UNSEPARATED}
 * bin holds everything.
 */
public class PhasedAlignments {

	private final Map<HaplotypeBin, AlignmentSet> bins;

	private PhasedAlignments(Map<HaplotypeBin, AlignmentSet> bins) {
		this.bins = Collections.unmodifiableMap(bins);
	}

	public static PhasedAlignments separated(AlignmentSet bin0, AlignmentSet bin1) {
		Map<HaplotypeBin, AlignmentSet> bins = new EnumMap<HaplotypeBin, AlignmentSet>(HaplotypeBin.class);
		bins.put(HaplotypeBin.ZERO, bin0);
		bins.put(HaplotypeBin.ONE, bin1);
		return new PhasedAlignments(bins);
	}

	public static PhasedAlignments unseparated(AlignmentSet all) {
		Map<HaplotypeBin, AlignmentSet> bins = new EnumMap<HaplotypeBin, AlignmentSet>(HaplotypeBin.class);
		bins.put(HaplotypeBin.UNSEPARATED, all);
		return new PhasedAlignments(bins);
	}

	/** Bins in label order. */
	public Map<HaplotypeBin, AlignmentSet> bins() {
		return this.bins;
	}

	/** True when reads were split and bin 1 received any of them. */
	public boolean isSeparated() {
		AlignmentSet bin1 = this.bins.get(HaplotypeBin.ONE);
		return bin1!=null && !bin1.isEmpty();
	}

	/**
	 * The bin that drives extension: the larger of the two haplotypes, or the
	 * unseparated bin.
	 */
	public HaplotypeBin dominant() {
		if(!this.isSeparated()) return this.bins.containsKey(HaplotypeBin.UNSEPARATED) ?
				HaplotypeBin.UNSEPARATED : HaplotypeBin.ZERO;
		return this.bins.get(HaplotypeBin.ONE).size()>this.bins.get(HaplotypeBin.ZERO).size() ?
				HaplotypeBin.ONE : HaplotypeBin.ZERO;
	}

	public AlignmentSet get(HaplotypeBin bin) {
		return this.bins.get(bin);
	}
}
