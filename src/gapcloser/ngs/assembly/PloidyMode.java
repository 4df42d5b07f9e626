package gapcloser.ngs.assembly;

/**
 * Whether the reads are treated as coming from one haplotype or two.
 */
public enum PloidyMode {
	/** One haplotype: no duplicate marking or phasing while extending. */
	HOMOZYGOUS,
	/** Two haplotypes: alignments are cleaned, downsampled and phased every iteration. */
	HETEROZYGOUS
}
