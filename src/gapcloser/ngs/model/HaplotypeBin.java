package gapcloser.ngs.model;

/**
 * Haplotype of origin assigned to reads by phasing. {@link #UNSEPARATED} holds all
 * reads when phasing could not split them.
 */
public enum HaplotypeBin {
	ZERO("0"),
	ONE("1"),
	UNSEPARATED("2");

	private final String label;

	HaplotypeBin(String label) {
		this.label = label;
	}

	public String label() {
		return this.label;
	}
}
