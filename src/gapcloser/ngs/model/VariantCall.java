package gapcloser.ngs.model;

/**
 * A called difference between the reads and the reference at a 1-based position.
 */
public class VariantCall {

	private final int position;
	private final String ref;
	private final String alt;

	public VariantCall(int position, String ref, String alt) {
		this.position = position;
		this.ref = ref;
		this.alt = alt;
	}

	public int position() {
		return this.position;
	}

	public String ref() {
		return this.ref;
	}

	public String alt() {
		return this.alt;
	}

	@Override
	public String toString() {
		return this.position+":"+this.ref+">"+this.alt;
	}
}
