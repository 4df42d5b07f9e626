package gapcloser.ngs.model;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Variants called against one reference, with the (compressed, indexed) VCF they
 * were loaded from when they come from an external caller.
 */
public class VariantCalls {

	private final File vcf;
	private final List<VariantCall> calls;

	public VariantCalls(File vcf, List<VariantCall> calls) {
		this.vcf = vcf;
		this.calls = Collections.unmodifiableList(new ArrayList<VariantCall>(calls));
	}

	public VariantCalls(List<VariantCall> calls) {
		this(null, calls);
	}

	public File vcf() {
		return this.vcf;
	}

	public List<VariantCall> calls() {
		return this.calls;
	}

	public int size() {
		return this.calls.size();
	}
}
