package gapcloser.ngs.external;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.Sequence;
import gapcloser.ngs.model.VariantCall;
import gapcloser.ngs.model.VariantCalls;
import gapcloser.util.CollaboratorFailureException;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;

/**
 * Variant calling with freebayes; calls are written into the reference with
 * <tt>bcftools consensus</tt>.
 */
public class FreebayesCaller implements VariantCaller {

	private final static Logger myLogger = LogManager.getLogger(FreebayesCaller.class);

	private final WorkDirectory work;

	public FreebayesCaller(WorkDirectory work) {
		this.work = work;
	}

	@Override
	public VariantCalls call(Sequence reference, AlignmentSet alignments, String label) {
		final String fa = work.writeReference(reference, label+".call");
		final String vcf = work.path(label+".vcf");
		work.run("samtools faidx "+WorkDirectory.quote(fa));
		work.run("freebayes -f "+WorkDirectory.quote(fa)+" "+WorkDirectory.quote(SamtoolsProcessor.bam(alignments))+" > "+WorkDirectory.quote(vcf));
		work.run("bgzip -f "+WorkDirectory.quote(vcf));
		work.run("tabix -f -p vcf "+WorkDirectory.quote(vcf+".gz"));
		VariantCalls calls = read(new File(vcf+".gz"));
		myLogger.info(label+": "+calls.size()+" variants called");
		return calls;
	}

	@Override
	public Sequence apply(Sequence reference, VariantCalls variants, String label) {
		if(variants.size()==0 || variants.vcf()==null) return reference;
		final String fa = work.writeReference(reference, label+".apply");
		final String out = work.path(label+".corrected.fa");
		work.run("bcftools consensus -f "+WorkDirectory.quote(fa)+" -o "+WorkDirectory.quote(out)+" "+WorkDirectory.quote(variants.vcf().getPath()));
		try {
			List<Sequence> corrected = Sequence.parseFastaFileAsList(out);
			if(corrected.size()!=1)
				throw new CollaboratorFailureException("Expected one corrected sequence in "+out+
						", found "+corrected.size());
			return corrected.get(0).rename(reference.seq_sn());
		} catch (IOException e) {
			throw new CollaboratorFailureException("Could not read corrected sequence "+out, e);
		}
	}

	static VariantCalls read(File vcf) {
		final List<VariantCall> calls = new ArrayList<VariantCall>();
		try (VCFFileReader reader = new VCFFileReader(vcf, false)) {
			for(VariantContext vc : reader) {
				if(vc.getAlternateAlleles().isEmpty()) continue;
				calls.add(new VariantCall(vc.getStart(),
						vc.getReference().getBaseString(),
						vc.getAlternateAllele(0).getBaseString()));
			}
		}
		return new VariantCalls(vcf, calls);
	}
}
