package gapcloser.ngs.external;

import java.io.File;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.PhasedAlignments;
import gapcloser.ngs.model.Sequence;

/**
 * Two-haplotype phasing with <tt>samtools phase</tt>, which writes the reads of each
 * haplotype to <tt>prefix.0.bam</tt> and <tt>prefix.1.bam</tt>.
 */
public class SamtoolsPhaser implements Phaser {

	private final static Logger myLogger = LogManager.getLogger(SamtoolsPhaser.class);

	private final WorkDirectory work;

	public SamtoolsPhaser(WorkDirectory work) {
		this.work = work;
	}

	@Override
	public PhasedAlignments phase(Sequence reference, AlignmentSet alignments, String label) {
		final String prefix = work.path(label+".phase");
		work.run("samtools phase -b "+WorkDirectory.quote(prefix)+" "+WorkDirectory.quote(SamtoolsProcessor.bam(alignments))+" > "+WorkDirectory.quote(prefix+".txt"));
		final File bam0 = new File(prefix+".0.bam");
		final File bam1 = new File(prefix+".1.bam");
		if(!bam0.exists() || !bam1.exists()) {
			myLogger.info(label+": phasing produced no haplotype files, reads left unseparated");
			return PhasedAlignments.unseparated(alignments);
		}
		work.run("samtools sort -o "+WorkDirectory.quote(prefix+".0.sorted.bam")+" "+WorkDirectory.quote(bam0.getPath())+" && samtools index "+WorkDirectory.quote(prefix+".0.sorted.bam"));
		work.run("samtools sort -o "+WorkDirectory.quote(prefix+".1.sorted.bam")+" "+WorkDirectory.quote(bam1.getPath())+" && samtools index "+WorkDirectory.quote(prefix+".1.sorted.bam"));
		AlignmentSet bin0 = AlignmentSet.read(new File(prefix+".0.sorted.bam"));
		AlignmentSet bin1 = AlignmentSet.read(new File(prefix+".1.sorted.bam"));
		if(bin0.isEmpty() || bin1.isEmpty()) {
			myLogger.info(label+": reads could not be split into two haplotypes");
			return PhasedAlignments.unseparated(alignments);
		}
		myLogger.info(label+": haplotype 0 "+bin0.size()+" reads, haplotype 1 "+bin1.size()+" reads");
		return PhasedAlignments.separated(bin0, bin1);
	}
}
