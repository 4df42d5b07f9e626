package gapcloser.ngs.external;

import java.io.File;
import java.util.Locale;

import com.google.common.base.Preconditions;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.Sequence;

/**
 * Duplicate marking and downsampling with samtools, indel realignment with
 * <tt>lofreq viterbi</tt>.
 */
public class SamtoolsProcessor implements AlignmentProcessor {

	private final WorkDirectory work;

	public SamtoolsProcessor(WorkDirectory work) {
		this.work = work;
	}

	@Override
	public AlignmentSet markDuplicates(Sequence reference, AlignmentSet alignments, String label) {
		final String in = bam(alignments);
		final String nsorted = work.path(label+".nsorted.bam");
		final String fixmate = work.path(label+".fixmate.bam");
		final String sorted = work.path(label+".fixmate.sorted.bam");
		final String out = work.path(label+".markdup.bam");
		work.run("samtools sort -n -o "+WorkDirectory.quote(nsorted)+" "+WorkDirectory.quote(in));
		work.run("samtools fixmate -m "+WorkDirectory.quote(nsorted)+" "+WorkDirectory.quote(fixmate));
		work.run("samtools sort -o "+WorkDirectory.quote(sorted)+" "+WorkDirectory.quote(fixmate));
		work.run("samtools markdup "+WorkDirectory.quote(sorted)+" "+WorkDirectory.quote(out));
		work.run("samtools index "+WorkDirectory.quote(out));
		return AlignmentSet.read(new File(out));
	}

	@Override
	public AlignmentSet realignIndels(Sequence reference, AlignmentSet alignments, String label) {
		final String in = bam(alignments);
		final String fa = work.writeReference(reference, label+".realign");
		final String viterbi = work.path(label+".viterbi.bam");
		final String out = work.path(label+".realigned.bam");
		work.run("samtools faidx "+WorkDirectory.quote(fa));
		work.run("lofreq viterbi -f "+WorkDirectory.quote(fa)+" -o "+WorkDirectory.quote(viterbi)+" "+WorkDirectory.quote(in));
		work.run("samtools sort -o "+WorkDirectory.quote(out)+" "+WorkDirectory.quote(viterbi));
		work.run("samtools index "+WorkDirectory.quote(out));
		return AlignmentSet.read(new File(out));
	}

	@Override
	public AlignmentSet downsample(AlignmentSet alignments, double fraction, String label) {
		if(fraction>=1) return alignments;
		final String out = work.path(label+".downsampled.bam");
		work.run(downsampleCommand(bam(alignments), out, fraction));
		work.run("samtools index "+WorkDirectory.quote(out));
		return AlignmentSet.read(new File(out));
	}

	static String downsampleCommand(String in, String out, double fraction) {
		// the integer part of -s is the seed, the fractional part the kept proportion
		return "samtools view -b -s "+String.format(Locale.ROOT, "%.4f", fraction)+
				" -o "+WorkDirectory.quote(out)+" "+WorkDirectory.quote(in);
	}

	static String bam(AlignmentSet alignments) {
		Preconditions.checkArgument(alignments.bam()!=null,
				"alignments are not backed by a BAM file");
		return alignments.bam().getPath();
	}
}
