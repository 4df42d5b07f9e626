package gapcloser.ngs.external;

import java.io.File;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.Sequence;

/**
 * Paired-end alignment with <tt>bwa mem</tt>, sorted and indexed by samtools.
 */
public class BwaAligner implements Aligner {

	private final WorkDirectory work;
	private final String read1;
	private final String read2;
	private final int threads;

	public BwaAligner(WorkDirectory work, String read1, String read2, int threads) {
		this.work = work;
		this.read1 = read1;
		this.read2 = read2;
		this.threads = threads;
	}

	@Override
	public AlignmentSet align(Sequence reference, String label) {
		final String fa = work.writeReference(reference, label);
		final String bam = work.path(label+".bam");
		work.run("bwa index "+WorkDirectory.quote(fa));
		work.run(this.alignCommand(fa, bam));
		work.run("samtools index "+WorkDirectory.quote(bam));
		return AlignmentSet.read(new File(bam));
	}

	String alignCommand(String fa, String bam) {
		return "set -o pipefail; bwa mem -t "+threads+" "+WorkDirectory.quote(fa)+" "+WorkDirectory.quote(read1)+" "+WorkDirectory.quote(read2)+
				" | samtools sort -@ "+threads+" -o "+WorkDirectory.quote(bam)+" -";
	}
}
