package gapcloser.ngs.external;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import gapcloser.ngs.model.Sequence;
import gapcloser.util.CollaboratorFailureException;
import gapcloser.util.Constants;

/**
 * Gapped alignment with <tt>muscle</tt>, reduced to a consensus by plurality vote.
 */
public class MuscleAligner implements MultipleSequenceAligner {

	private final WorkDirectory work;

	public MuscleAligner(WorkDirectory work) {
		this.work = work;
	}

	@Override
	public String consensus(List<Sequence> sequences, String label) {
		if(sequences.isEmpty()) return "";
		if(sequences.size()==1) return sequences.get(0).seq_str();
		final File in = new File(work.path(label+".reads.fa"));
		final String out = work.path(label+".afa");
		final List<String> gapped = new ArrayList<String>();
		try {
			Sequence.writeFastaFile(in, sequences.toArray(new Sequence[sequences.size()]));
			work.run("muscle -in "+WorkDirectory.quote(in.getPath())+" -out "+WorkDirectory.quote(out)+" -quiet");
			for(Sequence aligned : Sequence.parseFastaFileAsList(out))
				gapped.add(aligned.seq_str());
		} catch (IOException e) {
			throw new CollaboratorFailureException("Multiple sequence alignment failed for "+label, e);
		}
		return plurality(gapped);
	}

	/**
	 * Column-wise plurality vote over a gapped alignment. A column where gaps outvote
	 * every base is dropped; a tie between bases yields the ambiguity placeholder.
	 */
	static String plurality(List<String> gapped) {
		if(gapped.isEmpty()) return "";
		int width = 0;
		for(String row : gapped) width = Math.max(width, row.length());
		final StringBuilder consensus = new StringBuilder(width);
		final char[] bases = new char[]{'A','C','G','T','N'};
		for(int c=0; c<width; c++) {
			int[] counts = new int[bases.length];
			int gaps = 0;
			for(String row : gapped) {
				char b = c<row.length() ? Character.toUpperCase(row.charAt(c)) : Constants.ALIGNMENT_GAP;
				int k = -1;
				for(int i=0; i<bases.length; i++) if(bases[i]==b) k = i;
				if(k<0) gaps++;
				else counts[k]++;
			}
			int best = 0, ties = 0;
			for(int i=1; i<counts.length; i++) {
				if(counts[i]>counts[best]) {
					best = i;
					ties = 0;
				} else if(counts[i]==counts[best]) {
					ties++;
				}
			}
			if(counts[best]==0 || gaps>counts[best]) continue;
			consensus.append(ties>0 ? Constants.AMBIGUITY_PLACEHOLDER : bases[best]);
		}
		return consensus.toString();
	}
}
