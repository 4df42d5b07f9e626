package gapcloser.ngs.assembly;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import gapcloser.ngs.external.MultipleSequenceAligner;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.Constants;

/**
 * Turns an anchor read set into a single candidate extension. An empty read set
 * gives an empty consensus, meaning no extension is available.
 */
public class ConsensusBuilder {

	private final MultipleSequenceAligner msa;

	public ConsensusBuilder(MultipleSequenceAligner msa) {
		this.msa = msa;
	}

	public String build(List<Sequence> reads, String label) {
		if(reads.isEmpty()) return "";
		String consensus = msa.consensus(reads, label);
		if(consensus==null) return "";
		return StringUtils.remove(consensus, Constants.AMBIGUITY_PLACEHOLDER);
	}
}
