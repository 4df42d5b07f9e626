package gapcloser.ngs.model;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import gapcloser.util.ConfigurationException;
import gapcloser.util.Constants;
import gapcloser.util.Utils;

/**
 * An immutable named nucleotide sequence. Novel bases are carried in lower case;
 * all searches ignore case. Operations that change the bases return a new instance.
 */
public class Sequence {

	private final String seq_sn; // sequence name
	private final String seq_str; // sequence string

	private final static Pattern seq_id = Pattern.compile("[A-Za-z0-9.]+");
	private final static Pattern nucleotides = Pattern.compile("[ACGTNacgtn]*");

	public Sequence(final String seq_sn,
			final String seq_str) {
		this.seq_sn = seq_sn;
		this.seq_str = seq_str;
	}

	public String seq_sn() {
		return this.seq_sn;
	}

	public String seq_str() {
		return this.seq_str;
	}

	public int seq_ln() {
		return this.seq_str.length();
	}

	/**
	 * First run of exactly {@value gapcloser.util.Constants#GAP_LENGTH} placeholder
	 * bases, or <tt>null</tt> when the sequence carries no gap. Longer or shorter runs
	 * of N are ordinary ambiguous bases.
	 */
	public GapRun gapRun() {
		int n = this.seq_str.length();
		int i = 0;
		while(i<n) {
			if(Character.toUpperCase(this.seq_str.charAt(i))!=Constants.GAP_BASE) {
				i++;
				continue;
			}
			int j = i;
			while(j<n && Character.toUpperCase(this.seq_str.charAt(j))==Constants.GAP_BASE) j++;
			if(j-i==Constants.GAP_LENGTH) return new GapRun(i);
			i = j;
		}
		return null;
	}

	public int countGapRuns() {
		int count = 0;
		Sequence rest = this;
		GapRun gap;
		while( (gap=rest.gapRun())!=null ) {
			count++;
			rest = new Sequence(this.seq_sn, rest.seq_str.substring(gap.end()));
		}
		return count;
	}

	/**
	 * Counts case-insensitive occurrences of a pattern, scanning left to right and
	 * resuming after each match.
	 */
	public int countOccurrences(String pattern) {
		if(StringUtils.isEmpty(pattern)) return 0;
		return StringUtils.countMatches(this.seq_str.toUpperCase(), pattern.toUpperCase());
	}

	/**
	 * Replaces the first occurrence of <tt>target</tt> (ignoring case).
	 *
	 * @throws NoSuchElementException if <tt>target</tt> does not occur
	 */
	public Sequence replace(String target, String replacement) {
		int i = StringUtils.indexOfIgnoreCase(this.seq_str, target);
		if(i<0) throw new NoSuchElementException("Pattern not found in "+this.seq_sn+": "+target);
		return new Sequence(this.seq_sn,
				this.seq_str.substring(0, i)+replacement+this.seq_str.substring(i+target.length()));
	}

	/**
	 * Bases in <tt>[from, to)</tt>, or <tt>null</tt> if the range runs off either end.
	 */
	public String slice(int from, int to) {
		if(from<0 || to>this.seq_str.length() || from>to) return null;
		return this.seq_str.substring(from, to);
	}

	public Sequence rename(String seq_sn) {
		return new Sequence(seq_sn, this.seq_str);
	}

	public Sequence withSequence(String seq_str) {
		return new Sequence(this.seq_sn, seq_str);
	}

	public String formatOutput() {
		return formatOutput(this.seq_sn, this.seq_str);
	}

	public static String formatOutput(String seq_sn,
			String seq_str) {
		StringBuilder os = new StringBuilder();
		os.append(">");
		os.append(seq_sn);
		os.append("\n");
		os.append(seq_str);
		os.append("\n");
		return os.toString();
	}

	public static List<Sequence> parseFastaFileAsList(String seq_fa) throws IOException {
		final List<Sequence> sequences = new ArrayList<Sequence>();
		try (BufferedReader br_fa = Utils.getBufferedReader(seq_fa)) {
			StringBuilder str_buf = new StringBuilder();
			String line = br_fa.readLine();
			String seq_sn = null;
			while(line!=null) {
				if(line.startsWith(">"))
					seq_sn = line.substring(1).trim().split("\\s+")[0];

				str_buf.setLength(0);
				while( (line=br_fa.readLine())!=null && !line.startsWith(">") )
					str_buf.append(line.trim());

				sequences.add(new Sequence(seq_sn, str_buf.toString()));
			}
		}
		return sequences;
	}

	/**
	 * Reads a gapped reference: one header line, one sequence line, and exactly one
	 * gap run in the sequence.
	 */
	public static Sequence parseReference(String seq_fa) {
		final List<String> lines = new ArrayList<String>();
		try (BufferedReader br_fa = Utils.getBufferedReader(seq_fa)) {
			String line;
			while( (line=br_fa.readLine())!=null )
				if(!line.trim().isEmpty()) lines.add(line.trim());
		} catch (IOException e) {
			throw new ConfigurationException("Could not read reference "+seq_fa, e);
		}
		if(lines.size()!=2 || !lines.get(0).startsWith(">"))
			throw new ConfigurationException("Reference "+seq_fa+
					" must contain exactly one header line and one sequence line.");
		String seq_sn = lines.get(0).substring(1);
		if(!seq_id.matcher(seq_sn).matches())
			throw new ConfigurationException("Invalid reference identifier \""+seq_sn+
					"\": only letters, digits and periods are allowed.");
		String seq_str = lines.get(1);
		if(!nucleotides.matcher(seq_str).matches())
			throw new ConfigurationException("Reference "+seq_sn+" contains characters other than A, C, G, T and N.");
		Sequence reference = new Sequence(seq_sn, seq_str);
		int gaps = reference.countGapRuns();
		if(gaps!=1)
			throw new ConfigurationException("Reference "+seq_sn+" must contain exactly one run of "+
					Constants.GAP_LENGTH+" N bases marking the gap, found "+gaps+".");
		return reference;
	}

	public static void writeFastaFile(File out, Sequence... sequences) throws IOException {
		try (BufferedWriter bw = Utils.getBufferedWriter(out)) {
			for(Sequence sequence : sequences)
				bw.write(sequence.formatOutput());
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Sequence)) return false;
		Sequence that = (Sequence) o;
		return this.seq_str.equals(that.seq_str) &&
				(this.seq_sn==null ? that.seq_sn==null : this.seq_sn.equals(that.seq_sn));
	}

	@Override
	public int hashCode() {
		return 31*(this.seq_sn==null ? 0 : this.seq_sn.hashCode())+this.seq_str.hashCode();
	}

	@Override
	public String toString() {
		return this.seq_sn+"("+this.seq_ln()+"bp)";
	}
}
