package gapcloser.ngs.model;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.apache.commons.math3.stat.StatUtils;

import gapcloser.util.CollaboratorFailureException;
import gapcloser.util.Utils;

/**
 * Read depth per 1-based reference position. Positions without coverage are absent
 * rather than zero, so the mean depth is taken over reported positions only.
 */
public class CoverageProfile {

	private final NavigableMap<Integer, Integer> depth;

	public CoverageProfile(Map<Integer, Integer> depth) {
		this.depth = Collections.unmodifiableNavigableMap(new TreeMap<Integer, Integer>(depth));
	}

	public static CoverageProfile empty() {
		return new CoverageProfile(Collections.<Integer, Integer>emptyMap());
	}

	/** Depth at a position, zero when not reported. */
	public int depth(int position) {
		Integer d = this.depth.get(position);
		return d==null ? 0 : d;
	}

	public boolean isReported(int position) {
		return this.depth.containsKey(position);
	}

	/** Last reported position, zero for an empty profile. */
	public int lastPosition() {
		return this.depth.isEmpty() ? 0 : this.depth.lastKey();
	}

	public int size() {
		return this.depth.size();
	}

	public double mean() {
		if(this.depth.isEmpty()) return 0;
		double[] values = new double[this.depth.size()];
		int i = 0;
		for(int d : this.depth.values()) values[i++] = d;
		return StatUtils.mean(values);
	}

	/**
	 * Parses tab separated <tt>name position depth</tt> lines as written by
	 * <tt>samtools depth</tt>. Zero depths are dropped.
	 */
	public static CoverageProfile parse(BufferedReader br) throws IOException {
		final Map<Integer, Integer> depth = new TreeMap<Integer, Integer>();
		String line;
		String[] s;
		while( (line=br.readLine())!=null ) {
			if(line.isEmpty() || line.startsWith("#")) continue;
			s = line.split("\\s+");
			if(s.length<3)
				throw new IOException("Malformed depth line: "+line);
			int d = Integer.parseInt(s[2]);
			if(d>0) depth.put(Integer.parseInt(s[1]), d);
		}
		return new CoverageProfile(depth);
	}

	public static CoverageProfile parse(String depth_file) {
		try (BufferedReader br = Utils.getBufferedReader(depth_file)) {
			return parse(br);
		} catch (IOException | NumberFormatException e) {
			throw new CollaboratorFailureException("Could not read depth file "+depth_file, e);
		}
	}
}
