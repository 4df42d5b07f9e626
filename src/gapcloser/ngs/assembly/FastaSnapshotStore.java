package gapcloser.ngs.assembly;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.ngs.model.Sequence;
import gapcloser.util.CollaboratorFailureException;
import gapcloser.util.ConfigurationException;
import gapcloser.util.Utils;

/**
 * Snapshots written as <tt>&lt;sample&gt;.iter&lt;N&gt;.fa</tt> into a directory.
 * Snapshots already in the directory are loaded when the store is opened.
 */
public class FastaSnapshotStore extends MemorySnapshotStore {

	private final static Logger myLogger = LogManager.getLogger(FastaSnapshotStore.class);

	private final File dir;
	private final String sample;

	public FastaSnapshotStore(File dir, String sample) {
		this.dir = dir;
		this.sample = sample;
		Utils.makeOutputDir(dir);
		this.load();
	}

	public File file(int iteration) {
		return new File(this.dir, this.sample+".iter"+iteration+".fa");
	}

	@Override
	public void save(Snapshot snapshot) {
		try {
			Sequence.writeFastaFile(this.file(snapshot.iteration()), snapshot.sequence());
		} catch (IOException e) {
			throw new CollaboratorFailureException("Could not write snapshot "+
					this.file(snapshot.iteration()), e);
		}
		super.save(snapshot);
	}

	private void load() {
		final Pattern name = Pattern.compile(Pattern.quote(this.sample)+"\\.iter([0-9]+)\\.fa");
		File[] files = this.dir.listFiles();
		if(files==null) return;
		for(File f : files) {
			Matcher m = name.matcher(f.getName());
			if(!m.matches()) continue;
			try {
				List<Sequence> sequences = Sequence.parseFastaFileAsList(f.getPath());
				if(sequences.size()!=1)
					throw new ConfigurationException("Snapshot "+f+" must hold exactly one sequence.");
				super.save(new Snapshot(Integer.parseInt(m.group(1)), sequences.get(0)));
			} catch (IOException e) {
				throw new ConfigurationException("Could not read snapshot "+f, e);
			}
		}
		if(this.latest()!=null)
			myLogger.info("Found "+this.snapshots().size()+" snapshots of "+this.sample+
					" in "+this.dir+", latest iteration "+this.latest().iteration());
	}
}
