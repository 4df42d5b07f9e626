package gapcloser.ngs.model;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.util.CollaboratorFailureException;
import gapcloser.util.Constants;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordIterator;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;

/**
 * Alignments of the reads against one reference. Alignments produced by an external
 * program also carry the BAM file they were read from, so the next program in the
 * chain can consume it directly.
 */
public class AlignmentSet {

	private final static Logger myLogger = LogManager.getLogger(AlignmentSet.class);

	private final static SamReaderFactory factory =
			SamReaderFactory.makeDefault()
			.validationStringency(ValidationStringency.SILENT);

	private final File bam;
	private final List<ReadAlignment> records;

	public AlignmentSet(File bam, List<ReadAlignment> records) {
		this.bam = bam;
		this.records = Collections.unmodifiableList(new ArrayList<ReadAlignment>(records));
	}

	public AlignmentSet(List<ReadAlignment> records) {
		this(null, records);
	}

	public static AlignmentSet empty() {
		return new AlignmentSet(Collections.<ReadAlignment>emptyList());
	}

	/** Backing BAM file, <tt>null</tt> for alignments held in memory only. */
	public File bam() {
		return this.bam;
	}

	public List<ReadAlignment> records() {
		return this.records;
	}

	public int size() {
		return this.records.size();
	}

	public boolean isEmpty() {
		return this.records.isEmpty();
	}

	/**
	 * Loads a BAM/SAM file, dropping reads without a reference position and reads
	 * aligned over less than half their length. Secondary, supplementary and
	 * duplicate-flagged records are skipped.
	 */
	public static AlignmentSet read(File bam) {
		final List<ReadAlignment> records = new ArrayList<ReadAlignment>();
		int unmapped = 0, partial = 0;
		try (SamReader in1 = factory.open(bam);
				SAMRecordIterator iter1 = in1.iterator()) {
			while(iter1.hasNext()) {
				SAMRecord sam_rc = iter1.next();
				if(sam_rc.isSecondaryOrSupplementary() || sam_rc.getDuplicateReadFlag()) continue;
				ReadAlignment record = ReadAlignment.samRecord(sam_rc);
				if(record==null) {
					unmapped++;
				} else if(record.alignedFraction()<Constants.MIN_ALIGNED_FRACTION) {
					partial++;
				} else {
					records.add(record);
				}
			}
		} catch (IOException e) {
			throw new CollaboratorFailureException("Could not read alignments from "+bam, e);
		}
		myLogger.info(bam.getName()+": "+records.size()+" alignments kept, "+
				unmapped+" unplaced and "+partial+" partially aligned reads dropped");
		return new AlignmentSet(bam, records);
	}
}
