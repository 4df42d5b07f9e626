package gapcloser.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class Utils {

	private static final Logger myLogger = LogManager.getLogger(Utils.class);

	public static boolean makeOutputDir(String dir) {
		return makeOutputDir(new File(dir));
	}

	public static boolean makeOutputDir(File file) {
		if(!file.exists() || file.exists()&&!file.isDirectory()) {
			return file.mkdirs();
		} else {
			return false;
		}
	}

	public static void deleteDirectory(File file) {
		try {
			FileUtils.deleteDirectory(file);
		} catch (IOException e) {
			myLogger.warn("deleteDirectory: could not remove "+file+": "+e.getMessage());
		}
	}

	/**
	 * Opens a text file for reading, decompressing it on the fly when the name ends
	 * with {@code .gz}.
	 */
	public static BufferedReader getBufferedReader(String inSourceName) throws IOException {
		if (inSourceName.endsWith(".gz")) {
			return new BufferedReader(new InputStreamReader(
					new GZIPInputStream(new FileInputStream(inSourceName)), StandardCharsets.UTF_8));
		} else {
			return new BufferedReader(new InputStreamReader(
					new FileInputStream(inSourceName), StandardCharsets.UTF_8));
		}
	}

	public static BufferedWriter getBufferedWriter(File file) throws IOException {
		if (file.getName().endsWith(".gz")) {
			return new BufferedWriter(new OutputStreamWriter(
					new GZIPOutputStream(new FileOutputStream(file)), StandardCharsets.UTF_8));
		} else {
			return new BufferedWriter(new OutputStreamWriter(
					new FileOutputStream(file), StandardCharsets.UTF_8));
		}
	}

	public static boolean isReadableFile(String file) {
		if(file==null) return false;
		File f = new File(file);
		return f.isFile() && f.canRead();
	}
}
