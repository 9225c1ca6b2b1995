package edu.tum.cs.topicsweep.nlp.vocabulary;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public class StopWords {

	private static final Logger logger = Logger.getLogger(StopWords.class.getName());

	/**
	 * Loads the bundled stop word list for the given language and adds the words of the dataset-specific list
	 * <code>stopWords-&lt;lang&gt;.txt</code> in dataPath, if present. All words are lower-cased.
	 */
	public static Set<String> load(String lang, String dataPath) throws IOException {
		String resource = "/data/stopWords-" + lang + ".txt";
		InputStream is = StopWords.class.getResourceAsStream(resource);
		if (is == null)
			throw new IOException("no stop word list for language '" + lang + "'");
		Set<String> stopWords = loadWordList(is);

		if (dataPath != null) {
			File f = new File(dataPath, "stopWords-" + lang + ".txt");
			if (f.isFile()) {
				try {
					stopWords.addAll(loadWordList(new FileInputStream(f)));
				} catch (IOException ex) {
					logger.log(Level.WARNING, "could not load dataset-specific stop words from '" + f.getPath() + "'",
							ex);
				}
			}
		}
		logger.fine(stopWords.size() + " stop words for language '" + lang + "'");
		return stopWords;
	}

	/** Reads one word per line; empty lines and lines starting with '#' are skipped. Closes the stream. */
	public static Set<String> loadWordList(InputStream is) throws IOException {
		Set<String> words = new HashSet<String>();
		BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		try {
			String line;
			while ((line = reader.readLine()) != null) {
				line = line.trim();
				if ((line.length() > 0) && !line.startsWith("#"))
					words.add(line.toLowerCase(Locale.ROOT));
			}
		} finally {
			reader.close();
		}
		return words;
	}

}
