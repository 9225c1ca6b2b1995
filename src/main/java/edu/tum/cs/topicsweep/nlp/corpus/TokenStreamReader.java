package edu.tum.cs.topicsweep.nlp.corpus;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads precomputed token data in tab separated form. The first line is the header
 * <code>document_id, surface_form, lemma, part_of_speech</code>; every further non-empty line holds one token in
 * stream order.
 */
public class TokenStreamReader {

	private static final Logger logger = Logger.getLogger(TokenStreamReader.class.getName());

	public static final String[] header = { "document_id", "surface_form", "lemma", "part_of_speech" };
	private static final String separator = "\t";

	public static List<Token> readTokens(File f) throws IOException {
		InputStream is = new FileInputStream(f);
		try {
			List<Token> tokens = readTokens(is);
			logger.info("Read " + tokens.size() + " tokens from '" + f.getPath() + "'");
			return tokens;
		} finally {
			is.close();
		}
	}

	public static List<Token> readTokens(InputStream is) throws IOException {
		List<Token> tokens = new ArrayList<Token>();
		BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		int lineNo = 0;
		boolean headerSeen = false;
		String line;
		while ((line = reader.readLine()) != null) {
			lineNo++;
			if (line.trim().length() == 0)
				continue;

			String[] fields = line.split(separator, -1);
			if (!headerSeen) {
				checkHeader(fields, lineNo);
				headerSeen = true;
				continue;
			}
			if (fields.length != header.length)
				throw new IOException("line " + lineNo + ": expected " + header.length + " fields, found " +
						fields.length);
			if (fields[0].length() == 0)
				throw new IOException("line " + lineNo + ": empty document id");
			tokens.add(new Token(fields[0], fields[1], fields[2], fields[3]));
		}
		if (!headerSeen)
			throw new IOException("token data is empty, header missing");
		return tokens;
	}

	private static void checkHeader(String[] fields, int lineNo) throws IOException {
		boolean valid = (fields.length == header.length);
		for (int i = 0; valid && (i < header.length); i++)
			valid = header[i].equalsIgnoreCase(fields[i].trim());
		if (!valid)
			throw new IOException("line " + lineNo + ": invalid header, expected " + String.join(separator, header));
	}

}
