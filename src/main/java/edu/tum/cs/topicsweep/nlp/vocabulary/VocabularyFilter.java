package edu.tum.cs.topicsweep.nlp.vocabulary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.util.ExperimentConfiguration;

/**
 * Defines the controlled vocabulary by dropping stop words, punctuation, numeric-like and very short tokens. There
 * are two presets with different normalization: {@link #forDocumentTermMatrix} strips all non-alphabetic characters
 * before the length check, {@link #forRawFrequency} keeps them but drops tokens containing digits or percent signs.
 */
public class VocabularyFilter {

	private static final Logger logger = Logger.getLogger(VocabularyFilter.class.getName());

	public static final String PROP_LANGUAGE = "language";
	public static final String PROP_MIN_LENGTH = "minLength";
	public static final String PROP_PUNCTUATION_TAGS = "punctuationTags";

	public static final int defaultMinLength = 3;
	public static final String defaultPunctuationTags = "PUNCT";

	private static final Pattern NonAlphabetic = Pattern.compile("[^\\p{IsAlphabetic}]+");
	private static final Pattern NumericLike = Pattern.compile(".*[\\p{Nd}%].*");

	private final String name;
	private final Set<String> stopWords;
	private final Set<String> punctuationTags;
	private final int minLength;
	private final boolean stripNonAlphabetic;
	private final boolean dropNumericLike;

	public VocabularyFilter(String name, Collection<String> stopWords, Collection<String> punctuationTags,
			int minLength, boolean stripNonAlphabetic, boolean dropNumericLike) {
		if (minLength < 1)
			throw new IllegalArgumentException("minimum length must be positive, got " + minLength);
		this.name = name;
		this.stopWords = lowerCase(stopWords);
		this.punctuationTags = new HashSet<String>(punctuationTags);
		this.minLength = minLength;
		this.stripNonAlphabetic = stripNonAlphabetic;
		this.dropNumericLike = dropNumericLike;
	}

	/** preset for building document-term matrices and TF-IDF tables */
	public static VocabularyFilter forDocumentTermMatrix(Collection<String> stopWords,
			Collection<String> punctuationTags, int minLength) {
		return new VocabularyFilter("document-term", stopWords, punctuationTags, minLength, true, false);
	}

	/** preset for coarse corpus-wide frequency views */
	public static VocabularyFilter forRawFrequency(Collection<String> stopWords, Collection<String> punctuationTags,
			int minLength) {
		return new VocabularyFilter("raw-frequency", stopWords, punctuationTags, minLength, false, true);
	}

	public static VocabularyFilter forDocumentTermMatrix(ExperimentConfiguration cfg) throws IOException {
		String prefix = "DocumentTermFilter.";
		return forDocumentTermMatrix(loadStopWords(cfg, prefix),
				cfg.getStringSetProperty(prefix + PROP_PUNCTUATION_TAGS, defaultPunctuationTags),
				cfg.getIntProperty(prefix + PROP_MIN_LENGTH, defaultMinLength));
	}

	public static VocabularyFilter forRawFrequency(ExperimentConfiguration cfg) throws IOException {
		String prefix = "RawFrequencyFilter.";
		return forRawFrequency(loadStopWords(cfg, prefix),
				cfg.getStringSetProperty(prefix + PROP_PUNCTUATION_TAGS, defaultPunctuationTags),
				cfg.getIntProperty(prefix + PROP_MIN_LENGTH, defaultMinLength));
	}

	private static Set<String> loadStopWords(ExperimentConfiguration cfg, String prefix) throws IOException {
		String lang = cfg.getProperty(prefix + PROP_LANGUAGE, "en");
		String dataPath = cfg.getProperty(ExperimentConfiguration.PROP_DATA_PATH, ".");
		return StopWords.load(lang, dataPath);
	}

	private static Set<String> lowerCase(Collection<String> words) {
		Set<String> lower = new HashSet<String>(words.size());
		for (String word : words)
			lower.add(word.toLowerCase(Locale.ROOT));
		return lower;
	}

	/** @return the normalized lemma of the token, or null if the token is not part of the vocabulary */
	public String normalize(Token token) {
		if (punctuationTags.contains(token.getPartOfSpeech()))
			return null;

		String lemma = token.getLemma().toLowerCase(Locale.ROOT);
		if (stopWords.contains(lemma))
			return null;
		if (dropNumericLike && (NumericLike.matcher(lemma).matches() ||
				NumericLike.matcher(token.getSurfaceForm()).matches()))
			return null;
		if (stripNonAlphabetic) {
			lemma = NonAlphabetic.matcher(lemma).replaceAll("");
			if (stopWords.contains(lemma))
				return null;
		}
		if (lemma.length() < minLength)
			return null;
		return lemma;
	}

	public boolean accepts(Token token) {
		return (normalize(token) != null);
	}

	/** @return the surviving tokens in stream order, each carrying its normalized lemma */
	public List<Token> filter(Iterable<Token> tokens) {
		List<Token> filtered = new ArrayList<Token>();
		int numTokens = 0;
		for (Token token : tokens) {
			numTokens++;
			String lemma = normalize(token);
			if (lemma != null)
				filtered.add(lemma.equals(token.getLemma()) ? token : token.withLemma(lemma));
		}
		logger.fine("filter '" + name + "' kept " + filtered.size() + " of " + numTokens + " tokens");
		return filtered;
	}

	/**
	 * Hash over all settings including the loaded stop words, so that a changed dataset-specific stop word file
	 * changes the fingerprint even if the configuration does not.
	 */
	public String fingerprint() {
		Hasher hasher = Hashing.sha256().newHasher();
		hasher.putString(name, StandardCharsets.UTF_8).putChar('\0');
		hasher.putInt(minLength).putBoolean(stripNonAlphabetic).putBoolean(dropNumericLike);
		for (String tag : new TreeSet<String>(punctuationTags))
			hasher.putString(tag, StandardCharsets.UTF_8).putChar('\0');
		hasher.putChar('\n');
		for (String word : new TreeSet<String>(stopWords))
			hasher.putString(word, StandardCharsets.UTF_8).putChar('\0');
		return hasher.hash().toString();
	}

	public String getName() {
		return name;
	}

	public Set<String> getStopWords() {
		return Collections.unmodifiableSet(stopWords);
	}

	public int getMinLength() {
		return minLength;
	}

	public boolean isStrippingNonAlphabetic() {
		return stripNonAlphabetic;
	}

	public boolean isDroppingNumericLike() {
		return dropNumericLike;
	}

}
