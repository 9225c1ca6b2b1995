package edu.tum.cs.topicsweep.nlp.tfidf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.nlp.vocabulary.VocabularyFilter;

public class FrequencyAggregator {

	private static final Logger logger = Logger.getLogger(FrequencyAggregator.class.getName());

	/**
	 * Counts an already filtered token stream. Only documents with at least one token appear in the result.
	 */
	public static TermFrequencies aggregate(Iterable<Token> filteredTokens) {
		Map<String, Integer> wordCounts = new LinkedHashMap<String, Integer>();
		Map<String, SortedMap<String, Integer>> termCounts = new LinkedHashMap<String, SortedMap<String, Integer>>();
		for (Token token : filteredTokens)
			addToken(wordCounts, termCounts, token);
		return new TermFrequencies(wordCounts, termCounts);
	}

	/**
	 * Filters and counts a raw token stream. Every document of the raw stream is declared, so documents whose tokens
	 * are all removed by the filter are kept with a word count of zero.
	 */
	public static TermFrequencies aggregate(Iterable<Token> rawTokens, VocabularyFilter filter) {
		Map<String, Integer> wordCounts = new LinkedHashMap<String, Integer>();
		Map<String, SortedMap<String, Integer>> termCounts = new LinkedHashMap<String, SortedMap<String, Integer>>();
		for (Token token : rawTokens) {
			if (!wordCounts.containsKey(token.getDocumentId()))
				wordCounts.put(token.getDocumentId(), 0);
			String lemma = filter.normalize(token);
			if (lemma != null)
				addToken(wordCounts, termCounts, token.withLemma(lemma));
		}

		TermFrequencies freq = new TermFrequencies(wordCounts, termCounts);
		List<String> empty = freq.getEmptyDocumentIds();
		logger.info("filter '" + filter.getName() + "': " + freq.countTokens() + " tokens in " + freq.size() +
				" documents, " + empty.size() + " documents without surviving tokens");
		if (!empty.isEmpty())
			logger.fine("documents without surviving tokens: " + empty);
		return freq;
	}

	private static void addToken(Map<String, Integer> wordCounts, Map<String, SortedMap<String, Integer>> termCounts,
			Token token) {
		String documentId = token.getDocumentId();
		Integer n = wordCounts.get(documentId);
		wordCounts.put(documentId, (n != null) ? n + 1 : 1);

		SortedMap<String, Integer> counts = termCounts.get(documentId);
		if (counts == null) {
			counts = new TreeMap<String, Integer>();
			termCounts.put(documentId, counts);
		}
		Integer c = counts.get(token.getLemma());
		counts.put(token.getLemma(), (c != null) ? c + 1 : 1);
	}

}
