package edu.tum.cs.topicsweep.nlp.tfidf;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Per-document term counts and filtered token totals. Documents keep the order in which they were declared, lemmas
 * of a document are ordered lexicographically. A document may be declared with a word count of zero; such
 * documents have no term counts and are reported by {@link #getEmptyDocumentIds()}.
 *
 * Instances are immutable; the restricting methods return new instances.
 */
public class TermFrequencies implements Serializable {

	private static final long serialVersionUID = 8106946364004718355L;

	private final ImmutableMap<String, Integer> wordCounts;
	private final ImmutableMap<String, ImmutableSortedMap<String, Integer>> termCounts;

	TermFrequencies(Map<String, Integer> wordCounts, Map<String, ? extends SortedMap<String, Integer>> termCounts) {
		this.wordCounts = ImmutableMap.copyOf(wordCounts);
		ImmutableMap.Builder<String, ImmutableSortedMap<String, Integer>> builder = ImmutableMap.builder();
		for (String documentId : wordCounts.keySet()) {
			SortedMap<String, Integer> counts = termCounts.get(documentId);
			builder.put(documentId, (counts != null) ? ImmutableSortedMap.copyOfSorted(counts) :
				ImmutableSortedMap.<String, Integer>of());
		}
		this.termCounts = builder.build();
	}

	/** @return the number of declared documents, including empty ones */
	public int size() {
		return wordCounts.size();
	}

	public Set<String> getDocumentIds() {
		return wordCounts.keySet();
	}

	public boolean containsDocument(String documentId) {
		return wordCounts.containsKey(documentId);
	}

	/** @return the number of filtered tokens of the document, 0 for unknown documents */
	public int getWordCount(String documentId) {
		Integer count = wordCounts.get(documentId);
		return (count != null) ? count : 0;
	}

	public int getTermCount(String documentId, String lemma) {
		ImmutableSortedMap<String, Integer> counts = termCounts.get(documentId);
		if (counts == null)
			return 0;
		Integer count = counts.get(lemma);
		return (count != null) ? count : 0;
	}

	/** @return lemma counts of the document in lexicographic lemma order */
	public SortedMap<String, Integer> getTermCounts(String documentId) {
		ImmutableSortedMap<String, Integer> counts = termCounts.get(documentId);
		return (counts != null) ? counts : ImmutableSortedMap.<String, Integer>of();
	}

	public List<String> getEmptyDocumentIds() {
		List<String> empty = new ArrayList<String>();
		for (Map.Entry<String, Integer> e : wordCounts.entrySet())
			if (e.getValue() == 0)
				empty.add(e.getKey());
		return empty;
	}

	public TermFrequencies withoutEmptyDocuments() {
		Map<String, Integer> nonEmpty = new LinkedHashMap<String, Integer>();
		for (Map.Entry<String, Integer> e : wordCounts.entrySet())
			if (e.getValue() > 0)
				nonEmpty.put(e.getKey(), e.getValue());
		return new TermFrequencies(nonEmpty, termCounts);
	}

	/** @return the counts of those documents of the given subset that are known, in the order of the subset */
	public TermFrequencies restrictTo(Collection<String> documentIds) {
		Map<String, Integer> restricted = new LinkedHashMap<String, Integer>();
		for (String documentId : documentIds) {
			Integer count = wordCounts.get(documentId);
			if (count != null)
				restricted.put(documentId, count);
		}
		return new TermFrequencies(restricted, termCounts);
	}

	/** @return the number of documents containing each lemma */
	public Map<String, Integer> documentFrequencies() {
		Map<String, Integer> df = new HashMap<String, Integer>();
		for (ImmutableSortedMap<String, Integer> counts : termCounts.values()) {
			for (String lemma : counts.keySet()) {
				Integer n = df.get(lemma);
				df.put(lemma, (n != null) ? n + 1 : 1);
			}
		}
		return df;
	}

	/** @return all (document, lemma, count) rows, documents in declaration order and lemmas sorted */
	public List<TermCount> toTermCounts() {
		List<TermCount> rows = new ArrayList<TermCount>();
		for (Map.Entry<String, ImmutableSortedMap<String, Integer>> doc : termCounts.entrySet())
			for (Map.Entry<String, Integer> e : doc.getValue().entrySet())
				rows.add(new TermCount(doc.getKey(), e.getKey(), e.getValue()));
		return rows;
	}

	/** @return corpus-wide lemma occurrence counts, most frequent first */
	public List<LemmaCount> rankLemmas() {
		Map<String, Long> total = new HashMap<String, Long>();
		for (ImmutableSortedMap<String, Integer> counts : termCounts.values()) {
			for (Map.Entry<String, Integer> e : counts.entrySet()) {
				Long c = total.get(e.getKey());
				total.put(e.getKey(), (c != null) ? c + e.getValue() : e.getValue());
			}
		}
		List<LemmaCount> ranking = new ArrayList<LemmaCount>(total.size());
		for (Map.Entry<String, Long> e : total.entrySet())
			ranking.add(new LemmaCount(e.getKey(), e.getValue()));
		Collections.sort(ranking);
		return ranking;
	}

	public int countTokens() {
		int n = 0;
		for (int c : wordCounts.values())
			n += c;
		return n;
	}

}
