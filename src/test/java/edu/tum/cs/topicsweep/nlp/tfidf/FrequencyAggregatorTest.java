package edu.tum.cs.topicsweep.nlp.tfidf;

import static edu.tum.cs.topicsweep.nlp.tfidf.TfIdfTestCorpus.document;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.nlp.vocabulary.VocabularyFilter;

public class FrequencyAggregatorTest {

	@Test
	public void testAggregate() {
		List<Token> tokens = new ArrayList<Token>();
		tokens.addAll(document("d2", "topic", "model", "topic"));
		tokens.addAll(document("d1", "corpus"));
		tokens.addAll(document("d2", "topic"));
		TermFrequencies freq = FrequencyAggregator.aggregate(tokens);

		assertEquals(2, freq.size());
		assertEquals(Arrays.asList("d2", "d1"), new ArrayList<String>(freq.getDocumentIds()));
		assertEquals(4, freq.getWordCount("d2"));
		assertEquals(3, freq.getTermCount("d2", "topic"));
		assertEquals(1, freq.getTermCount("d2", "model"));
		assertEquals(0, freq.getTermCount("d2", "corpus"));
		assertEquals(0, freq.getWordCount("unknown"));
		assertEquals(Arrays.asList("model", "topic"), new ArrayList<String>(freq.getTermCounts("d2").keySet()));
		assertEquals(5, freq.countTokens());
		assertTrue(freq.getEmptyDocumentIds().isEmpty());

		int sum = 0;
		for (TermCount tc : freq.toTermCounts()) {
			assertTrue(tc.getCount() >= 1);
			sum += tc.getCount();
		}
		assertEquals(freq.countTokens(), sum);

		Map<String, Integer> df = freq.documentFrequencies();
		assertEquals(Integer.valueOf(1), df.get("topic"));
		assertEquals(Integer.valueOf(1), df.get("corpus"));
	}

	@Test
	public void testEmptyDocuments() {
		VocabularyFilter filter = VocabularyFilter.forDocumentTermMatrix(Arrays.asList("the", "and"),
				Collections.singletonList("PUNCT"), 3);
		List<Token> tokens = new ArrayList<Token>();
		tokens.addAll(document("d1", "topic", "the"));
		tokens.addAll(document("d2", "the", "and", "42"));
		tokens.addAll(document("d3", "model"));
		TermFrequencies freq = FrequencyAggregator.aggregate(tokens, filter);

		assertEquals(3, freq.size());
		assertTrue(freq.containsDocument("d2"));
		assertEquals(0, freq.getWordCount("d2"));
		assertEquals(Collections.singletonList("d2"), freq.getEmptyDocumentIds());

		TermFrequencies nonEmpty = freq.withoutEmptyDocuments();
		assertEquals(2, nonEmpty.size());
		assertFalse(nonEmpty.containsDocument("d2"));
		assertEquals(1, nonEmpty.getTermCount("d1", "topic"));
		assertEquals(0, nonEmpty.getTermCount("d1", "the"));
	}

	@Test
	public void testRestrictAndRank() {
		List<Token> tokens = new ArrayList<Token>();
		tokens.addAll(document("a", "beta", "alpha", "alpha"));
		tokens.addAll(document("b", "beta", "gamma"));
		tokens.addAll(document("c", "beta"));
		TermFrequencies freq = FrequencyAggregator.aggregate(tokens);

		TermFrequencies restricted = freq.restrictTo(Arrays.asList("c", "a", "missing"));
		assertEquals(Arrays.asList("c", "a"), new ArrayList<String>(restricted.getDocumentIds()));
		assertEquals(2, restricted.getTermCount("a", "alpha"));

		List<LemmaCount> ranking = freq.rankLemmas();
		assertEquals(new LemmaCount("beta", 3), ranking.get(0));
		assertEquals(new LemmaCount("alpha", 2), ranking.get(1));
		assertEquals(new LemmaCount("gamma", 1), ranking.get(2));
	}

}
