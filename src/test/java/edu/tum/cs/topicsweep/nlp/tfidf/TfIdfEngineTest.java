package edu.tum.cs.topicsweep.nlp.tfidf;

import static edu.tum.cs.topicsweep.nlp.tfidf.TfIdfTestCorpus.document;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.nlp.vocabulary.VocabularyFilter;

public class TfIdfEngineTest {

	private static final double eps = 1E-12;

	@Test
	public void testSmallCorpus() {
		List<Token> tokens = new ArrayList<Token>();
		tokens.addAll(document("d1", "topic", "model", "topic", "topic"));
		tokens.addAll(document("d2", "topic", "corpus"));
		TfIdfTable table = TfIdfEngine.compute(FrequencyAggregator.aggregate(tokens));

		assertEquals(4, table.size());
		assertEquals(0.0, table.getIdf("topic"), 0.0);
		assertEquals(Math.log(2.0), table.getIdf("model"), eps);
		assertTrue(Double.isNaN(table.getIdf("unknown")));

		List<TfIdfRecord> d1 = table.getRecords("d1");
		assertEquals(2, d1.size());
		TfIdfRecord model = d1.get(0);
		assertEquals("model", model.getLemma());
		assertEquals(0.25, model.getTf(), eps);
		assertEquals(0.25 * Math.log(2.0), model.getTfIdf(), eps);
		TfIdfRecord topic = d1.get(1);
		assertEquals(0.75, topic.getTf(), eps);
		assertEquals(0.0, topic.getTfIdf(), 0.0);

		List<TfIdfRecord> top = table.topTerms("d1", 1);
		assertEquals(1, top.size());
		assertEquals("model", top.get(0).getLemma());
	}

	@Test
	public void testRandomCorpus() {
		TermFrequencies freq = FrequencyAggregator.aggregate(TfIdfTestCorpus.randomCorpus(2343919L, 200, 30, 40));
		TfIdfTable table = TfIdfEngine.compute(freq);
		Map<String, Integer> df = freq.documentFrequencies();

		for (String documentId : freq.getDocumentIds()) {
			int wordCount = freq.getWordCount(documentId);
			double sum = 0.0;
			for (TfIdfRecord r : table.getRecords(documentId)) {
				assertTrue((r.getTf() > 0.0) && (r.getTf() <= 1.0));
				sum += r.getTf() * wordCount;
			}
			assertEquals(wordCount, sum, 1E-9);
		}

		for (Map.Entry<String, Double> e : table.getIdf().entrySet()) {
			double idf = e.getValue();
			assertTrue(idf >= 0.0);
			boolean inEveryDocument = (df.get(e.getKey()) == freq.size());
			assertEquals(inEveryDocument, idf == 0.0);
		}
	}

	@Test
	public void testEmptyDocument() {
		VocabularyFilter filter = VocabularyFilter.forDocumentTermMatrix(Arrays.asList("the"),
				Collections.singletonList("PUNCT"), 3);
		List<Token> tokens = new ArrayList<Token>();
		tokens.addAll(document("d1", "topic"));
		tokens.addAll(document("d2", "the"));
		tokens.addAll(document("d3", "of"));
		TermFrequencies freq = FrequencyAggregator.aggregate(tokens, filter);
		try {
			TfIdfEngine.compute(freq);
			fail("empty document accepted");
		} catch (EmptyDocumentException ex) {
			assertEquals(Arrays.asList("d2", "d3"), ex.getDocumentIds());
		}

		TfIdfTable table = TfIdfEngine.compute(freq.withoutEmptyDocuments());
		assertEquals(1, table.size());
		assertEquals(0.0, table.getIdf("topic"), 0.0);
	}

	@Test
	public void testIdf() {
		assertEquals(0.0, TfIdfEngine.idf(5, 5), 0.0);
		assertEquals(Math.log(5.0), TfIdfEngine.idf(5, 1), eps);
		try {
			TfIdfEngine.idf(5, 0);
			fail("zero document frequency accepted");
		} catch (IllegalArgumentException ex) {
			// expected
		}
		try {
			TfIdfEngine.tf("d", 1, 0);
			fail("zero word count accepted");
		} catch (EmptyDocumentException ex) {
			assertEquals(Collections.singletonList("d"), ex.getDocumentIds());
		}
	}

	@Test
	public void testTsv() {
		TfIdfTable table = TfIdfEngine.compute(FrequencyAggregator.aggregate(document("d1", "topic", "model")));
		StringWriter out = new StringWriter();
		table.writeTsv(new PrintWriter(out));
		String[] lines = out.toString().split("\\r?\\n");
		assertEquals(3, lines.length);
		assertEquals(TfIdfTable.header, lines[0]);
		assertEquals("d1\tmodel\t0.5\t0.0\t0.0", lines[1]);
	}

}
