package edu.tum.cs.topicsweep.nlp.vocabulary;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.util.ExperimentConfiguration;

public class VocabularyFilterTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private static final List<String> stopWords = Arrays.asList("The", "and", "of");
	private static final List<String> punctuation = Collections.singletonList("PUNCT");

	private static Token token(String surface, String lemma, String pos) {
		return new Token("d1", surface, lemma, pos);
	}

	@Test
	public void testDocumentTermPreset() {
		VocabularyFilter filter = VocabularyFilter.forDocumentTermMatrix(stopWords, punctuation, 3);
		assertEquals("model", filter.normalize(token("Models", "Model", "NOUN")));
		assertNull(filter.normalize(token("The", "the", "DET")));
		assertNull(filter.normalize(token("THE", "THE", "DET")));
		assertNull(filter.normalize(token("...", "...", "PUNCT")));
		assertNull(filter.normalize(token("lda", "lda", "PUNCT")));
		assertEquals("covid", filter.normalize(token("COVID-19", "covid-19", "NOUN")));
		assertNull(filter.normalize(token("U.S.", "u.s.", "PROPN")));
		assertNull(filter.normalize(token("95%", "95%", "NUM")));
		assertNull(filter.normalize(token("ox", "ox", "NOUN")));
		// stripping may produce a stop word
		assertNull(filter.normalize(token("and-", "and-", "CCONJ")));
	}

	@Test
	public void testRawFrequencyPreset() {
		VocabularyFilter filter = VocabularyFilter.forRawFrequency(stopWords, punctuation, 3);
		assertEquals("model", filter.normalize(token("Models", "Model", "NOUN")));
		assertNull(filter.normalize(token("The", "the", "DET")));
		assertNull(filter.normalize(token("...", "...", "PUNCT")));
		assertNull(filter.normalize(token("COVID-19", "covid-19", "NOUN")));
		assertNull(filter.normalize(token("95%", "95%", "NUM")));
		assertNull(filter.normalize(token("percent", "%", "SYM")));
		// surface form alone disqualifies
		assertNull(filter.normalize(token("2nd", "second", "ADJ")));
		assertEquals("u.s.", filter.normalize(token("U.S.", "u.s.", "PROPN")));
		assertNull(filter.normalize(token("ox", "ox", "NOUN")));
	}

	@Test
	public void testPresetsDiffer() {
		VocabularyFilter dtm = VocabularyFilter.forDocumentTermMatrix(stopWords, punctuation, 3);
		VocabularyFilter raw = VocabularyFilter.forRawFrequency(stopWords, punctuation, 3);
		assertTrue(dtm.isStrippingNonAlphabetic());
		assertFalse(dtm.isDroppingNumericLike());
		assertFalse(raw.isStrippingNonAlphabetic());
		assertTrue(raw.isDroppingNumericLike());
		assertFalse(dtm.getName().equals(raw.getName()));
	}

	@Test
	public void testFilter() {
		VocabularyFilter filter = VocabularyFilter.forDocumentTermMatrix(stopWords, punctuation, 3);
		List<Token> filtered = filter.filter(Arrays.asList(token("The", "the", "DET"),
				token("Topics", "Topic", "NOUN"), token(",", ",", "PUNCT"), token("emerge", "emerge", "VERB")));
		assertEquals(2, filtered.size());
		assertEquals("topic", filtered.get(0).getLemma());
		assertEquals("Topics", filtered.get(0).getSurfaceForm());
		assertEquals("emerge", filtered.get(1).getLemma());
	}

	@Test
	public void testStopWords() throws IOException {
		Set<String> bundled = StopWords.load("en", null);
		assertTrue(bundled.contains("the"));
		assertTrue(bundled.contains("and"));
		assertFalse(bundled.contains("model"));

		File dataDir = tmp.newFolder("data");
		PrintWriter writer = new PrintWriter(new OutputStreamWriter(
				new FileOutputStream(new File(dataDir, "stopWords-en.txt")), StandardCharsets.UTF_8));
		try {
			writer.println("# dataset-specific");
			writer.println("Model");
		} finally {
			writer.close();
		}
		Set<String> extended = StopWords.load("en", dataDir.getPath());
		assertTrue(extended.contains("model"));
		assertTrue(extended.containsAll(bundled));

		Set<String> words = StopWords.loadWordList(new ByteArrayInputStream(
				"# comment\n\n  Foo \nbar\n".getBytes(StandardCharsets.UTF_8)));
		assertEquals(2, words.size());
		assertTrue(words.contains("foo"));
	}

	@Test
	public void testFingerprint() {
		VocabularyFilter filter = VocabularyFilter.forDocumentTermMatrix(stopWords, punctuation, 3);
		assertEquals(filter.fingerprint(),
				VocabularyFilter.forDocumentTermMatrix(Arrays.asList("of", "and", "the"), punctuation, 3).fingerprint());
		assertFalse(filter.fingerprint().equals(VocabularyFilter.forDocumentTermMatrix(
				Arrays.asList("The", "and", "of", "model"), punctuation, 3).fingerprint()));
		assertFalse(filter.fingerprint().equals(
				VocabularyFilter.forDocumentTermMatrix(stopWords, punctuation, 2).fingerprint()));
		assertFalse(filter.fingerprint().equals(
				VocabularyFilter.forRawFrequency(stopWords, punctuation, 3).fingerprint()));
	}

	@Test(expected = IOException.class)
	public void testUnknownLanguage() throws IOException {
		StopWords.load("xx", null);
	}

	@Test
	public void testConfiguration() throws IOException {
		Properties props = new Properties();
		props.setProperty(ExperimentConfiguration.PROP_DATA_PATH, tmp.getRoot().getPath());
		props.setProperty("DocumentTermFilter.minLength", "2");
		props.setProperty("RawFrequencyFilter.punctuationTags", "PUNCT, SYM");
		ExperimentConfiguration cfg = new ExperimentConfiguration(VocabularyFilterTest.class, props);

		VocabularyFilter dtm = VocabularyFilter.forDocumentTermMatrix(cfg);
		assertEquals(2, dtm.getMinLength());
		assertEquals("ox", dtm.normalize(token("ox", "ox", "NOUN")));
		assertEquals("xy", dtm.normalize(token("x-y", "x-y", "NOUN")));
		// "us" is a bundled stop word
		assertNull(dtm.normalize(token("U.S.", "u.s.", "PROPN")));
		assertNull(dtm.normalize(token("the", "the", "DET")));

		VocabularyFilter raw = VocabularyFilter.forRawFrequency(cfg);
		assertEquals(VocabularyFilter.defaultMinLength, raw.getMinLength());
		assertNull(raw.normalize(token("&", "and", "SYM")));
		assertNull(raw.normalize(token("+++", "+++", "SYM")));
	}

}
