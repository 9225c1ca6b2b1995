package edu.tum.cs.topicsweep.nlp.topic.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.Test;

import cc.mallet.types.Alphabet;
import cc.mallet.types.FeatureSequence;
import cc.mallet.types.InstanceList;

import edu.tum.cs.topicsweep.nlp.corpus.CorpusSplitter;
import edu.tum.cs.topicsweep.nlp.corpus.Split;
import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrix;
import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrixBuilder;
import edu.tum.cs.topicsweep.nlp.matrix.VocabularyAlignment;
import edu.tum.cs.topicsweep.nlp.tfidf.FrequencyAggregator;
import edu.tum.cs.topicsweep.nlp.tfidf.TermFrequencies;

public class MalletLdaFitterTest {

	private static final long seed = 2343919L;
	private static final int numIterations = 50;
	private static final String[][] topicWords = {
		{ "apple", "banana", "cherry", "grape", "lemon" },
		{ "engine", "wheel", "brake", "motor", "piston" }
	};

	/** documents drawn from one of two disjoint word sets */
	private static TermFrequencies makeCorpus(int numDocuments, int docLength) {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		List<Token> tokens = new ArrayList<Token>();
		for (int d = 0; d < numDocuments; d++) {
			String[] words = topicWords[d % topicWords.length];
			for (int i = 0; i < docLength; i++) {
				String w = words[rand.nextInt(words.length)];
				tokens.add(new Token(String.format("doc%02d", d), w, w, "NOUN"));
			}
		}
		return FrequencyAggregator.aggregate(tokens);
	}

	private static MalletLdaFitter makeFitter() {
		return new MalletLdaFitter(1.0, 0.01, numIterations, 42);
	}

	@Test
	public void testFit() throws FitFailedException {
		TermFrequencies freq = makeCorpus(20, 30);
		DocumentTermMatrix dtm = DocumentTermMatrixBuilder.build(freq);
		MalletTopicModel model = makeFitter().fit(dtm, 2);

		assertEquals(2, model.getNumTopics());
		assertEquals(dtm.getVocabulary(), model.getVocabulary());
		assertEquals(0.5, model.getAlpha(), 1E-12);
		assertFalse(model.getParallelTopicModel().printLogLikelihood);
		double[][] phi = model.getTopicWordDistr();
		assertEquals(2, phi.length);
		for (double[] distr : phi) {
			assertEquals(dtm.numColumns(), distr.length);
			double sum = 0.0;
			for (double p : distr)
				sum += p;
			assertEquals(1.0, sum, 1E-9);
		}
	}

	@Test
	public void testDeterministicPerplexity() throws FitFailedException {
		TermFrequencies freq = makeCorpus(20, 30);
		Split split = new CorpusSplitter(0.2, 42).split(freq.getDocumentIds());
		DocumentTermMatrix train = DocumentTermMatrixBuilder.build(freq, split.getTrain());
		DocumentTermMatrix test = VocabularyAlignment.align(DocumentTermMatrixBuilder.build(freq, split.getTest()),
				train.getVocabulary()).getMatrix();

		MalletLdaFitter fitter = makeFitter();
		double p1 = fitter.perplexity(fitter.fit(train, 2), test);
		double p2 = fitter.perplexity(fitter.fit(train, 2), test);
		assertEquals(p1, p2, 1E-9);
		assertTrue(p1 >= 1.0);
		// cannot be worse than guessing uniformly among all words by much
		assertTrue(p1 < 2.0 * train.numColumns());
	}

	@Test
	public void testLeftToRight() throws FitFailedException {
		TermFrequencies freq = makeCorpus(20, 30);
		DocumentTermMatrix dtm = DocumentTermMatrixBuilder.build(freq);
		MalletLdaFitter fitter = makeFitter();
		fitter.setEstimator(MalletLdaFitter.Estimator.LEFT_TO_RIGHT);
		fitter.setNumParticles(2);
		double p = fitter.perplexity(fitter.fit(dtm, 3), dtm);
		assertTrue(!Double.isNaN(p) && !Double.isInfinite(p));
		assertTrue(p >= 1.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnalignedHeldOut() throws FitFailedException {
		TermFrequencies freq = makeCorpus(4, 10);
		DocumentTermMatrix train = DocumentTermMatrixBuilder.build(freq, Arrays.asList("doc00", "doc02"));
		DocumentTermMatrix test = DocumentTermMatrixBuilder.build(freq, Arrays.asList("doc01"));
		MalletLdaFitter fitter = makeFitter();
		fitter.perplexity(fitter.fit(train, 2), test);
	}

	@Test
	public void testApproxLogLikelihood() {
		TermFrequencies freq = makeCorpus(1, 4);
		DocumentTermMatrix dtm = DocumentTermMatrixBuilder.build(freq);
		int numWords = dtm.numColumns();
		double[][] phi = new double[1][numWords];
		Arrays.fill(phi[0], 1.0 / numWords);

		// a single topic with uniform word distribution predicts every token with 1/V
		double ll = MalletLdaFitter.approxLogLikelihood(dtm, phi, 0.1);
		assertEquals(4 * Math.log(1.0 / numWords), ll, 1E-9);
		assertEquals(numWords, MalletLdaFitter.perplexity(ll, dtm.countTokens()), 1E-9);
	}

	@Test
	public void testInstances() {
		DocumentTermMatrix dtm = DocumentTermMatrixBuilder.build(makeCorpus(3, 7));
		Alphabet alphabet = new Alphabet();
		for (String term : dtm.getVocabulary().getTerms())
			alphabet.lookupIndex(term, true);
		InstanceList instances = MalletLdaFitter.toInstances(dtm, alphabet);
		assertEquals(dtm.numRows(), instances.size());
		for (int row = 0; row < dtm.numRows(); row++) {
			FeatureSequence fs = (FeatureSequence) instances.get(row).getData();
			assertEquals(dtm.rowSum(row), fs.getLength());
			assertEquals(dtm.getRowIds().get(row), instances.get(row).getName());
			for (int i = 0; i < fs.getLength(); i++)
				assertTrue(dtm.get(row, fs.getIndexAtPosition(i)) > 0);
		}
	}

	@Test
	public void testEmptyTrainingMatrix() {
		TermFrequencies freq = makeCorpus(2, 5);
		DocumentTermMatrix empty = DocumentTermMatrixBuilder.build(freq, new ArrayList<String>());
		try {
			makeFitter().fit(empty, 2);
		} catch (FitFailedException ex) {
			assertEquals(2, ex.getNumTopics());
			return;
		}
		throw new AssertionError("empty training matrix accepted");
	}

}
