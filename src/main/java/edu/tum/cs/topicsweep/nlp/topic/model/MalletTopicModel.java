package edu.tum.cs.topicsweep.nlp.topic.model;

import cc.mallet.topics.ParallelTopicModel;
import cc.mallet.types.Alphabet;

import edu.tum.cs.topicsweep.nlp.matrix.Vocabulary;

/** LDA model estimated by MALLET, together with the vocabulary its type ids refer to */
public class MalletTopicModel implements TopicModel {

	private static final long serialVersionUID = -7805409009512606147L;

	private final ParallelTopicModel lda;
	private final Alphabet alphabet;
	private final Vocabulary vocabulary;
	private final double alphaSum;

	/** smoothed topic-word distributions */
	private double[][] phi;

	MalletTopicModel(ParallelTopicModel lda, Alphabet alphabet, Vocabulary vocabulary, double alphaSum) {
		this.lda = lda;
		this.alphabet = alphabet;
		this.vocabulary = vocabulary;
		this.alphaSum = alphaSum;
	}

	public ParallelTopicModel getParallelTopicModel() {
		return lda;
	}

	Alphabet getAlphabet() {
		return alphabet;
	}

	/** @return the symmetric Dirichlet prior on the document-topic proportions, per topic */
	public double getAlpha() {
		return alphaSum / getNumTopics();
	}

	@Override
	public int getNumTopics() {
		return lda.getNumTopics();
	}

	@Override
	public Vocabulary getVocabulary() {
		return vocabulary;
	}

	@Override
	public synchronized double[][] getTopicWordDistr() {
		if (phi == null)
			phi = lda.getTopicWords(true, true);
		return phi;
	}

}
