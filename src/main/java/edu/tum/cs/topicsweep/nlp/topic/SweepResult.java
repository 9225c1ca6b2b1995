package edu.tum.cs.topicsweep.nlp.topic;

import java.util.Map;
import java.util.SortedMap;

import com.google.common.collect.ImmutableSortedMap;

import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrix;
import edu.tum.cs.topicsweep.nlp.matrix.VocabularyMismatch;
import edu.tum.cs.topicsweep.nlp.topic.model.TopicModel;

public class SweepResult<M extends TopicModel> {

	private final PerplexityCurve curve;
	private final ImmutableSortedMap<Integer, M> models;
	private final VocabularyMismatch mismatch;
	private final DocumentTermMatrix heldOut;

	SweepResult(PerplexityCurve curve, Map<Integer, M> models, VocabularyMismatch mismatch,
			DocumentTermMatrix heldOut) {
		this.curve = curve;
		this.models = ImmutableSortedMap.copyOf(models);
		this.mismatch = mismatch;
		this.heldOut = heldOut;
	}

	public PerplexityCurve getCurve() {
		return curve;
	}

	/** @return the fitted models of all successfully evaluated K, empty if models were not kept */
	public SortedMap<Integer, M> getModels() {
		return models;
	}

	public M getModel(int numTopics) {
		return models.get(numTopics);
	}

	/** @return the differences between test and training vocabulary found while aligning the test matrix */
	public VocabularyMismatch getVocabularyMismatch() {
		return mismatch;
	}

	/** @return the test matrix aligned to the training vocabulary, as used for all perplexity computations */
	public DocumentTermMatrix getHeldOut() {
		return heldOut;
	}

}
