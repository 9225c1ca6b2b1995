package edu.tum.cs.topicsweep.nlp.topic.model;

import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrix;

/**
 * Fits topic models with a given number of topics and scores them on held-out documents. Implementations must be
 * safe to call concurrently for different numbers of topics.
 */
public interface TopicModelFitter<M extends TopicModel> {

	public M fit(DocumentTermMatrix train, int numTopics) throws FitFailedException;

	/**
	 * @param heldOut documents aligned to the vocabulary of the model
	 * @return the per-token perplexity of the held-out documents, lower is better
	 */
	public double perplexity(M model, DocumentTermMatrix heldOut) throws FitFailedException;

}
