package edu.tum.cs.topicsweep.nlp.topic.model;

import java.io.Serializable;

import edu.tum.cs.topicsweep.nlp.matrix.Vocabulary;

public interface TopicModel extends Serializable {

	public int getNumTopics();

	/** @return the vocabulary the model was trained on; held-out matrices must use the same one */
	public Vocabulary getVocabulary();

	/** @return one distribution over the vocabulary per topic */
	public double[][] getTopicWordDistr();

}
