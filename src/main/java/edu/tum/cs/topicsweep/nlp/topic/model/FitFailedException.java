package edu.tum.cs.topicsweep.nlp.topic.model;

/** fitting or evaluating a topic model for one number of topics failed */
public class FitFailedException extends Exception {

	private static final long serialVersionUID = 1936180745268730671L;

	private final int numTopics;

	public FitFailedException(int numTopics, String message) {
		super("K=" + numTopics + ": " + message);
		this.numTopics = numTopics;
	}

	public FitFailedException(int numTopics, String message, Throwable cause) {
		super("K=" + numTopics + ": " + message, cause);
		this.numTopics = numTopics;
	}

	public int getNumTopics() {
		return numTopics;
	}

}
