package edu.tum.cs.topicsweep.nlp.topic;

import java.io.Serializable;

public final class PerplexityPoint implements Serializable {

	private static final long serialVersionUID = 2172620722306862470L;

	private final int numTopics;
	private final double perplexity;

	public PerplexityPoint(int numTopics, double perplexity) {
		this.numTopics = numTopics;
		this.perplexity = perplexity;
	}

	public int getNumTopics() {
		return numTopics;
	}

	public double getPerplexity() {
		return perplexity;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof PerplexityPoint))
			return false;
		PerplexityPoint other = (PerplexityPoint) o;
		return (numTopics == other.numTopics) && (Double.compare(perplexity, other.perplexity) == 0);
	}

	@Override
	public int hashCode() {
		return 31 * numTopics + Double.hashCode(perplexity);
	}

	@Override
	public String toString() {
		return "(" + numTopics + ", " + perplexity + ")";
	}

}
