package edu.tum.cs.topicsweep.nlp.corpus;

public class InvalidSplitException extends RuntimeException {

	private static final long serialVersionUID = -4671030183347250128L;

	private final double testFraction;
	private final int numDocuments;

	public InvalidSplitException(String message, double testFraction, int numDocuments) {
		super(message + " (test fraction " + testFraction + ", " + numDocuments + " documents)");
		this.testFraction = testFraction;
		this.numDocuments = numDocuments;
	}

	public double getTestFraction() {
		return testFraction;
	}

	public int getNumDocuments() {
		return numDocuments;
	}

}
