package edu.tum.cs.topicsweep.nlp.corpus;

import java.io.Serializable;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** disjoint partition of a document set into training and test documents, both in ascending id order */
public final class Split implements Serializable {

	private static final long serialVersionUID = 3304829981604771540L;

	private final ImmutableList<String> train;
	private final ImmutableList<String> test;

	Split(List<String> train, List<String> test) {
		this.train = ImmutableList.copyOf(train);
		this.test = ImmutableList.copyOf(test);
	}

	public List<String> getTrain() {
		return train;
	}

	public List<String> getTest() {
		return test;
	}

	public int size() {
		return train.size() + test.size();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Split))
			return false;
		Split other = (Split) o;
		return train.equals(other.train) && test.equals(other.test);
	}

	@Override
	public int hashCode() {
		return 31 * train.hashCode() + test.hashCode();
	}

	@Override
	public String toString() {
		return "Split[" + train.size() + " train, " + test.size() + " test]";
	}

}
