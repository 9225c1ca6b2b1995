package edu.tum.cs.topicsweep.nlp.topic;

import java.util.Map;
import java.util.SortedMap;

import com.google.common.collect.ImmutableSortedMap;

/** no number of topics of a sweep could be fitted and evaluated */
public class SweepFailedException extends RuntimeException {

	private static final long serialVersionUID = -6370262773659402357L;

	private final ImmutableSortedMap<Integer, String> failures;

	public SweepFailedException(Map<Integer, String> failures) {
		super("all " + failures.size() + " candidate numbers of topics failed: " + failures);
		this.failures = ImmutableSortedMap.copyOf(failures);
	}

	public SortedMap<Integer, String> getFailures() {
		return failures;
	}

}
