package edu.tum.cs.topicsweep.nlp.matrix;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.carrotsearch.hppc.ObjectIntMap;
import com.carrotsearch.hppc.cursors.ObjectIntCursor;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Differences between the columns of a matrix and the reference vocabulary it was aligned to. Unseen terms occur in
 * the matrix but not in the reference and were dropped, missing terms occur only in the reference and have zero
 * counts in the aligned matrix.
 */
public final class VocabularyMismatch implements Serializable {

	private static final long serialVersionUID = -8836171826466566180L;

	private final ImmutableSortedMap<String, Integer> unseenTermCounts;
	private final ImmutableSet<String> missingTerms;
	private final ImmutableList<String> droppedDocuments;

	public VocabularyMismatch(ObjectIntMap<String> unseenTermCounts, Set<String> missingTerms,
			List<String> droppedDocuments) {
		ImmutableSortedMap.Builder<String, Integer> builder = ImmutableSortedMap.naturalOrder();
		for (ObjectIntCursor<String> csr : unseenTermCounts)
			builder.put(csr.key, csr.value);
		this.unseenTermCounts = builder.build();
		this.missingTerms = ImmutableSet.copyOf(missingTerms);
		this.droppedDocuments = ImmutableList.copyOf(droppedDocuments);
	}

	public boolean isEmpty() {
		return unseenTermCounts.isEmpty() && missingTerms.isEmpty();
	}

	public Set<String> getUnseenTerms() {
		return unseenTermCounts.keySet();
	}

	/** @return number of dropped tokens per unseen term */
	public Map<String, Integer> getUnseenTermCounts() {
		return unseenTermCounts;
	}

	public int countDroppedTokens() {
		int n = 0;
		for (int c : unseenTermCounts.values())
			n += c;
		return n;
	}

	public Set<String> getMissingTerms() {
		return missingTerms;
	}

	/** @return documents that had only unseen terms and therefore have no row in the aligned matrix */
	public List<String> getDroppedDocuments() {
		return droppedDocuments;
	}

	@Override
	public String toString() {
		return unseenTermCounts.size() + " unseen terms (" + countDroppedTokens() + " tokens dropped), " +
				missingTerms.size() + " missing terms, " + droppedDocuments.size() + " documents dropped";
	}

}
