package edu.tum.cs.topicsweep.nlp.matrix;

import java.io.Serializable;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;

/** Immutable mapping between lemmas and matrix column ids. Ids follow the lexicographic order of the lemmas. */
public final class Vocabulary implements Serializable {

	private static final long serialVersionUID = -2287960823113542391L;

	private final ImmutableList<String> terms;
	private final BiMap<String, Integer> indexMap = HashBiMap.create();

	private Vocabulary(Collection<String> sortedTerms) {
		terms = ImmutableList.copyOf(sortedTerms);
		int id = 0;
		for (String term : terms)
			indexMap.put(term, id++);
	}

	public static Vocabulary of(Collection<String> terms) {
		return new Vocabulary(new TreeSet<String>(terms));
	}

	public int size() {
		return terms.size();
	}

	/** @return the column id of the term, or -1 if the term is unknown */
	public int getTermId(String term) {
		Integer id = indexMap.get(term);
		if (id == null)
			return -1;
		return id;
	}

	public String getTerm(int id) {
		return indexMap.inverse().get(id);
	}

	public boolean contains(String term) {
		return indexMap.containsKey(term);
	}

	public List<String> getTerms() {
		return terms;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Vocabulary))
			return false;
		return terms.equals(((Vocabulary) o).terms);
	}

	@Override
	public int hashCode() {
		return terms.hashCode();
	}

	@Override
	public String toString() {
		return "Vocabulary" + terms;
	}

}
