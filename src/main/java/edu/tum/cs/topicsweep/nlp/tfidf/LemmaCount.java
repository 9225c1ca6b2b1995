package edu.tum.cs.topicsweep.nlp.tfidf;

/** corpus-wide number of occurrences of a lemma; natural order is by descending count, then by lemma */
public final class LemmaCount implements Comparable<LemmaCount> {

	public final String lemma;
	public final long count;

	public LemmaCount(String lemma, long count) {
		this.lemma = lemma;
		this.count = count;
	}

	@Override
	public int compareTo(LemmaCount other) {
		int c = -Long.compare(count, other.count);
		if (c == 0)
			c = lemma.compareTo(other.lemma);
		return c;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof LemmaCount))
			return false;
		LemmaCount other = (LemmaCount) o;
		return lemma.equals(other.lemma) && (count == other.count);
	}

	@Override
	public int hashCode() {
		return lemma.hashCode() * 31 + Long.hashCode(count);
	}

	@Override
	public String toString() {
		return lemma + "\t" + count;
	}

}
