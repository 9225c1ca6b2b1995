package edu.tum.cs.topicsweep.nlp.tfidf;

import java.io.Serializable;

public final class TermCount implements Serializable {

	private static final long serialVersionUID = -1316263021860447792L;

	private final String documentId;
	private final String lemma;
	private final int count;

	public TermCount(String documentId, String lemma, int count) {
		if (count < 1)
			throw new IllegalArgumentException("term count must be at least 1, got " + count + " for '" + lemma +
					"' in document " + documentId);
		this.documentId = documentId;
		this.lemma = lemma;
		this.count = count;
	}

	public String getDocumentId() {
		return documentId;
	}

	public String getLemma() {
		return lemma;
	}

	public int getCount() {
		return count;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof TermCount))
			return false;
		TermCount other = (TermCount) o;
		return documentId.equals(other.documentId) && lemma.equals(other.lemma) && (count == other.count);
	}

	@Override
	public int hashCode() {
		return (31 * documentId.hashCode() + lemma.hashCode()) * 31 + count;
	}

	@Override
	public String toString() {
		return documentId + "\t" + lemma + "\t" + count;
	}

}
