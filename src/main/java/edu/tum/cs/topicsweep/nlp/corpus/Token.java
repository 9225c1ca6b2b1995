package edu.tum.cs.topicsweep.nlp.corpus;

import java.io.Serializable;

/** A single lemmatized and part-of-speech tagged token, as delivered by the external lemmatizer. */
public final class Token implements Serializable {

	private static final long serialVersionUID = 5830914257768921873L;

	private final String documentId;
	private final String surfaceForm;
	private final String lemma;
	private final String partOfSpeech;

	public Token(String documentId, String surfaceForm, String lemma, String partOfSpeech) {
		if (documentId == null)
			throw new IllegalArgumentException("token without document id");
		this.documentId = documentId;
		this.surfaceForm = (surfaceForm != null) ? surfaceForm : "";
		this.lemma = (lemma != null) ? lemma : "";
		this.partOfSpeech = (partOfSpeech != null) ? partOfSpeech : "";
	}

	public String getDocumentId() {
		return documentId;
	}

	public String getSurfaceForm() {
		return surfaceForm;
	}

	public String getLemma() {
		return lemma;
	}

	public String getPartOfSpeech() {
		return partOfSpeech;
	}

	/** @return a copy of this token carrying a normalized lemma */
	public Token withLemma(String normalizedLemma) {
		return new Token(documentId, surfaceForm, normalizedLemma, partOfSpeech);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Token))
			return false;
		Token other = (Token) o;
		return documentId.equals(other.documentId) && surfaceForm.equals(other.surfaceForm) &&
				lemma.equals(other.lemma) && partOfSpeech.equals(other.partOfSpeech);
	}

	@Override
	public int hashCode() {
		int h = documentId.hashCode();
		h = 31 * h + surfaceForm.hashCode();
		h = 31 * h + lemma.hashCode();
		h = 31 * h + partOfSpeech.hashCode();
		return h;
	}

	@Override
	public String toString() {
		return documentId + ":" + surfaceForm + "/" + lemma + "/" + partOfSpeech;
	}

}
