package edu.tum.cs.topicsweep.nlp.tfidf;

import java.io.Serializable;

public final class TfIdfRecord implements Serializable {

	private static final long serialVersionUID = 6474129412795512651L;

	private final String documentId;
	private final String lemma;
	private final double tf;
	private final double idf;

	public TfIdfRecord(String documentId, String lemma, double tf, double idf) {
		this.documentId = documentId;
		this.lemma = lemma;
		this.tf = tf;
		this.idf = idf;
	}

	public String getDocumentId() {
		return documentId;
	}

	public String getLemma() {
		return lemma;
	}

	public double getTf() {
		return tf;
	}

	public double getIdf() {
		return idf;
	}

	public double getTfIdf() {
		return tf * idf;
	}

	@Override
	public String toString() {
		return documentId + "\t" + lemma + "\t" + tf + "\t" + idf + "\t" + getTfIdf();
	}

}
