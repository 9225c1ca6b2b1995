package edu.tum.cs.topicsweep.nlp.tfidf;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/** Signals documents without any surviving token, for which term frequencies are undefined. */
public class EmptyDocumentException extends RuntimeException {

	private static final long serialVersionUID = 2404471305458209381L;

	private final List<String> documentIds;

	public EmptyDocumentException(Collection<String> documentIds) {
		super("documents without surviving tokens: " + documentIds);
		this.documentIds = Collections.unmodifiableList(new ArrayList<String>(documentIds));
	}

	public List<String> getDocumentIds() {
		return documentIds;
	}

}
