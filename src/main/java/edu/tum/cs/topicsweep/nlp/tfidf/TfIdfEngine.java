package edu.tum.cs.topicsweep.nlp.tfidf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class TfIdfEngine {

	private static final Logger logger = Logger.getLogger(TfIdfEngine.class.getName());

	/**
	 * Computes tf, idf and tf-idf for every (document, lemma) pair. N and the document frequencies are both taken
	 * from the given document set.
	 *
	 * @throws EmptyDocumentException if any document of the set has no filtered tokens
	 */
	public static TfIdfTable compute(TermFrequencies freq) {
		List<String> empty = freq.getEmptyDocumentIds();
		if (!empty.isEmpty())
			throw new EmptyDocumentException(empty);

		int numDocuments = freq.size();
		Map<String, Double> idf = new HashMap<String, Double>();
		for (Map.Entry<String, Integer> e : freq.documentFrequencies().entrySet())
			idf.put(e.getKey(), idf(numDocuments, e.getValue()));

		List<TfIdfRecord> records = new ArrayList<TfIdfRecord>();
		for (String documentId : freq.getDocumentIds()) {
			int wordCount = freq.getWordCount(documentId);
			for (Map.Entry<String, Integer> e : freq.getTermCounts(documentId).entrySet())
				records.add(new TfIdfRecord(documentId, e.getKey(), tf(documentId, e.getValue(), wordCount),
						idf.get(e.getKey())));
		}
		logger.info("computed " + records.size() + " tf-idf records for " + numDocuments + " documents and " +
				idf.size() + " lemmas");
		return new TfIdfTable(records, idf);
	}

	public static double tf(String documentId, int termCount, int wordCount) {
		if (wordCount == 0)
			throw new EmptyDocumentException(Collections.singletonList(documentId));
		return (double) termCount / wordCount;
	}

	/** ln(N / n_t); zero exactly when the lemma occurs in every document */
	public static double idf(int numDocuments, int documentFrequency) {
		if ((documentFrequency < 1) || (documentFrequency > numDocuments))
			throw new IllegalArgumentException("document frequency " + documentFrequency + " outside of [1, " +
					numDocuments + "]");
		if (documentFrequency == numDocuments)
			return 0.0;
		return Math.log((double) numDocuments / documentFrequency);
	}

}
