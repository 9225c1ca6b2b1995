package edu.tum.cs.topicsweep.nlp.matrix;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.logging.Logger;

import edu.tum.cs.topicsweep.nlp.tfidf.TermFrequencies;

/**
 * Builds a document-term matrix from term counts restricted to a subset of documents. Rows follow the order of the
 * subset and only include documents with at least one counted term. Columns are exactly the lemmas observed in the
 * subset, so matrices built over different subsets generally have different columns; use
 * {@link VocabularyAlignment} to map one onto the other.
 */
public class DocumentTermMatrixBuilder {

	private static final Logger logger = Logger.getLogger(DocumentTermMatrixBuilder.class.getName());

	public static DocumentTermMatrix build(TermFrequencies freq) {
		return build(freq, freq.getDocumentIds());
	}

	public static DocumentTermMatrix build(TermFrequencies freq, Collection<String> documentIds) {
		List<String> rowIds = new ArrayList<String>(documentIds.size());
		Set<String> seen = new HashSet<String>();
		TreeSet<String> terms = new TreeSet<String>();
		int numSkipped = 0;
		for (String documentId : documentIds) {
			SortedMap<String, Integer> counts = freq.getTermCounts(documentId);
			if (counts.isEmpty()) {
				numSkipped++;
				continue;
			}
			if (!seen.add(documentId))
				throw new IllegalArgumentException("duplicate document " + documentId);
			rowIds.add(documentId);
			terms.addAll(counts.keySet());
		}
		if (numSkipped > 0)
			logger.fine(numSkipped + " documents of the subset have no terms and are left out");

		Vocabulary vocabulary = Vocabulary.of(terms);
		int[][] columnIds = new int[rowIds.size()][];
		int[][] cells = new int[rowIds.size()][];
		for (int row = 0; row < rowIds.size(); row++) {
			SortedMap<String, Integer> counts = freq.getTermCounts(rowIds.get(row));
			columnIds[row] = new int[counts.size()];
			cells[row] = new int[counts.size()];
			int i = 0;
			// lemmas and column ids share the same order
			for (Map.Entry<String, Integer> e : counts.entrySet()) {
				columnIds[row][i] = vocabulary.getTermId(e.getKey());
				cells[row][i] = e.getValue();
				i++;
			}
		}

		DocumentTermMatrix dtm = new DocumentTermMatrix(rowIds, vocabulary, columnIds, cells);
		logger.info("built " + dtm);
		return dtm;
	}

}
