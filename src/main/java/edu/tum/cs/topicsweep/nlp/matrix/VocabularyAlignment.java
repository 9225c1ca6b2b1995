package edu.tum.cs.topicsweep.nlp.matrix;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.carrotsearch.hppc.ObjectIntHashMap;

/**
 * Re-expresses a document-term matrix over a reference vocabulary, typically the training vocabulary of a topic
 * model. Counts of terms unknown to the reference are dropped, reference terms absent from the matrix stay zero.
 * Rows left without any count are removed.
 */
public class VocabularyAlignment {

	private static final Logger logger = Logger.getLogger(VocabularyAlignment.class.getName());

	public static class Result {
		private final DocumentTermMatrix matrix;
		private final VocabularyMismatch mismatch;

		private Result(DocumentTermMatrix matrix, VocabularyMismatch mismatch) {
			this.matrix = matrix;
			this.mismatch = mismatch;
		}

		public DocumentTermMatrix getMatrix() {
			return matrix;
		}

		public VocabularyMismatch getMismatch() {
			return mismatch;
		}
	}

	public static Result align(DocumentTermMatrix dtm, Vocabulary reference) {
		Vocabulary source = dtm.getVocabulary();
		// both vocabularies are sorted, so mapped ids stay ascending within a row
		int[] columnMap = new int[source.size()];
		for (int i = 0; i < columnMap.length; i++)
			columnMap[i] = reference.getTermId(source.getTerm(i));

		ObjectIntHashMap<String> unseenCounts = new ObjectIntHashMap<String>();
		List<String> rowIds = new ArrayList<String>(dtm.numRows());
		List<int[]> columnIds = new ArrayList<int[]>(dtm.numRows());
		List<int[]> counts = new ArrayList<int[]>(dtm.numRows());
		List<String> droppedDocuments = new ArrayList<String>();
		for (int row = 0; row < dtm.numRows(); row++) {
			int[] srcColumns = dtm.getRowColumnIds(row);
			int[] srcCounts = dtm.getRowCounts(row);
			int numKept = 0;
			for (int column : srcColumns)
				if (columnMap[column] >= 0)
					numKept++;

			int[] dstColumns = new int[numKept];
			int[] dstCounts = new int[numKept];
			int pos = 0;
			for (int i = 0; i < srcColumns.length; i++) {
				int mapped = columnMap[srcColumns[i]];
				if (mapped >= 0) {
					dstColumns[pos] = mapped;
					dstCounts[pos] = srcCounts[i];
					pos++;
				} else
					unseenCounts.addTo(source.getTerm(srcColumns[i]), srcCounts[i]);
			}

			String documentId = dtm.getRowIds().get(row);
			if (numKept == 0) {
				droppedDocuments.add(documentId);
				continue;
			}
			rowIds.add(documentId);
			columnIds.add(dstColumns);
			counts.add(dstCounts);
		}

		Set<String> missingTerms = new LinkedHashSet<String>();
		for (String term : reference.getTerms())
			if (!source.contains(term))
				missingTerms.add(term);

		DocumentTermMatrix aligned = new DocumentTermMatrix(rowIds, reference, columnIds.toArray(new int[0][]),
				counts.toArray(new int[0][]));
		VocabularyMismatch mismatch = new VocabularyMismatch(unseenCounts, missingTerms, droppedDocuments);
		if (!mismatch.isEmpty())
			logger.warning("vocabulary mismatch after alignment: " + mismatch);
		return new Result(aligned, mismatch);
	}

}
