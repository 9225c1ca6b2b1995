package edu.tum.cs.topicsweep.nlp.matrix;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;

/**
 * Sparse document-term count matrix. Each row stores the column ids of its non-zero cells in ascending order
 * together with their counts. Rows are never empty.
 */
public final class DocumentTermMatrix implements Serializable {

	private static final long serialVersionUID = 7358417432215869016L;

	private final ImmutableList<String> rowIds;
	private final BiMap<String, Integer> rowIndex = HashBiMap.create();
	private final Vocabulary vocabulary;
	private final int[][] columnIds;
	private final int[][] counts;
	private final int numTokens;

	DocumentTermMatrix(List<String> rowIds, Vocabulary vocabulary, int[][] columnIds, int[][] counts) {
		if ((rowIds.size() != columnIds.length) || (columnIds.length != counts.length))
			throw new IllegalArgumentException("inconsistent number of rows");
		this.rowIds = ImmutableList.copyOf(rowIds);
		this.vocabulary = vocabulary;
		this.columnIds = columnIds;
		this.counts = counts;

		int n = 0;
		for (int row = 0; row < columnIds.length; row++) {
			rowIndex.put(this.rowIds.get(row), row);
			if ((columnIds[row].length == 0) || (columnIds[row].length != counts[row].length))
				throw new IllegalArgumentException("row " + rowIds.get(row) + " is empty or inconsistent");
			for (int i = 0; i < columnIds[row].length; i++) {
				if ((columnIds[row][i] < 0) || (columnIds[row][i] >= vocabulary.size()))
					throw new IllegalArgumentException("column id " + columnIds[row][i] + " out of range");
				if ((i > 0) && (columnIds[row][i] <= columnIds[row][i - 1]))
					throw new IllegalArgumentException("columns of row " + rowIds.get(row) + " not ascending");
				if (counts[row][i] < 1)
					throw new IllegalArgumentException("non-positive count in row " + rowIds.get(row));
				n += counts[row][i];
			}
		}
		numTokens = n;
	}

	public int numRows() {
		return rowIds.size();
	}

	public int numColumns() {
		return vocabulary.size();
	}

	public List<String> getRowIds() {
		return rowIds;
	}

	/** @return the row of the document, or -1 if the document is not part of the matrix */
	public int getRowIndex(String documentId) {
		Integer row = rowIndex.get(documentId);
		if (row == null)
			return -1;
		return row;
	}

	public Vocabulary getVocabulary() {
		return vocabulary;
	}

	public int get(int row, int column) {
		int pos = Arrays.binarySearch(columnIds[row], column);
		return (pos >= 0) ? counts[row][pos] : 0;
	}

	public int get(String documentId, String term) {
		int row = getRowIndex(documentId);
		int column = vocabulary.getTermId(term);
		if ((row < 0) || (column < 0))
			return 0;
		return get(row, column);
	}

	/** @return the column ids of the non-zero cells of the row, ascending; callers must not modify the array */
	public int[] getRowColumnIds(int row) {
		return columnIds[row];
	}

	/** @return the counts matching {@link #getRowColumnIds(int)}; callers must not modify the array */
	public int[] getRowCounts(int row) {
		return counts[row];
	}

	public int rowSum(int row) {
		int sum = 0;
		for (int c : counts[row])
			sum += c;
		return sum;
	}

	public int countTokens() {
		return numTokens;
	}

	public int countNonZero() {
		int n = 0;
		for (int[] ids : columnIds)
			n += ids.length;
		return n;
	}

	@Override
	public String toString() {
		return "DocumentTermMatrix[" + numRows() + " x " + numColumns() + ", " + countNonZero() + " non-zero]";
	}

}
