package edu.tum.cs.topicsweep.nlp.tfidf;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

public class TfIdfTable implements Serializable {

	private static final long serialVersionUID = -5906251400624983264L;

	public static final String header = "document_id\tlemma\ttf\tidf\ttfidf";

	private static final Comparator<TfIdfRecord> byDescendingTfIdf = new Comparator<TfIdfRecord>() {
		@Override
		public int compare(TfIdfRecord r1, TfIdfRecord r2) {
			int c = -Double.compare(r1.getTfIdf(), r2.getTfIdf());
			if (c == 0)
				c = r1.getLemma().compareTo(r2.getLemma());
			return c;
		}
	};

	private final ImmutableList<TfIdfRecord> records;
	private final ImmutableListMultimap<String, TfIdfRecord> recordsByDocument;
	private final ImmutableMap<String, Double> idf;

	TfIdfTable(List<TfIdfRecord> records, Map<String, Double> idf) {
		this.records = ImmutableList.copyOf(records);
		ImmutableListMultimap.Builder<String, TfIdfRecord> builder = ImmutableListMultimap.builder();
		for (TfIdfRecord record : records)
			builder.put(record.getDocumentId(), record);
		this.recordsByDocument = builder.build();
		this.idf = ImmutableMap.copyOf(idf);
	}

	public List<TfIdfRecord> getRecords() {
		return records;
	}

	public List<TfIdfRecord> getRecords(String documentId) {
		return recordsByDocument.get(documentId);
	}

	/** @return the inverse document frequency of the lemma, or NaN if it does not occur in the corpus */
	public double getIdf(String lemma) {
		Double v = idf.get(lemma);
		return (v != null) ? v : Double.NaN;
	}

	public Map<String, Double> getIdf() {
		return idf;
	}

	/** @return the n records of the document with the highest TF-IDF, ties broken by lemma */
	public List<TfIdfRecord> topTerms(String documentId, int n) {
		List<TfIdfRecord> sorted = new ArrayList<TfIdfRecord>(recordsByDocument.get(documentId));
		Collections.sort(sorted, byDescendingTfIdf);
		return sorted.subList(0, Math.min(n, sorted.size()));
	}

	public int size() {
		return records.size();
	}

	public void writeTsv(PrintWriter writer) {
		writer.println(header);
		for (TfIdfRecord record : records)
			writer.println(record.toString());
		writer.flush();
	}

	public void saveTsv(File f) throws IOException {
		PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
		try {
			writeTsv(writer);
			if (writer.checkError())
				throw new IOException("error writing '" + f.getPath() + "'");
		} finally {
			writer.close();
		}
	}

}
