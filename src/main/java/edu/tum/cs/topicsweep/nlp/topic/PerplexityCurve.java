package edu.tum.cs.topicsweep.nlp.topic;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSortedMap;

/**
 * Held-out perplexity per number of topics, in ascending order of K. Numbers of topics whose fit failed are kept
 * apart with the failure reason; they have no point on the curve.
 */
public final class PerplexityCurve implements Serializable {

	private static final long serialVersionUID = -1071859925457281385L;

	public static final String header = "k,perplexity";
	private static final String separator = ",";

	private final ImmutableSortedMap<Integer, Double> points;
	private final ImmutableSortedMap<Integer, String> failures;

	public PerplexityCurve(Map<Integer, Double> points, Map<Integer, String> failures) {
		for (Map.Entry<Integer, Double> e : points.entrySet()) {
			if (failures.containsKey(e.getKey()))
				throw new IllegalArgumentException("K=" + e.getKey() + " is both a point and a failure");
			double p = e.getValue();
			if (Double.isNaN(p) || Double.isInfinite(p) || (p < 0.0))
				throw new IllegalArgumentException("invalid perplexity " + p + " for K=" + e.getKey());
		}
		this.points = ImmutableSortedMap.copyOf(points);
		this.failures = ImmutableSortedMap.copyOf(failures);
	}

	public static PerplexityCurve of(List<PerplexityPoint> points) {
		SortedMap<Integer, Double> map = new TreeMap<Integer, Double>();
		for (PerplexityPoint point : points)
			if (map.put(point.getNumTopics(), point.getPerplexity()) != null)
				throw new IllegalArgumentException("duplicate K=" + point.getNumTopics());
		return new PerplexityCurve(map, new TreeMap<Integer, String>());
	}

	/** @return the points in ascending order of K */
	public List<PerplexityPoint> getPoints() {
		List<PerplexityPoint> list = new ArrayList<PerplexityPoint>(points.size());
		for (Map.Entry<Integer, Double> e : points.entrySet())
			list.add(new PerplexityPoint(e.getKey(), e.getValue()));
		return list;
	}

	/** @return the perplexity for K, or NaN if K was not evaluated successfully */
	public double getPerplexity(int numTopics) {
		Double p = points.get(numTopics);
		return (p != null) ? p : Double.NaN;
	}

	public SortedMap<Integer, String> getFailures() {
		return failures;
	}

	public int size() {
		return points.size();
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}

	public void writeCsv(PrintWriter writer) {
		writer.println(header);
		for (Map.Entry<Integer, Double> e : points.entrySet())
			writer.println(e.getKey() + separator + e.getValue());
		writer.flush();
	}

	public void saveCsv(File f) throws IOException {
		PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
		try {
			writeCsv(writer);
			if (writer.checkError())
				throw new IOException("error writing '" + f.getPath() + "'");
		} finally {
			writer.close();
		}
	}

	public static PerplexityCurve readCsv(InputStream is) throws IOException {
		List<PerplexityPoint> points = new ArrayList<PerplexityPoint>();
		BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		String line = reader.readLine();
		if ((line == null) || !line.trim().equals(header))
			throw new IOException("missing header '" + header + "'");
		int lineNo = 1;
		while ((line = reader.readLine()) != null) {
			lineNo++;
			if (line.trim().length() == 0)
				continue;
			String[] fields = line.split(separator);
			if (fields.length != 2)
				throw new IOException("line " + lineNo + ": expected 2 fields, found " + fields.length);
			try {
				points.add(new PerplexityPoint(Integer.parseInt(fields[0].trim()),
						Double.parseDouble(fields[1].trim())));
			} catch (NumberFormatException ex) {
				throw new IOException("line " + lineNo + ": " + ex.getMessage(), ex);
			}
		}
		try {
			return of(points);
		} catch (IllegalArgumentException ex) {
			throw new IOException(ex.getMessage(), ex);
		}
	}

	public static PerplexityCurve loadCsv(File f) throws IOException {
		InputStream is = new FileInputStream(f);
		try {
			return readCsv(is);
		} finally {
			is.close();
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof PerplexityCurve))
			return false;
		PerplexityCurve other = (PerplexityCurve) o;
		return points.equals(other.points) && failures.equals(other.failures);
	}

	@Override
	public int hashCode() {
		return 31 * points.hashCode() + failures.hashCode();
	}

	@Override
	public String toString() {
		return "PerplexityCurve" + getPoints() + (failures.isEmpty() ? "" : ", failed " + failures.keySet());
	}

}
