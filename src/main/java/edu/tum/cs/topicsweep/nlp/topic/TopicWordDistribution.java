package edu.tum.cs.topicsweep.nlp.topic;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import edu.tum.cs.topicsweep.nlp.matrix.Vocabulary;

public class TopicWordDistribution {

	public static final int defaultNumTopWords = 20;

	/** @return indices of the n most probable words in descending order of probability */
	public static int[] topWords(double[] topicWordDistr, int n) {
		n = Math.min(n, topicWordDistr.length);
		int[] topWordIdx = new int[n];
		Arrays.fill(topWordIdx, -1);
		// insertion into a short list kept in descending order
		for (int i = 0; i < topicWordDistr.length; i++) {
			int pos = n;
			while ((pos > 0) && ((topWordIdx[pos - 1] == -1) ||
					(topicWordDistr[i] > topicWordDistr[topWordIdx[pos - 1]])))
				pos--;
			if (pos >= n)
				continue;
			System.arraycopy(topWordIdx, pos, topWordIdx, pos + 1, n - pos - 1);
			topWordIdx[pos] = i;
		}
		return topWordIdx;
	}

	/** one block per topic: topic number, then lines "word, probability" */
	public static void writeTopicsCsv(double[][] topicWordDistr, Vocabulary vocabulary, int numTopWords,
			PrintWriter writer) {
		for (int i = 0; i < topicWordDistr.length; i++) {
			writer.println("topic," + (i + 1));
			for (int idx : topWords(topicWordDistr[i], numTopWords))
				writer.println(vocabulary.getTerm(idx) + "," + topicWordDistr[i][idx]);
			writer.println();
		}
		writer.flush();
	}

	public static void saveTopicsCsv(double[][] topicWordDistr, Vocabulary vocabulary, int numTopWords, File f)
			throws IOException {
		PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
		try {
			writeTopicsCsv(topicWordDistr, vocabulary, numTopWords, writer);
			if (writer.checkError())
				throw new IOException("error writing '" + f.getPath() + "'");
		} finally {
			writer.close();
		}
	}

}
