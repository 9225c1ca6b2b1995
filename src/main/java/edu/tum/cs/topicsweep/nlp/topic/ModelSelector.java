package edu.tum.cs.topicsweep.nlp.topic;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public class ModelSelector {

	/** ascending perplexity, ties broken by the smaller number of topics */
	public static final Comparator<PerplexityPoint> byPerplexity = new Comparator<PerplexityPoint>() {
		@Override
		public int compare(PerplexityPoint p1, PerplexityPoint p2) {
			int c = Double.compare(p1.getPerplexity(), p2.getPerplexity());
			if (c == 0)
				c = Integer.compare(p1.getNumTopics(), p2.getNumTopics());
			return c;
		}
	};

	/** @return the number of topics with minimal perplexity; the smallest such K on ties */
	public static int selectNumTopics(PerplexityCurve curve) {
		return best(curve).getNumTopics();
	}

	public static PerplexityPoint best(PerplexityCurve curve) {
		if (curve.isEmpty())
			throw new IllegalArgumentException("cannot select from an empty perplexity curve");
		return Collections.min(curve.getPoints(), byPerplexity);
	}

	/** @return all points of the curve, best first */
	public static List<PerplexityPoint> rank(PerplexityCurve curve) {
		List<PerplexityPoint> ranked = curve.getPoints();
		Collections.sort(ranked, byPerplexity);
		return ranked;
	}

}
