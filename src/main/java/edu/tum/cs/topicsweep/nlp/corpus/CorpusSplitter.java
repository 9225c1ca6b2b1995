package edu.tum.cs.topicsweep.nlp.corpus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import edu.tum.cs.topicsweep.util.ExperimentConfiguration;

/**
 * Draws a uniform sample without replacement of ceil(f * N) documents as test set; the remaining documents form
 * the training set. Documents are put in ascending id order before sampling, and the generator is a seeded
 * XOR_SHIFT_1024_S, so the partition only depends on the document set, the fraction and the seed.
 */
public class CorpusSplitter {

	private static final Logger logger = Logger.getLogger(CorpusSplitter.class.getName());

	public static final String PROP_TEST_FRACTION = "testFraction";
	public static final double defaultTestFraction = 0.2;
	public static final long defaultSeed = 42L;

	private final double testFraction;
	private final long seed;

	public CorpusSplitter(double testFraction, long seed) {
		this.testFraction = testFraction;
		this.seed = seed;
	}

	public static CorpusSplitter fromConfiguration(ExperimentConfiguration cfg) {
		String prefix = CorpusSplitter.class.getSimpleName() + ".";
		return new CorpusSplitter(cfg.getDoubleProperty(prefix + PROP_TEST_FRACTION, defaultTestFraction),
				cfg.getLongProperty(prefix + ExperimentConfiguration.PROP_SEED, defaultSeed));
	}

	public Split split(Collection<String> documentIds) {
		List<String> sorted = new ArrayList<String>(new TreeSet<String>(documentIds));
		int n = sorted.size();
		if (n != documentIds.size())
			throw new IllegalArgumentException("document ids are not unique");
		if (!(testFraction > 0.0) || !(testFraction < 1.0))
			throw new InvalidSplitException("test fraction must be in (0, 1)", testFraction, n);
		if (n < 2)
			throw new InvalidSplitException("at least two documents are required", testFraction, n);
		int numTest = numTestDocuments(testFraction, n);
		if (numTest >= n)
			throw new InvalidSplitException("no documents left for training", testFraction, n);

		boolean[] isTest = new boolean[n];
		UniformRandomProvider prng = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		for (int idx : sampleWithoutReplacement(prng, n, numTest))
			isTest[idx] = true;

		List<String> train = new ArrayList<String>(n - numTest);
		List<String> test = new ArrayList<String>(numTest);
		for (int i = 0; i < n; i++) {
			if (isTest[i])
				test.add(sorted.get(i));
			else
				train.add(sorted.get(i));
		}
		Split split = new Split(train, test);
		logger.info("split " + n + " documents with seed " + seed + ": " + split);
		return split;
	}

	/** ceil(f * N) on the decimal value of f, so that 0.7 * 10 is exactly 7 */
	static int numTestDocuments(double testFraction, int numDocuments) {
		return new BigDecimal(Double.toString(testFraction)).multiply(BigDecimal.valueOf(numDocuments))
				.setScale(0, RoundingMode.CEILING).intValueExact();
	}

	/** selection sampling; returns numSamples distinct indices in [0, numEvents) in ascending order */
	static int[] sampleWithoutReplacement(UniformRandomProvider prng, int numEvents, int numSamples) {
		int[] samples = new int[numSamples];
		int n = 0, t = 0;
		while (n < numSamples) {
			double u = prng.nextDouble();
			if ((u * (numEvents - t)) < (numSamples - n))
				samples[n++] = t;
			t++;
		}
		return samples;
	}

	public double getTestFraction() {
		return testFraction;
	}

	public long getSeed() {
		return seed;
	}

}
