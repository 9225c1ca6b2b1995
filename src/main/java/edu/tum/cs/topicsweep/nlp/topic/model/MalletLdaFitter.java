package edu.tum.cs.topicsweep.nlp.topic.model;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import cc.mallet.topics.MarginalProbEstimator;
import cc.mallet.topics.ParallelTopicModel;
import cc.mallet.types.Alphabet;
import cc.mallet.types.FeatureSequence;
import cc.mallet.types.Instance;
import cc.mallet.types.InstanceList;

import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrix;
import edu.tum.cs.topicsweep.util.ExperimentConfiguration;

/**
 * Fits LDA with MALLET's collapsed Gibbs sampler. Each fit runs single-threaded with a fixed seed, so models are
 * reproducible; parallelism comes from fitting several numbers of topics at once. Hyperparameters are not optimized,
 * the symmetric priors stay as configured.
 *
 * Held-out perplexity is computed either with the deterministic approximation that assigns each token a soft topic
 * distribution given the preceding tokens of its document ({@link Estimator#APPROXIMATE}), or with MALLET's
 * left-to-right particle estimator ({@link Estimator#LEFT_TO_RIGHT}), which samples from an unseeded generator.
 */
public class MalletLdaFitter implements TopicModelFitter<MalletTopicModel> {

	private static final Logger logger = Logger.getLogger(MalletLdaFitter.class.getName());
	// MALLET reports every few iterations on INFO; progress is reported per model here instead
	private static final Logger malletLogger = Logger.getLogger(ParallelTopicModel.class.getName());

	static {
		malletLogger.setLevel(Level.WARNING);
	}

	public static enum Estimator { APPROXIMATE, LEFT_TO_RIGHT };

	public static final String PROP_ALPHA_SUM = "alphaSum";
	public static final String PROP_BETA = "beta";
	public static final String PROP_NUM_ITERATIONS = "numIterations";
	public static final String PROP_ESTIMATOR = "estimator";
	public static final String PROP_NUM_PARTICLES = "numParticles";

	private final double alphaSum;
	private final double beta;
	private final int numIterations;
	private final int seed;
	private Estimator estimator = Estimator.APPROXIMATE;
	private int numParticles = 10;

	public MalletLdaFitter(double alphaSum, double beta, int numIterations, int seed) {
		if ((alphaSum <= 0.0) || (beta <= 0.0))
			throw new IllegalArgumentException("priors must be positive");
		if (numIterations < 1)
			throw new IllegalArgumentException("at least one iteration is required");
		this.alphaSum = alphaSum;
		this.beta = beta;
		this.numIterations = numIterations;
		this.seed = seed;
	}

	public static MalletLdaFitter fromConfiguration(ExperimentConfiguration cfg) {
		String prefix = MalletLdaFitter.class.getSimpleName() + ".";
		MalletLdaFitter fitter = new MalletLdaFitter(cfg.getDoubleProperty(prefix + PROP_ALPHA_SUM, 50.0),
				cfg.getDoubleProperty(prefix + PROP_BETA, 0.01),
				cfg.getIntProperty(prefix + PROP_NUM_ITERATIONS, 1000),
				cfg.getIntProperty(prefix + ExperimentConfiguration.PROP_SEED, 42));
		fitter.setEstimator(Estimator.valueOf(cfg.getProperty(prefix + PROP_ESTIMATOR, Estimator.APPROXIMATE.name())));
		fitter.setNumParticles(cfg.getIntProperty(prefix + PROP_NUM_PARTICLES, 10));
		return fitter;
	}

	public void setEstimator(Estimator estimator) {
		this.estimator = estimator;
	}

	public void setNumParticles(int numParticles) {
		if (numParticles < 1)
			throw new IllegalArgumentException("at least one particle is required");
		this.numParticles = numParticles;
	}

	@Override
	public MalletTopicModel fit(DocumentTermMatrix train, int numTopics) throws FitFailedException {
		if (numTopics < 1)
			throw new IllegalArgumentException("number of topics must be positive, got " + numTopics);
		if (train.numRows() == 0)
			throw new FitFailedException(numTopics, "training matrix is empty");

		Alphabet alphabet = new Alphabet();
		for (String term : train.getVocabulary().getTerms())
			alphabet.lookupIndex(term, true);
		alphabet.stopGrowth();

		ParallelTopicModel lda = new ParallelTopicModel(numTopics, alphaSum, beta);
		lda.setRandomSeed(seed);	// must precede addInstances, which draws the initial assignment
		lda.setNumThreads(1);
		lda.setNumIterations(numIterations);
		lda.setBurninPeriod(numIterations);	// no hyperparameter optimization
		lda.setTopicDisplay(numIterations + 1, 0);
		lda.printLogLikelihood = false;
		try {
			lda.addInstances(toInstances(train, alphabet));
			long startTime = System.currentTimeMillis();
			lda.estimate();
			logger.info("K=" + numTopics + ": estimated LDA in " + (System.currentTimeMillis() - startTime) + "ms, " +
					"train LL/token " + (lda.modelLogLikelihood() / train.countTokens()));
		} catch (Exception ex) {
			throw new FitFailedException(numTopics, "MALLET failed to estimate the model", ex);
		}
		return new MalletTopicModel(lda, alphabet, train.getVocabulary(), alphaSum);
	}

	@Override
	public double perplexity(MalletTopicModel model, DocumentTermMatrix heldOut) throws FitFailedException {
		if (!heldOut.getVocabulary().equals(model.getVocabulary()))
			throw new IllegalArgumentException("held-out matrix is not aligned to the training vocabulary");
		int numTopics = model.getNumTopics();
		int numTokens = heldOut.countTokens();
		if (numTokens == 0)
			throw new FitFailedException(numTopics, "no held-out tokens");

		double logLikelihood;
		try {
			if (estimator == Estimator.LEFT_TO_RIGHT) {
				MarginalProbEstimator probEstimator = model.getParallelTopicModel().getProbEstimator();
				logLikelihood = probEstimator.evaluateLeftToRight(toInstances(heldOut, model.getAlphabet()),
						numParticles, false, null);
			} else
				logLikelihood = approxLogLikelihood(heldOut, model.getTopicWordDistr(), model.getAlpha());
		} catch (RuntimeException ex) {
			throw new FitFailedException(numTopics, "held-out likelihood estimation failed", ex);
		}

		double p = perplexity(logLikelihood, numTokens);
		if (Double.isNaN(p) || Double.isInfinite(p))
			throw new FitFailedException(numTopics, "perplexity diverged (log likelihood " + logLikelihood + ")");
		return p;
	}

	public static double perplexity(double logLikelihood, int numTokens) {
		return Math.exp(-(logLikelihood / numTokens));
	}

	/**
	 * Sequentially accumulates soft topic assignments of the tokens of each document and adds the predictive log
	 * probability of every token given the assignments of its predecessors.
	 */
	static double approxLogLikelihood(DocumentTermMatrix dtm, double[][] phi, double alpha) {
		int numTopics = phi.length;
		double logLikelihood = 0.0;
		double[] w = new double[numTopics];
		double[] z = new double[numTopics];
		for (int row = 0; row < dtm.numRows(); row++) {
			Arrays.fill(z, 0.0);
			double sumZ = alpha * numTopics;

			int[] columns = dtm.getRowColumnIds(row);
			int[] counts = dtm.getRowCounts(row);
			for (int i = 0; i < columns.length; i++) {
				int wordIndex = columns[i];
				for (int c = 0; c < counts[i]; c++) {
					double sumW = 0.0;
					for (int k = 0; k < numTopics; k++) {
						w[k] = ((alpha + z[k]) / sumZ) * phi[k][wordIndex];
						sumW += w[k];
					}
					logLikelihood += Math.log(sumW);

					for (int k = 0; k < numTopics; k++) {
						double wNorm = w[k] / sumW;
						z[k] += wNorm;
						sumZ += wNorm;
					}
				}
			}
		}
		return logLikelihood;
	}

	/** expands each row into a token sequence, columns in ascending order */
	static InstanceList toInstances(DocumentTermMatrix dtm, Alphabet alphabet) {
		InstanceList instances = new InstanceList(alphabet, null);
		for (int row = 0; row < dtm.numRows(); row++) {
			int[] columns = dtm.getRowColumnIds(row);
			int[] counts = dtm.getRowCounts(row);
			int[] features = new int[dtm.rowSum(row)];
			int pos = 0;
			for (int i = 0; i < columns.length; i++)
				for (int c = 0; c < counts[i]; c++)
					features[pos++] = columns[i];
			String documentId = dtm.getRowIds().get(row);
			instances.add(new Instance(new FeatureSequence(alphabet, features), null, documentId, null));
		}
		return instances;
	}

}
