package edu.tum.cs.topicsweep.nlp.topic;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrix;
import edu.tum.cs.topicsweep.nlp.matrix.VocabularyAlignment;
import edu.tum.cs.topicsweep.nlp.topic.model.FitFailedException;
import edu.tum.cs.topicsweep.nlp.topic.model.TopicModel;
import edu.tum.cs.topicsweep.nlp.topic.model.TopicModelFitter;
import edu.tum.cs.topicsweep.util.ExperimentConfiguration;

/**
 * Fits one topic model per candidate number of topics on the training matrix and measures its perplexity on the
 * test matrix, after aligning the test matrix to the training vocabulary. Candidates are evaluated concurrently on a
 * bounded pool; the curve is always in ascending order of K. Failed candidates are recorded and do not stop the
 * sweep.
 */
public class TopicModelSweep<M extends TopicModel> {

	private static final Logger logger = Logger.getLogger(TopicModelSweep.class.getName());

	public static final String PROP_CANDIDATES = "candidates";
	public static final String PROP_FIT_TIMEOUT = "fitTimeoutSeconds";

	private static class Evaluation<M> {
		public final M model;
		public final double perplexity;

		public Evaluation(M model, double perplexity) {
			this.model = model;
			this.perplexity = perplexity;
		}
	}

	private final TopicModelFitter<M> fitter;
	private final int[] candidates;
	private int numThreads = Runtime.getRuntime().availableProcessors();
	private long fitTimeoutMillis = 0;
	private boolean keepModels = true;

	public TopicModelSweep(TopicModelFitter<M> fitter, int[] candidates) {
		checkCandidates(candidates);
		this.fitter = fitter;
		this.candidates = candidates.clone();
	}

	public static <M extends TopicModel> TopicModelSweep<M> fromConfiguration(ExperimentConfiguration cfg,
			TopicModelFitter<M> fitter) {
		String prefix = TopicModelSweep.class.getSimpleName() + ".";
		TopicModelSweep<M> sweep = new TopicModelSweep<M>(fitter, cfg.getIntListProperty(prefix + PROP_CANDIDATES));
		sweep.setNumThreads(cfg.getIntProperty(ExperimentConfiguration.PROP_NUM_THREADS,
				Runtime.getRuntime().availableProcessors()));
		sweep.setFitTimeout(cfg.getLongProperty(prefix + PROP_FIT_TIMEOUT, 0L), TimeUnit.SECONDS);
		return sweep;
	}

	private static void checkCandidates(int[] candidates) {
		if (candidates.length == 0)
			throw new IllegalArgumentException("no candidate numbers of topics");
		for (int i = 0; i < candidates.length; i++) {
			if (candidates[i] < 1)
				throw new IllegalArgumentException("number of topics must be positive, got " + candidates[i]);
			if ((i > 0) && (candidates[i] <= candidates[i - 1]))
				throw new IllegalArgumentException("candidates must be strictly ascending: " +
						Arrays.toString(candidates));
		}
	}

	public void setNumThreads(int numThreads) {
		if (numThreads < 1)
			throw new IllegalArgumentException("at least one thread is required");
		this.numThreads = numThreads;
	}

	/** limits the duration of a single fit; a non-positive value disables the limit */
	public void setFitTimeout(long timeout, TimeUnit unit) {
		this.fitTimeoutMillis = (timeout > 0) ? unit.toMillis(timeout) : 0;
	}

	public void setKeepModels(boolean keepModels) {
		this.keepModels = keepModels;
	}

	public int[] getCandidates() {
		return candidates.clone();
	}

	public SweepResult<M> run(final DocumentTermMatrix train, DocumentTermMatrix test) {
		VocabularyAlignment.Result alignment = VocabularyAlignment.align(test, train.getVocabulary());
		final DocumentTermMatrix heldOut = alignment.getMatrix();
		if (heldOut.countTokens() == 0)
			throw new IllegalStateException("no test token is part of the training vocabulary");
		logger.info("sweeping K=" + Arrays.toString(candidates) + " on " + train + ", held-out " + heldOut);

		ExecutorService pool = Executors.newFixedThreadPool(Math.min(numThreads, candidates.length),
				new ThreadFactoryBuilder().setNameFormat("topic-sweep-%d").build());
		// fits that exceed the timeout cannot be stopped, so their threads must not keep the VM alive
		final ExecutorService fitPool = (fitTimeoutMillis > 0) ? Executors.newCachedThreadPool(
				new ThreadFactoryBuilder().setNameFormat("topic-fit-%d").setDaemon(true).build()) : null;

		SortedMap<Integer, Double> points = new TreeMap<Integer, Double>();
		SortedMap<Integer, String> failures = new TreeMap<Integer, String>();
		SortedMap<Integer, M> models = new TreeMap<Integer, M>();
		try {
			Map<Integer, Future<Evaluation<M>>> futures = new LinkedHashMap<Integer, Future<Evaluation<M>>>();
			for (final int numTopics : candidates) {
				futures.put(numTopics, pool.submit(new Callable<Evaluation<M>>() {
					@Override
					public Evaluation<M> call() throws Exception {
						return evaluate(train, heldOut, numTopics, fitPool);
					}
				}));
			}

			for (Map.Entry<Integer, Future<Evaluation<M>>> e : futures.entrySet()) {
				int numTopics = e.getKey();
				try {
					Evaluation<M> evaluation = e.getValue().get();
					points.put(numTopics, evaluation.perplexity);
					if (keepModels)
						models.put(numTopics, evaluation.model);
					logger.info("K=" + numTopics + ": perplexity " + evaluation.perplexity);
				} catch (ExecutionException ex) {
					Throwable cause = ex.getCause();
					String reason = (cause.getMessage() != null) ? cause.getMessage() : cause.getClass().getName();
					failures.put(numTopics, reason);
					logger.log(Level.WARNING, "K=" + numTopics + " failed, continuing with remaining candidates",
							cause);
				}
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted while waiting for topic models", ex);
		} finally {
			pool.shutdownNow();
			if (fitPool != null)
				fitPool.shutdownNow();
		}

		if (points.isEmpty())
			throw new SweepFailedException(failures);

		SummaryStatistics stats = new SummaryStatistics();
		for (double p : points.values())
			stats.addValue(p);
		logger.info("sweep finished: " + points.size() + " of " + candidates.length + " candidates evaluated, " +
				"perplexity min " + stats.getMin() + ", max " + stats.getMax() + ", mean " + stats.getMean());

		return new SweepResult<M>(new PerplexityCurve(points, failures), models, alignment.getMismatch(), heldOut);
	}

	private Evaluation<M> evaluate(DocumentTermMatrix train, DocumentTermMatrix heldOut, int numTopics,
			ExecutorService fitPool) throws FitFailedException {
		M model = (fitPool != null) ? fitWithTimeout(train, numTopics, fitPool) : fitter.fit(train, numTopics);
		double perplexity = fitter.perplexity(model, heldOut);
		if (Double.isNaN(perplexity) || Double.isInfinite(perplexity) || (perplexity < 0.0))
			throw new FitFailedException(numTopics, "invalid perplexity " + perplexity);
		return new Evaluation<M>(model, perplexity);
	}

	private M fitWithTimeout(final DocumentTermMatrix train, final int numTopics, ExecutorService fitPool)
			throws FitFailedException {
		Future<M> future = fitPool.submit(new Callable<M>() {
			@Override
			public M call() throws Exception {
				return fitter.fit(train, numTopics);
			}
		});
		try {
			return future.get(fitTimeoutMillis, TimeUnit.MILLISECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			throw new FitFailedException(numTopics, "fit exceeded timeout of " + fitTimeoutMillis + "ms", ex);
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new FitFailedException(numTopics, "interrupted", ex);
		} catch (ExecutionException ex) {
			if (ex.getCause() instanceof FitFailedException)
				throw (FitFailedException) ex.getCause();
			throw new FitFailedException(numTopics, "fit failed", ex.getCause());
		}
	}

}
