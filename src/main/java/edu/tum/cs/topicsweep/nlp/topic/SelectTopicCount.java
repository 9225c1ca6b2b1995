package edu.tum.cs.topicsweep.nlp.topic;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

import edu.tum.cs.topicsweep.nlp.corpus.CorpusSplitter;
import edu.tum.cs.topicsweep.nlp.corpus.Split;
import edu.tum.cs.topicsweep.nlp.corpus.Token;
import edu.tum.cs.topicsweep.nlp.corpus.TokenStreamReader;
import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrix;
import edu.tum.cs.topicsweep.nlp.matrix.DocumentTermMatrixBuilder;
import edu.tum.cs.topicsweep.nlp.tfidf.FrequencyAggregator;
import edu.tum.cs.topicsweep.nlp.tfidf.LemmaCount;
import edu.tum.cs.topicsweep.nlp.tfidf.TermFrequencies;
import edu.tum.cs.topicsweep.nlp.tfidf.TfIdfEngine;
import edu.tum.cs.topicsweep.nlp.tfidf.TfIdfTable;
import edu.tum.cs.topicsweep.nlp.topic.model.MalletLdaFitter;
import edu.tum.cs.topicsweep.nlp.topic.model.MalletTopicModel;
import edu.tum.cs.topicsweep.nlp.vocabulary.VocabularyFilter;
import edu.tum.cs.topicsweep.util.ExperimentConfiguration;
import edu.tum.cs.topicsweep.util.io.ArtifactCache;

/**
 * Batch entry point: reads lemmatized tokens, writes TF-IDF scores and the corpus-wide lemma frequencies, sweeps the
 * configured numbers of topics and writes the perplexity curve together with the top words of the selected model.
 * An optional argument overrides the token file of the configuration.
 */
public class SelectTopicCount {

	private static final Logger logger = Logger.getLogger(SelectTopicCount.class.getName());

	public static final String PROP_TOKEN_FILE = "tokenFile";
	public static final String PROP_NUM_TOP_LEMMAS = "numTopFrequentLemmas";
	public static final String PROP_NUM_TOP_WORDS = "numTopWords";

	public static final String tfIdfFileName = "tfidf.tsv";
	public static final String lemmaFrequencyFileName = "lemma-frequencies.tsv";
	public static final String perplexityFileName = "perplexity.csv";
	public static final String cacheDirName = "cache";

	private static final ArtifactCache.Codec<PerplexityCurve> curveCodec = new ArtifactCache.Codec<PerplexityCurve>() {
		@Override
		public void save(PerplexityCurve curve, File f) throws IOException {
			curve.saveCsv(f);
		}

		@Override
		public PerplexityCurve load(File f) throws IOException {
			return PerplexityCurve.loadCsv(f);
		}
	};

	public static void saveLemmaFrequencies(List<LemmaCount> ranking, int n, File f) throws IOException {
		PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
		try {
			writer.println("lemma\tcount");
			for (LemmaCount lc : ranking.subList(0, Math.min(n, ranking.size())))
				writer.println(lc.lemma + "\t" + lc.count);
			if (writer.checkError())
				throw new IOException("error writing '" + f.getPath() + "'");
		} finally {
			writer.close();
		}
	}

	/**
	 * Runs the whole flow on the given tokens and writes all outputs to the output directory.
	 *
	 * @return the selected number of topics
	 */
	public static int run(ExperimentConfiguration cfg, File tokenFile, File outputDir) throws Exception {
		if (!outputDir.isDirectory() && !outputDir.mkdirs())
			throw new IOException("cannot create output directory '" + outputDir.getPath() + "'");
		String prefix = SelectTopicCount.class.getSimpleName() + ".";

		List<Token> tokens = TokenStreamReader.readTokens(tokenFile);

		// coarse frequency view
		TermFrequencies rawFreq = FrequencyAggregator.aggregate(tokens, VocabularyFilter.forRawFrequency(cfg));
		saveLemmaFrequencies(rawFreq.rankLemmas(), cfg.getIntProperty(prefix + PROP_NUM_TOP_LEMMAS, 100),
				new File(outputDir, lemmaFrequencyFileName));

		VocabularyFilter filter = VocabularyFilter.forDocumentTermMatrix(cfg);
		TermFrequencies freq = FrequencyAggregator.aggregate(tokens, filter);
		List<String> emptyDocs = freq.getEmptyDocumentIds();
		if (!emptyDocs.isEmpty()) {
			logger.warning(emptyDocs.size() + " documents have no terms left after filtering and are excluded");
			freq = freq.withoutEmptyDocuments();
		}
		TfIdfTable tfIdf = TfIdfEngine.compute(freq);
		tfIdf.saveTsv(new File(outputDir, tfIdfFileName));
		logger.info("Wrote " + tfIdf.size() + " TF-IDF records");

		Split split = CorpusSplitter.fromConfiguration(cfg).split(freq.getDocumentIds());
		logger.info(split.toString());
		final DocumentTermMatrix train = DocumentTermMatrixBuilder.build(freq, split.getTrain());
		final DocumentTermMatrix test = DocumentTermMatrixBuilder.build(freq, split.getTest());

		MalletLdaFitter fitter = MalletLdaFitter.fromConfiguration(cfg);
		final TopicModelSweep<MalletTopicModel> sweep = TopicModelSweep.fromConfiguration(cfg, fitter);
		final SweepResult<?>[] result = new SweepResult<?>[1];

		ArtifactCache cache = new ArtifactCache(new File(outputDir, cacheDirName));
		// stop words may come from files outside the configuration
		String key = ArtifactCache.fingerprint(new File[] { tokenFile }, cfg.fingerprint(), filter.fingerprint());
		PerplexityCurve curve = cache.computeOrLoad("perplexity", key, ".csv", curveCodec,
				new Callable<PerplexityCurve>() {
					@Override
					public PerplexityCurve call() {
						SweepResult<MalletTopicModel> r = sweep.run(train, test);
						result[0] = r;
						return r.getCurve();
					}
				});
		curve.saveCsv(new File(outputDir, perplexityFileName));
		if (!curve.getFailures().isEmpty())
			logger.warning("Failed numbers of topics: " + curve.getFailures());

		int numTopics = ModelSelector.selectNumTopics(curve);
		logger.info("Selected K=" + numTopics + " (perplexity " + curve.getPerplexity(numTopics) + "), ranking " +
				ModelSelector.rank(curve));

		// models are not cached, so topics are only available for a freshly computed curve
		if (result[0] != null) {
			MalletTopicModel model = (MalletTopicModel) result[0].getModel(numTopics);
			TopicWordDistribution.saveTopicsCsv(model.getTopicWordDistr(), model.getVocabulary(),
					cfg.getIntProperty(prefix + PROP_NUM_TOP_WORDS, TopicWordDistribution.defaultNumTopWords),
					new File(outputDir, "topics-k" + numTopics + ".csv"));
		}
		return numTopics;
	}

	/** the first command line argument takes precedence over the configured token file */
	static File getTokenFile(ExperimentConfiguration cfg, String[] args) {
		return new File((args.length > 0) ? args[0] : cfg.getLocalProperty(PROP_TOKEN_FILE));
	}

	public static void main(String[] args) {
		try {
			ExperimentConfiguration cfg = new ExperimentConfiguration(SelectTopicCount.class);
			File tokenFile = getTokenFile(cfg, args);
			File outputDir = new File(cfg.getProperty(ExperimentConfiguration.PROP_OUTPUT_PATH, "."));
			int numTopics = run(cfg, tokenFile, outputDir);
			System.out.println(numTopics);
		} catch (Exception ex) {
			logger.log(Level.SEVERE, "Topic count selection failed", ex);
			System.exit(1);
		}
	}

}
