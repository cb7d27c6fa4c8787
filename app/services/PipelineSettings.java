package services;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tuning knobs of the mining pipeline. Defaults live in
 * <code>conf/reference.conf</code> under the <code>miner</code> block;
 * {@link #builder()} starts from the same values.
 */
public final class PipelineSettings {

	public static final String CONFIG_PATH = "miner";

	private final int numberOfClusters;
	private final int minNgram;
	private final int maxNgram;
	private final List<String> extraStopWords;
	private final double issueMultiplier;
	private final double voteMultiplier;
	private final int maxIterations;
	private final int numInits;
	private final long seed;
	private final int topTermsCount;
	private final int minTokenLength;
	private final boolean smoothIdf;
	private final boolean sublinearTf;

	private PipelineSettings(Builder b) {
		this.numberOfClusters = b.numberOfClusters;
		this.minNgram = b.minNgram;
		this.maxNgram = b.maxNgram;
		List<String> stopWords = new ArrayList<>(b.extraStopWords.size());
		for (String word : b.extraStopWords)
			stopWords.add(word.toLowerCase(Locale.ROOT));
		this.extraStopWords = Collections.unmodifiableList(stopWords);
		this.issueMultiplier = b.issueMultiplier;
		this.voteMultiplier = b.voteMultiplier;
		this.maxIterations = b.maxIterations;
		this.numInits = b.numInits;
		this.seed = b.seed;
		this.topTermsCount = b.topTermsCount;
		this.minTokenLength = b.minTokenLength;
		this.smoothIdf = b.smoothIdf;
		this.sublinearTf = b.sublinearTf;
		validate();
	}

	private void validate() {
		check(numberOfClusters >= 1, "number-of-clusters must be at least 1");
		check(minNgram >= 1, "ngram-range lower bound must be at least 1");
		check(maxNgram >= minNgram, "ngram-range upper bound must not be lower than the lower bound");
		check(issueMultiplier >= 0 && issueMultiplier <= 1, "issue-multiplier must lie in [0, 1]");
		check(voteMultiplier >= 0 && voteMultiplier <= 1, "vote-multiplier must lie in [0, 1]");
		check(maxIterations >= 1, "max-iterations must be at least 1");
		check(numInits >= 1, "num-inits must be at least 1");
		check(topTermsCount >= 1, "top-terms-count must be at least 1");
		check(minTokenLength >= 1, "min-token-length must be at least 1");
	}

	private static void check(boolean condition, String message) {
		if (!condition)
			throw new IllegalArgumentException(message);
	}

	/**
	 * Reads the <code>miner</code> block of the application configuration.
	 */
	public static PipelineSettings load() {
		return fromConfig(ConfigFactory.load());
	}

	/**
	 * Reads settings from the <code>miner</code> block of the given
	 * configuration. Missing keys fall back to <code>reference.conf</code>.
	 */
	public static PipelineSettings fromConfig(Config config) {
		Config miner = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
		List<Integer> ngramRange = miner.getIntList("ngram-range");
		if (ngramRange.size() != 2)
			throw new IllegalArgumentException("ngram-range must hold exactly two values, got " + ngramRange);

		return builder()
				.numberOfClusters(miner.getInt("number-of-clusters"))
				.ngramRange(ngramRange.get(0), ngramRange.get(1))
				.extraStopWords(miner.getStringList("extra-stop-words"))
				.issueMultiplier(miner.getDouble("issue-multiplier"))
				.voteMultiplier(miner.getDouble("vote-multiplier"))
				.maxIterations(miner.getInt("max-iterations"))
				.numInits(miner.getInt("num-inits"))
				.seed(miner.getLong("seed"))
				.topTermsCount(miner.getInt("top-terms-count"))
				.minTokenLength(miner.getInt("min-token-length"))
				.smoothIdf(miner.getBoolean("smooth-idf"))
				.sublinearTf(miner.getBoolean("sublinear-tf"))
				.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.numberOfClusters(numberOfClusters)
				.ngramRange(minNgram, maxNgram)
				.extraStopWords(extraStopWords)
				.issueMultiplier(issueMultiplier)
				.voteMultiplier(voteMultiplier)
				.maxIterations(maxIterations)
				.numInits(numInits)
				.seed(seed)
				.topTermsCount(topTermsCount)
				.minTokenLength(minTokenLength)
				.smoothIdf(smoothIdf)
				.sublinearTf(sublinearTf);
	}

	public int getNumberOfClusters() {
		return numberOfClusters;
	}

	public int getMinNgram() {
		return minNgram;
	}

	public int getMaxNgram() {
		return maxNgram;
	}

	public List<String> getExtraStopWords() {
		return extraStopWords;
	}

	public double getIssueMultiplier() {
		return issueMultiplier;
	}

	public double getVoteMultiplier() {
		return voteMultiplier;
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	public int getNumInits() {
		return numInits;
	}

	public long getSeed() {
		return seed;
	}

	public int getTopTermsCount() {
		return topTermsCount;
	}

	public int getMinTokenLength() {
		return minTokenLength;
	}

	public boolean isSmoothIdf() {
		return smoothIdf;
	}

	public boolean isSublinearTf() {
		return sublinearTf;
	}

	public static final class Builder {

		private int numberOfClusters = 50;
		private int minNgram = 1;
		private int maxNgram = 2;
		private List<String> extraStopWords = Arrays.asList("feature", "issue");
		private double issueMultiplier = 1.0;
		private double voteMultiplier = 1.0;
		private int maxIterations = 100;
		private int numInits = 1;
		private long seed = 0L;
		private int topTermsCount = 10;
		private int minTokenLength = 2;
		private boolean smoothIdf = true;
		private boolean sublinearTf = false;

		private Builder() {
		}

		public Builder numberOfClusters(int numberOfClusters) {
			this.numberOfClusters = numberOfClusters;
			return this;
		}

		public Builder ngramRange(int minNgram, int maxNgram) {
			this.minNgram = minNgram;
			this.maxNgram = maxNgram;
			return this;
		}

		public Builder extraStopWords(List<String> extraStopWords) {
			this.extraStopWords = new ArrayList<>(extraStopWords);
			return this;
		}

		public Builder issueMultiplier(double issueMultiplier) {
			this.issueMultiplier = issueMultiplier;
			return this;
		}

		public Builder voteMultiplier(double voteMultiplier) {
			this.voteMultiplier = voteMultiplier;
			return this;
		}

		public Builder maxIterations(int maxIterations) {
			this.maxIterations = maxIterations;
			return this;
		}

		public Builder numInits(int numInits) {
			this.numInits = numInits;
			return this;
		}

		public Builder seed(long seed) {
			this.seed = seed;
			return this;
		}

		public Builder topTermsCount(int topTermsCount) {
			this.topTermsCount = topTermsCount;
			return this;
		}

		public Builder minTokenLength(int minTokenLength) {
			this.minTokenLength = minTokenLength;
			return this;
		}

		public Builder smoothIdf(boolean smoothIdf) {
			this.smoothIdf = smoothIdf;
			return this;
		}

		public Builder sublinearTf(boolean sublinearTf) {
			this.sublinearTf = sublinearTf;
			return this;
		}

		public PipelineSettings build() {
			return new PipelineSettings(this);
		}
	}
}
