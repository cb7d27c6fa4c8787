package services.ranking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Min-max normalizes the issue and vote totals of all clusters and ranks
 * them by the mean of both scores.
 */
public class ClusterScorer {

	private final Logger logger = LoggerFactory.getLogger(ClusterScorer.class);

	private final double issueMultiplier;

	private final double voteMultiplier;

	public ClusterScorer() {
		this(1.0, 1.0);
	}

	public ClusterScorer(double issueMultiplier, double voteMultiplier) {
		this.issueMultiplier = issueMultiplier;
		this.voteMultiplier = voteMultiplier;
	}

	/**
	 * Scores every cluster of the assignment.
	 * @param assignment totals of one aggregation pass
	 * @param topTerms labels of each cluster, indexed by cluster
	 * @return all clusters, best first
	 */
	public List<Cluster> rank(ClusterAssignment assignment, List<List<String>> topTerms) {
		final int numClusters = assignment.getNumClusters();
		if (topTerms.size() != numClusters) {
			throw new IllegalArgumentException("Expected labels for " + numClusters
					+ " clusters, got " + topTerms.size());
		}

		final int[] issueCounts = assignment.getIssueCounts();
		final long[] voteSums = assignment.getVoteSums();
		final long[] counts = new long[numClusters];
		for (int k = 0; k < numClusters; k++)
			counts[k] = issueCounts[k];

		final double[] issueScores = normalize(counts, issueMultiplier);
		final double[] voteScores = normalize(voteSums, voteMultiplier);

		final List<Cluster> clusters = new ArrayList<>(numClusters);
		for (int k = 0; k < numClusters; k++) {
			double combined = (issueScores[k] + voteScores[k]) / 2;
			clusters.add(new Cluster(k, topTerms.get(k), issueCounts[k], voteSums[k],
					issueScores[k], voteScores[k], combined));
		}
		Collections.sort(clusters, Cluster.BY_SCORE_THEN_INDEX);

		if (!clusters.isEmpty())
			logger.info("Top cluster: {}", clusters.get(0));
		return clusters;
	}

	/**
	 * <code>multiplier * (v - min) / (max - min)</code> for every value; all
	 * zeros when every value is the same.
	 */
	static double[] normalize(long[] values, double multiplier) {
		final double[] scores = new double[values.length];
		if (values.length == 0)
			return scores;

		long min = values[0];
		long max = values[0];
		for (long v : values) {
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		if (max == min)
			return scores;

		final double range = max - min;
		for (int i = 0; i < values.length; i++)
			scores[i] = multiplier * ((values[i] - min) / range);
		return scores;
	}
}
