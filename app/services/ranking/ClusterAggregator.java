package services.ranking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import services.Issue;
import services.clustering.KMeansModel;
import services.vsm.TfIdfVectorizer;

/**
 * Assigns issues to their nearest cluster and totals issues and votes per
 * cluster. Every call starts from zeroed counters, so aggregating the same
 * issues twice gives the same totals.
 */
public class ClusterAggregator {

	private final Logger logger = LoggerFactory.getLogger(ClusterAggregator.class);

	/**
	 * Predicts the cluster of every issue and records it on the issue.
	 * @throws IllegalArgumentException if two issues share an id
	 */
	public ClusterAssignment aggregate(List<Issue> issues, TfIdfVectorizer vectorizer, KMeansModel model) {
		final int numClusters = model.getNumClusters();
		final int[] issueCounts = new int[numClusters];
		final long[] voteSums = new long[numClusters];
		final Map<Long, Integer> clusterByIssue = new LinkedHashMap<>();

		for (Issue issue : issues) {
			if (clusterByIssue.containsKey(issue.getId()))
				throw new IllegalArgumentException("Duplicate issue id " + issue.getId());

			int cluster = model.predict(vectorizer.vectorize(issue.getDescription()));
			clusterByIssue.put(issue.getId(), cluster);
			issueCounts[cluster]++;
			voteSums[cluster] += issue.getVotes();
		}

		// issues are only touched once every prediction succeeded
		for (Issue issue : issues)
			issue.setCluster(clusterByIssue.get(issue.getId()));

		logger.info("Aggregated {} issues into {} clusters", issues.size(), numClusters);
		return new ClusterAssignment(clusterByIssue, issueCounts, voteSums);
	}
}
