package services.ranking;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of one aggregation pass: the cluster predicted for each issue and
 * the issue and vote totals of every cluster.
 */
public final class ClusterAssignment {

	private final Map<Long, Integer> clusterByIssue;

	private final int[] issueCounts;

	private final long[] voteSums;

	ClusterAssignment(Map<Long, Integer> clusterByIssue, int[] issueCounts, long[] voteSums) {
		this.clusterByIssue = Collections.unmodifiableMap(clusterByIssue);
		this.issueCounts = issueCounts;
		this.voteSums = voteSums;
	}

	public int getNumClusters() {
		return issueCounts.length;
	}

	/**
	 * Issue id to cluster index, in input order.
	 */
	public Map<Long, Integer> getClusterByIssue() {
		return clusterByIssue;
	}

	public Integer getCluster(long issueId) {
		return clusterByIssue.get(issueId);
	}

	public int getIssueCount(int cluster) {
		return issueCounts[cluster];
	}

	public long getVoteSum(int cluster) {
		return voteSums[cluster];
	}

	public int[] getIssueCounts() {
		return issueCounts.clone();
	}

	public long[] getVoteSums() {
		return voteSums.clone();
	}
}
