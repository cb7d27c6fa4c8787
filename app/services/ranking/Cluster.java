package services.ranking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A scored cluster of feature requests, as handed to reporting.
 */
public final class Cluster {

	/**
	 * Highest combined score first, lower index first on equal scores.
	 */
	public static final Comparator<Cluster> BY_SCORE_THEN_INDEX = new Comparator<Cluster>() {
		@Override
		public int compare(Cluster a, Cluster b) {
			int byScore = Double.compare(b.combinedScore, a.combinedScore);
			return byScore != 0 ? byScore : Integer.compare(a.index, b.index);
		}
	};

	private final int index;

	private final List<String> topTerms;

	private final int issueCount;

	private final long voteSum;

	private final double issueScore;

	private final double voteScore;

	private final double combinedScore;

	public Cluster(int index, List<String> topTerms, int issueCount, long voteSum,
			double issueScore, double voteScore, double combinedScore) {
		this.index = index;
		this.topTerms = Collections.unmodifiableList(new ArrayList<>(topTerms));
		this.issueCount = issueCount;
		this.voteSum = voteSum;
		this.issueScore = issueScore;
		this.voteScore = voteScore;
		this.combinedScore = combinedScore;
	}

	public int getIndex() {
		return index;
	}

	public List<String> getTopTerms() {
		return topTerms;
	}

	public int getIssueCount() {
		return issueCount;
	}

	public long getVoteSum() {
		return voteSum;
	}

	public double getIssueScore() {
		return issueScore;
	}

	public double getVoteScore() {
		return voteScore;
	}

	public double getCombinedScore() {
		return combinedScore;
	}

	/**
	 * Key/value view for serialization, keys in a fixed order.
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("index", index);
		map.put("top_terms", topTerms);
		map.put("issue_count", issueCount);
		map.put("vote_sum", voteSum);
		map.put("issue_score", issueScore);
		map.put("vote_score", voteScore);
		map.put("combined_score", combinedScore);
		return map;
	}

	@Override
	public String toString() {
		return "Cluster" + toMap();
	}
}
