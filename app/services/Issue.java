package services;

/**
 * A cleaned feature request as received from the issue tracker.
 * Only the assigned cluster changes after creation.
 */
public class Issue {

	private final long id;

	private final int votes;

	private final String description;

	/**
	 * Index of the cluster this issue was last assigned to,
	 * <code>null</code> until an aggregation pass visits it.
	 */
	private Integer cluster;

	/**
	 * Creates a new issue.
	 * @param id tracker id
	 * @param votes community votes, never negative
	 * @param description cleaned description, <code>null</code> is
	 * read as an empty document
	 * @throws IllegalArgumentException if votes is negative
	 */
	public Issue(long id, int votes, String description) {
		if (votes < 0)
			throw new IllegalArgumentException("Issue " + id + " has a negative vote count: " + votes);
		this.id = id;
		this.votes = votes;
		this.description = description == null ? "" : description;
	}

	public long getId() {
		return id;
	}

	public int getVotes() {
		return votes;
	}

	public String getDescription() {
		return description;
	}

	public Integer getCluster() {
		return cluster;
	}

	public void setCluster(int cluster) {
		this.cluster = cluster;
	}

	@Override
	public String toString() {
		return "Issue[id=" + id + ", votes=" + votes + ", cluster=" + cluster + "]";
	}
}
