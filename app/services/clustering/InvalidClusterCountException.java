package services.clustering;

/**
 * Raised when the requested number of clusters is below one or exceeds the
 * number of distinct documents with a non-zero vector.
 */
public class InvalidClusterCountException extends ClusteringException {

	private static final long serialVersionUID = -1390316416350860163L;

	private final int requested;

	private final int distinctDocuments;

	public InvalidClusterCountException(int requested, int distinctDocuments) {
		super("Cannot build " + requested + " clusters from " + distinctDocuments
				+ " distinct non-empty documents");
		this.requested = requested;
		this.distinctDocuments = distinctDocuments;
	}

	public int getRequested() {
		return requested;
	}

	public int getDistinctDocuments() {
		return distinctDocuments;
	}
}
