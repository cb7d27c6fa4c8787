package services.clustering;

/**
 * Base class of the errors raised when issues cannot be clustered.
 */
public class ClusteringException extends RuntimeException {

	private static final long serialVersionUID = -4470871129338524915L;

	public ClusteringException(String message) {
		super(message);
	}
}
