package services.clustering;

/**
 * Raised when there are no documents to build a vocabulary or train a model from.
 */
public class EmptyCorpusException extends ClusteringException {

	private static final long serialVersionUID = 2209427851373187634L;

	public EmptyCorpusException() {
		super("Cannot cluster an empty corpus");
	}
}
