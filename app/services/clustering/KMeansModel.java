package services.clustering;

import cern.colt.matrix.DoubleMatrix1D;
import cern.colt.matrix.DoubleMatrix2D;
import services.vsm.DocumentVector;

/**
 * Result of a k-means training run: the frozen centroids plus the label
 * of every training row. Prediction only reads the centroids, so a model
 * can be shared between threads.
 */
public final class KMeansModel {

	private final Centroids centroids;

	private final int[] labels;

	private final double inertia;

	private final int iterations;

	private final boolean converged;

	KMeansModel(Centroids centroids, int[] labels, double inertia, int iterations, boolean converged) {
		this.centroids = centroids;
		this.labels = labels;
		this.inertia = inertia;
		this.iterations = iterations;
		this.converged = converged;
	}

	/**
	 * Index of the centroid nearest to the vector, lowest index on ties.
	 * @throws IllegalArgumentException if the vector does not live in the
	 * vocabulary space the model was trained on
	 */
	public int predict(DocumentVector vector) {
		if (vector.size() != centroids.dimension()) {
			throw new IllegalArgumentException("Expected a vector of " + centroids.dimension()
					+ " columns, got " + vector.size());
		}
		return centroids.nearest(vector);
	}

	public int predict(DoubleMatrix1D vector) {
		return predict(DocumentVector.of(vector));
	}

	public int getNumClusters() {
		return centroids.count();
	}

	public int getDimension() {
		return centroids.dimension();
	}

	/**
	 * Copy of centroid <code>k</code>.
	 */
	public DoubleMatrix1D getCentroid(int k) {
		return centroids.centroid(k);
	}

	/**
	 * Copy of the K x V centroid matrix.
	 */
	public DoubleMatrix2D getCentroids() {
		return centroids.toMatrix();
	}

	/**
	 * Cluster of each training row, in row order.
	 */
	public int[] getLabels() {
		return labels.clone();
	}

	/**
	 * Sum of squared distances between training rows and their centroid.
	 */
	public double getInertia() {
		return inertia;
	}

	public int getIterations() {
		return iterations;
	}

	/**
	 * Whether training stopped because no row changed cluster, as opposed
	 * to hitting the iteration cap.
	 */
	public boolean isConverged() {
		return converged;
	}
}
