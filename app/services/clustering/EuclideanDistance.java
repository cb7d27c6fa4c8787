package services.clustering;

import cern.colt.matrix.DoubleMatrix1D;
import services.vsm.DocumentVector;

/**
 * Squared Euclidean distance between a sparse document vector and a dense
 * centroid, expanded as <code>|x|^2 + |c|^2 - 2 x.c</code> so that only the
 * non-zero cells of the document are visited.
 */
final class EuclideanDistance {

	private EuclideanDistance() {
	}

	/**
	 * Squared norm of a dense vector, summed in column order.
	 */
	static double squaredNorm(DoubleMatrix1D vector) {
		double norm = 0;
		for (int i = 0; i < vector.size(); i++) {
			double v = vector.getQuick(i);
			norm += v * v;
		}
		return norm;
	}

	static double squaredDistance(DocumentVector x, DoubleMatrix1D centroid, double centroidSquaredNorm) {
		if (x.size() != centroid.size()) {
			throw new IllegalArgumentException("Both vectors should have the same number of columns: "
					+ x.size() + " != " + centroid.size());
		}
		double dot = 0;
		for (int i = 0; i < x.nonZeros(); i++)
			dot += x.value(i) * centroid.getQuick(x.index(i));
		double distance = x.squaredNorm() + centroidSquaredNorm - 2 * dot;
		// rounding may leave a tiny negative value for identical vectors
		return distance > 0 ? distance : 0;
	}
}
