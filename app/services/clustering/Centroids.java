package services.clustering;

import java.util.List;

import cern.colt.matrix.DoubleMatrix1D;
import cern.colt.matrix.DoubleMatrix2D;
import cern.colt.matrix.impl.DenseDoubleMatrix2D;
import cern.jet.math.Functions;
import services.vsm.DocumentVector;

/**
 * Dense K x V centroid matrix with the cached squared norm of each row.
 * Written only by the training loop.
 */
final class Centroids {

	private final DoubleMatrix2D matrix;

	private final double[] squaredNorms;

	Centroids(int count, int dimension) {
		this.matrix = new DenseDoubleMatrix2D(count, dimension);
		this.squaredNorms = new double[count];
	}

	int count() {
		return matrix.rows();
	}

	int dimension() {
		return matrix.columns();
	}

	/**
	 * Index of the closest centroid; ties go to the lowest index.
	 */
	int nearest(DocumentVector x) {
		int nearest = 0;
		double best = squaredDistance(x, 0);
		for (int k = 1; k < count() && best > 0; k++) {
			double distance = squaredDistance(x, k);
			if (distance < best) {
				best = distance;
				nearest = k;
			}
		}
		return nearest;
	}

	double squaredDistance(DocumentVector x, int k) {
		return EuclideanDistance.squaredDistance(x, matrix.viewRow(k), squaredNorms[k]);
	}

	void set(int k, DocumentVector row) {
		DoubleMatrix1D centroid = matrix.viewRow(k);
		centroid.assign(0);
		for (int i = 0; i < row.nonZeros(); i++)
			centroid.setQuick(row.index(i), row.value(i));
		squaredNorms[k] = EuclideanDistance.squaredNorm(centroid);
	}

	/**
	 * Replaces every centroid that has members by the mean of its members,
	 * summing in place. Centroids without members stay where they are.
	 */
	void relocate(List<DocumentVector> rows, int[] labels) {
		final int[] members = new int[count()];
		for (int r = 0; r < rows.size(); r++)
			members[labels[r]]++;

		for (int k = 0; k < count(); k++) {
			if (members[k] > 0)
				matrix.viewRow(k).assign(0);
		}
		for (int r = 0; r < rows.size(); r++) {
			final int k = labels[r];
			final DocumentVector row = rows.get(r);
			for (int i = 0; i < row.nonZeros(); i++)
				matrix.setQuick(k, row.index(i), matrix.getQuick(k, row.index(i)) + row.value(i));
		}
		for (int k = 0; k < count(); k++) {
			if (members[k] == 0)
				continue;
			DoubleMatrix1D centroid = matrix.viewRow(k);
			centroid.assign(Functions.div(members[k]));
			squaredNorms[k] = EuclideanDistance.squaredNorm(centroid);
		}
	}

	DoubleMatrix1D centroid(int k) {
		return matrix.viewRow(k).copy();
	}

	DoubleMatrix2D toMatrix() {
		return matrix.copy();
	}
}
