package services.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cern.colt.matrix.DoubleMatrix2D;
import services.vsm.DocumentVector;

/**
 * K-means over TF-IDF document vectors with k-means++ seeding and
 * best-of-N restarts.
 * <p>
 * Every restart draws from the same seeded random stream, so a given matrix,
 * cluster count and seed always give the same centroids and labels.
 * </p>
 */
public class KMeansClusteringAlgorithm {

	private final Logger logger = LoggerFactory.getLogger(KMeansClusteringAlgorithm.class);

	/**
	 * Trains a model on the rows of a dense or sparse matrix. Meant for
	 * small inputs; large corpora go through {@link #train(List, int, int, int, long)}.
	 */
	public KMeansModel train(DoubleMatrix2D matrix, int numClusters, int maxIterations,
			int numInits, long seed) {
		if (matrix.rows() == 0)
			throw new EmptyCorpusException();
		final List<DocumentVector> rows = new ArrayList<>(matrix.rows());
		for (int r = 0; r < matrix.rows(); r++)
			rows.add(DocumentVector.of(matrix.viewRow(r)));
		return train(rows, numClusters, maxIterations, numInits, seed);
	}

	/**
	 * Trains a model on document vectors.
	 * @param rows one vector per document, all of the same size
	 * @param numClusters K
	 * @param maxIterations cap on assignment/relocation rounds per restart
	 * @param numInits number of restarts, the one with the lowest inertia wins
	 * @param seed random seed for centroid seeding
	 * @throws EmptyCorpusException if the matrix has no rows
	 * @throws InvalidClusterCountException if K is below one or above the
	 * number of distinct non-zero rows
	 */
	public KMeansModel train(List<DocumentVector> rows, int numClusters, int maxIterations,
			int numInits, long seed) {
		if (maxIterations < 1)
			throw new IllegalArgumentException("maxIterations must be at least 1");
		if (numInits < 1)
			throw new IllegalArgumentException("numInits must be at least 1");
		if (rows.isEmpty())
			throw new EmptyCorpusException();

		final int dimension = rows.get(0).size();
		for (DocumentVector row : rows) {
			if (row.size() != dimension)
				throw new IllegalArgumentException("All rows must have " + dimension + " columns, got " + row.size());
		}

		final int distinct = countDistinctNonEmpty(rows);
		if (numClusters < 1 || numClusters > distinct)
			throw new InvalidClusterCountException(numClusters, distinct);

		final Random random = new Random(seed);
		KMeansModel best = null;
		int bestRun = -1;
		for (int run = 0; run < numInits; run++) {
			KMeansModel model = lloyd(rows, dimension, numClusters, maxIterations, random);
			logger.debug("Restart {}: inertia {} after {} iterations", run, model.getInertia(),
					model.getIterations());
			if (best == null || model.getInertia() < best.getInertia()) {
				best = model;
				bestRun = run;
			}
		}

		logger.info("Trained {} clusters over {} documents: restart {} of {} kept, inertia {}, {} iterations{}",
				numClusters, rows.size(), bestRun + 1, numInits, best.getInertia(), best.getIterations(),
				best.isConverged() ? "" : " (iteration cap reached)");
		return best;
	}

	private KMeansModel lloyd(List<DocumentVector> rows, int dimension, int numClusters,
			int maxIterations, Random random) {
		final Centroids centroids = seedCentroids(rows, dimension, numClusters, random);
		final int[] labels = new int[rows.size()];
		Arrays.fill(labels, -1);

		boolean converged = false;
		int iterations = 0;
		while (iterations < maxIterations) {
			iterations++;
			int moved = assign(rows, centroids, labels);
			logger.debug("Iteration {}: {} documents changed cluster", iterations, moved);
			if (moved == 0) {
				converged = true;
				break;
			}
			centroids.relocate(rows, labels);
		}
		if (!converged) {
			// labels must match the centroids the model is frozen with
			assign(rows, centroids, labels);
		}

		double inertia = 0;
		for (int r = 0; r < rows.size(); r++)
			inertia += centroids.squaredDistance(rows.get(r), labels[r]);

		return new KMeansModel(centroids, labels, inertia, iterations, converged);
	}

	/**
	 * k-means++: the first centroid is a uniformly drawn row, every next one
	 * a row drawn with probability proportional to its squared distance to
	 * the closest centroid chosen so far.
	 */
	private Centroids seedCentroids(List<DocumentVector> rows, int dimension, int numClusters, Random random) {
		final Centroids centroids = new Centroids(numClusters, dimension);
		final boolean[] chosen = new boolean[rows.size()];

		int pick = random.nextInt(rows.size());
		chosen[pick] = true;
		centroids.set(0, rows.get(pick));

		final double[] closest = new double[rows.size()];
		for (int r = 0; r < rows.size(); r++)
			closest[r] = centroids.squaredDistance(rows.get(r), 0);

		for (int k = 1; k < numClusters; k++) {
			double total = 0;
			for (double d : closest)
				total += d;

			pick = -1;
			if (total > 0) {
				final double target = random.nextDouble() * total;
				double cumulative = 0;
				for (int r = 0; r < rows.size(); r++) {
					if (closest[r] <= 0)
						continue;
					cumulative += closest[r];
					pick = r;
					if (cumulative > target)
						break;
				}
			} else {
				for (int r = 0; r < rows.size() && pick < 0; r++) {
					if (!chosen[r])
						pick = r;
				}
			}

			chosen[pick] = true;
			centroids.set(k, rows.get(pick));
			for (int r = 0; r < rows.size(); r++)
				closest[r] = Math.min(closest[r], centroids.squaredDistance(rows.get(r), k));
		}
		return centroids;
	}

	/**
	 * Moves every row to its nearest centroid.
	 * @return number of rows whose label changed
	 */
	private static int assign(List<DocumentVector> rows, Centroids centroids, int[] labels) {
		int moved = 0;
		for (int r = 0; r < rows.size(); r++) {
			int nearest = centroids.nearest(rows.get(r));
			if (nearest != labels[r]) {
				labels[r] = nearest;
				moved++;
			}
		}
		return moved;
	}

	private static int countDistinctNonEmpty(List<DocumentVector> rows) {
		final Set<DocumentVector> distinct = new HashSet<>();
		for (DocumentVector row : rows) {
			if (!row.isEmpty())
				distinct.add(row);
		}
		return distinct.size();
	}
}
