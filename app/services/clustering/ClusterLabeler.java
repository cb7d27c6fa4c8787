package services.clustering;

import java.util.ArrayList;
import java.util.List;

import com.carrotsearch.hppc.sorting.IndirectComparator;
import com.carrotsearch.hppc.sorting.IndirectSort;

import cern.colt.matrix.DoubleMatrix1D;
import services.vsm.Vocabulary;

/**
 * Describes a cluster by the vocabulary terms carrying the most weight in
 * its centroid.
 */
public class ClusterLabeler {

	public static final int DEFAULT_LABEL_COUNT = 10;

	/**
	 * Returns up to <code>labelCount</code> terms ordered by decreasing
	 * centroid weight, equal weights in lexical order. Terms with zero
	 * weight are not labels.
	 */
	public List<String> label(final DoubleMatrix1D centroid, final Vocabulary vocabulary, int labelCount) {
		if (labelCount < 1)
			throw new IllegalArgumentException("labelCount must be at least 1");
		if (centroid.size() != vocabulary.size()) {
			throw new IllegalArgumentException("Centroid has " + centroid.size()
					+ " columns but the vocabulary has " + vocabulary.size() + " terms");
		}

		final int[] order = IndirectSort.mergesort(0, centroid.size(), new IndirectComparator() {
			@Override
			public int compare(int a, int b) {
				int byWeight = Double.compare(centroid.getQuick(b), centroid.getQuick(a));
				return byWeight != 0 ? byWeight : vocabulary.term(a).compareTo(vocabulary.term(b));
			}
		});

		final List<String> labels = new ArrayList<>(Math.min(labelCount, order.length));
		for (int i = 0; i < order.length && labels.size() < labelCount; i++) {
			if (centroid.getQuick(order[i]) <= 0)
				break;
			labels.add(vocabulary.term(order[i]));
		}
		return labels;
	}

	public List<String> label(DoubleMatrix1D centroid, Vocabulary vocabulary) {
		return label(centroid, vocabulary, DEFAULT_LABEL_COUNT);
	}
}
