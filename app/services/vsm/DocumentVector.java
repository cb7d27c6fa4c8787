package services.vsm;

import java.util.Arrays;

import cern.colt.list.DoubleArrayList;
import cern.colt.list.IntArrayList;
import cern.colt.matrix.DoubleMatrix1D;
import cern.colt.matrix.impl.SparseDoubleMatrix1D;

/**
 * Immutable sparse document vector: the non-zero cells sorted by column,
 * plus the squared norm. The fixed column order keeps sums over the cells
 * bit-identical for equal vectors.
 */
public final class DocumentVector {

	private final int size;

	private final int[] indices;

	private final double[] values;

	private final double squaredNorm;

	/**
	 * @param size number of columns of the vocabulary space
	 * @param indices columns of the non-zero cells, strictly ascending
	 * @param values weights of those cells
	 */
	DocumentVector(int size, int[] indices, double[] values) {
		if (indices.length != values.length)
			throw new IllegalArgumentException("Expected one value per index");
		for (int i = 0; i < indices.length; i++) {
			if (indices[i] < 0 || indices[i] >= size || (i > 0 && indices[i] <= indices[i - 1]))
				throw new IllegalArgumentException("Column indices must be ascending and below " + size);
		}
		this.size = size;
		this.indices = indices;
		this.values = values;
		double norm = 0;
		for (double v : values)
			norm += v * v;
		this.squaredNorm = norm;
	}

	/**
	 * Copies the non-zero cells of a Colt vector.
	 */
	public static DocumentVector of(DoubleMatrix1D vector) {
		final IntArrayList indexList = new IntArrayList();
		vector.getNonZeros(indexList, new DoubleArrayList());
		final int[] indices = Arrays.copyOf(indexList.elements(), indexList.size());
		Arrays.sort(indices);
		final double[] values = new double[indices.length];
		for (int i = 0; i < indices.length; i++)
			values[i] = vector.getQuick(indices[i]);
		return new DocumentVector(vector.size(), indices, values);
	}

	public int size() {
		return size;
	}

	public int nonZeros() {
		return indices.length;
	}

	public boolean isEmpty() {
		return indices.length == 0;
	}

	/**
	 * Column of the <code>i</code>-th non-zero cell.
	 */
	public int index(int i) {
		return indices[i];
	}

	/**
	 * Weight of the <code>i</code>-th non-zero cell.
	 */
	public double value(int i) {
		return values[i];
	}

	public double get(int column) {
		int i = Arrays.binarySearch(indices, column);
		return i >= 0 ? values[i] : 0;
	}

	public double squaredNorm() {
		return squaredNorm;
	}

	public DoubleMatrix1D toMatrix() {
		final DoubleMatrix1D vector = new SparseDoubleMatrix1D(size);
		for (int i = 0; i < indices.length; i++)
			vector.setQuick(indices[i], values[i]);
		return vector;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DocumentVector))
			return false;
		DocumentVector other = (DocumentVector) obj;
		return size == other.size && Arrays.equals(indices, other.indices)
				&& Arrays.equals(values, other.values);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
	}
}
