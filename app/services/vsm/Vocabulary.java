package services.vsm;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.carrotsearch.hppc.ObjectIntHashMap;

/**
 * Frozen mapping between vocabulary terms and matrix columns, together
 * with the inverse document frequency of every column as computed at
 * fit time. Columns follow the lexical order of the terms.
 */
public final class Vocabulary {

	private final String[] terms;

	private final double[] idf;

	private final ObjectIntHashMap<String> columns;

	Vocabulary(String[] terms, double[] idf) {
		if (terms.length != idf.length)
			throw new IllegalArgumentException("Expected one idf weight per term");
		this.terms = terms.clone();
		this.idf = idf.clone();
		this.columns = new ObjectIntHashMap<>(terms.length);
		for (int i = 0; i < terms.length; i++)
			columns.put(terms[i], i);
	}

	public int size() {
		return terms.length;
	}

	/**
	 * Returns the column of a term, or -1 if the term was not seen at fit time.
	 */
	public int indexOf(String term) {
		return columns.getOrDefault(term, -1);
	}

	public String term(int column) {
		return terms[column];
	}

	public double idf(int column) {
		return idf[column];
	}

	public List<String> terms() {
		return Collections.unmodifiableList(Arrays.asList(terms));
	}
}
