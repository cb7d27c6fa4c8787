package services.vsm;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.carrotsearch.hppc.IntIntHashMap;

import cern.colt.matrix.DoubleMatrix1D;
import services.PipelineSettings;
import services.clustering.EmptyCorpusException;

/**
 * Turns issue descriptions into TF-IDF weighted vectors over a
 * vocabulary of word n-grams.
 * <p>
 * {@link #fit(List)} builds the vocabulary and the inverse document
 * frequencies once; afterwards the vectorizer is read-only and
 * {@link #transform(String)} may be called from several threads.
 * </p>
 */
public class TfIdfVectorizer {

	private static final String FIELD = "description";

	private static final String NGRAM_SEPARATOR = " ";

	private final Logger logger = LoggerFactory.getLogger(TfIdfVectorizer.class);

	private final Analyzer analyzer;

	private final int minNgram;

	private final int maxNgram;

	private final boolean smoothIdf;

	private final boolean sublinearTf;

	private volatile Vocabulary vocabulary;

	public TfIdfVectorizer(PipelineSettings settings) {
		this(new IssueAnalyzer(settings.getExtraStopWords(), settings.getMinTokenLength()),
				settings.getMinNgram(), settings.getMaxNgram(),
				settings.isSmoothIdf(), settings.isSublinearTf());
	}

	public TfIdfVectorizer(Analyzer analyzer, int minNgram, int maxNgram,
			boolean smoothIdf, boolean sublinearTf) {
		if (minNgram < 1 || maxNgram < minNgram)
			throw new IllegalArgumentException("Invalid n-gram range (" + minNgram + ", " + maxNgram + ")");
		this.analyzer = analyzer;
		this.minNgram = minNgram;
		this.maxNgram = maxNgram;
		this.smoothIdf = smoothIdf;
		this.sublinearTf = sublinearTf;
	}

	/**
	 * Builds the vocabulary from the whole corpus.
	 * @param corpus cleaned descriptions, <code>null</code> entries are empty documents
	 * @return the frozen vocabulary
	 * @throws EmptyCorpusException if the corpus has no documents
	 * @throws IllegalStateException if this vectorizer was already fitted
	 */
	public synchronized Vocabulary fit(List<String> corpus) {
		if (vocabulary != null)
			throw new IllegalStateException("Vectorizer is already fitted");
		if (corpus == null || corpus.isEmpty())
			throw new EmptyCorpusException();

		// term -> number of documents containing it, sorted by term
		final Map<String, Integer> documentFrequencies = new TreeMap<>();
		for (String document : corpus) {
			Set<String> seen = new HashSet<>(terms(document));
			for (String term : seen)
				documentFrequencies.merge(term, 1, Integer::sum);
		}

		final int n = corpus.size();
		final String[] terms = new String[documentFrequencies.size()];
		final double[] idf = new double[terms.length];
		int column = 0;
		for (Map.Entry<String, Integer> e : documentFrequencies.entrySet()) {
			terms[column] = e.getKey();
			idf[column] = inverseDocumentFrequency(n, e.getValue());
			column++;
		}

		vocabulary = new Vocabulary(terms, idf);
		logger.info("Built vocabulary of {} terms from {} documents", terms.length, n);
		return vocabulary;
	}

	/**
	 * Fits the vocabulary on the corpus and returns one vector per document,
	 * in corpus order.
	 */
	public List<DocumentVector> fitTransform(List<String> corpus) {
		fit(corpus);
		return vectorize(corpus);
	}

	/**
	 * Vectors of the given documents against the fitted vocabulary. Only the
	 * non-zero cells are kept, so memory grows with the number of terms the
	 * documents use, not with documents x vocabulary.
	 */
	public List<DocumentVector> vectorize(List<String> documents) {
		final List<DocumentVector> vectors = new ArrayList<>(documents.size());
		for (String document : documents)
			vectors.add(vectorize(document));
		return vectors;
	}

	/**
	 * Maps a text into the vocabulary space. Terms unknown to the
	 * vocabulary are ignored; an empty text gives a zero vector.
	 */
	public DocumentVector vectorize(String text) {
		final Vocabulary vocab = requireVocabulary();
		final IntIntHashMap counts = new IntIntHashMap();
		for (String term : terms(text)) {
			int column = vocab.indexOf(term);
			if (column >= 0)
				counts.addTo(column, 1);
		}

		final int[] columns = counts.keys().toArray();
		Arrays.sort(columns);
		final double[] weights = new double[columns.length];
		for (int i = 0; i < columns.length; i++) {
			int count = counts.get(columns[i]);
			double tf = sublinearTf ? 1.0 + Math.log(count) : count;
			weights[i] = tf * vocab.idf(columns[i]);
		}
		return new DocumentVector(vocab.size(), columns, weights);
	}

	/**
	 * Same as {@link #vectorize(String)}, as a Colt vector.
	 */
	public DoubleMatrix1D transform(String text) {
		return vectorize(text).toMatrix();
	}

	public Vocabulary getVocabulary() {
		return requireVocabulary();
	}

	public boolean isFitted() {
		return vocabulary != null;
	}

	/**
	 * Extracts the vocabulary terms of a text, in order of appearance and
	 * with repetitions: every n-gram in the configured range built from
	 * consecutive analyzed tokens.
	 */
	public List<String> terms(String text) {
		final List<String> tokens = tokens(text);
		final List<String> terms = new ArrayList<>();
		for (int n = minNgram; n <= maxNgram; n++) {
			for (int start = 0; start + n <= tokens.size(); start++) {
				if (n == 1) {
					terms.add(tokens.get(start));
				} else {
					terms.add(String.join(NGRAM_SEPARATOR, tokens.subList(start, start + n)));
				}
			}
		}
		return terms;
	}

	private List<String> tokens(String text) {
		final List<String> tokens = new ArrayList<>();
		if (text == null || text.isEmpty())
			return tokens;
		try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
			CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
			stream.reset();
			while (stream.incrementToken())
				tokens.add(term.toString());
			stream.end();
		} catch (IOException e) {
			throw new UncheckedIOException("Could not analyze text", e);
		}
		return tokens;
	}

	private double inverseDocumentFrequency(int documents, int documentFrequency) {
		if (smoothIdf)
			return Math.log((1.0 + documents) / (1.0 + documentFrequency)) + 1.0;
		return Math.log((double) documents / documentFrequency) + 1.0;
	}

	private Vocabulary requireVocabulary() {
		final Vocabulary vocab = vocabulary;
		if (vocab == null)
			throw new IllegalStateException("Vectorizer has not been fitted");
		return vocab;
	}
}
