package services.vsm;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import cern.colt.matrix.DoubleMatrix1D;
import services.PipelineSettings;
import services.clustering.EmptyCorpusException;

public class TfIdfVectorizerTest {

	private static final List<String> CORPUS = Arrays.asList(
			"Upgrade the API please",
			"please upgrade api",
			"add a dark mode");

	private static TfIdfVectorizer vectorizer(int minNgram, int maxNgram) {
		return new TfIdfVectorizer(PipelineSettings.builder().ngramRange(minNgram, maxNgram).build());
	}

	@Test
	public void buildsLexicallyOrderedUnigramsAndBigrams() {
		Vocabulary vocabulary = vectorizer(1, 2).fit(CORPUS);

		assertEquals(Arrays.asList("add", "add dark", "api", "api please", "dark", "dark mode",
				"mode", "please", "please upgrade", "upgrade", "upgrade api"), vocabulary.terms());
		assertEquals(2, vocabulary.indexOf("api"));
		assertEquals(-1, vocabulary.indexOf("the"));
	}

	@Test
	public void dropsEnglishAndExtraStopWords() {
		TfIdfVectorizer vectorizer = vectorizer(1, 1);
		Vocabulary vocabulary = vectorizer.fit(Arrays.asList(
				"This feature is a request for the export issue",
				"Export to CSV"));

		assertEquals(Arrays.asList("csv", "export", "request"), vocabulary.terms());
	}

	@Test
	public void dropsShortTokens() {
		Vocabulary vocabulary = new TfIdfVectorizer(PipelineSettings.builder()
				.ngramRange(1, 1).minTokenLength(3).build())
				.fit(Collections.singletonList("go ui toolbar"));

		assertEquals(Collections.singletonList("toolbar"), vocabulary.terms());
	}

	@Test
	public void weightsTermFrequencyByFrozenSmoothedIdf() {
		TfIdfVectorizer vectorizer = vectorizer(1, 1);
		Vocabulary vocabulary = vectorizer.fit(CORPUS);

		DoubleMatrix1D vector = vectorizer.transform("api api dark");

		double apiIdf = Math.log(4.0 / 3.0) + 1.0;
		double darkIdf = Math.log(2.0) + 1.0;
		assertEquals(apiIdf, vocabulary.idf(vocabulary.indexOf("api")), 1e-12);
		assertEquals(2 * apiIdf, vector.get(vocabulary.indexOf("api")), 1e-12);
		assertEquals(darkIdf, vector.get(vocabulary.indexOf("dark")), 1e-12);
		assertEquals(2, vector.cardinality());
	}

	@Test
	public void unsmoothedIdfAndSublinearTf() {
		TfIdfVectorizer vectorizer = new TfIdfVectorizer(PipelineSettings.builder()
				.ngramRange(1, 1).smoothIdf(false).sublinearTf(true).build());
		Vocabulary vocabulary = vectorizer.fit(CORPUS);

		DoubleMatrix1D vector = vectorizer.transform("api api");

		double apiIdf = Math.log(3.0 / 2.0) + 1.0;
		assertEquals((1.0 + Math.log(2)) * apiIdf, vector.get(vocabulary.indexOf("api")), 1e-12);
	}

	@Test
	public void outOfVocabularyTermsWeighNothing() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);
		vectorizer.fit(CORPUS);

		DoubleMatrix1D vector = vectorizer.transform("zebra crossing");

		assertEquals(11, vector.size());
		assertEquals(0, vector.cardinality());
	}

	@Test
	public void emptyAndNullDocumentsGiveZeroVectors() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);
		vectorizer.fit(Arrays.asList("upgrade api", null, ""));

		assertEquals(0, vectorizer.transform("").cardinality());
		assertEquals(0, vectorizer.transform((String) null).cardinality());
		assertEquals(3, vectorizer.getVocabulary().size());
	}

	@Test
	public void transformIsIdempotent() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);
		vectorizer.fit(CORPUS);

		double[] first = vectorizer.transform("please upgrade the api soon").toArray();
		double[] second = vectorizer.transform("please upgrade the api soon").toArray();

		assertArrayEquals(first, second);
	}

	@Test
	public void fittedRowsMatchSingleTransforms() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);
		List<DocumentVector> rows = vectorizer.fitTransform(CORPUS);

		assertEquals(3, rows.size());
		for (int row = 0; row < CORPUS.size(); row++) {
			assertEquals(vectorizer.getVocabulary().size(), rows.get(row).size());
			assertArrayEquals(vectorizer.transform(CORPUS.get(row)).toArray(), rows.get(row).toMatrix().toArray());
		}
	}

	@Test
	public void rowsOnlyHoldTheTermsOfTheirDocument() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);
		List<DocumentVector> rows = vectorizer.fitTransform(CORPUS);
		Vocabulary vocabulary = vectorizer.getVocabulary();

		DocumentVector darkMode = rows.get(2);
		assertEquals(5, darkMode.nonZeros());
		for (int i = 1; i < darkMode.nonZeros(); i++)
			assertTrue(darkMode.index(i - 1) < darkMode.index(i));
		assertEquals(0.0, darkMode.get(vocabulary.indexOf("api")));
		assertTrue(darkMode.get(vocabulary.indexOf("dark mode")) > 0);
	}

	@Test
	public void largeVocabularyDoesNotNeedDenseStorage() {
		List<String> corpus = new ArrayList<>();
		for (int i = 0; i < 50_000; i++)
			corpus.add("term" + i);
		TfIdfVectorizer vectorizer = vectorizer(1, 1);

		List<DocumentVector> rows = vectorizer.fitTransform(corpus);

		assertEquals(50_000, vectorizer.getVocabulary().size());
		assertEquals(50_000, rows.size());
		for (DocumentVector row : rows)
			assertEquals(1, row.nonZeros());
	}

	@Test
	public void pronounsAndModalVerbsAreStopWords() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);

		assertEquals(Collections.singletonList("love"), vectorizer.terms("We would love it if you could"));
		assertEquals(Arrays.asList("think", "team", "think team"),
				vectorizer.terms("I think we should, my team would"));
	}

	@Test
	public void identicalInputGivesIdenticalVocabulary() {
		Vocabulary first = vectorizer(1, 2).fit(CORPUS);
		Vocabulary second = vectorizer(1, 2).fit(CORPUS);

		assertEquals(first.terms(), second.terms());
		for (int i = 0; i < first.size(); i++)
			assertEquals(first.idf(i), second.idf(i));
	}

	@Test
	public void emptyCorpusIsRejected() {
		assertThrows(EmptyCorpusException.class, () -> vectorizer(1, 2).fit(Collections.<String>emptyList()));
	}

	@Test
	public void vocabularyIsFrozenAfterFit() {
		TfIdfVectorizer vectorizer = vectorizer(1, 2);
		assertFalse(vectorizer.isFitted());
		assertThrows(IllegalStateException.class, () -> vectorizer.transform("api"));

		vectorizer.fit(CORPUS);

		assertTrue(vectorizer.isFitted());
		assertThrows(IllegalStateException.class, () -> vectorizer.fit(CORPUS));
	}
}
