package services.vsm;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.StopwordAnalyzerBase;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.WordlistLoader;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.util.IOUtils;

/**
 * Lucene analyzer for issue descriptions: standard tokenization,
 * lowercasing, removal of short tokens and of English plus domain
 * stop words. The English list is Lucene's classic one joined with the
 * Snowball list, which also covers pronouns and modal verbs. No stemming, terms keep their surface form so that
 * cluster labels stay readable.
 */
public class IssueAnalyzer extends StopwordAnalyzerBase {

	private static final CharArraySet ENGLISH_STOP_WORDS = loadEnglishStopWords();

	private final int minTokenLength;

	public IssueAnalyzer(Collection<String> extraStopWords, int minTokenLength) {
		super(stopWords(extraStopWords));
		this.minTokenLength = minTokenLength;
	}

	private static CharArraySet stopWords(Collection<String> extraStopWords) {
		CharArraySet set = new CharArraySet(ENGLISH_STOP_WORDS, true);
		set.addAll(extraStopWords);
		return CharArraySet.unmodifiableSet(set);
	}

	private static CharArraySet loadEnglishStopWords() {
		CharArraySet set = new CharArraySet(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET, true);
		try {
			set.addAll(WordlistLoader.getSnowballWordSet(
					IOUtils.getDecodingReader(SnowballFilter.class, "english_stop.txt", StandardCharsets.UTF_8)));
		} catch (IOException e) {
			throw new UncheckedIOException("Could not load the English stop words", e);
		}
		return CharArraySet.unmodifiableSet(set);
	}

	@Override
	protected TokenStreamComponents createComponents(String fieldName) {
		final Tokenizer source = new StandardTokenizer();
		TokenStream result = new LowerCaseFilter(source);
		result = new LengthFilter(result, minTokenLength, Integer.MAX_VALUE);
		result = new StopFilter(result, stopwords);
		return new TokenStreamComponents(source, result);
	}

	@Override
	protected TokenStream normalize(String fieldName, TokenStream in) {
		return new LowerCaseFilter(in);
	}
}
