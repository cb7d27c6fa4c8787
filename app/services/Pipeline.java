package services;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import services.clustering.ClusterLabeler;
import services.clustering.EmptyCorpusException;
import services.clustering.KMeansClusteringAlgorithm;
import services.clustering.KMeansModel;
import services.ranking.Cluster;
import services.ranking.ClusterAggregator;
import services.ranking.ClusterAssignment;
import services.ranking.ClusterScorer;
import services.vsm.DocumentVector;
import services.vsm.TfIdfVectorizer;
import services.vsm.Vocabulary;

/**
 * A trained mining pipeline: the fitted vectorizer (vocabulary and idf
 * weights), the k-means centroids and the labels of every cluster.
 * Read-only once built; aggregation and ranking take it explicitly.
 */
public final class Pipeline {

	private final PipelineSettings settings;

	private final TfIdfVectorizer vectorizer;

	private final KMeansModel model;

	private final List<List<String>> clusterLabels;

	private Pipeline(PipelineSettings settings, TfIdfVectorizer vectorizer, KMeansModel model,
			List<List<String>> clusterLabels) {
		this.settings = settings;
		this.vectorizer = vectorizer;
		this.model = model;
		this.clusterLabels = clusterLabels;
	}

	/**
	 * Fits the vocabulary on the issue descriptions, clusters them and labels
	 * every cluster.
	 * @throws EmptyCorpusException if there are no issues
	 * @throws services.clustering.InvalidClusterCountException if the configured
	 * number of clusters does not fit the corpus
	 */
	public static Pipeline train(List<Issue> issues, PipelineSettings settings) {
		if (issues == null || issues.isEmpty())
			throw new EmptyCorpusException();

		final List<String> corpus = new ArrayList<>(issues.size());
		for (Issue issue : issues)
			corpus.add(issue.getDescription());

		final TfIdfVectorizer vectorizer = new TfIdfVectorizer(settings);
		final List<DocumentVector> rows = vectorizer.fitTransform(corpus);

		final KMeansModel model = new KMeansClusteringAlgorithm().train(rows,
				settings.getNumberOfClusters(), settings.getMaxIterations(),
				settings.getNumInits(), settings.getSeed());

		final ClusterLabeler labeler = new ClusterLabeler();
		final Vocabulary vocabulary = vectorizer.getVocabulary();
		final List<List<String>> labels = new ArrayList<>(model.getNumClusters());
		for (int k = 0; k < model.getNumClusters(); k++) {
			labels.add(Collections.unmodifiableList(
					labeler.label(model.getCentroid(k), vocabulary, settings.getTopTermsCount())));
		}

		return new Pipeline(settings, vectorizer, model, Collections.unmodifiableList(labels));
	}

	/**
	 * Assigns the issues to clusters and totals them. Issues do not have to
	 * be the ones the pipeline was trained on.
	 */
	public ClusterAssignment aggregate(List<Issue> issues) {
		return new ClusterAggregator().aggregate(issues, vectorizer, model);
	}

	/**
	 * Scores and orders the clusters of an aggregation pass.
	 */
	public List<Cluster> rank(ClusterAssignment assignment) {
		return new ClusterScorer(settings.getIssueMultiplier(), settings.getVoteMultiplier())
				.rank(assignment, clusterLabels);
	}

	public PipelineSettings getSettings() {
		return settings;
	}

	public TfIdfVectorizer getVectorizer() {
		return vectorizer;
	}

	public Vocabulary getVocabulary() {
		return vectorizer.getVocabulary();
	}

	public KMeansModel getModel() {
		return model;
	}

	/**
	 * Top terms of each cluster, indexed by cluster.
	 */
	public List<List<String>> getClusterLabels() {
		return clusterLabels;
	}
}
