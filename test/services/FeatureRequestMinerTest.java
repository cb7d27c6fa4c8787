package services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import services.clustering.EmptyCorpusException;
import services.clustering.InvalidClusterCountException;
import services.ranking.Cluster;

public class FeatureRequestMinerTest {

	private static FeatureRequestMiner miner(int clusters, int maxNgram) {
		return new FeatureRequestMiner(PipelineSettings.builder()
				.numberOfClusters(clusters).ngramRange(1, maxNgram).build());
	}

	private static List<Issue> sampleIssues() {
		return Arrays.asList(
				new Issue(1, 5, "upgrade the api please"),
				new Issue(2, 3, "please upgrade api"),
				new Issue(3, 0, "add a dark mode"));
	}

	@Test
	public void ranksTheApiClusterFirst() {
		List<Issue> issues = sampleIssues();

		List<Cluster> ranked = miner(2, 1).mine(issues);

		assertEquals(2, ranked.size());
		assertEquals(issues.get(0).getCluster(), issues.get(1).getCluster());
		assertNotEquals(issues.get(0).getCluster(), issues.get(2).getCluster());

		Cluster api = ranked.get(0);
		assertEquals((int) issues.get(0).getCluster(), api.getIndex());
		assertEquals(2, api.getIssueCount());
		assertEquals(8, api.getVoteSum());
		assertEquals(1.0, api.getIssueScore());
		assertEquals(1.0, api.getVoteScore());
		assertEquals(1.0, api.getCombinedScore());
		assertEquals(Arrays.asList("api", "please", "upgrade"), api.getTopTerms());

		Cluster darkMode = ranked.get(1);
		assertEquals((int) issues.get(2).getCluster(), darkMode.getIndex());
		assertEquals(1, darkMode.getIssueCount());
		assertEquals(0, darkMode.getVoteSum());
		assertEquals(0.0, darkMode.getCombinedScore());
		assertEquals(Arrays.asList("add", "dark", "mode"), darkMode.getTopTerms());
	}

	@Test
	public void everyIssueLandsInAnExistingCluster() {
		List<Issue> issues = new ArrayList<>();
		String[] descriptions = {
			"export reports to csv", "csv export for reports", "dark mode for the editor",
			"night theme dark mode", "single sign on with saml", "saml login support",
			"keyboard shortcuts for navigation", "custom keyboard shortcuts", "", null,
			"api rate limits", "raise the api rate limit",
		};
		for (int i = 0; i < descriptions.length; i++)
			issues.add(new Issue(i, i % 4, descriptions[i]));

		FeatureRequestMiner miner = new FeatureRequestMiner(PipelineSettings.builder()
				.numberOfClusters(5).numInits(3).seed(42L).build());
		List<Cluster> ranked = miner.mine(issues);

		assertEquals(5, ranked.size());
		int total = 0;
		for (Cluster cluster : ranked) {
			total += cluster.getIssueCount();
			assertTrue(cluster.getCombinedScore() >= 0 && cluster.getCombinedScore() <= 1);
			assertTrue(cluster.getTopTerms().size() <= 10);
		}
		assertEquals(issues.size(), total);
		for (Issue issue : issues) {
			assertNotNull(issue.getCluster());
			assertTrue(issue.getCluster() >= 0 && issue.getCluster() < 5);
		}
	}

	@Test
	public void sameInputAndSeedGiveSameRanking() {
		List<Cluster> first = miner(2, 2).mine(sampleIssues());
		List<Cluster> second = miner(2, 2).mine(sampleIssues());

		assertEquals(first.size(), second.size());
		for (int i = 0; i < first.size(); i++)
			assertEquals(first.get(i).toMap(), second.get(i).toMap());
	}

	@Test
	public void trainedPipelineCanBeReusedForAggregation() {
		FeatureRequestMiner miner = miner(2, 1);
		Pipeline pipeline = miner.train(sampleIssues());

		List<Cluster> ranked = pipeline.rank(pipeline.aggregate(sampleIssues()));

		assertEquals(2, pipeline.getClusterLabels().size());
		assertEquals(8, ranked.get(0).getVoteSum());
		assertEquals(pipeline.getVocabulary().size(), pipeline.getModel().getDimension());
	}

	@Test
	public void missingDescriptionIsAnEmptyDocument() {
		List<Issue> issues = Arrays.asList(
				new Issue(1, 2, "upgrade api"),
				new Issue(2, 1, null),
				new Issue(3, 0, "dark mode"));

		List<Cluster> ranked = miner(2, 2).mine(issues);

		assertEquals(2, ranked.size());
		assertNotNull(issues.get(1).getCluster());
	}

	@Test
	public void trainsOnCorpusWithLargeVocabulary() {
		// 50,000 documents over 50,000 terms would not fit a dense document-term matrix
		List<Issue> issues = new ArrayList<>();
		for (int i = 0; i < 50_000; i++)
			issues.add(new Issue(i, i % 3, "term" + i));

		Pipeline pipeline = miner(2, 1).train(issues);
		List<Cluster> ranked = pipeline.rank(pipeline.aggregate(issues));

		assertEquals(50_000, pipeline.getVocabulary().size());
		assertEquals(2, ranked.size());
		assertEquals(50_000, ranked.get(0).getIssueCount() + ranked.get(1).getIssueCount());
	}

	@Test
	public void rejectsEmptyCorpus() {
		assertThrows(EmptyCorpusException.class, () -> miner(2, 2).mine(Collections.<Issue>emptyList()));
	}

	@Test
	public void rejectsMoreClustersThanDistinctDescriptions() {
		List<Issue> issues = Arrays.asList(
				new Issue(1, 0, "upgrade api"),
				new Issue(2, 0, "upgrade api"),
				new Issue(3, 0, "the"));

		InvalidClusterCountException e = assertThrows(InvalidClusterCountException.class,
				() -> miner(2, 2).mine(issues));
		assertEquals(1, e.getDistinctDocuments());
	}
}
