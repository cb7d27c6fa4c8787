package services;

import java.util.List;

import javax.inject.Inject;
import javax.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import services.ranking.Cluster;
import services.ranking.ClusterAssignment;

/**
 * Entry point of the mining pipeline: clusters cleaned feature requests and
 * ranks the clusters by how many issues and votes they gather.
 */
@Singleton
public class FeatureRequestMiner {

	private final Logger logger = LoggerFactory.getLogger(FeatureRequestMiner.class);

	private final PipelineSettings settings;

	@Inject
	public FeatureRequestMiner(PipelineSettings settings) {
		this.settings = settings;
	}

	/**
	 * Trains a pipeline on the issues without aggregating them.
	 */
	public Pipeline train(List<Issue> issues) {
		logger.info("Training on {} issues with {} clusters", issues == null ? 0 : issues.size(),
				settings.getNumberOfClusters());
		return Pipeline.train(issues, settings);
	}

	/**
	 * Trains on the issues, assigns each of them to a cluster and returns
	 * all clusters, most valuable first.
	 */
	public List<Cluster> mine(List<Issue> issues) {
		Pipeline pipeline = train(issues);
		ClusterAssignment assignment = pipeline.aggregate(issues);
		return pipeline.rank(assignment);
	}

	public PipelineSettings getSettings() {
		return settings;
	}
}
