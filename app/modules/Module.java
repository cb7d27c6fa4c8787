package modules;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import javax.inject.Singleton;

import services.FeatureRequestMiner;
import services.PipelineSettings;

/**
 * Wires the mining pipeline from a Typesafe configuration. Expects the
 * settings under the <code>miner</code> block, for instance
 * <code>miner.number-of-clusters = 20</code>; anything missing comes from
 * <code>reference.conf</code>.
 */
public class Module extends AbstractModule {

	private final Config configuration;

	public Module() {
		this(ConfigFactory.load());
	}

	public Module(Config configuration) {
		this.configuration = configuration;
	}

	@Override
	protected void configure() {
		bind(Config.class).toInstance(configuration);
		bind(FeatureRequestMiner.class).in(Singleton.class);
	}

	@Provides
	@Singleton
	PipelineSettings providePipelineSettings(Config config) {
		return PipelineSettings.fromConfig(config);
	}
}
