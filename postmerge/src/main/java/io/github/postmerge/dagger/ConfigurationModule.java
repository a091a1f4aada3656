package io.github.postmerge.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.postmerge.model.MergeConfiguration;
import javax.inject.Singleton;

/**
 * Supplies the run configuration to the graph.
 */
@Module
public class ConfigurationModule {

  private final MergeConfiguration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final MergeConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public MergeConfiguration configuration() {
    return configuration;
  }
}
