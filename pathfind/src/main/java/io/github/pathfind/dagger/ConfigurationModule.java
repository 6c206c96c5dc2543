package io.github.pathfind.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.pathfind.model.Configuration;
import javax.inject.Singleton;

/**
 * Supplies the configuration a component was created with.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }
}
