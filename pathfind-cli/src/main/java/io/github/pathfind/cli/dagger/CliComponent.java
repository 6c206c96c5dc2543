package io.github.pathfind.cli.dagger;

import dagger.Component;
import io.github.pathfind.cli.exporter.LaneExporter;
import io.github.pathfind.dagger.CommonModule;
import io.github.pathfind.dagger.ConfigurationModule;
import io.github.pathfind.dagger.PathfindModule;
import io.github.pathfind.finder.FinderFactory;
import io.github.pathfind.model.Configuration;
import javax.inject.Singleton;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(
    modules = {CliModule.class, PathfindModule.class, ConfigurationModule.class, CommonModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @param commonModule  supplies the output streams
   * @return the CLI component
   */
  static CliComponent create(final Configuration configuration, final CommonModule commonModule) {
    return DaggerCliComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .commonModule(commonModule)
        .build();
  }

  /**
   * Finder factory.
   *
   * @return the finder factory
   */
  FinderFactory finderFactory();

  /**
   * Lane exporter.
   *
   * @return the lane exporter
   */
  LaneExporter laneExporter();
}
