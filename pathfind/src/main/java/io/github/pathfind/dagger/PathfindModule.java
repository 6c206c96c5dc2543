package io.github.pathfind.dagger;

import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import dagger.multibindings.IntoMap;
import dagger.multibindings.StringKey;
import io.github.pathfind.dbu.liquibase.LiquibaseHelper;
import io.github.pathfind.lane.role.AnnotationLaneRole;
import io.github.pathfind.lane.role.AssemblyLaneRole;
import io.github.pathfind.lane.role.DataLaneRole;
import io.github.pathfind.lane.role.LaneRole;
import io.github.pathfind.model.Configuration;
import io.github.pathfind.progress.ConsoleProgressReporter;
import io.github.pathfind.progress.NoOpProgressReporter;
import io.github.pathfind.progress.ProgressReporter;
import java.io.PrintStream;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The type Pathfind module.
 */
@Module(includes = PathfindModule.Binder.class)
public class PathfindModule {

  /**
   * Instantiates a new Pathfind module.
   */
  public PathfindModule() {
    // Default constructor
  }

  /**
   * Liquibase helper.
   *
   * @return the liquibase helper
   */
  @Provides
  @Singleton
  public LiquibaseHelper liquibaseHelper() {
    return new LiquibaseHelper();
  }

  /**
   * Progress reporter; silent when the configuration turns progress bars off.
   *
   * @param configuration the configuration
   * @param stderr        the stream progress is drawn on
   * @return the progress reporter
   */
  @Provides
  @Singleton
  public ProgressReporter progressReporter(final Configuration configuration,
                                           @Named(CommonModule.STDERR) final PrintStream stderr) {
    if (configuration.noProgressBars()) {
      return new NoOpProgressReporter();
    }
    return new ConsoleProgressReporter(stderr);
  }

  /**
   * Lane roles, keyed by the names used in the configuration.
   */
  @Module
  interface Binder {

    /**
     * Data lane role.
     *
     * @param role the role
     * @return the lane role
     */
    @Binds
    @IntoMap
    @StringKey(DataLaneRole.NAME)
    LaneRole dataLaneRole(DataLaneRole role);

    /**
     * Annotation lane role.
     *
     * @param role the role
     * @return the lane role
     */
    @Binds
    @IntoMap
    @StringKey(AnnotationLaneRole.NAME)
    LaneRole annotationLaneRole(AnnotationLaneRole role);

    /**
     * Assembly lane role.
     *
     * @param role the role
     * @return the lane role
     */
    @Binds
    @IntoMap
    @StringKey(AssemblyLaneRole.NAME)
    LaneRole assemblyLaneRole(AssemblyLaneRole role);
  }
}
