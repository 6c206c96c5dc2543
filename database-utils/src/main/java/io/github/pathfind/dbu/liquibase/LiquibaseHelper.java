package io.github.pathfind.dbu.liquibase;

import liquibase.Contexts;
import liquibase.LabelExpression;
import liquibase.Liquibase;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.LiquibaseException;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies Liquibase changelogs through a Jdbi handle.
 */
public class LiquibaseHelper {

  private static final Logger log = LoggerFactory.getLogger(LiquibaseHelper.class);

  /**
   * Run liquibase.
   *
   * @param jdbi          the jdbi
   * @param changeLogFile classpath location of the changelog
   */
  public void runLiquibase(final Jdbi jdbi, final String changeLogFile) {
    log.info("Running liquibase changelog {}", changeLogFile);
    jdbi.useHandle(handle -> {
      try {
        final Database database = DatabaseFactory.getInstance()
            .findCorrectDatabaseImplementation(new JdbcConnection(handle.getConnection()));
        final Liquibase liquibase = new Liquibase(changeLogFile, new ClassLoaderResourceAccessor(), database);
        liquibase.update(new Contexts(), new LabelExpression());
        // liquibase leaves auto commit off on the shared connection
        if (handle.isInTransaction()) {
          handle.commit();
        }
      } catch (LiquibaseException e) {
        throw new IllegalStateException("Unable to apply changelog " + changeLogFile, e);
      }
    });
  }

}
