package io.github.pathfind.dbu.factory;

import io.github.pathfind.dbu.model.Database;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link Jdbi} instances for a configured database.
 */
public class JdbiFactory {

  private static final Logger log = LoggerFactory.getLogger(JdbiFactory.class);

  private final Database database;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database the database
   */
  public JdbiFactory(final Database database) {
    this.database = database;
  }

  /**
   * Create jdbi.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.debug("createJdbi({})", database.url());
    final Jdbi jdbi = Jdbi.create(database.url(), database.username(), database.password());
    jdbi.installPlugin(new SqlObjectPlugin());
    return jdbi;
  }

}
