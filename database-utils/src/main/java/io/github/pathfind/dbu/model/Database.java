package io.github.pathfind.dbu.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Connection settings for a single relational database.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDatabase.class)
@JsonDeserialize(as = ImmutableDatabase.class)
public interface Database {

  /**
   * JDBC url.
   *
   * @return the url
   */
  String url();

  /**
   * Username.
   *
   * @return the username
   */
  @Value.Default
  default String username() {
    return "";
  }

  /**
   * Password.
   *
   * @return the password
   */
  @Value.Default
  @Value.Redacted
  default String password() {
    return "";
  }

}
