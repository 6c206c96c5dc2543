package io.github.pathfind.model;

import org.immutables.value.Value;

/**
 * A typed identifier to search for.
 */
@Value.Immutable
public interface Identifier {

  /**
   * Type.
   *
   * @return the id type
   */
  @Value.Parameter
  IdType type();

  /**
   * Value.
   *
   * @return the value
   */
  @Value.Parameter
  String value();

  /**
   * Of identifier.
   *
   * @param type  the type
   * @param value the value
   * @return the identifier
   */
  static Identifier of(final IdType type, final String value) {
    return ImmutableIdentifier.of(type, value);
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if (value().isBlank()) {
      throw new IllegalArgumentException("Identifier value must not be blank");
    }
  }
}
