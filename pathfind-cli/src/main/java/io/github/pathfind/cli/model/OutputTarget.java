package io.github.pathfind.cli.model;

import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Where an optional-valued output switch such as {@code --archive [file]} sends its output:
 * nowhere, to a name derived from the search, or to a path the user gave.
 */
@Value.Immutable
public interface OutputTarget {

  /**
   * The kinds of target.
   */
  enum Kind {
    OFF,
    DEFAULT_NAME,
    NAMED
  }

  @Value.Parameter
  Kind kind();

  @Value.Parameter
  Optional<Path> path();

  /**
   * The switch was not given.
   *
   * @return the target
   */
  static OutputTarget off() {
    return ImmutableOutputTarget.of(Kind.OFF, Optional.empty());
  }

  /**
   * The switch was given without a value.
   *
   * @return the target
   */
  static OutputTarget defaultName() {
    return ImmutableOutputTarget.of(Kind.DEFAULT_NAME, Optional.empty());
  }

  /**
   * The switch was given with a path.
   *
   * @param path the path
   * @return the target
   */
  static OutputTarget named(final Path path) {
    return ImmutableOutputTarget.of(Kind.NAMED, Optional.of(path));
  }

  /**
   * Decide the target from a raw option value: null when the option is absent, empty when it
   * was given without a value.
   *
   * @param value the option value
   * @return the target
   */
  static OutputTarget parse(final String value) {
    if (value == null) {
      return off();
    }
    if (value.isEmpty()) {
      return defaultName();
    }
    return named(Path.of(value));
  }

  default boolean isOn() {
    return kind() != Kind.OFF;
  }

  /**
   * The path to write to.
   *
   * @param defaultPath used unless the target is named
   * @return the path
   */
  default Path resolve(final Path defaultPath) {
    return path().orElse(defaultPath);
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if ((kind() == Kind.NAMED) != path().isPresent()) {
      throw new IllegalStateException("Only named output targets carry a path");
    }
  }
}
