package io.github.pathfind.dagger;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import java.io.PrintStream;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Process-wide objects: JSON mapping and the standard streams.
 */
@Module
public class CommonModule {

  /**
   * The constant STDOUT.
   */
  public static final String STDOUT = "stdout";

  /**
   * The constant STDERR.
   */
  public static final String STDERR = "stderr";

  private final PrintStream stdout;
  private final PrintStream stderr;

  /**
   * Instantiates a new common module on the process streams.
   */
  public CommonModule() {
    this(System.out, System.err);
  }

  /**
   * Instantiates a new common module.
   *
   * @param stdout where results go
   * @param stderr where progress and diagnostics go
   */
  public CommonModule(final PrintStream stdout, final PrintStream stderr) {
    this.stdout = stdout;
    this.stderr = stderr;
  }

  /**
   * Object mapper for JSON serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    final ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.findAndRegisterModules();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    // Immutables
    objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    return objectMapper;
  }

  /**
   * Standard output, where results go.
   *
   * @return the stream
   */
  @Provides
  @Named(STDOUT)
  public PrintStream stdout() {
    return stdout;
  }

  /**
   * Standard error, for progress and diagnostics.
   *
   * @return the stream
   */
  @Provides
  @Named(STDERR)
  public PrintStream stderr() {
    return stderr;
  }
}
