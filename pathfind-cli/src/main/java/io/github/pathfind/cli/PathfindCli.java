package io.github.pathfind.cli;

import io.github.pathfind.cli.command.AnnotationCommand;
import io.github.pathfind.cli.command.AssemblyCommand;
import io.github.pathfind.cli.command.DataCommand;
import io.github.pathfind.dagger.CommonModule;
import java.io.PrintStream;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for pathfind.
 */
@Command(
    name = "pathfind",
    description = "Find lanes in the tracking databases and list, link, archive or summarise their data",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {DataCommand.class, AnnotationCommand.class, AssemblyCommand.class})
public class PathfindCli implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(PathfindCli.class);

  private final PrintStream stdout;
  private final PrintStream stderr;

  /**
   * Instantiates a new pathfind cli.
   *
   * @param stdout where results go
   * @param stderr where progress and errors go
   */
  public PathfindCli(final PrintStream stdout, final PrintStream stderr) {
    this.stdout = stdout;
    this.stderr = stderr;
  }

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = commandLine(System.out, System.err).execute(args);
    System.exit(exitCode);
  }

  /**
   * Command line writing to the given streams. Fatal errors are reported as
   * {@code ERROR: <message>} with exit code 1; usage errors keep picocli's exit code 2.
   *
   * @param stdout standard output
   * @param stderr standard error
   * @return the command line
   */
  public static CommandLine commandLine(final PrintStream stdout, final PrintStream stderr) {
    final CommandLine cmd = new CommandLine(new PathfindCli(stdout, stderr));
    cmd.setExpandAtFiles(false);
    cmd.setCaseInsensitiveEnumValuesAllowed(true);
    cmd.setExecutionStrategy(new CommandLine.RunLast());
    cmd.setOut(new PrintWriter(stdout, true));
    cmd.setErr(new PrintWriter(stderr, true));
    cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
      log.debug("{} failed", commandLine.getCommandName(), ex);
      commandLine.getErr().println("ERROR: " + (ex.getMessage() != null ? ex.getMessage() : ex.toString()));
      return 1;
    });
    return cmd;
  }

  /**
   * Module supplying this command line's streams to the components it creates.
   *
   * @return the common module
   */
  public CommonModule commonModule() {
    return new CommonModule(stdout, stderr);
  }

  public PrintStream stderr() {
    return stderr;
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, stdout);
  }
}
