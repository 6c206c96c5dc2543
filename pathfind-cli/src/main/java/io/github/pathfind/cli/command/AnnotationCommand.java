package io.github.pathfind.cli.command;

import picocli.CommandLine.Command;

/**
 * Find annotation files for lanes.
 */
@Command(
    name = "annotation",
    description = "Find annotation files for lanes",
    mixinStandardHelpOptions = true)
public class AnnotationCommand extends BaseFindCommand {

  @Override
  protected String contextName() {
    return "annotation";
  }
}
