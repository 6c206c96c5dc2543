package io.github.pathfind.cli.command;

import picocli.CommandLine.Command;

/**
 * Find sequencing data files for lanes.
 */
@Command(
    name = "data",
    description = "Find sequencing data files for lanes",
    mixinStandardHelpOptions = true)
public class DataCommand extends BaseFindCommand {

  @Override
  protected String contextName() {
    return "data";
  }
}
