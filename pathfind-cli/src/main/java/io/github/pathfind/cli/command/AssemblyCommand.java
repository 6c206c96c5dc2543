package io.github.pathfind.cli.command;

import picocli.CommandLine.Command;

/**
 * Find assembly files for lanes.
 */
@Command(
    name = "assembly",
    description = "Find assembly files for lanes",
    mixinStandardHelpOptions = true)
public class AssemblyCommand extends BaseFindCommand {

  @Override
  protected String contextName() {
    return "assembly";
  }
}
