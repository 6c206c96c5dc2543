package io.github.pathfind.cli.command;

import io.github.pathfind.cli.PathfindCli;
import io.github.pathfind.cli.dagger.CliComponent;
import io.github.pathfind.cli.format.ArchiveFormat;
import io.github.pathfind.cli.logging.LoggingConfigurator;
import io.github.pathfind.cli.model.ExportAction;
import io.github.pathfind.cli.model.ExportRequest;
import io.github.pathfind.cli.model.ImmutableExportRequest;
import io.github.pathfind.cli.model.OutputTarget;
import io.github.pathfind.config.ConfigurationLoader;
import io.github.pathfind.dagger.CommonModule;
import io.github.pathfind.helper.NameHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.Configuration;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.IdType;
import io.github.pathfind.model.ImmutableConfiguration;
import io.github.pathfind.model.ImmutableQueryFilter;
import io.github.pathfind.model.QcStatus;
import io.github.pathfind.model.QueryFilter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Options and flow shared by the find commands: find lanes for an ID, then list, link, archive
 * or summarise them. Subclasses only name the context used to pick the lane role.
 */
public abstract class BaseFindCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(BaseFindCommand.class);

  @Spec
  private CommandSpec spec;

  @ParentCommand
  private PathfindCli parent;

  @Option(
      names = {"--id", "-i"},
      description = "ID to find, or a file of IDs when --type is file",
      required = true)
  private String id;

  @Option(
      names = {"--type", "-t"},
      description = "ID type: ${COMPLETION-CANDIDATES}",
      required = true)
  private IdType type;

  @Option(
      names = {"--file-id-type", "--ft"},
      description = "Type of the IDs in the file given with --type file")
  private IdType fileIdType;

  @Option(
      names = {"--qc", "-q"},
      description = "Only lanes with this QC status: ${COMPLETION-CANDIDATES}")
  private QcStatus qc;

  @Option(
      names = {"--filetype", "-f"},
      description = "Only lanes with files of this type: ${COMPLETION-CANDIDATES}")
  private FileCategory filetype;

  @Option(
      names = {"--symlink", "-l"},
      description = "Link lane data into this directory (default: pathfind_<id>)",
      arity = "0..1",
      fallbackValue = "",
      paramLabel = "DIR")
  private String symlink;

  @Option(
      names = {"--archive", "-a"},
      description = "Archive lane data into this file (default: pathfind_<id>.tar.gz)",
      arity = "0..1",
      fallbackValue = "",
      paramLabel = "FILE")
  private String archive;

  @Option(
      names = {"--zip", "-z"},
      description = "Make a zip archive instead of a tar")
  private boolean zip;

  @Option(
      names = {"--no-tar-compression", "-u"},
      description = "Don't gzip tar archives")
  private boolean noTarCompression;

  @Option(
      names = {"--stats", "-s"},
      description = "Write lane stats to this file (default: <id>.stats.csv)",
      arity = "0..1",
      fallbackValue = "",
      paramLabel = "FILE")
  private String stats;

  @Option(
      names = {"--csv-separator", "-c"},
      description = "Stats column separator (default: ,)",
      defaultValue = ",")
  private char separator;

  @Option(
      names = {"--rename", "-r"},
      description = "Replace # with _ in link and archive file names")
  private boolean rename;

  @Option(
      names = {"--no-progress-bars", "-n"},
      description = "Don't show progress bars")
  private boolean noProgressBars;

  @Option(
      names = {"--verbose", "-v"},
      description = "Show debugging messages")
  private boolean verbose;

  @Option(
      names = {"--config"},
      description = "Configuration file (default: env PATHFIND_CONFIG)",
      defaultValue = "${env:" + ConfigurationLoader.CONFIG_ENV + "}")
  private Path config;

  /**
   * The calling context, used to look up the lane role in the configuration.
   *
   * @return the context name
   */
  protected abstract String contextName();

  @Override
  public Integer call() throws Exception {
    final OutputTarget symlinkTarget = OutputTarget.parse(symlink);
    final OutputTarget archiveTarget = OutputTarget.parse(archive);
    final OutputTarget statsTarget = OutputTarget.parse(stats);
    validate(symlinkTarget, archiveTarget, statsTarget);

    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
    }

    final CommonModule commonModule = parent.commonModule();
    Configuration configuration = new ConfigurationLoader(commonModule.objectMapper()).load(config);
    if (noProgressBars) {
      configuration = ImmutableConfiguration.copyOf(configuration).withNoProgressBars(true);
    }
    final CliComponent component = CliComponent.create(configuration, commonModule);

    final IdType searchType = type == IdType.FILE ? fileIdType : type;
    final List<String> ids = type == IdType.FILE ? readIds(Path.of(id)) : List.of(id);
    final QueryFilter filter = ImmutableQueryFilter.builder()
        .qcStatus(Optional.ofNullable(qc))
        .fileCategory(Optional.ofNullable(filetype))
        .build();
    log.debug("{}: {} IDs of type {}, filter {}", contextName(), ids.size(), searchType, filter);

    final List<Lane> lanes = component.finderFactory()
        .create(contextName())
        .findLanes(ids, searchType, filter);
    if (lanes.isEmpty()) {
      parent.stderr().println("No data found.");
      return 0;
    }

    component.laneExporter().export(lanes, exportRequest(symlinkTarget, archiveTarget, statsTarget));
    return 0;
  }

  private void validate(final OutputTarget symlinkTarget,
                        final OutputTarget archiveTarget,
                        final OutputTarget statsTarget) {
    final long actions = List.of(symlinkTarget, archiveTarget, statsTarget).stream()
        .filter(OutputTarget::isOn)
        .count();
    if (actions > 1) {
      throw new ParameterException(spec.commandLine(),
          "Choose only one of --symlink, --archive and --stats");
    }
    if ((zip || noTarCompression) && !archiveTarget.isOn()) {
      throw new ParameterException(spec.commandLine(),
          "--zip and --no-tar-compression only apply with --archive");
    }
    if (zip && noTarCompression) {
      throw new ParameterException(spec.commandLine(),
          "--no-tar-compression only applies to tar archives");
    }
    if (type == IdType.FILE && fileIdType == null) {
      throw new ParameterException(spec.commandLine(),
          "--file-id-type is required with --type file");
    }
    if (fileIdType == IdType.FILE) {
      throw new ParameterException(spec.commandLine(),
          "--file-id-type can't be file");
    }
  }

  private List<String> readIds(final Path file) {
    try {
      return IdListReader.read(file);
    } catch (IOException e) {
      throw new ParameterException(spec.commandLine(),
          "Can't read IDs from " + file + ": " + e.getMessage(), e);
    }
  }

  private ExportRequest exportRequest(final OutputTarget symlinkTarget,
                                      final OutputTarget archiveTarget,
                                      final OutputTarget statsTarget) {
    final ImmutableExportRequest.Builder request = ImmutableExportRequest.builder()
        .separator(separator)
        .renameHashes(rename)
        .fileCategory(Optional.ofNullable(filetype))
        .groupName(groupName());
    if (symlinkTarget.isOn()) {
      request.action(ExportAction.SYMLINK).target(symlinkTarget);
    } else if (archiveTarget.isOn()) {
      request.action(ExportAction.ARCHIVE).target(archiveTarget).archiveFormat(archiveFormat());
    } else if (statsTarget.isOn()) {
      request.action(ExportAction.STATS).target(statsTarget);
    } else {
      request.action(ExportAction.LIST_PATHS);
    }
    return request.build();
  }

  private ArchiveFormat archiveFormat() {
    if (zip) {
      return ArchiveFormat.ZIP;
    }
    return noTarCompression ? ArchiveFormat.TAR : ArchiveFormat.TAR_GZ;
  }

  private String groupName() {
    final String name = type == IdType.FILE ? Path.of(id).getFileName().toString() : id;
    return NameHelper.replaceHashes(name);
  }
}
