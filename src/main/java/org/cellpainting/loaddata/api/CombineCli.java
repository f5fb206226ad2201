package org.cellpainting.loaddata.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.cellpainting.loaddata.application.pipeline.CombineSummary;
import org.cellpainting.loaddata.config.CombineConfig;
import org.cellpainting.loaddata.config.CompositionRoot;
import org.cellpainting.loaddata.domain.meta.MissingKeyException;
import org.cellpainting.loaddata.logging.LoggingConfigurator;
import org.cellpainting.loaddata.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for concatenating per-group manifests from a bind handoff into coarser combined manifests.
 *
 * @since 0.1.0
 */
public final class CombineCli {
  private static final Logger log = LoggerFactory.getLogger(CombineCli.class);
  private static final String MODE = "combine";
  private static final Set<String> INPUT_KEYS = Set.of("handoff", "out");
  private static final String SUMMARY_USAGE =
      "usage: combine handoff=PATH out=PATH [keys=K,...] [prefix=NAME] [config=PATH] "
          + "[--dry-run] [--allow-overwrite] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      LoadData combine pipeline

      Usage:
        combine handoff=./load_data/handoff.ndjson out=./combined [options]

      Required:
        handoff=PATH             Handoff NDJSON written by bind
        out=PATH                 Directory receiving <prefix>.<values>_combined_load_data.csv files

      Optional:
        keys=K,...               Keys defining a combined group (default batch,plate)
        prefix=NAME              Combined file-name prefix, [A-Za-z0-9._-] (default loaddata)
        config=PATH              YAML file with common: and combine: sections
        --dry-run                Validate inputs and print the plan without writing
        --allow-overwrite        Permit an output directory holding files other than *.csv and *.ndjson
                                 (reruns over earlier manifests need no flag)
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private CombineCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CommandLine cli;
    try {
      cli = CommandLine.parse(MODE, INPUT_KEYS, args);
    } catch (CommandLine.UsageException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      Console.text(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (cli.has(CommandLine.Flag.HELP)) {
      Console.text(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (cli.has(CommandLine.Flag.VERBOSE)) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for combine CLI");
    }

    CommandLine.Resolved resolved;
    CombineConfig config;
    try {
      resolved = cli.resolve(log::warn);
      TelemetryConfigurator.configureMetrics(resolved.settings());
      config = CombineConfig.fromMap(resolved.settings());
    } catch (CommandLine.UsageException | IllegalArgumentException ex) {
      log.error("Invalid combine arguments: {}", ex.getMessage());
      Console.text(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", cli.options().get(CommandLine.CONFIG_KEY), ex);
      return ExitCode.IO_ERROR;
    }

    Path outputDirectory;
    try {
      Paths.requireReadableFile("handoff", config.handoffFile());
      outputDirectory =
          Paths.validateWritableDir(config.outputDirectory(), !resolved.dryRun(), resolved.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid combine path configuration: {}", ex.getMessage());
      Console.text(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (resolved.dryRun()) {
      Map<String, Object> plan = new LinkedHashMap<>();
      plan.put("Handoff", config.handoffFile());
      plan.put("Output directory", outputDirectory);
      plan.put("Keys", String.join(",", config.keys()));
      plan.put("Prefix", config.prefix());
      plan.put("Allow overwrite", resolved.allowOverwrite());
      Console.combinePlan(plan);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      log.info("Configured combine pipeline: handoff={}, out={}, keys={}",
          config.handoffFile(), outputDirectory, config.keys());
      CombineSummary summary = root.combineUseCase(config).run();
      Console.combineSummary(summary);
      return summary.hasFailures() ? ExitCode.GROUP_FAILURES : ExitCode.SUCCESS;
    } catch (MissingKeyException ex) {
      log.error("Combine keys do not fit the handoff groups: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Combine configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Combine pipeline I/O failure reading {}", config.handoffFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in combine pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
