package org.cellpainting.loaddata.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.cellpainting.loaddata.application.pipeline.BindSummary;
import org.cellpainting.loaddata.config.BindConfig;
import org.cellpainting.loaddata.config.CompositionRoot;
import org.cellpainting.loaddata.domain.meta.MissingKeyException;
import org.cellpainting.loaddata.logging.LoggingConfigurator;
import org.cellpainting.loaddata.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for binding images to illumination-correction artifacts and writing per-group manifests.
 *
 * @since 0.1.0
 */
public final class BindCli {
  private static final Logger log = LoggerFactory.getLogger(BindCli.class);
  private static final String MODE = "bind";
  private static final Set<String> INPUT_KEYS = Set.of("images", "corrections", "out");
  private static final String SUMMARY_USAGE =
      "usage: bind images=PATH corrections=PATH out=PATH [groupKeys=K,...] [joinKeys=K,...] "
          + "[metadataColumns=K,...] [frameColumns=true|false] [workers=N] [handoff=PATH|none] "
          + "[failOnUnmatched=true|false] [config=PATH] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      LoadData bind pipeline

      Usage:
        bind images=./images.ndjson corrections=./illum.ndjson out=./load_data [options]

      Required:
        images=PATH              NDJSON image stream ({"meta": {...}, "file": "..."} per line)
        corrections=PATH         NDJSON correction-artifact stream
        out=PATH                 Directory receiving one <groupId>.csv manifest per group

      Optional:
        groupKeys=K,...          Metadata keys defining a group (default batch,plate)
        joinKeys=K,...           Keys matching image groups to correction groups (default batch,plate)
        metadataColumns=K,...    Metadata_* columns, in order (default batch,plate,well,site)
        frameColumns=true|false  Emit Frame_Orig<Ch> columns (default false)
        workers=N                Groups processed in parallel (default: available processors)
        handoff=PATH|none        Handoff NDJSON for the combine step (default <out>/handoff.ndjson)
        failOnUnmatched=true     Exit with code 6 when an image group has no correction match
        config=PATH              YAML file with common: and bind: sections
        --dry-run                Validate inputs and print the plan without writing
        --allow-overwrite        Permit an output directory holding files other than *.csv and *.ndjson
                                 (reruns over earlier manifests need no flag)
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 configuration error,
        5 runtime failure, 6 some groups failed, 130 interrupted
      """;

  private BindCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the bind CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
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
      log.debug("Verbose logging enabled for bind CLI");
    }

    CommandLine.Resolved resolved;
    BindConfig config;
    String metricsExporter;
    try {
      resolved = cli.resolve(log::warn);
      metricsExporter = TelemetryConfigurator.configureMetrics(resolved.settings());
      config = BindConfig.fromMap(resolved.settings());
    } catch (CommandLine.UsageException | IllegalArgumentException ex) {
      log.error("Invalid bind arguments: {}", ex.getMessage());
      Console.text(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", cli.options().get(CommandLine.CONFIG_KEY), ex);
      return ExitCode.IO_ERROR;
    }

    Path outputDirectory;
    try {
      Paths.requireReadableFile("images", config.imagesFile());
      Paths.requireReadableFile("corrections", config.correctionsFile());
      outputDirectory =
          Paths.validateWritableDir(config.outputDirectory(), !resolved.dryRun(), resolved.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid bind path configuration: {}", ex.getMessage());
      Console.text(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (resolved.dryRun()) {
      Console.bindPlan(plan(config, outputDirectory, resolved.allowOverwrite()));
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      log.info(
          "Configured bind pipeline: images={}, corrections={}, out={}, groupKeys={}, joinKeys={}, workers={}, "
              + "metricsExporter={}",
          config.imagesFile(), config.correctionsFile(), outputDirectory, config.groupKeys(), config.joinKeys(),
          config.workers(), metricsExporter);
      BindSummary summary = root.bindUseCase(config).run();
      return report(summary, config);
    } catch (MissingKeyException ex) {
      log.error("Bind configuration does not fit the input metadata: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Bind configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Bind pipeline I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Bind pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in bind pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode report(BindSummary summary, BindConfig config) {
    Console.bindSummary(summary);
    if (summary.succeeded(config.failOnUnmatched())) {
      return ExitCode.SUCCESS;
    }
    log.warn("Bind finished with {} failed and {} unmatched groups",
        summary.failures().size(), summary.unmatched().size());
    return ExitCode.GROUP_FAILURES;
  }

  private static Map<String, Object> plan(BindConfig config, Path outputDirectory, boolean allowOverwrite) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Images", config.imagesFile());
    fields.put("Corrections", config.correctionsFile());
    fields.put("Output directory", outputDirectory);
    fields.put("Group keys", String.join(",", config.groupKeys()));
    fields.put("Join keys", String.join(",", config.joinKeys()));
    fields.put("Metadata columns", String.join(",", config.metadataColumns()));
    fields.put("Frame columns", config.frameColumns());
    fields.put("Workers", config.workers());
    fields.put("Handoff", config.handoffFile().map(Path::toString).orElse("<disabled>"));
    fields.put("Fail on unmatched", config.failOnUnmatched());
    fields.put("Allow overwrite", allowOverwrite);
    return fields;
  }
}
