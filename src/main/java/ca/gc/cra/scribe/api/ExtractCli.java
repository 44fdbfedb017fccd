package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.config.CompositionRoot;
import ca.gc.cra.scribe.config.ConfigMerger;
import ca.gc.cra.scribe.config.DefaultsForMode;
import ca.gc.cra.scribe.config.ExtractConfig;
import ca.gc.cra.scribe.config.YamlConfigLoader;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.scribe.logging.LoggingConfigurator;
import ca.gc.cra.scribe.logging.Logs;
import ca.gc.cra.scribe.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for canonicalizing a live message database or a device backup into NDJSON.
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String MODE = "extract";
  private static final String SUMMARY_USAGE =
      "usage: extract db=PATH|backup=DIR out=DIR [contact=ADDRESS] [passphraseEnv=NAME] [copyAttachments=true|false] "
          + "[hashAttachments=true|false] [attachmentWorkers=N] [transcription.mode=off|whisper-cpp|fixed] "
          + "[config=FILE] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      SCRIBE extract pipeline

      Usage:
        extract db=~/Library/Messages/chat.db out=./export [options]
        extract backup=./Backups/<udid> out=./export [options]

      Source (exactly one):
        db=PATH                    Live chat.db; -wal and -shm siblings are staged with it
        backup=DIR                 Device backup directory containing Manifest.db

      Output:
        out=DIR                    Receives messages.ndjson, quarantine.ndjson,
                                   unresolved_relations.ndjson, missing_attachments.json, run_report.json

      Optional (validated):
        passphraseEnv=NAME         Environment variable holding the backup passphrase
                                   (default SCRIBE_BACKUP_PASSPHRASE)
        passphrase=TEXT            Backup passphrase; prefer passphraseEnv so it stays out of shell history
        contact=ADDRESS            Only extract conversations with this handle, matched exactly as stored
        workDir=DIR                Parent of the private staging directory (default java.io.tmpdir)
        retainStaging=true|false   Keep the staging directory after the run
        stagingTimeout=DURATION    Bound on copying/decrypting the source, e.g. 10m or PT10M
        attachmentsHome=DIR        Directory substituted for ~ in attachment paths (default user home)
        copyAttachments=true|false Copy attachments into out/attachments by content hash (default false)
        hashAttachments=true|false Record sha256 content hashes (default true)
        attachmentWorkers=N        Parallel attachment/transcription workers, 1-64 (default 1)
        transcription.mode=MODE    off | whisper-cpp | fixed (default off)
        transcription.binary=PATH  whisper.cpp executable
        transcription.model=PATH   whisper.cpp model file
        transcription.language=XX  Spoken language hint (default en)
        transcription.ffmpeg=PATH  Convert audio to 16 kHz WAV first
        transcription.timeout=D    Per-attachment timeout (default 2m)
        transcription.fixedText=T  Template for mode=fixed; {sha256} expands to a hash prefix
        config=FILE                YAML file with common/extract sections
        --dry-run                  Validate inputs and print the plan without reading the source
        --allow-overwrite          Permit writing into a non-empty output directory
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 configuration error, 5 runtime failure,
        6 source error, 7 no valid rows, 130 interrupted
      """;

  private ExtractCli() {}

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
   * Executes the extract command and maps its outcome to an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, System::getenv);
  }

  static ExitCode run(String[] args, Function<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for extract CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Optional<String> passphrase = ConfigCliUtils.extractPassphrase(kv);

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", Logs.redactPath(yamlPath.toString()));
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", Logs.redactPath(yamlPath.toString()), ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return yamlConfig.isPresent() ? ExitCode.CONFIG_ERROR : ExitCode.INVALID_ARGS;
    }
    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    boolean dryRun = input.hasSwitch("dryRun") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = input.hasSwitch("allowOverwrite")
        || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    configInputs.put("allowOverwrite", Boolean.toString(allowOverwrite));
    ExtractConfig config;
    String metricsExporter;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = ExtractConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path output;
    try {
      output = Paths.validateWritableDir(config.outputDirectory(), !dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid output directory: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, output, passphrase.isPresent());
      return ExitCode.SUCCESS;
    }

    SourceDescriptor descriptor = config.toDescriptor(passphrase, environment);
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      log.info("Configured extract pipeline: source={}, output={}, workers={}, transcription={}, metricsExporter={}",
          config.sourceKind().wireName(),
          Logs.redactPath(output.toString()),
          config.attachmentWorkers(),
          config.transcription().mode(),
          metricsExporter);
      RunReport report = new CompositionRoot(config, metrics).extractUseCase().run(descriptor);
      printSummary(report, output);
      return ExitCode.SUCCESS;
    } catch (PipelineFailure ex) {
      return ProblemReporter.report(ex);
    } catch (IllegalArgumentException ex) {
      log.error("Extract configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in extract pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printSummary(RunReport report, Path output) {
    CliPrinter.printLines(
        "Extract finished: " + report.outcome(),
        " Run id            : " + report.runId(),
        " Rows read         : " + report.get(RunCounter.ROWS_READ),
        " Messages emitted  : " + report.get(RunCounter.MESSAGES_EMITTED),
        " Quarantined       : " + report.get(RunCounter.QUARANTINED),
        " Missing attachments: " + report.get(RunCounter.ATTACHMENTS_MISSING),
        " Output directory  : " + output);
  }

  private static void printDryRunPlan(ExtractConfig config, Path output, boolean explicitPassphrase) {
    CliPrinter.printLines(
        "Extract dry-run: the source will not be read.",
        " Source kind       : " + config.sourceKind().wireName(),
        " Source            : " + config.sourcePath(),
        " Contact           : " + config.contact().orElse("<all conversations>"),
        " Passphrase        : " + (explicitPassphrase ? "<argument>" : "$" + config.passphraseEnv()),
        " Output directory  : " + output,
        " Staging parent    : " + config.workDirectory(),
        " Staging timeout   : " + config.stagingTimeout(),
        " Copy attachments  : " + config.copyAttachments(),
        " Hash attachments  : " + config.hashAttachments(),
        " Attachment workers: " + config.attachmentWorkers(),
        " Transcription     : " + config.transcription().mode(),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Re-run without --dry-run to extract.");
  }
}
