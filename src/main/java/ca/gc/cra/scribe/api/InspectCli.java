package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.application.pipeline.InspectUseCase;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.config.CompositionRoot;
import ca.gc.cra.scribe.config.ConfigMerger;
import ca.gc.cra.scribe.config.DefaultsForMode;
import ca.gc.cra.scribe.config.ExtractConfig;
import ca.gc.cra.scribe.config.YamlConfigLoader;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.infrastructure.output.CanonicalJson;
import ca.gc.cra.scribe.logging.LoggingConfigurator;
import ca.gc.cra.scribe.logging.Logs;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages a source and prints its detected schema generation and table sizes as JSON.
 *
 * <p>Useful before a long extract to confirm a backup passphrase and see which layout the database uses.</p>
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String MODE = "inspect";
  private static final String SUMMARY_USAGE =
      "usage: inspect db=PATH|backup=DIR [passphraseEnv=NAME] [workDir=DIR] [config=FILE]";
  private static final String HELP_TEXT = """
      SCRIBE inspect

      Usage:
        inspect db=~/Library/Messages/chat.db
        inspect backup=./Backups/<udid> passphraseEnv=MY_PASSPHRASE

      Source (exactly one):
        db=PATH                    Live chat.db
        backup=DIR                 Device backup directory containing Manifest.db

      Optional:
        passphraseEnv=NAME         Environment variable holding the backup passphrase
        passphrase=TEXT            Backup passphrase
        workDir=DIR                Parent of the private staging directory
        stagingTimeout=DURATION    Bound on copying/decrypting the source
        config=FILE                YAML file with common/inspect sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private InspectCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

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

    ExtractConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      config = ExtractConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    InspectUseCase useCase = new CompositionRoot(config, MetricsPort.NO_OP).inspectUseCase();
    try {
      InspectUseCase.Inspection inspection = useCase.inspect(config.toDescriptor(passphrase, environment));
      CliPrinter.println(CanonicalJson.pretty(CanonicalJson.value(render(config, inspection))));
      return ExitCode.SUCCESS;
    } catch (PipelineFailure ex) {
      return ProblemReporter.report(ex);
    } catch (JsonProcessingException ex) {
      log.error("Unable to render inspection result", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in inspect", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Map<String, Object> render(ExtractConfig config, InspectUseCase.Inspection inspection) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("source_kind", config.sourceKind().wireName());
    out.put("schema_generation", inspection.generation());
    out.put("schema_degraded", inspection.degraded());
    out.put("wal_frames", inspection.walFrames());
    out.put("tables", new TreeMap<>(inspection.tableRowCounts()));
    out.put("message_columns", new TreeSet<>(inspection.messageColumns()));
    return out;
  }
}
