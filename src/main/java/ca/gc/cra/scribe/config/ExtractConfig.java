package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.domain.source.SourceKind;
import ca.gc.cra.scribe.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * <strong>What:</strong> Validated settings for one SCRIBE run against a live database or a device backup.
 * <p><strong>Why:</strong> Collapses defaults, YAML and CLI overrides into a single immutable value so a run is
 * reproducible from its effective configuration.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot} and the CLI commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require exactly one source: {@code db} (live) or {@code backup}.</li>
 *   <li>Optionally scope the run to the conversations of one handle, matched verbatim.</li>
 *   <li>Bound worker counts and timeouts.</li>
 *   <li>Resolve the backup passphrase from an argument or a named environment variable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Security:</strong> The record never holds the passphrase itself, only the name of the variable
 * that carries it.</p>
 *
 * @param sourceKind live database or backup
 * @param sourcePath {@code chat.db} path or backup root
 * @param passphraseEnv environment variable holding the backup passphrase
 * @param outputDirectory directory receiving run outputs
 * @param workDirectory parent of the per-run staging directory
 * @param retainStaging keep the staging directory after the run
 * @param copyAttachments copy attachment bytes into {@code <out>/attachments}
 * @param hashAttachments hash attachment bytes even when not copying them
 * @param attachmentsHome directory substituted for {@code ~} in attachment paths
 * @param attachmentWorkers parallelism for attachment hashing and transcription
 * @param stagingTimeout upper bound on copying or decrypting the source
 * @param transcription audio transcription settings
 * @param allowOverwrite accept a non-empty output directory
 * @param contact handle address ({@code handle.id}) whose conversations are extracted; empty for all
 * @since 0.1.0
 * @see ConfigMerger
 */
public record ExtractConfig(
    SourceKind sourceKind,
    Path sourcePath,
    String passphraseEnv,
    Path outputDirectory,
    Path workDirectory,
    boolean retainStaging,
    boolean copyAttachments,
    boolean hashAttachments,
    Path attachmentsHome,
    int attachmentWorkers,
    Duration stagingTimeout,
    TranscriptionConfig transcription,
    boolean allowOverwrite,
    Optional<String> contact) {

  static final String DEFAULT_PASSPHRASE_ENV = "SCRIBE_BACKUP_PASSPHRASE";
  static final Duration DEFAULT_STAGING_TIMEOUT = Duration.ofMinutes(10);
  static final int MAX_WORKERS = 64;

  public ExtractConfig {
    Objects.requireNonNull(sourceKind, "sourceKind");
    Objects.requireNonNull(sourcePath, "sourcePath");
    passphraseEnv = Strings.requirePrintableAscii("passphraseEnv",
        passphraseEnv == null ? DEFAULT_PASSPHRASE_ENV : passphraseEnv, 128);
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    workDirectory = Objects.requireNonNull(workDirectory, "workDirectory").toAbsolutePath().normalize();
    attachmentsHome = Objects.requireNonNull(attachmentsHome, "attachmentsHome").toAbsolutePath().normalize();
    if (attachmentWorkers < 1 || attachmentWorkers > MAX_WORKERS) {
      throw new IllegalArgumentException("attachmentWorkers must be between 1 and " + MAX_WORKERS);
    }
    stagingTimeout = Objects.requireNonNullElse(stagingTimeout, DEFAULT_STAGING_TIMEOUT);
    transcription = Objects.requireNonNullElse(transcription, TranscriptionConfig.off());
    contact = Objects.requireNonNullElse(contact, Optional.<String>empty());
    if (outputDirectory.equals(sourcePath.toAbsolutePath().normalize())) {
      throw new IllegalArgumentException("out must not be the source itself");
    }
  }

  /**
   * Builds a configuration from flat {@code key=value} settings.
   *
   * @param kv effective settings, usually from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException when the source is ambiguous or a value is invalid
   */
  public static ExtractConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    Optional<Path> db = ConfigValues.parseOptionalPath(kv, "db");
    Optional<Path> backup = ConfigValues.parseOptionalPath(kv, "backup");
    if (db.isPresent() == backup.isPresent()) {
      throw new IllegalArgumentException("Exactly one of db=<chat.db> or backup=<backup dir> is required");
    }
    SourceKind kind = db.isPresent() ? SourceKind.LIVE : SourceKind.BACKUP;
    String home = System.getProperty("user.home", ".");

    return new ExtractConfig(
        kind,
        db.orElseGet(backup::get),
        ConfigValues.optionalString(kv, "passphraseEnv").orElse(DEFAULT_PASSPHRASE_ENV),
        ConfigValues.parseOptionalPath(kv, "out").orElseGet(ExtractConfig::defaultOutputDirectory),
        ConfigValues.parseOptionalPath(kv, "workDir")
            .orElseGet(() -> Path.of(System.getProperty("java.io.tmpdir"))),
        ConfigValues.parseBoolean(kv, "retainStaging", false),
        ConfigValues.parseBoolean(kv, "copyAttachments", false),
        ConfigValues.parseBoolean(kv, "hashAttachments", true),
        ConfigValues.parseOptionalPath(kv, "attachmentsHome").orElse(Path.of(home)),
        ConfigValues.parseBoundedInt(kv, "attachmentWorkers", 1, 1, MAX_WORKERS),
        ConfigValues.parseDuration(kv, "stagingTimeout", DEFAULT_STAGING_TIMEOUT),
        TranscriptionConfig.fromMap(kv),
        ConfigValues.parseBoolean(kv, "allowOverwrite", false),
        ConfigValues.optionalString(kv, "contact"));
  }

  /**
   * Produces the source descriptor, resolving the backup passphrase.
   *
   * <p>An explicit passphrase wins over the environment variable named by {@link #passphraseEnv()}.
   * Live sources ignore both.</p>
   *
   * @param explicitPassphrase passphrase given on the command line
   * @param environment environment lookup, usually {@link System#getenv(String)}
   * @return descriptor for staging
   */
  public SourceDescriptor toDescriptor(Optional<String> explicitPassphrase, Function<String, String> environment) {
    Objects.requireNonNull(explicitPassphrase, "explicitPassphrase");
    Objects.requireNonNull(environment, "environment");
    if (sourceKind == SourceKind.LIVE) {
      return SourceDescriptor.live(sourcePath);
    }
    String passphrase = explicitPassphrase.orElseGet(() -> environment.apply(passphraseEnv));
    return SourceDescriptor.backup(sourcePath, passphrase);
  }

  static Path defaultOutputDirectory() {
    return Path.of(System.getProperty("user.home", "."), ".scribe", "out");
  }
}
