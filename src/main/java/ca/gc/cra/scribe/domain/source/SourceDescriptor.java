package ca.gc.cra.scribe.domain.source;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies the source to stage: a live database path, or a backup root with an optional passphrase.
 *
 * <p>{@link #toString()} never prints the passphrase.</p>
 *
 * @param kind source kind
 * @param location database file for {@link SourceKind#LIVE}, backup root for {@link SourceKind#BACKUP}
 * @param passphrase backup passphrase; always empty for live sources
 * @since 0.1.0
 */
public record SourceDescriptor(SourceKind kind, Path location, Optional<String> passphrase) {
  public SourceDescriptor {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(location, "location");
    passphrase = passphrase == null ? Optional.empty() : passphrase.filter(value -> !value.isEmpty());
    if (kind == SourceKind.LIVE && passphrase.isPresent()) {
      throw new IllegalArgumentException("live sources do not take a passphrase");
    }
  }

  public static SourceDescriptor live(Path databasePath) {
    return new SourceDescriptor(SourceKind.LIVE, databasePath, Optional.empty());
  }

  public static SourceDescriptor backup(Path backupRoot, String passphrase) {
    return new SourceDescriptor(SourceKind.BACKUP, backupRoot, Optional.ofNullable(passphrase));
  }

  @Override
  public String toString() {
    return "SourceDescriptor[kind=" + kind + ", location=" + location
        + ", passphrase=" + (passphrase.isPresent() ? "<set>" : "<none>") + "]";
  }
}
