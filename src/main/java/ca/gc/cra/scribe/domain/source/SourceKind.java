package ca.gc.cra.scribe.domain.source;

import java.util.Locale;

/** Where the source database lives. */
public enum SourceKind {
  /** A {@code chat.db} on the local filesystem. */
  LIVE,
  /** A device backup directory holding {@code Manifest.db} and hashed blobs. */
  BACKUP;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
