package ca.gc.cra.scribe.infrastructure.backup;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

/**
 * <strong>What:</strong> Lookup index over a staged backup {@code Manifest.db}.
 * <p><strong>Role:</strong> Opened once during staging, owned by the staged source and reused by the backup
 * attachment locator for {@code (domain, relativePath)} lookups.</p>
 * <p><strong>Thread-safety:</strong> Lookups are synchronized; the JDBC connection is not shared otherwise.</p>
 *
 * @since 0.1.0
 */
public final class BackupManifest implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BackupManifest.class);

  private final Connection connection;
  private final boolean hasFlags;
  private final boolean hasFile;

  private BackupManifest(Connection connection, boolean hasFlags, boolean hasFile) {
    this.connection = connection;
    this.hasFlags = hasFlags;
    this.hasFile = hasFile;
  }

  /**
   * Opens a staged manifest copy.
   *
   * @param manifestDb plaintext manifest database owned by the run
   * @return open manifest
   * @throws IOException when the file is not a manifest database
   */
  public static BackupManifest open(Path manifestDb) throws IOException {
    Objects.requireNonNull(manifestDb, "manifestDb");
    SQLiteDataSource dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + manifestDb.toAbsolutePath());
    Connection connection = null;
    try {
      connection = dataSource.getConnection();
      Set<String> columns = new HashSet<>();
      try (Statement statement = connection.createStatement();
          ResultSet rs = statement.executeQuery("PRAGMA table_info(Files)")) {
        while (rs.next()) {
          columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
        }
      }
      if (!columns.containsAll(Set.of("fileid", "domain", "relativepath"))) {
        throw new IOException("Manifest has no Files(fileID, domain, relativePath) table");
      }
      return new BackupManifest(connection, columns.contains("flags"), columns.contains("file"));
    } catch (SQLException | IOException ex) {
      closeQuietly(connection);
      if (ex instanceof IOException io) {
        throw io;
      }
      throw new IOException("Unable to read manifest: " + ex.getMessage(), ex);
    }
  }

  /**
   * Looks up a logical backup file. A leading slash on {@code relativePath} is ignored.
   *
   * @param domain backup domain such as {@code HomeDomain}
   * @param relativePath path relative to the domain
   * @return manifest entry, or empty when not recorded
   * @throws IOException when the query fails
   */
  public synchronized Optional<ManifestEntry> find(String domain, String relativePath) throws IOException {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(relativePath, "relativePath");
    String sql = "SELECT fileID, domain, relativePath, "
        + (hasFlags ? "flags" : "NULL") + ", "
        + (hasFile ? "file" : "NULL")
        + " FROM Files WHERE domain = ? AND relativePath = ? LIMIT 1";
    String trimmed = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, domain);
      statement.setString(2, trimmed);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        String fileId = rs.getString(1);
        if (!isUsableFileId(fileId)) {
          log.debug("Manifest entry for {} has an unusable fileID", domain);
          return Optional.empty();
        }
        return Optional.of(new ManifestEntry(
            fileId, rs.getString(2), rs.getString(3), rs.getInt(4), rs.getBytes(5)));
      }
    } catch (SQLException ex) {
      throw new IOException("Manifest lookup failed: " + ex.getMessage(), ex);
    }
  }

  /** A fileID names a blob under {@code <fileID[0:2]>/}, so it needs two characters and no path separators. */
  static boolean isUsableFileId(String fileId) {
    return fileId != null
        && fileId.length() >= 2
        && fileId.indexOf('/') < 0
        && fileId.indexOf('\\') < 0
        && !fileId.contains("..");
  }

  @Override
  public synchronized void close() {
    closeQuietly(connection);
  }

  private static void closeQuietly(Connection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      log.warn("Failed to close manifest connection", ex);
    }
  }

  /**
   * Manifest row.
   *
   * @param fileId blob identifier
   * @param domain backup domain
   * @param relativePath path relative to the domain
   * @param flags manifest flags; {@code 1} marks regular files
   * @param file archived file metadata, holding the per-file key in encrypted backups; may be {@code null}
   */
  public record ManifestEntry(String fileId, String domain, String relativePath, int flags, byte[] file) {}
}
