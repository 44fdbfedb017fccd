package ca.gc.cra.scribe.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Hashes attachment bytes and optionally copies them into a content-addressed store.
 *
 * @since 0.1.0
 */
public interface AttachmentMaterializer {
  /**
   * Computes the content hash of a file.
   *
   * @param source readable file
   * @return {@code sha256:<hex>}
   * @throws IOException when the file cannot be read
   */
  String hash(Path source) throws IOException;

  /**
   * Copies a file under a name derived from the hash of the copied bytes.
   *
   * @param source readable file
   * @param displayName original name, used only for its extension
   * @return location and hash of the copy
   * @throws IOException when copying fails
   */
  Materialized materialize(Path source, String displayName) throws IOException;

  /**
   * Materialized copy.
   *
   * @param path content-addressed path
   * @param contentHash {@code sha256:<hex>} of the copied bytes
   */
  record Materialized(Path path, String contentHash) {}
}
