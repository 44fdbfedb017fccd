package ca.gc.cra.scribe.infrastructure.staging;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Counts frames in a SQLite write-ahead log from its header and size.
 *
 * @since 0.1.0
 */
public final class WalInspector {
  static final int HEADER_BYTES = 32;
  static final int FRAME_HEADER_BYTES = 24;

  private WalInspector() {
    // Utility
  }

  /**
   * Returns the number of complete frames in a WAL file.
   *
   * @param wal write-ahead log path
   * @return frame count; {@code 0} when the file is absent, truncated or has an invalid page size
   * @throws IOException when the header cannot be read
   */
  public static long frameCount(Path wal) throws IOException {
    if (wal == null || !Files.isRegularFile(wal)) {
      return 0L;
    }
    long size = Files.size(wal);
    if (size < HEADER_BYTES) {
      return 0L;
    }
    byte[] header = new byte[HEADER_BYTES];
    try (InputStream in = Files.newInputStream(wal)) {
      if (in.readNBytes(header, 0, HEADER_BYTES) < HEADER_BYTES) {
        return 0L;
      }
    }
    long pageSize = ((header[8] & 0xFFL) << 24)
        | ((header[9] & 0xFFL) << 16)
        | ((header[10] & 0xFFL) << 8)
        | (header[11] & 0xFFL);
    if (pageSize == 1L) {
      pageSize = 65_536L;
    }
    if (pageSize < 512L) {
      return 0L;
    }
    return (size - HEADER_BYTES) / (pageSize + FRAME_HEADER_BYTES);
  }
}
