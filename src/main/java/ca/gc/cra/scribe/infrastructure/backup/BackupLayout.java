package ca.gc.cra.scribe.infrastructure.backup;

import java.nio.file.Path;

/**
 * Names and paths of a device backup directory.
 *
 * @since 0.1.0
 */
public final class BackupLayout {
  public static final String MANIFEST_DB = "Manifest.db";
  public static final String MANIFEST_PLIST = "Manifest.plist";
  public static final String STATUS_PLIST = "Status.plist";
  public static final String INFO_PLIST = "Info.plist";
  public static final String HOME_DOMAIN = "HomeDomain";
  public static final String MEDIA_DOMAIN = "MediaDomain";
  public static final String SMS_DATABASE = "Library/SMS/sms.db";

  private BackupLayout() {
    // Utility
  }

  /**
   * Returns the physical blob for a manifest file identifier.
   *
   * @param root backup root
   * @param fileId manifest {@code fileID}
   * @return {@code <root>/<fileID[0:2]>/<fileID>}
   */
  public static Path blobPath(Path root, String fileId) {
    if (fileId == null || fileId.length() < 2) {
      throw new IllegalArgumentException("fileID must have at least two characters");
    }
    return root.resolve(fileId.substring(0, 2)).resolve(fileId);
  }
}
