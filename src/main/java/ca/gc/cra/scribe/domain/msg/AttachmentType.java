package ca.gc.cra.scribe.domain.msg;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse attachment classification. Resolution order is MIME type, then UTI, then file extension.
 *
 * @since 0.1.0
 */
public enum AttachmentType {
  IMAGE("image"),
  VIDEO("video"),
  AUDIO("audio"),
  FILE("file"),
  UNKNOWN("unknown");

  private static final Set<String> IMAGE_EXTENSIONS =
      Set.of("jpg", "jpeg", "png", "gif", "heic", "heif", "tiff", "tif", "bmp", "webp");
  private static final Set<String> VIDEO_EXTENSIONS = Set.of("mov", "mp4", "m4v", "avi", "3gp");
  private static final Set<String> AUDIO_EXTENSIONS =
      Set.of("caf", "m4a", "mp3", "wav", "aac", "amr", "aiff", "aif", "opus");

  private final String wireName;

  AttachmentType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Classifies an attachment from whichever hints are available.
   *
   * @param mimeType MIME type; may be {@code null}
   * @param uti uniform type identifier; may be {@code null}
   * @param filename stored file name or path; may be {@code null}
   * @return classification, {@link #UNKNOWN} when nothing is known
   */
  public static AttachmentType classify(String mimeType, String uti, String filename) {
    AttachmentType byMime = fromMime(mimeType);
    if (byMime != null) {
      return byMime;
    }
    AttachmentType byUti = fromUti(uti);
    if (byUti != null) {
      return byUti;
    }
    AttachmentType byExtension = fromExtension(filename);
    if (byExtension != null) {
      return byExtension;
    }
    boolean anyHint = notBlank(mimeType) || notBlank(uti) || notBlank(filename);
    return anyHint ? FILE : UNKNOWN;
  }

  private static AttachmentType fromMime(String mimeType) {
    if (!notBlank(mimeType)) {
      return null;
    }
    String lower = mimeType.trim().toLowerCase(Locale.ROOT);
    if (lower.startsWith("image/")) {
      return IMAGE;
    }
    if (lower.startsWith("video/")) {
      return VIDEO;
    }
    if (lower.startsWith("audio/")) {
      return AUDIO;
    }
    return FILE;
  }

  private static AttachmentType fromUti(String uti) {
    if (!notBlank(uti)) {
      return null;
    }
    String lower = uti.trim().toLowerCase(Locale.ROOT);
    if (lower.equals("public.image") || lower.equals("public.jpeg") || lower.equals("public.png")
        || lower.equals("public.heic") || lower.equals("com.compuserve.gif")) {
      return IMAGE;
    }
    if (lower.equals("public.movie") || lower.equals("public.mpeg-4")
        || lower.equals("com.apple.quicktime-movie")) {
      return VIDEO;
    }
    if (lower.equals("public.audio") || lower.equals("com.apple.coreaudio-format")
        || lower.equals("public.mp3") || lower.equals("com.apple.m4a-audio")) {
      return AUDIO;
    }
    return null;
  }

  private static AttachmentType fromExtension(String filename) {
    if (!notBlank(filename)) {
      return null;
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1 || filename.indexOf('/', dot) >= 0) {
      return null;
    }
    String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    if (IMAGE_EXTENSIONS.contains(ext)) {
      return IMAGE;
    }
    if (VIDEO_EXTENSIONS.contains(ext)) {
      return VIDEO;
    }
    if (AUDIO_EXTENSIONS.contains(ext)) {
      return AUDIO;
    }
    return null;
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }
}
