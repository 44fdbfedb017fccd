package ca.gc.cra.scribe.domain.problem;

/**
 * Replaces a home directory prefix with {@code ~} wherever it appears in a string.
 *
 * @since 0.1.0
 */
public final class PathRedaction {
  private PathRedaction() {
    // Utility
  }

  /**
   * Redacts every occurrence of {@code home} in {@code value}.
   *
   * @param value text possibly holding filesystem paths; {@code null} yields {@code null}
   * @param home home directory; blank or root homes leave the text unchanged
   * @return redacted text
   */
  public static String redact(String value, String home) {
    if (value == null || home == null) {
      return value;
    }
    String trimmed = home.strip();
    while (trimmed.length() > 1 && (trimmed.endsWith("/") || trimmed.endsWith("\\"))) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (trimmed.isEmpty() || trimmed.equals("/")) {
      return value;
    }
    StringBuilder out = new StringBuilder(value.length());
    int from = 0;
    int idx;
    while ((idx = value.indexOf(trimmed, from)) >= 0) {
      int end = idx + trimmed.length();
      boolean boundary = end == value.length() || value.charAt(end) == '/' || value.charAt(end) == '\\';
      out.append(value, from, idx);
      out.append(boundary ? "~" : trimmed);
      from = end;
    }
    out.append(value.substring(from));
    return out.toString();
  }
}
