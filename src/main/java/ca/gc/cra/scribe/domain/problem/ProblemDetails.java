package ca.gc.cra.scribe.domain.problem;

import java.util.Objects;

/**
 * Structured problem description rendered for fatal run outcomes.
 *
 * <p>{@code instance} and {@code detail} never contain the unredacted user home directory.</p>
 *
 * @param type problem type URI derived from the code
 * @param title short human summary
 * @param status HTTP-style status
 * @param detail redacted detail message
 * @param instance redacted context path, or {@code null}
 * @param code stable machine-readable code
 * @since 0.1.0
 */
public record ProblemDetails(
    String type, String title, int status, String detail, String instance, String code) {
  /** Base URI for problem types. */
  public static final String TYPE_BASE = "https://scribe.local/problems/";

  public ProblemDetails {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(code, "code");
  }

  /**
   * Builds the problem description for a failure using the current {@code user.home}.
   *
   * @param failure fatal failure
   * @return redacted problem description
   */
  public static ProblemDetails of(PipelineFailure failure) {
    return of(failure, System.getProperty("user.home"));
  }

  /**
   * Builds the problem description for a failure, redacting the supplied home directory.
   *
   * @param failure fatal failure; must not be {@code null}
   * @param home home directory to replace with {@code ~}; may be {@code null}
   * @return redacted problem description
   */
  public static ProblemDetails of(PipelineFailure failure, String home) {
    Objects.requireNonNull(failure, "failure");
    ProblemCode code = failure.code();
    String detail = failure.getMessage() == null ? code.title() : failure.getMessage();
    return new ProblemDetails(
        TYPE_BASE + code.slug(),
        code.title(),
        code.status(),
        PathRedaction.redact(detail, home),
        failure.contextPath().map(path -> PathRedaction.redact(path, home)).orElse(null),
        code.name());
  }
}
