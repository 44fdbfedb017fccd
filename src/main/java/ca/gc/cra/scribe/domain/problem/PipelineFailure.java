package ca.gc.cra.scribe.domain.problem;

import java.util.Objects;
import java.util.Optional;

/**
 * Fatal pipeline condition carrying a stable {@link ProblemCode} and an optional context path.
 *
 * <p>Thrown by adapters and use cases only for conditions that must abort the run. Per-row
 * degradations are counted instead.</p>
 *
 * @since 0.1.0
 */
public final class PipelineFailure extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ProblemCode code;
  private final String contextPath;

  /**
   * Creates a failure without an underlying cause.
   *
   * @param code stable problem code; must not be {@code null}
   * @param detail human-readable detail
   * @param contextPath path the failure relates to; may be {@code null}
   */
  public PipelineFailure(ProblemCode code, String detail, String contextPath) {
    super(detail);
    this.code = Objects.requireNonNull(code, "code");
    this.contextPath = contextPath;
  }

  /**
   * Creates a failure wrapping a library or I/O cause.
   *
   * @param code stable problem code; must not be {@code null}
   * @param detail human-readable detail
   * @param contextPath path the failure relates to; may be {@code null}
   * @param cause underlying exception
   */
  public PipelineFailure(ProblemCode code, String detail, String contextPath, Throwable cause) {
    super(detail, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.contextPath = contextPath;
  }

  public ProblemCode code() {
    return code;
  }

  public Optional<String> contextPath() {
    return Optional.ofNullable(contextPath);
  }
}
