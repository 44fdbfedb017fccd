package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemDetails;
import ca.gc.cra.scribe.infrastructure.output.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Prints fatal pipeline failures as a single-line problem JSON document on stderr. */
final class ProblemReporter {
  private static final Logger log = LoggerFactory.getLogger(ProblemReporter.class);

  private ProblemReporter() {}

  /**
   * Logs and prints the failure, returning the mapped exit code.
   *
   * @param failure fatal failure
   * @return exit code for the failure's problem code
   */
  static ExitCode report(PipelineFailure failure) {
    ProblemDetails problem = ProblemDetails.of(failure);
    log.error("Run failed with {}: {}", problem.code(), problem.detail());
    // Causes may carry unredacted paths; keep them out of INFO and above.
    log.debug("Failure cause for {}", problem.code(), failure);
    try {
      CliPrinter.printError(CanonicalJson.line(CanonicalJson.problem(problem)));
    } catch (JsonProcessingException ex) {
      log.error("Unable to render problem document for {}", problem.code(), ex);
      CliPrinter.printError(problem.code() + ": " + problem.detail());
    }
    return ExitCode.forProblem(failure.code());
  }
}
