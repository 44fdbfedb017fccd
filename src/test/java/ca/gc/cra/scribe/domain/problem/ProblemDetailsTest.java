package ca.gc.cra.scribe.domain.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class ProblemDetailsTest {

  @Test
  void homeDirectoryIsRedactedInDetailAndInstance() {
    PipelineFailure failure = new PipelineFailure(ProblemCode.DATABASE_NOT_FOUND,
        "No database at /home/alex/Library/Messages/chat.db", "/home/alex/Library/Messages/chat.db");

    ProblemDetails problem = ProblemDetails.of(failure, "/home/alex");

    assertEquals("https://scribe.local/problems/database-not-found", problem.type());
    assertEquals("DATABASE_NOT_FOUND", problem.code());
    assertEquals(404, problem.status());
    assertEquals("~/Library/Messages/chat.db", problem.instance());
    assertEquals("No database at ~/Library/Messages/chat.db", problem.detail());
  }

  @Test
  void siblingDirectoriesAreNotRedacted() {
    assertEquals("/home/alexander/x", PathRedaction.redact("/home/alexander/x", "/home/alex"));
    assertEquals("~", PathRedaction.redact("/home/alex", "/home/alex/"));
  }

  @Test
  void missingContextLeavesInstanceEmpty() {
    ProblemDetails problem = ProblemDetails.of(
        new PipelineFailure(ProblemCode.NO_VALID_ROWS, null, null), "/home/alex");

    assertNull(problem.instance());
    assertEquals(ProblemCode.NO_VALID_ROWS.title(), problem.detail());
    assertFalse(problem.type().endsWith("_"));
  }
}
