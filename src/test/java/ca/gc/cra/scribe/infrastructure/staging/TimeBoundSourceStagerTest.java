package ca.gc.cra.scribe.infrastructure.staging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.domain.source.SourceKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TimeBoundSourceStagerTest {
  @TempDir Path tempDir;

  @Test
  void slowStagingTimesOutAndDiscardsWorkDirectory() throws IOException {
    AtomicReference<Path> used = new AtomicReference<>();
    WorkDirStager slow = (descriptor, work) -> {
      used.set(work);
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      throw new IllegalStateException("should have been cancelled");
    };
    TimeBoundSourceStager stager = new TimeBoundSourceStager(tempDir, Duration.ofMillis(200),
        Map.of(SourceKind.LIVE, slow, SourceKind.BACKUP, slow));

    PipelineFailure failure = assertThrows(PipelineFailure.class,
        () -> stager.stage(SourceDescriptor.live(tempDir.resolve("chat.db"))));

    assertEquals(ProblemCode.STAGING_TIMEOUT, failure.code());
    assertTrue(used.get() == null || !Files.exists(used.get()));
  }

  @Test
  void timedOutStagingWaitsForTheWorkerBeforeRemovingItsDirectory() throws IOException {
    AtomicReference<Path> used = new AtomicReference<>();
    AtomicBoolean finished = new AtomicBoolean();
    WorkDirStager stubborn = (descriptor, work) -> {
      used.set(work);
      long deadline = System.nanoTime() + Duration.ofMillis(800).toNanos();
      while (System.nanoTime() < deadline) {
        try {
          Thread.sleep(50);
        } catch (InterruptedException ignored) {
          // keeps copying like a stager blocked in uninterruptible I/O
        }
      }
      try {
        Files.writeString(work.resolve("late.part"), "x");
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      } finally {
        finished.set(true);
      }
      return null;
    };
    TimeBoundSourceStager stager = new TimeBoundSourceStager(tempDir, Duration.ofMillis(200),
        Map.of(SourceKind.LIVE, stubborn, SourceKind.BACKUP, stubborn), Duration.ofSeconds(10));

    PipelineFailure failure = assertThrows(PipelineFailure.class,
        () -> stager.stage(SourceDescriptor.live(tempDir.resolve("chat.db"))));

    assertEquals(ProblemCode.STAGING_TIMEOUT, failure.code());
    assertTrue(finished.get(), "worker finished before the directory was removed");
    assertTrue(Files.notExists(used.get()), "late writes are removed with the directory");
  }

  @Test
  void delegatesByKindInsidePrivateWorkDirectory() throws IOException {
    WorkDirStager live = (descriptor, work) -> new StagedDirectory(descriptor, work.resolve("chat.db"), work, 0,
        row -> Optional.empty(), false, List.of());
    WorkDirStager backup = (descriptor, work) -> {
      throw new PipelineFailure(ProblemCode.BACKUP_MANIFEST_MISSING, "no backup", null);
    };
    TimeBoundSourceStager stager = new TimeBoundSourceStager(tempDir.resolve("stage"), Duration.ofSeconds(5),
        Map.of(SourceKind.LIVE, live, SourceKind.BACKUP, backup));

    Path work;
    try (StagedSource staged = stager.stage(SourceDescriptor.live(tempDir.resolve("chat.db")))) {
      work = staged.workDirectory();
      assertTrue(work.getFileName().toString().startsWith("scribe-stage-"));
      assertTrue(Files.isDirectory(work));
    }
    assertTrue(Files.notExists(work));

    PipelineFailure failure = assertThrows(PipelineFailure.class,
        () -> stager.stage(SourceDescriptor.backup(tempDir.resolve("backup"), null)));
    assertEquals(ProblemCode.BACKUP_MANIFEST_MISSING, failure.code());
    try (Stream<Path> left = Files.list(tempDir.resolve("stage"))) {
      assertEquals(0L, left.count(), "failed staging leaves no work directory behind");
    }
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class,
        () -> new TimeBoundSourceStager(tempDir, Duration.ZERO, Map.of()));
  }
}
