package ca.gc.cra.scribe.infrastructure.staging;

import ca.gc.cra.scribe.application.port.SourceStager;
import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.domain.source.SourceKind;
import ca.gc.cra.scribe.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.scribe.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SourceStager} that creates the private working directory and runs the
 * kind-specific stager on a dedicated daemon thread bounded by a timeout.
 * <p><strong>Why:</strong> Copying and decrypting multi-gigabyte sources can hang on slow or failing media; the run
 * fails with {@link ProblemCode#STAGING_TIMEOUT} instead of blocking forever.</p>
 * <p><strong>Thread-safety:</strong> Safe to share; each call uses its own executor.</p>
 *
 * @since 0.1.0
 */
public final class TimeBoundSourceStager implements SourceStager {
  private static final Logger log = LoggerFactory.getLogger(TimeBoundSourceStager.class);
  private static final Duration DEFAULT_WORKER_GRACE = Duration.ofSeconds(5);

  private final Path workRoot;
  private final Duration timeout;
  private final Map<SourceKind, WorkDirStager> stagers;
  private final Duration workerGrace;

  /**
   * Creates the stager.
   *
   * @param workRoot parent of per-run working directories; {@code null} uses the system temporary directory
   * @param timeout upper bound for copy and decryption
   * @param stagers kind-specific stagers; every {@link SourceKind} must be present
   */
  public TimeBoundSourceStager(Path workRoot, Duration timeout, Map<SourceKind, WorkDirStager> stagers) {
    this(workRoot, timeout, stagers, DEFAULT_WORKER_GRACE);
  }

  /**
   * Creates the stager with an explicit wait for a cancelled staging thread.
   *
   * @param workRoot parent of per-run working directories; {@code null} uses the system temporary directory
   * @param timeout upper bound for copy and decryption
   * @param stagers kind-specific stagers; every {@link SourceKind} must be present
   * @param workerGrace how long to wait for a cancelled staging thread before removing its directory
   */
  public TimeBoundSourceStager(
      Path workRoot, Duration timeout, Map<SourceKind, WorkDirStager> stagers, Duration workerGrace) {
    this.workerGrace = Objects.requireNonNull(workerGrace, "workerGrace");
    this.workRoot = workRoot;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.stagers = new EnumMap<>(SourceKind.class);
    this.stagers.putAll(stagers);
    for (SourceKind kind : SourceKind.values()) {
      if (!this.stagers.containsKey(kind)) {
        throw new IllegalArgumentException("No stager for " + kind);
      }
    }
  }

  @Override
  public StagedSource stage(SourceDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    Path workDirectory = createWorkDirectory();
    WorkDirStager stager = stagers.get(descriptor.kind());
    ExecutorService executor = ExecutorFactories.newSingleDaemon("scribe-stage");
    Future<StagedSource> future = executor.submit(() -> stager.stage(descriptor, workDirectory));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      stopWorker(executor);
      discard(workDirectory);
      throw new PipelineFailure(ProblemCode.STAGING_TIMEOUT,
          "Staging did not finish within " + timeout.toSeconds() + "s", descriptor.location().toString(), ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      stopWorker(executor);
      Thread.currentThread().interrupt();
      discard(workDirectory);
      throw new PipelineFailure(ProblemCode.RUN_INTERRUPTED, "Interrupted while staging",
          descriptor.location().toString(), ex);
    } catch (ExecutionException ex) {
      discard(workDirectory);
      Throwable cause = ex.getCause();
      if (cause instanceof PipelineFailure failure) {
        throw failure;
      }
      throw new PipelineFailure(ProblemCode.DATABASE_UNREADABLE,
          "Staging failed: " + cause, descriptor.location().toString(), cause);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Interrupts the staging thread and waits for it to leave, so the working directory is not deleted while
   * a copy is still writing into it.
   */
  private void stopWorker(ExecutorService executor) {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(workerGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Staging thread still running after {} ms; removing its working directory anyway",
            workerGrace.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the staging thread to stop");
    }
  }

  private Path createWorkDirectory() {
    try {
      if (workRoot == null) {
        return Files.createTempDirectory("scribe-stage-");
      }
      Files.createDirectories(workRoot);
      return Files.createTempDirectory(workRoot, "scribe-stage-");
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.OUTPUT_FAILURE, "Unable to create staging directory",
          workRoot == null ? null : workRoot.toString(), ex);
    }
  }

  private static void discard(Path workDirectory) {
    try {
      StagedDirectory.deleteTree(workDirectory);
    } catch (IOException ex) {
      log.warn("Failed to delete staging directory {}", Logs.redactPath(workDirectory.toString()), ex);
    }
  }
}
