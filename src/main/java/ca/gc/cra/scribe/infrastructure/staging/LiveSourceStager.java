package ca.gc.cra.scribe.infrastructure.staging;

import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stages a live database by copying the primary file with its write-ahead log and
 * shared-memory companions.
 * <p><strong>Why:</strong> The original is never opened with SQLite; opening the private copy read-write replays the
 * copied log so rows not yet checkpointed are read.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from configuration.</p>
 *
 * @since 0.1.0
 */
public final class LiveSourceStager implements WorkDirStager {
  private static final Logger log = LoggerFactory.getLogger(LiveSourceStager.class);

  /** File name of the staged primary database. */
  public static final String STAGED_DATABASE = "chat.db";
  static final List<String> COMPANIONS = List.of("-wal", "-shm");

  private final Path attachmentsHome;
  private final boolean retain;

  /**
   * Creates the stager.
   *
   * @param attachmentsHome expansion of {@code ~} in attachment filenames
   * @param retain keep the working directory after the run
   */
  public LiveSourceStager(Path attachmentsHome, boolean retain) {
    this.attachmentsHome = Objects.requireNonNull(attachmentsHome, "attachmentsHome");
    this.retain = retain;
  }

  @Override
  public StagedSource stage(SourceDescriptor descriptor, Path workDirectory) {
    Path source = descriptor.location();
    if (!Files.isRegularFile(source)) {
      throw new PipelineFailure(ProblemCode.DATABASE_NOT_FOUND,
          "Source database does not exist or is not a file", source.toString());
    }
    Path staged = workDirectory.resolve(STAGED_DATABASE);
    try {
      Files.copy(source, staged, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
      for (String suffix : COMPANIONS) {
        Path companion = source.resolveSibling(source.getFileName() + suffix);
        if (Files.isRegularFile(companion)) {
          Files.copy(companion, staged.resolveSibling(STAGED_DATABASE + suffix),
              StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
        }
      }
      long frames = WalInspector.frameCount(staged.resolveSibling(STAGED_DATABASE + "-wal"));
      log.info("Staged live database {} with {} WAL frames", Logs.redactPath(source.toString()), frames);
      Path databaseDirectory = source.toAbsolutePath().getParent();
      return new StagedDirectory(descriptor, staged, workDirectory, frames,
          new LiveAttachmentLocator(attachmentsHome, databaseDirectory), retain, List.of());
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.DATABASE_UNREADABLE,
          "Unable to copy source database: " + ex.getMessage(), source.toString(), ex);
    }
  }
}
