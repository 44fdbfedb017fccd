package ca.gc.cra.scribe.infrastructure.staging;

import ca.gc.cra.scribe.application.port.AttachmentLocator;
import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.logging.Logs;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link StagedSource} backed by a private working directory.
 * <p><strong>Lifecycle:</strong> {@link #close()} closes registered resources (such as the backup manifest) in
 * reverse order, then deletes the directory tree unless staging is retained.</p>
 * <p><strong>Thread-safety:</strong> Accessors are immutable; {@link #close()} is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class StagedDirectory implements StagedSource {
  private static final Logger log = LoggerFactory.getLogger(StagedDirectory.class);

  private final SourceDescriptor descriptor;
  private final Path databasePath;
  private final Path workDirectory;
  private final long walFrames;
  private final AttachmentLocator attachmentLocator;
  private final boolean retain;
  private final List<AutoCloseable> resources;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a staged directory handle.
   *
   * @param descriptor source the copy came from
   * @param databasePath staged primary database inside {@code workDirectory}
   * @param workDirectory private working directory
   * @param walFrames frames in the staged write-ahead log
   * @param attachmentLocator locator chain for the source
   * @param retain keep the directory on close
   * @param resources resources owned by this staging, closed before deletion
   */
  public StagedDirectory(
      SourceDescriptor descriptor,
      Path databasePath,
      Path workDirectory,
      long walFrames,
      AttachmentLocator attachmentLocator,
      boolean retain,
      List<? extends AutoCloseable> resources) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.databasePath = Objects.requireNonNull(databasePath, "databasePath");
    this.workDirectory = Objects.requireNonNull(workDirectory, "workDirectory");
    this.walFrames = walFrames;
    this.attachmentLocator = Objects.requireNonNull(attachmentLocator, "attachmentLocator");
    this.retain = retain;
    this.resources = new ArrayList<>(resources == null ? List.of() : resources);
  }

  @Override
  public SourceDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public Path databasePath() {
    return databasePath;
  }

  @Override
  public Path workDirectory() {
    return workDirectory;
  }

  @Override
  public long walFrames() {
    return walFrames;
  }

  @Override
  public AttachmentLocator attachmentLocator() {
    return attachmentLocator;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (int i = resources.size() - 1; i >= 0; i--) {
      try {
        resources.get(i).close();
      } catch (Exception ex) {
        log.warn("Failed to close staging resource {}", resources.get(i).getClass().getSimpleName(), ex);
      }
    }
    if (retain) {
      log.info("Retaining staging directory {}", Logs.redactPath(workDirectory.toString()));
      return;
    }
    try {
      deleteTree(workDirectory);
      log.debug("Deleted staging directory {}", Logs.redactPath(workDirectory.toString()));
    } catch (IOException ex) {
      log.warn("Failed to delete staging directory {}", Logs.redactPath(workDirectory.toString()), ex);
    }
  }

  static void deleteTree(Path root) throws IOException {
    if (root == null || !Files.exists(root)) {
      return;
    }
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        Files.deleteIfExists(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.deleteIfExists(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
