package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Private, read-consistent copy of a source database owned by exactly one run.
 * <p><strong>Lifecycle:</strong> obtained from {@link SourceStager#stage(SourceDescriptor)} and closed in
 * {@code try-with-resources}; {@link #close()} deletes the working directory unless staging is retained.</p>
 * <p><strong>Thread-safety:</strong> Accessors are safe to share; {@link #close()} must run once, after all readers
 * are done.</p>
 *
 * @since 0.1.0
 */
public interface StagedSource extends AutoCloseable {
  /**
   * Returns the descriptor the copy was staged from.
   *
   * @return source descriptor
   */
  SourceDescriptor descriptor();

  /**
   * Returns the staged primary database; write-ahead and shared-memory files sit next to it.
   *
   * @return path to the private database copy
   */
  Path databasePath();

  /**
   * Returns the private working directory.
   *
   * @return working directory owned by this run
   */
  Path workDirectory();

  /**
   * Returns the number of write-ahead log frames copied alongside the database.
   *
   * @return frame count; {@code 0} when no log was present
   */
  long walFrames();

  /**
   * Returns the locator chain able to resolve attachments for this source.
   *
   * @return attachment locator
   */
  AttachmentLocator attachmentLocator();

  @Override
  void close();
}
