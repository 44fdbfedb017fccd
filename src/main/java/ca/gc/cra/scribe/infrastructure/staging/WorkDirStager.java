package ca.gc.cra.scribe.infrastructure.staging;

import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import java.nio.file.Path;

/**
 * Stages one kind of source into a working directory prepared by {@link TimeBoundSourceStager}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface WorkDirStager {
  /**
   * Copies the source into {@code workDirectory}.
   *
   * @param descriptor source to stage
   * @param workDirectory empty private directory owned by the run
   * @return staged source owning {@code workDirectory}
   * @throws ca.gc.cra.scribe.domain.problem.PipelineFailure when acquisition fails
   */
  StagedSource stage(SourceDescriptor descriptor, Path workDirectory);
}
