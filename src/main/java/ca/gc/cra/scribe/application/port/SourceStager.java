package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.source.SourceDescriptor;

/**
 * Obtains a mutation-free, filesystem-local copy of the source database.
 *
 * <p>Acquisition failures surface as {@link ca.gc.cra.scribe.domain.problem.PipelineFailure} with a stable code.</p>
 *
 * @since 0.1.0
 */
public interface SourceStager {
  /**
   * Stages the source described by {@code descriptor}.
   *
   * @param descriptor live or backup source
   * @return staged copy owned by the caller
   * @throws ca.gc.cra.scribe.domain.problem.PipelineFailure when the source cannot be acquired
   */
  StagedSource stage(SourceDescriptor descriptor);
}
