package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.AttachmentLocator;
import ca.gc.cra.scribe.application.port.AttachmentLocator.ResolvedAttachment;
import ca.gc.cra.scribe.application.port.AttachmentMaterializer;
import ca.gc.cra.scribe.application.port.AttachmentMaterializer.Materialized;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.domain.msg.DraftAttachment;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import ca.gc.cra.scribe.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Attaches attachment references to drafts and resolves their byte sources.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one reference per attachment record, in attachment row order.</li>
 *   <li>Resolve bytes through the source's locator chain; hash or materialize them when configured.</li>
 *   <li>Record unreachable attachments in the missing list and flag the owning message.</li>
 * </ul>
 * <p><strong>Concurrency:</strong> per-attachment work may run on a bounded executor. Each task mutates only its own
 * {@link DraftAttachment}; results are joined in submission order so the missing list and message flags are
 * deterministic.</p>
 *
 * @since 0.1.0
 */
public final class AttachmentResolver {
  private static final Logger log = LoggerFactory.getLogger(AttachmentResolver.class);

  static final String REASON_NOT_FOUND = "not_found";
  static final String REASON_UNREADABLE = "unreadable";

  private final AttachmentMaterializer materializer;
  private final boolean materialize;
  private final boolean hashContent;
  private final ExecutorService executor;
  private final RunReport report;

  /**
   * Creates a resolver.
   *
   * @param materializer hashing and copying adapter
   * @param materialize copy bytes into the content-addressed store
   * @param hashContent compute hashes when not materializing
   * @param executor bounded worker pool, or {@code null} to resolve inline
   * @param report run report
   */
  public AttachmentResolver(
      AttachmentMaterializer materializer,
      boolean materialize,
      boolean hashContent,
      ExecutorService executor,
      RunReport report) {
    this.materializer = Objects.requireNonNull(materializer, "materializer");
    this.materialize = materialize;
    this.hashContent = hashContent;
    this.executor = executor;
    this.report = Objects.requireNonNull(report, "report");
  }

  /**
   * Resolves every attachment of every message.
   *
   * @param messages standalone drafts in output order
   * @param attachmentsByMessage attachment records keyed by owning message row
   * @param locator locator chain for the staged source
   * @return missing attachments in message then attachment order
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public List<MissingAttachment> resolve(
      List<DraftMessage> messages,
      Map<Long, List<AttachmentRow>> attachmentsByMessage,
      AttachmentLocator locator) throws InterruptedException {
    Objects.requireNonNull(locator, "locator");
    List<Pending> pending = new ArrayList<>();
    for (DraftMessage draft : messages) {
      List<AttachmentRow> rows = attachmentsByMessage.getOrDefault(draft.sourceRef().rowId(), List.of());
      for (AttachmentRow row : rows) {
        DraftAttachment attachment = new DraftAttachment(row);
        draft.addAttachment(attachment);
        report.increment(RunCounter.ATTACHMENTS_TOTAL);
        pending.add(new Pending(draft, attachment));
      }
    }

    List<String> outcomes = run(pending, locator);
    List<MissingAttachment> missing = new ArrayList<>();
    for (int i = 0; i < pending.size(); i++) {
      String failure = outcomes.get(i);
      if (failure == null) {
        continue;
      }
      Pending item = pending.get(i);
      item.draft().putMeta("attachment_unresolved", Boolean.TRUE);
      missing.add(new MissingAttachment(
          item.draft().conversationId(),
          item.draft().id(),
          item.attachment().row().rowId(),
          item.attachment().row().filename(),
          failure));
      report.increment(RunCounter.ATTACHMENTS_MISSING);
    }
    if (!missing.isEmpty()) {
      log.info("{} of {} attachments could not be resolved", missing.size(), pending.size());
    }
    return missing;
  }

  private List<String> run(List<Pending> pending, AttachmentLocator locator) throws InterruptedException {
    List<String> outcomes = new ArrayList<>(pending.size());
    if (executor == null) {
      for (Pending item : pending) {
        outcomes.add(resolveOne(item.attachment(), locator));
      }
      return outcomes;
    }
    List<Callable<String>> tasks = new ArrayList<>(pending.size());
    for (Pending item : pending) {
      tasks.add(() -> resolveOne(item.attachment(), locator));
    }
    List<Future<String>> futures = executor.invokeAll(tasks);
    for (Future<String> future : futures) {
      try {
        outcomes.add(future.get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
          throw runtime;
        }
        throw new IllegalStateException("Attachment worker failed", cause);
      }
    }
    return outcomes;
  }

  /**
   * Resolves one attachment.
   *
   * @return {@code null} on success, otherwise the missing reason
   */
  private String resolveOne(DraftAttachment attachment, AttachmentLocator locator) {
    AttachmentRow row = attachment.row();
    try {
      Optional<ResolvedAttachment> located = locator.locate(row);
      if (located.isEmpty()) {
        log.debug("Attachment {} not found", row.rowId());
        return REASON_NOT_FOUND;
      }
      ResolvedAttachment source = located.get();
      if (materialize) {
        Materialized copy = materializer.materialize(source.readablePath(), row.displayName());
        attachment.resolve(copy.path().toString(), copy.path(), copy.contentHash());
        report.increment(RunCounter.ATTACHMENTS_MATERIALIZED);
      } else {
        String hash = hashContent ? materializer.hash(source.readablePath()) : null;
        attachment.resolve(source.sourcePath().toString(), source.readablePath(), hash);
      }
      report.increment(RunCounter.ATTACHMENTS_RESOLVED);
      return null;
    } catch (IOException | RuntimeException ex) {
      log.warn("Attachment {} is unreadable ({}): {}",
          row.rowId(), Logs.redactPath(row.filename()), Logs.redactPath(ex.getMessage()));
      return REASON_UNREADABLE;
    }
  }

  private record Pending(DraftMessage draft, DraftAttachment attachment) {}
}
