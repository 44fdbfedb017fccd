package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.TranscriptionEngine;
import ca.gc.cra.scribe.domain.msg.AttachmentType;
import ca.gc.cra.scribe.domain.msg.DraftAttachment;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.Transcript;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the configured {@link TranscriptionEngine} over resolved audio attachments.
 *
 * <p>Transcripts land in {@code source_meta.transcript}; message text is never touched. Engine failures are
 * counted and logged, never fatal.</p>
 *
 * @since 0.1.0
 */
public final class TranscriptionStage {
  private static final Logger log = LoggerFactory.getLogger(TranscriptionStage.class);

  private final TranscriptionEngine engine;
  private final ExecutorService executor;
  private final RunReport report;

  /**
   * Creates the stage.
   *
   * @param engine local engine
   * @param executor bounded worker pool, or {@code null} to transcribe inline
   * @param report run report
   */
  public TranscriptionStage(TranscriptionEngine engine, ExecutorService executor, RunReport report) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.executor = executor;
    this.report = Objects.requireNonNull(report, "report");
  }

  /**
   * Transcribes every resolved audio attachment.
   *
   * @param messages drafts after attachment resolution
   * @throws InterruptedException when interrupted while waiting for the engine
   */
  public void apply(List<DraftMessage> messages) throws InterruptedException {
    List<DraftMessage> owners = new ArrayList<>();
    List<DraftAttachment> audio = new ArrayList<>();
    for (DraftMessage draft : messages) {
      for (DraftAttachment attachment : draft.attachments()) {
        if (attachment.type() == AttachmentType.AUDIO && attachment.readablePath() != null) {
          owners.add(draft);
          audio.add(attachment);
        }
      }
    }
    if (audio.isEmpty()) {
      return;
    }
    log.info("Transcribing {} audio attachments with engine {}", audio.size(), engine.name());

    List<Optional<String>> results = executor == null ? inline(audio) : parallel(audio);
    for (int i = 0; i < audio.size(); i++) {
      Optional<String> text = results.get(i);
      if (text == null) {
        report.increment(RunCounter.TRANSCRIPTS_FAILED);
        continue;
      }
      if (text.isPresent()) {
        owners.get(i).addTranscript(
            new Transcript(audio.get(i).row().displayName(), text.get(), engine.name(), engine.model()));
        report.increment(RunCounter.TRANSCRIPTS_PRODUCED);
      }
    }
  }

  private List<Optional<String>> inline(List<DraftAttachment> audio) throws InterruptedException {
    List<Optional<String>> results = new ArrayList<>(audio.size());
    for (DraftAttachment attachment : audio) {
      results.add(transcribeOne(attachment));
    }
    return results;
  }

  private List<Optional<String>> parallel(List<DraftAttachment> audio) throws InterruptedException {
    List<Callable<Optional<String>>> tasks = new ArrayList<>(audio.size());
    for (DraftAttachment attachment : audio) {
      tasks.add(() -> transcribeOne(attachment));
    }
    List<Optional<String>> results = new ArrayList<>(audio.size());
    for (Future<Optional<String>> future : executor.invokeAll(tasks)) {
      try {
        results.add(future.get());
      } catch (ExecutionException ex) {
        log.warn("Transcription worker failed", ex.getCause());
        results.add(null);
      }
    }
    return results;
  }

  /**
   * Transcribes one attachment.
   *
   * @return transcript, empty when the engine returned nothing, {@code null} when the engine failed
   */
  private Optional<String> transcribeOne(DraftAttachment attachment) throws InterruptedException {
    try {
      return engine.transcribe(attachment.readablePath());
    } catch (IOException | RuntimeException ex) {
      log.warn("Transcription failed for attachment {}: {}", attachment.row().rowId(), ex.toString());
      return null;
    }
  }
}
