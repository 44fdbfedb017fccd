package ca.gc.cra.scribe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.port.TranscriptionEngine;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.domain.msg.DraftAttachment;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.SourceRef;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import ca.gc.cra.scribe.infrastructure.attachments.ContentAddressedAttachmentStore;
import ca.gc.cra.scribe.infrastructure.transcribe.FixedTranscriptionEngine;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptionStageTest {
  @TempDir Path tempDir;

  private RunReport report;

  @BeforeEach
  void setUp() {
    report = new RunReport("run-test", "live", () -> Instant.EPOCH, RunReport.CounterListener.NONE);
  }

  @Test
  void transcribesResolvedAudioIntoSourceMeta() throws Exception {
    DraftMessage message = messageWith(audio("voice.caf", "audio/x-caf", "caf bytes"));
    FixedTranscriptionEngine engine =
        new FixedTranscriptionEngine("[transcript {sha256}]", new ContentAddressedAttachmentStore(tempDir));

    new TranscriptionStage(engine, null, report).apply(List.of(message));

    CanonicalMessage frozen = message.freeze();
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> transcripts = (List<Map<String, Object>>) frozen.sourceMeta().get("transcript");
    assertEquals(1, transcripts.size());
    assertEquals("voice.caf", transcripts.get(0).get("attachment"));
    assertEquals("fixed", transcripts.get(0).get("engine"));
    String text = (String) transcripts.get(0).get("text");
    assertTrue(text.matches("\\[transcript [0-9a-f]{12}]"), text);
    assertEquals(1L, report.get(RunCounter.TRANSCRIPTS_PRODUCED));
  }

  @Test
  void skipsImagesAndUnresolvedAudio() throws Exception {
    DraftMessage message = messageWith(audio("photo.jpg", "image/jpeg", "jpg"));
    message.addAttachment(new DraftAttachment(
        new AttachmentRow(99, 1, "g", "lost.m4a", "audio/mp4", null, null, null)));
    TranscriptionEngine engine = new FixedTranscriptionEngine("never", new ContentAddressedAttachmentStore(tempDir));

    new TranscriptionStage(engine, null, report).apply(List.of(message));

    assertNull(message.freeze().sourceMeta().get("transcript"));
    assertEquals(0L, report.get(RunCounter.TRANSCRIPTS_PRODUCED));
  }

  @Test
  void engineFailureCountsButKeepsMessage() throws Exception {
    DraftMessage message = messageWith(audio("a.m4a", "audio/mp4", "a"));
    message.addAttachment(audio("b.m4a", "audio/mp4", "b"));
    TranscriptionEngine flaky = new TranscriptionEngine() {
      @Override
      public String name() {
        return "flaky";
      }

      @Override
      public String model() {
        return "tiny";
      }

      @Override
      public Optional<String> transcribe(Path audio) throws IOException {
        if (audio.getFileName().toString().startsWith("a")) {
          throw new IOException("decoder crashed");
        }
        return Optional.of("hello");
      }
    };
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      new TranscriptionStage(flaky, executor, report).apply(List.of(message));
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1L, report.get(RunCounter.TRANSCRIPTS_FAILED));
    assertEquals(1L, report.get(RunCounter.TRANSCRIPTS_PRODUCED));
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> transcripts =
        (List<Map<String, Object>>) message.freeze().sourceMeta().get("transcript");
    assertEquals("tiny", transcripts.get(0).get("model"));
  }

  @Test
  void uncheckedEngineFailureCountsTheSameInlineAndOnWorkers() throws Exception {
    TranscriptionEngine broken = new TranscriptionEngine() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public String model() {
        return "none";
      }

      @Override
      public Optional<String> transcribe(Path audio) {
        throw new IllegalStateException("model missing");
      }
    };

    new TranscriptionStage(broken, null, report).apply(List.of(messageWith(audio("c.m4a", "audio/mp4", "c"))));
    assertEquals(1L, report.get(RunCounter.TRANSCRIPTS_FAILED));

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      new TranscriptionStage(broken, executor, report).apply(List.of(messageWith(audio("d.m4a", "audio/mp4", "d"))));
    } finally {
      executor.shutdownNow();
    }
    assertEquals(2L, report.get(RunCounter.TRANSCRIPTS_FAILED));
    assertEquals(0L, report.get(RunCounter.TRANSCRIPTS_PRODUCED));
  }

  private DraftAttachment audio(String name, String mime, String content) throws IOException {
    Path file = Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    DraftAttachment attachment =
        new DraftAttachment(new AttachmentRow(name.hashCode(), 1, "g-" + name, name, mime, null, null, null));
    attachment.resolve(file.toString(), file, null);
    return attachment;
  }

  private static DraftMessage messageWith(DraftAttachment attachment) {
    DraftMessage message = new DraftMessage("A", "chat", Instant.EPOCH, "self", true, "",
        new SourceRef("chat.db", "A", 1), Map.of());
    message.addAttachment(attachment);
    return message;
  }
}
