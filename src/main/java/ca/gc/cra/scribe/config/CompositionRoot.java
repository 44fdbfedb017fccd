package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.pipeline.ExtractUseCase;
import ca.gc.cra.scribe.application.pipeline.InspectUseCase;
import ca.gc.cra.scribe.application.port.AttachmentMaterializer;
import ca.gc.cra.scribe.application.port.ChatDatabase;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.application.port.RichTextDecoder;
import ca.gc.cra.scribe.application.port.SourceStager;
import ca.gc.cra.scribe.application.port.TranscriptionEngine;
import ca.gc.cra.scribe.domain.source.SourceKind;
import ca.gc.cra.scribe.infrastructure.attachments.ContentAddressedAttachmentStore;
import ca.gc.cra.scribe.infrastructure.backup.BackupSourceStager;
import ca.gc.cra.scribe.infrastructure.decode.EditHistoryDecoder;
import ca.gc.cra.scribe.infrastructure.decode.KeyedArchiveDecoder;
import ca.gc.cra.scribe.infrastructure.decode.TypedStreamDecoder;
import ca.gc.cra.scribe.infrastructure.output.NdjsonMessageOutputAdapter;
import ca.gc.cra.scribe.infrastructure.sqlite.SqliteChatDatabase;
import ca.gc.cra.scribe.infrastructure.staging.LiveSourceStager;
import ca.gc.cra.scribe.infrastructure.staging.TimeBoundSourceStager;
import ca.gc.cra.scribe.infrastructure.staging.WorkDirStager;
import ca.gc.cra.scribe.infrastructure.transcribe.FixedTranscriptionEngine;
import ca.gc.cra.scribe.infrastructure.transcribe.WhisperCppTranscriptionEngine;
import ca.gc.cra.scribe.infrastructure.validation.JsonSchemaMessageValidator;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Central composition root that wires SCRIBE use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the use cases only ever see ports.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning staging, SQLite reading, decoding, attachment
 * handling, transcription, validation and output.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the live or backup stager behind a timeout-bounded {@link SourceStager}.</li>
 *   <li>Order the rich-text decoders and choose the transcription engine.</li>
 *   <li>Point the attachment store and output adapter at the configured output directory.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create fresh adapter graphs and
 * are not synchronized.</p>
 *
 * @since 0.1.0
 * @see ExtractUseCase
 * @see InspectUseCase
 */
public final class CompositionRoot {
  /** Sub-directory of the output directory holding content-addressed attachment copies. */
  public static final String ATTACHMENTS_DIRECTORY = "attachments";

  private final ExtractConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root.
   *
   * @param config validated run configuration
   * @param metrics metrics adapter shared by the use cases
   */
  public CompositionRoot(ExtractConfig config, MetricsPort metrics) {
    this(config, metrics, ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root with an explicit clock.
   *
   * @param config validated run configuration
   * @param metrics metrics adapter shared by the use cases
   * @param clock clock used for run report stamps
   */
  public CompositionRoot(ExtractConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the extract pipeline.
   *
   * @return use case writing to {@link ExtractConfig#outputDirectory()}
   */
  public ExtractUseCase extractUseCase() {
    Path out = config.outputDirectory();
    AttachmentMaterializer store = new ContentAddressedAttachmentStore(out.resolve(ATTACHMENTS_DIRECTORY));
    return new ExtractUseCase(
        sourceStager(),
        databases(),
        richTextDecoders(),
        new EditHistoryDecoder(),
        store,
        transcriptionEngine(store),
        JsonSchemaMessageValidator.fromClasspath(),
        NdjsonMessageOutputAdapter.factory(out),
        metrics,
        clock,
        new ExtractUseCase.Options(
            config.copyAttachments(), config.hashAttachments(), config.attachmentWorkers(), config.contact()));
  }

  /**
   * Builds the read-only inspection pipeline.
   *
   * @return inspect use case
   */
  public InspectUseCase inspectUseCase() {
    return new InspectUseCase(sourceStager(), databases());
  }

  /**
   * Builds the stager for both source kinds.
   *
   * @return timeout-bounded stager
   */
  public SourceStager sourceStager() {
    Map<SourceKind, WorkDirStager> stagers = new EnumMap<>(SourceKind.class);
    stagers.put(SourceKind.LIVE, new LiveSourceStager(config.attachmentsHome(), config.retainStaging()));
    stagers.put(SourceKind.BACKUP, new BackupSourceStager(config.attachmentsHome(), config.retainStaging()));
    return new TimeBoundSourceStager(config.workDirectory(), config.stagingTimeout(), stagers);
  }

  /**
   * Returns the rich-text decoders in the order they are tried.
   *
   * @return decoder chain
   */
  public static List<RichTextDecoder> richTextDecoders() {
    return List.of(new TypedStreamDecoder(), new KeyedArchiveDecoder());
  }

  private static ChatDatabase.Factory databases() {
    return SqliteChatDatabase::open;
  }

  Optional<TranscriptionEngine> transcriptionEngine(AttachmentMaterializer hasher) {
    TranscriptionConfig transcription = config.transcription();
    return switch (transcription.mode()) {
      case OFF -> Optional.empty();
      case FIXED -> Optional.of(new FixedTranscriptionEngine(transcription.fixedText(), hasher));
      case WHISPER_CPP -> Optional.of(new WhisperCppTranscriptionEngine(
          transcription.binary().orElseThrow(),
          transcription.model().orElseThrow(),
          transcription.language(),
          transcription.ffmpeg().orElse(null),
          transcription.timeout()));
    };
  }
}
