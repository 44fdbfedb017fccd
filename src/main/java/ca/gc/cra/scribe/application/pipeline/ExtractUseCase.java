package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.AttachmentMaterializer;
import ca.gc.cra.scribe.application.port.ChatDatabase;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.MessageOutputPort;
import ca.gc.cra.scribe.application.port.MessageValidator;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.application.port.RichTextDecoder;
import ca.gc.cra.scribe.application.port.SourceStager;
import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.application.port.TranscriptionEngine;
import ca.gc.cra.scribe.application.pipeline.RelationshipResolver.ResolutionResult;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import ca.gc.cra.scribe.domain.schema.SchemaDetection;
import ca.gc.cra.scribe.domain.schema.SchemaGenerations;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.scribe.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one canonicalization pass from source descriptor to output artifacts.
 * <p><strong>Why:</strong> Owns the downstream-only stage order (stage, detect, decode, resolve relationships,
 * resolve attachments, transcribe, validate, report) and the fatal/non-fatal error policy.</p>
 * <p><strong>Role:</strong> Application-layer use case invoked by {@code ExtractCli}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stage the source and guarantee cleanup of the private copy on every exit path.</li>
 *   <li>Accumulate non-fatal degradations in the {@link RunReport} and sinks.</li>
 *   <li>Abort with {@link PipelineFailure} for acquisition failures, cancellation and all-invalid runs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run(SourceDescriptor)} calls; attachment
 * and transcription workers are created per run and shut down before it returns.</p>
 * <p><strong>Observability:</strong> MDC keys {@code runId} and {@code pipeline}; counters mirrored into
 * {@link MetricsPort} as {@code scribe.*}.</p>
 *
 * @since 0.1.0
 */
public final class ExtractUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExtractUseCase.class);
  private static final Set<String> OPTIONAL_TABLES =
      Set.of("chat", "chat_message_join", "handle", "attachment", "message_attachment_join");

  private final SourceStager stager;
  private final ChatDatabase.Factory databases;
  private final List<RichTextDecoder> richTextDecoders;
  private final RichTextDecoder editHistoryDecoder;
  private final AttachmentMaterializer materializer;
  private final Optional<TranscriptionEngine> transcriptionEngine;
  private final MessageValidator validator;
  private final MessageOutputPort.Factory outputs;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Options options;
  private final Supplier<String> runIds;

  /**
   * Creates the use case.
   *
   * @param stager source stager
   * @param databases opens staged databases
   * @param richTextDecoders rich-text decoders in chain order
   * @param editHistoryDecoder edit-history decoder
   * @param materializer attachment hashing and copying
   * @param transcriptionEngine engine, or empty when transcription is off
   * @param validator canonical schema validator
   * @param outputs opens the output port for a run
   * @param metrics metrics sink
   * @param clock clock for run report stamps
   * @param options run options
   */
  public ExtractUseCase(
      SourceStager stager,
      ChatDatabase.Factory databases,
      List<RichTextDecoder> richTextDecoders,
      RichTextDecoder editHistoryDecoder,
      AttachmentMaterializer materializer,
      Optional<TranscriptionEngine> transcriptionEngine,
      MessageValidator validator,
      MessageOutputPort.Factory outputs,
      MetricsPort metrics,
      ClockPort clock,
      Options options) {
    this(stager, databases, richTextDecoders, editHistoryDecoder, materializer, transcriptionEngine,
        validator, outputs, metrics, clock, options, () -> UUID.randomUUID().toString());
  }

  ExtractUseCase(
      SourceStager stager,
      ChatDatabase.Factory databases,
      List<RichTextDecoder> richTextDecoders,
      RichTextDecoder editHistoryDecoder,
      AttachmentMaterializer materializer,
      Optional<TranscriptionEngine> transcriptionEngine,
      MessageValidator validator,
      MessageOutputPort.Factory outputs,
      MetricsPort metrics,
      ClockPort clock,
      Options options,
      Supplier<String> runIds) {
    this.stager = Objects.requireNonNull(stager, "stager");
    this.databases = Objects.requireNonNull(databases, "databases");
    this.richTextDecoders = List.copyOf(Objects.requireNonNull(richTextDecoders, "richTextDecoders"));
    this.editHistoryDecoder = Objects.requireNonNull(editHistoryDecoder, "editHistoryDecoder");
    this.materializer = Objects.requireNonNull(materializer, "materializer");
    this.transcriptionEngine = Objects.requireNonNull(transcriptionEngine, "transcriptionEngine");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.outputs = Objects.requireNonNull(outputs, "outputs");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.options = Objects.requireNonNull(options, "options");
    this.runIds = Objects.requireNonNull(runIds, "runIds");
  }

  /**
   * Executes one run.
   *
   * @param descriptor source to canonicalize
   * @return finished run report
   * @throws PipelineFailure for fatal conditions, including {@link ProblemCode#NO_VALID_ROWS}
   */
  public RunReport run(SourceDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    RunReport report = new RunReport(
        runIds.get(),
        descriptor.kind().wireName(),
        clock::now,
        (counter, delta) -> metrics.add(counter.metricKey(), delta));
    String previousRunId = MDC.get("runId");
    String previousPipeline = MDC.get("pipeline");
    MDC.put("runId", report.runId());
    MDC.put("pipeline", "extract");
    long started = clock.nowMillis();
    try {
      log.info("Starting extract run for {} source {}",
          descriptor.kind().wireName(), Logs.redactPath(descriptor.location().toString()));
      execute(descriptor, report);
      metrics.observe("scribe.run.durationMs", clock.nowMillis() - started);
      log.info("Extract run finished: emitted={}, quarantined={}, missingAttachments={}, unresolved={}",
          report.get(RunCounter.MESSAGES_EMITTED),
          report.get(RunCounter.QUARANTINED),
          report.get(RunCounter.ATTACHMENTS_MISSING),
          report.get(RunCounter.REPLIES_UNRESOLVED) + report.get(RunCounter.REACTIONS_UNRESOLVED));
      return report;
    } finally {
      restore("runId", previousRunId);
      restore("pipeline", previousPipeline);
    }
  }

  private void execute(SourceDescriptor descriptor, RunReport report) {
    try (StagedSource staged = stager.stage(descriptor);
        ChatDatabase database = databases.open(staged.databasePath())) {
      report.add(RunCounter.WAL_FRAMES_STAGED, staged.walFrames());
      SchemaDetection detection = detectSchema(database, report);

      List<DecodedRow> rows = decodeRows(database, detection, descriptor, report);
      Map<Long, List<AttachmentRow>> attachments = database.attachmentsByMessage();

      ResolutionResult resolution = new RelationshipResolver(report).resolve(rows);
      rows.clear();

      List<MissingAttachment> missing;
      ExecutorService workers = newWorkerPool();
      try {
        missing = new AttachmentResolver(materializer, options.materializeAttachments(),
            options.hashAttachments(), workers, report)
            .resolve(resolution.messages(), attachments, staged.attachmentLocator());
        if (transcriptionEngine.isPresent()) {
          new TranscriptionStage(transcriptionEngine.get(), workers, report).apply(resolution.messages());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new PipelineFailure(ProblemCode.RUN_INTERRUPTED, "Run interrupted during attachment work", null, ex);
      } finally {
        shutdown(workers);
      }

      emit(resolution, missing, report);
    }
  }

  private SchemaDetection detectSchema(ChatDatabase database, RunReport report) {
    Set<String> tables = new TreeSet<>();
    for (String table : database.tables()) {
      tables.add(table.toLowerCase(Locale.ROOT));
    }
    if (!tables.contains("message")) {
      throw new PipelineFailure(ProblemCode.DATABASE_UNREADABLE, "Staged database has no message table", null);
    }
    for (String table : new TreeSet<>(OPTIONAL_TABLES)) {
      if (!tables.contains(table)) {
        report.increment(RunCounter.SCHEMA_WARNINGS);
        log.warn("Optional table {} is missing; related fields will be empty", table);
      }
    }
    SchemaDetection detection = SchemaGenerations.detect(database.messageColumns());
    if (detection.degraded()) {
      report.increment(RunCounter.SCHEMA_WARNINGS);
      log.warn("Unknown message table layout; falling back to {}", detection.generation().tag());
    } else {
      log.info("Detected schema generation {}", detection.generation().tag());
    }
    report.schema(detection.generation().tag(), detection.degraded());
    return detection;
  }

  private List<DecodedRow> decodeRows(
      ChatDatabase database, SchemaDetection detection, SourceDescriptor descriptor, RunReport report) {
    RowDecoder decoder = new RowDecoder(
        richTextDecoders, editHistoryDecoder, descriptor.location().toString(), report);
    List<DecodedRow> rows = new ArrayList<>();
    if (options.contact().isPresent()) {
      log.info("Reading only the conversations of the requested contact");
    }
    database.forEachMessage(detection.generation(), options.contact(), row -> {
      checkInterrupted();
      report.increment(RunCounter.ROWS_READ);
      rows.add(new DecodedRow(row, decoder.decode(row, detection.generation())));
    });
    log.info("Decoded {} rows", rows.size());
    return rows;
  }

  private void emit(ResolutionResult resolution, List<MissingAttachment> missing, RunReport report) {
    ValidationGate gate = new ValidationGate(validator, report);
    try (MessageOutputPort output = outputs.open()) {
      for (DraftMessage draft : resolution.messages()) {
        checkInterrupted();
        gate.admit(draft.freeze(), output);
      }
      output.writeUnresolved(resolution.unresolved());
      output.writeMissingAttachments(missing);
      boolean anyValid = report.get(RunCounter.MESSAGES_EMITTED) > 0;
      report.finish(anyValid ? "success" : "no_valid_rows");
      output.writeRunReport(report.snapshot());
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.OUTPUT_FAILURE, "Failed to write run outputs", null, ex);
    }
    if (report.get(RunCounter.MESSAGES_EMITTED) == 0) {
      throw new PipelineFailure(ProblemCode.NO_VALID_ROWS,
          "None of " + resolution.messages().size() + " candidate messages passed validation", null);
    }
  }

  private ExecutorService newWorkerPool() {
    if (options.workers() <= 1) {
      return null;
    }
    return ExecutorFactories.newWorkerPool(options.workers(), "scribe-attach", (thread, ex) ->
        log.error("Uncaught failure in {}", thread.getName(), ex));
  }

  private static void shutdown(ExecutorService workers) {
    if (workers == null) {
      return;
    }
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Attachment workers did not terminate within 5s");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void checkInterrupted() {
    if (Thread.currentThread().isInterrupted()) {
      throw new PipelineFailure(ProblemCode.RUN_INTERRUPTED, "Run cancelled between rows", null);
    }
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }

  /**
   * Per-run options.
   *
   * @param materializeAttachments copy attachment bytes into the content-addressed store
   * @param hashAttachments hash attachment bytes when not materializing
   * @param workers bounded parallelism for attachment and transcription work; {@code 1} runs inline
   * @param contact handle address whose conversations are read; empty reads every conversation
   */
  public record Options(
      boolean materializeAttachments, boolean hashAttachments, int workers, Optional<String> contact) {
    public Options {
      if (workers < 1) {
        throw new IllegalArgumentException("workers must be >= 1");
      }
      contact = Objects.requireNonNullElse(contact, Optional.<String>empty());
    }

    public Options(boolean materializeAttachments, boolean hashAttachments, int workers) {
      this(materializeAttachments, hashAttachments, workers, Optional.empty());
    }
  }
}
