package ca.gc.cra.scribe.domain.report;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Process-scoped aggregate counters for one pipeline run.
 * <p><strong>Lifecycle:</strong> created at pipeline start, only appended to, emitted once through {@link #snapshot()}
 * after {@link #finish(String)}.</p>
 * <p><strong>Thread-safety:</strong> Counters are {@link AtomicLong}s; attachment and transcription workers may
 * increment concurrently. Metadata setters are intended for the orchestrating thread.</p>
 * <p><strong>Observability:</strong> every increment is forwarded to the {@link CounterListener}.</p>
 *
 * @since 0.1.0
 */
public final class RunReport {
  private final String runId;
  private final String sourceKind;
  private final Supplier<Instant> clock;
  private final CounterListener listener;
  private final Instant startedAt;
  private final Map<RunCounter, AtomicLong> counters = new EnumMap<>(RunCounter.class);
  private volatile String schemaGeneration = "unknown";
  private volatile boolean schemaDegraded;
  private volatile Instant finishedAt;
  private volatile String outcome = "running";

  /**
   * Creates a report and stamps its start time.
   *
   * @param runId unique run identifier
   * @param sourceKind {@code live} or {@code backup}
   * @param clock time source
   * @param listener receives every counter change; use {@link CounterListener#NONE} to ignore
   */
  public RunReport(String runId, String sourceKind, Supplier<Instant> clock, CounterListener listener) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
    for (RunCounter counter : RunCounter.values()) {
      counters.put(counter, new AtomicLong());
    }
    this.startedAt = clock.get();
  }

  public String runId() {
    return runId;
  }

  public void increment(RunCounter counter) {
    add(counter, 1L);
  }

  /**
   * Adds a non-negative delta to a counter.
   *
   * @param counter counter to bump
   * @param delta amount; zero is ignored
   */
  public void add(RunCounter counter, long delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("counters only grow");
    }
    if (delta == 0) {
      return;
    }
    counters.get(counter).addAndGet(delta);
    listener.onAdd(counter, delta);
  }

  public long get(RunCounter counter) {
    return counters.get(counter).get();
  }

  public void schema(String generationTag, boolean degraded) {
    this.schemaGeneration = Objects.requireNonNull(generationTag, "generationTag");
    this.schemaDegraded = degraded;
  }

  public String outcome() {
    return outcome;
  }

  /**
   * Stamps the finish time and the outcome label.
   *
   * @param outcomeLabel e.g. {@code success} or {@code no_valid_rows}
   */
  public void finish(String outcomeLabel) {
    this.outcome = Objects.requireNonNull(outcomeLabel, "outcomeLabel");
    this.finishedAt = clock.get();
  }

  /**
   * Renders the report as an ordered map ready for JSON serialization.
   *
   * @return snapshot; counters are nested under {@code counters}
   */
  public Map<String, Object> snapshot() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("run_id", runId);
    out.put("source_kind", sourceKind);
    out.put("schema_generation", schemaGeneration);
    out.put("schema_degraded", schemaDegraded);
    out.put("outcome", outcome);
    out.put("started_at", startedAt.toString());
    Instant finished = finishedAt;
    out.put("finished_at", finished == null ? null : finished.toString());
    out.put("duration_ms", finished == null ? null : Duration.between(startedAt, finished).toMillis());
    Map<String, Object> values = new LinkedHashMap<>();
    for (RunCounter counter : RunCounter.values()) {
      values.put(counter.wireName(), counters.get(counter).get());
    }
    out.put("counters", values);
    return out;
  }

  /** Receives counter changes, typically to mirror them into metrics. */
  @FunctionalInterface
  public interface CounterListener {
    CounterListener NONE = (counter, delta) -> {};

    void onAdd(RunCounter counter, long delta);
  }
}
