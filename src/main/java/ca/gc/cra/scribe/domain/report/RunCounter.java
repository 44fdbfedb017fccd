package ca.gc.cra.scribe.domain.report;

/**
 * Counters carried by {@link RunReport}. Wire names are stable.
 *
 * @since 0.1.0
 */
public enum RunCounter {
  ROWS_READ("rows_read"),
  MESSAGES_DECODED("messages_decoded"),
  MESSAGES_EMITTED("messages_emitted"),
  QUARANTINED("quarantined"),
  REACTIONS_FOLDED("reactions_folded"),
  REACTIONS_DUPLICATE("reactions_duplicate"),
  REACTION_REMOVALS_APPLIED("reaction_removals_applied"),
  REACTIONS_UNRESOLVED("reactions_unresolved"),
  REPLIES_RESOLVED("replies_resolved"),
  REPLIES_UNRESOLVED("replies_unresolved"),
  ATTACHMENTS_TOTAL("attachments_total"),
  ATTACHMENTS_RESOLVED("attachments_resolved"),
  ATTACHMENTS_MISSING("attachments_missing"),
  ATTACHMENTS_MATERIALIZED("attachments_materialized"),
  TRANSCRIPTS_PRODUCED("transcripts_produced"),
  TRANSCRIPTS_FAILED("transcripts_failed"),
  TEXT_DECODE_FAILURES("text_decode_failures"),
  TIMESTAMPS_MISSING("timestamps_missing"),
  SCHEMA_WARNINGS("schema_warnings"),
  WAL_FRAMES_STAGED("wal_frames_staged");

  private final String wireName;

  RunCounter(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Returns the metric key mirrored to the metrics port.
   *
   * @return key such as {@code scribe.rows_read}
   */
  public String metricKey() {
    return "scribe." + wireName;
  }
}
