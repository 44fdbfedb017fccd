package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.RawRow;
import java.util.Objects;

/**
 * Raw row paired with the draft decoded from it.
 *
 * @param row source row
 * @param draft draft message
 * @since 0.1.0
 */
public record DecodedRow(RawRow row, DraftMessage draft) {
  public DecodedRow {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(draft, "draft");
  }
}
