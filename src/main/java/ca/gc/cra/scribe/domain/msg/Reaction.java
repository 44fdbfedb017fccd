package ca.gc.cra.scribe.domain.msg;

import java.time.Instant;
import java.util.Objects;

/**
 * Tapback folded onto its target message.
 *
 * @param actor resolved sender of the reaction row
 * @param kind reaction kind
 * @param timestamp normalized time of the reaction row; may be {@code null} if the row had no date
 * @param emoji emoji for {@link ReactionKind#CUSTOM}; otherwise {@code null}
 * @since 0.1.0
 */
public record Reaction(String actor, ReactionKind kind, Instant timestamp, String emoji) {
  public Reaction {
    Objects.requireNonNull(actor, "actor");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Reports whether another reaction came from the same actor with the same kind.
   *
   * @param other reaction to compare
   * @return {@code true} when actor and kind match
   */
  public boolean sameActorAndKind(Reaction other) {
    return actor.equals(other.actor) && kind == other.kind;
  }
}
