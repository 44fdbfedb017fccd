package ca.gc.cra.scribe.domain.assoc;

/**
 * Closed set of association row classes.
 *
 * @since 0.1.0
 */
public enum AssociationClass {
  /** No association key: an ordinary message. */
  NONE,
  /** Tapback added to the target. */
  REACTION,
  /** Tapback withdrawn from the target. */
  REACTION_REMOVAL,
  /** Any other code with a key, including unknown codes: a reply that may stay unresolved. */
  REPLY_CANDIDATE
}
