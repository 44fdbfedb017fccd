package ca.gc.cra.scribe.domain.assoc;

import ca.gc.cra.scribe.domain.msg.ReactionKind;
import java.util.Objects;

/**
 * Classified association of one message row.
 *
 * @param associationClass variant tag
 * @param reactionKind reaction kind for {@link AssociationClass#REACTION} and
 *     {@link AssociationClass#REACTION_REMOVAL}; otherwise {@code null}
 * @param code raw association type code
 * @param targetKey normalized target GUID, or {@code null} for {@link AssociationClass#NONE}
 * @since 0.1.0
 */
public record Association(
    AssociationClass associationClass, ReactionKind reactionKind, int code, String targetKey) {

  public Association {
    Objects.requireNonNull(associationClass, "associationClass");
    boolean reactionLike = associationClass == AssociationClass.REACTION
        || associationClass == AssociationClass.REACTION_REMOVAL;
    if (reactionLike && reactionKind == null) {
      throw new IllegalArgumentException("reaction associations require a kind");
    }
  }

  /**
   * Reports whether the row is folded into its target instead of being emitted.
   *
   * @return {@code true} for reactions and reaction removals
   */
  public boolean foldsIntoTarget() {
    return associationClass == AssociationClass.REACTION
        || associationClass == AssociationClass.REACTION_REMOVAL;
  }
}
