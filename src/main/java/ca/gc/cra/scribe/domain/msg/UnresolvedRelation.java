package ca.gc.cra.scribe.domain.msg;

import java.util.Objects;

/**
 * Reply or reaction whose target was not found in the same run.
 *
 * @param originRowId row that carried the reference
 * @param referencedKey normalized key that could not be resolved
 * @param relation relationship kind
 * @since 0.1.0
 */
public record UnresolvedRelation(long originRowId, String referencedKey, RelationKind relation) {
  public UnresolvedRelation {
    Objects.requireNonNull(relation, "relation");
  }
}
