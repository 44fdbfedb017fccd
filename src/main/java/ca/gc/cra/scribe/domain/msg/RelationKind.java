package ca.gc.cra.scribe.domain.msg;

/** Relationship whose target could not be located. */
public enum RelationKind {
  REPLY,
  REACTION,
  REACTION_REMOVAL
}
