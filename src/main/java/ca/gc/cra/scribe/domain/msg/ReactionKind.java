package ca.gc.cra.scribe.domain.msg;

/**
 * Closed set of tapback kinds.
 *
 * @since 0.1.0
 */
public enum ReactionKind {
  LOVED("loved"),
  LIKED("liked"),
  DISLIKED("disliked"),
  AMUSED("amused"),
  EMPHASIZED("emphasized"),
  QUESTIONED("questioned"),
  CUSTOM("custom");

  private final String wireName;

  ReactionKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
