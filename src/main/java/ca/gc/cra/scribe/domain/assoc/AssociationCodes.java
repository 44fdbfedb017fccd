package ca.gc.cra.scribe.domain.assoc;

import ca.gc.cra.scribe.domain.msg.ReactionKind;
import java.util.Map;

/**
 * Classifies {@code associated_message_type} codes and normalizes association keys.
 *
 * <p>2000-2006 add a tapback, 3000-3006 remove one. Every other code that comes with a key is a reply
 * candidate; unknown codes are never dropped.</p>
 *
 * @since 0.1.0
 */
public final class AssociationCodes {
  public static final int REACTION_BASE = 2000;
  public static final int REMOVAL_BASE = 3000;

  private static final Map<Integer, ReactionKind> KINDS_BY_OFFSET = Map.of(
      0, ReactionKind.LOVED,
      1, ReactionKind.LIKED,
      2, ReactionKind.DISLIKED,
      3, ReactionKind.AMUSED,
      4, ReactionKind.EMPHASIZED,
      5, ReactionKind.QUESTIONED,
      6, ReactionKind.CUSTOM);

  private AssociationCodes() {
    // Utility
  }

  /**
   * Classifies an association code and key.
   *
   * @param code raw association type
   * @param rawKey raw association key; blank means no association
   * @return classified association
   */
  public static Association classify(int code, String rawKey) {
    String key = normalizeKey(rawKey);
    if (key == null) {
      return new Association(AssociationClass.NONE, null, code, null);
    }
    ReactionKind added = KINDS_BY_OFFSET.get(code - REACTION_BASE);
    if (added != null) {
      return new Association(AssociationClass.REACTION, added, code, key);
    }
    ReactionKind removed = KINDS_BY_OFFSET.get(code - REMOVAL_BASE);
    if (removed != null) {
      return new Association(AssociationClass.REACTION_REMOVAL, removed, code, key);
    }
    return new Association(AssociationClass.REPLY_CANDIDATE, null, code, key);
  }

  /**
   * Strips the {@code p:<part>/} and {@code bp:} prefixes from an association key.
   *
   * @param rawKey raw key
   * @return target GUID, or {@code null} when blank
   */
  public static String normalizeKey(String rawKey) {
    if (rawKey == null) {
      return null;
    }
    String key = rawKey.trim();
    if (key.startsWith("p:")) {
      int slash = key.indexOf('/');
      key = slash >= 0 ? key.substring(slash + 1) : key.substring(2);
    } else if (key.startsWith("bp:")) {
      key = key.substring(3);
    }
    return key.isEmpty() ? null : key;
  }
}
