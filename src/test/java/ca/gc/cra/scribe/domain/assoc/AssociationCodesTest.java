package ca.gc.cra.scribe.domain.assoc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.domain.msg.ReactionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AssociationCodesTest {

  @ParameterizedTest
  @CsvSource({
      "2000, LOVED",
      "2001, LIKED",
      "2002, DISLIKED",
      "2003, AMUSED",
      "2004, EMPHASIZED",
      "2005, QUESTIONED",
      "2006, CUSTOM"})
  void reactionCodesMapToKinds(int code, ReactionKind kind) {
    Association association = AssociationCodes.classify(code, "p:0/TARGET");

    assertEquals(AssociationClass.REACTION, association.associationClass());
    assertEquals(kind, association.reactionKind());
    assertEquals("TARGET", association.targetKey());
    assertTrue(association.foldsIntoTarget());
  }

  @Test
  void laughCodeIsAmused() {
    assertEquals(ReactionKind.AMUSED, AssociationCodes.classify(2003, "GUID").reactionKind());
    assertEquals("amused", ReactionKind.AMUSED.wireName());
  }

  @Test
  void removalCodesMirrorReactionKinds() {
    Association removal = AssociationCodes.classify(3001, "bp:TARGET");

    assertEquals(AssociationClass.REACTION_REMOVAL, removal.associationClass());
    assertEquals(ReactionKind.LIKED, removal.reactionKind());
    assertEquals("TARGET", removal.targetKey());
  }

  @Test
  void unknownCodesWithKeyFallBackToReplyCandidates() {
    Association unknown = AssociationCodes.classify(1000, "p:1/TARGET");
    Association outOfRange = AssociationCodes.classify(2007, "TARGET");

    assertEquals(AssociationClass.REPLY_CANDIDATE, unknown.associationClass());
    assertEquals(AssociationClass.REPLY_CANDIDATE, outOfRange.associationClass());
    assertNull(unknown.reactionKind());
  }

  @Test
  void missingKeyMeansNoAssociation() {
    assertEquals(AssociationClass.NONE, AssociationCodes.classify(2000, null).associationClass());
    assertEquals(AssociationClass.NONE, AssociationCodes.classify(0, "  ").associationClass());
  }

  @Test
  void prefixesAreStripped() {
    assertEquals("ABC", AssociationCodes.normalizeKey("p:12/ABC"));
    assertEquals("ABC", AssociationCodes.normalizeKey("bp:ABC"));
    assertEquals("ABC", AssociationCodes.normalizeKey(" ABC "));
    assertNull(AssociationCodes.normalizeKey("p:0/"));
  }
}
