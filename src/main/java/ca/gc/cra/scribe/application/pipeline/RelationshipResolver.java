package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.domain.assoc.Association;
import ca.gc.cra.scribe.domain.assoc.AssociationCodes;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.RawRow;
import ca.gc.cra.scribe.domain.msg.Reaction;
import ca.gc.cra.scribe.domain.msg.ReactionKind;
import ca.gc.cra.scribe.domain.msg.RelationKind;
import ca.gc.cra.scribe.domain.msg.UnresolvedRelation;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds reaction rows into their targets and links replies.
 * <p><strong>Why:</strong> Association rows reference other rows by GUID, and a target may appear later in scan order,
 * so resolution runs over the complete decoded row set in two phases: index, then fold.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Index every non-reaction row by GUID.</li>
 *   <li>Append reactions to targets and apply reaction removals; reaction rows never reach the output.</li>
 *   <li>Set {@code reply_to} only for targets present in the same run; record everything else as unresolved.</li>
 * </ul>
 * <p><strong>Determinism:</strong> rows are processed in scan order without re-sorting, so ties on timestamp keep
 * their original order and repeated runs on identical input produce identical links.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per run.</p>
 *
 * @since 0.1.0
 */
public final class RelationshipResolver {
  private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

  private final RunReport report;

  public RelationshipResolver(RunReport report) {
    this.report = Objects.requireNonNull(report, "report");
  }

  /**
   * Resolves relationships across the full decoded row set.
   *
   * @param rows decoded rows in scan order
   * @return standalone messages in scan order plus unresolved relations
   */
  public ResolutionResult resolve(List<DecodedRow> rows) {
    Objects.requireNonNull(rows, "rows");
    List<Association> associations = new ArrayList<>(rows.size());
    Map<String, DraftMessage> targets = new HashMap<>();
    for (DecodedRow decoded : rows) {
      RawRow row = decoded.row();
      Association association = AssociationCodes.classify(row.associationType(), row.associationKey());
      associations.add(association);
      if (association.foldsIntoTarget()) {
        continue;
      }
      String guid = row.guid();
      if (guid != null && !guid.isBlank()) {
        DraftMessage previous = targets.putIfAbsent(guid, decoded.draft());
        if (previous != null) {
          log.debug("Duplicate GUID on row {}; first occurrence keeps the key", row.rowId());
        }
      }
    }

    List<DraftMessage> messages = new ArrayList<>();
    List<UnresolvedRelation> unresolved = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      DecodedRow decoded = rows.get(i);
      Association association = associations.get(i);
      switch (association.associationClass()) {
        case REACTION -> foldReaction(decoded, association, targets, unresolved);
        case REACTION_REMOVAL -> applyRemoval(decoded, association, targets, unresolved);
        case REPLY_CANDIDATE -> {
          DraftMessage draft = decoded.draft();
          Map<String, Object> details = new LinkedHashMap<>();
          details.put("code", association.code());
          details.put("key", association.targetKey());
          draft.putMeta("association", details);
          linkReply(decoded, association.targetKey(), targets, unresolved);
          messages.add(draft);
        }
        case NONE -> {
          String thread = AssociationCodes.normalizeKey(decoded.row().threadOriginatorGuid());
          if (thread != null) {
            linkReply(decoded, thread, targets, unresolved);
          }
          messages.add(decoded.draft());
        }
        default -> throw new IllegalStateException("Unhandled association " + association);
      }
    }
    log.debug("Resolved {} rows into {} messages with {} unresolved relations",
        rows.size(), messages.size(), unresolved.size());
    return new ResolutionResult(messages, unresolved);
  }

  private void foldReaction(
      DecodedRow decoded,
      Association association,
      Map<String, DraftMessage> targets,
      List<UnresolvedRelation> unresolved) {
    DraftMessage target = targets.get(association.targetKey());
    if (target == null) {
      unresolved.add(new UnresolvedRelation(
          decoded.row().rowId(), association.targetKey(), RelationKind.REACTION));
      report.increment(RunCounter.REACTIONS_UNRESOLVED);
      return;
    }
    if (target.addReaction(reactionFrom(decoded, association))) {
      report.increment(RunCounter.REACTIONS_FOLDED);
    } else {
      report.increment(RunCounter.REACTIONS_DUPLICATE);
    }
  }

  private void applyRemoval(
      DecodedRow decoded,
      Association association,
      Map<String, DraftMessage> targets,
      List<UnresolvedRelation> unresolved) {
    DraftMessage target = targets.get(association.targetKey());
    if (target == null) {
      unresolved.add(new UnresolvedRelation(
          decoded.row().rowId(), association.targetKey(), RelationKind.REACTION_REMOVAL));
      report.increment(RunCounter.REACTIONS_UNRESOLVED);
      return;
    }
    if (target.removeLatestReaction(reactionFrom(decoded, association))) {
      report.increment(RunCounter.REACTION_REMOVALS_APPLIED);
    } else {
      log.debug("Row {} removes a reaction that was never folded", decoded.row().rowId());
    }
  }

  private void linkReply(
      DecodedRow decoded,
      String targetKey,
      Map<String, DraftMessage> targets,
      List<UnresolvedRelation> unresolved) {
    DraftMessage draft = decoded.draft();
    DraftMessage target = targets.get(targetKey);
    if (target == null || target == draft) {
      draft.replyTo(null);
      unresolved.add(new UnresolvedRelation(decoded.row().rowId(), targetKey, RelationKind.REPLY));
      report.increment(RunCounter.REPLIES_UNRESOLVED);
      return;
    }
    draft.replyTo(target.id());
    report.increment(RunCounter.REPLIES_RESOLVED);
  }

  private static Reaction reactionFrom(DecodedRow decoded, Association association) {
    ReactionKind kind = association.reactionKind();
    String emoji = kind == ReactionKind.CUSTOM ? decoded.row().associatedEmoji() : null;
    return new Reaction(decoded.draft().sender(), kind, decoded.draft().timestamp(), emoji);
  }

  /**
   * Output of relationship resolution.
   *
   * @param messages standalone drafts in scan order
   * @param unresolved relations whose targets were not found, in scan order
   */
  public record ResolutionResult(List<DraftMessage> messages, List<UnresolvedRelation> unresolved) {
    public ResolutionResult {
      messages = List.copyOf(messages);
      unresolved = List.copyOf(unresolved);
    }
  }
}
