package ca.gc.cra.scribe.infrastructure.output;

import ca.gc.cra.scribe.domain.msg.AttachmentRef;
import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.msg.Reaction;
import ca.gc.cra.scribe.domain.msg.UnresolvedRelation;
import ca.gc.cra.scribe.domain.problem.ProblemDetails;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Jackson tree rendering for every JSON artifact.
 * <p><strong>Determinism:</strong> record fields are written in a fixed order; map entries keep the iteration order
 * of the (sorted or insertion-ordered) source maps; instants render as ISO-8601 UTC at second precision.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the shared {@link ObjectMapper} is only used for serialization.</p>
 *
 * @since 0.1.0
 */
public final class CanonicalJson {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static final String NO_CONVERSATION = "unassigned";

  private CanonicalJson() {
    // Utility
  }

  /**
   * Returns the shared mapper.
   *
   * @return object mapper
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Renders a canonical message.
   *
   * @param message frozen message
   * @return JSON object with fields in canonical order
   */
  public static ObjectNode message(CanonicalMessage message) {
    ObjectNode node = NODES.objectNode();
    node.put("msg_id", message.id());
    node.put("conv_id", message.conversationId());
    node.put("platform", message.platform());
    node.put("timestamp", instant(message.timestamp()));
    node.put("sender", message.sender());
    node.put("is_self", message.fromSelf());
    node.put("text", message.text());
    ArrayNode attachments = node.putArray("attachments");
    for (AttachmentRef attachment : message.attachments()) {
      attachments.add(attachment(attachment));
    }
    ArrayNode reactions = node.putArray("reactions");
    for (Reaction reaction : message.reactions()) {
      reactions.add(reaction(reaction));
    }
    node.put("reply_to", message.replyTo());
    ObjectNode sourceRef = node.putObject("source_ref");
    sourceRef.put("path", message.sourceRef().path());
    sourceRef.put("guid", message.sourceRef().guid());
    sourceRef.put("rowid", message.sourceRef().rowId());
    node.set("source_meta", value(message.sourceMeta()));
    return node;
  }

  static ObjectNode attachment(AttachmentRef attachment) {
    ObjectNode node = NODES.objectNode();
    node.put("type", attachment.type().wireName());
    node.put("filename", attachment.filename());
    putIfPresent(node, "abs_path", attachment.absPath());
    putIfPresent(node, "content_hash", attachment.contentHash());
    putIfPresent(node, "mime_type", attachment.mimeType());
    putIfPresent(node, "uti", attachment.uti());
    putIfPresent(node, "transfer_name", attachment.transferName());
    if (attachment.totalBytes() != null) {
      node.put("total_bytes", attachment.totalBytes());
    }
    return node;
  }

  static ObjectNode reaction(Reaction reaction) {
    ObjectNode node = NODES.objectNode();
    node.put("from", reaction.actor());
    node.put("kind", reaction.kind().wireName());
    node.put("ts", instant(reaction.timestamp()));
    putIfPresent(node, "emoji", reaction.emoji());
    return node;
  }

  /**
   * Renders a quarantine record.
   *
   * @param message rejected message
   * @param reasons validation failures
   * @return {@code {row_id, reasons, record}}
   */
  public static ObjectNode quarantine(CanonicalMessage message, List<String> reasons) {
    ObjectNode node = NODES.objectNode();
    node.put("row_id", message.sourceRef().rowId());
    ArrayNode reasonArray = node.putArray("reasons");
    reasons.forEach(reasonArray::add);
    node.set("record", message(message));
    return node;
  }

  /**
   * Renders an unresolved relation.
   *
   * @param relation unresolved relation
   * @return {@code {origin_row_id, referenced_key, relation}}
   */
  public static ObjectNode unresolved(UnresolvedRelation relation) {
    ObjectNode node = NODES.objectNode();
    node.put("origin_row_id", relation.originRowId());
    node.put("referenced_key", relation.referencedKey());
    node.put("relation", relation.relation().name());
    return node;
  }

  /**
   * Renders the missing-attachment artifact.
   *
   * @param missing missing attachments in emission order
   * @return {@code {items, summary: {total, by_conversation}}}
   */
  public static ObjectNode missingAttachments(List<MissingAttachment> missing) {
    ObjectNode node = NODES.objectNode();
    ArrayNode items = node.putArray("items");
    Map<String, Long> byConversation = new TreeMap<>();
    for (MissingAttachment item : missing) {
      ObjectNode entry = items.addObject();
      entry.put("conv_id", item.conversationId());
      entry.put("msg_id", item.messageId());
      entry.put("attachment_row_id", item.attachmentRowId());
      entry.put("filename", item.filename());
      entry.put("reason", item.reason());
      String key = item.conversationId() == null ? NO_CONVERSATION : item.conversationId();
      byConversation.merge(key, 1L, Long::sum);
    }
    ObjectNode summary = node.putObject("summary");
    summary.put("total", missing.size());
    ObjectNode counts = summary.putObject("by_conversation");
    byConversation.forEach(counts::put);
    return node;
  }

  /**
   * Renders a problem description.
   *
   * @param problem problem details
   * @return JSON object
   */
  public static ObjectNode problem(ProblemDetails problem) {
    ObjectNode node = NODES.objectNode();
    node.put("type", problem.type());
    node.put("title", problem.title());
    node.put("status", problem.status());
    node.put("detail", problem.detail());
    node.put("instance", problem.instance());
    node.put("code", problem.code());
    return node;
  }

  /**
   * Renders a plain Java value (maps, collections, scalars, instants, byte arrays).
   *
   * @param value value to render
   * @return JSON node
   */
  public static JsonNode value(Object value) {
    if (value == null) {
      return NODES.nullNode();
    }
    if (value instanceof JsonNode node) {
      return node;
    }
    if (value instanceof Map<?, ?> map) {
      ObjectNode node = NODES.objectNode();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        node.set(String.valueOf(entry.getKey()), value(entry.getValue()));
      }
      return node;
    }
    if (value instanceof Collection<?> collection) {
      ArrayNode array = NODES.arrayNode();
      for (Object element : collection) {
        array.add(value(element));
      }
      return array;
    }
    if (value instanceof String text) {
      return NODES.textNode(text);
    }
    if (value instanceof Boolean flag) {
      return NODES.booleanNode(flag);
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return NODES.numberNode(((Number) value).longValue());
    }
    if (value instanceof Double number) {
      return NODES.numberNode(number);
    }
    if (value instanceof Float number) {
      return NODES.numberNode(number);
    }
    if (value instanceof BigDecimal number) {
      return NODES.numberNode(number);
    }
    if (value instanceof BigInteger number) {
      return NODES.numberNode(number);
    }
    if (value instanceof Instant instant) {
      return NODES.textNode(instant(instant));
    }
    if (value instanceof byte[] bytes) {
      return NODES.textNode(Base64.getEncoder().encodeToString(bytes));
    }
    if (value instanceof Enum<?> constant) {
      return NODES.textNode(constant.name());
    }
    return NODES.textNode(value.toString());
  }

  /**
   * Serializes a node on one line.
   *
   * @param node JSON node
   * @return compact JSON text
   * @throws JsonProcessingException when serialization fails
   */
  public static String line(JsonNode node) throws JsonProcessingException {
    return MAPPER.writeValueAsString(node);
  }

  /**
   * Serializes a node with indentation.
   *
   * @param node JSON node
   * @return indented JSON text
   * @throws JsonProcessingException when serialization fails
   */
  public static String pretty(JsonNode node) throws JsonProcessingException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
  }

  private static String instant(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }
}
