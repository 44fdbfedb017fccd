package ca.gc.cra.scribe.infrastructure.sqlite;

import ca.gc.cra.scribe.application.port.ChatDatabase;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.domain.msg.RawRow;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.schema.SchemaGeneration;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

/**
 * <strong>What:</strong> {@link ChatDatabase} over a staged SQLite copy using the xerial JDBC driver.
 * <p><strong>Why:</strong> The copy is private to the run, so it is opened read-write; SQLite then replays the staged
 * write-ahead log and rows that were never checkpointed into the primary file are visible.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Introspect tables and message columns for schema detection.</li>
 *   <li>Stream message rows in {@code ROWID} order with chat and handle joins when those tables exist.</li>
 *   <li>Optionally limit rows to the conversations of one handle address.</li>
 *   <li>Keep every unmodelled column, Base64-encoding BLOBs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the orchestrating thread.</p>
 *
 * @since 0.1.0
 */
public final class SqliteChatDatabase implements ChatDatabase {
  private static final Logger log = LoggerFactory.getLogger(SqliteChatDatabase.class);

  private static final String ROWID_ALIAS = "__rowid";
  private static final String CHAT_ALIAS = "__chat_guid";
  private static final String HANDLE_ALIAS = "__handle_address";
  private static final Set<String> MODELLED_COLUMNS = Set.of(
      "rowid", "guid", "text", "date", "is_from_me", "service", "handle_id",
      "associated_message_guid", "associated_message_type", "thread_originator_guid",
      "associated_message_emoji", "attributedbody", "message_summary_info");

  private final Path databasePath;
  private final Connection connection;

  private SqliteChatDatabase(Path databasePath, Connection connection) {
    this.databasePath = databasePath;
    this.connection = connection;
  }

  /**
   * Opens a staged database.
   *
   * @param databasePath staged copy
   * @return open database
   * @throws PipelineFailure with {@link ProblemCode#DATABASE_UNREADABLE} when the file is not a SQLite database
   */
  public static SqliteChatDatabase open(Path databasePath) {
    Objects.requireNonNull(databasePath, "databasePath");
    SQLiteDataSource dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + databasePath.toAbsolutePath());
    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException ex) {
      throw unreadable("Unable to open staged database", databasePath, ex);
    }
    SqliteChatDatabase database = new SqliteChatDatabase(databasePath, connection);
    try {
      database.tables();
    } catch (PipelineFailure ex) {
      database.close();
      throw ex;
    }
    return database;
  }

  @Override
  public Set<String> tables() {
    Set<String> tables = new LinkedHashSet<>();
    try (Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery(
            "SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name")) {
      while (rs.next()) {
        tables.add(rs.getString(1));
      }
    } catch (SQLException ex) {
      throw unreadable("Unable to list tables", databasePath, ex);
    }
    return tables;
  }

  @Override
  public Set<String> messageColumns() {
    return columns("message");
  }

  @Override
  public long count(String table) {
    try (Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + quote(table))) {
      return rs.next() ? rs.getLong(1) : 0L;
    } catch (SQLException ex) {
      throw unreadable("Unable to count rows in " + table, databasePath, ex);
    }
  }

  @Override
  public void forEachMessage(SchemaGeneration generation, Optional<String> contact, Consumer<RawRow> consumer) {
    Objects.requireNonNull(generation, "generation");
    Objects.requireNonNull(contact, "contact");
    Objects.requireNonNull(consumer, "consumer");
    MessageQuery query = buildMessageQuery(lowerCase(tables()), lowerCase(messageColumns()), contact);
    log.debug("Message query: {}", query.sql());
    try (PreparedStatement statement = connection.prepareStatement(query.sql())) {
      for (int i = 0; i < query.parameters().size(); i++) {
        statement.setString(i + 1, query.parameters().get(i));
      }
      try (ResultSet rs = statement.executeQuery()) {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> labels = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
          labels.add(meta.getColumnLabel(i));
        }
        while (rs.next()) {
          Map<String, Object> values = new LinkedHashMap<>();
          for (int i = 1; i <= columnCount; i++) {
            values.putIfAbsent(labels.get(i - 1), rs.getObject(i));
          }
          consumer.accept(toRawRow(values, generation));
        }
      }
    } catch (SQLException ex) {
      throw unreadable("Unable to read message rows", databasePath, ex);
    }
  }

  @Override
  public Map<Long, List<AttachmentRow>> attachmentsByMessage() {
    Set<String> tables = lowerCase(tables());
    Map<Long, List<AttachmentRow>> byMessage = new LinkedHashMap<>();
    if (!tables.contains("attachment") || !tables.contains("message_attachment_join")) {
      return byMessage;
    }
    Set<String> columns = lowerCase(columns("attachment"));
    String sql = "SELECT maj.message_id, a.ROWID, "
        + column(columns, "a", "guid") + ", "
        + column(columns, "a", "filename") + ", "
        + column(columns, "a", "mime_type") + ", "
        + column(columns, "a", "uti") + ", "
        + column(columns, "a", "transfer_name") + ", "
        + column(columns, "a", "total_bytes")
        + " FROM message_attachment_join maj JOIN attachment a ON a.ROWID = maj.attachment_id"
        + " ORDER BY maj.message_id, a.ROWID";
    try (Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery(sql)) {
      while (rs.next()) {
        long messageRowId = rs.getLong(1);
        AttachmentRow row = new AttachmentRow(
            rs.getLong(2),
            messageRowId,
            rs.getString(3),
            rs.getString(4),
            rs.getString(5),
            rs.getString(6),
            rs.getString(7),
            asLong(rs.getObject(8)));
        byMessage.computeIfAbsent(messageRowId, id -> new ArrayList<>()).add(row);
      }
    } catch (SQLException ex) {
      throw unreadable("Unable to read attachment rows", databasePath, ex);
    }
    return byMessage;
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException ex) {
      log.warn("Failed to close staged database connection", ex);
    }
  }

  private Set<String> columns(String table) {
    Set<String> columns = new LinkedHashSet<>();
    try (Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery("PRAGMA table_info(" + quote(table) + ")")) {
      while (rs.next()) {
        columns.add(rs.getString("name"));
      }
    } catch (SQLException ex) {
      throw unreadable("Unable to read columns of " + table, databasePath, ex);
    }
    return columns;
  }

  static MessageQuery buildMessageQuery(Set<String> tables, Set<String> messageColumns, Optional<String> contact) {
    boolean chats = tables.contains("chat") && tables.contains("chat_message_join");
    boolean handles = tables.contains("handle") && messageColumns.contains("handle_id");
    List<String> parameters = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT m.ROWID AS ").append(ROWID_ALIAS).append(", m.*, ");
    sql.append(chats ? "cj.chat_guid" : "NULL").append(" AS ").append(CHAT_ALIAS).append(", ");
    sql.append(handles ? "h.id" : "NULL").append(" AS ").append(HANDLE_ALIAS);
    sql.append(" FROM message m");
    if (chats) {
      sql.append(" LEFT JOIN (SELECT cmj.message_id AS mid, MIN(c.guid) AS chat_guid")
          .append(" FROM chat_message_join cmj JOIN chat c ON c.ROWID = cmj.chat_id")
          .append(" GROUP BY cmj.message_id) cj ON cj.mid = m.ROWID");
    }
    if (handles) {
      sql.append(" LEFT JOIN handle h ON h.ROWID = m.handle_id");
    }
    if (contact.isPresent()) {
      sql.append(" WHERE ").append(contactScope(tables, chats, handles, contact.get(), parameters));
    }
    sql.append(" ORDER BY m.ROWID");
    return new MessageQuery(sql.toString(), parameters);
  }

  /** Restricts rows to chats the handle takes part in; without chat tables, to the handle's own rows. */
  private static String contactScope(
      Set<String> tables, boolean chats, boolean handles, String contact, List<String> parameters) {
    if (!handles) {
      return "0 = 1";
    }
    if (!chats) {
      parameters.add(contact);
      return "h.id = ?";
    }
    StringBuilder chatIds = new StringBuilder("SELECT sc.chat_id FROM chat_message_join sc")
        .append(" JOIN message sm ON sm.ROWID = sc.message_id")
        .append(" JOIN handle sh ON sh.ROWID = sm.handle_id WHERE sh.id = ?");
    parameters.add(contact);
    if (tables.contains("chat_handle_join")) {
      chatIds.append(" UNION SELECT chj.chat_id FROM chat_handle_join chj")
          .append(" JOIN handle ph ON ph.ROWID = chj.handle_id WHERE ph.id = ?");
      parameters.add(contact);
    }
    return "m.ROWID IN (SELECT cmj2.message_id FROM chat_message_join cmj2 WHERE cmj2.chat_id IN ("
        + chatIds + "))";
  }

  record MessageQuery(String sql, List<String> parameters) {
    MessageQuery {
      parameters = List.copyOf(parameters);
    }
  }

  private static RawRow toRawRow(Map<String, Object> values, SchemaGeneration generation) {
    Map<String, Object> byLower = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      byLower.putIfAbsent(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
    }
    long rowId = asLong(byLower.get(ROWID_ALIAS));
    boolean readBody = generation.declares("attributedBody");
    boolean readSummary = generation.declares("message_summary_info");
    RawRow.Builder builder = RawRow.builder(rowId)
        .guid(asString(byLower.get("guid")))
        .association(
            asString(byLower.get("associated_message_guid")),
            asInt(byLower.get("associated_message_type")))
        .rawDate(asLong(byLower.get("date")))
        .text(asString(byLower.get("text")))
        .attributedBody(readBody ? asBytes(byLower.get("attributedbody")) : null)
        .messageSummaryInfo(readSummary ? asBytes(byLower.get("message_summary_info")) : null)
        .fromSelf(asInt(byLower.get("is_from_me")) != 0)
        .service(asString(byLower.get("service")))
        .conversationId(asString(byLower.get(CHAT_ALIAS)))
        .handle(asLong(byLower.get("handle_id")), asString(byLower.get(HANDLE_ALIAS)))
        .threadOriginatorGuid(asString(byLower.get("thread_originator_guid")))
        .associatedEmoji(asString(byLower.get("associated_message_emoji")));

    for (Map.Entry<String, Object> entry : values.entrySet()) {
      String lower = entry.getKey().toLowerCase(Locale.ROOT);
      if (lower.startsWith("__")) {
        continue;
      }
      boolean unreadPayload = (lower.equals("attributedbody") && !readBody)
          || (lower.equals("message_summary_info") && !readSummary);
      if (MODELLED_COLUMNS.contains(lower) && !unreadPayload) {
        continue;
      }
      builder.extra(entry.getKey(), jsonSafe(entry.getValue()));
    }
    return builder.build();
  }

  private static Object jsonSafe(Object value) {
    if (value instanceof byte[] bytes) {
      return Base64.getEncoder().encodeToString(bytes);
    }
    if (value instanceof Integer number) {
      return number.longValue();
    }
    return value;
  }

  private static String column(Set<String> columns, String alias, String name) {
    return columns.contains(name) ? alias + "." + name : "NULL";
  }

  private static Set<String> lowerCase(Set<String> names) {
    Set<String> lowered = new LinkedHashSet<>();
    for (String name : names) {
      lowered.add(name.toLowerCase(Locale.ROOT));
    }
    return lowered;
  }

  private static String quote(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  private static String asString(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof byte[] bytes) {
      return new String(bytes, StandardCharsets.UTF_8);
    }
    return value.toString();
  }

  private static Long asLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  private static int asInt(Object value) {
    Long asLong = asLong(value);
    return asLong == null ? 0 : asLong.intValue();
  }

  private static byte[] asBytes(Object value) {
    if (value instanceof byte[] bytes) {
      return bytes;
    }
    if (value instanceof String text) {
      return text.getBytes(StandardCharsets.UTF_8);
    }
    return null;
  }

  private static PipelineFailure unreadable(String detail, Path path, SQLException cause) {
    return new PipelineFailure(ProblemCode.DATABASE_UNREADABLE, detail + ": " + cause.getMessage(),
        path.toString(), cause);
  }
}
