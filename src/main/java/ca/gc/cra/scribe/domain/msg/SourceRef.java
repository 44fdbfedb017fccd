package ca.gc.cra.scribe.domain.msg;

/**
 * Provenance pointer from a canonical message back to its origin row.
 *
 * @param path origin database or backup path as supplied by the operator
 * @param guid origin message GUID
 * @param rowId origin {@code message.ROWID}
 * @since 0.1.0
 */
public record SourceRef(String path, String guid, long rowId) {}
