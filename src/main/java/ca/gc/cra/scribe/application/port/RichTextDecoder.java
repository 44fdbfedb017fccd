package ca.gc.cra.scribe.application.port;

import java.util.Optional;

/**
 * Decodes one archived rich-text encoding into its plain string content.
 *
 * <p>Implementations never throw on malformed input; they return empty so the next decoder in the
 * chain can try.</p>
 *
 * @since 0.1.0
 */
public interface RichTextDecoder {
  /**
   * Returns the decoder name recorded as text provenance.
   *
   * @return short stable name
   */
  String name();

  /**
   * Decodes a payload.
   *
   * @param payload raw bytes; may be {@code null}
   * @return decoded non-blank text, or empty on failure
   */
  Optional<String> decode(byte[] payload);
}
