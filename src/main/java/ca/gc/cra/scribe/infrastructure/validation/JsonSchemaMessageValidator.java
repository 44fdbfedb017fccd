package ca.gc.cra.scribe.infrastructure.validation;

import ca.gc.cra.scribe.application.port.MessageValidator;
import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.infrastructure.output.CanonicalJson;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Validates canonical messages against the bundled draft-07 JSON Schema.
 * <p><strong>Why:</strong> The schema is the contract with downstream consumers; validating the exact tree that is
 * written keeps emission and validation in lockstep.</p>
 * <p><strong>Thread-safety:</strong> The compiled schema is immutable and safe to share.</p>
 *
 * @since 0.1.0
 */
public final class JsonSchemaMessageValidator implements MessageValidator {
  /** Classpath location of the canonical message schema. */
  public static final String SCHEMA_RESOURCE = "/schemas/canonical_message.schema.json";

  private final JsonSchema schema;

  private JsonSchemaMessageValidator(JsonSchema schema) {
    this.schema = schema;
  }

  /**
   * Loads the bundled schema.
   *
   * @return validator
   * @throws IllegalStateException when the schema resource is missing
   */
  public static JsonSchemaMessageValidator fromClasspath() {
    try (InputStream in = JsonSchemaMessageValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource " + SCHEMA_RESOURCE);
      }
      JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
      return new JsonSchemaMessageValidator(factory.getSchema(in));
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read schema resource " + SCHEMA_RESOURCE, ex);
    }
  }

  @Override
  public List<String> validate(CanonicalMessage message) {
    Set<ValidationMessage> failures = schema.validate(CanonicalJson.message(message));
    if (failures.isEmpty()) {
      return List.of();
    }
    List<String> reasons = new ArrayList<>(failures.size());
    for (ValidationMessage failure : failures) {
      reasons.add(failure.getMessage());
    }
    Collections.sort(reasons);
    return List.copyOf(reasons);
  }
}
