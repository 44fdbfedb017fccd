package ca.gc.cra.scribe.infrastructure.backup;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Parsed backup keybag and its passphrase unlock.
 * <p><strong>Format:</strong> a flat sequence of blocks, each a 4-byte ASCII tag, a 4-byte big-endian length and the
 * value. Header tags ({@code VERS, TYPE, UUID, WRAP, SALT, ITER, DPSL, DPIC}, ...) come first; every later
 * {@code UUID} tag opens a class key entry holding {@code CLAS, WRAP, KTYP, WPKY}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after parsing; {@link #unlock(byte[])} returns a new key set.</p>
 *
 * @since 0.1.0
 */
final class BackupKeyBag {
  static final int WRAP_PASSCODE = 2;
  static final int KEY_LENGTH = 32;

  private final Map<String, byte[]> attributes;
  private final List<Map<String, byte[]>> classKeys;

  private BackupKeyBag(Map<String, byte[]> attributes, List<Map<String, byte[]>> classKeys) {
    this.attributes = attributes;
    this.classKeys = classKeys;
  }

  /**
   * Parses keybag bytes.
   *
   * @param data raw {@code BackupKeyBag} value
   * @return parsed keybag
   * @throws IllegalArgumentException when a block overruns the buffer
   */
  static BackupKeyBag parse(byte[] data) {
    Objects.requireNonNull(data, "data");
    Map<String, byte[]> attributes = new LinkedHashMap<>();
    List<Map<String, byte[]>> classKeys = new ArrayList<>();
    Map<String, byte[]> current = null;
    boolean headerUuidSeen = false;
    ByteBuffer buffer = ByteBuffer.wrap(data);
    while (buffer.remaining() >= 8) {
      byte[] tagBytes = new byte[4];
      buffer.get(tagBytes);
      String tag = new String(tagBytes, StandardCharsets.US_ASCII);
      int length = buffer.getInt();
      if (length < 0 || length > buffer.remaining()) {
        throw new IllegalArgumentException("Keybag block " + tag + " overruns the buffer");
      }
      byte[] value = new byte[length];
      buffer.get(value);
      if (tag.equals("UUID")) {
        if (!headerUuidSeen) {
          headerUuidSeen = true;
          attributes.put(tag, value);
          continue;
        }
        current = new HashMap<>();
        classKeys.add(current);
        current.put(tag, value);
      } else if (current != null) {
        current.put(tag, value);
      } else {
        attributes.put(tag, value);
      }
    }
    return new BackupKeyBag(attributes, classKeys);
  }

  int classKeyCount() {
    return classKeys.size();
  }

  /**
   * Derives the passcode key and unwraps every passcode-protected class key.
   *
   * @param passphrase passphrase bytes
   * @return class keys by protection class
   * @throws GeneralSecurityException when derivation fails or any class key does not unwrap
   */
  Map<Integer, byte[]> unlock(byte[] passphrase) throws GeneralSecurityException {
    byte[] salt = required("SALT");
    int iterations = intValue(required("ITER"));
    byte[] key = passphrase;
    byte[] dpsl = attributes.get("DPSL");
    byte[] dpic = attributes.get("DPIC");
    if (dpsl != null && dpic != null) {
      key = BackupCrypto.pbkdf2(BackupCrypto.HMAC_SHA256, key, dpsl, intValue(dpic), KEY_LENGTH);
    }
    byte[] passcodeKey = BackupCrypto.pbkdf2(BackupCrypto.HMAC_SHA1, key, salt, iterations, KEY_LENGTH);

    Map<Integer, byte[]> unwrapped = new HashMap<>();
    for (Map<String, byte[]> entry : classKeys) {
      byte[] wrapped = entry.get("WPKY");
      byte[] clas = entry.get("CLAS");
      byte[] wrap = entry.get("WRAP");
      if (wrapped == null || clas == null || wrap == null) {
        continue;
      }
      if ((intValue(wrap) & WRAP_PASSCODE) == 0) {
        continue;
      }
      unwrapped.put(intValue(clas), BackupCrypto.unwrap(passcodeKey, wrapped));
    }
    if (unwrapped.isEmpty()) {
      throw new GeneralSecurityException("Keybag holds no passcode-protected class keys");
    }
    return Collections.unmodifiableMap(unwrapped);
  }

  private byte[] required(String tag) throws GeneralSecurityException {
    byte[] value = attributes.get(tag);
    if (value == null) {
      throw new GeneralSecurityException("Keybag is missing " + tag);
    }
    return value;
  }

  static int intValue(byte[] value) {
    long result = 0;
    for (byte b : value) {
      result = (result << 8) | (b & 0xFF);
    }
    return (int) result;
  }
}
