package ca.gc.cra.scribe.infrastructure.backup;

import ca.gc.cra.scribe.infrastructure.plist.KeyedArchives;
import com.dd.plist.NSArray;
import com.dd.plist.NSData;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSObject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Property list access for backup metadata: the encryption flag, the keybag, the manifest key, and per-file
 * archived encryption keys.
 *
 * @since 0.1.0
 */
final class BackupPlists {
  private static final Logger log = LoggerFactory.getLogger(BackupPlists.class);
  private static final List<String> ENCRYPTION_FLAGS = List.of("IsEncrypted", "Encrypted", "UsesEncryptedBackups");

  private BackupPlists() {
    // Utility
  }

  /**
   * Determines whether a backup is encrypted from {@code Manifest.plist}, then {@code Status.plist}, then
   * {@code Info.plist}. Unparseable plists are skipped.
   *
   * @param root backup root
   * @return encryption flag, or empty when no plist declares one
   */
  static Optional<Boolean> isEncrypted(Path root) {
    for (String name : List.of(BackupLayout.MANIFEST_PLIST, BackupLayout.STATUS_PLIST, BackupLayout.INFO_PLIST)) {
      Path plist = root.resolve(name);
      if (!Files.isRegularFile(plist)) {
        continue;
      }
      NSDictionary dictionary;
      try {
        dictionary = readDictionary(plist);
      } catch (IOException ex) {
        log.warn("Skipping unparseable {}: {}", name, ex.getMessage());
        continue;
      }
      for (String key : ENCRYPTION_FLAGS) {
        NSObject value = dictionary.objectForKey(key);
        if (value instanceof NSNumber number) {
          return Optional.of(number.boolValue());
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Reads a property list file whose root is a dictionary.
   *
   * @param plist file path
   * @return root dictionary
   * @throws IOException when the file is unreadable, malformed, or its root is not a dictionary
   */
  static NSDictionary readDictionary(Path plist) throws IOException {
    NSObject root = KeyedArchives.parse(Files.readAllBytes(plist), plist.getFileName().toString());
    if (!(root instanceof NSDictionary dictionary)) {
      throw new IOException(plist.getFileName() + " root is not a dictionary");
    }
    return dictionary;
  }

  /**
   * Returns a binary value from a dictionary.
   *
   * @param dictionary plist dictionary
   * @param key entry key
   * @return value bytes, or empty when absent or not data
   */
  static Optional<byte[]> data(NSDictionary dictionary, String key) {
    NSObject value = dictionary.objectForKey(key);
    if (value instanceof NSData data) {
      return Optional.of(data.bytes());
    }
    return Optional.empty();
  }

  /**
   * Extracts the wrapped per-file key from a manifest {@code Files.file} archive.
   *
   * @param archive keyed-archive bytes
   * @return protection class and wrapped key, or empty when the archive carries no key
   * @throws IOException when the archive cannot be parsed
   */
  static Optional<WrappedFileKey> fileKey(byte[] archive) throws IOException {
    if (archive == null || archive.length == 0) {
      return Optional.empty();
    }
    NSObject root = KeyedArchives.parse(archive, "Files.file");
    if (!(root instanceof NSDictionary dictionary)) {
      return Optional.empty();
    }
    Optional<NSArray> table = KeyedArchives.objects(dictionary);
    if (table.isEmpty()) {
      return Optional.empty();
    }
    NSArray objects = table.get();
    NSObject file = KeyedArchives.root(dictionary, objects);
    if (!(file instanceof NSDictionary fileDictionary)) {
      return Optional.empty();
    }
    NSObject key = KeyedArchives.dereference(fileDictionary.objectForKey("EncryptionKey"), objects);
    byte[] keyBytes = null;
    if (key instanceof NSData data) {
      keyBytes = data.bytes();
    } else if (key instanceof NSDictionary keyDictionary) {
      NSObject inner = KeyedArchives.dereference(keyDictionary.objectForKey("NS.data"), objects);
      if (inner instanceof NSData data) {
        keyBytes = data.bytes();
      }
    }
    if (keyBytes == null || keyBytes.length <= 4) {
      return Optional.empty();
    }
    int protectionClass = littleEndianInt(keyBytes);
    NSObject declared = KeyedArchives.dereference(fileDictionary.objectForKey("ProtectionClass"), objects);
    if (declared instanceof NSNumber number) {
      protectionClass = number.intValue();
    }
    byte[] wrapped = new byte[keyBytes.length - 4];
    System.arraycopy(keyBytes, 4, wrapped, 0, wrapped.length);
    return Optional.of(new WrappedFileKey(protectionClass, wrapped));
  }

  static int littleEndianInt(byte[] bytes) {
    return (bytes[0] & 0xFF)
        | ((bytes[1] & 0xFF) << 8)
        | ((bytes[2] & 0xFF) << 16)
        | ((bytes[3] & 0xFF) << 24);
  }

  /**
   * Wrapped per-file key.
   *
   * @param protectionClass keybag class holding the unwrapping key
   * @param wrapped RFC 3394 wrapped key
   */
  record WrappedFileKey(int protectionClass, byte[] wrapped) {}
}
