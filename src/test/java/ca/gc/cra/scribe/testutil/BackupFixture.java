package ca.gc.cra.scribe.testutil;

import com.dd.plist.NSArray;
import com.dd.plist.NSData;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSString;
import com.dd.plist.UID;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Writes device backup directories: {@code Manifest.db}, {@code Manifest.plist} and hashed file blobs, optionally
 * encrypted with a passphrase-protected keybag.
 */
public final class BackupFixture {
  public static final String HOME_DOMAIN = "HomeDomain";
  public static final String MEDIA_DOMAIN = "MediaDomain";
  public static final String SMS_DATABASE = "Library/SMS/sms.db";

  private static final int PROTECTION_CLASS = 3;
  private static final int ITERATIONS = 10;
  private static final byte[] ZERO_IV = new byte[16];

  private final Path root;
  private final String passphrase;
  private final SecureRandom random = new SecureRandom();
  private final List<Entry> entries = new ArrayList<>();
  private final byte[] classKey;

  private BackupFixture(Path root, String passphrase) {
    this.root = root;
    this.passphrase = passphrase;
    this.classKey = passphrase == null ? null : randomBytes(32);
  }

  public static BackupFixture plain(Path root) {
    return new BackupFixture(root, null);
  }

  public static BackupFixture encrypted(Path root, String passphrase) {
    return new BackupFixture(root, passphrase);
  }

  /** Adds a file under its domain; the blob is written by {@link #write()}. */
  public BackupFixture file(String domain, String relativePath, byte[] content) {
    entries.add(new Entry(domain, relativePath, content));
    return this;
  }

  /** Adds a SQLite database file read from disk. */
  public BackupFixture file(String domain, String relativePath, Path content) throws Exception {
    return file(domain, relativePath, Files.readAllBytes(content));
  }

  public static String fileId(String domain, String relativePath) throws GeneralSecurityException {
    MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
    byte[] digest = sha1.digest((domain + "-" + relativePath).getBytes(StandardCharsets.UTF_8));
    return HexFormat.of().formatHex(digest);
  }

  /** Writes the backup and returns its root. */
  public Path write() throws Exception {
    Files.createDirectories(root);
    Path plainManifest = root.resolve(passphrase == null ? "Manifest.db" : ".manifest-plain.db");
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + plainManifest.toAbsolutePath())) {
      try (Statement statement = connection.createStatement()) {
        statement.execute("CREATE TABLE Files (fileID TEXT PRIMARY KEY, domain TEXT, relativePath TEXT,"
            + " flags INTEGER, file BLOB)");
      }
      for (Entry entry : entries) {
        String fileId = fileId(entry.domain(), entry.relativePath());
        byte[] fileColumn = null;
        byte[] blob = entry.content();
        if (passphrase != null) {
          byte[] fileKey = randomBytes(32);
          blob = encryptPadded(fileKey, entry.content());
          fileColumn = fileArchive(withClassPrefix(wrap(classKey, fileKey)));
        }
        Path blobPath = root.resolve(fileId.substring(0, 2)).resolve(fileId);
        Files.createDirectories(blobPath.getParent());
        Files.write(blobPath, blob);
        try (PreparedStatement insert = connection.prepareStatement(
            "INSERT INTO Files (fileID, domain, relativePath, flags, file) VALUES (?, ?, ?, 1, ?)")) {
          insert.setString(1, fileId);
          insert.setString(2, entry.domain());
          insert.setString(3, entry.relativePath());
          insert.setBytes(4, fileColumn);
          insert.executeUpdate();
        }
      }
    }

    NSDictionary manifestPlist = new NSDictionary();
    manifestPlist.put("IsEncrypted", new NSNumber(passphrase != null));
    manifestPlist.put("Version", new NSString("10.0"));
    if (passphrase != null) {
      byte[] manifestKey = randomBytes(32);
      byte[] plaintext = Files.readAllBytes(plainManifest);
      Files.delete(plainManifest);
      Files.write(root.resolve("Manifest.db"), encryptUnpadded(manifestKey, plaintext));
      manifestPlist.put("ManifestKey", new NSData(withClassPrefix(wrap(classKey, manifestKey))));
      manifestPlist.put("BackupKeyBag", new NSData(keyBag()));
    }
    Files.write(root.resolve("Manifest.plist"), RichTextFixtures.binary(manifestPlist));
    return root;
  }

  private byte[] keyBag() throws GeneralSecurityException {
    byte[] dpsl = randomBytes(20);
    byte[] salt = randomBytes(20);
    byte[] first = pbkdf2("HmacSHA256", passphrase.getBytes(StandardCharsets.UTF_8), dpsl, ITERATIONS);
    byte[] passcodeKey = pbkdf2("HmacSHA1", first, salt, ITERATIONS);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    block(out, "VERS", intBytes(4));
    block(out, "TYPE", intBytes(1));
    block(out, "UUID", randomBytes(16));
    block(out, "WRAP", intBytes(0));
    block(out, "SALT", salt);
    block(out, "ITER", intBytes(ITERATIONS));
    block(out, "DPWT", intBytes(1));
    block(out, "DPIC", intBytes(ITERATIONS));
    block(out, "DPSL", dpsl);
    block(out, "UUID", randomBytes(16));
    block(out, "CLAS", intBytes(PROTECTION_CLASS));
    block(out, "WRAP", intBytes(2));
    block(out, "KTYP", intBytes(0));
    block(out, "WPKY", wrap(passcodeKey, classKey));
    return out.toByteArray();
  }

  private static byte[] fileArchive(byte[] encryptionKey) {
    NSDictionary file = new NSDictionary();
    file.put("EncryptionKey", new UID("key", new byte[] {2}));
    file.put("ProtectionClass", new NSNumber(PROTECTION_CLASS));
    file.put("Size", new NSNumber(encryptionKey.length));
    NSDictionary keyData = new NSDictionary();
    keyData.put("NS.data", new NSData(encryptionKey));
    NSDictionary top = new NSDictionary();
    top.put("root", new UID("root", new byte[] {1}));
    NSDictionary archive = new NSDictionary();
    archive.put("$archiver", new NSString("NSKeyedArchiver"));
    archive.put("$top", top);
    archive.put("$objects", new NSArray(new NSString("$null"), file, keyData));
    return RichTextFixtures.binary(archive);
  }

  private static void block(ByteArrayOutputStream out, String tag, byte[] value) {
    byte[] tagBytes = tag.getBytes(StandardCharsets.US_ASCII);
    out.write(tagBytes, 0, tagBytes.length);
    byte[] length = intBytes(value.length);
    out.write(length, 0, length.length);
    out.write(value, 0, value.length);
  }

  private static byte[] intBytes(int value) {
    return ByteBuffer.allocate(4).putInt(value).array();
  }

  private static byte[] withClassPrefix(byte[] wrapped) {
    ByteBuffer buffer = ByteBuffer.allocate(4 + wrapped.length).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(PROTECTION_CLASS);
    buffer.put(wrapped);
    return buffer.array();
  }

  private static byte[] wrap(byte[] kek, byte[] key) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance("AESWrap");
    cipher.init(Cipher.WRAP_MODE, new SecretKeySpec(kek, "AES"));
    return cipher.wrap(new SecretKeySpec(key, "AES"));
  }

  private static byte[] encryptPadded(byte[] key, byte[] plaintext) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
    cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(ZERO_IV));
    return cipher.doFinal(plaintext);
  }

  private static byte[] encryptUnpadded(byte[] key, byte[] plaintext) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance("AES/CBC/NoPadding");
    cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(ZERO_IV));
    return cipher.doFinal(plaintext);
  }

  private static byte[] pbkdf2(String algorithm, byte[] password, byte[] salt, int iterations)
      throws GeneralSecurityException {
    Mac mac = Mac.getInstance(algorithm);
    mac.init(new SecretKeySpec(password, algorithm));
    byte[] result = new byte[0];
    for (int block = 1; result.length < 32; block++) {
      mac.update(salt);
      byte[] u = mac.doFinal(intBytes(block));
      byte[] t = u.clone();
      for (int i = 1; i < iterations; i++) {
        u = mac.doFinal(u);
        for (int j = 0; j < t.length; j++) {
          t[j] ^= u[j];
        }
      }
      byte[] grown = Arrays.copyOf(result, result.length + t.length);
      System.arraycopy(t, 0, grown, result.length, t.length);
      result = grown;
    }
    return Arrays.copyOf(result, 32);
  }

  private byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }

  private record Entry(String domain, String relativePath, byte[] content) {}
}
