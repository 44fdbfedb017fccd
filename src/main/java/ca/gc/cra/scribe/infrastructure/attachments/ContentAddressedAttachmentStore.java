package ca.gc.cra.scribe.infrastructure.attachments;

import ca.gc.cra.scribe.application.port.AttachmentMaterializer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> SHA-256 content-addressed attachment store under {@code <out>/attachments}.
 * <p><strong>Layout:</strong> {@code <root>/<h[0:2]>/<h><.ext>} where {@code h} is the hex digest of the bytes and
 * {@code ext} the lowercased extension of the original name.</p>
 * <p><strong>Idempotence:</strong> bytes stream once through the digest into a temporary file, which is moved into
 * place only when no copy exists yet; otherwise it is discarded.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; concurrent writers of the same content converge on one
 * file.</p>
 *
 * @since 0.1.0
 */
public final class ContentAddressedAttachmentStore implements AttachmentMaterializer {
  private static final Logger log = LoggerFactory.getLogger(ContentAddressedAttachmentStore.class);
  private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,10}");
  private static final int BUFFER_BYTES = 64 * 1024;

  /** Prefix of every content hash. */
  public static final String HASH_PREFIX = "sha256:";

  private final Path root;

  /**
   * Creates the store.
   *
   * @param root store root, typically {@code <out>/attachments}
   */
  public ContentAddressedAttachmentStore(Path root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  @Override
  public String hash(Path source) throws IOException {
    MessageDigest digest = sha256();
    try (InputStream in = new DigestInputStream(Files.newInputStream(source), digest)) {
      in.transferTo(OutputStream.nullOutputStream());
    }
    return HASH_PREFIX + HexFormat.of().formatHex(digest.digest());
  }

  @Override
  public Materialized materialize(Path source, String displayName) throws IOException {
    Files.createDirectories(root);
    MessageDigest digest = sha256();
    Path temp = Files.createTempFile(root, ".incoming-", ".tmp");
    try {
      try (InputStream in = new DigestInputStream(Files.newInputStream(source), digest);
          OutputStream out = Files.newOutputStream(temp)) {
        byte[] buffer = new byte[BUFFER_BYTES];
        int read;
        while ((read = in.read(buffer)) != -1) {
          out.write(buffer, 0, read);
        }
      }
      String hex = HexFormat.of().formatHex(digest.digest());
      Path target = root.resolve(hex.substring(0, 2)).resolve(hex + extension(displayName));
      Files.createDirectories(target.getParent());
      if (Files.exists(target)) {
        log.debug("Attachment content {} already materialized", hex);
      } else {
        moveIntoPlace(temp, target);
      }
      return new Materialized(target, HASH_PREFIX + hex);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (FileAlreadyExistsException ex) {
      log.debug("Concurrent writer materialized {} first", target.getFileName());
    } catch (AtomicMoveNotSupportedException ex) {
      try {
        Files.move(temp, target);
      } catch (FileAlreadyExistsException raced) {
        log.debug("Concurrent writer materialized {} first", target.getFileName());
      }
    }
  }

  static String extension(String displayName) {
    if (displayName == null) {
      return "";
    }
    String name = displayName;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
    return EXTENSION.matcher(ext).matches() ? "." + ext : "";
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
