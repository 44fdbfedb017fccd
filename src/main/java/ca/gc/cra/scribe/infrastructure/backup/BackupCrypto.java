package ca.gc.cra.scribe.infrastructure.backup;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Cryptographic primitives used by encrypted device backups.
 *
 * <p>PBKDF2 is computed over raw byte passwords because the second derivation round takes the
 * binary output of the first, which {@code PBEKeySpec} cannot represent.</p>
 *
 * @since 0.1.0
 */
final class BackupCrypto {
  static final String HMAC_SHA256 = "HmacSHA256";
  static final String HMAC_SHA1 = "HmacSHA1";

  private static final int BLOCK = 16;
  private static final byte[] ZERO_IV = new byte[BLOCK];

  private BackupCrypto() {
    // Utility
  }

  /**
   * Derives a key with PBKDF2.
   *
   * @param macAlgorithm {@link #HMAC_SHA256} or {@link #HMAC_SHA1}
   * @param password raw password bytes; must not be empty
   * @param salt salt
   * @param iterations iteration count; must be positive
   * @param length derived key length in bytes
   * @return derived key
   * @throws GeneralSecurityException when the MAC is unavailable
   */
  static byte[] pbkdf2(String macAlgorithm, byte[] password, byte[] salt, int iterations, int length)
      throws GeneralSecurityException {
    if (password == null || password.length == 0) {
      throw new IllegalArgumentException("password must not be empty");
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be positive");
    }
    Mac mac = Mac.getInstance(macAlgorithm);
    mac.init(new SecretKeySpec(password, macAlgorithm));
    int hashLength = mac.getMacLength();
    int blocks = (length + hashLength - 1) / hashLength;
    byte[] derived = new byte[blocks * hashLength];
    for (int block = 1; block <= blocks; block++) {
      mac.update(salt);
      mac.update(ByteBuffer.allocate(4).putInt(block).array());
      byte[] u = mac.doFinal();
      byte[] t = u.clone();
      for (int i = 1; i < iterations; i++) {
        u = mac.doFinal(u);
        for (int j = 0; j < t.length; j++) {
          t[j] ^= u[j];
        }
      }
      System.arraycopy(t, 0, derived, (block - 1) * hashLength, hashLength);
    }
    return Arrays.copyOf(derived, length);
  }

  /**
   * Unwraps an RFC 3394 wrapped AES key.
   *
   * @param kek key-encryption key
   * @param wrapped wrapped key bytes
   * @return unwrapped key
   * @throws GeneralSecurityException when the integrity check fails
   */
  static byte[] unwrap(byte[] kek, byte[] wrapped) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance("AESWrap");
    cipher.init(Cipher.UNWRAP_MODE, new SecretKeySpec(kek, "AES"));
    return cipher.unwrap(wrapped, "AES", Cipher.SECRET_KEY).getEncoded();
  }

  /**
   * Decrypts a whole buffer with AES-CBC and a zero IV, without padding removal.
   *
   * @param key AES key
   * @param data ciphertext whose length is a multiple of the block size
   * @return plaintext
   * @throws GeneralSecurityException when the length is not block aligned
   */
  static byte[] decryptUnpadded(byte[] key, byte[] data) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance("AES/CBC/NoPadding");
    cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(ZERO_IV));
    return cipher.doFinal(data);
  }

  /**
   * Streams a PKCS#7 padded AES-CBC file body with a zero IV into {@code out}.
   *
   * @param key AES key
   * @param in ciphertext
   * @param out plaintext sink
   * @return plaintext bytes written
   * @throws IOException when reading or writing fails
   * @throws GeneralSecurityException when the key or padding is wrong
   */
  static long decryptPadded(byte[] key, InputStream in, OutputStream out)
      throws IOException, GeneralSecurityException {
    Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
    cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(ZERO_IV));
    byte[] buffer = new byte[64 * 1024];
    long written = 0;
    int read;
    while ((read = in.read(buffer)) != -1) {
      byte[] chunk = cipher.update(buffer, 0, read);
      if (chunk != null && chunk.length > 0) {
        out.write(chunk);
        written += chunk.length;
      }
    }
    byte[] tail = cipher.doFinal();
    out.write(tail);
    return written + tail.length;
  }
}
