package net.coffeetariat.rsadigest.lib;

import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Signs and verifies data by running its SHA-512 digest through {@link ModularTransform}.
 *
 * <p>A signature is the token stream of the 64 digest bytes, encrypted with the private
 * projection. Verification decrypts it with the public projection and compares bytes.</p>
 */
public final class DigestSigner {

  private static final String DIGEST_ALGORITHM = "SHA-512";

  private DigestSigner() {
  }

  /**
   * Writes the signature tokens for {@code data} to {@code out}.
   *
   * @throws NullPointerException if any argument is null
   */
  public static void sign(InputStream data, RsaPrivateKey key, OutputStream out) throws IOException {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(out, "out");
    byte[] digest = digest(data);
    ModularTransform.encrypt(new ByteArrayInputStream(digest), out, key.e(), key.n());
  }

  /**
   * Checks a signature produced by {@link #sign}.
   *
   * @return {@code true} if the signature decrypts to the digest of {@code data};
   *         {@code false} on mismatch or on malformed signature tokens
   */
  public static boolean verify(InputStream data, InputStream signature, RsaPublicKey key) throws IOException {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(key, "key");
    byte[] expected = digest(data);

    ByteArrayOutputStream recovered = new ByteArrayOutputStream(expected.length);
    try {
      ModularTransform.decrypt(signature, recovered, key.d(), key.n());
    } catch (MalformedTokenException e) {
      return false;
    }
    return MessageDigest.isEqual(expected, recovered.toByteArray());
  }

  private static byte[] digest(InputStream data) throws IOException {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance(DIGEST_ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
    }
    byte[] buffer = new byte[8192];
    int read;
    while ((read = data.read(buffer)) != -1) {
      md.update(buffer, 0, read);
    }
    return md.digest();
  }
}
