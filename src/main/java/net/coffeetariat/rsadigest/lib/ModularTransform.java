package net.coffeetariat.rsadigest.lib;

import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Per-byte modular exponentiation and the token stream format built on it.
 *
 * <p>Encryption turns every input byte into one line holding {@code 0x}-prefixed lowercase
 * hex. Decryption reads such lines back, one output byte per token. No padding is applied:
 * each byte is exponentiated as is, so the modulus must exceed 255 for every byte value to
 * survive a round trip. The streams passed in are neither buffered externally nor closed
 * here.</p>
 */
public final class ModularTransform {

  private static final BigInteger BYTE_LIMIT = BigInteger.valueOf(256);

  private ModularTransform() {
  }

  /**
   * Computes {@code unit^exponent mod modulus}.
   *
   * @throws IllegalArgumentException unless {@code 0 <= unit < modulus}, {@code exponent > 0}
   *                                  and {@code modulus > 0}
   */
  public static BigInteger transform(BigInteger unit, BigInteger exponent, BigInteger modulus) {
    if (unit == null || exponent == null || modulus == null)
      throw new IllegalArgumentException("unit, exponent and modulus are required");
    if (modulus.signum() <= 0)
      throw new IllegalArgumentException("modulus must be positive");
    if (exponent.signum() <= 0)
      throw new IllegalArgumentException("exponent must be positive");
    if (unit.signum() < 0 || unit.compareTo(modulus) >= 0)
      throw new IllegalArgumentException("unit must be in [0, modulus)");
    return unit.modPow(exponent, modulus);
  }

  /** Encrypts {@code in} with the public projection. */
  public static long encrypt(InputStream in, OutputStream out, RsaPublicKey key) throws IOException {
    Objects.requireNonNull(key, "key");
    return encrypt(in, out, key.d(), key.n());
  }

  /** Decrypts a token stream with the private projection. */
  public static long decrypt(InputStream in, OutputStream out, RsaPrivateKey key) throws IOException {
    Objects.requireNonNull(key, "key");
    return decrypt(in, out, key.e(), key.n());
  }

  /**
   * Writes one token line per byte of {@code in}. Tokens produced before a failure are
   * still flushed to {@code out}.
   *
   * @return the number of bytes consumed
   * @throws IllegalArgumentException if a byte is not below {@code modulus}
   */
  public static long encrypt(InputStream in, OutputStream out, BigInteger exponent, BigInteger modulus)
      throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(out, "out");

    InputStream bin = new BufferedInputStream(in);
    Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.US_ASCII));
    long units = 0;
    try {
      int b;
      while ((b = bin.read()) != -1) {
        BigInteger c = transform(BigInteger.valueOf(b), exponent, modulus);
        writer.write(Utilities.toHexLiteral(c));
        writer.write('\n');
        units++;
      }
    } finally {
      writer.flush();
    }
    return units;
  }

  /**
   * Reads token lines from {@code in} and writes the recovered bytes to {@code out}.
   * Blank lines are skipped.
   *
   * @return the number of bytes written
   * @throws MalformedTokenException if a line is not a hex literal in {@code [0, modulus)}
   *                                 or does not decrypt to a byte value
   */
  public static long decrypt(InputStream in, OutputStream out, BigInteger exponent, BigInteger modulus)
      throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(out, "out");
    if (exponent == null || modulus == null)
      throw new IllegalArgumentException("exponent and modulus are required");

    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII));
    long lineNumber = 0;
    long units = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) continue;

      BigInteger c;
      try {
        c = Utilities.parseHexLiteral(line);
      } catch (NumberFormatException e) {
        throw new MalformedTokenException(lineNumber, "not a hex token: '" + line.trim() + "'", e);
      }
      if (c.compareTo(modulus) >= 0)
        throw new MalformedTokenException(lineNumber, "token is not below the modulus");

      BigInteger m = transform(c, exponent, modulus);
      if (m.compareTo(BYTE_LIMIT) >= 0)
        throw new MalformedTokenException(lineNumber, "token does not decrypt to a byte");

      out.write(m.intValue());
      units++;
    }
    out.flush();
    return units;
  }
}
