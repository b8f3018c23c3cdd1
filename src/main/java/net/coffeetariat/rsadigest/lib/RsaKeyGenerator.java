package net.coffeetariat.rsadigest.lib;

import net.coffeetariat.rsadigest.RsaKey;
import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Assembles textbook RSA keys and derives their projections.
 *
 * <p>Example usage:
 * <pre>
 *   RsaKeyGenerator generator = RsaKeyGenerator.createDefault();
 *   RsaKey key = generator.generate(2048);
 *   RsaPublicKey pub = RsaKeyGenerator.derivePublic(key);
 * </pre>
 */
public final class RsaKeyGenerator {

  public static final int DEFAULT_KEY_LENGTH = 2048;

  /**
   * Smallest length for which a modulus of exactly that many bits exists. A 2-bit request
   * never finds one and {@link #generate} would search forever, so callers taking lengths
   * from users reject anything shorter.
   */
  public static final int MIN_REACHABLE_KEY_LENGTH = 4;

  private final PrimePairGenerator primePairGenerator;

  public RsaKeyGenerator(Random random) {
    this(new PrimePairGenerator(random));
  }

  public RsaKeyGenerator(PrimePairGenerator primePairGenerator) {
    this.primePairGenerator = Objects.requireNonNull(primePairGenerator, "primePairGenerator");
  }

  /**
   * Creates a generator backed by the platform's strong {@link SecureRandom}.
   *
   * @throws GeneralSecurityException if no strong RNG is available
   */
  public static RsaKeyGenerator createDefault() throws GeneralSecurityException {
    return new RsaKeyGenerator(SecureRandom.getInstanceStrong());
  }

  /**
   * Generates a key whose modulus has exactly {@code keyLength} bits.
   *
   * @param keyLength the key length in bits; positive and even
   * @return a newly generated key
   * @throws IllegalArgumentException if keyLength is null, not positive or odd
   * @throws KeyGenerationException if the exponent cannot be inverted or the prime search gave up
   */
  public RsaKey generate(Integer keyLength) throws KeyGenerationException {
    if (keyLength == null)
      throw new IllegalArgumentException("key length must not be null");
    if (keyLength <= 0 || keyLength % 2 != 0)
      throw new IllegalArgumentException("key length must be a positive even number of bits: " + keyLength);

    PrimePairGenerator.PrimePair npq;
    try {
      npq = primePairGenerator.generate(keyLength);
    } catch (KeyGenerationException e) {
      throw new KeyGenerationException("failed to generate N, P, Q factors", e);
    }

    ExponentGenerator.ExponentPair ed;
    try {
      ed = ExponentGenerator.generate(npq.p(), npq.q());
    } catch (ArithmeticException e) {
      throw new KeyGenerationException("failed to generate E, D factors", e);
    }

    return new RsaKey(npq.n(), npq.p(), npq.q(), ed.e(), ed.d(), keyLength);
  }

  /**
   * Copies {@code n} and {@code d} of the key.
   *
   * @throws IllegalArgumentException if the key, its modulus or {@code d} is missing
   */
  public static RsaPublicKey derivePublic(RsaKey key) {
    if (key == null || key.n() == null || key.d() == null)
      throw new IllegalArgumentException("key has no modulus or no d exponent");
    return new RsaPublicKey(key.n(), key.d(), key.keyLength());
  }

  /**
   * Copies {@code n} and {@code e} of the key.
   *
   * @throws IllegalArgumentException if the key, its modulus or {@code e} is missing
   */
  public static RsaPrivateKey derivePrivate(RsaKey key) {
    if (key == null || key.n() == null || key.e() == null)
      throw new IllegalArgumentException("key has no modulus or no e exponent");
    return new RsaPrivateKey(key.n(), key.e(), key.keyLength());
  }
}
