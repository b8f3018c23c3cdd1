package net.coffeetariat.rsadigest.lib;

import java.math.BigInteger;

/**
 * Derives the exponent pair {@code (e, d)} for two primes.
 */
public final class ExponentGenerator {

  /** The only exponent this project issues. */
  public static final BigInteger PUBLIC_EXPONENT = BigInteger.valueOf(65537);

  /** Result of {@link #generate(BigInteger, BigInteger)}. */
  public record ExponentPair(BigInteger e, BigInteger d) {}

  private ExponentGenerator() {
  }

  /**
   * Computes {@code e = 65537} and {@code d = e^-1 mod (p - 1)(q - 1)}.
   *
   * <p>A failed {@code (e * d) mod phi == 1} check after inversion is reported on
   * {@code System.err} and does not fail the call.</p>
   *
   * @throws IllegalArgumentException if {@code p} or {@code q} is null
   * @throws ArithmeticException if {@code e} is not coprime with {@code phi}
   */
  public static ExponentPair generate(BigInteger p, BigInteger q) {
    if (p == null || q == null)
      throw new IllegalArgumentException("p and q must not be null");

    BigInteger phi = p.subtract(BigInteger.ONE).multiply(q.subtract(BigInteger.ONE));
    BigInteger e = PUBLIC_EXPONENT;

    if (!e.gcd(phi).equals(BigInteger.ONE))
      throw new ArithmeticException("gcd(e, phi) != 1: e is not invertible modulo " + phi);

    BigInteger d = e.modInverse(phi);

    if (!e.multiply(d).mod(phi).equals(BigInteger.ONE)) {
      System.err.println("warning: (e * d) % phi != 1 for phi = " + Utilities.toHexLiteral(phi));
    }
    return new ExponentPair(e, d);
  }
}
