package net.coffeetariat.rsadigest.lib;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Random;

/**
 * Generates the modulus {@code n} and its two prime factors for a requested key length.
 *
 * <p>Candidates are first checked for the product's magnitude, which is cheap, before
 * paying for primality rounds. {@code p} and {@code q} are then resampled independently
 * until each passes {@link PrimalityTester}, and the product's bit-length is checked
 * again because resampling can move it. A failed final check starts over with both
 * factors discarded.</p>
 *
 * <p>By default the search is unbounded. Callers that need a liveness bound pass
 * {@code maxAttempts}, counted in outer iterations.</p>
 */
public final class PrimePairGenerator {

  /** The three numbers produced by {@link #generate(int)}. */
  public record PrimePair(BigInteger n, BigInteger p, BigInteger q) {}

  private final Random random;
  private final PrimalityTester tester;
  private final long maxAttempts;

  public PrimePairGenerator(Random random) {
    this(random, new PrimalityTester(random), Long.MAX_VALUE);
  }

  public PrimePairGenerator(Random random, PrimalityTester tester, long maxAttempts) {
    this.random = Objects.requireNonNull(random, "random");
    this.tester = Objects.requireNonNull(tester, "tester");
    if (maxAttempts < 1)
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    this.maxAttempts = maxAttempts;
  }

  /**
   * Generates {@code (n, p, q)} with {@code n = p * q}, {@code p} and {@code q} probable
   * primes of {@code targetBitLength / 2} bits and {@code n} of exactly
   * {@code targetBitLength} bits.
   *
   * @throws IllegalArgumentException if {@code targetBitLength} is not positive and even
   * @throws KeyGenerationException if the attempt limit is reached
   */
  public PrimePair generate(int targetBitLength) throws KeyGenerationException {
    if (targetBitLength <= 0 || targetBitLength % 2 != 0)
      throw new IllegalArgumentException("key length must be a positive even number of bits: " + targetBitLength);

    int half = targetBitLength / 2;

    for (long attempt = 0; attempt < maxAttempts; attempt++) {
      BigInteger p = Utilities.randomWithBitLength(half, random);
      BigInteger q = Utilities.randomWithBitLength(half, random);
      if (p.multiply(q).bitLength() != targetBitLength) continue;

      p = randomPrime(half);
      q = randomPrime(half);

      BigInteger n = p.multiply(q);
      if (n.bitLength() == targetBitLength) {
        return new PrimePair(n, p, q);
      }
    }
    throw new KeyGenerationException("generation exhausted after " + maxAttempts
        + " attempts for a " + targetBitLength + "-bit modulus");
  }

  private BigInteger randomPrime(int bits) {
    BigInteger candidate;
    do {
      candidate = Utilities.randomWithBitLength(bits, random);
    } while (!tester.isProbablePrime(candidate, PrimalityTester.ACCURACY));
    return candidate;
  }
}
