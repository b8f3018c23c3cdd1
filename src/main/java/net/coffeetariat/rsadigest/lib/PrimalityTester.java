package net.coffeetariat.rsadigest.lib;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Random;

/**
 * Solovay-Strassen probabilistic primality test.
 *
 * <p>Each round draws a random base {@code a} from {@code [2, n - 2]} and checks Euler's
 * criterion {@code a^((n-1)/2) = (a/n) (mod n)}. The loop reports "prime" as soon as one
 * round satisfies the criterion, so a single liar base is enough for a composite to be
 * accepted. Rounds only add chances to find such a base. This is the known soundness
 * gap of the generator's test and is kept as is; {@link #ACCURACY} rounds are used for
 * key generation.</p>
 */
public final class PrimalityTester {

  /** Round count used when generating primes. */
  public static final int ACCURACY = 20;

  private static final BigInteger TWO = BigInteger.TWO;
  private static final BigInteger THREE = BigInteger.valueOf(3);

  private final Random random;

  public PrimalityTester(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Tests {@code n} for primality.
   *
   * @param n value to test
   * @param rounds maximum number of random bases to try; with none, an odd {@code n > 3}
   *               is reported composite
   * @return {@code true} if {@code n} is probably prime, {@code false} if composite
   * @throws IllegalArgumentException if {@code n} is null
   */
  public boolean isProbablePrime(BigInteger n, int rounds) {
    if (n == null)
      throw new IllegalArgumentException("n must not be null");

    if (n.compareTo(BigInteger.ONE) <= 0) return false;
    if (n.equals(TWO)) return true;
    if (!n.testBit(0)) return false;
    // [2, n - 2] is empty for n = 3
    if (n.equals(THREE)) return true;

    BigInteger nMinusOne = n.subtract(BigInteger.ONE);
    BigInteger halfOrder = nMinusOne.shiftRight(1);
    BigInteger range = n.subtract(THREE);

    for (int i = 0; i < rounds; i++) {
      BigInteger a = Utilities.randomBelow(range, random).add(TWO);

      int j = jacobi(a, n);
      BigInteger x = j == -1 ? nMinusOne : BigInteger.valueOf(j);

      if (x.signum() != 0 && a.modPow(halfOrder, n).equals(x)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Computes the Jacobi symbol {@code (a/n)}.
   *
   * @param a any integer
   * @param n odd positive modulus
   * @return -1, 0 or 1
   * @throws IllegalArgumentException if {@code n} is not odd and positive
   */
  public static int jacobi(BigInteger a, BigInteger n) {
    Objects.requireNonNull(a, "a");
    if (n == null || n.signum() <= 0 || !n.testBit(0))
      throw new IllegalArgumentException("Jacobi symbol needs an odd positive modulus: " + n);

    BigInteger x = a.mod(n);
    BigInteger m = n;
    int result = 1;

    while (x.signum() != 0) {
      int zeros = x.getLowestSetBit();
      x = x.shiftRight(zeros);
      int mMod8 = m.intValue() & 7;
      if ((zeros & 1) == 1 && (mMod8 == 3 || mMod8 == 5)) {
        result = -result;
      }

      // quadratic reciprocity
      BigInteger t = x;
      x = m;
      m = t;
      if ((x.intValue() & 3) == 3 && (m.intValue() & 3) == 3) {
        result = -result;
      }
      x = x.mod(m);
    }
    return m.equals(BigInteger.ONE) ? result : 0;
  }
}
