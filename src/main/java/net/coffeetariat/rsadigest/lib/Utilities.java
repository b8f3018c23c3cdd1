package net.coffeetariat.rsadigest.lib;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Miscellaneous helper utilities for big-integer sampling and the hex literal format
 * shared by key dumps, key files and token streams.
 */
public final class Utilities {

  private static final String HEX_PREFIX = "0x";

  private Utilities() {
    // no instances
  }

  /**
   * Draws a value uniformly from {@code [0, bound)} by rejection sampling.
   *
   * @throws IllegalArgumentException if {@code bound} is not positive
   */
  public static BigInteger randomBelow(BigInteger bound, Random random) {
    Objects.requireNonNull(random, "random");
    if (bound == null || bound.signum() <= 0)
      throw new IllegalArgumentException("bound must be positive: " + bound);

    int bits = bound.bitLength();
    BigInteger r;
    do {
      r = new BigInteger(bits, random);
    } while (r.compareTo(bound) >= 0);
    return r;
  }

  /**
   * Draws a random value with exactly {@code bits} bits, i.e. the top bit is always set.
   *
   * @throws IllegalArgumentException if {@code bits < 1}
   */
  public static BigInteger randomWithBitLength(int bits, Random random) {
    Objects.requireNonNull(random, "random");
    if (bits < 1)
      throw new IllegalArgumentException("bit length must be positive: " + bits);
    return new BigInteger(bits, random).setBit(bits - 1);
  }

  /**
   * Formats a non-negative value as {@code 0x} followed by lowercase hex digits.
   */
  public static String toHexLiteral(BigInteger value) {
    Objects.requireNonNull(value, "value");
    return HEX_PREFIX + value.toString(16);
  }

  /**
   * Parses a hex literal with or without a {@code 0x}/{@code 0X} prefix.
   *
   * @throws NumberFormatException if the text is not a non-negative hex number
   */
  public static BigInteger parseHexLiteral(String text) {
    Objects.requireNonNull(text, "text");
    String s = text.trim();
    if (s.toLowerCase(Locale.ROOT).startsWith(HEX_PREFIX)) {
      s = s.substring(HEX_PREFIX.length());
    }
    if (s.isEmpty() || s.charAt(0) == '-' || s.charAt(0) == '+')
      throw new NumberFormatException("not a hex literal: '" + text + "'");
    return new BigInteger(s, 16);
  }
}
