package net.coffeetariat.rsadigest.lib;

import java.util.Arrays;
import java.util.Random;

/**
 * A {@link Random} whose {@link #nextBytes(byte[])} yields a fixed sequence of small
 * values, so {@code new BigInteger(bits, random)} draws are predictable. The values are
 * cycled; each draw puts the value in the least significant byte.
 */
class ScriptedRandom extends Random {

  private final int[] values;
  private int next;

  ScriptedRandom(int... values) {
    if (values.length == 0) throw new IllegalArgumentException("no values");
    this.values = values.clone();
  }

  @Override
  public void nextBytes(byte[] bytes) {
    Arrays.fill(bytes, (byte) 0);
    if (bytes.length > 0) {
      bytes[bytes.length - 1] = (byte) values[next++ % values.length];
    }
  }
}
