package net.coffeetariat.rsadigest.lib;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrimalityTesterTest {

  private static final BigInteger CARMICHAEL_561 = BigInteger.valueOf(561);

  private final PrimalityTester tester = new PrimalityTester(new Random(20240917L));

  @Test
  void knownPrimesArePrime() {
    for (int trial = 0; trial < 25; trial++) {
      for (long prime : new long[]{2, 3, 5, 97, 104729}) {
        assertTrue(tester.isProbablePrime(BigInteger.valueOf(prime), PrimalityTester.ACCURACY),
            prime + " should be reported prime");
      }
    }
  }

  @Test
  void knownCompositesAreComposite() {
    for (int trial = 0; trial < 25; trial++) {
      for (long composite : new long[]{1, 4, 9, 100}) {
        assertFalse(tester.isProbablePrime(BigInteger.valueOf(composite), PrimalityTester.ACCURACY),
            composite + " should be reported composite");
      }
    }
  }

  @Test
  void zeroAndNegativeAreComposite() {
    assertFalse(tester.isProbablePrime(BigInteger.ZERO, 1));
    assertFalse(tester.isProbablePrime(BigInteger.valueOf(-7), 1));
  }

  @Test
  void carmichaelNumberIsRejectedByAWitness() {
    // draw 11 -> base 13, and (13/561) = -1 while 13^280 = 1 (mod 561)
    assertEquals(-1, PrimalityTester.jacobi(BigInteger.valueOf(13), CARMICHAEL_561));
    PrimalityTester scripted = new PrimalityTester(new ScriptedRandom(11));
    assertFalse(scripted.isProbablePrime(CARMICHAEL_561, PrimalityTester.ACCURACY));
  }

  @Test
  void carmichaelNumberIsAcceptedByASingleLiar() {
    // draw 0 -> base 2, an Euler liar for 561
    PrimalityTester scripted = new PrimalityTester(new ScriptedRandom(0));
    assertTrue(scripted.isProbablePrime(CARMICHAEL_561, 1));
  }

  @Test
  void firstPassingRoundWins() {
    assertTrue(new PrimalityTester(new ScriptedRandom(11, 11, 0)).isProbablePrime(CARMICHAEL_561, 3));
    assertFalse(new PrimalityTester(new ScriptedRandom(11, 11, 0)).isProbablePrime(CARMICHAEL_561, 2));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> tester.isProbablePrime(null, 5));
  }

  @Test
  void noRoundsMeansComposite() {
    assertFalse(tester.isProbablePrime(BigInteger.valueOf(97), 0));
    assertFalse(tester.isProbablePrime(BigInteger.valueOf(104729), -1));
    assertTrue(tester.isProbablePrime(BigInteger.TWO, 0));
  }

  @Test
  void jacobiMatchesKnownValues() {
    assertEquals(1, PrimalityTester.jacobi(BigInteger.valueOf(2), BigInteger.valueOf(7)));
    assertEquals(-1, PrimalityTester.jacobi(BigInteger.valueOf(3), BigInteger.valueOf(7)));
    assertEquals(0, PrimalityTester.jacobi(BigInteger.valueOf(3), BigInteger.valueOf(9)));
    assertEquals(-1, PrimalityTester.jacobi(BigInteger.valueOf(1001), BigInteger.valueOf(9907)));
    assertEquals(1, PrimalityTester.jacobi(BigInteger.valueOf(19), BigInteger.valueOf(45)));
    assertEquals(1, PrimalityTester.jacobi(BigInteger.valueOf(-1), BigInteger.valueOf(5)));
    assertEquals(-1, PrimalityTester.jacobi(BigInteger.valueOf(-1), BigInteger.valueOf(7)));
    assertEquals(1, PrimalityTester.jacobi(BigInteger.ZERO, BigInteger.ONE));
  }

  @Test
  void jacobiAgreesWithEulersCriterionForPrimes() {
    BigInteger p = BigInteger.valueOf(104729);
    BigInteger half = p.subtract(BigInteger.ONE).shiftRight(1);
    for (int a = 2; a < 200; a++) {
      BigInteger euler = BigInteger.valueOf(a).modPow(half, p);
      int expected = euler.equals(BigInteger.ONE) ? 1 : -1;
      assertEquals(expected, PrimalityTester.jacobi(BigInteger.valueOf(a), p), "a = " + a);
    }
  }

  @Test
  void jacobiRejectsEvenModulus() {
    assertThrows(IllegalArgumentException.class, () -> PrimalityTester.jacobi(BigInteger.ONE, BigInteger.TEN));
    assertThrows(IllegalArgumentException.class, () -> PrimalityTester.jacobi(BigInteger.ONE, BigInteger.valueOf(-3)));
  }
}
