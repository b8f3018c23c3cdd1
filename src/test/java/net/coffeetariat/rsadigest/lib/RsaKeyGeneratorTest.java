package net.coffeetariat.rsadigest.lib;

import net.coffeetariat.rsadigest.RsaKey;
import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RsaKeyGeneratorTest {

  private static final List<RsaKey> KEYS = new ArrayList<>();

  @BeforeAll
  static void generateKeys() throws Exception {
    RsaKeyGenerator generator = new RsaKeyGenerator(new Random(1337L));
    for (int bits : new int[]{64, 64, 96, 128}) {
      KEYS.add(generator.generate(bits));
    }
  }

  @Test
  void modulusIsProductWithRequestedLength() {
    int[] expected = {64, 64, 96, 128};
    for (int i = 0; i < KEYS.size(); i++) {
      RsaKey key = KEYS.get(i);
      assertEquals(expected[i], key.keyLength());
      assertEquals(expected[i], key.n().bitLength());
      assertEquals(key.p().multiply(key.q()), key.n());
    }
  }

  @Test
  void exponentsAreInverseModuloPhi() {
    for (RsaKey key : KEYS) {
      BigInteger phi = key.p().subtract(BigInteger.ONE).multiply(key.q().subtract(BigInteger.ONE));
      assertEquals(ExponentGenerator.PUBLIC_EXPONENT, key.e());
      assertEquals(BigInteger.ONE, key.e().gcd(phi));
      assertEquals(BigInteger.ONE, key.e().multiply(key.d()).mod(phi));
    }
  }

  @Test
  void everyByteRoundTripsInBothDirections() {
    for (RsaKey key : KEYS) {
      for (int m = 0; m <= 255; m++) {
        BigInteger unit = BigInteger.valueOf(m);
        BigInteger viaE = ModularTransform.transform(unit, key.e(), key.n());
        assertEquals(unit, ModularTransform.transform(viaE, key.d(), key.n()));
        BigInteger viaD = ModularTransform.transform(unit, key.d(), key.n());
        assertEquals(unit, ModularTransform.transform(viaD, key.e(), key.n()));
      }
    }
  }

  @Test
  void derivationIsRepeatableAndCopiesFields() {
    RsaKey key = KEYS.get(0);

    RsaPublicKey pub1 = RsaKeyGenerator.derivePublic(key);
    RsaPublicKey pub2 = RsaKeyGenerator.derivePublic(key);
    assertEquals(pub1, pub2);
    assertNotSame(pub1, pub2);
    assertEquals(key.n(), pub1.n());
    assertEquals(key.d(), pub1.d());
    assertEquals(key.keyLength(), pub1.keyLength());

    RsaPrivateKey priv1 = RsaKeyGenerator.derivePrivate(key);
    RsaPrivateKey priv2 = RsaKeyGenerator.derivePrivate(key);
    assertEquals(priv1, priv2);
    assertEquals(key.n(), priv1.n());
    assertEquals(key.e(), priv1.e());
    assertEquals(key.keyLength(), priv1.keyLength());
  }

  @Test
  void derivationRejectsIncompleteKeys() {
    RsaKey noModulus = new RsaKey(null, BigInteger.TWO, BigInteger.TWO, BigInteger.ONE, BigInteger.ONE, 4);
    RsaKey noD = new RsaKey(BigInteger.TEN, BigInteger.TWO, BigInteger.TWO, BigInteger.ONE, null, 4);
    RsaKey noE = new RsaKey(BigInteger.TEN, BigInteger.TWO, BigInteger.TWO, null, BigInteger.ONE, 4);

    assertThrows(IllegalArgumentException.class, () -> RsaKeyGenerator.derivePublic(null));
    assertThrows(IllegalArgumentException.class, () -> RsaKeyGenerator.derivePublic(noModulus));
    assertThrows(IllegalArgumentException.class, () -> RsaKeyGenerator.derivePublic(noD));
    assertThrows(IllegalArgumentException.class, () -> RsaKeyGenerator.derivePrivate(null));
    assertThrows(IllegalArgumentException.class, () -> RsaKeyGenerator.derivePrivate(noModulus));
    assertThrows(IllegalArgumentException.class, () -> RsaKeyGenerator.derivePrivate(noE));
    // each projection only needs its own exponent
    assertEquals(BigInteger.ONE, RsaKeyGenerator.derivePrivate(noD).e());
    assertEquals(BigInteger.ONE, RsaKeyGenerator.derivePublic(noE).d());
  }

  @Test
  void rejectsNullZeroAndOddLengths() {
    RsaKeyGenerator generator = new RsaKeyGenerator(new Random(2L));
    assertThrows(IllegalArgumentException.class, () -> generator.generate(null));
    assertThrows(IllegalArgumentException.class, () -> generator.generate(0));
    assertThrows(IllegalArgumentException.class, () -> generator.generate(65));
    assertThrows(IllegalArgumentException.class, () -> generator.generate(-64));
  }

  @Test
  void exhaustedPrimeSearchFailsGeneration() {
    Random random = new Random(9L);
    RsaKeyGenerator generator = new RsaKeyGenerator(
        new PrimePairGenerator(random, new PrimalityTester(random), 3));
    KeyGenerationException e = assertThrows(KeyGenerationException.class, () -> generator.generate(2));
    assertInstanceOf(KeyGenerationException.class, e.getCause());
  }

  @Test
  void sixtyFourBitKeyEncryptsAndDecryptsBytes() throws Exception {
    Random random = new Random(64L);
    RsaKey key = new RsaKeyGenerator(random).generate(64);

    assertEquals(64, key.n().bitLength());
    assertEquals(32, key.p().bitLength());
    assertEquals(32, key.q().bitLength());
    PrimalityTester tester = new PrimalityTester(random);
    assertTrue(tester.isProbablePrime(key.p(), PrimalityTester.ACCURACY));
    assertTrue(tester.isProbablePrime(key.q(), PrimalityTester.ACCURACY));

    byte[] message = {0, 1, (byte) 255, 65};
    ByteArrayOutputStream tokens = new ByteArrayOutputStream();
    assertEquals(4, ModularTransform.encrypt(new ByteArrayInputStream(message), tokens,
        RsaKeyGenerator.derivePublic(key)));

    ByteArrayOutputStream recovered = new ByteArrayOutputStream();
    assertEquals(4, ModularTransform.decrypt(new ByteArrayInputStream(tokens.toByteArray()), recovered,
        RsaKeyGenerator.derivePrivate(key)));
    assertArrayEquals(message, recovered.toByteArray());
  }
}
