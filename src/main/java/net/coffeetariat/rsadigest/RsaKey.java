package net.coffeetariat.rsadigest;

import java.math.BigInteger;

/**
 * A full textbook RSA key: the modulus, its two secret prime factors and both exponents.
 *
 * <p>Keys produced by {@link net.coffeetariat.rsadigest.lib.RsaKeyGenerator} satisfy
 * {@code n = p * q}, {@code n.bitLength() == keyLength} and
 * {@code e * d = 1 (mod (p - 1)(q - 1))}. Keys read back from an incomplete
 * {@link KeyStoreYaml} entry may carry {@code null} members.</p>
 *
 * @param n the modulus
 * @param p first secret prime factor
 * @param q second secret prime factor
 * @param e the fixed exponent (65537)
 * @param d the inverse of {@code e} modulo {@code (p - 1)(q - 1)}
 * @param keyLength bit-length of {@code n}
 */
public record RsaKey(BigInteger n, BigInteger p, BigInteger q, BigInteger e, BigInteger d, int keyLength) {
}
