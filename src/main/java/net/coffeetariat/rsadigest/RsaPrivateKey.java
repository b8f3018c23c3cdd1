package net.coffeetariat.rsadigest;

import java.math.BigInteger;

/**
 * Private projection of an {@link RsaKey}: the modulus and {@code e}.
 * Used to decrypt token streams and to sign digests.
 *
 * @param n the modulus
 * @param e the exponent paired with {@link RsaPublicKey#d()}
 * @param keyLength bit-length of {@code n}
 */
public record RsaPrivateKey(BigInteger n, BigInteger e, int keyLength) {
}
