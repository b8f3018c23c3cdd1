package net.coffeetariat.rsadigest;

import java.math.BigInteger;

/**
 * Public projection of an {@link RsaKey}.
 *
 * <p>Note the exponent convention: the public projection carries {@code d}, and the
 * private projection carries {@code e}. Bytes are encrypted and signatures verified with
 * this projection.</p>
 *
 * @param n the modulus
 * @param d the exponent paired with {@link RsaPrivateKey#e()}
 * @param keyLength bit-length of {@code n}
 */
public record RsaPublicKey(BigInteger n, BigInteger d, int keyLength) {
}
