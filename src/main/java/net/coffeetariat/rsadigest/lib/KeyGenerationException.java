package net.coffeetariat.rsadigest.lib;

import java.security.GeneralSecurityException;

/**
 * Thrown when key material cannot be produced: the exponent is not invertible for the
 * chosen primes, or a caller-imposed attempt limit ran out.
 */
public class KeyGenerationException extends GeneralSecurityException {

  public KeyGenerationException(String message) {
    super(message);
  }

  public KeyGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
