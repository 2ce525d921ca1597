package com.codeheadsystems.envelope.rfc.common;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import java.security.SecureRandom;

/**
 * The random source behind generated agent keys, ephemeral ECDH keys, CEKs and IVs. One
 * instance may be shared by every thread.
 *
 * @param random the secure random
 */
public record RandomProvider(SecureRandom random) {

  public RandomProvider {
    if (random == null) {
      throw EnvelopeException.invalidParameter("a SecureRandom is required");
    }
  }

  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Draws fresh random bytes.
   *
   * @param count how many bytes
   * @return the bytes
   */
  public byte[] randomBytes(int count) {
    if (count < 0) {
      throw EnvelopeException.invalidParameter("negative byte count: " + count);
    }
    byte[] bytes = new byte[count];
    random.nextBytes(bytes);
    return bytes;
  }
}
