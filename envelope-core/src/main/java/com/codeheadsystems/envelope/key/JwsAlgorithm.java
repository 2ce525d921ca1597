package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;

/**
 * JWS "alg" values this envelope signs and verifies with.
 */
public enum JwsAlgorithm {
  EDDSA("EdDSA"),
  ES256("ES256"),
  ES256K("ES256K");

  private final String value;

  JwsAlgorithm(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Parses a JWS "alg" header value.
   *
   * @param value the header value
   * @return the algorithm
   * @throws EnvelopeException UNSUPPORTED_ALGORITHM for anything else, "none" included
   */
  public static JwsAlgorithm fromValue(String value) {
    for (JwsAlgorithm alg : values()) {
      if (alg.value.equals(value)) {
        return alg;
      }
    }
    throw EnvelopeException.unsupportedAlgorithm("unsupported JWS algorithm: " + value);
  }
}
