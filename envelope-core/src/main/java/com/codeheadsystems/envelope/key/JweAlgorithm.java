package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;

/**
 * JWE key management ("alg") and content encryption ("enc") pair used by the envelope.
 */
public enum JweAlgorithm {
  ECDH_ES_A256KW("ECDH-ES+A256KW", "A256GCM");

  private final String alg;
  private final String enc;

  JweAlgorithm(String alg, String enc) {
    this.alg = alg;
    this.enc = enc;
  }

  public String alg() {
    return alg;
  }

  public String enc() {
    return enc;
  }

  /**
   * Matches a protected header's alg and enc.
   *
   * @param alg the alg value
   * @param enc the enc value
   * @return the pair
   */
  public static JweAlgorithm fromValues(String alg, String enc) {
    for (JweAlgorithm candidate : values()) {
      if (candidate.alg.equals(alg) && candidate.enc.equals(enc)) {
        return candidate;
      }
    }
    throw EnvelopeException.unsupportedAlgorithm("unsupported JWE algorithm: " + alg + "/" + enc);
  }
}
