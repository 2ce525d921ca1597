package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.Jws;
import com.codeheadsystems.envelope.jose.JwsCodec;
import com.codeheadsystems.envelope.jose.JwsProtected;

/**
 * A key that can produce JWS signatures.
 */
public interface SigningKey extends AgentKey {

  /**
   * Signs raw bytes with the key's native algorithm. ECDSA output is the fixed-width
   * {@code R || S} JOSE form.
   *
   * @param data the signing input
   * @return the signature
   */
  byte[] sign(byte[] data);

  default JwsAlgorithm recommendedJwsAlgorithm() {
    return keyType().jwsAlgorithm();
  }

  /**
   * Signs a payload into a general-serialization JWS.
   *
   * @param payload         the payload bytes
   * @param protectedHeader the protected header to use, or null for the default
   * @return the JWS
   */
  default Jws createJws(byte[] payload, JwsProtected protectedHeader) {
    return JwsCodec.sign(this, payload, protectedHeader);
  }
}
