package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.jose.JwsProtected;

/**
 * Public key able to verify signatures made by the matching {@link SigningKey}. Also the
 * handle by which JWE recipients are addressed.
 */
public interface VerificationKey {

  String keyId();

  KeyType keyType();

  Jwk publicKeyJwk();

  /**
   * Verifies a signature. Fails closed: a malformed signature, an algorithm that does not match
   * this key's type, or a bad signature all return false.
   *
   * @param signingInput    the bytes that were signed
   * @param signature       the signature
   * @param protectedHeader the decoded protected header naming the algorithm
   * @return true only for a valid signature
   */
  boolean verifySignature(byte[] signingInput, byte[] signature, JwsProtected protectedHeader);
}
