package com.codeheadsystems.envelope.did;

import com.codeheadsystems.envelope.jose.Jwk;

/**
 * Turns a DID or DID URL key id into public key material. Implementations backed by DID
 * document resolution live outside this library.
 * <p>
 * Implementations must be thread-safe.
 */
public interface KeyResolver {

  /**
   * Resolves public key material.
   *
   * @param didOrKeyId a DID, or a DID URL naming one of its keys
   * @return the public JWK, with kid set to the resolved key id
   * @throws com.codeheadsystems.envelope.exceptions.EnvelopeException KEY_NOT_FOUND when the
   *                                                                   key cannot be resolved
   */
  Jwk resolve(String didOrKeyId);
}
