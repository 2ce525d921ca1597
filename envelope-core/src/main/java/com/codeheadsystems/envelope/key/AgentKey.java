package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.Jwk;

/**
 * A key held by an agent. What else it can do is expressed by the capability interfaces it
 * implements: {@link SigningKey}, {@link VerificationKey}, {@link EncryptionKey} and
 * {@link DecryptionKey}.
 */
public interface AgentKey {

  /**
   * Stable identifier chosen by the owner, usually a DID URL such as {@code did:key:z...#z...}.
   *
   * @return the key id
   */
  String keyId();

  /**
   * The DID this key authenticates as.
   *
   * @return the did
   */
  String did();

  KeyType keyType();

  /**
   * Public key material, safe to share.
   *
   * @return the public JWK, with kid set to {@link #keyId()}
   */
  Jwk publicKeyJwk();
}
