package com.codeheadsystems.envelope.manager;

import com.codeheadsystems.envelope.key.AgentKey;
import com.codeheadsystems.envelope.key.DecryptionKey;
import com.codeheadsystems.envelope.key.EncryptionKey;
import com.codeheadsystems.envelope.key.SigningKey;
import com.codeheadsystems.envelope.key.VerificationKey;
import java.util.List;

/**
 * Lookup of an agent's keys by key id, narrowed to the capability the caller needs.
 * <p>
 * Implementations must be thread-safe. Lookups for a capability the key does not have fail
 * with UNSUPPORTED_ALGORITHM; unknown ids fail with KEY_NOT_FOUND.
 */
public interface KeyManager {

  void addKey(AgentKey key);

  /**
   * Removes a local key.
   *
   * @param keyId the key id
   * @return true if a key was removed
   */
  boolean removeKey(String keyId);

  boolean hasKey(String keyId);

  /**
   * Ids of the local keys, sorted.
   *
   * @return the key ids
   */
  List<String> listKeys();

  AgentKey getKey(String keyId);

  SigningKey getSigningKey(String keyId);

  EncryptionKey getEncryptionKey(String keyId);

  DecryptionKey getDecryptionKey(String keyId);

  /**
   * Finds a key able to verify signatures by the given key id: a local key, a registered
   * public key, or one from the fallback resolver.
   *
   * @param keyId the key id
   * @return the verification key
   */
  VerificationKey resolveVerificationKey(String keyId);
}
