package com.codeheadsystems.envelope.manager;

import com.codeheadsystems.envelope.did.DidKeyResolver;
import com.codeheadsystems.envelope.did.KeyResolver;
import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.key.AgentKey;
import com.codeheadsystems.envelope.key.DecryptionKey;
import com.codeheadsystems.envelope.key.EncryptionKey;
import com.codeheadsystems.envelope.key.PublicVerificationKey;
import com.codeheadsystems.envelope.key.SigningKey;
import com.codeheadsystems.envelope.key.VerificationKey;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link KeyManager} backed by {@link ConcurrentHashMap}s. Keys are usually added once
 * at construction through the {@link Builder}; lookups need no locking.
 * <p>
 * Nothing is persisted. Key storage formats belong to the caller.
 */
@Singleton
public class AgentKeyManager implements KeyManager {

  private static final Logger log = LoggerFactory.getLogger(AgentKeyManager.class);

  private final ConcurrentHashMap<String, AgentKey> keys = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, VerificationKey> verificationKeys = new ConcurrentHashMap<>();
  private final KeyResolver resolver;

  /**
   * Instantiates a new manager.
   *
   * @param resolver fallback for verification keys that are neither local nor registered
   */
  @Inject
  public AgentKeyManager(final KeyResolver resolver) {
    log.info("AgentKeyManager()");
    log.warn("AgentKeyManager holds private keys in memory only; nothing is persisted");
    this.resolver = resolver;
  }

  public AgentKeyManager() {
    this(new DidKeyResolver());
  }

  public static Builder builder() {
    return new Builder();
  }

  // ─── Mutation ─────────────────────────────────────────────────────────────

  @Override
  public void addKey(AgentKey key) {
    keys.put(key.keyId(), key);
    log.debug("addKey(keyId={}, keyType={})", key.keyId(), key.keyType());
  }

  /**
   * Registers another agent's public key so it can be used without resolution.
   *
   * @param key the key
   */
  public void addVerificationKey(VerificationKey key) {
    verificationKeys.put(key.keyId(), key);
    log.debug("addVerificationKey(keyId={})", key.keyId());
  }

  @Override
  public boolean removeKey(String keyId) {
    boolean removed = keys.remove(keyId) != null;
    log.debug("removeKey(keyId={}) removed={}", keyId, removed);
    return removed;
  }

  // ─── Lookup ───────────────────────────────────────────────────────────────

  @Override
  public boolean hasKey(String keyId) {
    return keyId != null && keys.containsKey(keyId);
  }

  @Override
  public List<String> listKeys() {
    List<String> ids = new ArrayList<>(keys.keySet());
    ids.sort(null);
    return ids;
  }

  @Override
  public AgentKey getKey(String keyId) {
    AgentKey key = keyId == null ? null : keys.get(keyId);
    if (key == null) {
      throw EnvelopeException.keyNotFound(keyId);
    }
    return key;
  }

  @Override
  public SigningKey getSigningKey(String keyId) {
    if (getKey(keyId) instanceof SigningKey signingKey) {
      return signingKey;
    }
    throw EnvelopeException.unsupportedAlgorithm("key cannot sign: " + keyId);
  }

  @Override
  public EncryptionKey getEncryptionKey(String keyId) {
    if (getKey(keyId) instanceof EncryptionKey encryptionKey) {
      return encryptionKey;
    }
    throw EnvelopeException.unsupportedAlgorithm("key cannot encrypt: " + keyId);
  }

  @Override
  public DecryptionKey getDecryptionKey(String keyId) {
    if (getKey(keyId) instanceof DecryptionKey decryptionKey) {
      return decryptionKey;
    }
    throw EnvelopeException.unsupportedAlgorithm("key cannot decrypt: " + keyId);
  }

  @Override
  public VerificationKey resolveVerificationKey(String keyId) {
    if (keyId == null) {
      throw EnvelopeException.keyNotFound(null);
    }
    if (keys.get(keyId) instanceof VerificationKey local) {
      return local;
    }
    VerificationKey registered = verificationKeys.get(keyId);
    if (registered != null) {
      return registered;
    }
    log.debug("resolveVerificationKey({}): falling back to resolver", keyId);
    return PublicVerificationKey.fromJwk(keyId, resolver.resolve(keyId));
  }

  /**
   * Builder for an {@link AgentKeyManager} populated at construction.
   */
  public static class Builder {

    private final List<AgentKey> keys = new ArrayList<>();
    private final List<VerificationKey> verificationKeys = new ArrayList<>();
    private KeyResolver resolver = new DidKeyResolver();

    public Builder withKey(AgentKey key) {
      keys.add(key);
      return this;
    }

    public Builder withVerificationKey(VerificationKey key) {
      verificationKeys.add(key);
      return this;
    }

    public Builder withResolver(KeyResolver keyResolver) {
      this.resolver = keyResolver;
      return this;
    }

    public AgentKeyManager build() {
      AgentKeyManager manager = new AgentKeyManager(resolver);
      keys.forEach(manager::addKey);
      verificationKeys.forEach(manager::addVerificationKey);
      return manager;
    }
  }
}
