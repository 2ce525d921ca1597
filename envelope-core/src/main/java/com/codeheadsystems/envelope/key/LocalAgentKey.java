package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.did.DidKey;
import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An agent key whose private material lives in this process. Instances are immutable and the
 * only way to obtain the private key is {@link #exportPrivateJwk()}.
 * <p>
 * The set of implementations is closed: {@link Ed25519AgentKey} (signing only) and
 * {@link EcAgentKey} (signing and ECDH encryption). Which capability interfaces a key implements
 * is therefore known at compile time.
 */
public abstract class LocalAgentKey implements SigningKey, VerificationKey {

  private static final Logger log = LoggerFactory.getLogger(LocalAgentKey.class);

  private final String keyId;
  private final String did;
  private final KeyType keyType;

  LocalAgentKey(String keyId, String did, KeyType keyType) {
    this.keyId = keyId;
    this.did = did;
    this.keyType = keyType;
  }

  // ─── Factories ────────────────────────────────────────────────────────────

  public static LocalAgentKey generate(KeyType keyType) {
    return generate(keyType, new RandomProvider());
  }

  /**
   * Generates a fresh key identified by its did:key DID.
   *
   * @param keyType        the key type
   * @param randomProvider the random source for the key and, for EC keys, later encryption
   * @return the key
   */
  public static LocalAgentKey generate(KeyType keyType, RandomProvider randomProvider) {
    log.debug("generate(keyType={})", keyType);
    return switch (keyType) {
      case ED25519 -> Ed25519AgentKey.generate(null, null, randomProvider);
      case P256, SECP256K1 -> EcAgentKey.generate(keyType, null, null, randomProvider);
    };
  }

  /**
   * Imports raw private key bytes, naming the key by its did:key DID.
   *
   * @param keyType        the key type
   * @param privateKey     32-byte Ed25519 seed or big-endian EC scalar
   * @param randomProvider the random source
   * @return the key
   */
  public static LocalAgentKey fromPrivateKey(KeyType keyType, byte[] privateKey,
                                             RandomProvider randomProvider) {
    return fromPrivateKey(keyType, privateKey, null, null, randomProvider);
  }

  /**
   * Imports raw private key bytes under a caller-chosen DID and key id. Either may be null, in
   * which case the did:key DID and its default key id are used.
   *
   * @param keyType        the key type
   * @param privateKey     32-byte Ed25519 seed or big-endian EC scalar
   * @param did            the DID, or null
   * @param keyId          the key id, or null
   * @param randomProvider the random source
   * @return the key
   */
  public static LocalAgentKey fromPrivateKey(KeyType keyType, byte[] privateKey, String did,
                                             String keyId, RandomProvider randomProvider) {
    log.debug("fromPrivateKey(keyType={}, keyId={})", keyType, keyId);
    return switch (keyType) {
      case ED25519 -> Ed25519AgentKey.importSeed(privateKey, did, keyId);
      case P256, SECP256K1 -> EcAgentKey.importScalar(keyType, privateKey, did, keyId, randomProvider);
    };
  }

  /**
   * Imports a private JWK as produced by {@link #exportPrivateJwk()}.
   *
   * @param jwk            a JWK with its "d" member
   * @param did            the DID, or null for did:key
   * @param randomProvider the random source
   * @return the key
   */
  public static LocalAgentKey fromJwk(Jwk jwk, String did, RandomProvider randomProvider) {
    if (!jwk.isPrivate()) {
      throw EnvelopeException.invalidKey("JWK has no private key");
    }
    byte[] d = Base64Url.decode(jwk.d(), "d");
    LocalAgentKey key = fromPrivateKey(KeyType.fromJwk(jwk), d, did, jwk.kid(), randomProvider);
    Jwk derived = key.publicKeyJwk();
    if (!derived.x().equals(jwk.x()) || (derived.y() != null && !derived.y().equals(jwk.y()))) {
      throw EnvelopeException.invalidKey("JWK public members do not match its private key");
    }
    return key;
  }

  // ─── AgentKey ─────────────────────────────────────────────────────────────

  @Override
  public String keyId() {
    return keyId;
  }

  @Override
  public String did() {
    return did;
  }

  @Override
  public KeyType keyType() {
    return keyType;
  }

  /**
   * Audited export of the private key. Every call is logged with the key id.
   *
   * @return the private JWK
   */
  public Jwk exportPrivateJwk() {
    log.warn("Exporting private key material for {}", keyId);
    byte[] d = privateKeyBytes();
    return publicKeyJwk().withD(Base64Url.encode(d));
  }

  /**
   * A public-only handle to this key, suitable for handing to other agents.
   *
   * @return the verification key
   */
  public PublicVerificationKey toPublicKey() {
    return PublicVerificationKey.fromJwk(keyId, publicKeyJwk());
  }

  protected abstract byte[] privateKeyBytes();

  static String didOrDefault(String did, KeyType keyType, byte[] publicKey) {
    return did != null ? did : DidKey.encode(keyType, publicKey);
  }

  static String keyIdOrDefault(String keyId, String did) {
    if (keyId != null) {
      return keyId;
    }
    return DidKey.isDidKey(did) ? DidKey.keyIdFor(did) : did + "#keys-1";
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[keyId=" + keyId + ", keyType=" + keyType + "]";
  }
}
