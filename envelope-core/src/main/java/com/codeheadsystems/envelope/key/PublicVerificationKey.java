package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.jose.JwsProtected;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Public-only key of another agent, built from a JWK (typically from DID resolution). Any
 * private member of the source JWK is discarded.
 */
public class PublicVerificationKey implements VerificationKey {

  private final String keyId;
  private final KeyType keyType;
  private final Jwk jwk;
  private final Ed25519PublicKeyParameters ed25519Key;
  private final ECPoint ecPoint;

  private PublicVerificationKey(String keyId, KeyType keyType, Jwk jwk,
                                Ed25519PublicKeyParameters ed25519Key, ECPoint ecPoint) {
    this.keyId = keyId;
    this.keyType = keyType;
    this.jwk = jwk;
    this.ed25519Key = ed25519Key;
    this.ecPoint = ecPoint;
  }

  /**
   * Validates and wraps a public JWK.
   *
   * @param keyId the key id, or null to use the JWK's kid
   * @param jwk   the JWK
   * @return the key
   */
  public static PublicVerificationKey fromJwk(String keyId, Jwk jwk) {
    String id = keyId != null ? keyId : jwk.kid();
    Jwk publicJwk = jwk.publicOnly().withKid(id);
    KeyType type = KeyType.fromJwk(publicJwk);
    if (type == KeyType.ED25519) {
      return new PublicVerificationKey(id, type, publicJwk, JwkKeys.ed25519PublicKey(publicJwk), null);
    }
    return new PublicVerificationKey(id, type, publicJwk, null, JwkKeys.ecPublicPoint(publicJwk));
  }

  @Override
  public String keyId() {
    return keyId;
  }

  @Override
  public KeyType keyType() {
    return keyType;
  }

  @Override
  public Jwk publicKeyJwk() {
    return jwk;
  }

  @Override
  public boolean verifySignature(byte[] signingInput, byte[] signature, JwsProtected protectedHeader) {
    if (!Signatures.algorithmMatches(keyType, protectedHeader)) {
      return false;
    }
    if (keyType == KeyType.ED25519) {
      return Signatures.verifyEd25519(ed25519Key, signingInput, signature);
    }
    return Signatures.verifyEcdsa(keyType.curve(), ecPoint, signingInput, signature);
  }

  @Override
  public String toString() {
    return "PublicVerificationKey[keyId=" + keyId + ", keyType=" + keyType + "]";
  }
}
