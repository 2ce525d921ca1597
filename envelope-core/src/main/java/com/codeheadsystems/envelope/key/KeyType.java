package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.rfc.curve.Curve;

/**
 * The key algorithms an agent can hold. Ed25519 signs only; both EC curves sign and do ECDH.
 */
public enum KeyType {
  ED25519("OKP", "Ed25519", JwsAlgorithm.EDDSA, null),
  P256("EC", "P-256", JwsAlgorithm.ES256, Curve.P256_CURVE),
  SECP256K1("EC", "secp256k1", JwsAlgorithm.ES256K, Curve.SECP256K1_CURVE);

  private final String kty;
  private final String crv;
  private final JwsAlgorithm jwsAlgorithm;
  private final Curve curve;

  KeyType(String kty, String crv, JwsAlgorithm jwsAlgorithm, Curve curve) {
    this.kty = kty;
    this.crv = crv;
    this.jwsAlgorithm = jwsAlgorithm;
    this.curve = curve;
  }

  public String kty() {
    return kty;
  }

  public String crv() {
    return crv;
  }

  public JwsAlgorithm jwsAlgorithm() {
    return jwsAlgorithm;
  }

  public boolean supportsEncryption() {
    return curve != null;
  }

  /**
   * The ECDH curve behind this key type.
   *
   * @return the curve
   * @throws EnvelopeException UNSUPPORTED_ALGORITHM for Ed25519
   */
  public Curve curve() {
    if (curve == null) {
      throw EnvelopeException.unsupportedAlgorithm(this + " keys do not support key agreement");
    }
    return curve;
  }

  /**
   * Identifies the key type of a JWK from its kty and crv.
   *
   * @param jwk the jwk
   * @return the key type
   */
  public static KeyType fromJwk(Jwk jwk) {
    for (KeyType type : values()) {
      if (type.kty.equals(jwk.kty()) && type.crv.equals(jwk.crv())) {
        return type;
      }
    }
    throw EnvelopeException.unsupportedAlgorithm(
        "unsupported key type: kty=" + jwk.kty() + " crv=" + jwk.crv());
  }
}
