package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.codeheadsystems.envelope.rfc.curve.Curve;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Conversions between JWKs and BouncyCastle key material.
 */
public class JwkKeys {

  private JwkKeys() {
  }

  /**
   * Parses and validates the public point of an EC JWK.
   *
   * @param jwk an EC JWK on P-256 or secp256k1
   * @return the point, checked to be on the curve
   */
  public static ECPoint ecPublicPoint(Jwk jwk) {
    Curve curve = KeyType.fromJwk(jwk).curve();
    return curve.decodePoint(Base64Url.decode(jwk.x(), "x"), Base64Url.decode(jwk.y(), "y"));
  }

  /**
   * Parses the public key of an OKP Ed25519 JWK.
   *
   * @param jwk the jwk
   * @return the public key
   */
  public static Ed25519PublicKeyParameters ed25519PublicKey(Jwk jwk) {
    if (KeyType.fromJwk(jwk) != KeyType.ED25519) {
      throw EnvelopeException.invalidKey("not an Ed25519 key: " + jwk);
    }
    byte[] x = Base64Url.decode(jwk.x(), "x");
    if (x.length != Ed25519PublicKeyParameters.KEY_SIZE) {
      throw EnvelopeException.invalidKey("Ed25519 public key must be 32 bytes");
    }
    try {
      return new Ed25519PublicKeyParameters(x);
    } catch (IllegalArgumentException e) {
      throw EnvelopeException.invalidKey("invalid Ed25519 public key", e);
    }
  }

  public static Jwk ecJwk(Curve curve, ECPoint point) {
    return Jwk.ec(curve.jwkCrv(), Base64Url.encode(curve.x(point)), Base64Url.encode(curve.y(point)));
  }
}
