package com.codeheadsystems.envelope.rfc.curve;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.agreement.ECDHBasicAgreement;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

/**
 * Short-Weierstrass curve usable for both ECDSA and ECDH-ES, named by its JWK "crv" value.
 *
 * @param jwkCrv    the JWK curve name
 * @param params    the domain parameters
 * @param curve     the curve
 * @param g         the generator
 * @param n         the group order
 * @param fieldSize coordinate length in bytes
 */
public record Curve(String jwkCrv, ECDomainParameters params, ECCurve curve, ECPoint g,
                    BigInteger n, int fieldSize) {

  public static final Curve P256_CURVE = loadCurve("P-256", "P-256");
  public static final Curve SECP256K1_CURVE = loadCurve("secp256k1", "secp256k1");

  public Curve(String jwkCrv, ECDomainParameters params) {
    this(jwkCrv, params, params.getCurve(), params.getG(), params.getN(),
        (params.getCurve().getFieldSize() + 7) / 8);
  }

  /**
   * Looks up a curve by JWK "crv".
   *
   * @param crv the crv value
   * @return the curve
   * @throws EnvelopeException UNSUPPORTED_ALGORITHM for any other curve
   */
  public static Curve forJwkCrv(String crv) {
    if (P256_CURVE.jwkCrv().equals(crv)) {
      return P256_CURVE;
    }
    if (SECP256K1_CURVE.jwkCrv().equals(crv)) {
      return SECP256K1_CURVE;
    }
    throw EnvelopeException.unsupportedAlgorithm("unsupported EC curve: " + crv);
  }

  /**
   * Picks a private scalar uniformly from [1, n-1].
   *
   * @param randomProvider the random source
   * @return the scalar
   */
  public BigInteger randomScalar(RandomProvider randomProvider) {
    return BigIntegers.createRandomInRange(BigInteger.ONE, n.subtract(BigInteger.ONE),
        randomProvider.random());
  }

  /**
   * Parses a big-endian private scalar and checks its range.
   *
   * @param raw the raw scalar bytes
   * @return the scalar
   */
  public BigInteger privateScalar(byte[] raw) {
    if (raw.length != fieldSize) {
      throw EnvelopeException.invalidKey("private key must be " + fieldSize + " bytes");
    }
    BigInteger d = new BigInteger(1, raw);
    if (d.signum() <= 0 || d.compareTo(n) >= 0) {
      throw EnvelopeException.invalidKey("private key out of range");
    }
    return d;
  }

  public ECPoint publicPoint(BigInteger d) {
    return g.multiply(d).normalize();
  }

  /**
   * Builds a public point from affine coordinates, rejecting anything not on this curve.
   *
   * @param x the x coordinate, fieldSize bytes
   * @param y the y coordinate, fieldSize bytes
   * @return the validated point
   */
  public ECPoint decodePoint(byte[] x, byte[] y) {
    if (x.length != fieldSize || y.length != fieldSize) {
      throw EnvelopeException.invalidKey("EC coordinates must be " + fieldSize + " bytes");
    }
    try {
      ECPoint point = curve.validatePoint(new BigInteger(1, x), new BigInteger(1, y));
      return checkSubgroup(point);
    } catch (IllegalArgumentException e) {
      throw EnvelopeException.invalidKey("point is not on " + jwkCrv, e);
    }
  }

  /**
   * Decodes a SEC1 encoded point (compressed or uncompressed).
   *
   * @param encoded the encoding
   * @return the validated point
   */
  public ECPoint decodePoint(byte[] encoded) {
    try {
      return checkSubgroup(curve.decodePoint(encoded).normalize());
    } catch (IllegalArgumentException e) {
      throw EnvelopeException.invalidKey("invalid " + jwkCrv + " point encoding", e);
    }
  }

  public byte[] x(ECPoint point) {
    return BigIntegers.asUnsignedByteArray(fieldSize, point.getAffineXCoord().toBigInteger());
  }

  public byte[] y(ECPoint point) {
    return BigIntegers.asUnsignedByteArray(fieldSize, point.getAffineYCoord().toBigInteger());
  }

  public byte[] scalarBytes(BigInteger d) {
    return BigIntegers.asUnsignedByteArray(fieldSize, d);
  }

  /**
   * ECDH shared secret Z: the x coordinate of d * Q, fixed to fieldSize bytes (RFC 7518 §4.6.2).
   *
   * @param d the local private scalar
   * @param q the peer public point
   * @return Z
   */
  public byte[] ecdh(BigInteger d, ECPoint q) {
    ECDHBasicAgreement agreement = new ECDHBasicAgreement();
    agreement.init(new ECPrivateKeyParameters(d, params));
    BigInteger z = agreement.calculateAgreement(new ECPublicKeyParameters(q, params));
    return BigIntegers.asUnsignedByteArray(agreement.getFieldSize(), z);
  }

  private ECPoint checkSubgroup(ECPoint point) {
    if (point.isInfinity() || !point.isValid()) {
      throw EnvelopeException.invalidKey("point is not a valid " + jwkCrv + " public key");
    }
    return point;
  }

  private static Curve loadCurve(String name, String jwkCrv) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(jwkCrv, new ECDomainParameters(
        params.getCurve(),
        params.getG(),
        params.getN(),
        params.getH()
    ));
  }
}
