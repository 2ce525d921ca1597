package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.JwsProtected;
import com.codeheadsystems.envelope.rfc.common.ByteUtils;
import com.codeheadsystems.envelope.rfc.curve.Curve;
import java.math.BigInteger;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;

/**
 * EdDSA and ECDSA over SHA-256 in their JOSE encodings.
 */
final class Signatures {

  private Signatures() {
  }

  static boolean algorithmMatches(KeyType keyType, JwsProtected protectedHeader) {
    return protectedHeader != null
        && keyType.jwsAlgorithm().value().equals(protectedHeader.alg());
  }

  static byte[] signEd25519(Ed25519PrivateKeyParameters privateKey, byte[] data) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKey);
    signer.update(data, 0, data.length);
    return signer.generateSignature();
  }

  static boolean verifyEd25519(Ed25519PublicKeyParameters publicKey, byte[] data, byte[] signature) {
    if (signature == null || signature.length != Ed25519PrivateKeyParameters.SIGNATURE_SIZE) {
      return false;
    }
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, publicKey);
    verifier.update(data, 0, data.length);
    return verifier.verifySignature(signature);
  }

  /**
   * Deterministic (RFC 6979) ECDSA with the S value normalized to the lower half of the order.
   */
  static byte[] signEcdsa(Curve curve, BigInteger d, byte[] data) {
    ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(d, curve.params()));
    BigInteger[] rs = signer.generateSignature(sha256(data));
    BigInteger s = rs[1];
    if (s.compareTo(curve.n().shiftRight(1)) > 0) {
      s = curve.n().subtract(s);
    }
    return ByteUtils.concat(curve.scalarBytes(rs[0]), curve.scalarBytes(s));
  }

  static boolean verifyEcdsa(Curve curve, ECPoint publicPoint, byte[] data, byte[] signature) {
    if (signature == null || signature.length != 2 * curve.fieldSize()) {
      return false;
    }
    byte[] rBytes = new byte[curve.fieldSize()];
    byte[] sBytes = new byte[curve.fieldSize()];
    System.arraycopy(signature, 0, rBytes, 0, rBytes.length);
    System.arraycopy(signature, rBytes.length, sBytes, 0, sBytes.length);
    ECDSASigner verifier = new ECDSASigner();
    verifier.init(false, new ECPublicKeyParameters(publicPoint, curve.params()));
    return verifier.verifySignature(sha256(data), new BigInteger(1, rBytes), new BigInteger(1, sBytes));
  }

  private static byte[] sha256(byte[] data) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(data, 0, data.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
