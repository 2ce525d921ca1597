package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.EncryptedContent;
import com.codeheadsystems.envelope.jose.Jwe;
import com.codeheadsystems.envelope.jose.JweCodec;
import com.codeheadsystems.envelope.jose.JweProtected;
import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.jose.JwsProtected;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import com.codeheadsystems.envelope.rfc.curve.Curve;
import java.math.BigInteger;
import java.util.List;
import org.bouncycastle.math.ec.ECPoint;

/**
 * P-256 or secp256k1 agent key: ES256 / ES256K signatures and ECDH-ES+A256KW encryption.
 */
public class EcAgentKey extends LocalAgentKey implements EncryptionKey, DecryptionKey {

  private final Curve curve;
  private final BigInteger d;
  private final ECPoint q;
  private final RandomProvider randomProvider;

  private EcAgentKey(String keyId, String did, KeyType keyType, BigInteger d,
                     RandomProvider randomProvider) {
    super(keyId, did, keyType);
    this.curve = keyType.curve();
    this.d = d;
    this.q = curve.publicPoint(d);
    this.randomProvider = randomProvider;
  }

  static EcAgentKey generate(KeyType keyType, String did, String keyId, RandomProvider randomProvider) {
    return create(keyType, keyType.curve().randomScalar(randomProvider), did, keyId, randomProvider);
  }

  static EcAgentKey importScalar(KeyType keyType, byte[] scalar, String did, String keyId,
                                 RandomProvider randomProvider) {
    return create(keyType, keyType.curve().privateScalar(scalar), did, keyId, randomProvider);
  }

  private static EcAgentKey create(KeyType keyType, BigInteger d, String did, String keyId,
                                   RandomProvider randomProvider) {
    ECPoint point = keyType.curve().publicPoint(d);
    String resolvedDid = didOrDefault(did, keyType, point.getEncoded(true));
    return new EcAgentKey(keyIdOrDefault(keyId, resolvedDid), resolvedDid, keyType, d, randomProvider);
  }

  // ─── Signing ──────────────────────────────────────────────────────────────

  @Override
  public byte[] sign(byte[] data) {
    return Signatures.signEcdsa(curve, d, data);
  }

  @Override
  public boolean verifySignature(byte[] signingInput, byte[] signature, JwsProtected protectedHeader) {
    return Signatures.algorithmMatches(keyType(), protectedHeader)
        && Signatures.verifyEcdsa(curve, q, signingInput, signature);
  }

  // ─── Encryption ───────────────────────────────────────────────────────────

  @Override
  public EncryptedContent encrypt(byte[] plaintext, byte[] aad, VerificationKey recipient) {
    return JweCodec.seal(plaintext, aad, keyId(), recipient, randomProvider);
  }

  @Override
  public Jwe createJwe(byte[] plaintext, List<? extends VerificationKey> recipients,
                       JweProtected protectedHeader) {
    return JweCodec.encrypt(plaintext, recipients, keyId(), protectedHeader, randomProvider);
  }

  @Override
  public byte[] deriveSharedSecret(Jwk peerPublicKey) {
    if (KeyType.fromJwk(peerPublicKey) != keyType()) {
      throw EnvelopeException.invalidKey("peer key is not on " + curve.jwkCrv());
    }
    return curve.ecdh(d, JwkKeys.ecPublicPoint(peerPublicKey));
  }

  @Override
  public Jwk publicKeyJwk() {
    return JwkKeys.ecJwk(curve, q).withKid(keyId());
  }

  @Override
  protected byte[] privateKeyBytes() {
    return curve.scalarBytes(d);
  }
}
