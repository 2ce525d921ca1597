package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.jose.JwsProtected;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

/**
 * Ed25519 agent key. Signs with EdDSA and cannot take part in key agreement, so it implements
 * neither {@link EncryptionKey} nor {@link DecryptionKey}.
 */
public class Ed25519AgentKey extends LocalAgentKey {

  private final Ed25519PrivateKeyParameters privateKey;
  private final Ed25519PublicKeyParameters publicKey;

  private Ed25519AgentKey(String keyId, String did, Ed25519PrivateKeyParameters privateKey) {
    super(keyId, did, KeyType.ED25519);
    this.privateKey = privateKey;
    this.publicKey = privateKey.generatePublicKey();
  }

  static Ed25519AgentKey generate(String did, String keyId, RandomProvider randomProvider) {
    return create(new Ed25519PrivateKeyParameters(randomProvider.random()), did, keyId);
  }

  static Ed25519AgentKey importSeed(byte[] seed, String did, String keyId) {
    if (seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
      throw EnvelopeException.invalidKey("Ed25519 private key must be 32 bytes");
    }
    return create(new Ed25519PrivateKeyParameters(seed, 0), did, keyId);
  }

  private static Ed25519AgentKey create(Ed25519PrivateKeyParameters privateKey, String did,
                                        String keyId) {
    String resolvedDid = didOrDefault(did, KeyType.ED25519, privateKey.generatePublicKey().getEncoded());
    return new Ed25519AgentKey(keyIdOrDefault(keyId, resolvedDid), resolvedDid, privateKey);
  }

  @Override
  public byte[] sign(byte[] data) {
    return Signatures.signEd25519(privateKey, data);
  }

  @Override
  public boolean verifySignature(byte[] signingInput, byte[] signature, JwsProtected protectedHeader) {
    return Signatures.algorithmMatches(KeyType.ED25519, protectedHeader)
        && Signatures.verifyEd25519(publicKey, signingInput, signature);
  }

  @Override
  public Jwk publicKeyJwk() {
    return Jwk.okp(KeyType.ED25519.crv(), Base64Url.encode(publicKey.getEncoded())).withKid(keyId());
  }

  @Override
  protected byte[] privateKeyBytes() {
    return privateKey.getEncoded();
  }
}
