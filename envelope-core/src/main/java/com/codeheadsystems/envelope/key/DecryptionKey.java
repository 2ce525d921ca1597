package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.EncryptedContent;
import com.codeheadsystems.envelope.jose.Jwe;
import com.codeheadsystems.envelope.jose.JweCodec;
import com.codeheadsystems.envelope.jose.Jwk;

/**
 * A key that can open content encrypted to it.
 */
public interface DecryptionKey extends AgentKey {

  /**
   * Raw ECDH agreement between this key's private scalar and a peer public key.
   *
   * @param peerPublicKey the peer (ephemeral) public key
   * @return the shared secret Z
   */
  byte[] deriveSharedSecret(Jwk peerPublicKey);

  /**
   * Opens content produced by {@link EncryptionKey#encrypt}.
   *
   * @param content the encrypted content
   * @param aad     the same additional authenticated data given to encrypt, or null
   * @return the plaintext
   */
  default byte[] decrypt(EncryptedContent content, byte[] aad) {
    return JweCodec.open(content, aad, this);
  }

  /**
   * Decrypts a JWE addressed to this key.
   *
   * @param jwe the jwe
   * @return the plaintext
   */
  default byte[] unwrapJwe(Jwe jwe) {
    return JweCodec.decrypt(jwe, this);
  }
}
