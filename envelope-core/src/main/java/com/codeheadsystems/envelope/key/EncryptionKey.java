package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.jose.EncryptedContent;
import com.codeheadsystems.envelope.jose.Jwe;
import com.codeheadsystems.envelope.jose.JweProtected;
import java.util.List;

/**
 * A key that can encrypt to other agents with ECDH-ES+A256KW and A256GCM. Key agreement uses a
 * fresh ephemeral key, so this key's own identity is carried only as the sender_kid hint.
 */
public interface EncryptionKey extends AgentKey {

  /**
   * Encrypts for a single recipient.
   *
   * @param plaintext the plaintext
   * @param aad       additional authenticated data, or null
   * @param recipient the recipient public key
   * @return ciphertext, iv, tag and the wrapped content key with its agreement parameters
   */
  EncryptedContent encrypt(byte[] plaintext, byte[] aad, VerificationKey recipient);

  default JweAlgorithm recommendedJweAlgorithm() {
    return JweAlgorithm.ECDH_ES_A256KW;
  }

  /**
   * Encrypts for every recipient, naming this key as sender_kid in each recipient header.
   *
   * @param plaintext       the plaintext
   * @param recipients      the recipients, at least one, all on one curve
   * @param protectedHeader a protected header whose typ and cty to use, or null for the default
   * @return the JWE
   */
  Jwe createJwe(byte[] plaintext, List<? extends VerificationKey> recipients,
                JweProtected protectedHeader);
}
