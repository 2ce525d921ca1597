package com.codeheadsystems.envelope.packing;

import com.codeheadsystems.envelope.key.VerificationKey;
import java.util.List;

/**
 * How a message is protected when packed.
 * <ul>
 *   <li>{@link Plain}: no protection, for tests and local use.</li>
 *   <li>{@link Signed}: JWS.</li>
 *   <li>{@link Encrypted}: anonymous ECDH-ES JWE; the sender kid is an unauthenticated hint.</li>
 *   <li>{@link SignedEncrypted}: a JWS nested in a JWE, which authenticates the sender.</li>
 * </ul>
 */
public interface SecurityMode {

  static SecurityMode plain() {
    return new Plain();
  }

  static SecurityMode signed(String signingKeyId) {
    return new Signed(signingKeyId);
  }

  static SecurityMode anonymous(List<? extends VerificationKey> recipients) {
    return new Encrypted(null, recipients);
  }

  static SecurityMode encrypted(String senderKeyId, List<? extends VerificationKey> recipients) {
    return new Encrypted(senderKeyId, recipients);
  }

  static SecurityMode signedEncrypted(String signingKeyId, List<? extends VerificationKey> recipients) {
    return new SignedEncrypted(signingKeyId, recipients);
  }

  /**
   * No integrity or confidentiality.
   */
  record Plain() implements SecurityMode {
  }

  /**
   * Signed with a local key.
   *
   * @param signingKeyId the local signing key id
   */
  record Signed(String signingKeyId) implements SecurityMode {
  }

  /**
   * Encrypted to recipients. When senderKeyId is set, that local encryption key's id is written
   * as sender_kid in every recipient header and bound into the KEK derivation. It is not proof
   * of origin.
   *
   * @param senderKeyId the local encryption key id, or null
   * @param recipients  the recipients
   */
  record Encrypted(String senderKeyId, List<? extends VerificationKey> recipients)
      implements SecurityMode {

    public Encrypted {
      recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
  }

  /**
   * Signed with a local key, then encrypted to recipients.
   *
   * @param signingKeyId the local signing key id
   * @param recipients   the recipients
   */
  record SignedEncrypted(String signingKeyId, List<? extends VerificationKey> recipients)
      implements SecurityMode {

    public SignedEncrypted {
      recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
  }
}
