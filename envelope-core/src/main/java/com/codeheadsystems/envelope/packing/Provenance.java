package com.codeheadsystems.envelope.packing;

/**
 * What unpacking established about a message. Trust decisions belong to the caller.
 *
 * @param mode         the protection the envelope had
 * @param signerKid    kid of the verified signature, or null when unsigned
 * @param senderKid    unauthenticated sender_kid hint from the JWE recipient header, or null
 * @param recipientKid local key that decrypted the envelope, or null when not encrypted
 */
public record Provenance(EnvelopeMode mode, String signerKid, String senderKid, String recipientKid) {

  public static Provenance plain() {
    return new Provenance(EnvelopeMode.PLAIN, null, null, null);
  }

  public static Provenance signed(String signerKid) {
    return new Provenance(EnvelopeMode.SIGNED, signerKid, null, null);
  }
}
