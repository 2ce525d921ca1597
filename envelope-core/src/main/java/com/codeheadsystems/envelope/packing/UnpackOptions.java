package com.codeheadsystems.envelope.packing;

/**
 * Policy applied after an envelope has been verified or decrypted.
 *
 * @param requireSignature     fail with POLICY_VIOLATION unless a signature verified
 * @param requireEncryption    fail with POLICY_VIOLATION unless the envelope was encrypted
 * @param expectedRecipientKid decrypt only with this local key, or null to pick any local
 *                             recipient key
 */
public record UnpackOptions(boolean requireSignature,
                           boolean requireEncryption,
                           String expectedRecipientKid) {

  /**
   * Accepts every mode.
   */
  public static final UnpackOptions DEFAULT = new UnpackOptions(false, false, null);

  public UnpackOptions withRequireSignature(boolean required) {
    return new UnpackOptions(required, requireEncryption, expectedRecipientKid);
  }

  public UnpackOptions withRequireEncryption(boolean required) {
    return new UnpackOptions(requireSignature, required, expectedRecipientKid);
  }

  public UnpackOptions withExpectedRecipientKid(String kid) {
    return new UnpackOptions(requireSignature, requireEncryption, kid);
  }
}
