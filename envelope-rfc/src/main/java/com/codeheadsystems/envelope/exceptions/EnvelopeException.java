package com.codeheadsystems.envelope.exceptions;

/**
 * The single failure type of the envelope layer. The message is an opaque reason for humans;
 * callers branch on {@link #kind()}.
 */
public class EnvelopeException extends RuntimeException {

  /**
   * Reason reported for every failure on the decrypt path once the recipient entry was found.
   * Unwrap and AEAD failures both report it.
   */
  public static final String DECRYPTION_FAILED_REASON = "decryption failed";

  /**
   * Reason reported when the local key id does not appear among the JWE recipients.
   */
  public static final String NOT_INTENDED_RECIPIENT_REASON = "not an intended recipient";

  private final ErrorKind kind;

  /**
   * Instantiates a new envelope exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  public EnvelopeException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new envelope exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  public EnvelopeException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public static EnvelopeException invalidParameter(final String message) {
    return new EnvelopeException(ErrorKind.INVALID_PARAMETER, message);
  }

  public static EnvelopeException unsupportedAlgorithm(final String message) {
    return new EnvelopeException(ErrorKind.UNSUPPORTED_ALGORITHM, message);
  }

  public static EnvelopeException invalidKey(final String message) {
    return new EnvelopeException(ErrorKind.INVALID_KEY, message);
  }

  public static EnvelopeException invalidKey(final String message, final Throwable cause) {
    return new EnvelopeException(ErrorKind.INVALID_KEY, message, cause);
  }

  public static EnvelopeException integrityCheckFailed() {
    return new EnvelopeException(ErrorKind.INTEGRITY_CHECK_FAILED, "integrity check failed");
  }

  public static EnvelopeException verificationFailed(final String message) {
    return new EnvelopeException(ErrorKind.VERIFICATION_FAILED, message);
  }

  public static EnvelopeException decryptionFailed() {
    return new EnvelopeException(ErrorKind.DECRYPTION_FAILED, DECRYPTION_FAILED_REASON);
  }

  /**
   * Decryption failure that keeps the underlying cause for the stack trace while reporting the
   * same opaque reason as every other decrypt failure.
   *
   * @param cause the cause
   * @return the exception
   */
  public static EnvelopeException decryptionFailed(final Throwable cause) {
    return new EnvelopeException(ErrorKind.DECRYPTION_FAILED, DECRYPTION_FAILED_REASON, cause);
  }

  public static EnvelopeException notIntendedRecipient() {
    return new EnvelopeException(ErrorKind.DECRYPTION_FAILED, NOT_INTENDED_RECIPIENT_REASON);
  }

  public static EnvelopeException serializationError(final String message, final Throwable cause) {
    return new EnvelopeException(ErrorKind.SERIALIZATION_ERROR, message, cause);
  }

  public static EnvelopeException serializationError(final String message) {
    return new EnvelopeException(ErrorKind.SERIALIZATION_ERROR, message);
  }

  public static EnvelopeException invalidFormat(final String message) {
    return new EnvelopeException(ErrorKind.INVALID_FORMAT, message);
  }

  public static EnvelopeException invalidFormat(final String message, final Throwable cause) {
    return new EnvelopeException(ErrorKind.INVALID_FORMAT, message, cause);
  }

  public static EnvelopeException keyNotFound(final String keyId) {
    return new EnvelopeException(ErrorKind.KEY_NOT_FOUND, "key not found: " + keyId);
  }

  public static EnvelopeException keyNotFound(final String keyId, final Throwable cause) {
    return new EnvelopeException(ErrorKind.KEY_NOT_FOUND, "key not found: " + keyId, cause);
  }

  public static EnvelopeException policyViolation(final String message) {
    return new EnvelopeException(ErrorKind.POLICY_VIOLATION, message);
  }
}
