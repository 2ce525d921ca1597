package com.codeheadsystems.envelope.exceptions;

/**
 * Machine-checkable classification of every failure the envelope layer can report.
 */
public enum ErrorKind {
  /** Malformed call, e.g. a key length that is not a multiple of 8. */
  INVALID_PARAMETER,
  /** The key type does not offer the requested capability or algorithm. */
  UNSUPPORTED_ALGORITHM,
  /** Key material could not be parsed or is not on the expected curve. */
  INVALID_KEY,
  /** AES key unwrap failed its integrity check value. */
  INTEGRITY_CHECK_FAILED,
  /** A JWS signature did not verify. */
  VERIFICATION_FAILED,
  /** A JWE could not be opened by the local key. */
  DECRYPTION_FAILED,
  /** The envelope is not valid JSON or does not bind to the expected model. */
  SERIALIZATION_ERROR,
  /** A field parsed but carries a value outside its format, e.g. bad base64url. */
  INVALID_FORMAT,
  /** A key manager or resolver has no key for the requested id. */
  KEY_NOT_FOUND,
  /** The envelope unpacked but did not satisfy the caller's unpack options. */
  POLICY_VIOLATION
}
