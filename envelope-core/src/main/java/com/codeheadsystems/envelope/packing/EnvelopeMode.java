package com.codeheadsystems.envelope.packing;

/**
 * The protection an unpacked envelope actually had, as read from its shape.
 */
public enum EnvelopeMode {
  PLAIN,
  SIGNED,
  ENCRYPTED,
  SIGNED_ENCRYPTED;

  public boolean isSigned() {
    return this == SIGNED || this == SIGNED_ENCRYPTED;
  }

  public boolean isEncrypted() {
    return this == ENCRYPTED || this == SIGNED_ENCRYPTED;
  }
}
