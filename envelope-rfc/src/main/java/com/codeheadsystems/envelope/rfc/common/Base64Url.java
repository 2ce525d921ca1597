package com.codeheadsystems.envelope.rfc.common;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Unpadded base64url as used by every binary JOSE member (RFC 7515 §2).
 */
public class Base64Url {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private Base64Url() {
  }

  public static String encode(byte[] data) {
    return ENCODER.encodeToString(data);
  }

  public static String encode(String utf8) {
    return encode(utf8.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decodes a base64url member.
   *
   * @param value the encoded value
   * @param field the JOSE member name, used in the error message
   * @return the decoded bytes
   * @throws EnvelopeException INVALID_FORMAT if the value is missing or not base64url
   */
  public static byte[] decode(String value, String field) {
    if (value == null) {
      throw EnvelopeException.invalidFormat("missing " + field);
    }
    if (value.indexOf('=') >= 0) {
      throw EnvelopeException.invalidFormat(field + " must be unpadded base64url");
    }
    try {
      return DECODER.decode(value);
    } catch (IllegalArgumentException e) {
      throw EnvelopeException.invalidFormat(field + " is not base64url", e);
    }
  }
}
