package com.codeheadsystems.envelope.rfc.common;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Octet-string helpers shared by the KDF, key wrap and envelope codecs.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * I2OSP (RFC 8017 §4.1) for the short fixed-width counters and lengths used here.
   *
   * @param value  a non-negative value
   * @param length output width, 1 to 4 bytes
   * @return the big-endian encoding
   */
  public static byte[] I2OSP(int value, int length) {
    if (length < 1 || length > 4) {
      throw EnvelopeException.invalidParameter("I2OSP width must be 1 to 4 bytes: " + length);
    }
    if (value < 0 || (length < 4 && (value >>> (8 * length)) != 0)) {
      throw EnvelopeException.invalidParameter(value + " does not fit in " + length + " bytes");
    }
    byte[] out = new byte[length];
    for (int shift = 0, i = length - 1; i >= 0; i--, shift += 8) {
      out[i] = (byte) (value >>> shift);
    }
    return out;
  }

  /**
   * The Concat KDF "Datalen || Data" form: a 32-bit big-endian length, then the bytes.
   *
   * @param data the data
   * @return the prefixed data
   */
  public static byte[] lengthPrefixed(byte[] data) {
    return concat(I2OSP(data.length, 4), data);
  }

  public static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.writeBytes(part);
    }
    return out.toByteArray();
  }

  /**
   * Compares two arrays without an early exit, so timing reveals only the lengths.
   *
   * @param expected the expected bytes
   * @param actual   the actual bytes
   * @return true when equal
   */
  public static boolean constantTimeEquals(byte[] expected, byte[] actual) {
    if (expected.length != actual.length) {
      return false;
    }
    int acc = 0;
    for (int i = 0; i < expected.length; i++) {
      acc |= expected[i] ^ actual[i];
    }
    return acc == 0;
  }

  /**
   * Zeroes key material once it is no longer needed. Null entries are ignored.
   *
   * @param secrets the arrays to clear
   */
  public static void wipe(byte[]... secrets) {
    for (byte[] secret : secrets) {
      if (secret != null) {
        Arrays.fill(secret, (byte) 0);
      }
    }
  }
}
