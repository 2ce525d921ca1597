package com.codeheadsystems.envelope.rfc.rfc3394;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.rfc.common.ByteUtils;
import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES Key Wrap (RFC 3394 §2.2) with a 256-bit key-encryption key, the index-based form of the
 * algorithm over 64-bit semiblocks.
 */
public class AesKeyWrap {

  private static final Logger log = LoggerFactory.getLogger(AesKeyWrap.class);

  public static final int KEK_LENGTH = 32;
  public static final int SEMIBLOCK = 8;
  public static final int MIN_KEY_LENGTH = 16;

  // RFC 3394 §2.2.3.1 default initial value.
  private static final byte[] DEFAULT_IV = {
      (byte) 0xA6, (byte) 0xA6, (byte) 0xA6, (byte) 0xA6,
      (byte) 0xA6, (byte) 0xA6, (byte) 0xA6, (byte) 0xA6};

  private AesKeyWrap() {
  }

  /**
   * Wraps a key.
   *
   * @param kek          the 256-bit key-encryption key
   * @param plaintextKey the key to wrap, at least 16 bytes and a multiple of 8
   * @return the wrapped key, 8 bytes longer than the input
   */
  public static byte[] wrap(byte[] kek, byte[] plaintextKey) {
    checkKek(kek);
    if (plaintextKey.length < MIN_KEY_LENGTH || plaintextKey.length % SEMIBLOCK != 0) {
      throw EnvelopeException.invalidParameter(
          "key to wrap must be at least 16 bytes and a multiple of 8: " + plaintextKey.length);
    }
    int n = plaintextKey.length / SEMIBLOCK;
    byte[] a = DEFAULT_IV.clone();
    byte[] r = plaintextKey.clone();
    byte[] block = new byte[16];

    BlockCipher aes = AESEngine.newInstance();
    aes.init(true, new KeyParameter(kek));
    for (int j = 0; j <= 5; j++) {
      for (int i = 1; i <= n; i++) {
        System.arraycopy(a, 0, block, 0, SEMIBLOCK);
        System.arraycopy(r, (i - 1) * SEMIBLOCK, block, SEMIBLOCK, SEMIBLOCK);
        aes.processBlock(block, 0, block, 0);
        xorCounter(block, (long) n * j + i);
        System.arraycopy(block, 0, a, 0, SEMIBLOCK);
        System.arraycopy(block, SEMIBLOCK, r, (i - 1) * SEMIBLOCK, SEMIBLOCK);
      }
    }
    byte[] out = ByteUtils.concat(a, r);
    ByteUtils.wipe(r, block);
    return out;
  }

  /**
   * Unwraps a key and checks its integrity value before releasing any of it.
   *
   * @param kek     the 256-bit key-encryption key
   * @param wrapped the wrapped key, at least 24 bytes and a multiple of 8
   * @return the unwrapped key
   * @throws EnvelopeException INTEGRITY_CHECK_FAILED on a wrong KEK or any corruption
   */
  public static byte[] unwrap(byte[] kek, byte[] wrapped) {
    checkKek(kek);
    if (wrapped.length < MIN_KEY_LENGTH + SEMIBLOCK || wrapped.length % SEMIBLOCK != 0) {
      log.debug("unwrap(): malformed wrapped key length {}", wrapped.length);
      throw EnvelopeException.integrityCheckFailed();
    }
    int n = wrapped.length / SEMIBLOCK - 1;
    byte[] a = new byte[SEMIBLOCK];
    System.arraycopy(wrapped, 0, a, 0, SEMIBLOCK);
    byte[] r = new byte[n * SEMIBLOCK];
    System.arraycopy(wrapped, SEMIBLOCK, r, 0, r.length);
    byte[] block = new byte[16];

    BlockCipher aes = AESEngine.newInstance();
    aes.init(false, new KeyParameter(kek));
    for (int j = 5; j >= 0; j--) {
      for (int i = n; i >= 1; i--) {
        System.arraycopy(a, 0, block, 0, SEMIBLOCK);
        xorCounter(block, (long) n * j + i);
        System.arraycopy(r, (i - 1) * SEMIBLOCK, block, SEMIBLOCK, SEMIBLOCK);
        aes.processBlock(block, 0, block, 0);
        System.arraycopy(block, 0, a, 0, SEMIBLOCK);
        System.arraycopy(block, SEMIBLOCK, r, (i - 1) * SEMIBLOCK, SEMIBLOCK);
      }
    }
    ByteUtils.wipe(block);
    if (!ByteUtils.constantTimeEquals(a, DEFAULT_IV)) {
      ByteUtils.wipe(r);
      log.debug("unwrap(): integrity check value mismatch");
      throw EnvelopeException.integrityCheckFailed();
    }
    return r;
  }

  private static void checkKek(byte[] kek) {
    if (kek == null || kek.length != KEK_LENGTH) {
      throw EnvelopeException.invalidParameter("key-encryption key must be 256 bits");
    }
  }

  // A ^= BE64(t) over the first semiblock of the block buffer.
  private static void xorCounter(byte[] block, long t) {
    for (int k = SEMIBLOCK - 1; k >= 0; k--) {
      block[k] ^= (byte) (t & 0xFF);
      t >>>= 8;
    }
  }
}
