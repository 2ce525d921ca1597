package com.codeheadsystems.envelope.rfc.rfc7518;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.rfc.common.ByteUtils;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A256GCM content encryption (RFC 7518 §5.3): 256-bit key, 96-bit IV, 128-bit tag. The JOSE
 * serialization carries ciphertext and tag separately, so results are split accordingly.
 */
public class AesGcm {

  private static final Logger log = LoggerFactory.getLogger(AesGcm.class);

  public static final int KEY_LENGTH = 32;
  public static final int IV_LENGTH = 12;
  public static final int TAG_LENGTH = 16;

  private AesGcm() {
  }

  /**
   * Encrypts and authenticates.
   *
   * @param cek       the 256-bit content-encryption key
   * @param iv        the 96-bit IV, never reused under the same key
   * @param plaintext the plaintext
   * @param aad       additional authenticated data, may be empty
   * @return ciphertext and tag
   */
  public static Sealed encrypt(byte[] cek, byte[] iv, byte[] plaintext, byte[] aad) {
    if (cek.length != KEY_LENGTH || iv.length != IV_LENGTH) {
      throw EnvelopeException.invalidParameter("A256GCM requires a 32-byte key and 12-byte IV");
    }
    GCMModeCipher gcm = init(true, cek, iv, aad);
    byte[] out = new byte[gcm.getOutputSize(plaintext.length)];
    int len = gcm.processBytes(plaintext, 0, plaintext.length, out, 0);
    try {
      len += gcm.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("GCM encryption cannot fail on a fresh cipher", e);
    }
    byte[] ciphertext = new byte[len - TAG_LENGTH];
    byte[] tag = new byte[TAG_LENGTH];
    System.arraycopy(out, 0, ciphertext, 0, ciphertext.length);
    System.arraycopy(out, ciphertext.length, tag, 0, TAG_LENGTH);
    return new Sealed(ciphertext, tag);
  }

  /**
   * Verifies the tag and decrypts. Nothing is returned unless the tag verifies.
   *
   * @param cek        the 256-bit content-encryption key
   * @param iv         the IV
   * @param ciphertext the ciphertext
   * @param tag        the 128-bit tag
   * @param aad        additional authenticated data, may be empty
   * @return the plaintext
   * @throws EnvelopeException DECRYPTION_FAILED on any mismatch
   */
  public static byte[] decrypt(byte[] cek, byte[] iv, byte[] ciphertext, byte[] tag, byte[] aad) {
    if (cek.length != KEY_LENGTH || iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
      log.debug("decrypt(): bad key, iv or tag length");
      throw EnvelopeException.decryptionFailed();
    }
    GCMModeCipher gcm = init(false, cek, iv, aad);
    byte[] input = ByteUtils.concat(ciphertext, tag);
    byte[] out = new byte[gcm.getOutputSize(input.length)];
    int len = gcm.processBytes(input, 0, input.length, out, 0);
    try {
      len += gcm.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      ByteUtils.wipe(out);
      log.debug("decrypt(): authentication tag mismatch");
      throw EnvelopeException.decryptionFailed(e);
    }
    if (len == out.length) {
      return out;
    }
    byte[] plaintext = new byte[len];
    System.arraycopy(out, 0, plaintext, 0, len);
    ByteUtils.wipe(out);
    return plaintext;
  }

  private static GCMModeCipher init(boolean forEncryption, byte[] cek, byte[] iv, byte[] aad) {
    GCMModeCipher gcm = GCMBlockCipher.newInstance(AESEngine.newInstance());
    gcm.init(forEncryption, new AEADParameters(new KeyParameter(cek), TAG_LENGTH * 8, iv, aad));
    return gcm;
  }

  /**
   * Ciphertext and detached authentication tag.
   *
   * @param ciphertext the ciphertext
   * @param tag        the tag
   */
  public record Sealed(byte[] ciphertext, byte[] tag) {
  }
}
