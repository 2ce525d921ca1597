package com.codeheadsystems.envelope.rfc.rfc7518;

import static com.codeheadsystems.envelope.rfc.common.ByteUtils.I2OSP;
import static com.codeheadsystems.envelope.rfc.common.ByteUtils.concat;
import static com.codeheadsystems.envelope.rfc.common.ByteUtils.lengthPrefixed;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Single-step Concat KDF from NIST SP 800-56A §5.8.1 with SHA-256, laid out as RFC 7518 §4.6.2
 * specifies for ECDH-ES:
 * <pre>
 * OtherInfo = BE32(len(AlgID)) || AlgID || BE32(len(apu)) || apu || BE32(len(apv)) || apv || BE32(keydatalen)
 * round(i)  = SHA-256(BE32(i) || Z || OtherInfo)
 * </pre>
 */
public class ConcatKdf {

  /**
   * AlgorithmID used for key-wrapped ECDH-ES. The KEK is bound to the key management algorithm,
   * not the content encryption.
   */
  public static final String ECDH_ES_A256KW = "ECDH-ES+A256KW";

  private static final int HASH_LEN = 32;

  private ConcatKdf() {
  }

  /**
   * Derives key material for ECDH-ES+A256KW.
   *
   * @param sharedSecret    the raw ECDH shared secret Z
   * @param apu             PartyUInfo, may be empty
   * @param apv             PartyVInfo, may be empty
   * @param keyDataLenBits  output length in bits, a positive multiple of 8
   * @return keyDataLenBits / 8 bytes
   */
  public static byte[] derive(byte[] sharedSecret, byte[] apu, byte[] apv, int keyDataLenBits) {
    return derive(ECDH_ES_A256KW, sharedSecret, apu, apv, keyDataLenBits);
  }

  /**
   * Derives key material for an arbitrary JOSE AlgorithmID. Direct-agreement ECDH-ES uses the
   * "enc" value here, which is how the RFC 7518 Appendix C example is computed.
   *
   * @param algorithmId     the AlgorithmID string
   * @param sharedSecret    the raw ECDH shared secret Z
   * @param apu             PartyUInfo, may be empty
   * @param apv             PartyVInfo, may be empty
   * @param keyDataLenBits  output length in bits, a positive multiple of 8
   * @return keyDataLenBits / 8 bytes
   */
  public static byte[] derive(String algorithmId, byte[] sharedSecret, byte[] apu, byte[] apv,
                              int keyDataLenBits) {
    if (keyDataLenBits <= 0 || keyDataLenBits % 8 != 0) {
      throw EnvelopeException.invalidParameter(
          "key data length must be a positive multiple of 8 bits: " + keyDataLenBits);
    }
    byte[] otherInfo = concat(
        lengthPrefixed(algorithmId.getBytes(StandardCharsets.US_ASCII)),
        lengthPrefixed(apu),
        lengthPrefixed(apv),
        I2OSP(keyDataLenBits, 4));

    int keyLen = keyDataLenBits / 8;
    int rounds = (keyLen + HASH_LEN - 1) / HASH_LEN;
    byte[] output = new byte[keyLen];
    SHA256Digest digest = new SHA256Digest();
    byte[] round = new byte[HASH_LEN];
    for (int counter = 1; counter <= rounds; counter++) {
      digest.reset();
      byte[] counterBytes = I2OSP(counter, 4);
      digest.update(counterBytes, 0, counterBytes.length);
      digest.update(sharedSecret, 0, sharedSecret.length);
      digest.update(otherInfo, 0, otherInfo.length);
      digest.doFinal(round, 0);
      int offset = (counter - 1) * HASH_LEN;
      System.arraycopy(round, 0, output, offset, Math.min(HASH_LEN, keyLen - offset));
    }
    return output;
  }
}
