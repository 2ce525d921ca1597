package com.codeheadsystems.envelope.did;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.key.KeyType;
import com.codeheadsystems.envelope.rfc.common.ByteUtils;
import io.github.novacrypto.base58.Base58;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * The did:key method: a DID that is its own public key, encoded as a base58btc multibase string
 * over a multicodec-prefixed public key. EC keys use the 33-byte compressed SEC1 point.
 */
public class DidKey {

  public static final String PREFIX = "did:key:";
  private static final char BASE58BTC = 'z';

  private static final int ED25519_PUB = 0xed;
  private static final int SECP256K1_PUB = 0xe7;
  private static final int P256_PUB = 0x1200;

  private DidKey() {
  }

  /**
   * Builds the did:key DID for a public key.
   *
   * @param keyType   the key type
   * @param publicKey raw Ed25519 key or compressed EC point
   * @return the DID
   */
  public static String encode(KeyType keyType, byte[] publicKey) {
    byte[] prefixed = ByteUtils.concat(varint(multicodec(keyType)), publicKey);
    return PREFIX + BASE58BTC + Base58.base58Encode(prefixed);
  }

  /**
   * The conventional key id of a did:key DID: the DID with its multibase value as fragment.
   *
   * @param did the DID
   * @return the key id
   */
  public static String keyIdFor(String did) {
    if (!isDidKey(did)) {
      throw EnvelopeException.invalidFormat("not a did:key DID: " + did);
    }
    return did + "#" + did.substring(PREFIX.length());
  }

  public static boolean isDidKey(String didOrKeyId) {
    return didOrKeyId != null && didOrKeyId.startsWith(PREFIX);
  }

  /**
   * Strips any fragment, returning the DID part of a key id.
   *
   * @param didOrKeyId the DID or DID URL
   * @return the DID
   */
  public static String didOf(String didOrKeyId) {
    int hash = didOrKeyId.indexOf('#');
    return hash < 0 ? didOrKeyId : didOrKeyId.substring(0, hash);
  }

  /**
   * Recovers the key type and public key bytes from a did:key DID or key id.
   *
   * @param didOrKeyId the DID or DID URL
   * @return the decoded key
   */
  public static Decoded decode(String didOrKeyId) {
    if (!isDidKey(didOrKeyId)) {
      throw EnvelopeException.invalidFormat("not a did:key DID: " + didOrKeyId);
    }
    String multibase = didOf(didOrKeyId).substring(PREFIX.length());
    if (multibase.isEmpty() || multibase.charAt(0) != BASE58BTC) {
      throw EnvelopeException.invalidFormat("did:key must use base58btc multibase");
    }
    byte[] bytes;
    try {
      bytes = Base58.base58Decode(multibase.substring(1));
    } catch (RuntimeException e) {
      // BadCharacterException for characters outside the base58 alphabet
      throw EnvelopeException.invalidFormat("did:key is not valid base58btc", e);
    }
    int codec = 0;
    int shift = 0;
    int offset = 0;
    while (offset < bytes.length && offset < 3) {
      int b = bytes[offset++] & 0xFF;
      codec |= (b & 0x7F) << shift;
      shift += 7;
      if ((b & 0x80) == 0) {
        return new Decoded(keyTypeFor(codec), Arrays.copyOfRange(bytes, offset, bytes.length));
      }
    }
    throw EnvelopeException.invalidFormat("did:key has a truncated multicodec prefix");
  }

  private static int multicodec(KeyType keyType) {
    return switch (keyType) {
      case ED25519 -> ED25519_PUB;
      case P256 -> P256_PUB;
      case SECP256K1 -> SECP256K1_PUB;
    };
  }

  private static KeyType keyTypeFor(int codec) {
    return switch (codec) {
      case ED25519_PUB -> KeyType.ED25519;
      case P256_PUB -> KeyType.P256;
      case SECP256K1_PUB -> KeyType.SECP256K1;
      default -> throw EnvelopeException.unsupportedAlgorithm(
          "unsupported did:key multicodec: 0x" + Integer.toHexString(codec));
    };
  }

  private static byte[] varint(int value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int v = value;
    while (v >= 0x80) {
      out.write((v & 0x7F) | 0x80);
      v >>>= 7;
    }
    out.write(v);
    return out.toByteArray();
  }

  /**
   * A decoded did:key.
   *
   * @param keyType   the key type
   * @param publicKey raw Ed25519 key or compressed EC point
   */
  public record Decoded(KeyType keyType, byte[] publicKey) {
  }
}
