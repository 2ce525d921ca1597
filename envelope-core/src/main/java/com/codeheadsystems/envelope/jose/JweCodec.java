package com.codeheadsystems.envelope.jose;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.key.DecryptionKey;
import com.codeheadsystems.envelope.key.JweAlgorithm;
import com.codeheadsystems.envelope.key.JwkKeys;
import com.codeheadsystems.envelope.key.VerificationKey;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.codeheadsystems.envelope.rfc.common.ByteUtils;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import com.codeheadsystems.envelope.rfc.curve.Curve;
import com.codeheadsystems.envelope.rfc.rfc3394.AesKeyWrap;
import com.codeheadsystems.envelope.rfc.rfc7518.AesGcm;
import com.codeheadsystems.envelope.rfc.rfc7518.ConcatKdf;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.math.ec.ECPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-recipient JWE with ECDH-ES+A256KW key management and A256GCM content encryption.
 * <p>
 * One ephemeral key pair, one content-encryption key (CEK) and one IV serve the whole envelope.
 * For every recipient the ephemeral private key is agreed with the recipient's public key, the
 * shared secret is run through the Concat KDF into a 256-bit KEK, and the CEK is wrapped under it.
 * <ul>
 *   <li>AAD: ASCII of the base64url protected header.</li>
 *   <li>apv: SHA-256 over the sorted recipient kids joined with ".", carried in the header.</li>
 *   <li>apu: UTF-8 of the recipient header's sender_kid, or empty.</li>
 * </ul>
 */
public class JweCodec {

  private static final Logger log = LoggerFactory.getLogger(JweCodec.class);

  private static final int KEK_BITS = 256;
  private static final byte[] EMPTY = new byte[0];

  private JweCodec() {
  }

  // ─── Multi-recipient ──────────────────────────────────────────────────────

  /**
   * Encrypts plaintext for every recipient.
   *
   * @param plaintext       the plaintext
   * @param recipients      recipient keys, at least one, unique kids, all on one ECDH curve
   * @param senderKid       sender hint to put in each recipient header, or null
   * @param protectedHeader template whose typ and cty are used, or null for the default
   * @param randomProvider  source of the ephemeral key, CEK and IV
   * @return the JWE
   */
  public static Jwe encrypt(byte[] plaintext, List<? extends VerificationKey> recipients,
                            String senderKid, JweProtected protectedHeader,
                            RandomProvider randomProvider) {
    if (recipients == null || recipients.isEmpty()) {
      throw EnvelopeException.invalidParameter("JWE needs at least one recipient");
    }
    Curve curve = null;
    Set<String> kids = new LinkedHashSet<>();
    List<ECPoint> points = new ArrayList<>(recipients.size());
    for (VerificationKey recipient : recipients) {
      if (recipient.keyId() == null || !kids.add(recipient.keyId())) {
        throw EnvelopeException.invalidParameter("recipient kids must be present and unique: "
            + recipient.keyId());
      }
      Curve recipientCurve = recipient.keyType().curve();
      if (curve == null) {
        curve = recipientCurve;
      } else if (curve != recipientCurve) {
        throw EnvelopeException.invalidParameter("all JWE recipients must share one curve");
      }
      points.add(JwkKeys.ecPublicPoint(recipient.publicKeyJwk()));
    }
    log.debug("encrypt(recipients={}, curve={}, senderKid={})", kids.size(), curve.jwkCrv(), senderKid);

    BigInteger ephemeral = curve.randomScalar(randomProvider);
    byte[] apv = recipientSetDigest(kids);
    String typ = protectedHeader != null && protectedHeader.typ() != null
        ? protectedHeader.typ() : JweProtected.DEFAULT_TYP;
    JweProtected header = new JweProtected(
        JwkKeys.ecJwk(curve, curve.publicPoint(ephemeral)),
        Base64Url.encode(apv),
        typ,
        protectedHeader == null ? null : protectedHeader.cty(),
        JweAlgorithm.ECDH_ES_A256KW.enc(),
        JweAlgorithm.ECDH_ES_A256KW.alg());
    String protectedB64 = JoseMapper.encodeSegment(header);

    byte[] cek = randomProvider.randomBytes(AesGcm.KEY_LENGTH);
    byte[] iv = randomProvider.randomBytes(AesGcm.IV_LENGTH);
    try {
      AesGcm.Sealed sealed = AesGcm.encrypt(cek, iv, plaintext, aad(protectedB64));
      List<JweRecipient> entries = new ArrayList<>(points.size());
      int i = 0;
      for (String kid : kids) {
        byte[] wrapped = wrapCek(curve, ephemeral, points.get(i++), apu(senderKid), apv, cek);
        entries.add(new JweRecipient(Base64Url.encode(wrapped), new JweHeader(kid, senderKid)));
      }
      return new Jwe(Base64Url.encode(sealed.ciphertext()), protectedB64, entries,
          Base64Url.encode(sealed.tag()), Base64Url.encode(iv));
    } finally {
      ByteUtils.wipe(cek);
    }
  }

  /**
   * Decrypts a JWE with the local key. Once this key is found among the recipients, every
   * failure is reported as the same DECRYPTION_FAILED reason.
   *
   * @param jwe the JWE
   * @param key the local decryption key
   * @return the plaintext
   */
  public static byte[] decrypt(Jwe jwe, DecryptionKey key) {
    JweProtected header = JoseMapper.decodeSegment(jwe.protectedHeader(), "protected", JweProtected.class);
    JweAlgorithm.fromValues(header.alg(), header.enc());
    JweRecipient recipient = jwe.recipients().stream()
        .filter(r -> key.keyId().equals(r.kid()))
        .findFirst()
        .orElseThrow(EnvelopeException::notIntendedRecipient);
    log.debug("decrypt(kid={})", key.keyId());

    byte[] z = null;
    byte[] kek = null;
    byte[] cek = null;
    try {
      if (header.epk() == null) {
        throw EnvelopeException.invalidKey("missing epk");
      }
      z = key.deriveSharedSecret(header.epk());
      kek = ConcatKdf.derive(z, apu(recipient.senderKid()), Base64Url.decode(header.apv(), "apv"), KEK_BITS);
      cek = AesKeyWrap.unwrap(kek, Base64Url.decode(recipient.encryptedKey(), "encrypted_key"));
      return AesGcm.decrypt(cek,
          Base64Url.decode(jwe.iv(), "iv"),
          Base64Url.decode(jwe.ciphertext(), "ciphertext"),
          Base64Url.decode(jwe.tag(), "tag"),
          aad(jwe.protectedHeader()));
    } catch (EnvelopeException e) {
      throw EnvelopeException.decryptionFailed(e);
    } finally {
      ByteUtils.wipe(z, kek, cek);
    }
  }

  // ─── Single recipient ─────────────────────────────────────────────────────

  /**
   * Encrypts for one recipient without building a JWE. apu is the sender kid and apv the
   * recipient kid.
   *
   * @param plaintext      the plaintext
   * @param aad            additional authenticated data, or null
   * @param senderKid      the sender kid, or null
   * @param recipient      the recipient
   * @param randomProvider the random source
   * @return the encrypted content
   */
  public static EncryptedContent seal(byte[] plaintext, byte[] aad, String senderKid,
                                      VerificationKey recipient, RandomProvider randomProvider) {
    Curve curve = recipient.keyType().curve();
    ECPoint point = JwkKeys.ecPublicPoint(recipient.publicKeyJwk());
    BigInteger ephemeral = curve.randomScalar(randomProvider);
    byte[] apu = apu(senderKid);
    byte[] apv = recipient.keyId().getBytes(StandardCharsets.UTF_8);
    byte[] cek = randomProvider.randomBytes(AesGcm.KEY_LENGTH);
    byte[] iv = randomProvider.randomBytes(AesGcm.IV_LENGTH);
    try {
      AesGcm.Sealed sealed = AesGcm.encrypt(cek, iv, plaintext, aad == null ? EMPTY : aad);
      byte[] wrapped = wrapCek(curve, ephemeral, point, apu, apv, cek);
      return new EncryptedContent(sealed.ciphertext(), iv, sealed.tag(), wrapped,
          JwkKeys.ecJwk(curve, curve.publicPoint(ephemeral)), apu, apv);
    } finally {
      ByteUtils.wipe(cek);
    }
  }

  /**
   * Opens content produced by {@link #seal}.
   *
   * @param content the content
   * @param aad     the same AAD given to seal, or null
   * @param key     the recipient's decryption key
   * @return the plaintext
   */
  public static byte[] open(EncryptedContent content, byte[] aad, DecryptionKey key) {
    byte[] z = null;
    byte[] kek = null;
    byte[] cek = null;
    try {
      z = key.deriveSharedSecret(content.ephemeralPublicKey());
      kek = ConcatKdf.derive(z, orEmpty(content.apu()), orEmpty(content.apv()), KEK_BITS);
      cek = AesKeyWrap.unwrap(kek, content.encryptedKey());
      return AesGcm.decrypt(cek, content.iv(), content.ciphertext(), content.tag(),
          aad == null ? EMPTY : aad);
    } catch (EnvelopeException e) {
      throw EnvelopeException.decryptionFailed(e);
    } finally {
      ByteUtils.wipe(z, kek, cek);
    }
  }

  // ─── Helpers ──────────────────────────────────────────────────────────────

  /**
   * The apv value for a recipient set: SHA-256 of the sorted kids joined with ".".
   *
   * @param kids the recipient kids
   * @return the digest
   */
  public static byte[] recipientSetDigest(Set<String> kids) {
    byte[] joined = String.join(".", new TreeSet<>(kids)).getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(joined, 0, joined.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  private static byte[] wrapCek(Curve curve, BigInteger ephemeral, ECPoint recipient,
                                byte[] apu, byte[] apv, byte[] cek) {
    byte[] z = curve.ecdh(ephemeral, recipient);
    byte[] kek = ConcatKdf.derive(z, apu, apv, KEK_BITS);
    try {
      return AesKeyWrap.wrap(kek, cek);
    } finally {
      ByteUtils.wipe(z, kek);
    }
  }

  private static byte[] apu(String senderKid) {
    return senderKid == null ? EMPTY : senderKid.getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] aad(String protectedB64) {
    return protectedB64.getBytes(StandardCharsets.US_ASCII);
  }

  private static byte[] orEmpty(byte[] value) {
    return value == null ? EMPTY : value;
  }
}
