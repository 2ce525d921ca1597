package com.codeheadsystems.envelope.packing;

import com.codeheadsystems.envelope.config.EnvelopeConfig;
import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.JoseMapper;
import com.codeheadsystems.envelope.jose.Jwe;
import com.codeheadsystems.envelope.jose.JweCodec;
import com.codeheadsystems.envelope.jose.JweProtected;
import com.codeheadsystems.envelope.jose.JweRecipient;
import com.codeheadsystems.envelope.jose.Jws;
import com.codeheadsystems.envelope.jose.JwsCodec;
import com.codeheadsystems.envelope.jose.JwsProtected;
import com.codeheadsystems.envelope.key.AgentKey;
import com.codeheadsystems.envelope.key.DecryptionKey;
import com.codeheadsystems.envelope.key.VerificationKey;
import com.codeheadsystems.envelope.manager.KeyManager;
import com.codeheadsystems.envelope.model.PlainMessage;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs payloads into transport strings and unpacks them again.
 * <p>
 * <strong>Pack:</strong> the payload is serialized as canonical JSON, then returned as is
 * (plain), signed into a general JWS, encrypted into a multi-recipient JWE, or signed and then
 * encrypted.
 * <p>
 * <strong>Unpack:</strong> the mode is read from the envelope's shape, never from the caller.
 * A "signatures" member means JWS; a "recipients" member means JWE; anything else is plain. A
 * JWE whose protected cty names the signed media type carries a JWS, which is verified as well.
 * Any other JWE content is returned as is, whatever its shape.
 */
@Singleton
public class MessagePacker {

  private static final Logger log = LoggerFactory.getLogger(MessagePacker.class);

  private final KeyManager keyManager;
  private final EnvelopeConfig config;

  @Inject
  public MessagePacker(final KeyManager keyManager, final EnvelopeConfig config) {
    log.info("MessagePacker()");
    this.keyManager = keyManager;
    this.config = config;
  }

  // ─── Pack ─────────────────────────────────────────────────────────────────

  /**
   * Packs a payload.
   *
   * @param payload any Jackson-serializable value
   * @param mode    the protection to apply
   * @return the transport string
   */
  public String pack(Object payload, SecurityMode mode) {
    if (mode == null) {
      throw EnvelopeException.invalidParameter("security mode is required");
    }
    byte[] body = JoseMapper.canonicalBytes(payload);
    if (mode instanceof SecurityMode.Plain) {
      log.warn("pack(): plain mode, message has no integrity or confidentiality protection");
      return new String(body, StandardCharsets.UTF_8);
    }
    if (mode instanceof SecurityMode.Signed signed) {
      log.debug("pack(mode=signed, signer={})", signed.signingKeyId());
      return JoseMapper.writeJson(sign(body, signed.signingKeyId()));
    }
    if (mode instanceof SecurityMode.Encrypted encrypted) {
      log.debug("pack(mode=encrypted, sender={}, recipients={})",
          encrypted.senderKeyId(), encrypted.recipients().size());
      return JoseMapper.writeJson(encrypt(body, encrypted.senderKeyId(), encrypted.recipients()));
    }
    if (mode instanceof SecurityMode.SignedEncrypted signedEncrypted) {
      log.debug("pack(mode=signed-encrypted, signer={}, recipients={})",
          signedEncrypted.signingKeyId(), signedEncrypted.recipients().size());
      Jws inner = sign(body, signedEncrypted.signingKeyId());
      byte[] innerJson = JoseMapper.writeJson(inner).getBytes(StandardCharsets.UTF_8);
      Jwe jwe = JweCodec.encrypt(innerJson, signedEncrypted.recipients(),
          signedEncrypted.signingKeyId(),
          JweProtected.ofTyp(config.encryptedMediaType(), config.signedMediaType()),
          config.randomProvider());
      return JoseMapper.writeJson(jwe);
    }
    throw EnvelopeException.invalidParameter("unsupported security mode: " + mode);
  }

  /**
   * Starts a plaintext message stamped with the configured plain media type.
   *
   * @param type the message type URI
   * @param from the sender DID
   * @param to   the recipient DIDs
   * @param body the body
   * @return the message
   */
  public PlainMessage newMessage(String type, String from, List<String> to, JsonNode body) {
    return PlainMessage.create(config.plainMediaType(), type, from, to, body);
  }

  private Jws sign(byte[] body, String signingKeyId) {
    return keyManager.getSigningKey(signingKeyId)
        .createJws(body, new JwsProtected(config.signedMediaType(), null));
  }

  private Jwe encrypt(byte[] body, String senderKeyId, List<? extends VerificationKey> recipients) {
    JweProtected header = JweProtected.ofTyp(config.encryptedMediaType());
    if (senderKeyId != null) {
      return keyManager.getEncryptionKey(senderKeyId).createJwe(body, recipients, header);
    }
    return JweCodec.encrypt(body, recipients, null, header, config.randomProvider());
  }

  // ─── Unpack ───────────────────────────────────────────────────────────────

  public UnpackResult unpack(String transport) {
    return unpack(transport, UnpackOptions.DEFAULT);
  }

  /**
   * Unpacks a transport string and binds the payload to a type.
   *
   * @param transport the transport string
   * @param type      the payload type
   * @param options   the unpack policy
   * @param <T>       the type
   * @return the payload
   */
  public <T> T unpack(String transport, Class<T> type, UnpackOptions options) {
    return unpack(transport, options).payloadAs(type);
  }

  /**
   * Unpacks a transport string.
   *
   * @param transport the transport string
   * @param options   the unpack policy
   * @return the payload and its provenance
   */
  public UnpackResult unpack(String transport, UnpackOptions options) {
    if (transport == null) {
      throw EnvelopeException.invalidParameter("transport string is required");
    }
    UnpackOptions policy = options == null ? UnpackOptions.DEFAULT : options;
    JsonNode root = JoseMapper.readTree(transport);
    if (root == null || root.isMissingNode()) {
      throw EnvelopeException.serializationError("transport string is empty");
    }

    UnpackResult result;
    if (root.isObject() && root.has("signatures")) {
      JwsCodec.Verified verified = verify(JoseMapper.treeToValue(root, Jws.class));
      result = new UnpackResult(readPayload(verified.payload()), Provenance.signed(verified.signerKid()));
    } else if (root.isObject() && root.has("recipients")) {
      result = decrypt(JoseMapper.treeToValue(root, Jwe.class), policy);
    } else {
      result = new UnpackResult(root, Provenance.plain());
    }
    log.debug("unpack(): mode={}, signer={}", result.provenance().mode(), result.provenance().signerKid());
    enforce(policy, result.provenance());
    return result;
  }

  private UnpackResult decrypt(Jwe jwe, UnpackOptions options) {
    DecryptionKey key = selectDecryptionKey(jwe, options);
    String senderKid = jwe.recipients().stream()
        .filter(r -> key.keyId().equals(r.kid()))
        .findFirst()
        .map(JweRecipient::senderKid)
        .orElse(null);
    JsonNode content = readPayload(key.unwrapJwe(jwe));
    JweProtected header = JoseMapper.decodeSegment(jwe.protectedHeader(), "protected", JweProtected.class);
    if (header.cty() != null && header.cty().equals(config.signedMediaType())) {
      JwsCodec.Verified verified = verify(JoseMapper.treeToValue(content, Jws.class));
      if (!verified.signerKid().equals(senderKid)) {
        throw EnvelopeException.verificationFailed("inner signer does not match sender_kid");
      }
      return new UnpackResult(readPayload(verified.payload()),
          new Provenance(EnvelopeMode.SIGNED_ENCRYPTED, verified.signerKid(), senderKid, key.keyId()));
    }
    return new UnpackResult(content, new Provenance(EnvelopeMode.ENCRYPTED, null, senderKid, key.keyId()));
  }

  private DecryptionKey selectDecryptionKey(Jwe jwe, UnpackOptions options) {
    String expected = options.expectedRecipientKid();
    if (expected != null) {
      if (jwe.recipients().stream().noneMatch(r -> expected.equals(r.kid()))) {
        throw EnvelopeException.notIntendedRecipient();
      }
      return keyManager.getDecryptionKey(expected);
    }
    for (JweRecipient recipient : jwe.recipients()) {
      if (keyManager.hasKey(recipient.kid())) {
        AgentKey local = keyManager.getKey(recipient.kid());
        if (local instanceof DecryptionKey decryptionKey) {
          return decryptionKey;
        }
      }
    }
    throw EnvelopeException.notIntendedRecipient();
  }

  private JwsCodec.Verified verify(Jws jws) {
    return JwsCodec.verify(jws, keyManager::resolveVerificationKey);
  }

  private static JsonNode readPayload(byte[] payload) {
    JsonNode node = JoseMapper.readTree(payload);
    if (node == null || node.isMissingNode()) {
      throw EnvelopeException.serializationError("payload is empty");
    }
    return node;
  }

  private static void enforce(UnpackOptions options, Provenance provenance) {
    if (options.requireSignature() && !provenance.mode().isSigned()) {
      throw EnvelopeException.policyViolation("signature required but envelope was " + provenance.mode());
    }
    if (options.requireEncryption() && !provenance.mode().isEncrypted()) {
      throw EnvelopeException.policyViolation("encryption required but envelope was " + provenance.mode());
    }
  }
}
