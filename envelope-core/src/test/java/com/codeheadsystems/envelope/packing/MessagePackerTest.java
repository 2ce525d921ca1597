package com.codeheadsystems.envelope.packing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.envelope.config.EnvelopeConfig;
import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.exceptions.ErrorKind;
import com.codeheadsystems.envelope.jose.JoseMapper;
import com.codeheadsystems.envelope.jose.Jwe;
import com.codeheadsystems.envelope.jose.JweCodec;
import com.codeheadsystems.envelope.jose.JweProtected;
import com.codeheadsystems.envelope.jose.Jws;
import com.codeheadsystems.envelope.jose.JwsProtected;
import com.codeheadsystems.envelope.key.KeyType;
import com.codeheadsystems.envelope.key.LocalAgentKey;
import com.codeheadsystems.envelope.manager.AgentKeyManager;
import com.codeheadsystems.envelope.model.PlainMessage;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessagePackerTest {

  private static final Map<String, Object> PAYLOAD = Map.of(
      "type", "https://tap.rsvp/schema/1.0#Transfer",
      "body", Map.of("amount", "100.00", "asset", "eip155:1/slip44:60"));

  private final RandomProvider random = new RandomProvider();

  private LocalAgentKey aliceSigning;
  private LocalAgentKey aliceEc;
  private LocalAgentKey bobEc;
  private LocalAgentKey carolEc;
  private MessagePacker alice;
  private MessagePacker bob;
  private MessagePacker carol;

  @BeforeEach
  void setUp() {
    aliceSigning = LocalAgentKey.generate(KeyType.ED25519, random);
    aliceEc = LocalAgentKey.generate(KeyType.P256, random);
    bobEc = LocalAgentKey.generate(KeyType.P256, random);
    carolEc = LocalAgentKey.generate(KeyType.P256, random);
    EnvelopeConfig config = EnvelopeConfig.DEFAULT.withRandomProvider(random);
    alice = new MessagePacker(AgentKeyManager.builder().withKey(aliceSigning).withKey(aliceEc).build(), config);
    bob = new MessagePacker(AgentKeyManager.builder().withKey(bobEc).build(), config);
    carol = new MessagePacker(AgentKeyManager.builder().withKey(carolEc).build(), config);
  }

  // ─── Plain ────────────────────────────────────────────────────────────────

  @Test
  void plain_isCanonicalJson() {
    String transport = alice.pack(PAYLOAD, SecurityMode.plain());

    assertThat(transport).isEqualTo("{\"body\":{\"amount\":\"100.00\",\"asset\":\"eip155:1/slip44:60\"},"
        + "\"type\":\"https://tap.rsvp/schema/1.0#Transfer\"}");
    UnpackResult result = bob.unpack(transport);
    assertThat(result.provenance()).isEqualTo(Provenance.plain());
    assertThat(result.payload()).isEqualTo(JoseMapper.readTree(transport));
  }

  @Test
  void plain_nonObjectPayload() {
    UnpackResult result = bob.unpack(alice.pack(List.of(1, 2, 3), SecurityMode.plain()));

    assertThat(result.payload().isArray()).isTrue();
    assertThat(result.provenance().mode()).isEqualTo(EnvelopeMode.PLAIN);
  }

  @Test
  void plain_rejectedWhenSignatureRequired() {
    String transport = alice.pack(PAYLOAD, SecurityMode.plain());

    assertKind(() -> bob.unpack(transport, UnpackOptions.DEFAULT.withRequireSignature(true)),
        ErrorKind.POLICY_VIOLATION);
  }

  // ─── Signed ───────────────────────────────────────────────────────────────

  @Test
  void signed_verifiesThroughDidKeyResolution() {
    String transport = alice.pack(PAYLOAD, SecurityMode.signed(aliceSigning.keyId()));

    Jws jws = JoseMapper.treeToValue(JoseMapper.readTree(transport), Jws.class);
    assertThat(jws.signatures()).singleElement().satisfies(s -> assertThat(s.kid()).isEqualTo(aliceSigning.keyId()));
    UnpackResult result = bob.unpack(transport, UnpackOptions.DEFAULT.withRequireSignature(true));
    assertThat(result.provenance()).isEqualTo(Provenance.signed(aliceSigning.keyId()));
    assertThat(result.payload()).isEqualTo(JoseMapper.mapper().valueToTree(PAYLOAD));
  }

  @Test
  void signed_usesConfiguredMediaType() {
    EnvelopeConfig config = new EnvelopeConfig(random, "application/plain", "application/custom-signed", "x");
    MessagePacker packer = new MessagePacker(AgentKeyManager.builder().withKey(aliceEc).build(), config);

    Jws jws = JoseMapper.treeToValue(
        JoseMapper.readTree(packer.pack(PAYLOAD, SecurityMode.signed(aliceEc.keyId()))), Jws.class);

    assertThat(JoseMapper.decodeSegment(jws.signatures().get(0).protectedHeader(), "protected", JwsProtected.class))
        .isEqualTo(new JwsProtected("application/custom-signed", "ES256"));
  }

  @Test
  void signed_rejectedWhenEncryptionRequired() {
    String transport = alice.pack(PAYLOAD, SecurityMode.signed(aliceSigning.keyId()));

    assertKind(() -> bob.unpack(transport, UnpackOptions.DEFAULT.withRequireEncryption(true)),
        ErrorKind.POLICY_VIOLATION);
  }

  @Test
  void signed_tamperedPayloadFails() {
    Jws jws = JoseMapper.treeToValue(
        JoseMapper.readTree(alice.pack(PAYLOAD, SecurityMode.signed(aliceSigning.keyId()))), Jws.class);
    Jws tampered = new Jws(Base64Url.encode("{\"body\":{\"amount\":\"999.00\"}}"), jws.signatures());

    assertKind(() -> bob.unpack(JoseMapper.writeJson(tampered)), ErrorKind.VERIFICATION_FAILED);
  }

  @Test
  void signed_unresolvableSignerIsKeyNotFound() {
    LocalAgentKey webKey = LocalAgentKey.fromPrivateKey(KeyType.ED25519, random.randomBytes(32),
        "did:web:alice.example", null, random);
    MessagePacker packer = new MessagePacker(AgentKeyManager.builder().withKey(webKey).build(), EnvelopeConfig.DEFAULT);
    String transport = packer.pack(PAYLOAD, SecurityMode.signed(webKey.keyId()));

    assertKind(() -> bob.unpack(transport), ErrorKind.KEY_NOT_FOUND);
  }

  @Test
  void signed_registeredPeerKeyIsUsed() {
    LocalAgentKey webKey = LocalAgentKey.fromPrivateKey(KeyType.SECP256K1, random.randomBytes(32),
        "did:web:alice.example", null, random);
    MessagePacker sender = new MessagePacker(AgentKeyManager.builder().withKey(webKey).build(), EnvelopeConfig.DEFAULT);
    MessagePacker receiver = new MessagePacker(
        AgentKeyManager.builder().withVerificationKey(webKey.toPublicKey()).build(), EnvelopeConfig.DEFAULT);

    UnpackResult result = receiver.unpack(sender.pack(PAYLOAD, SecurityMode.signed(webKey.keyId())));

    assertThat(result.provenance().signerKid()).isEqualTo("did:web:alice.example#keys-1");
  }

  @Test
  void signed_unknownLocalKeyIsKeyNotFound() {
    assertKind(() -> alice.pack(PAYLOAD, SecurityMode.signed("did:example:nobody#1")), ErrorKind.KEY_NOT_FOUND);
  }

  // ─── Encrypted ────────────────────────────────────────────────────────────

  @Test
  void encrypted_senderHintAndRecipientInProvenance() {
    String transport = alice.pack(PAYLOAD,
        SecurityMode.encrypted(aliceEc.keyId(), List.of(bobEc.toPublicKey())));

    Jwe jwe = JoseMapper.treeToValue(JoseMapper.readTree(transport), Jwe.class);
    assertThat(JoseMapper.decodeSegment(jwe.protectedHeader(), "protected", JweProtected.class).typ())
        .isEqualTo("application/didcomm-encrypted+json");
    UnpackResult result = bob.unpack(transport, UnpackOptions.DEFAULT.withRequireEncryption(true));
    assertThat(result.provenance())
        .isEqualTo(new Provenance(EnvelopeMode.ENCRYPTED, null, aliceEc.keyId(), bobEc.keyId()));
    assertThat(result.payload()).isEqualTo(JoseMapper.mapper().valueToTree(PAYLOAD));
  }

  @Test
  void encrypted_anonymous() {
    String transport = alice.pack(PAYLOAD, SecurityMode.anonymous(List.of(bobEc.toPublicKey())));

    UnpackResult result = bob.unpack(transport);

    assertThat(result.provenance())
        .isEqualTo(new Provenance(EnvelopeMode.ENCRYPTED, null, null, bobEc.keyId()));
    assertThat(result.payload()).isEqualTo(JoseMapper.mapper().valueToTree(PAYLOAD));
  }

  @Test
  void encrypted_jwsShapedPayloadIsReturnedAsIs() {
    Map<String, Object> jwsShaped = Map.of("payload", "eyJ4IjoxfQ", "signatures", List.of());
    String transport = alice.pack(jwsShaped,
        SecurityMode.encrypted(aliceEc.keyId(), List.of(bobEc.toPublicKey())));

    UnpackResult result = bob.unpack(transport);

    assertThat(result.provenance().mode()).isEqualTo(EnvelopeMode.ENCRYPTED);
    assertThat(result.payload()).isEqualTo(JoseMapper.mapper().valueToTree(jwsShaped));
  }

  @Test
  void encrypted_forwardedJwsIsNotReportedAsSigned() {
    String signed = alice.pack(PAYLOAD, SecurityMode.signed(aliceSigning.keyId()));
    String forwarded = carol.pack(JoseMapper.readTree(signed), SecurityMode.anonymous(List.of(bobEc.toPublicKey())));

    UnpackResult result = bob.unpack(forwarded);

    assertThat(result.provenance().mode()).isEqualTo(EnvelopeMode.ENCRYPTED);
    assertThat(result.provenance().signerKid()).isNull();
    assertThat(result.payload()).isEqualTo(JoseMapper.readTree(signed));
  }

  @Test
  void encrypted_protectedHeaderJsonNullIsSerializationError() {
    String transport = alice.pack(PAYLOAD,
        SecurityMode.encrypted(aliceEc.keyId(), List.of(bobEc.toPublicKey())));
    Jwe jwe = JoseMapper.treeToValue(JoseMapper.readTree(transport), Jwe.class);
    Jwe nulled = new Jwe(jwe.ciphertext(), Base64Url.encode("null"), jwe.recipients(), jwe.tag(), jwe.iv());

    assertKind(() -> bob.unpack(JoseMapper.writeJson(nulled)), ErrorKind.SERIALIZATION_ERROR);
  }

  @Test
  void encrypted_rejectedWhenSignatureRequired() {
    String transport = alice.pack(PAYLOAD, SecurityMode.encrypted(aliceEc.keyId(), List.of(bobEc.toPublicKey())));

    assertKind(() -> bob.unpack(transport, UnpackOptions.DEFAULT.withRequireSignature(true)),
        ErrorKind.POLICY_VIOLATION);
  }

  @Test
  void encrypted_nonRecipientCannotUnpack() {
    String transport = alice.pack(PAYLOAD, SecurityMode.anonymous(List.of(bobEc.toPublicKey())));

    assertThatThrownBy(() -> carol.unpack(transport))
        .isInstanceOf(EnvelopeException.class)
        .hasMessage(EnvelopeException.NOT_INTENDED_RECIPIENT_REASON);
  }

  @Test
  void encrypted_senderMustBeAbleToEncrypt() {
    assertKind(() -> alice.pack(PAYLOAD, SecurityMode.encrypted(aliceSigning.keyId(), List.of(bobEc.toPublicKey()))),
        ErrorKind.UNSUPPORTED_ALGORITHM);
  }

  @Test
  void encrypted_expectedRecipientKidSelectsKey() {
    LocalAgentKey bobSecond = LocalAgentKey.generate(KeyType.P256, random);
    MessagePacker bobs = new MessagePacker(
        AgentKeyManager.builder().withKey(bobEc).withKey(bobSecond).build(), EnvelopeConfig.DEFAULT);
    String transport = alice.pack(PAYLOAD,
        SecurityMode.anonymous(List.of(bobEc.toPublicKey(), bobSecond.toPublicKey())));

    UnpackResult result = bobs.unpack(transport, UnpackOptions.DEFAULT.withExpectedRecipientKid(bobSecond.keyId()));

    assertThat(result.provenance().recipientKid()).isEqualTo(bobSecond.keyId());
    assertThat(bobs.unpack(transport).provenance().recipientKid()).isEqualTo(bobEc.keyId());
  }

  @Test
  void encrypted_expectedRecipientKidNotAmongRecipients() {
    String transport = alice.pack(PAYLOAD, SecurityMode.anonymous(List.of(carolEc.toPublicKey())));

    assertThatThrownBy(() -> bob.unpack(transport, UnpackOptions.DEFAULT.withExpectedRecipientKid(bobEc.keyId())))
        .isInstanceOf(EnvelopeException.class)
        .hasMessage(EnvelopeException.NOT_INTENDED_RECIPIENT_REASON);
  }

  // ─── Signed then encrypted ────────────────────────────────────────────────

  @Test
  void signedEncrypted_authenticatesSender() {
    String transport = alice.pack(PAYLOAD,
        SecurityMode.signedEncrypted(aliceSigning.keyId(), List.of(bobEc.toPublicKey())));

    UnpackResult result = bob.unpack(transport,
        UnpackOptions.DEFAULT.withRequireSignature(true).withRequireEncryption(true));

    assertThat(result.provenance()).isEqualTo(new Provenance(EnvelopeMode.SIGNED_ENCRYPTED,
        aliceSigning.keyId(), aliceSigning.keyId(), bobEc.keyId()));
    assertThat(result.payload()).isEqualTo(JoseMapper.mapper().valueToTree(PAYLOAD));
  }

  @Test
  void signedEncrypted_protectedHeaderNamesSignedContent() {
    String transport = alice.pack(PAYLOAD,
        SecurityMode.signedEncrypted(aliceSigning.keyId(), List.of(bobEc.toPublicKey())));

    Jwe jwe = JoseMapper.treeToValue(JoseMapper.readTree(transport), Jwe.class);
    JweProtected header = JoseMapper.decodeSegment(jwe.protectedHeader(), "protected", JweProtected.class);
    assertThat(header.typ()).isEqualTo(JweProtected.DEFAULT_TYP);
    assertThat(header.cty()).isEqualTo(JwsProtected.DEFAULT_TYP);
  }

  @Test
  void signedEncrypted_innerSignerMustMatchSender() {
    String signed = alice.pack(PAYLOAD, SecurityMode.signed(aliceSigning.keyId()));
    Jwe rewrapped = JweCodec.encrypt(signed.getBytes(StandardCharsets.UTF_8), List.of(bobEc.toPublicKey()),
        carolEc.keyId(), JweProtected.ofTyp(JweProtected.DEFAULT_TYP, JwsProtected.DEFAULT_TYP), random);

    assertKind(() -> bob.unpack(JoseMapper.writeJson(rewrapped)), ErrorKind.VERIFICATION_FAILED);
  }

  @Test
  void signedEncrypted_typedUnpack() {
    PlainMessage message = PlainMessage.create("https://tap.rsvp/schema/1.0#Transfer", aliceSigning.did(),
        List.of(bobEc.did()), JoseMapper.readTree("{\"amount\":\"1.00\"}"));
    String transport = alice.pack(message,
        SecurityMode.signedEncrypted(aliceSigning.keyId(), List.of(bobEc.toPublicKey())));

    PlainMessage unpacked = bob.unpack(transport, PlainMessage.class, UnpackOptions.DEFAULT);

    assertThat(unpacked).isEqualTo(message);
  }

  // ─── Plain messages ───────────────────────────────────────────────────────

  @Test
  void newMessage_usesConfiguredPlainMediaType() {
    EnvelopeConfig custom = new EnvelopeConfig(random, "application/custom-plain+json",
        JwsProtected.DEFAULT_TYP, JweProtected.DEFAULT_TYP);
    MessagePacker packer = new MessagePacker(AgentKeyManager.builder().withKey(aliceSigning).build(), custom);

    PlainMessage message = packer.newMessage("https://tap.rsvp/schema/1.0#Ping", aliceSigning.did(),
        List.of(bobEc.did()), JoseMapper.readTree("{}"));

    assertThat(message.typ()).isEqualTo("application/custom-plain+json");
    assertThat(message.from()).isEqualTo(aliceSigning.did());
    assertThat(alice.newMessage("t", null, null, null).typ()).isEqualTo(EnvelopeConfig.PLAIN_MEDIA_TYPE);
  }

  // ─── Malformed input ──────────────────────────────────────────────────────

  @Test
  void unpack_malformedJsonIsSerializationError() {
    assertKind(() -> bob.unpack("{\"payload\":"), ErrorKind.SERIALIZATION_ERROR);
    assertKind(() -> bob.unpack(""), ErrorKind.SERIALIZATION_ERROR);
    assertKind(() -> bob.unpack("{\"signatures\":42}"), ErrorKind.SERIALIZATION_ERROR);
  }

  @Test
  void nullArgumentsAreInvalid() {
    assertKind(() -> bob.unpack(null), ErrorKind.INVALID_PARAMETER);
    assertKind(() -> alice.pack(PAYLOAD, null), ErrorKind.INVALID_PARAMETER);
  }

  @Test
  void typedUnpack_wrongShapeIsSerializationError() {
    String transport = alice.pack(Map.of("to", "not-a-list"), SecurityMode.plain());

    assertKind(() -> bob.unpack(transport, PlainMessage.class, UnpackOptions.DEFAULT), ErrorKind.SERIALIZATION_ERROR);
  }

  private static void assertKind(Runnable call, ErrorKind kind) {
    assertThatThrownBy(call::run)
        .isInstanceOf(EnvelopeException.class)
        .satisfies(e -> assertThat(((EnvelopeException) e).kind()).isEqualTo(kind));
  }
}
