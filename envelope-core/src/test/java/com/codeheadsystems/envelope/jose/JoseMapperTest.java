package com.codeheadsystems.envelope.jose;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.exceptions.ErrorKind;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JoseMapperTest {

  @Test
  void canonicalBytes_sortsKeysAtEveryDepth() {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("z", 1);
    inner.put("a", 2);
    Map<String, Object> outer = new LinkedHashMap<>();
    outer.put("list", List.of(inner));
    outer.put("body", inner);
    outer.put("amount", "10.00");

    assertThat(new String(JoseMapper.canonicalBytes(outer), StandardCharsets.UTF_8))
        .isEqualTo("{\"amount\":\"10.00\",\"body\":{\"a\":2,\"z\":1},\"list\":[{\"a\":2,\"z\":1}]}");
  }

  @Test
  void canonicalBytes_sameForTreeAndMap() {
    JsonNode tree = JoseMapper.readTree("{ \"b\" : true, \"a\" : [1, 2] }");

    assertThat(JoseMapper.canonicalBytes(tree))
        .isEqualTo(JoseMapper.canonicalBytes(Map.of("a", List.of(1, 2), "b", true)));
  }

  @Test
  void canonicalBytes_recordUsesPropertyNames() {
    JweHeader header = new JweHeader("did:example:bob#key-1", "did:example:alice#key-1");

    assertThat(new String(JoseMapper.canonicalBytes(header), StandardCharsets.UTF_8))
        .isEqualTo("{\"kid\":\"did:example:bob#key-1\",\"sender_kid\":\"did:example:alice#key-1\"}");
  }

  @Test
  void canonicalBytes_unserializableIsSerializationError() {
    assertKind(() -> JoseMapper.canonicalBytes(new Object()), ErrorKind.SERIALIZATION_ERROR);
  }

  @Test
  void readTree_malformedIsSerializationError() {
    assertKind(() -> JoseMapper.readTree("{\"payload\":"), ErrorKind.SERIALIZATION_ERROR);
    assertKind(() -> JoseMapper.readTree("{oops}".getBytes(StandardCharsets.UTF_8)), ErrorKind.SERIALIZATION_ERROR);
  }

  @Test
  void treeToValue_ignoresUnknownMembers() {
    JsonNode node = JoseMapper.readTree("{\"typ\":\"t\",\"alg\":\"EdDSA\",\"cty\":\"x\"}");

    assertThat(JoseMapper.treeToValue(node, JwsProtected.class)).isEqualTo(new JwsProtected("t", "EdDSA"));
  }

  @Test
  void treeToValue_wrongShapeIsSerializationError() {
    JsonNode node = JoseMapper.readTree("{\"signatures\":\"not-a-list\"}");

    assertKind(() -> JoseMapper.treeToValue(node, Jws.class), ErrorKind.SERIALIZATION_ERROR);
  }

  @Test
  void segment_roundTrip() {
    JwsProtected header = new JwsProtected(JwsProtected.DEFAULT_TYP, "ES256K");

    String segment = JoseMapper.encodeSegment(header);

    assertThat(segment).doesNotContain("=", "+", "/");
    assertThat(new String(Base64Url.decode(segment, "protected"), StandardCharsets.UTF_8))
        .isEqualTo("{\"typ\":\"application/didcomm-signed+json\",\"alg\":\"ES256K\"}");
    assertThat(JoseMapper.decodeSegment(segment, "protected", JwsProtected.class)).isEqualTo(header);
  }

  @Test
  void decodeSegment_errors() {
    assertKind(() -> JoseMapper.decodeSegment(null, "protected", JwsProtected.class), ErrorKind.INVALID_FORMAT);
    assertKind(() -> JoseMapper.decodeSegment(Base64Url.encode("[1,2"), "protected", JwsProtected.class),
        ErrorKind.SERIALIZATION_ERROR);
    assertKind(() -> JoseMapper.decodeSegment(Base64Url.encode("null"), "protected", JwsProtected.class),
        ErrorKind.SERIALIZATION_ERROR);
  }

  @Test
  void writeJson_jwsWireForm() {
    Jws jws = new Jws("e30", List.of(new JwsSignature("eyJ9", "c2ln", new JwsHeader("did:example:a#1"))));

    assertThat(JoseMapper.writeJson(jws)).isEqualTo(
        "{\"payload\":\"e30\",\"signatures\":[{\"protected\":\"eyJ9\",\"signature\":\"c2ln\","
            + "\"header\":{\"kid\":\"did:example:a#1\"}}]}");
  }

  private static void assertKind(Runnable call, ErrorKind kind) {
    assertThatThrownBy(call::run)
        .isInstanceOf(EnvelopeException.class)
        .satisfies(e -> assertThat(((EnvelopeException) e).kind()).isEqualTo(kind));
  }
}
