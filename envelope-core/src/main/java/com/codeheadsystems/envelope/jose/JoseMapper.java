package com.codeheadsystems.envelope.jose;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;

/**
 * Jackson configuration shared by the envelope codecs. Payloads are written in a canonical form
 * (object keys sorted, no whitespace) so both ends hash and sign the same bytes.
 */
public class JoseMapper {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private static final ObjectWriter CANONICAL = MAPPER.writer()
      .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  private JoseMapper() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Serializes any JSON-mappable value with sorted keys at every depth.
   *
   * @param payload a record, map, {@link JsonNode} or other Jackson-mappable value
   * @return UTF-8 JSON
   */
  public static byte[] canonicalBytes(Object payload) {
    try {
      Object generic = MAPPER.convertValue(payload, Object.class);
      return CANONICAL.writeValueAsBytes(generic);
    } catch (IllegalArgumentException | JsonProcessingException e) {
      throw EnvelopeException.serializationError("payload is not JSON-serializable", e);
    }
  }

  /**
   * Writes an envelope structure as JSON in its declared member order.
   *
   * @param value the value
   * @return the JSON text
   */
  public static String writeJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw EnvelopeException.serializationError("failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw EnvelopeException.serializationError("malformed JSON", e);
    }
  }

  public static JsonNode readTree(byte[] json) {
    try {
      return MAPPER.readTree(json);
    } catch (IOException e) {
      throw EnvelopeException.serializationError("malformed JSON", e);
    }
  }

  /**
   * Binds a JSON tree to an envelope type.
   *
   * @param node the tree
   * @param type the target type
   * @param <T>  the type
   * @return the bound value
   */
  public static <T> T treeToValue(JsonNode node, Class<T> type) {
    try {
      return MAPPER.treeToValue(node, type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw EnvelopeException.serializationError("not a valid " + type.getSimpleName(), e);
    }
  }

  /**
   * Base64url of a header's JSON.
   *
   * @param header the header
   * @return the encoded segment
   */
  public static String encodeSegment(Object header) {
    try {
      return Base64Url.encode(MAPPER.writeValueAsBytes(header));
    } catch (JsonProcessingException e) {
      throw EnvelopeException.serializationError("failed to serialize header", e);
    }
  }

  /**
   * Decodes a base64url JSON segment such as a protected header.
   *
   * @param segment the encoded segment
   * @param field   the member name, for error messages
   * @param type    the target type
   * @param <T>     the type
   * @return the decoded header, never null
   */
  public static <T> T decodeSegment(String segment, String field, Class<T> type) {
    byte[] json = Base64Url.decode(segment, field);
    T value;
    try {
      value = MAPPER.readValue(json, type);
    } catch (IOException e) {
      throw EnvelopeException.serializationError(field + " is not a valid " + type.getSimpleName(), e);
    }
    if (value == null) {
      throw EnvelopeException.serializationError(field + " is not a " + type.getSimpleName());
    }
    return value;
  }
}
