package com.codeheadsystems.envelope.packing;

import com.codeheadsystems.envelope.jose.JoseMapper;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A recovered payload and how it was protected.
 *
 * @param payload    the payload JSON
 * @param provenance the provenance
 */
public record UnpackResult(JsonNode payload, Provenance provenance) {

  /**
   * Binds the payload to a Java type.
   *
   * @param type the type
   * @param <T>  the type
   * @return the bound payload
   */
  public <T> T payloadAs(Class<T> type) {
    return JoseMapper.treeToValue(payload, type);
  }
}
