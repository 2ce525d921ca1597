package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * General JWS JSON serialization (RFC 7515 §7.2.1).
 *
 * @param payload    base64url payload
 * @param signatures one or more signatures over the payload
 */
@JsonPropertyOrder({"payload", "signatures"})
public record Jws(@JsonProperty("payload") String payload,
                  @JsonProperty("signatures") List<JwsSignature> signatures) {

  public Jws {
    signatures = signatures == null ? List.of() : List.copyOf(signatures);
  }
}
