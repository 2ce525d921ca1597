package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One entry of a general-serialization JWS "signatures" array.
 *
 * @param protectedHeader base64url of the protected header JSON
 * @param signature       base64url of the raw signature
 * @param header          unprotected header carrying the kid
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"protected", "signature", "header"})
public record JwsSignature(@JsonProperty("protected") String protectedHeader,
                           @JsonProperty("signature") String signature,
                           @JsonProperty("header") JwsHeader header) {

  public String kid() {
    return header == null ? null : header.kid();
  }
}
