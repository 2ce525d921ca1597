package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Decoded JWS protected header.
 *
 * @param typ the media type
 * @param alg the signature algorithm
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"typ", "alg"})
public record JwsProtected(@JsonProperty("typ") String typ,
                           @JsonProperty("alg") String alg) {

  public static final String DEFAULT_TYP = "application/didcomm-signed+json";
}
