package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unprotected per-signature header.
 *
 * @param kid the signing key id
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JwsHeader(@JsonProperty("kid") String kid) {
}
