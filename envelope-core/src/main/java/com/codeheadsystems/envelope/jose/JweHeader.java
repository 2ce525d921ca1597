package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-recipient unprotected header.
 *
 * @param kid       the recipient key id
 * @param senderKid optional, unauthenticated sender hint, bound into the KEK derivation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kid", "sender_kid"})
public record JweHeader(@JsonProperty("kid") String kid,
                        @JsonProperty("sender_kid") String senderKid) {
}
