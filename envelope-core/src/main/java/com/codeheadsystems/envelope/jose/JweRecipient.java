package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One entry of the JWE "recipients" array.
 *
 * @param encryptedKey base64url of the content key wrapped for this recipient
 * @param header       the recipient header
 */
@JsonPropertyOrder({"encrypted_key", "header"})
public record JweRecipient(@JsonProperty("encrypted_key") String encryptedKey,
                           @JsonProperty("header") JweHeader header) {

  public String kid() {
    return header == null ? null : header.kid();
  }

  public String senderKid() {
    return header == null ? null : header.senderKid();
  }
}
