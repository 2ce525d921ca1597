package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * General JWE JSON serialization (RFC 7516 §7.2.1) with one shared ciphertext and one wrapped
 * content key per recipient.
 *
 * @param ciphertext      base64url ciphertext
 * @param protectedHeader base64url protected header, also the AAD
 * @param recipients      the recipients
 * @param tag             base64url GCM tag
 * @param iv              base64url 96-bit IV
 */
@JsonPropertyOrder({"ciphertext", "protected", "recipients", "tag", "iv"})
public record Jwe(@JsonProperty("ciphertext") String ciphertext,
                  @JsonProperty("protected") String protectedHeader,
                  @JsonProperty("recipients") List<JweRecipient> recipients,
                  @JsonProperty("tag") String tag,
                  @JsonProperty("iv") String iv) {

  public Jwe {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }
}
