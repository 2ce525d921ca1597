package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Decoded JWE protected header, shared by every recipient.
 *
 * @param epk the ephemeral public key
 * @param apv base64url of the recipient-set digest
 * @param typ the media type
 * @param cty the content type, set when the plaintext is a signed envelope
 * @param enc content encryption, A256GCM
 * @param alg key management, ECDH-ES+A256KW
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"epk", "apv", "typ", "cty", "enc", "alg"})
public record JweProtected(@JsonProperty("epk") Jwk epk,
                           @JsonProperty("apv") String apv,
                           @JsonProperty("typ") String typ,
                           @JsonProperty("cty") String cty,
                           @JsonProperty("enc") String enc,
                           @JsonProperty("alg") String alg) {

  public static final String DEFAULT_TYP = "application/didcomm-encrypted+json";

  /**
   * A header template that only sets the media type; the codec fills in the rest.
   *
   * @param typ the typ
   * @return the template
   */
  public static JweProtected ofTyp(String typ) {
    return new JweProtected(null, null, typ, null, null, null);
  }

  /**
   * A header template for a JWE whose plaintext is itself an envelope of type {@code cty}.
   *
   * @param typ the typ
   * @param cty the content type
   * @return the template
   */
  public static JweProtected ofTyp(String typ, String cty) {
    return new JweProtected(null, null, typ, cty, null, null);
  }
}
