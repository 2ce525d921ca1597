package com.codeheadsystems.envelope.jose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * JSON Web Key (RFC 7517) restricted to the OKP and EC members the envelope uses.
 *
 * @param kty key type, "OKP" or "EC"
 * @param crv curve name
 * @param x   base64url x coordinate or OKP public key
 * @param y   base64url y coordinate, EC only
 * @param d   base64url private key, present only on an explicit export
 * @param kid optional key id
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kty", "crv", "x", "y", "d", "kid"})
public record Jwk(@JsonProperty("kty") String kty,
                  @JsonProperty("crv") String crv,
                  @JsonProperty("x") String x,
                  @JsonProperty("y") String y,
                  @JsonProperty("d") String d,
                  @JsonProperty("kid") String kid) {

  public static Jwk okp(String crv, String x) {
    return new Jwk("OKP", crv, x, null, null, null);
  }

  public static Jwk ec(String crv, String x, String y) {
    return new Jwk("EC", crv, x, y, null, null);
  }

  public boolean isPrivate() {
    return d != null;
  }

  /**
   * Drops any private member.
   *
   * @return the public part of this key
   */
  public Jwk publicOnly() {
    return new Jwk(kty, crv, x, y, null, kid);
  }

  public Jwk withKid(String keyId) {
    return new Jwk(kty, crv, x, y, d, keyId);
  }

  public Jwk withD(String privateKey) {
    return new Jwk(kty, crv, x, y, privateKey, kid);
  }

  @Override
  public String toString() {
    // d is never printed.
    return "Jwk[kty=" + kty + ", crv=" + crv + ", kid=" + kid + (d == null ? "]" : ", d=***]");
  }
}
