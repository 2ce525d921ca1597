package com.codeheadsystems.envelope.jose;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.exceptions.ErrorKind;
import com.codeheadsystems.envelope.key.SigningKey;
import com.codeheadsystems.envelope.key.VerificationKey;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and verifies general-serialization JWS envelopes. The signing input is always
 * recomputed from the envelope's own protected and payload members.
 */
public class JwsCodec {

  private static final Logger log = LoggerFactory.getLogger(JwsCodec.class);

  private JwsCodec() {
  }

  /**
   * Signs a payload.
   *
   * @param key             the signing key
   * @param payload         the payload bytes
   * @param protectedHeader header to sign under, or null for the default typ; alg is always
   *                        the key's own algorithm
   * @return a JWS with a single signature
   */
  public static Jws sign(SigningKey key, byte[] payload, JwsProtected protectedHeader) {
    String payloadB64 = Base64Url.encode(payload);
    return new Jws(payloadB64, List.of(signature(key, payloadB64, protectedHeader)));
  }

  /**
   * Adds another signature over the same payload.
   *
   * @param jws the existing JWS
   * @param key the additional signer
   * @return a new JWS carrying every previous signature plus this one
   */
  public static Jws addSignature(Jws jws, SigningKey key) {
    List<JwsSignature> signatures = new ArrayList<>(jws.signatures());
    signatures.add(signature(key, jws.payload(), null));
    return new Jws(jws.payload(), signatures);
  }

  /**
   * Verifies against a single known key. Only signatures whose kid matches the key are tried.
   *
   * @param jws the JWS
   * @param key the verification key
   * @return the verified payload
   */
  public static Verified verify(Jws jws, VerificationKey key) {
    return verify(jws, kid -> {
      if (!key.keyId().equals(kid)) {
        throw EnvelopeException.keyNotFound(kid);
      }
      return key;
    });
  }

  /**
   * Verifies a JWS, accepting it when any signature verifies under the key its kid resolves to.
   *
   * @param jws      the JWS
   * @param resolver kid to key; throws KEY_NOT_FOUND for unknown kids
   * @return the verified payload and signer
   * @throws EnvelopeException VERIFICATION_FAILED if a key resolved but no signature verified,
   *                           KEY_NOT_FOUND if no signer key could be resolved
   */
  public static Verified verify(Jws jws, Function<String, ? extends VerificationKey> resolver) {
    if (jws.payload() == null || jws.signatures().isEmpty()) {
      throw EnvelopeException.verificationFailed("JWS has no payload or no signatures");
    }
    boolean anyKeyResolved = false;
    EnvelopeException lastMiss = null;
    for (JwsSignature candidate : jws.signatures()) {
      String kid = candidate.kid();
      if (kid == null || candidate.protectedHeader() == null || candidate.signature() == null) {
        continue;
      }
      VerificationKey key;
      try {
        key = resolver.apply(kid);
      } catch (EnvelopeException e) {
        if (e.kind() != ErrorKind.KEY_NOT_FOUND) {
          throw e;
        }
        lastMiss = e;
        continue;
      }
      anyKeyResolved = true;
      if (verifies(candidate, jws.payload(), key)) {
        log.debug("verify(kid={}) succeeded", kid);
        return new Verified(Base64Url.decode(jws.payload(), "payload"), kid,
            JoseMapper.decodeSegment(candidate.protectedHeader(), "protected", JwsProtected.class));
      }
    }
    if (!anyKeyResolved && lastMiss != null) {
      throw lastMiss;
    }
    throw EnvelopeException.verificationFailed("signature verification failed");
  }

  private static JwsSignature signature(SigningKey key, String payloadB64, JwsProtected protectedHeader) {
    String typ = protectedHeader != null && protectedHeader.typ() != null
        ? protectedHeader.typ() : JwsProtected.DEFAULT_TYP;
    JwsProtected header = new JwsProtected(typ, key.recommendedJwsAlgorithm().value());
    String protectedB64 = JoseMapper.encodeSegment(header);
    byte[] signature = key.sign(signingInput(protectedB64, payloadB64));
    log.debug("sign(kid={}, alg={})", key.keyId(), header.alg());
    return new JwsSignature(protectedB64, Base64Url.encode(signature), new JwsHeader(key.keyId()));
  }

  // Malformed members count as a failed signature rather than an error.
  private static boolean verifies(JwsSignature candidate, String payloadB64, VerificationKey key) {
    JwsProtected header;
    byte[] signature;
    try {
      header = JoseMapper.decodeSegment(candidate.protectedHeader(), "protected", JwsProtected.class);
      signature = Base64Url.decode(candidate.signature(), "signature");
    } catch (EnvelopeException e) {
      log.debug("verify(kid={}) rejected malformed member: {}", candidate.kid(), e.getMessage());
      return false;
    }
    return key.verifySignature(signingInput(candidate.protectedHeader(), payloadB64), signature, header);
  }

  static byte[] signingInput(String protectedB64, String payloadB64) {
    return (protectedB64 + "." + payloadB64).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * A verified JWS.
   *
   * @param payload         the payload bytes
   * @param signerKid       the kid whose signature verified
   * @param protectedHeader the protected header of that signature
   */
  public record Verified(byte[] payload, String signerKid, JwsProtected protectedHeader) {
  }
}
