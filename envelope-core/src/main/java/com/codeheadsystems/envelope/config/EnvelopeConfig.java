package com.codeheadsystems.envelope.config;

import com.codeheadsystems.envelope.jose.JweProtected;
import com.codeheadsystems.envelope.jose.JwsProtected;
import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import java.security.SecureRandom;

/**
 * Configuration for packing: the random source and the media types written into envelopes.
 *
 * @param randomProvider     source of ephemeral keys, CEKs and IVs
 * @param plainMediaType     media type of an unprotected message
 * @param signedMediaType    typ of the JWS protected header
 * @param encryptedMediaType typ of the JWE protected header
 */
public record EnvelopeConfig(RandomProvider randomProvider,
                             String plainMediaType,
                             String signedMediaType,
                             String encryptedMediaType) {

  public static final String PLAIN_MEDIA_TYPE = "application/didcomm-plain+json";

  /**
   * DIDComm media types with a default {@link SecureRandom}.
   */
  public static final EnvelopeConfig DEFAULT = new EnvelopeConfig(
      new RandomProvider(),
      PLAIN_MEDIA_TYPE,
      JwsProtected.DEFAULT_TYP,
      JweProtected.DEFAULT_TYP
  );

  /**
   * Default media types with a caller-supplied random source, e.g. a seeded one in tests.
   *
   * @param random the random
   * @return the config
   */
  public static EnvelopeConfig forTesting(SecureRandom random) {
    return DEFAULT.withRandomProvider(new RandomProvider(random));
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param provider the provider
   * @return the config
   */
  public EnvelopeConfig withRandomProvider(RandomProvider provider) {
    return new EnvelopeConfig(provider, plainMediaType, signedMediaType, encryptedMediaType);
  }
}
