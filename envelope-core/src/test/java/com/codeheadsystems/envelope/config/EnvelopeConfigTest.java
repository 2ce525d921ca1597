package com.codeheadsystems.envelope.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.envelope.rfc.common.RandomProvider;
import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class EnvelopeConfigTest {

  @Test
  void default_usesDidcommMediaTypes() {
    assertThat(EnvelopeConfig.DEFAULT.plainMediaType()).isEqualTo("application/didcomm-plain+json");
    assertThat(EnvelopeConfig.DEFAULT.signedMediaType()).isEqualTo("application/didcomm-signed+json");
    assertThat(EnvelopeConfig.DEFAULT.encryptedMediaType()).isEqualTo("application/didcomm-encrypted+json");
    assertThat(EnvelopeConfig.DEFAULT.randomProvider()).isNotNull();
  }

  @Test
  void forTesting_keepsMediaTypesAndUsesGivenRandom() {
    SecureRandom random = new SecureRandom();

    EnvelopeConfig config = EnvelopeConfig.forTesting(random);

    assertThat(config.randomProvider().random()).isSameAs(random);
    assertThat(config.signedMediaType()).isEqualTo(EnvelopeConfig.DEFAULT.signedMediaType());
    assertThat(config.encryptedMediaType()).isEqualTo(EnvelopeConfig.DEFAULT.encryptedMediaType());
  }

  @Test
  void withRandomProvider_returnsCopy() {
    RandomProvider provider = new RandomProvider();

    EnvelopeConfig config = EnvelopeConfig.DEFAULT.withRandomProvider(provider);

    assertThat(config).isNotSameAs(EnvelopeConfig.DEFAULT);
    assertThat(config.randomProvider()).isSameAs(provider);
    assertThat(EnvelopeConfig.DEFAULT.randomProvider()).isNotSameAs(provider);
  }
}
