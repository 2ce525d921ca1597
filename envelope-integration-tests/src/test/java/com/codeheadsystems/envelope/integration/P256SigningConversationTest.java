package com.codeheadsystems.envelope.integration;

import com.codeheadsystems.envelope.key.KeyType;

/**
 * ES256 signatures over P-256 encryption.
 */
class P256SigningConversationTest extends AbstractConversationTest {

  @Override
  protected KeyType signingKeyType() {
    return KeyType.P256;
  }

  @Override
  protected KeyType encryptionKeyType() {
    return KeyType.P256;
  }
}
