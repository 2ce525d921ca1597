package com.codeheadsystems.envelope.integration;

import com.codeheadsystems.envelope.key.KeyType;

class Secp256k1ConversationTest extends AbstractConversationTest {

  @Override
  protected KeyType signingKeyType() {
    return KeyType.SECP256K1;
  }

  @Override
  protected KeyType encryptionKeyType() {
    return KeyType.SECP256K1;
  }
}
