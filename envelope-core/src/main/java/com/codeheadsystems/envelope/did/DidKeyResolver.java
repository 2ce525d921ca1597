package com.codeheadsystems.envelope.did;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.Jwk;
import com.codeheadsystems.envelope.key.JwkKeys;
import com.codeheadsystems.envelope.key.KeyType;
import com.codeheadsystems.envelope.rfc.common.Base64Url;
import com.codeheadsystems.envelope.rfc.curve.Curve;
import javax.inject.Singleton;

/**
 * Resolves did:key identifiers locally; the key is encoded in the identifier itself.
 */
@Singleton
public class DidKeyResolver implements KeyResolver {

  @Override
  public Jwk resolve(String didOrKeyId) {
    if (!DidKey.isDidKey(didOrKeyId)) {
      throw EnvelopeException.keyNotFound(didOrKeyId);
    }
    String did = DidKey.didOf(didOrKeyId);
    String keyId = DidKey.keyIdFor(did);
    if (!did.equals(didOrKeyId) && !keyId.equals(didOrKeyId)) {
      throw EnvelopeException.keyNotFound(didOrKeyId);
    }
    try {
      return toJwk(DidKey.decode(did)).withKid(keyId);
    } catch (EnvelopeException e) {
      throw EnvelopeException.keyNotFound(didOrKeyId, e);
    }
  }

  private static Jwk toJwk(DidKey.Decoded decoded) {
    KeyType keyType = decoded.keyType();
    if (keyType == KeyType.ED25519) {
      return Jwk.okp(keyType.crv(), Base64Url.encode(decoded.publicKey()));
    }
    Curve curve = keyType.curve();
    return JwkKeys.ecJwk(curve, curve.decodePoint(decoded.publicKey()));
  }
}
