package com.codeheadsystems.envelope.did;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.jose.Jwk;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches to a per-method resolver by the DID method name ("key" in did:key:...).
 */
public class MultiResolver implements KeyResolver {

  private static final Logger log = LoggerFactory.getLogger(MultiResolver.class);

  private final Map<String, KeyResolver> resolvers;

  /**
   * Instantiates a new resolver.
   *
   * @param resolvers DID method name to resolver
   */
  public MultiResolver(final Map<String, KeyResolver> resolvers) {
    log.info("MultiResolver({})", resolvers.keySet());
    this.resolvers = Map.copyOf(resolvers);
  }

  /**
   * A resolver that only understands did:key.
   *
   * @return the resolver
   */
  public static MultiResolver didKeyOnly() {
    return new MultiResolver(Map.of("key", new DidKeyResolver()));
  }

  @Override
  public Jwk resolve(String didOrKeyId) {
    KeyResolver resolver = resolvers.get(methodOf(didOrKeyId));
    if (resolver == null) {
      log.debug("resolve({}): no resolver for method", didOrKeyId);
      throw EnvelopeException.keyNotFound(didOrKeyId);
    }
    return resolver.resolve(didOrKeyId);
  }

  static String methodOf(String didOrKeyId) {
    if (didOrKeyId == null || !didOrKeyId.startsWith("did:")) {
      return "";
    }
    int end = didOrKeyId.indexOf(':', 4);
    return end < 0 ? "" : didOrKeyId.substring(4, end);
  }
}
