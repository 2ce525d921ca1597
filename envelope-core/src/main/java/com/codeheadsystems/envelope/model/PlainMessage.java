package com.codeheadsystems.envelope.model;

import com.codeheadsystems.envelope.config.EnvelopeConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * DIDComm v2 plaintext message, the usual payload of an envelope.
 *
 * @param id          unique message id
 * @param typ         media type, application/didcomm-plain+json
 * @param type        message type URI
 * @param from        sender DID
 * @param to          recipient DIDs
 * @param thid        thread id
 * @param pthid       parent thread id
 * @param createdTime creation time, epoch seconds
 * @param expiresTime expiry time, epoch seconds
 * @param body        message body
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlainMessage(@JsonProperty("id") String id,
                           @JsonProperty("typ") String typ,
                           @JsonProperty("type") String type,
                           @JsonProperty("from") String from,
                           @JsonProperty("to") List<String> to,
                           @JsonProperty("thid") String thid,
                           @JsonProperty("pthid") String pthid,
                           @JsonProperty("created_time") Long createdTime,
                           @JsonProperty("expires_time") Long expiresTime,
                           @JsonProperty("body") JsonNode body) {

  /**
   * Creates a new message with a random id and the current time.
   *
   * @param type the message type URI
   * @param from the sender DID
   * @param to   the recipient DIDs
   * @param body the body
   * @return the message
   */
  public static PlainMessage create(String type, String from, List<String> to, JsonNode body) {
    return create(EnvelopeConfig.PLAIN_MEDIA_TYPE, type, from, to, body);
  }

  /**
   * Creates a new message under an explicit media type.
   *
   * @param typ  the media type
   * @param type the message type URI
   * @param from the sender DID
   * @param to   the recipient DIDs
   * @param body the body
   * @return the message
   */
  public static PlainMessage create(String typ, String type, String from, List<String> to,
                                    JsonNode body) {
    return new PlainMessage(UUID.randomUUID().toString(), typ, type,
        from, to == null ? null : List.copyOf(to), null, null, Instant.now().getEpochSecond(), null, body);
  }

  public PlainMessage withThread(String threadId) {
    return new PlainMessage(id, typ, type, from, to, threadId, pthid, createdTime, expiresTime, body);
  }

  public PlainMessage withExpiresTime(Instant expires) {
    return new PlainMessage(id, typ, type, from, to, thid, pthid, createdTime,
        expires.getEpochSecond(), body);
  }

  public boolean isExpired(Instant now) {
    return expiresTime != null && now.getEpochSecond() >= expiresTime;
  }
}
