package com.mk.fx.qa.vecro.transport;

/**
 * Encoded response ready to be written back.
 *
 * @param status HTTP status code
 * @param contentType media type of {@code body}
 * @param body encoded bytes
 */
public record ServerResponse(int status, String contentType, byte[] body) {

  public long size() {
    return body.length;
  }
}
