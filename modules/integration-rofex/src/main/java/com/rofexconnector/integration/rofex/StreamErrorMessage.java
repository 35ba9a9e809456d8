package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;

public record StreamErrorMessage(Kind kind, String description, JsonNode payload) {
  static final String UNSUPPORTED_TYPE_NOTICE = "Websocket: Message Type not Supported. Message: ";
  static final String UNSUPPORTED_MESSAGE_NOTICE = "Websocket: Message not Supported. Message: ";

  public enum Kind {
    /** The exchange answered with {@code "status":"ERROR"}. */
    ERROR_STATUS,
    UNSUPPORTED_TYPE,
    UNSUPPORTED_MESSAGE
  }

  public StreamErrorMessage {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    description = description == null ? "" : description;
  }

  static StreamErrorMessage errorStatus(JsonNode payload) {
    String description = "";
    for (String field : new String[] {"description", "msg", "message"}) {
      if (payload.hasNonNull(field)) {
        description = payload.get(field).asText();
        break;
      }
    }
    return new StreamErrorMessage(Kind.ERROR_STATUS, description, payload);
  }

  static StreamErrorMessage unsupportedType(JsonNode payload) {
    return new StreamErrorMessage(
        Kind.UNSUPPORTED_TYPE, UNSUPPORTED_TYPE_NOTICE + payload, payload);
  }

  static StreamErrorMessage unsupportedMessage(JsonNode payload) {
    return new StreamErrorMessage(
        Kind.UNSUPPORTED_MESSAGE, UNSUPPORTED_MESSAGE_NOTICE + payload, payload);
  }
}
