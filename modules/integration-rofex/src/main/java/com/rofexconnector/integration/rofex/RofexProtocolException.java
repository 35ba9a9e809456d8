package com.rofexconnector.integration.rofex;

/** Raised for inbound frames that cannot be parsed. Only ever delivered to exception handlers. */
public class RofexProtocolException extends RofexConnectorException {
  private final String rawPayload;

  public RofexProtocolException(String message, String rawPayload, Throwable cause) {
    super(message, NO_HTTP_STATUS, cause);
    this.rawPayload = rawPayload;
  }

  public RofexProtocolException(String message, String rawPayload) {
    super(message);
    this.rawPayload = rawPayload;
  }

  public String rawPayload() {
    return rawPayload;
  }
}
