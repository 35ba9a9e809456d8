package com.rofexconnector.integration.rofex;

public class RofexConnectionException extends RofexConnectorException {
  public RofexConnectionException(String message) {
    super(message);
  }

  public RofexConnectionException(String message, Throwable cause) {
    super(message, NO_HTTP_STATUS, cause);
  }
}
