package com.rofexconnector.integration.rofex;

public class RofexAuthenticationException extends RofexConnectorException {
  public RofexAuthenticationException(String message, int httpStatus) {
    super(message, httpStatus);
  }
}
