package com.rofexconnector.integration.rofex;

public class RofexNotConnectedException extends RofexConnectorException {
  public RofexNotConnectedException(String message) {
    super(message);
  }
}
