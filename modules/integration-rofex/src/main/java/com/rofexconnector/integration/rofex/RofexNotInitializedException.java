package com.rofexconnector.integration.rofex;

public class RofexNotInitializedException extends RofexConnectorException {
  public RofexNotInitializedException(String message) {
    super(message);
  }
}
