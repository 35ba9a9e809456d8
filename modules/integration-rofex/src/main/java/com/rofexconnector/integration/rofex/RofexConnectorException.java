package com.rofexconnector.integration.rofex;

public class RofexConnectorException extends RuntimeException {
  public static final int NO_HTTP_STATUS = -1;

  private final int httpStatus;

  public RofexConnectorException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }

  public RofexConnectorException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public RofexConnectorException(String message) {
    this(message, NO_HTTP_STATUS);
  }

  public int httpStatus() {
    return httpStatus;
  }
}
