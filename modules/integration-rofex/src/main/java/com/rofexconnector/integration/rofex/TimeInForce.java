package com.rofexconnector.integration.rofex;

import java.util.Locale;

/** Order lifetime modifier. {@link #GOOD_TILL_DATE} orders must carry an expiration date. */
public enum TimeInForce {
  DAY("Day"),
  IMMEDIATE_OR_CANCEL("IOC"),
  FILL_OR_KILL("FOK"),
  GOOD_TILL_DATE("GTD");

  private final String restValue;

  TimeInForce(String restValue) {
    this.restValue = restValue;
  }

  public String restValue() {
    return restValue;
  }

  public String wireValue() {
    return restValue.toUpperCase(Locale.ROOT);
  }
}
