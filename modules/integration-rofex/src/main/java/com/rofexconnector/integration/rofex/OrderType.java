package com.rofexconnector.integration.rofex;

import java.util.Locale;

public enum OrderType {
  LIMIT("limit"),
  MARKET("market"),
  MARKET_TO_LIMIT("market_to_limit");

  private final String restValue;

  OrderType(String restValue) {
    this.restValue = restValue;
  }

  public String restValue() {
    return restValue;
  }

  public String wireValue() {
    return restValue.toUpperCase(Locale.ROOT);
  }
}
