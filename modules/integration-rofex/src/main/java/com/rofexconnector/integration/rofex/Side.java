package com.rofexconnector.integration.rofex;

import java.util.Locale;

public enum Side {
  BUY("buy"),
  SELL("sell");

  private final String restValue;

  Side(String restValue) {
    this.restValue = restValue;
  }

  public String restValue() {
    return restValue;
  }

  public String wireValue() {
    return restValue.toUpperCase(Locale.ROOT);
  }
}
