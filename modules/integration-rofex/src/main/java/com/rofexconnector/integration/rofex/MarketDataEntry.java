package com.rofexconnector.integration.rofex;

import java.util.EnumSet;
import java.util.Set;

public enum MarketDataEntry {
  BIDS("BI"),
  OFFERS("OF"),
  LAST("LA"),
  OPENING_PRICE("OP"),
  CLOSING_PRICE("CL"),
  SETTLEMENT_PRICE("SE"),
  HIGH_PRICE("HI"),
  LOW_PRICE("LO"),
  TRADE_VOLUME("TV"),
  OPEN_INTEREST("OI"),
  INDEX_VALUE("IV"),
  TRADE_EFFECTIVE_VOLUME("EV"),
  NOMINAL_VOLUME("NV");

  private final String code;

  MarketDataEntry(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Set<MarketDataEntry> all() {
    return EnumSet.allOf(MarketDataEntry.class);
  }
}
