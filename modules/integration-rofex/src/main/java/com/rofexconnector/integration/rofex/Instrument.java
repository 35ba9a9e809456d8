package com.rofexconnector.integration.rofex;

public record Instrument(String symbol, Market market) {
  public Instrument {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    if (market == null) {
      throw new IllegalArgumentException("market is required");
    }
  }

  public static Instrument of(String symbol, Market market) {
    return new Instrument(symbol, market);
  }
}
