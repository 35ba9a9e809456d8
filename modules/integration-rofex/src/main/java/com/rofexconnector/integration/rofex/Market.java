package com.rofexconnector.integration.rofex;

public enum Market {
  ROFEX("ROFX");

  private final String marketId;

  Market(String marketId) {
    this.marketId = marketId;
  }

  public String marketId() {
    return marketId;
  }
}
