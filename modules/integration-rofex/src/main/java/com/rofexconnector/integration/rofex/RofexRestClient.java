package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.util.Collection;

public interface RofexRestClient {
  JsonNode get(String path);

  JsonNode getSegments();

  JsonNode getAllInstruments();

  JsonNode getDetailedInstruments();

  JsonNode getInstrumentDetails(String ticker, Market market);

  JsonNode getMarketData(
      String ticker, Collection<MarketDataEntry> entries, int depth, Market market);

  JsonNode getTradeHistory(String ticker, LocalDate from, LocalDate to, Market market);

  JsonNode getOrderStatus(String clientOrderId, String proprietary);

  JsonNode sendOrder(NewOrderRequest request);

  JsonNode cancelOrder(String clientOrderId, String proprietary);

  JsonNode getAllOrdersByAccount(String account);

  JsonNode getAccountPosition(String account);

  JsonNode getDetailedPosition(String account);

  JsonNode getAccountReport(String account);
}
