package com.rofexconnector.integration.rofex;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

final class RofexRequestPaths {
  static final String AUTH = "auth/getToken";
  static final String SEGMENTS = "rest/segment/all";
  static final String ALL_INSTRUMENTS = "rest/instruments/all";
  static final String DETAILED_INSTRUMENTS = "rest/instruments/details";

  private static final String INSTRUMENT_DETAIL = "rest/instruments/detail";
  private static final String MARKET_DATA = "rest/marketdata/get";
  private static final String TRADE_HISTORY = "rest/data/getTrades";
  private static final String ORDER_STATUS = "rest/order/id";
  private static final String NEW_ORDER = "rest/order/newSingleOrder";
  private static final String CANCEL_ORDER = "rest/order/cancelById";
  private static final String ALL_ORDERS = "rest/order/all";
  private static final String ACCOUNT_POSITION = "rest/risk/position/getPositions/";
  private static final String DETAILED_POSITION = "rest/risk/detailedPosition/";
  private static final String ACCOUNT_REPORT = "rest/risk/accountReport/";

  private static final DateTimeFormatter TRADE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;
  private static final DateTimeFormatter EXPIRE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  private RofexRequestPaths() {}

  static String instrumentDetails(String ticker, Market market) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", ticker);
    params.put("marketId", market.marketId());
    return withQuery(INSTRUMENT_DETAIL, params);
  }

  static String marketData(
      String ticker, Collection<MarketDataEntry> entries, int depth, Market market) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("marketId", market.marketId());
    params.put("symbol", ticker);
    params.put(
        "entries", entries.stream().map(MarketDataEntry::code).collect(Collectors.joining(",")));
    params.put("depth", Integer.toString(depth));
    return withQuery(MARKET_DATA, params);
  }

  static String tradeHistory(String ticker, LocalDate from, LocalDate to, Market market) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("marketId", market.marketId());
    params.put("symbol", ticker);
    params.put("dateFrom", TRADE_DATE.format(from));
    params.put("dateTo", TRADE_DATE.format(to));
    return withQuery(TRADE_HISTORY, params);
  }

  static String orderStatus(String clientOrderId, String proprietary) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("clOrdId", clientOrderId);
    params.put("proprietary", proprietary);
    return withQuery(ORDER_STATUS, params);
  }

  static String newOrder(NewOrderRequest request) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("marketId", request.market().marketId());
    params.put("symbol", request.ticker());
    if (request.orderType() == OrderType.LIMIT) {
      params.put("price", request.price().toPlainString());
    }
    params.put("orderQty", request.size().toPlainString());
    params.put("ordType", request.orderType().restValue());
    params.put("side", request.side().restValue());
    params.put("timeInForce", request.timeInForce().restValue());
    params.put("account", request.account());
    params.put("cancelPrevious", Boolean.toString(request.cancelPrevious()));
    if (request.timeInForce() == TimeInForce.GOOD_TILL_DATE) {
      params.put("expireDate", EXPIRE_DATE.format(request.expireDate()));
    }
    if (request.iceberg()) {
      params.put("iceberg", "true");
      params.put("displayQty", request.displayQuantity().toPlainString());
    }
    return withQuery(NEW_ORDER, params);
  }

  static String cancelOrder(String clientOrderId, String proprietary) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("clOrdId", clientOrderId);
    params.put("proprietary", proprietary);
    return withQuery(CANCEL_ORDER, params);
  }

  static String allOrders(String account) {
    return withQuery(ALL_ORDERS, Map.of("accountId", account));
  }

  static String accountPosition(String account) {
    return ACCOUNT_POSITION + pathSegment(account);
  }

  static String detailedPosition(String account) {
    return DETAILED_POSITION + pathSegment(account);
  }

  static String accountReport(String account) {
    return ACCOUNT_REPORT + pathSegment(account);
  }

  private static String withQuery(String path, Map<String, String> params) {
    StringBuilder query = new StringBuilder(path).append('?');
    boolean first = true;
    for (Map.Entry<String, String> entry : params.entrySet()) {
      if (!first) {
        query.append('&');
      }
      query.append(urlEncode(entry.getKey())).append('=').append(urlEncode(entry.getValue()));
      first = false;
    }
    return query.toString();
  }

  private static String pathSegment(String value) {
    return urlEncode(value).replace("+", "%20");
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
