package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Objects;

/** Builds the outbound websocket frames. Field order follows the exchange documentation. */
public class StreamRequestEncoder {
  private static final DateTimeFormatter EXPIRE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  private final ObjectMapper objectMapper;

  public StreamRequestEncoder(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  public String marketDataSubscription(
      Collection<Instrument> instruments, Collection<MarketDataEntry> entries, int depth) {
    if (instruments == null || instruments.isEmpty()) {
      throw new IllegalArgumentException("at least one instrument is required");
    }
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("at least one market data entry is required");
    }
    if (depth < 1) {
      throw new IllegalArgumentException("depth must be >= 1");
    }
    ObjectNode root = objectMapper.createObjectNode();
    root.put("type", "smd");
    root.put("level", 1);
    root.put("depth", depth);
    ArrayNode entriesNode = root.putArray("entries");
    for (MarketDataEntry entry : entries) {
      if (entry == null) {
        throw new IllegalArgumentException("Invalid Market Data Entry: null");
      }
      entriesNode.add(entry.code());
    }
    ArrayNode products = root.putArray("products");
    for (Instrument instrument : instruments) {
      ObjectNode product = products.addObject();
      product.put("symbol", instrument.symbol());
      product.put("marketId", instrument.market().marketId());
    }
    return write(root);
  }

  public String orderReportSubscription(String account, boolean snapshotOnlyActive) {
    requireText(account, "account");
    ObjectNode root = objectMapper.createObjectNode();
    root.put("type", "os");
    root.putObject("account").put("id", account);
    root.put("snapshotOnlyActive", snapshotOnlyActive);
    return write(root);
  }

  public String newOrder(NewOrderRequest request) {
    Objects.requireNonNull(request, "request is required");
    requireText(request.account(), "account");
    ObjectNode root = objectMapper.createObjectNode();
    root.put("type", "no");
    ObjectNode product = root.putObject("product");
    product.put("marketId", request.market().marketId());
    product.put("symbol", request.ticker());
    root.put("quantity", request.size());
    root.put("ordType", request.orderType().wireValue());
    root.put("side", request.side().wireValue());
    root.put("account", request.account());
    root.put("allOrNone", request.allOrNone());
    root.put("timeInForce", request.timeInForce().wireValue());
    if (request.orderType() == OrderType.LIMIT) {
      root.put("price", request.price());
    }
    if (request.cancelPrevious()) {
      root.put("cancelPrevious", true);
    }
    if (request.iceberg()) {
      root.put("iceberg", true);
      root.put("displayQuantity", request.displayQuantity());
    }
    if (request.timeInForce() == TimeInForce.GOOD_TILL_DATE) {
      root.put("expireDate", EXPIRE_DATE.format(request.expireDate()));
    }
    if (request.clientOrderId() != null) {
      root.put("wsClOrdId", request.clientOrderId());
    }
    return write(root);
  }

  public String cancelOrder(String clientOrderId, String proprietary) {
    requireText(clientOrderId, "clientOrderId");
    requireText(proprietary, "proprietary");
    ObjectNode root = objectMapper.createObjectNode();
    root.put("type", "co");
    root.put("clientId", clientOrderId);
    root.put("proprietary", proprietary);
    return write(root);
  }

  private String write(ObjectNode root) {
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize websocket request", ex);
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
