package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

enum InboundMessageType {
  ERROR("error"),
  MARKET_DATA("market_data"),
  ORDER_REPORT("order_report"),
  UNSUPPORTED_TYPE("unsupported_type"),
  UNSUPPORTED_MESSAGE("unsupported_message");

  private static final String ERROR_STATUS = "ERROR";
  private static final String MARKET_DATA_TYPE = "MD";
  private static final String ORDER_REPORT_TYPE = "OR";

  private final String metricTag;

  InboundMessageType(String metricTag) {
    this.metricTag = metricTag;
  }

  String metricTag() {
    return metricTag;
  }

  // First match wins: an error status outranks the type field.
  static InboundMessageType classify(JsonNode root) {
    if (ERROR_STATUS.equals(root.path("status").asText(null))) {
      return ERROR;
    }
    if (root.has("type")) {
      String type = root.get("type").asText("").toUpperCase(Locale.ROOT);
      if (MARKET_DATA_TYPE.equals(type)) {
        return MARKET_DATA;
      }
      if (ORDER_REPORT_TYPE.equals(type)) {
        return ORDER_REPORT;
      }
      return UNSUPPORTED_TYPE;
    }
    return UNSUPPORTED_MESSAGE;
  }
}
