package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;

/** Receives market data or order report frames, as parsed JSON. */
@FunctionalInterface
public interface StreamMessageHandler {
  void onMessage(JsonNode message);
}
