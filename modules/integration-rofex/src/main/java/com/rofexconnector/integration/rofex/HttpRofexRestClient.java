package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpRofexRestClient implements RofexRestClient {
  private static final Logger log = LoggerFactory.getLogger(HttpRofexRestClient.class);

  private static final int UNAUTHORIZED = 401;
  private static final String REAUTH_COUNTER = "connector.rofex.rest.reauth.total";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final EnvironmentContext context;
  private final RofexAuthenticator authenticator;
  private final MeterRegistry meterRegistry;

  public HttpRofexRestClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      EnvironmentContext context,
      RofexAuthenticator authenticator,
      MeterRegistry meterRegistry) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.context = Objects.requireNonNull(context, "context is required");
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
  }

  /**
   * Sends an authenticated GET. A 401 refreshes the token and retries once; a second 401 is
   * terminal.
   */
  @Override
  public JsonNode get(String path) {
    HttpResponse<String> response = execute(path);
    if (response.statusCode() == UNAUTHORIZED) {
      log.info(
          "Token rejected, re-authenticating environment={} path={}",
          context.environment(),
          path);
      meterRegistry
          .counter(REAUTH_COUNTER, "environment", context.environment().name())
          .increment();
      authenticator.authenticate();
      response = execute(path);
      if (response.statusCode() == UNAUTHORIZED) {
        throw new RofexAuthenticationException("Authentication Fails.", UNAUTHORIZED);
      }
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw parseFailure(response.statusCode(), response.body());
    }
    return parseJson(response.body());
  }

  @Override
  public JsonNode getSegments() {
    return get(RofexRequestPaths.SEGMENTS);
  }

  @Override
  public JsonNode getAllInstruments() {
    return get(RofexRequestPaths.ALL_INSTRUMENTS);
  }

  @Override
  public JsonNode getDetailedInstruments() {
    return get(RofexRequestPaths.DETAILED_INSTRUMENTS);
  }

  @Override
  public JsonNode getInstrumentDetails(String ticker, Market market) {
    return get(RofexRequestPaths.instrumentDetails(ticker, market));
  }

  @Override
  public JsonNode getMarketData(
      String ticker, Collection<MarketDataEntry> entries, int depth, Market market) {
    return get(RofexRequestPaths.marketData(ticker, entries, depth, market));
  }

  @Override
  public JsonNode getTradeHistory(String ticker, LocalDate from, LocalDate to, Market market) {
    return get(RofexRequestPaths.tradeHistory(ticker, from, to, market));
  }

  @Override
  public JsonNode getOrderStatus(String clientOrderId, String proprietary) {
    return get(RofexRequestPaths.orderStatus(clientOrderId, proprietary));
  }

  @Override
  public JsonNode sendOrder(NewOrderRequest request) {
    if (request.account() == null) {
      throw new IllegalArgumentException("Account not specified.");
    }
    return get(RofexRequestPaths.newOrder(request));
  }

  @Override
  public JsonNode cancelOrder(String clientOrderId, String proprietary) {
    return get(RofexRequestPaths.cancelOrder(clientOrderId, proprietary));
  }

  @Override
  public JsonNode getAllOrdersByAccount(String account) {
    return get(RofexRequestPaths.allOrders(account));
  }

  @Override
  public JsonNode getAccountPosition(String account) {
    return get(RofexRequestPaths.accountPosition(account));
  }

  @Override
  public JsonNode getDetailedPosition(String account) {
    return get(RofexRequestPaths.detailedPosition(account));
  }

  @Override
  public JsonNode getAccountReport(String account) {
    return get(RofexRequestPaths.accountReport(account));
  }

  private HttpResponse<String> execute(String path) {
    HttpRequest request =
        HttpRequest.newBuilder(context.settings().resolveRest(path))
            .timeout(context.settings().requestTimeout())
            .header(HttpRofexAuthenticator.TOKEN_HEADER, context.requireToken())
            .GET()
            .build();
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RofexConnectorException(
          "Request to " + path + " was interrupted", RofexConnectorException.NO_HTTP_STATUS, ex);
    } catch (IOException ex) {
      throw new RofexConnectorException(
          "Failed to call " + path, RofexConnectorException.NO_HTTP_STATUS, ex);
    }
  }

  private RofexConnectorException parseFailure(int statusCode, String responseBody) {
    try {
      JsonNode node = parseJson(responseBody);
      String description =
          node.hasNonNull("description")
              ? node.get("description").asText()
              : node.path("message").asText("Unknown error");
      return new RofexConnectorException(
          "API error status=" + statusCode + " description=" + description, statusCode);
    } catch (RuntimeException ex) {
      return new RofexConnectorException(
          "API error status=" + statusCode + " body=" + responseBody, statusCode, ex);
    }
  }

  private JsonNode parseJson(String responseBody) {
    try {
      return objectMapper.readTree(responseBody);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to parse response JSON: " + responseBody, ex);
    }
  }
}
