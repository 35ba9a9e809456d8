package com.rofexconnector.integration.rofex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RofexConnectorTest {
  private MockWebServer server;
  private EnvironmentSettings settings;
  private RofexConnector connector;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    URI wsUri = URI.create("ws://" + server.getHostName() + ":" + server.getPort() + "/");
    settings =
        EnvironmentSettings.defaults(Environment.REMARKET)
            .withEndpoints(server.url("/").uri(), wsUri)
            .withTimeouts(Duration.ofSeconds(30), Duration.ofSeconds(2), Duration.ofSeconds(5));
    connector = new RofexConnector(new ObjectMapper(), new SimpleMeterRegistry());
  }

  @AfterEach
  void tearDown() throws Exception {
    connector.close();
    server.shutdown();
  }

  @Test
  void shouldRequireEnvironment() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, connector::getSegments);

    assertEquals("Environment not specified.", ex.getMessage());
  }

  @Test
  void shouldRejectUninitializedEnvironment() {
    connector.initialize(settings, "user1", "secret", "REM1234", "tok-1");

    RofexNotInitializedException ex =
        assertThrows(
            RofexNotInitializedException.class, () -> connector.getSegments(Environment.LIVE));

    assertEquals("The Environment is not initialized.", ex.getMessage());
  }

  @Test
  void shouldAuthenticateAndUseDefaultAccount() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).addHeader("X-Auth-Token", "tok-1"));
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"OK\"}"));

    connector.initialize(settings, "user1", "secret", "REM1234");
    JsonNode positions = connector.getAccountPosition();

    assertEquals("OK", positions.get("status").asText());
    assertEquals(Optional.of(Environment.REMARKET), connector.defaultEnvironment());
    assertEquals("/auth/getToken", server.takeRequest().getPath());
    RecordedRequest request = server.takeRequest();
    assertEquals("/rest/risk/position/getPositions/REM1234", request.getPath());
    assertEquals("tok-1", request.getHeader("X-Auth-Token"));
  }

  @Test
  void shouldSkipAuthenticationWithActiveToken() {
    connector.initialize(settings, null, null, "REM1234", "tok-1");

    assertTrue(connector.environmentContext(Environment.REMARKET).isInitialized());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void shouldLeaveEnvironmentUninitializedWhenAuthenticationFails() {
    server.enqueue(new MockResponse().setResponseCode(401));

    assertThrows(
        RofexAuthenticationException.class,
        () -> connector.initialize(settings, "user1", "wrong", "REM1234"));

    assertTrue(connector.initializedEnvironments().isEmpty());
    assertThrows(
        RofexNotInitializedException.class, () -> connector.getSegments(Environment.REMARKET));
  }

  @Test
  void shouldRequireAccountWhenNoDefault() {
    connector.initialize(settings, "user1", "secret", null, "tok-1");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, connector::getAccountReport);

    assertEquals("Account not specified.", ex.getMessage());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void shouldRequestAllEntriesWithDepthOneByDefault() throws Exception {
    connector.initialize(settings, "user1", "secret", "REM1234", "tok-1");
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

    connector.getMarketData("DLR/ENE24");

    assertEquals(
        "/rest/marketdata/get?marketId=ROFX&symbol=DLR%2FENE24"
            + "&entries=BI%2COF%2CLA%2COP%2CCL%2CSE%2CHI%2CLO%2CTV%2COI%2CIV%2CEV%2CNV&depth=1",
        server.takeRequest().getPath());
  }

  @Test
  void shouldFillAccountAndProprietaryDefaults() throws Exception {
    connector.initialize(settings, "user1", "secret", "REM1234", "tok-1");
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

    connector.sendOrder(
        NewOrderRequest.builder("DLR/ENE24", Side.BUY, new BigDecimal("2"), OrderType.LIMIT)
            .price(new BigDecimal("1000"))
            .build());
    connector.getOrderStatus("cl-1");

    String orderPath = server.takeRequest().getPath();
    assertTrue(orderPath.startsWith("/rest/order/newSingleOrder?"));
    assertTrue(orderPath.contains("account=REM1234"));
    assertTrue(orderPath.contains("price=1000"));
    assertEquals("/rest/order/id?clOrdId=cl-1&proprietary=PBCP", server.takeRequest().getPath());
  }

  @Test
  void shouldValidateSubscriptionArgumentsBeforeConnecting() {
    connector.initialize(settings, "user1", "secret", "REM1234", "tok-1");

    assertThrows(
        IllegalArgumentException.class,
        () ->
            connector.marketDataSubscription(
                List.of("DLR/ENE24"),
                Arrays.asList(MarketDataEntry.BIDS, null),
                Market.ROFEX,
                1,
                null));
    assertThrows(IllegalArgumentException.class, () -> connector.addMarketDataHandler(null));
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void shouldConnectOnFirstSubscription() throws Exception {
    BlockingQueue<String> received = new LinkedBlockingQueue<>();
    server.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new WebSocketListener() {
                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    received.add(text);
                  }
                }));
    connector.initialize(settings, "user1", "secret", "REM1234", "tok-1");
    assertFalse(connector.isWebsocketConnected(Environment.REMARKET));

    connector.orderReportSubscription(null, true, message -> {});

    assertTrue(connector.isWebsocketConnected(Environment.REMARKET));
    assertEquals(
        "{\"type\":\"os\",\"account\":{\"id\":\"REM1234\"},\"snapshotOnlyActive\":true}",
        received.poll(5, TimeUnit.SECONDS));
  }
}
