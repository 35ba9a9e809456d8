package com.rofexconnector.integration.rofex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebSocketRofexStreamingSessionTest {
  private static final long WAIT_SECONDS = 5L;

  private MockWebServer server;
  private ServerSocketListener serverListener;
  private EnvironmentContext context;
  private SimpleMeterRegistry meterRegistry;
  private WebSocketRofexStreamingSession session;
  private BlockingQueue<Throwable> exceptions;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    serverListener = new ServerSocketListener();
    URI wsUri = URI.create("ws://" + server.getHostName() + ":" + server.getPort() + "/");
    EnvironmentSettings settings =
        EnvironmentSettings.defaults(Environment.REMARKET)
            .withEndpoints(server.url("/").uri(), wsUri)
            .withTimeouts(Duration.ofSeconds(30), Duration.ofMillis(500), Duration.ofSeconds(5));
    context = new EnvironmentContext(settings, "user1", "secret", "REM1234");
    context.markAuthenticated("tok-1");
    meterRegistry = new SimpleMeterRegistry();
    session =
        new WebSocketRofexStreamingSession(
            HttpClient.newHttpClient(), new ObjectMapper(), context, meterRegistry);
    exceptions = new LinkedBlockingQueue<>();
    session.setExceptionHandler(exceptions::add);
  }

  @AfterEach
  void tearDown() throws Exception {
    session.close();
    server.shutdown();
  }

  @Test
  void shouldConnectWithTokenHeaderAndDispatchMarketData() throws Exception {
    serverListener.onOpenFrames.add("{\"type\":\"Md\",\"instrumentId\":{\"symbol\":\"DLR/ENE24\"}}");
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    BlockingQueue<JsonNode> marketData = new LinkedBlockingQueue<>();
    session.addMarketDataHandler(marketData::add);

    session.connect();

    assertTrue(session.isConnected());
    assertEquals(ConnectionState.CONNECTED, session.state());
    assertEquals("tok-1", server.takeRequest().getHeader("X-Auth-Token"));
    JsonNode message = marketData.poll(WAIT_SECONDS, TimeUnit.SECONDS);
    assertNotNull(message);
    assertEquals("DLR/ENE24", message.path("instrumentId").path("symbol").asText());
  }

  @Test
  void shouldWriteSubscriptionFrames() throws Exception {
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    session.connect();

    session.marketDataSubscription(
        List.of(Instrument.of("DLR/ENE24", Market.ROFEX)),
        List.of(MarketDataEntry.BIDS, MarketDataEntry.OFFERS),
        2);
    session.orderReportSubscription("REM1234", true);

    assertEquals(
        "{\"type\":\"smd\",\"level\":1,\"depth\":2,\"entries\":[\"BI\",\"OF\"],"
            + "\"products\":[{\"symbol\":\"DLR/ENE24\",\"marketId\":\"ROFX\"}]}",
        serverListener.received.poll(WAIT_SECONDS, TimeUnit.SECONDS));
    assertEquals(
        "{\"type\":\"os\",\"account\":{\"id\":\"REM1234\"},\"snapshotOnlyActive\":true}",
        serverListener.received.poll(WAIT_SECONDS, TimeUnit.SECONDS));
  }

  @Test
  void shouldAllowHandlersToSendFromReceiveThread() throws Exception {
    serverListener.onOpenFrames.add("{\"type\":\"MD\"}");
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    session.addMarketDataHandler(message -> session.cancelOrder("cl-1", "PBCP"));

    session.connect();

    assertEquals(
        "{\"type\":\"co\",\"clientId\":\"cl-1\",\"proprietary\":\"PBCP\"}",
        serverListener.received.poll(WAIT_SECONDS, TimeUnit.SECONDS));
  }

  @Test
  void shouldOpenOneSocketForRepeatedConnect() throws Exception {
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    server.enqueue(new MockResponse().withWebSocketUpgrade(new ServerSocketListener()));

    session.connect();
    session.connect();

    assertTrue(session.isConnected());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldIgnoreConnectWhileHandshakeIsPending() throws Exception {
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
    EnvironmentSettings slowSettings =
        context
            .settings()
            .withTimeouts(Duration.ofSeconds(30), Duration.ofSeconds(3), Duration.ofSeconds(5));
    EnvironmentContext slowContext = new EnvironmentContext(slowSettings, "user1", "secret", null);
    slowContext.markAuthenticated("tok-1");
    WebSocketRofexStreamingSession pending =
        new WebSocketRofexStreamingSession(
            HttpClient.newHttpClient(), new ObjectMapper(), slowContext, new SimpleMeterRegistry());
    Thread firstConnect = new Thread(pending::connect);
    firstConnect.start();
    try {
      assertNotNull(server.takeRequest(WAIT_SECONDS, TimeUnit.SECONDS));
      assertEquals(ConnectionState.CONNECTING, pending.state());

      pending.connect();

      assertEquals(1, server.getRequestCount());
      assertEquals(ConnectionState.CONNECTING, pending.state());
    } finally {
      pending.close();
      firstConnect.join(TimeUnit.SECONDS.toMillis(WAIT_SECONDS));
    }
    assertEquals(1, server.getRequestCount());
    assertEquals(ConnectionState.DISCONNECTED, pending.state());
    assertFalse(pending.isConnected());
  }

  @Test
  void shouldReconnectRightAfterClose() throws Exception {
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    ServerSocketListener secondListener = new ServerSocketListener();
    server.enqueue(new MockResponse().withWebSocketUpgrade(secondListener));
    session.connect();

    session.close();
    session.connect();

    assertTrue(session.isConnected());
    assertEquals(2, server.getRequestCount());
    session.cancelOrder("cl-2", "PBCP");
    assertEquals(
        "{\"type\":\"co\",\"clientId\":\"cl-2\",\"proprietary\":\"PBCP\"}",
        secondListener.received.poll(WAIT_SECONDS, TimeUnit.SECONDS));
  }

  @Test
  void shouldStopHeartbeatThreadOnClose() throws Exception {
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    session.connect();
    assertTrue(session.isConnected());

    session.close();
    awaitState(ConnectionState.DISCONNECTED);

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
    while (heartbeatThreads() > 0 && System.nanoTime() < deadline) {
      Thread.sleep(20L);
    }
    assertEquals(0, heartbeatThreads());
  }

  @Test
  void shouldRejectSendWhileDisconnected() {
    NewOrderRequest order =
        NewOrderRequest.builder("DLR/ENE24", Side.BUY, BigDecimal.ONE, OrderType.MARKET)
            .account("REM1234")
            .build();

    assertThrows(RofexNotConnectedException.class, () -> session.sendOrder(order));
    assertThrows(
        RofexNotConnectedException.class, () -> session.orderReportSubscription("REM1234", true));
    assertEquals(ConnectionState.DISCONNECTED, session.state());
  }

  @Test
  void shouldRequireTokenToConnect() {
    context.invalidate();

    assertThrows(RofexNotInitializedException.class, session::connect);
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void shouldReportHandshakeTimeoutToExceptionHandler() throws Exception {
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

    session.connect();

    Throwable error = exceptions.poll(WAIT_SECONDS, TimeUnit.SECONDS);
    RofexConnectionException connectionError =
        assertInstanceOf(RofexConnectionException.class, error);
    assertEquals("Connection could not be established.", connectionError.getMessage());
    assertFalse(session.isConnected());
  }

  @Test
  void shouldBecomeDisconnectedWhenServerCloses() throws Exception {
    serverListener.closeOnOpen = true;
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));

    session.connect();

    awaitState(ConnectionState.DISCONNECTED);
    assertThrows(
        RofexNotConnectedException.class, () -> session.orderReportSubscription("REM1234", true));
  }

  @Test
  void shouldCloseIdempotently() throws Exception {
    server.enqueue(new MockResponse().withWebSocketUpgrade(serverListener));
    session.connect();

    session.close();
    session.close();

    awaitState(ConnectionState.DISCONNECTED);
    assertEquals(
        0.0,
        meterRegistry
            .get("connector.rofex.ws.connection.state")
            .tag("environment", "REMARKET")
            .gauge()
            .value());
  }

  private static long heartbeatThreads() {
    return Thread.getAllStackTraces().keySet().stream()
        .filter(thread -> thread.isAlive() && thread.getName().startsWith("rofex-ws-heartbeat-"))
        .count();
  }

  private void awaitState(ConnectionState expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
    while (session.state() != expected && System.nanoTime() < deadline) {
      Thread.sleep(20L);
    }
    assertEquals(expected, session.state());
  }

  private static final class ServerSocketListener extends WebSocketListener {
    private final List<String> onOpenFrames = new ArrayList<>();
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private volatile boolean closeOnOpen;

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
      onOpenFrames.forEach(webSocket::send);
      if (closeOnOpen) {
        webSocket.close(1000, "bye");
      }
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
      received.add(text);
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
      webSocket.close(code, reason);
    }
  }
}
