package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming session over the JDK {@link WebSocket}.
 *
 * <p>The socket listener only assembles text frames and queues them. A dedicated receive thread
 * per connection drains the queue and runs the handlers, so handlers may send on this session
 * without blocking the socket's own executor.
 */
public class WebSocketRofexStreamingSession implements RofexStreamingSession {
  private static final Logger log = LoggerFactory.getLogger(WebSocketRofexStreamingSession.class);

  static final String CONNECTION_FAILED_MESSAGE = "Connection could not be established.";

  private static final InboundEvent END = new InboundEvent(null, null);

  private final HttpClient httpClient;
  private final EnvironmentContext context;
  private final StreamMessageDispatcher dispatcher;
  private final StreamRequestEncoder encoder;
  private final Object lifecycleLock = new Object();
  private final Object sendLock = new Object();
  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final AtomicInteger connectionStateGauge = new AtomicInteger(0);
  private volatile Connection current;

  public WebSocketRofexStreamingSession(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      EnvironmentContext context,
      MeterRegistry meterRegistry) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.context = Objects.requireNonNull(context, "context is required");
    Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.dispatcher =
        new StreamMessageDispatcher(objectMapper, meterRegistry, context.environment());
    this.encoder = new StreamRequestEncoder(objectMapper);
    meterRegistry.gauge(
        "connector.rofex.ws.connection.state",
        Tags.of("environment", context.environment().name()),
        connectionStateGauge);
  }

  @Override
  public void connect() {
    Connection connection;
    synchronized (lifecycleLock) {
      Connection existing = current;
      if (existing != null && existing.isLive()) {
        log.debug(
            "Connect ignored, connection already open or opening environment={}",
            context.environment());
        return;
      }
      String token = context.requireToken();
      connection = new Connection();
      current = connection;
      updateState(ConnectionState.CONNECTING);
      connection.start(token);
    }
    connection.awaitOpen(context.settings().connectionTimeout());
  }

  @Override
  public void close() {
    Connection connection = current;
    if (connection == null) {
      return;
    }
    connection.close();
  }

  @Override
  public boolean isConnected() {
    return state.get() == ConnectionState.CONNECTED;
  }

  @Override
  public ConnectionState state() {
    return state.get();
  }

  @Override
  public void addMarketDataHandler(StreamMessageHandler handler) {
    dispatcher.marketDataHandlers().add(handler);
  }

  @Override
  public void removeMarketDataHandler(StreamMessageHandler handler) {
    dispatcher.marketDataHandlers().remove(handler);
  }

  @Override
  public void addOrderReportHandler(StreamMessageHandler handler) {
    dispatcher.orderReportHandlers().add(handler);
  }

  @Override
  public void removeOrderReportHandler(StreamMessageHandler handler) {
    dispatcher.orderReportHandlers().remove(handler);
  }

  @Override
  public void addErrorHandler(StreamErrorHandler handler) {
    dispatcher.errorHandlers().add(handler);
  }

  @Override
  public void removeErrorHandler(StreamErrorHandler handler) {
    dispatcher.errorHandlers().remove(handler);
  }

  @Override
  public void setExceptionHandler(StreamExceptionHandler handler) {
    dispatcher.setExceptionHandler(handler);
  }

  @Override
  public void marketDataSubscription(
      Collection<Instrument> instruments, Collection<MarketDataEntry> entries, int depth) {
    send(encoder.marketDataSubscription(instruments, entries, depth), "market_data_subscription");
  }

  @Override
  public void orderReportSubscription(String account, boolean snapshotOnlyActive) {
    send(encoder.orderReportSubscription(account, snapshotOnlyActive), "order_report_subscription");
  }

  @Override
  public void sendOrder(NewOrderRequest request) {
    send(encoder.newOrder(request), "new_order");
  }

  @Override
  public void cancelOrder(String clientOrderId, String proprietary) {
    send(encoder.cancelOrder(clientOrderId, proprietary), "cancel_order");
  }

  private void send(String frame, String action) {
    Connection connection = current;
    WebSocket socket = connection == null ? null : connection.openSocket();
    if (socket == null || state.get() != ConnectionState.CONNECTED) {
      throw new RofexNotConnectedException(
          "Websocket is not connected, cannot send " + action);
    }
    synchronized (sendLock) {
      try {
        socket.sendText(frame, true).join();
      } catch (CompletionException ex) {
        throw new RofexConnectorException(
            "Failed websocket " + action + " request",
            RofexConnectorException.NO_HTTP_STATUS,
            unwrapCompletionException(ex));
      }
    }
    log.debug("Sent {} environment={}", action, context.environment());
  }

  private void updateState(ConnectionState value) {
    state.set(value);
    connectionStateGauge.set(value.ordinal());
  }

  private static Throwable unwrapCompletionException(Throwable throwable) {
    if ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
        && throwable.getCause() != null) {
      return throwable.getCause();
    }
    return throwable;
  }

  private record InboundEvent(String payload, Throwable error) {}

  private final class Connection implements WebSocket.Listener {
    private final BlockingQueue<InboundEvent> inbound = new LinkedBlockingQueue<>();
    private final CompletableFuture<WebSocket> opened = new CompletableFuture<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final ScheduledExecutorService heartbeatScheduler;
    private final StringBuilder frameBuffer = new StringBuilder();
    private final Thread receiveThread;
    private volatile WebSocket socket;
    private volatile CompletableFuture<WebSocket> handshake;

    private Connection() {
      this.receiveThread =
          new Thread(this::receiveLoop, "rofex-ws-" + context.environment().name().toLowerCase());
      this.receiveThread.setDaemon(true);
      String heartbeatThreadName =
          "rofex-ws-heartbeat-" + context.environment().name().toLowerCase();
      this.heartbeatScheduler =
          Executors.newSingleThreadScheduledExecutor(
              new ThreadFactory() {
                @Override
                public Thread newThread(Runnable runnable) {
                  Thread thread = new Thread(runnable, heartbeatThreadName);
                  thread.setDaemon(true);
                  return thread;
                }
              });
    }

    /** A connection being closed no longer blocks a new {@code connect()}. */
    private boolean isLive() {
      return !terminated.get() && !closing.get();
    }

    private void publishState(ConnectionState value) {
      if (current == this) {
        updateState(value);
      }
    }

    private WebSocket openSocket() {
      return terminated.get() ? null : socket;
    }

    private void start(String token) {
      receiveThread.start();
      log.info(
          "Connecting websocket environment={} ws_uri={}",
          context.environment(),
          context.settings().wsBaseUri());
      CompletableFuture<WebSocket> pending =
          httpClient
              .newWebSocketBuilder()
              .header(HttpRofexAuthenticator.TOKEN_HEADER, token)
              .connectTimeout(context.settings().connectionTimeout())
              .buildAsync(context.settings().wsBaseUri(), this);
      handshake = pending;
      pending.whenComplete(
          (webSocket, error) -> {
            if (error != null) {
              Throwable cause = unwrapCompletionException(error);
              log.warn("Websocket handshake failed environment={}", context.environment(), cause);
              terminate(new RofexConnectionException(CONNECTION_FAILED_MESSAGE, cause), false);
            }
          });
    }

    private void awaitOpen(Duration timeout) {
      try {
        opened.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException ex) {
        log.warn(
            "Websocket not open after {}ms environment={}",
            timeout.toMillis(),
            context.environment());
        dispatcher.forwardException(new RofexConnectionException(CONNECTION_FAILED_MESSAGE));
      } catch (ExecutionException ex) {
        // Already reported through the receive loop.
        log.debug("Websocket connect failed environment={}", context.environment());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        dispatcher.forwardException(
            new RofexConnectionException("Interrupted while waiting for websocket", ex));
      }
    }

    private void close() {
      WebSocket webSocket = socket;
      if (webSocket == null) {
        CompletableFuture<WebSocket> pending = handshake;
        if (pending != null) {
          pending.cancel(true);
        }
        terminate(null, false);
        return;
      }
      if (terminated.get() || !closing.compareAndSet(false, true)) {
        return;
      }
      log.info("Closing websocket environment={}", context.environment());
      CompletableFuture<WebSocket> closeSent;
      synchronized (sendLock) {
        closeSent = webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "closed by client");
      }
      closeSent.whenComplete((ignored, error) -> terminate(null, true));
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      synchronized (lifecycleLock) {
        if (terminated.get()) {
          webSocket.abort();
          return;
        }
        socket = webSocket;
        publishState(ConnectionState.CONNECTED);
        scheduleHeartbeat(webSocket);
      }
      log.info("Websocket connected environment={}", context.environment());
      opened.complete(webSocket);
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (last) {
        inbound.offer(new InboundEvent(frameBuffer.toString(), null));
        frameBuffer.setLength(0);
      }
      webSocket.request(1);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      log.info(
          "Websocket closed environment={} status={} reason={}",
          context.environment(),
          statusCode,
          reason);
      terminate(null, false);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      log.warn("Websocket error environment={}", context.environment(), error);
      terminate(error, true);
    }

    private void scheduleHeartbeat(WebSocket webSocket) {
      long intervalMs = context.settings().heartbeatInterval().toMillis();
      heartbeatScheduler.scheduleAtFixedRate(
          () -> {
            if (terminated.get()) {
              return;
            }
            synchronized (sendLock) {
              webSocket
                  .sendPing(ByteBuffer.allocate(0))
                  .whenComplete(
                      (ignored, error) -> {
                        if (error != null) {
                          log.debug(
                              "Heartbeat ping failed environment={}",
                              context.environment(),
                              error);
                        }
                      });
            }
          },
          intervalMs,
          intervalMs,
          TimeUnit.MILLISECONDS);
    }

    private void terminate(Throwable error, boolean abort) {
      synchronized (lifecycleLock) {
        if (!terminated.compareAndSet(false, true)) {
          return;
        }
        publishState(ConnectionState.DISCONNECTED);
      }
      heartbeatScheduler.shutdownNow();
      WebSocket webSocket = socket;
      if (webSocket != null && abort) {
        webSocket.abort();
      }
      if (error != null) {
        inbound.offer(new InboundEvent(null, error));
      }
      inbound.offer(END);
      opened.completeExceptionally(
          error != null ? error : new RofexConnectionException("Websocket closed"));
    }

    private void receiveLoop() {
      log.debug("Receive loop started environment={}", context.environment());
      try {
        while (true) {
          InboundEvent event = inbound.take();
          if (event == END) {
            break;
          }
          try {
            if (event.error() != null) {
              dispatcher.forwardException(event.error());
            } else {
              dispatcher.dispatch(event.payload());
            }
          } catch (RuntimeException ex) {
            log.warn("Dispatch failed environment={}", context.environment(), ex);
          }
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      log.debug("Receive loop stopped environment={}", context.environment());
    }
  }
}
