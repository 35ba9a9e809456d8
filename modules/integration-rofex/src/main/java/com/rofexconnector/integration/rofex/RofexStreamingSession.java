package com.rofexconnector.integration.rofex;

import java.util.Collection;

/**
 * One websocket connection to an environment, plus the handlers its frames are dispatched to.
 *
 * <p>Handlers may be registered before or after {@link #connect()} and survive reconnects. All
 * send operations throw {@link RofexNotConnectedException} while the session is not connected.
 */
public interface RofexStreamingSession {
  /**
   * Opens the socket and starts the receive thread, waiting up to the environment's connection
   * timeout for the socket to open. A timeout is reported to the exception handler rather than
   * thrown. Does nothing while a receive thread from an earlier call is still running.
   *
   * @throws RofexNotInitializedException when the environment holds no token
   */
  void connect();

  /** Requests socket shutdown without waiting for the receive thread to stop. Idempotent. */
  void close();

  boolean isConnected();

  ConnectionState state();

  void addMarketDataHandler(StreamMessageHandler handler);

  void removeMarketDataHandler(StreamMessageHandler handler);

  void addOrderReportHandler(StreamMessageHandler handler);

  void removeOrderReportHandler(StreamMessageHandler handler);

  void addErrorHandler(StreamErrorHandler handler);

  void removeErrorHandler(StreamErrorHandler handler);

  void setExceptionHandler(StreamExceptionHandler handler);

  void marketDataSubscription(
      Collection<Instrument> instruments, Collection<MarketDataEntry> entries, int depth);

  void orderReportSubscription(String account, boolean snapshotOnlyActive);

  void sendOrder(NewOrderRequest request);

  void cancelOrder(String clientOrderId, String proprietary);
}
