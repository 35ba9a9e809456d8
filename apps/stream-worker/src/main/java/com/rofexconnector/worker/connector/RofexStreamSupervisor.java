package com.rofexconnector.worker.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.rofexconnector.integration.rofex.Environment;
import com.rofexconnector.integration.rofex.EnvironmentSettings;
import com.rofexconnector.integration.rofex.RofexConnector;
import com.rofexconnector.integration.rofex.RofexConnectorProperties;
import com.rofexconnector.integration.rofex.RofexNotConnectedException;
import com.rofexconnector.integration.rofex.StreamErrorHandler;
import com.rofexconnector.integration.rofex.StreamErrorMessage;
import com.rofexconnector.integration.rofex.StreamExceptionHandler;
import com.rofexconnector.integration.rofex.StreamMessageHandler;
import com.rofexconnector.worker.config.RofexCredentials;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Keeps one streaming session open for the configured environment and subscribes it to the
 * configured tickers and order reports. The latest market data frame of each symbol is retained.
 */
@Component
@ConditionalOnProperty(prefix = "connector.rofex.stream", name = "enabled", havingValue = "true")
public class RofexStreamSupervisor {
  private static final Logger log = LoggerFactory.getLogger(RofexStreamSupervisor.class);

  private final RofexConnector connector;
  private final EnvironmentSettings settings;
  private final RofexCredentials credentials;
  private final RofexConnectorProperties properties;
  private final MeterRegistry meterRegistry;
  private final Map<String, JsonNode> latestMarketData = new ConcurrentHashMap<>();
  private final StreamMessageHandler marketDataHandler = this::onMarketData;
  private final StreamMessageHandler orderReportHandler = this::onOrderReport;
  private final StreamErrorHandler errorHandler = this::onError;
  private final StreamExceptionHandler exceptionHandler = this::onException;

  public RofexStreamSupervisor(
      RofexConnector connector,
      EnvironmentSettings settings,
      RofexCredentials credentials,
      RofexConnectorProperties properties,
      MeterRegistry meterRegistry) {
    this.connector = connector;
    this.settings = settings;
    this.credentials = credentials;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    connector.initialize(
        settings,
        credentials.user(),
        credentials.password(),
        credentials.account(),
        credentials.activeToken());
    connector.initWebsocketConnection(
        marketDataHandler, orderReportHandler, errorHandler, exceptionHandler, environment());
    RofexConnectorProperties.Stream stream = properties.getStream();
    try {
      if (!stream.getTickers().isEmpty()) {
        connector.marketDataSubscription(
            stream.getTickers(),
            stream.getEntries(),
            stream.getMarket(),
            stream.getDepth(),
            null,
            environment());
        log.info(
            "Subscribed to market data environment={} tickers={}",
            environment(),
            stream.getTickers());
      }
      if (stream.isOrderReportsEnabled()) {
        connector.orderReportSubscription(
            credentials.account(), stream.isSnapshotOnlyActive(), null, environment());
        log.info("Subscribed to order reports environment={}", environment());
      }
    } catch (RofexNotConnectedException ex) {
      log.warn("Subscriptions skipped, websocket not connected environment={}", environment(), ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (connector.initializedEnvironments().contains(environment())) {
      connector.closeWebsocketConnection(environment());
    }
  }

  public Optional<JsonNode> latestMarketData(String symbol) {
    return Optional.ofNullable(latestMarketData.get(symbol));
  }

  void onMarketData(JsonNode message) {
    String symbol = message.path("instrumentId").path("symbol").asText("");
    if (!symbol.isEmpty()) {
      latestMarketData.put(symbol, message);
    }
    count("market_data");
  }

  void onOrderReport(JsonNode message) {
    JsonNode report = message.path("orderReport");
    log.info(
        "Order report environment={} clOrdId={} status={}",
        environment(),
        report.path("clOrdId").asText(""),
        report.path("status").asText(""));
    count("order_report");
  }

  void onError(StreamErrorMessage error) {
    log.warn(
        "Stream error environment={} kind={} description={}",
        environment(),
        error.kind(),
        error.description());
    count("error_" + error.kind().name().toLowerCase(Locale.ROOT));
  }

  void onException(Throwable error) {
    log.warn("Stream exception environment={}", environment(), error);
    count("exception");
  }

  private void count(String type) {
    meterRegistry
        .counter(
            "worker.rofex.stream.events.total",
            "environment",
            environment().name(),
            "type",
            type)
        .increment();
  }

  private Environment environment() {
    return settings.environment();
  }
}
