package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies inbound frames and fans them out to the registered handlers.
 *
 * <p>Every handler invocation runs inside its own failure boundary: an exception thrown by one
 * handler, {@link Error}s included, is forwarded to the exception handler and the remaining
 * handlers still receive the frame. Nothing thrown here reaches the receive thread.
 */
public class StreamMessageDispatcher {
  private static final Logger log = LoggerFactory.getLogger(StreamMessageDispatcher.class);

  private static final String MESSAGES_COUNTER = "connector.rofex.ws.messages.total";
  private static final String HANDLER_ERRORS_COUNTER = "connector.rofex.ws.handler.errors.total";
  private static final String PARSE_ERROR_TAG = "parse_error";
  private static final int MAX_LOGGED_PAYLOAD = 300;

  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final String environmentTag;
  private final HandlerRegistry<StreamMessageHandler> marketDataHandlers = new HandlerRegistry<>();
  private final HandlerRegistry<StreamMessageHandler> orderReportHandlers = new HandlerRegistry<>();
  private final HandlerRegistry<StreamErrorHandler> errorHandlers = new HandlerRegistry<>();
  private final AtomicReference<StreamExceptionHandler> exceptionHandler = new AtomicReference<>();

  public StreamMessageDispatcher(
      ObjectMapper objectMapper, MeterRegistry meterRegistry, Environment environment) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.environmentTag = Objects.requireNonNull(environment, "environment is required").name();
  }

  public HandlerRegistry<StreamMessageHandler> marketDataHandlers() {
    return marketDataHandlers;
  }

  public HandlerRegistry<StreamMessageHandler> orderReportHandlers() {
    return orderReportHandlers;
  }

  public HandlerRegistry<StreamErrorHandler> errorHandlers() {
    return errorHandlers;
  }

  /** Replaces the exception handler; {@code null} stops forwarding. */
  public void setExceptionHandler(StreamExceptionHandler handler) {
    exceptionHandler.set(handler);
  }

  public void dispatch(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (IOException ex) {
      countMessage(PARSE_ERROR_TAG);
      forwardException(
          new RofexProtocolException("Malformed message: " + abbreviate(payload), payload, ex));
      return;
    }
    if (root == null || !root.isObject()) {
      countMessage(PARSE_ERROR_TAG);
      forwardException(
          new RofexProtocolException(
              "Message is not a JSON object: " + abbreviate(payload), payload));
      return;
    }

    InboundMessageType type = InboundMessageType.classify(root);
    countMessage(type.metricTag());
    log.debug("Dispatching {} message environment={}", type, environmentTag);
    switch (type) {
      case ERROR -> fanOutError(StreamErrorMessage.errorStatus(root));
      case MARKET_DATA -> fanOut(marketDataHandlers, root);
      case ORDER_REPORT -> fanOut(orderReportHandlers, root);
      case UNSUPPORTED_TYPE -> fanOutError(StreamErrorMessage.unsupportedType(root));
      case UNSUPPORTED_MESSAGE -> fanOutError(StreamErrorMessage.unsupportedMessage(root));
      default -> throw new IllegalStateException("Unhandled message type " + type);
    }
  }

  /** Hands a failure to the exception handler, or logs it when none is registered. */
  public void forwardException(Throwable error) {
    StreamExceptionHandler handler = exceptionHandler.get();
    if (handler == null) {
      log.warn(
          "No exception handler registered, dropping error environment={}", environmentTag, error);
      return;
    }
    try {
      handler.onException(error);
    } catch (RuntimeException | Error ex) {
      log.warn("Exception handler failed environment={}", environmentTag, ex);
    }
  }

  private void fanOut(HandlerRegistry<StreamMessageHandler> handlers, JsonNode message) {
    handlers.forEach(
        handler -> {
          try {
            handler.onMessage(message);
          } catch (RuntimeException | Error ex) {
            handlerFailed(ex);
          }
        });
  }

  private void fanOutError(StreamErrorMessage error) {
    errorHandlers.forEach(
        handler -> {
          try {
            handler.onError(error);
          } catch (RuntimeException | Error ex) {
            handlerFailed(ex);
          }
        });
  }

  private void handlerFailed(Throwable ex) {
    meterRegistry.counter(HANDLER_ERRORS_COUNTER, "environment", environmentTag).increment();
    forwardException(ex);
  }

  private void countMessage(String type) {
    meterRegistry
        .counter(MESSAGES_COUNTER, "environment", environmentTag, "type", type)
        .increment();
  }

  private static String abbreviate(String payload) {
    if (payload == null) {
      return "null";
    }
    String compact = payload.replaceAll("\\s+", " ").trim();
    return compact.length() <= MAX_LOGGED_PAYLOAD
        ? compact
        : compact.substring(0, MAX_LOGGED_PAYLOAD);
  }
}
