package com.rofexconnector.integration.rofex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for applications. Keeps one authenticated context, REST client and streaming session
 * per initialized environment, validates arguments and fills in the environment's default account
 * and proprietary.
 *
 * <p>Every operation has an overload taking the target {@link Environment}; the overload without
 * it, or a {@code null} environment, uses the default environment, which is the one most recently
 * initialized unless changed with {@link #setDefaultEnvironment(Environment)}.
 */
public class RofexConnector implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RofexConnector.class);

  static final int DEFAULT_DEPTH = 1;

  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final Function<EnvironmentSettings, HttpClient> httpClientFactory;
  private final Map<Environment, EnvironmentBinding> bindings = new ConcurrentHashMap<>();
  private volatile Environment defaultEnvironment;

  public RofexConnector(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this(objectMapper, meterRegistry, RofexHttpClients::create);
  }

  public RofexConnector(
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Function<EnvironmentSettings, HttpClient> httpClientFactory) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.httpClientFactory =
        Objects.requireNonNull(httpClientFactory, "httpClientFactory is required");
  }

  // Initialization

  public void initialize(String user, String password, String account, Environment environment) {
    initialize(EnvironmentSettings.defaults(environment), user, password, account, null);
  }

  public void initialize(
      EnvironmentSettings settings, String user, String password, String account) {
    initialize(settings, user, password, account, null);
  }

  /**
   * Builds the environment's context and clients and makes it the default environment. When
   * {@code activeToken} is given it is trusted as is and the auth endpoint is not called.
   *
   * @throws RofexAuthenticationException when the credentials are rejected
   */
  public void initialize(
      EnvironmentSettings settings,
      String user,
      String password,
      String account,
      String activeToken) {
    if (settings == null) {
      throw new IllegalArgumentException("Environment not specified.");
    }
    EnvironmentContext context = new EnvironmentContext(settings, user, password, account);
    HttpClient httpClient = httpClientFactory.apply(settings);
    RofexAuthenticator authenticator = new HttpRofexAuthenticator(httpClient, context);
    if (activeToken != null && !activeToken.isBlank()) {
      context.markAuthenticated(activeToken);
    } else {
      authenticator.authenticate();
    }
    EnvironmentBinding binding =
        new EnvironmentBinding(
            context,
            new HttpRofexRestClient(
                httpClient, objectMapper, context, authenticator, meterRegistry),
            new WebSocketRofexStreamingSession(httpClient, objectMapper, context, meterRegistry));
    EnvironmentBinding previous = bindings.put(settings.environment(), binding);
    if (previous != null) {
      previous.session().close();
    }
    defaultEnvironment = settings.environment();
    log.info(
        "Environment initialized environment={} account={}",
        settings.environment(),
        context.account().orElse("<none>"));
  }

  public void setDefaultEnvironment(Environment environment) {
    if (environment == null) {
      throw new IllegalArgumentException("Environment not specified.");
    }
    defaultEnvironment = environment;
  }

  public Optional<Environment> defaultEnvironment() {
    return Optional.ofNullable(defaultEnvironment);
  }

  public EnvironmentContext environmentContext(Environment environment) {
    return binding(environment).context();
  }

  public Set<Environment> initializedEnvironments() {
    return Set.copyOf(bindings.keySet());
  }

  // REST operations

  public JsonNode getSegments() {
    return getSegments(null);
  }

  public JsonNode getSegments(Environment environment) {
    return binding(environment).restClient().getSegments();
  }

  public JsonNode getAllInstruments() {
    return getAllInstruments(null);
  }

  public JsonNode getAllInstruments(Environment environment) {
    return binding(environment).restClient().getAllInstruments();
  }

  public JsonNode getDetailedInstruments() {
    return getDetailedInstruments(null);
  }

  public JsonNode getDetailedInstruments(Environment environment) {
    return binding(environment).restClient().getDetailedInstruments();
  }

  public JsonNode getInstrumentDetails(String ticker, Market market) {
    return getInstrumentDetails(ticker, market, null);
  }

  public JsonNode getInstrumentDetails(String ticker, Market market, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding.restClient().getInstrumentDetails(requireTicker(ticker), marketOrDefault(market));
  }

  public JsonNode getMarketData(String ticker) {
    return getMarketData(ticker, null, DEFAULT_DEPTH, null, null);
  }

  public JsonNode getMarketData(
      String ticker, Collection<MarketDataEntry> entries, int depth, Market market) {
    return getMarketData(ticker, entries, depth, market, null);
  }

  /** Empty or {@code null} entries request every {@link MarketDataEntry}. */
  public JsonNode getMarketData(
      String ticker,
      Collection<MarketDataEntry> entries,
      int depth,
      Market market,
      Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding
        .restClient()
        .getMarketData(
            requireTicker(ticker),
            entriesOrAll(entries),
            requireDepth(depth),
            marketOrDefault(market));
  }

  public JsonNode getTradeHistory(String ticker, LocalDate from, LocalDate to, Market market) {
    return getTradeHistory(ticker, from, to, market, null);
  }

  public JsonNode getTradeHistory(
      String ticker, LocalDate from, LocalDate to, Market market, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    if (from == null || to == null) {
      throw new IllegalArgumentException("dateFrom and dateTo are required");
    }
    if (from.isAfter(to)) {
      throw new IllegalArgumentException("dateFrom must not be after dateTo");
    }
    return binding
        .restClient()
        .getTradeHistory(requireTicker(ticker), from, to, marketOrDefault(market));
  }

  public JsonNode getOrderStatus(String clientOrderId) {
    return getOrderStatus(clientOrderId, null, null);
  }

  public JsonNode getOrderStatus(
      String clientOrderId, String proprietary, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding
        .restClient()
        .getOrderStatus(requireClientOrderId(clientOrderId), proprietary(binding, proprietary));
  }

  public JsonNode sendOrder(NewOrderRequest request) {
    return sendOrder(request, null);
  }

  public JsonNode sendOrder(NewOrderRequest request, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding.restClient().sendOrder(withAccount(binding, request));
  }

  public JsonNode cancelOrder(String clientOrderId) {
    return cancelOrder(clientOrderId, null, null);
  }

  public JsonNode cancelOrder(String clientOrderId, String proprietary, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding
        .restClient()
        .cancelOrder(requireClientOrderId(clientOrderId), proprietary(binding, proprietary));
  }

  public JsonNode getAllOrdersStatus() {
    return getAllOrdersStatus(null, null);
  }

  public JsonNode getAllOrdersStatus(String account, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding.restClient().getAllOrdersByAccount(account(binding, account));
  }

  public JsonNode getAccountPosition() {
    return getAccountPosition(null, null);
  }

  public JsonNode getAccountPosition(String account, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding.restClient().getAccountPosition(account(binding, account));
  }

  public JsonNode getDetailedPosition() {
    return getDetailedPosition(null, null);
  }

  public JsonNode getDetailedPosition(String account, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding.restClient().getDetailedPosition(account(binding, account));
  }

  public JsonNode getAccountReport() {
    return getAccountReport(null, null);
  }

  public JsonNode getAccountReport(String account, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    return binding.restClient().getAccountReport(account(binding, account));
  }

  // Websocket operations

  public void initWebsocketConnection(
      StreamMessageHandler marketDataHandler,
      StreamMessageHandler orderReportHandler,
      StreamErrorHandler errorHandler,
      StreamExceptionHandler exceptionHandler) {
    initWebsocketConnection(
        marketDataHandler, orderReportHandler, errorHandler, exceptionHandler, null);
  }

  /** Registers the non-null handlers and connects. */
  public void initWebsocketConnection(
      StreamMessageHandler marketDataHandler,
      StreamMessageHandler orderReportHandler,
      StreamErrorHandler errorHandler,
      StreamExceptionHandler exceptionHandler,
      Environment environment) {
    RofexStreamingSession session = binding(environment).session();
    if (marketDataHandler != null) {
      session.addMarketDataHandler(marketDataHandler);
    }
    if (orderReportHandler != null) {
      session.addOrderReportHandler(orderReportHandler);
    }
    if (errorHandler != null) {
      session.addErrorHandler(errorHandler);
    }
    if (exceptionHandler != null) {
      session.setExceptionHandler(exceptionHandler);
    }
    session.connect();
  }

  public void closeWebsocketConnection() {
    closeWebsocketConnection(null);
  }

  public void closeWebsocketConnection(Environment environment) {
    binding(environment).session().close();
  }

  public boolean isWebsocketConnected(Environment environment) {
    return binding(environment).session().isConnected();
  }

  public void orderReportSubscription(
      String account, boolean snapshotOnlyActive, StreamMessageHandler handler) {
    orderReportSubscription(account, snapshotOnlyActive, handler, null);
  }

  /** Registers {@code handler} when given, connecting first if needed. */
  public void orderReportSubscription(
      String account,
      boolean snapshotOnlyActive,
      StreamMessageHandler handler,
      Environment environment) {
    EnvironmentBinding binding = binding(environment);
    String resolvedAccount = account(binding, account);
    if (handler != null) {
      binding.session().addOrderReportHandler(handler);
    }
    ensureConnected(binding);
    binding.session().orderReportSubscription(resolvedAccount, snapshotOnlyActive);
  }

  public void marketDataSubscription(
      Collection<String> tickers,
      Collection<MarketDataEntry> entries,
      Market market,
      int depth,
      StreamMessageHandler handler) {
    marketDataSubscription(tickers, entries, market, depth, handler, null);
  }

  /**
   * Subscribes to every ticker on {@code market}. Empty or {@code null} entries subscribe to every
   * {@link MarketDataEntry}.
   */
  public void marketDataSubscription(
      Collection<String> tickers,
      Collection<MarketDataEntry> entries,
      Market market,
      int depth,
      StreamMessageHandler handler,
      Environment environment) {
    EnvironmentBinding binding = binding(environment);
    if (tickers == null || tickers.isEmpty()) {
      throw new IllegalArgumentException("At least one ticker is required.");
    }
    Market resolvedMarket = marketOrDefault(market);
    List<Instrument> instruments = new ArrayList<>(tickers.size());
    for (String ticker : tickers) {
      instruments.add(Instrument.of(requireTicker(ticker), resolvedMarket));
    }
    Collection<MarketDataEntry> resolvedEntries = entriesOrAll(entries);
    int resolvedDepth = requireDepth(depth);
    if (handler != null) {
      binding.session().addMarketDataHandler(handler);
    }
    ensureConnected(binding);
    binding.session().marketDataSubscription(instruments, resolvedEntries, resolvedDepth);
  }

  public void sendOrderViaWebsocket(NewOrderRequest request) {
    sendOrderViaWebsocket(request, null);
  }

  public void sendOrderViaWebsocket(NewOrderRequest request, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    NewOrderRequest resolved = withAccount(binding, request);
    ensureConnected(binding);
    binding.session().sendOrder(resolved);
  }

  public void cancelOrderViaWebsocket(String clientOrderId) {
    cancelOrderViaWebsocket(clientOrderId, null, null);
  }

  public void cancelOrderViaWebsocket(
      String clientOrderId, String proprietary, Environment environment) {
    EnvironmentBinding binding = binding(environment);
    String resolvedId = requireClientOrderId(clientOrderId);
    String resolvedProprietary = proprietary(binding, proprietary);
    ensureConnected(binding);
    binding.session().cancelOrder(resolvedId, resolvedProprietary);
  }

  public void addMarketDataHandler(StreamMessageHandler handler) {
    addMarketDataHandler(handler, null);
  }

  public void addMarketDataHandler(StreamMessageHandler handler, Environment environment) {
    binding(environment).session().addMarketDataHandler(handler);
  }

  public void removeMarketDataHandler(StreamMessageHandler handler) {
    removeMarketDataHandler(handler, null);
  }

  public void removeMarketDataHandler(StreamMessageHandler handler, Environment environment) {
    binding(environment).session().removeMarketDataHandler(handler);
  }

  public void addOrderReportHandler(StreamMessageHandler handler) {
    addOrderReportHandler(handler, null);
  }

  public void addOrderReportHandler(StreamMessageHandler handler, Environment environment) {
    binding(environment).session().addOrderReportHandler(handler);
  }

  public void removeOrderReportHandler(StreamMessageHandler handler) {
    removeOrderReportHandler(handler, null);
  }

  public void removeOrderReportHandler(StreamMessageHandler handler, Environment environment) {
    binding(environment).session().removeOrderReportHandler(handler);
  }

  public void addErrorHandler(StreamErrorHandler handler) {
    addErrorHandler(handler, null);
  }

  public void addErrorHandler(StreamErrorHandler handler, Environment environment) {
    binding(environment).session().addErrorHandler(handler);
  }

  public void removeErrorHandler(StreamErrorHandler handler) {
    removeErrorHandler(handler, null);
  }

  public void removeErrorHandler(StreamErrorHandler handler, Environment environment) {
    binding(environment).session().removeErrorHandler(handler);
  }

  public void setExceptionHandler(StreamExceptionHandler handler) {
    setExceptionHandler(handler, null);
  }

  public void setExceptionHandler(StreamExceptionHandler handler, Environment environment) {
    binding(environment).session().setExceptionHandler(handler);
  }

  /** Closes every open streaming session. */
  @Override
  public void close() {
    bindings.values().forEach(binding -> binding.session().close());
  }

  private EnvironmentBinding binding(Environment environment) {
    Environment target = environment == null ? defaultEnvironment : environment;
    if (target == null) {
      throw new IllegalArgumentException("Environment not specified.");
    }
    EnvironmentBinding binding = bindings.get(target);
    if (binding == null || !binding.context().isInitialized()) {
      throw new RofexNotInitializedException("The Environment is not initialized.");
    }
    return binding;
  }

  private static void ensureConnected(EnvironmentBinding binding) {
    if (!binding.session().isConnected()) {
      binding.session().connect();
    }
  }

  private static String account(EnvironmentBinding binding, String account) {
    if (account != null && !account.isBlank()) {
      return account;
    }
    return binding
        .context()
        .account()
        .orElseThrow(() -> new IllegalArgumentException("Account not specified."));
  }

  private static String proprietary(EnvironmentBinding binding, String proprietary) {
    return proprietary == null || proprietary.isBlank()
        ? binding.context().proprietary()
        : proprietary;
  }

  private static NewOrderRequest withAccount(EnvironmentBinding binding, NewOrderRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Order request not specified.");
    }
    return request.withAccount(account(binding, request.account()));
  }

  private static Collection<MarketDataEntry> entriesOrAll(Collection<MarketDataEntry> entries) {
    if (entries == null || entries.isEmpty()) {
      return MarketDataEntry.all();
    }
    List<MarketDataEntry> resolved = new ArrayList<>(entries.size());
    for (MarketDataEntry entry : entries) {
      if (entry == null) {
        throw new IllegalArgumentException("Invalid Market Data Entry: null");
      }
      resolved.add(entry);
    }
    return resolved;
  }

  private static Market marketOrDefault(Market market) {
    return market == null ? Market.ROFEX : market;
  }

  private static int requireDepth(int depth) {
    if (depth < 1) {
      throw new IllegalArgumentException("depth must be >= 1");
    }
    return depth;
  }

  private static String requireTicker(String ticker) {
    if (ticker == null || ticker.isBlank()) {
      throw new IllegalArgumentException("Ticker not specified.");
    }
    return ticker;
  }

  private static String requireClientOrderId(String clientOrderId) {
    if (clientOrderId == null || clientOrderId.isBlank()) {
      throw new IllegalArgumentException("Client order id not specified.");
    }
    return clientOrderId;
  }

  private record EnvironmentBinding(
      EnvironmentContext context, RofexRestClient restClient, RofexStreamingSession session) {}
}
