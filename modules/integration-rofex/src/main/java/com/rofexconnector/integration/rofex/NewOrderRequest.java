package com.rofexconnector.integration.rofex;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A new single order, shared by the REST and the websocket order paths.
 *
 * <p>{@code account} may be left null when the environment has a default account; the connector
 * fills it in before sending.
 */
public record NewOrderRequest(
    String ticker,
    Side side,
    BigDecimal size,
    OrderType orderType,
    String account,
    BigDecimal price,
    TimeInForce timeInForce,
    Market market,
    boolean cancelPrevious,
    boolean iceberg,
    BigDecimal displayQuantity,
    LocalDate expireDate,
    boolean allOrNone,
    String clientOrderId) {
  public NewOrderRequest {
    if (ticker == null || ticker.isBlank()) {
      throw new IllegalArgumentException("ticker is required");
    }
    if (side == null) {
      throw new IllegalArgumentException("side is required");
    }
    if (size == null || size.compareTo(BigDecimal.ZERO) <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
    if (orderType == null) {
      throw new IllegalArgumentException("orderType is required");
    }
    timeInForce = timeInForce == null ? TimeInForce.DAY : timeInForce;
    market = market == null ? Market.ROFEX : market;
    account = account == null || account.isBlank() ? null : account;
    clientOrderId = clientOrderId == null || clientOrderId.isBlank() ? null : clientOrderId;

    if (orderType == OrderType.LIMIT
        && (price == null || price.compareTo(BigDecimal.ZERO) <= 0)) {
      throw new IllegalArgumentException("LIMIT order requires price > 0");
    }
    if (iceberg && (displayQuantity == null || displayQuantity.compareTo(BigDecimal.ZERO) <= 0)) {
      throw new IllegalArgumentException("iceberg order requires displayQuantity > 0");
    }
    if (timeInForce == TimeInForce.GOOD_TILL_DATE && expireDate == null) {
      throw new IllegalArgumentException("GTD order requires expireDate");
    }
  }

  public static Builder builder(String ticker, Side side, BigDecimal size, OrderType orderType) {
    return new Builder(ticker, side, size, orderType);
  }

  public NewOrderRequest withAccount(String newAccount) {
    return new NewOrderRequest(
        ticker,
        side,
        size,
        orderType,
        newAccount,
        price,
        timeInForce,
        market,
        cancelPrevious,
        iceberg,
        displayQuantity,
        expireDate,
        allOrNone,
        clientOrderId);
  }

  public static final class Builder {
    private final String ticker;
    private final Side side;
    private final BigDecimal size;
    private final OrderType orderType;
    private String account;
    private BigDecimal price;
    private TimeInForce timeInForce = TimeInForce.DAY;
    private Market market = Market.ROFEX;
    private boolean cancelPrevious;
    private boolean iceberg;
    private BigDecimal displayQuantity;
    private LocalDate expireDate;
    private boolean allOrNone;
    private String clientOrderId;

    private Builder(String ticker, Side side, BigDecimal size, OrderType orderType) {
      this.ticker = ticker;
      this.side = side;
      this.size = size;
      this.orderType = orderType;
    }

    public Builder account(String account) {
      this.account = account;
      return this;
    }

    public Builder price(BigDecimal price) {
      this.price = price;
      return this;
    }

    public Builder timeInForce(TimeInForce timeInForce) {
      this.timeInForce = timeInForce;
      return this;
    }

    public Builder market(Market market) {
      this.market = market;
      return this;
    }

    public Builder cancelPrevious(boolean cancelPrevious) {
      this.cancelPrevious = cancelPrevious;
      return this;
    }

    public Builder iceberg(BigDecimal displayQuantity) {
      this.iceberg = true;
      this.displayQuantity = displayQuantity;
      return this;
    }

    public Builder expireDate(LocalDate expireDate) {
      this.expireDate = expireDate;
      return this;
    }

    public Builder allOrNone(boolean allOrNone) {
      this.allOrNone = allOrNone;
      return this;
    }

    public Builder clientOrderId(String clientOrderId) {
      this.clientOrderId = clientOrderId;
      return this;
    }

    public NewOrderRequest build() {
      return new NewOrderRequest(
          ticker,
          side,
          size,
          orderType,
          account,
          price,
          timeInForce,
          market,
          cancelPrevious,
          iceberg,
          displayQuantity,
          expireDate,
          allOrNone,
          clientOrderId);
    }
  }
}
