package com.rofexconnector.integration.rofex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class NewOrderRequestTest {
  @Test
  void shouldApplyDefaults() {
    NewOrderRequest request =
        NewOrderRequest.builder("DLR/ENE24", Side.BUY, BigDecimal.ONE, OrderType.MARKET)
            .account(" ")
            .build();

    assertEquals(TimeInForce.DAY, request.timeInForce());
    assertEquals(Market.ROFEX, request.market());
    assertNull(request.account());
    assertEquals("REM1", request.withAccount("REM1").account());
  }

  @Test
  void shouldRequirePriceForLimitOrders() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            NewOrderRequest.builder("DLR/ENE24", Side.BUY, BigDecimal.ONE, OrderType.LIMIT)
                .build());
  }

  @Test
  void shouldRequireDisplayQuantityForIceberg() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            NewOrderRequest.builder("DLR/ENE24", Side.BUY, BigDecimal.TEN, OrderType.LIMIT)
                .price(BigDecimal.ONE)
                .iceberg(BigDecimal.ZERO)
                .build());
  }

  @Test
  void shouldRequireExpireDateForGoodTillDate() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            NewOrderRequest.builder("DLR/ENE24", Side.SELL, BigDecimal.ONE, OrderType.MARKET)
                .timeInForce(TimeInForce.GOOD_TILL_DATE)
                .build());
  }

  @Test
  void shouldRejectNonPositiveSize() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            NewOrderRequest.builder("DLR/ENE24", Side.SELL, BigDecimal.ZERO, OrderType.MARKET)
                .build());
  }
}
