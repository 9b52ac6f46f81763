package com.apex.guardian.service.exchange;

import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.model.Direction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperExchangeGatewayTest {

    private PaperExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        ExecutionProperties executionProperties = new ExecutionProperties();
        executionProperties.getPaper().getMarkPrices().put("ethusdt", 2500.0);
        gateway = new PaperExchangeGateway(executionProperties);
    }

    @Test
    void stopTriggerClosesPositionAndBooksPnl() {
        gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.SELL, new BigDecimal("1"), false);
        gateway.placeStopMarket("A", "ETHUSDT", OrderSide.BUY, new BigDecimal("2550"));
        BigDecimal before = gateway.getBalance("A");

        gateway.setMarkPrice("ETHUSDT", new BigDecimal("2560"));

        assertThat(gateway.getPosition("A", "ETHUSDT")).isEmpty();
        assertThat(gateway.openOrders("A", "ETHUSDT")).isEmpty();
        assertThat(gateway.getBalance("A")).isEqualByComparingTo(before.subtract(new BigDecimal("60")));
    }

    @Test
    void orderStateFollowsTriggerAndCancel() {
        gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.BUY, new BigDecimal("1"), false);
        String stop = gateway.placeStopMarket("A", "ETHUSDT", OrderSide.SELL, new BigDecimal("2450")).orderId();
        String target = gateway.placeTakeProfitMarket("A", "ETHUSDT", OrderSide.SELL, new BigDecimal("2600")).orderId();
        String spare = gateway.placeTakeProfitMarket("A", "ETHUSDT", OrderSide.SELL, new BigDecimal("2700")).orderId();
        gateway.cancelOrder("A", "ETHUSDT", spare);

        assertThat(gateway.getOrder("A", "ETHUSDT", stop)).hasValueSatisfying(
                order -> assertThat(order.isWorking()).isTrue());

        gateway.setMarkPrice("ETHUSDT", new BigDecimal("2610"));

        assertThat(gateway.getOrder("A", "ETHUSDT", target)).hasValueSatisfying(order -> {
            assertThat(order.isFilled()).isTrue();
            assertThat(order.avgPrice()).isEqualByComparingTo("2610");
            assertThat(order.executedQty()).isEqualByComparingTo("1");
        });
        assertThat(gateway.getOrder("A", "ETHUSDT", stop)).hasValueSatisfying(
                order -> assertThat(order.status()).isEqualTo("EXPIRED"));
        assertThat(gateway.getOrder("A", "ETHUSDT", spare)).hasValueSatisfying(
                order -> assertThat(order.status()).isEqualTo("CANCELED"));
        assertThat(gateway.getOrder("A", "ETHUSDT", "PAPER-999")).isEmpty();
    }

    @Test
    void triggerOrderOnWrongSideIsRefused() {
        gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.BUY, new BigDecimal("1"), false);

        assertThatThrownBy(() -> gateway.placeStopMarket("A", "ETHUSDT", OrderSide.SELL, new BigDecimal("2600")))
                .isInstanceOf(ExchangeApiException.class);
    }

    @Test
    void reduceOnlyNeedsAnOpposingPosition() {
        assertThatThrownBy(() -> gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.SELL, BigDecimal.ONE, true))
                .isInstanceOf(ExchangeApiException.class);

        gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.BUY, new BigDecimal("2"), false);
        gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.SELL, new BigDecimal("0.5"), true);

        assertThat(gateway.getPosition("A", "ETHUSDT")).hasValueSatisfying(position -> {
            assertThat(position.direction()).isEqualTo(Direction.LONG);
            assertThat(position.quantity()).isEqualByComparingTo("1.5");
        });
    }

    @Test
    void accountsAreIsolated() {
        gateway.placeMarketOrder("A", "ETHUSDT", OrderSide.BUY, BigDecimal.ONE, false);

        assertThat(gateway.getPosition("B", "ETHUSDT")).isEmpty();
        assertThat(gateway.openOrders("B", "ETHUSDT")).isEmpty();
    }
}
