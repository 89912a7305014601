package com.regimetrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.regimetrader.config.OrderLifecycleConfig;
import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.exception.TransportException;
import com.regimetrader.oms.LatencyTracker;
import com.regimetrader.oms.OrderGateway;
import com.regimetrader.oms.OrderIdGenerator;
import com.regimetrader.oms.OrderLifecycleManager;
import com.regimetrader.oms.SubmitResult;
import com.regimetrader.oms.SubmitStatus;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class OrderLifecycleManagerTest {

    private OrderGateway orderGateway;
    private EventPublisherHelper eventPublisherHelper;
    private PositionState positionState;
    private MutableClock clock;
    private OrderLifecycleManager manager;

    @BeforeEach
    void setUp() {
        orderGateway = mock(OrderGateway.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        positionState = new PositionState();
        clock = new MutableClock(Instant.parse("2026-01-02T03:04:05Z"));

        manager = new OrderLifecycleManager(
                orderGateway,
                new OrderLifecycleConfig(),
                new OrderIdGenerator("team_alpha"),
                positionState,
                new LatencyTracker(clock, 1000),
                eventPublisherHelper);
    }

    private static OrderIntent intent(OrderSide side, String price, int quantity) {
        return OrderIntent.builder()
                .side(side)
                .price(new BigDecimal(price))
                .quantity(quantity)
                .source("test")
                .build();
    }

    // ==============================
    // SUBMIT
    // ==============================

    @Nested
    @DisplayName("Submit")
    class Submit {

        @Test
        @DisplayName("Accepted order gets a step-scoped id and rests locally")
        void accepted() {
            SubmitResult result = manager.submit(intent(OrderSide.BUY, "99.1", 200), 7);

            assertThat(result.getStatus()).isEqualTo(SubmitStatus.ACCEPTED);
            assertThat(result.getOrder().getId()).isEqualTo("ORD_team_alpha_7_0");
            assertThat(result.getOrder().getSubmittedStep()).isEqualTo(7);
            assertThat(manager.getOpenOrders()).containsExactly(result.getOrder());
            assertThat(positionState.getOrdersSent()).isEqualTo(1);
            verify(orderGateway).sendOrder(result.getOrder());
            verify(eventPublisherHelper).publishOrderSubmitted(manager, result.getOrder());
        }

        @Test
        @DisplayName("Sequence in the id follows the number of orders sent")
        void sequenceAdvances() {
            manager.submit(intent(OrderSide.BUY, "99.1", 200), 7);

            SubmitResult second = manager.submit(intent(OrderSide.BUY, "99.0", 200), 8);

            assertThat(second.getOrder().getId()).isEqualTo("ORD_team_alpha_8_1");
        }

        @Test
        @DisplayName("Crossing orders on the other side are cancelled before sending")
        void selfCrossCancelledFirst() {
            SubmitResult resting = manager.submit(intent(OrderSide.SELL, "100.0", 200), 1);

            SubmitResult result = manager.submit(intent(OrderSide.BUY, "100.0", 200), 2);

            InOrder order = inOrder(orderGateway);
            order.verify(orderGateway).cancelOrder(resting.getOrder().getId());
            order.verify(orderGateway).sendOrder(result.getOrder());
            assertThat(result.getCancelledOrderIds()).containsExactly(resting.getOrder().getId());
            assertThat(manager.getOpenOrders()).containsExactly(result.getOrder());
            verify(eventPublisherHelper)
                    .publishOrderCancelled(manager, resting.getOrder(), OrderLifecycleManager.REASON_SELF_CROSS);
        }

        @Test
        @DisplayName("Non-crossing resting orders are left alone")
        void noCross() {
            manager.submit(intent(OrderSide.SELL, "100.2", 200), 1);

            SubmitResult result = manager.submit(intent(OrderSide.BUY, "100.0", 200), 2);

            assertThat(result.getCancelledOrderIds()).isEmpty();
            assertThat(manager.getOpenOrders()).hasSize(2);
        }

        @Test
        @DisplayName("At the resting-order cap the oldest orders are cancelled and the new one deferred")
        void capacity() {
            for (int step = 0; step < 20; step++) {
                manager.submit(intent(OrderSide.BUY, "90.0", 100), step);
            }

            SubmitResult result = manager.submit(intent(OrderSide.BUY, "90.0", 100), 20);

            assertThat(result.getStatus()).isEqualTo(SubmitStatus.DEFERRED);
            assertThat(result.getOrder()).isNull();
            assertThat(result.getCancelledOrderIds()).containsExactly(
                    "ORD_team_alpha_0_0", "ORD_team_alpha_1_1", "ORD_team_alpha_2_2",
                    "ORD_team_alpha_3_3", "ORD_team_alpha_4_4");
            assertThat(manager.getOpenOrders()).hasSize(15);
            assertThat(positionState.getOrdersSent()).isEqualTo(20);
        }

        @Test
        @DisplayName("Gateway failure rejects the order without resting it")
        void sendFailure() {
            doThrow(new TransportException("order socket not open")).when(orderGateway).sendOrder(any());

            SubmitResult result = manager.submit(intent(OrderSide.BUY, "99.1", 200), 3);

            assertThat(result.getStatus()).isEqualTo(SubmitStatus.REJECTED);
            assertThat(result.getReason()).contains("not open");
            assertThat(manager.getOpenOrders()).isEmpty();
            assertThat(positionState.getOrdersSent()).isZero();
            verify(eventPublisherHelper).publishOrderRejected(eq(manager), any(OrderRecord.class), eq("order socket not open"));
        }
    }

    // ==============================
    // CANCEL / FILL
    // ==============================

    @Nested
    @DisplayName("Cancel and fill")
    class CancelAndFill {

        @Test
        @DisplayName("Cancel removes locally even when the gateway fails")
        void cancelDespiteGatewayFailure() {
            SubmitResult result = manager.submit(intent(OrderSide.BUY, "99.1", 200), 1);
            doThrow(new TransportException("closed")).when(orderGateway).cancelOrder(any());

            assertThat(manager.cancel(result.getOrder().getId(), "test")).isTrue();
            assertThat(manager.getOpenOrders()).isEmpty();
            assertThat(manager.cancel(result.getOrder().getId(), "test")).isFalse();
        }

        @Test
        @DisplayName("Fill updates inventory, cash and P&L marked at the last mid")
        void fillUpdatesPosition() {
            SubmitResult result = manager.submit(intent(OrderSide.BUY, "100.0", 200), 1);
            clock.advanceMillis(15);

            Fill reconciled = manager.onFill(Fill.builder()
                    .orderId(result.getOrder().getId())
                    .side(OrderSide.BUY)
                    .price(new BigDecimal("100.0"))
                    .quantity(200)
                    .build(), 100.5);

            assertThat(reconciled.getLatencyMs()).isEqualTo(15L);
            assertThat(positionState.getInventory()).isEqualTo(200);
            assertThat(positionState.getCashFlow()).isEqualByComparingTo("-20000");
            assertThat(positionState.getPnl()).isEqualByComparingTo("100");
            assertThat(manager.getOpenOrders()).isEmpty();
        }

        @Test
        @DisplayName("Fill for a cancelled order is still applied")
        void fillAfterCancel() {
            SubmitResult result = manager.submit(intent(OrderSide.SELL, "100.0", 300), 1);
            manager.cancel(result.getOrder().getId(), "test");

            Fill reconciled = manager.onFill(Fill.builder()
                    .orderId(result.getOrder().getId())
                    .side(OrderSide.SELL)
                    .price(new BigDecimal("100.0"))
                    .quantity(300)
                    .build(), 100.0);

            assertThat(positionState.getInventory()).isEqualTo(-300);
            assertThat(reconciled.getLatencyMs()).isNotNull();
            verify(eventPublisherHelper).publishOrderFilled(manager, null, reconciled);
        }

        @Test
        @DisplayName("Fill for an unknown id is applied without latency")
        void unknownFill() {
            Fill reconciled = manager.onFill(Fill.builder()
                    .orderId("ORD_other_1_0")
                    .side(OrderSide.BUY)
                    .price(new BigDecimal("99.0"))
                    .quantity(100)
                    .build(), 99.0);

            assertThat(reconciled.getLatencyMs()).isNull();
            assertThat(positionState.getInventory()).isEqualTo(100);
            assertThat(positionState.getFillCount()).isEqualTo(1);
            verify(orderGateway, never()).cancelOrder(any());
        }
    }
}
