package org.nowstart.orderflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.orderflow.data.dto.OrderJob;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.exception.OrderPersistenceException;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.nowstart.orderflow.data.type.OrderType;

@ExtendWith(MockitoExtension.class)
class OrderRecoveryServiceTest {

    @Mock
    private OrderStateStore orderStateStore;

    @Mock
    private OrderJobQueue orderJobQueue;

    @Test
    void recover_requeuesInFlightOrdersAndDropsStaleEntries() {
        OrderRecoveryService service = service(true);
        when(orderStateStore.activeOrderIds()).thenReturn(new LinkedHashSet<>(List.of("building", "confirmed", "expired")));
        when(orderStateStore.get("building")).thenReturn(Optional.of(order("building", OrderStatus.BUILDING, 2)));
        when(orderStateStore.get("confirmed")).thenReturn(Optional.of(order("confirmed", OrderStatus.CONFIRMED, 1)));
        when(orderStateStore.get("expired")).thenReturn(Optional.empty());
        when(orderJobQueue.enqueue(any())).thenReturn(true);

        int requeued = service.recover();

        assertThat(requeued).isEqualTo(1);
        ArgumentCaptor<OrderJob> captor = ArgumentCaptor.forClass(OrderJob.class);
        verify(orderJobQueue).enqueue(captor.capture());
        assertThat(captor.getValue().orderId()).isEqualTo("building");
        assertThat(captor.getValue().attemptNumber()).isEqualTo(2);
        assertThat(captor.getValue().order().status()).isEqualTo(OrderStatus.PENDING);
        verify(orderStateStore).removeFromActive("confirmed");
        verify(orderStateStore).removeFromActive("expired");
    }

    @Test
    void resumeJob_failedOrderWaitingForRetryContinuesWithNextAttempt() {
        OrderSnapshot failed = order("failed", OrderStatus.FAILED, 1).toBuilder()
                .failureReason("Attempt 1 failed: timeout")
                .failedAt(Instant.now())
                .build();

        OrderJob job = service(true).resumeJob(failed).orElseThrow();

        assertThat(job.attemptNumber()).isEqualTo(2);
        assertThat(job.order().failureReason()).isNull();
        assertThat(job.order().failedAt()).isNull();
    }

    @Test
    void resumeJob_exhaustedOrderIsNotResumed() {
        assertThat(service(true).resumeJob(order("failed", OrderStatus.FAILED, 3))).isEmpty();
    }

    @Test
    void onApplicationReady_skipsWhenDisabled() {
        service(false).onApplicationReady();

        verifyNoInteractions(orderStateStore, orderJobQueue);
    }

    @Test
    void onApplicationReady_storeOutageDoesNotFailStartup() {
        when(orderStateStore.activeOrderIds()).thenThrow(new OrderPersistenceException(
                OrderPersistenceException.Store.EPHEMERAL, "Failed to read active order index", new RuntimeException()));

        service(true).onApplicationReady();

        verify(orderJobQueue, never()).enqueue(any());
    }

    private OrderRecoveryService service(boolean enabled) {
        return new OrderRecoveryService(orderStateStore, orderJobQueue, new OrderEngineProperties(
                10, 100, 3, Duration.ofSeconds(2), Duration.ofSeconds(8), Duration.ZERO, Duration.ofHours(24), enabled));
    }

    private OrderSnapshot order(String orderId, OrderStatus status, Integer attemptCount) {
        return OrderSnapshot.builder()
                .orderId(orderId)
                .tokenIn("SOL")
                .tokenOut("USDC")
                .amount(BigDecimal.ONE)
                .orderType(OrderType.MARKET)
                .status(status)
                .submittedAt(Instant.now())
                .attemptCount(attemptCount)
                .build();
    }
}
