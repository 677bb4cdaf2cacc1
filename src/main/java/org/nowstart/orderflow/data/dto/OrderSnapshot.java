package org.nowstart.orderflow.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.nowstart.orderflow.data.type.OrderType;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderSnapshot(
        String orderId,
        String tokenIn,
        String tokenOut,
        BigDecimal amount,
        OrderType orderType,
        OrderStatus status,
        Instant submittedAt,
        Instant completedAt,
        Instant failedAt,
        String failureReason,
        String venueOrderId,
        BigDecimal executionPrice,
        BigDecimal executionAmount,
        RoutingDecision routingDecision,
        String settlementReference,
        Integer attemptCount
) {

    /**
     * Moves the snapshot to {@code nextStatus} and applies the non-null members of {@code update}.
     * Identity fields never change; completedAt and failedAt are stamped on first entry into
     * CONFIRMED and FAILED and kept afterwards.
     */
    public OrderSnapshot merge(OrderStatus nextStatus, OrderUpdate update, Instant now) {
        OrderUpdate changes = update == null ? OrderUpdate.EMPTY : update;

        Instant resolvedCompletedAt = completedAt;
        if (resolvedCompletedAt == null && nextStatus == OrderStatus.CONFIRMED) {
            resolvedCompletedAt = pick(changes.completedAt(), now);
        }
        Instant resolvedFailedAt = failedAt;
        if (resolvedFailedAt == null && nextStatus == OrderStatus.FAILED) {
            resolvedFailedAt = pick(changes.failedAt(), now);
        }

        return toBuilder()
                .status(nextStatus)
                .completedAt(resolvedCompletedAt)
                .failedAt(resolvedFailedAt)
                .failureReason(pick(changes.failureReason(), failureReason))
                .venueOrderId(pick(changes.venueOrderId(), venueOrderId))
                .executionPrice(pick(changes.executionPrice(), executionPrice))
                .executionAmount(pick(changes.executionAmount(), executionAmount))
                .routingDecision(pick(changes.routingDecision(), routingDecision))
                .settlementReference(pick(changes.settlementReference(), settlementReference))
                .attemptCount(pick(changes.attemptCount(), attemptCount))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
