package org.nowstart.orderflow.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

/**
 * Partial change applied to an {@link OrderSnapshot}. Null members leave the snapshot untouched.
 */
@Builder
public record OrderUpdate(
        RoutingDecision routingDecision,
        String settlementReference,
        String venueOrderId,
        BigDecimal executionPrice,
        BigDecimal executionAmount,
        String failureReason,
        Integer attemptCount,
        Instant completedAt,
        Instant failedAt
) {

    public static final OrderUpdate EMPTY = OrderUpdate.builder().build();
}
