package org.nowstart.orderflow.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import lombok.Builder;
import org.nowstart.orderflow.data.type.OrderStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusUpdate(
        String orderId,
        OrderStatus status,
        long timestamp,
        String message,
        StatusData data
) {

    public static StatusUpdate of(String orderId, OrderStatus status, String message, StatusData data) {
        return new StatusUpdate(orderId, status, System.currentTimeMillis(), message, data);
    }

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StatusData(
            RoutingDecision routingDecision,
            String settlementReference,
            String failureReason,
            BigDecimal executionPrice,
            BigDecimal executionAmount,
            Integer attemptNumber,
            Integer maxAttempts,
            Boolean willRetry
    ) {
    }
}
