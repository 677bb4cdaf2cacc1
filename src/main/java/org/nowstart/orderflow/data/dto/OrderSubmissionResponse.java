package org.nowstart.orderflow.data.dto;

import org.nowstart.orderflow.data.type.OrderStatus;

public record OrderSubmissionResponse(
        String orderId,
        OrderStatus status,
        String message
) {
}
