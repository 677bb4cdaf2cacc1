package org.nowstart.orderflow.service;

import java.time.Instant;
import java.util.UUID;
import org.nowstart.orderflow.data.dto.OrderSubmissionRequest;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.springframework.stereotype.Service;

@Service
public class OrderFactory {

    public OrderSnapshot build(OrderSubmissionRequest request) {
        return OrderSnapshot.builder()
                .orderId(nextOrderId())
                .tokenIn(request.tokenIn().trim())
                .tokenOut(request.tokenOut().trim())
                .amount(request.amount())
                .orderType(request.orderType())
                .status(OrderStatus.PENDING)
                .submittedAt(Instant.now())
                .build();
    }

    String nextOrderId() {
        return "order_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
