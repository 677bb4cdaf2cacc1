package org.nowstart.orderflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.OrderJob;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.dto.OrderSubmissionRequest;
import org.nowstart.orderflow.data.dto.OrderSubmissionResponse;
import org.nowstart.orderflow.data.exception.OrderApiException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderSubmissionService {

    static final String ACCEPTED_MESSAGE = "Order submitted successfully. Connect via WebSocket for status updates.";

    private final OrderFactory orderFactory;
    private final OrderStateStore orderStateStore;
    private final OrderJobQueue orderJobQueue;

    public OrderSubmissionResponse submit(OrderSubmissionRequest request) {
        if (!request.orderType().isExecutable()) {
            throw new OrderApiException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    "unsupported_order_type",
                    "Order type " + request.orderType() + " is not supported yet"
            );
        }
        if (request.tokenIn().trim().equalsIgnoreCase(request.tokenOut().trim())) {
            throw new OrderApiException(HttpStatus.BAD_REQUEST, "validation_error", "tokenIn and tokenOut must differ");
        }

        OrderSnapshot order = orderFactory.build(request);
        // Nothing reaches the active index unless the durable row exists.
        orderStateStore.archive(order);
        orderStateStore.put(order);
        orderJobQueue.enqueue(OrderJob.first(order));

        log.info("Order submitted. orderId={}, pair={}/{}, amount={}, orderType={}",
                order.orderId(), order.tokenIn(), order.tokenOut(), order.amount(), order.orderType());
        return new OrderSubmissionResponse(order.orderId(), order.status(), ACCEPTED_MESSAGE);
    }

    public OrderSnapshot getOrder(String orderId) {
        return orderStateStore.get(orderId)
                .or(() -> orderStateStore.findArchived(orderId))
                .orElseThrow(() -> new OrderApiException(HttpStatus.NOT_FOUND, "order_not_found", "Order not found"));
    }
}
