package org.nowstart.orderflow.data.dto;

public record OrderJob(
        String orderId,
        OrderSnapshot order,
        int attemptsMade
) {

    public static OrderJob first(OrderSnapshot order) {
        return new OrderJob(order.orderId(), order, 0);
    }

    public int attemptNumber() {
        return attemptsMade + 1;
    }

    public OrderJob nextAttempt() {
        return new OrderJob(orderId, order, attemptsMade + 1);
    }
}
