package org.nowstart.orderflow.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamFrame(
        String type,
        String orderId,
        long timestamp,
        String message
) {

    public static StreamFrame connected(String orderId) {
        return new StreamFrame("connected", orderId, System.currentTimeMillis(), "Connected to order status stream");
    }

    public static StreamFrame pong() {
        return new StreamFrame("pong", null, System.currentTimeMillis(), null);
    }
}
