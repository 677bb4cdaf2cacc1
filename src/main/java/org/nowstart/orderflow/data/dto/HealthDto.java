package org.nowstart.orderflow.data.dto;

public record HealthDto(
        String status,
        long timestamp
) {
}
