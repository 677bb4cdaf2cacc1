package org.nowstart.orderflow.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.orderflow.data.type.Venue;

public record SettlementReceipt(
        boolean success,
        String settlementReference,
        BigDecimal realizedPrice,
        BigDecimal realizedAmount,
        Venue venue,
        Instant settledAt
) {
}
