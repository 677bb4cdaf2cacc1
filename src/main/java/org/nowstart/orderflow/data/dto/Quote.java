package org.nowstart.orderflow.data.dto;

import java.math.BigDecimal;
import org.nowstart.orderflow.data.type.Venue;

public record Quote(
        Venue venue,
        BigDecimal rate,
        BigDecimal fee,
        BigDecimal netRate,
        BigDecimal amountOut,
        BigDecimal liquidity
) {
}
