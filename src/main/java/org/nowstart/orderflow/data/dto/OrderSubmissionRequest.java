package org.nowstart.orderflow.data.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.nowstart.orderflow.data.type.OrderType;

public record OrderSubmissionRequest(
        @NotBlank(message = "tokenIn is required")
        String tokenIn,
        @NotBlank(message = "tokenOut is required")
        String tokenOut,
        @NotNull(message = "amount is required")
        @DecimalMin(value = "0", inclusive = false, message = "amount must be positive")
        BigDecimal amount,
        @NotNull(message = "orderType must be MARKET, LIMIT, or SNIPER")
        OrderType orderType
) {
}
