package org.nowstart.orderflow.service.venue;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import org.nowstart.orderflow.data.dto.Quote;
import org.nowstart.orderflow.data.type.Venue;

public interface QuoteEngine {

    /**
     * Prices {@code amount} of {@code tokenIn} into {@code tokenOut} on one venue. The future
     * completes off the caller thread.
     */
    CompletableFuture<Quote> quote(Venue venue, String tokenIn, String tokenOut, BigDecimal amount);
}
