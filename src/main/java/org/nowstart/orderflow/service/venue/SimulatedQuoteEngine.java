package org.nowstart.orderflow.service.venue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.Quote;
import org.nowstart.orderflow.data.property.VenueSimulationProperties;
import org.nowstart.orderflow.data.type.Venue;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class SimulatedQuoteEngine implements QuoteEngine {

    private final VenueSimulationProperties venueSimulationProperties;

    @Override
    public CompletableFuture<Quote> quote(Venue venue, String tokenIn, String tokenOut, BigDecimal amount) {
        Executor delayed = CompletableFuture.delayedExecutor(
                venueSimulationProperties.quoteLatency().toMillis(),
                TimeUnit.MILLISECONDS
        );
        return CompletableFuture.supplyAsync(() -> price(venue, tokenIn, tokenOut, amount), delayed);
    }

    Quote price(Venue venue, String tokenIn, String tokenOut, BigDecimal amount) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        BigDecimal rate = BigDecimal.valueOf(between(random, venue.getMinRate(), venue.getMaxRate()));
        BigDecimal feeRate = BigDecimal.valueOf(between(random, venue.getMinFeeRate(), venue.getMaxFeeRate()));
        BigDecimal liquidity = BigDecimal.valueOf(between(random, venue.getMinLiquidity(), venue.getMaxLiquidity()))
                .setScale(2, RoundingMode.HALF_UP);

        BigDecimal fee = amount.multiply(feeRate, MathContext.DECIMAL64);
        BigDecimal amountOut = amount.subtract(fee).multiply(rate, MathContext.DECIMAL64);
        BigDecimal netRate = amountOut.divide(amount, MathContext.DECIMAL64);

        Quote quote = new Quote(venue, rate, fee, netRate, amountOut, liquidity);
        log.info("Venue quote received. venue={}, pair={}/{}, amount={}, rate={}, fee={}, netRate={}, liquidity={}",
                venue.getDisplayName(), tokenIn, tokenOut, amount, rate, fee, netRate, liquidity);
        return quote;
    }

    private double between(ThreadLocalRandom random, double min, double max) {
        if (max <= min) {
            return min;
        }
        return random.nextDouble(min, max);
    }
}
