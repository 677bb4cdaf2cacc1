package org.nowstart.orderflow.service.venue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.Quote;
import org.nowstart.orderflow.data.dto.SettlementReceipt;
import org.nowstart.orderflow.data.exception.OrderProcessingException;
import org.nowstart.orderflow.data.property.VenueSimulationProperties;
import org.nowstart.orderflow.data.type.Venue;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class ExecutionSimulator {

    private static final HexFormat HEX = HexFormat.of();

    private final VenueSimulationProperties venueSimulationProperties;

    public SettlementReceipt execute(Quote quote, BigDecimal amount) {
        Venue venue = quote.venue();
        pause(settlementDelay(), venue);

        ThreadLocalRandom random = ThreadLocalRandom.current();
        if (random.nextDouble() < venueSimulationProperties.transientFailureRate()) {
            throw OrderProcessingException.transientFailure("Network timeout while settling on " + venue.getDisplayName());
        }

        BigDecimal realizedPrice = quote.netRate()
                .multiply(BigDecimal.ONE.add(slippage(random)), MathContext.DECIMAL64);
        BigDecimal realizedAmount = amount.multiply(realizedPrice, MathContext.DECIMAL64);
        String settlementReference = settlementReference(random);

        log.info("Settlement completed. venue={}, amount={}, realizedPrice={}, realizedAmount={}, reference={}",
                venue.getDisplayName(), amount, realizedPrice, realizedAmount, settlementReference);
        return new SettlementReceipt(true, settlementReference, realizedPrice, realizedAmount, venue, Instant.now());
    }

    Duration settlementDelay() {
        long min = venueSimulationProperties.executionDelayMin().toMillis();
        long max = venueSimulationProperties.executionDelayMax().toMillis();
        if (max <= min) {
            return Duration.ofMillis(min);
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(min, max + 1));
    }

    private BigDecimal slippage(ThreadLocalRandom random) {
        double bound = venueSimulationProperties.maxSlippage().doubleValue();
        if (bound <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(random.nextDouble(-bound, bound));
    }

    private String settlementReference(ThreadLocalRandom random) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    private void pause(Duration delay, Venue venue) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrderProcessingException(
                    OrderProcessingException.FailureKind.TRANSIENT,
                    "Settlement interrupted on " + venue.getDisplayName(),
                    e
            );
        }
    }
}
