package org.nowstart.orderflow.service.venue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.nowstart.orderflow.data.dto.Quote;
import org.nowstart.orderflow.data.dto.SettlementReceipt;
import org.nowstart.orderflow.data.exception.OrderProcessingException;
import org.nowstart.orderflow.data.property.VenueSimulationProperties;
import org.nowstart.orderflow.data.type.Venue;

class ExecutionSimulatorTest {

    private final Quote quote = new Quote(
            Venue.METEORA,
            new BigDecimal("100"),
            new BigDecimal("0.04"),
            new BigDecimal("99.6"),
            new BigDecimal("996"),
            new BigDecimal("2000000")
    );

    @RepeatedTest(10)
    void execute_realizedPriceStaysWithinSlippageOfNetRate() {
        ExecutionSimulator simulator = simulator(new BigDecimal("0.005"), 0.0);

        SettlementReceipt receipt = simulator.execute(quote, new BigDecimal("10"));

        assertThat(receipt.success()).isTrue();
        assertThat(receipt.venue()).isEqualTo(Venue.METEORA);
        assertThat(receipt.realizedPrice().doubleValue()).isBetween(99.6 * 0.995, 99.6 * 1.005);
        assertThat(receipt.realizedAmount()).isEqualByComparingTo(receipt.realizedPrice().multiply(new BigDecimal("10")));
        assertThat(receipt.settlementReference()).matches("[0-9a-f]{64}");
        assertThat(receipt.settledAt()).isNotNull();
    }

    @Test
    void execute_withoutSlippageRealizesQuotedNetRate() {
        ExecutionSimulator simulator = simulator(BigDecimal.ZERO, 0.0);

        SettlementReceipt receipt = simulator.execute(quote, new BigDecimal("2"));

        assertThat(receipt.realizedPrice()).isEqualByComparingTo("99.6");
        assertThat(receipt.realizedAmount()).isEqualByComparingTo("199.2");
    }

    @Test
    void execute_injectedFailureIsTransient() {
        ExecutionSimulator simulator = simulator(BigDecimal.ZERO, 1.0);

        assertThatThrownBy(() -> simulator.execute(quote, BigDecimal.ONE))
                .isInstanceOfSatisfying(OrderProcessingException.class, exception ->
                        assertThat(exception.getKind()).isEqualTo(OrderProcessingException.FailureKind.TRANSIENT))
                .hasMessageContaining("Meteora");
    }

    @Test
    void settlementDelay_staysInsideConfiguredRange() {
        ExecutionSimulator simulator = new ExecutionSimulator(new VenueSimulationProperties(
                Duration.ZERO, Duration.ofSeconds(2), Duration.ofSeconds(3), BigDecimal.ZERO, 0.0));

        for (int i = 0; i < 50; i++) {
            assertThat(simulator.settlementDelay().toMillis()).isBetween(2000L, 3000L);
        }
    }

    private ExecutionSimulator simulator(BigDecimal maxSlippage, double failureRate) {
        return new ExecutionSimulator(new VenueSimulationProperties(
                Duration.ZERO, Duration.ZERO, Duration.ZERO, maxSlippage, failureRate));
    }
}
