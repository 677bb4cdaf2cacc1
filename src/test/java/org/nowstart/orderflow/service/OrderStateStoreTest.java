package org.nowstart.orderflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.dto.OrderUpdate;
import org.nowstart.orderflow.data.dto.Quote;
import org.nowstart.orderflow.data.dto.RoutingDecision;
import org.nowstart.orderflow.data.entity.TradingOrder;
import org.nowstart.orderflow.data.exception.OrderPersistenceException;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.nowstart.orderflow.data.type.OrderType;
import org.nowstart.orderflow.data.type.Venue;
import org.nowstart.orderflow.repository.TradingOrderRepository;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class OrderStateStoreTest {

    private static final Duration TTL = Duration.ofHours(24);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    @Mock
    private TradingOrderRepository tradingOrderRepository;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private OrderStateStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOperations);
        OrderEngineProperties properties = new OrderEngineProperties(
                10, 100, 3, Duration.ofSeconds(2), Duration.ofSeconds(8), Duration.ZERO, TTL, true);
        store = new OrderStateStore(redisTemplate, objectMapper, tradingOrderRepository, properties);
    }

    @Test
    void put_writesSnapshotWithTtlAndIndexesAsActive() throws Exception {
        OrderSnapshot order = pendingOrder();

        store.put(order);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("order:order_1_abc"), json.capture(), eq(TTL));
        verify(setOperations).add("orders:active", "order_1_abc");
        assertThat(objectMapper.readValue(json.getValue(), OrderSnapshot.class)).isEqualTo(order);
        assertThat(json.getValue()).contains("\"status\":\"pending\"");
    }

    @Test
    void get_returnsEmptyForUnknownOrder() {
        when(valueOperations.get("order:missing")).thenReturn(null);

        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void updateStatus_mergesAndRemovesTerminalOrderFromActiveIndex() throws Exception {
        when(valueOperations.get("order:order_1_abc")).thenReturn(objectMapper.writeValueAsString(pendingOrder()));

        Optional<OrderSnapshot> updated = store.updateStatus("order_1_abc", OrderStatus.CONFIRMED,
                OrderUpdate.builder().settlementReference("ref").build());

        assertThat(updated).isPresent();
        assertThat(updated.get().status()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(updated.get().completedAt()).isNotNull();
        assertThat(updated.get().settlementReference()).isEqualTo("ref");
        verify(valueOperations).set(eq("order:order_1_abc"), anyString(), eq(TTL));
        verify(setOperations).remove("orders:active", "order_1_abc");
        verify(setOperations, never()).add("orders:active", "order_1_abc");
    }

    @Test
    void updateStatus_nonTerminalKeepsOrderActive() throws Exception {
        when(valueOperations.get("order:order_1_abc")).thenReturn(objectMapper.writeValueAsString(pendingOrder()));

        store.updateStatus("order_1_abc", OrderStatus.ROUTING, OrderUpdate.EMPTY);

        verify(setOperations).add("orders:active", "order_1_abc");
    }

    @Test
    void updateStatus_missingSnapshotIsNotAnError() {
        when(valueOperations.get("order:gone")).thenReturn(null);

        Optional<OrderSnapshot> updated = store.updateStatus("gone", OrderStatus.ROUTING, OrderUpdate.EMPTY);

        assertThat(updated).isEmpty();
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void updateStatus_redisFailureSurfacesAsEphemeralPersistenceError() {
        when(valueOperations.get("order:order_1_abc")).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.updateStatus("order_1_abc", OrderStatus.ROUTING, OrderUpdate.EMPTY))
                .isInstanceOfSatisfying(OrderPersistenceException.class, exception ->
                        assertThat(exception.getStore()).isEqualTo(OrderPersistenceException.Store.EPHEMERAL));
    }

    @Test
    void get_corruptSnapshotSurfacesAsEphemeralPersistenceError() {
        when(valueOperations.get("order:order_1_abc")).thenReturn("{not json");

        assertThatThrownBy(() -> store.get("order_1_abc"))
                .isInstanceOf(OrderPersistenceException.class)
                .hasMessageContaining("order_1_abc");
    }

    @Test
    void archive_insertsNewRowWithAllFields() {
        when(tradingOrderRepository.findById("order_1_abc")).thenReturn(Optional.empty());
        OrderSnapshot confirmed = confirmedOrder();

        store.archive(confirmed);

        ArgumentCaptor<TradingOrder> captor = ArgumentCaptor.forClass(TradingOrder.class);
        verify(tradingOrderRepository).saveAndFlush(captor.capture());
        TradingOrder row = captor.getValue();
        assertThat(row.getOrderId()).isEqualTo("order_1_abc");
        assertThat(row.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(row.getSubmittedAt()).isEqualTo(confirmed.submittedAt());
        assertThat(row.getExecutionPrice()).isEqualByComparingTo("99.5");
        assertThat(row.getExecutionAmount()).isEqualByComparingTo("995");
        assertThat(row.getVenueOrderId()).isEqualTo("RAYDIUM");
        assertThat(row.getRoutingDecision()).isEqualTo(confirmed.routingDecision());
        assertThat(row.getSettlementReference()).isEqualTo("ref");
        assertThat(row.getAttemptCount()).isEqualTo(1);
    }

    @Test
    void archive_updatesExistingRowWithoutTouchingIdentity() {
        Instant originalSubmittedAt = Instant.parse("2024-12-31T23:59:00Z");
        TradingOrder existing = TradingOrder.builder()
                .orderId("order_1_abc")
                .tokenIn("SOL")
                .tokenOut("USDC")
                .amount(BigDecimal.TEN)
                .orderType(OrderType.MARKET)
                .status(OrderStatus.PENDING)
                .submittedAt(originalSubmittedAt)
                .build();
        when(tradingOrderRepository.findById("order_1_abc")).thenReturn(Optional.of(existing));

        store.archive(confirmedOrder());

        verify(tradingOrderRepository).saveAndFlush(existing);
        assertThat(existing.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(existing.getSubmittedAt()).isEqualTo(originalSubmittedAt);
        assertThat(existing.getCompletedAt()).isNotNull();
    }

    @Test
    void archive_databaseFailureSurfacesAsDurablePersistenceError() {
        when(tradingOrderRepository.findById("order_1_abc")).thenReturn(Optional.empty());
        when(tradingOrderRepository.saveAndFlush(any(TradingOrder.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> store.archive(confirmedOrder()))
                .isInstanceOfSatisfying(OrderPersistenceException.class, exception ->
                        assertThat(exception.getStore()).isEqualTo(OrderPersistenceException.Store.DURABLE));
    }

    @Test
    void findArchived_mapsRowBackToSnapshot() {
        TradingOrder row = TradingOrder.builder()
                .orderId("order_1_abc")
                .tokenIn("SOL")
                .tokenOut("USDC")
                .amount(BigDecimal.TEN)
                .orderType(OrderType.MARKET)
                .status(OrderStatus.FAILED)
                .failureReason("Failed after 3 attempts: timeout")
                .attemptCount(3)
                .submittedAt(Instant.now())
                .build();
        when(tradingOrderRepository.findById("order_1_abc")).thenReturn(Optional.of(row));

        OrderSnapshot snapshot = store.findArchived("order_1_abc").orElseThrow();

        assertThat(snapshot.status()).isEqualTo(OrderStatus.FAILED);
        assertThat(snapshot.failureReason()).isEqualTo("Failed after 3 attempts: timeout");
        assertThat(snapshot.attemptCount()).isEqualTo(3);
    }

    @Test
    void activeOrderIds_returnsEmptySetWhenRedisHasNone() {
        when(setOperations.members("orders:active")).thenReturn(null);

        Set<String> ids = store.activeOrderIds();

        assertThat(ids).isEmpty();
    }

    private OrderSnapshot pendingOrder() {
        return OrderSnapshot.builder()
                .orderId("order_1_abc")
                .tokenIn("SOL")
                .tokenOut("USDC")
                .amount(new BigDecimal("10"))
                .orderType(OrderType.MARKET)
                .status(OrderStatus.PENDING)
                .submittedAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    private OrderSnapshot confirmedOrder() {
        Quote quote = new Quote(Venue.RAYDIUM, new BigDecimal("100"), new BigDecimal("0.025"),
                new BigDecimal("99.75"), new BigDecimal("997.5"), new BigDecimal("2000000.00"));
        RoutingDecision decision = new RoutingDecision(Venue.RAYDIUM, List.of(quote), "only venue", Instant.now());
        return pendingOrder().merge(OrderStatus.CONFIRMED, OrderUpdate.builder()
                .routingDecision(decision)
                .venueOrderId("RAYDIUM")
                .executionPrice(new BigDecimal("99.5"))
                .executionAmount(new BigDecimal("995"))
                .settlementReference("ref")
                .attemptCount(1)
                .build(), Instant.now());
    }
}
