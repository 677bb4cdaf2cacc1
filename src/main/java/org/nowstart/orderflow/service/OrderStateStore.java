package org.nowstart.orderflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.dto.OrderUpdate;
import org.nowstart.orderflow.data.entity.TradingOrder;
import org.nowstart.orderflow.data.exception.OrderPersistenceException;
import org.nowstart.orderflow.data.exception.OrderPersistenceException.Store;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.nowstart.orderflow.repository.TradingOrderRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStateStore {

    static final String ORDER_KEY_PREFIX = "order:";
    static final String ACTIVE_ORDERS_KEY = "orders:active";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TradingOrderRepository tradingOrderRepository;
    private final OrderEngineProperties orderEngineProperties;

    // Keeps the order in the active index whatever its status.
    public void put(OrderSnapshot order) {
        write(order);
        try {
            redisTemplate.opsForSet().add(ACTIVE_ORDERS_KEY, order.orderId());
        } catch (DataAccessException e) {
            throw ephemeral("Failed to index active order " + order.orderId(), e);
        }
    }

    public Optional<OrderSnapshot> updateStatus(String orderId, OrderStatus status, OrderUpdate update) {
        Optional<OrderSnapshot> current = get(orderId);
        if (current.isEmpty()) {
            log.warn("Order snapshot missing on status update. orderId={}, status={}", orderId, status);
            return Optional.empty();
        }

        OrderSnapshot merged = current.get().merge(status, update, Instant.now());
        replace(merged);
        return Optional.of(merged);
    }

    // Terminal statuses leave the active index.
    public void replace(OrderSnapshot order) {
        write(order);
        try {
            if (order.status().isTerminal()) {
                redisTemplate.opsForSet().remove(ACTIVE_ORDERS_KEY, order.orderId());
            } else {
                redisTemplate.opsForSet().add(ACTIVE_ORDERS_KEY, order.orderId());
            }
        } catch (DataAccessException e) {
            throw ephemeral("Failed to update active index for order " + order.orderId(), e);
        }
    }

    public Optional<OrderSnapshot> get(String orderId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(ORDER_KEY_PREFIX + orderId);
        } catch (DataAccessException e) {
            throw ephemeral("Failed to read order " + orderId, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, OrderSnapshot.class));
        } catch (JsonProcessingException e) {
            throw ephemeral("Corrupt snapshot for order " + orderId, e);
        }
    }

    public Set<String> activeOrderIds() {
        try {
            Set<String> members = redisTemplate.opsForSet().members(ACTIVE_ORDERS_KEY);
            return members == null ? Set.of() : members;
        } catch (DataAccessException e) {
            throw ephemeral("Failed to read active order index", e);
        }
    }

    public void removeFromActive(String orderId) {
        try {
            redisTemplate.opsForSet().remove(ACTIVE_ORDERS_KEY, orderId);
        } catch (DataAccessException e) {
            throw ephemeral("Failed to drop order " + orderId + " from active index", e);
        }
    }

    @Transactional
    public void archive(OrderSnapshot order) {
        try {
            TradingOrder row = tradingOrderRepository.findById(order.orderId())
                    .orElseGet(() -> TradingOrder.builder()
                            .orderId(order.orderId())
                            .tokenIn(order.tokenIn())
                            .tokenOut(order.tokenOut())
                            .amount(order.amount())
                            .orderType(order.orderType())
                            .submittedAt(order.submittedAt())
                            .build());

            row.setStatus(order.status());
            row.setCompletedAt(order.completedAt());
            row.setFailedAt(order.failedAt());
            row.setFailureReason(order.failureReason());
            row.setVenueOrderId(order.venueOrderId());
            row.setExecutionPrice(order.executionPrice());
            row.setExecutionAmount(order.executionAmount());
            row.setRoutingDecision(order.routingDecision());
            row.setSettlementReference(order.settlementReference());
            row.setAttemptCount(order.attemptCount());
            tradingOrderRepository.saveAndFlush(row);
        } catch (DataAccessException e) {
            throw new OrderPersistenceException(Store.DURABLE, "Failed to archive order " + order.orderId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<OrderSnapshot> findArchived(String orderId) {
        try {
            return tradingOrderRepository.findById(orderId).map(this::toSnapshot);
        } catch (DataAccessException e) {
            throw new OrderPersistenceException(Store.DURABLE, "Failed to read archived order " + orderId, e);
        }
    }

    private void write(OrderSnapshot order) {
        String json;
        try {
            json = objectMapper.writeValueAsString(order);
        } catch (JsonProcessingException e) {
            throw ephemeral("Failed to serialize order " + order.orderId(), e);
        }
        try {
            redisTemplate.opsForValue().set(ORDER_KEY_PREFIX + order.orderId(), json, orderEngineProperties.snapshotTtl());
        } catch (DataAccessException e) {
            throw ephemeral("Failed to write order " + order.orderId(), e);
        }
    }

    private OrderSnapshot toSnapshot(TradingOrder row) {
        return OrderSnapshot.builder()
                .orderId(row.getOrderId())
                .tokenIn(row.getTokenIn())
                .tokenOut(row.getTokenOut())
                .amount(row.getAmount())
                .orderType(row.getOrderType())
                .status(row.getStatus())
                .submittedAt(row.getSubmittedAt())
                .completedAt(row.getCompletedAt())
                .failedAt(row.getFailedAt())
                .failureReason(row.getFailureReason())
                .venueOrderId(row.getVenueOrderId())
                .executionPrice(row.getExecutionPrice())
                .executionAmount(row.getExecutionAmount())
                .routingDecision(row.getRoutingDecision())
                .settlementReference(row.getSettlementReference())
                .attemptCount(row.getAttemptCount())
                .build();
    }

    private OrderPersistenceException ephemeral(String message, Exception cause) {
        return new OrderPersistenceException(Store.EPHEMERAL, message, cause);
    }
}
