package org.nowstart.orderflow.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.nowstart.orderflow.data.dto.RoutingDecision;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.nowstart.orderflow.data.type.OrderType;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_status", columnList = "status"),
        @Index(name = "idx_orders_submitted_at", columnList = "submitted_at"),
        @Index(name = "idx_orders_settlement_reference", columnList = "settlement_reference")
})
public class TradingOrder {

    @Id
    @Column(length = 64)
    private String orderId;

    @Column(nullable = false, length = 50)
    private String tokenIn;

    @Column(nullable = false, length = 50)
    private String tokenOut;

    @Column(nullable = false, precision = 38, scale = 12)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(nullable = false, updatable = false)
    private Instant submittedAt;

    private Instant completedAt;

    private Instant failedAt;

    @Column(length = 2000)
    private String failureReason;

    @Column(length = 50)
    private String venueOrderId;

    @Column(precision = 38, scale = 12)
    private BigDecimal executionPrice;

    @Column(precision = 38, scale = 12)
    private BigDecimal executionAmount;

    @JdbcTypeCode(SqlTypes.JSON)
    private RoutingDecision routingDecision;

    private String settlementReference;

    private Integer attemptCount;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
