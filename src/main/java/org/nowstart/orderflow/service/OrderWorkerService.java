package org.nowstart.orderflow.service;

import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.AttemptResult;
import org.nowstart.orderflow.data.dto.OrderJob;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.dto.OrderUpdate;
import org.nowstart.orderflow.data.dto.QuoteSelection;
import org.nowstart.orderflow.data.dto.RoutingDecision;
import org.nowstart.orderflow.data.dto.SettlementReceipt;
import org.nowstart.orderflow.data.dto.StatusUpdate;
import org.nowstart.orderflow.data.dto.StatusUpdate.StatusData;
import org.nowstart.orderflow.data.dto.StepResult;
import org.nowstart.orderflow.data.exception.OrderProcessingException;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.nowstart.orderflow.service.venue.ExecutionSimulator;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderWorkerService {

    private final RoutingSelectorService routingSelectorService;
    private final ExecutionSimulator executionSimulator;
    private final OrderStateStore orderStateStore;
    private final OrderStatusBroadcaster orderStatusBroadcaster;
    private final OrderEngineProperties orderEngineProperties;

    public AttemptResult process(OrderJob job) {
        String orderId = job.orderId();
        int attempt = job.attemptNumber();
        AttemptProgress progress = new AttemptProgress(orderId, job.order().toBuilder()
                .status(OrderStatus.PENDING)
                .failedAt(null)
                .failureReason(null)
                .build());
        log.info("Order attempt started. orderId={}, attempt={}/{}", orderId, attempt, orderEngineProperties.maxAttempts());

        // Whole-snapshot write: the live copy may still carry the previous attempt's failure.
        OrderSnapshot routing = progress.snapshot().merge(OrderStatus.ROUTING,
                OrderUpdate.builder().attemptCount(attempt).build(), Instant.now());
        progress.advance(OrderStatus.ROUTING, routing);
        replaceQuietly(routing);
        publishQuietly(StatusUpdate.of(orderId, OrderStatus.ROUTING, "Fetching quotes from venues", null));
        OrderSnapshot order = progress.snapshot();
        StepResult<QuoteSelection> routed = StepResult.capture(() -> routingSelectorService
                .selectBest(order.tokenIn(), order.tokenOut(), order.amount())
                .join());
        if (!(routed instanceof StepResult.Ok<QuoteSelection> routedOk)) {
            return fail(job, progress, routed);
        }
        RoutingDecision decision = routingSelectorService.toDecision(routedOk.value());
        OrderUpdate routingUpdate = OrderUpdate.builder().routingDecision(decision).build();
        progress.attach(routingUpdate);
        persistQuietly(orderId, OrderStatus.ROUTING, routingUpdate);

        transition(progress, OrderStatus.BUILDING, routingUpdate,
                "Building transaction for " + decision.selectedVenue().getDisplayName(),
                StatusData.builder().routingDecision(decision).build());
        StepResult<Void> built = pause(orderEngineProperties.buildDelay());
        if (!(built instanceof StepResult.Ok<Void>)) {
            return fail(job, progress, built);
        }

        StepResult<SettlementReceipt> settled = StepResult.capture(() -> settle(decision, order));
        if (!(settled instanceof StepResult.Ok<SettlementReceipt> settledOk)) {
            return fail(job, progress, settled);
        }
        SettlementReceipt receipt = settledOk.value();
        transition(progress, OrderStatus.SUBMITTED,
                OrderUpdate.builder().settlementReference(receipt.settlementReference()).build(),
                "Transaction submitted to " + receipt.venue().getDisplayName(),
                StatusData.builder().settlementReference(receipt.settlementReference()).build());

        return confirm(job, progress, decision, receipt);
    }

    private SettlementReceipt settle(RoutingDecision decision, OrderSnapshot order) {
        SettlementReceipt receipt = executionSimulator.execute(decision.selectedQuote(), order.amount());
        if (!receipt.success()) {
            throw OrderProcessingException.permanent("Settlement rejected by " + decision.selectedVenue().getDisplayName());
        }
        return receipt;
    }

    private AttemptResult confirm(OrderJob job, AttemptProgress progress, RoutingDecision decision, SettlementReceipt receipt) {
        String orderId = job.orderId();
        OrderUpdate finalUpdate = OrderUpdate.builder()
                .routingDecision(decision)
                .settlementReference(receipt.settlementReference())
                .venueOrderId(receipt.venue().name())
                .executionPrice(receipt.realizedPrice())
                .executionAmount(receipt.realizedAmount())
                .attemptCount(job.attemptNumber())
                .completedAt(Instant.now())
                .build();
        OrderSnapshot confirmed = progress.snapshot().merge(OrderStatus.CONFIRMED, finalUpdate, Instant.now());

        StepResult<OrderSnapshot> archived = StepResult.capture(() -> {
            orderStateStore.archive(confirmed);
            return confirmed;
        });
        if (!(archived instanceof StepResult.Ok<OrderSnapshot>)) {
            return fail(job, progress, archived);
        }

        progress.advance(OrderStatus.CONFIRMED, confirmed);
        replaceQuietly(confirmed);
        publishQuietly(StatusUpdate.of(orderId, OrderStatus.CONFIRMED,
                "Order executed successfully on " + receipt.venue().getDisplayName(),
                StatusData.builder()
                        .settlementReference(receipt.settlementReference())
                        .executionPrice(receipt.realizedPrice())
                        .executionAmount(receipt.realizedAmount())
                        .build()));
        log.info("Order confirmed. orderId={}, venue={}, attempt={}, executionPrice={}, reference={}",
                orderId, receipt.venue().getDisplayName(), job.attemptNumber(), receipt.realizedPrice(),
                receipt.settlementReference());
        return AttemptResult.completed();
    }

    private AttemptResult fail(OrderJob job, AttemptProgress progress, StepResult<?> failure) {
        String orderId = job.orderId();
        int attempt = job.attemptNumber();
        int maxAttempts = orderEngineProperties.maxAttempts();
        boolean retryable = failure instanceof StepResult.Retryable<?>;
        String reason = reasonOf(failure);
        boolean willRetry = retryable && attempt < maxAttempts;

        String failureReason;
        String message;
        if (willRetry) {
            failureReason = "Attempt " + attempt + " failed: " + reason;
            message = "Order execution failed (attempt " + attempt + "/" + maxAttempts + "): " + reason + ". Retrying...";
        } else if (retryable) {
            failureReason = "Failed after " + attempt + " attempts: " + reason;
            message = "Order execution failed after " + attempt + " attempts: " + reason;
        } else {
            failureReason = "Attempt " + attempt + " failed: " + reason;
            message = "Order execution failed: " + reason;
        }

        OrderSnapshot failed = progress.snapshot().merge(OrderStatus.FAILED, OrderUpdate.builder()
                .failureReason(failureReason)
                .attemptCount(attempt)
                .build(), Instant.now());
        progress.advance(OrderStatus.FAILED, failed);

        if (willRetry) {
            log.warn("Order attempt failed. orderId={}, attempt={}/{}, reason={}", orderId, attempt, maxAttempts, reason);
            putQuietly(failed);
        } else {
            log.error("Order failed permanently. orderId={}, attempt={}/{}, reason={}", orderId, attempt, maxAttempts, reason);
            replaceQuietly(failed);
            archiveQuietly(failed);
        }

        publishQuietly(StatusUpdate.of(orderId, OrderStatus.FAILED, message, StatusData.builder()
                .failureReason(failureReason)
                .attemptNumber(attempt)
                .maxAttempts(maxAttempts)
                .willRetry(willRetry)
                .build()));
        return willRetry ? AttemptResult.retry(reason) : AttemptResult.failed(failureReason);
    }

    private void transition(AttemptProgress progress, OrderStatus next, OrderUpdate update, String message, StatusData data) {
        progress.advance(next, progress.snapshot().merge(next, update, Instant.now()));
        persistQuietly(progress.orderId(), next, update);
        publishQuietly(StatusUpdate.of(progress.orderId(), next, message, data));
    }

    private StepResult<Void> pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return new StepResult.Ok<>(null);
        }
        try {
            Thread.sleep(delay.toMillis());
            return new StepResult.Ok<>(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new StepResult.Retryable<>("Transaction build interrupted", e);
        }
    }

    private void persistQuietly(String orderId, OrderStatus status, OrderUpdate update) {
        try {
            orderStateStore.updateStatus(orderId, status, update);
        } catch (RuntimeException e) {
            log.warn("Failed to persist order status. orderId={}, status={}", orderId, status, e);
        }
    }

    private void putQuietly(OrderSnapshot order) {
        try {
            orderStateStore.put(order);
        } catch (RuntimeException e) {
            log.warn("Failed to persist interim failure. orderId={}", order.orderId(), e);
        }
    }

    private void replaceQuietly(OrderSnapshot order) {
        try {
            orderStateStore.replace(order);
        } catch (RuntimeException e) {
            log.warn("Failed to persist order snapshot. orderId={}, status={}", order.orderId(), order.status(), e);
        }
    }

    private void archiveQuietly(OrderSnapshot order) {
        try {
            orderStateStore.archive(order);
        } catch (RuntimeException e) {
            log.error("Failed to archive failed order. orderId={}", order.orderId(), e);
        }
    }

    private void publishQuietly(StatusUpdate update) {
        try {
            orderStatusBroadcaster.publish(update.orderId(), update);
        } catch (RuntimeException e) {
            log.warn("Failed to publish status update. orderId={}, status={}", update.orderId(), update.status(), e);
        }
    }

    private String reasonOf(StepResult<?> failure) {
        if (failure instanceof StepResult.Retryable<?> retryable) {
            return retryable.reason();
        }
        if (failure instanceof StepResult.Fatal<?> fatal) {
            return fatal.reason();
        }
        throw new IllegalArgumentException("Not a failure: " + failure);
    }

    private static final class AttemptProgress {

        private final String orderId;
        private OrderSnapshot snapshot;

        private AttemptProgress(String orderId, OrderSnapshot snapshot) {
            this.orderId = orderId;
            this.snapshot = snapshot;
        }

        private String orderId() {
            return orderId;
        }

        private OrderSnapshot snapshot() {
            return snapshot;
        }

        private void advance(OrderStatus next, OrderSnapshot nextSnapshot) {
            OrderStatus current = snapshot.status();
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal order transition " + current + " -> " + next + " for order " + orderId);
            }
            snapshot = nextSnapshot;
        }

        private void attach(OrderUpdate update) {
            snapshot = snapshot.merge(snapshot.status(), update, Instant.now());
        }
    }
}
