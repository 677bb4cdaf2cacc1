package org.nowstart.orderflow.service;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.OrderJob;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.nowstart.orderflow.data.type.OrderStatus;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderRecoveryService {

    private final OrderStateStore orderStateStore;
    private final OrderJobQueue orderJobQueue;
    private final OrderEngineProperties orderEngineProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!orderEngineProperties.recoverActiveOrders()) {
            log.info("event=order_recovery_skipped reason=disabled");
            return;
        }
        try {
            recover();
        } catch (RuntimeException e) {
            log.error("event=order_recovery_failed", e);
        }
    }

    public int recover() {
        int requeued = 0;
        int dropped = 0;
        for (String orderId : orderStateStore.activeOrderIds()) {
            Optional<OrderJob> job = orderStateStore.get(orderId).flatMap(this::resumeJob);
            if (job.isEmpty()) {
                orderStateStore.removeFromActive(orderId);
                dropped++;
                continue;
            }
            if (orderJobQueue.enqueue(job.get())) {
                requeued++;
            }
        }
        log.info("event=order_recovery_completed requeued={} dropped={}", requeued, dropped);
        return requeued;
    }

    Optional<OrderJob> resumeJob(OrderSnapshot snapshot) {
        int attemptCount = snapshot.attemptCount() == null ? 0 : snapshot.attemptCount();
        int attemptsMade;
        if (snapshot.status() == OrderStatus.FAILED) {
            if (attemptCount >= orderEngineProperties.maxAttempts()) {
                return Optional.empty();
            }
            attemptsMade = attemptCount;
        } else if (snapshot.status().isTerminal()) {
            return Optional.empty();
        } else {
            attemptsMade = Math.max(attemptCount - 1, 0);
        }

        OrderSnapshot restart = snapshot.toBuilder()
                .status(OrderStatus.PENDING)
                .failedAt(null)
                .failureReason(null)
                .build();
        return Optional.of(new OrderJob(snapshot.orderId(), restart, attemptsMade));
    }
}
