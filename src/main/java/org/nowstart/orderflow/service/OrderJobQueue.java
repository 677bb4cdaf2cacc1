package org.nowstart.orderflow.service;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.AttemptResult;
import org.nowstart.orderflow.data.dto.OrderJob;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderJobQueue {

    private static final long POLL_TIMEOUT_MS = 500;

    private final OrderWorkerService orderWorkerService;
    private final RateLimiter orderRateLimiter;
    private final IntervalFunction orderRetryBackoff;
    private final OrderEngineProperties orderEngineProperties;

    private final BlockingQueue<OrderJob> pending = new LinkedBlockingQueue<>();
    private final Set<String> trackedOrderIds = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private ExecutorService consumers;
    private ScheduledExecutorService retryScheduler;

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        int concurrency = orderEngineProperties.workerConcurrency();
        consumers = Executors.newFixedThreadPool(concurrency, namedThreads("order-worker-"));
        retryScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("order-retry-"));
        for (int i = 0; i < concurrency; i++) {
            consumers.submit(this::consume);
        }
        log.info("event=order_queue_started concurrency={} rateLimitPerMinute={} maxAttempts={}",
                concurrency, orderEngineProperties.rateLimitPerMinute(), orderEngineProperties.maxAttempts());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        retryScheduler.shutdownNow();
        consumers.shutdownNow();
        try {
            if (!consumers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("event=order_queue_stop_timeout inFlight={}", trackedOrderIds.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("event=order_queue_stopped dropped={}", pending.size());
    }

    public boolean enqueue(OrderJob job) {
        if (!trackedOrderIds.add(job.orderId())) {
            log.warn("Order already in flight, enqueue refused. orderId={}", job.orderId());
            return false;
        }
        pending.add(job);
        log.info("Order queued. orderId={}, attempt={}, queued={}", job.orderId(), job.attemptNumber(), pending.size());
        return true;
    }

    public boolean isTracked(String orderId) {
        return trackedOrderIds.contains(orderId);
    }

    public int queuedCount() {
        return pending.size();
    }

    long backoffFor(int attemptsMade) {
        return orderRetryBackoff.apply(Math.max(attemptsMade, 1));
    }

    private void consume() {
        while (running && !Thread.currentThread().isInterrupted()) {
            OrderJob job;
            try {
                job = pending.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job == null) {
                continue;
            }
            if (!awaitPermit()) {
                pending.add(job);
                return;
            }
            runAttempt(job);
        }
    }

    private boolean awaitPermit() {
        while (running && !Thread.currentThread().isInterrupted()) {
            if (orderRateLimiter.acquirePermission()) {
                return true;
            }
            log.debug("event=order_rate_limited waiting for permit");
        }
        return false;
    }

    void runAttempt(OrderJob job) {
        AttemptResult result;
        try {
            result = orderWorkerService.process(job);
        } catch (RuntimeException e) {
            log.error("Order attempt crashed. orderId={}, attempt={}", job.orderId(), job.attemptNumber(), e);
            result = AttemptResult.failed(e.getMessage());
        }

        if (result.outcome() != AttemptResult.Outcome.RETRY) {
            trackedOrderIds.remove(job.orderId());
            return;
        }

        OrderJob next = job.nextAttempt();
        long delayMs = backoffFor(next.attemptsMade());
        log.info("Order retry scheduled. orderId={}, nextAttempt={}, delayMs={}", job.orderId(), next.attemptNumber(), delayMs);
        try {
            retryScheduler.schedule(() -> pending.offer(next), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Retry not scheduled, queue is stopping. orderId={}", job.orderId(), e);
            trackedOrderIds.remove(job.orderId());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
