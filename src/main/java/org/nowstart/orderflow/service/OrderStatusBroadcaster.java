package org.nowstart.orderflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.StatusUpdate;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStatusBroadcaster {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscriptionsByOrder = new ConcurrentHashMap<>();

    public String subscribe(WebSocketSession channel, String orderId) {
        String subscriptionId = "conn_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(channel, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        subscriptions.put(subscriptionId, new Subscription(subscriptionId, orderId, decorated, Instant.now()));
        subscriptionsByOrder.compute(orderId, (key, ids) -> {
            Set<String> target = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            target.add(subscriptionId);
            return target;
        });
        log.info("Status subscriber connected. orderId={}, subscriptionId={}, subscribers={}",
                orderId, subscriptionId, subscriberCount(orderId));
        return subscriptionId;
    }

    public void publish(String orderId, StatusUpdate event) {
        Set<String> ids = subscriptionsByOrder.get(orderId);
        if (ids == null || ids.isEmpty()) {
            log.debug("No status subscribers. orderId={}, status={}", orderId, event.status());
            return;
        }

        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize status update. orderId={}, status={}", orderId, event.status(), e);
            return;
        }

        int delivered = 0;
        for (String subscriptionId : List.copyOf(ids)) {
            if (deliver(subscriptionId, message)) {
                delivered++;
            }
        }
        log.debug("Status update published. orderId={}, status={}, delivered={}", orderId, event.status(), delivered);
    }

    public boolean send(String subscriptionId, Object frame) {
        try {
            return deliver(subscriptionId, new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize frame. subscriptionId={}", subscriptionId, e);
            return false;
        }
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptions.remove(subscriptionId);
        if (subscription == null) {
            return;
        }
        subscriptionsByOrder.computeIfPresent(subscription.orderId(), (key, ids) -> {
            ids.remove(subscriptionId);
            return ids.isEmpty() ? null : ids;
        });
        log.info("Status subscriber disconnected. orderId={}, subscriptionId={}", subscription.orderId(), subscriptionId);
    }

    public void closeOrder(String orderId) {
        Set<String> ids = subscriptionsByOrder.remove(orderId);
        if (ids == null) {
            return;
        }
        for (String subscriptionId : List.copyOf(ids)) {
            Subscription subscription = subscriptions.remove(subscriptionId);
            if (subscription != null) {
                close(subscription, CloseStatus.NORMAL);
            }
        }
        log.info("Status subscribers closed for order. orderId={}, closed={}", orderId, ids.size());
    }

    @PreDestroy
    public void closeAll() {
        int total = subscriptions.size();
        for (Subscription subscription : List.copyOf(subscriptions.values())) {
            close(subscription, CloseStatus.GOING_AWAY);
        }
        subscriptions.clear();
        subscriptionsByOrder.clear();
        log.info("event=status_broadcaster_closed subscriptions={}", total);
    }

    public int subscriberCount(String orderId) {
        Set<String> ids = subscriptionsByOrder.get(orderId);
        return ids == null ? 0 : ids.size();
    }

    public int totalSubscriptions() {
        return subscriptions.size();
    }

    private boolean deliver(String subscriptionId, TextMessage message) {
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            return false;
        }
        if (!subscription.channel().isOpen()) {
            unsubscribe(subscriptionId);
            return false;
        }
        try {
            subscription.channel().sendMessage(message);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Dropping status subscriber after send failure. orderId={}, subscriptionId={}",
                    subscription.orderId(), subscriptionId, e);
            unsubscribe(subscriptionId);
            return false;
        }
    }

    private void close(Subscription subscription, CloseStatus status) {
        try {
            subscription.channel().close(status);
        } catch (IOException e) {
            log.debug("Status subscriber already gone on close. subscriptionId={}", subscription.id(), e);
        }
    }

    public record Subscription(
            String id,
            String orderId,
            WebSocketSession channel,
            Instant connectedAt
    ) {
    }
}
