package org.nowstart.orderflow.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.StreamFrame;
import org.nowstart.orderflow.service.OrderStatusBroadcaster;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriTemplate;

@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusWebSocketHandler extends TextWebSocketHandler {

    static final String SUBSCRIPTION_ID_ATTRIBUTE = "subscriptionId";
    private static final UriTemplate STATUS_PATH = new UriTemplate("/api/orders/{orderId}/status");

    private final OrderStatusBroadcaster orderStatusBroadcaster;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String orderId = orderIdOf(session.getUri());
        if (orderId == null) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Order ID is required"));
            return;
        }
        String subscriptionId = orderStatusBroadcaster.subscribe(session, orderId);
        session.getAttributes().put(SUBSCRIPTION_ID_ATTRIBUTE, subscriptionId);
        orderStatusBroadcaster.send(subscriptionId, StreamFrame.connected(orderId));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String subscriptionId = subscriptionIdOf(session);
        if (subscriptionId == null) {
            return;
        }
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed frame. subscriptionId={}", subscriptionId);
            return;
        }
        if (frame != null && "ping".equals(frame.path("type").asText(null))) {
            orderStatusBroadcaster.send(subscriptionId, StreamFrame.pong());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Status stream transport error. sessionId={}", session.getId(), exception);
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    String orderIdOf(URI uri) {
        if (uri == null || !STATUS_PATH.matches(uri.getPath())) {
            return null;
        }
        String orderId = STATUS_PATH.match(uri.getPath()).get("orderId");
        return orderId == null || orderId.isBlank() ? null : orderId;
    }

    private void release(WebSocketSession session) {
        String subscriptionId = subscriptionIdOf(session);
        if (subscriptionId != null) {
            orderStatusBroadcaster.unsubscribe(subscriptionId);
        }
    }

    private String subscriptionIdOf(WebSocketSession session) {
        Map<String, Object> attributes = session.getAttributes();
        Object value = attributes.get(SUBSCRIPTION_ID_ATTRIBUTE);
        return value instanceof String id ? id : null;
    }
}
