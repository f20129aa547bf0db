package com.washdispatch.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class JobUpdateWebSocketHandler extends TextWebSocketHandler {

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        if (registry.register(session)) {
            log.debug("WebSocket session {} connected", session.getId());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        SubscriptionMessage frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), SubscriptionMessage.class);
        } catch (JsonProcessingException e) {
            reply(session, error("Invalid message format"));
            return;
        }

        Set<String> keys = frame.keys();
        if ("subscribe".equals(frame.getType())) {
            registry.subscribe(session.getId(), keys);
            reply(session, ack("subscribed", keys));
        } else if ("unsubscribe".equals(frame.getType())) {
            registry.unsubscribe(session.getId(), keys);
            reply(session, ack("unsubscribed", keys));
        } else {
            reply(session, error("Unknown message type"));
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        registry.markAlive(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("WebSocket session {} transport error: {}", session.getId(), exception.getMessage());
        registry.remove(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.remove(session.getId());
    }

    private void reply(WebSocketSession session, Map<String, Object> body) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(body)));
    }

    private static Map<String, Object> ack(String type, Set<String> keys) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        body.put("keys", keys);
        return body;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "error");
        body.put("message", message);
        return body;
    }
}
