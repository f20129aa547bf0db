package com.washdispatch.websocket;

import com.washdispatch.dto.JobView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live WebSocket sessions and the subscription keys each one listens on
 * ({@code job:<id>}, {@code customer:<id>}, {@code cleaner:<id>}, {@code company:<id>}).
 */
@Slf4j
@Component
public class ConnectionRegistry implements SmartLifecycle {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private volatile boolean running;

    public static String jobKey(Long id) { return "job:" + id; }
    public static String customerKey(Long id) { return "customer:" + id; }
    public static String cleanerKey(Long id) { return "cleaner:" + id; }
    public static String companyKey(Long id) { return "company:" + id; }

    /** Every key a subscriber could use to follow this job. */
    public static Set<String> keysFor(JobView job) {
        Set<String> keys = new LinkedHashSet<>();
        if (job.getId() != null) keys.add(jobKey(job.getId()));
        if (job.getCustomerId() != null) keys.add(customerKey(job.getCustomerId()));
        if (job.getCleanerId() != null) keys.add(cleanerKey(job.getCleanerId()));
        if (job.getCompanyId() != null) keys.add(companyKey(job.getCompanyId()));
        return keys;
    }

    public boolean register(WebSocketSession session) {
        if (!running) {
            closeQuietly(session, CloseStatus.SERVICE_RESTARTED);
            return false;
        }
        connections.put(session.getId(), new Connection(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT)));
        return true;
    }

    public void subscribe(String sessionId, Collection<String> keys) {
        Connection connection = connections.get(sessionId);
        if (connection != null) {
            connection.keys.addAll(keys);
        }
    }

    public void unsubscribe(String sessionId, Collection<String> keys) {
        Connection connection = connections.get(sessionId);
        if (connection != null) {
            connection.keys.removeAll(keys);
        }
    }

    public void remove(String sessionId) {
        connections.remove(sessionId);
    }

    public Set<String> subscriptionsOf(String sessionId) {
        Connection connection = connections.get(sessionId);
        return connection == null ? Set.of() : Set.copyOf(connection.keys);
    }

    public int size() {
        return connections.size();
    }

    /**
     * Sends the payload once to every open session subscribed to at least one of the keys.
     *
     * @return number of sessions the payload was handed to
     */
    public int broadcast(Collection<String> keys, String payload) {
        if (keys.isEmpty()) {
            return 0;
        }
        TextMessage message = new TextMessage(payload);
        int delivered = 0;
        for (Map.Entry<String, Connection> entry : connections.entrySet()) {
            Connection connection = entry.getValue();
            if (!connection.matchesAny(keys)) {
                continue;
            }
            WebSocketSession session = connection.session;
            if (!session.isOpen()) {
                connections.remove(entry.getKey());
                continue;
            }
            try {
                session.sendMessage(message);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping websocket session {}: {}", entry.getKey(), e.getMessage());
                connections.remove(entry.getKey());
                closeQuietly(session, CloseStatus.SESSION_NOT_RELIABLE);
            }
        }
        return delivered;
    }

    /** A pong arrived, the session answered the last ping. */
    public void markAlive(String sessionId) {
        Connection connection = connections.get(sessionId);
        if (connection != null) {
            connection.alive = true;
        }
    }

    /**
     * Heartbeat round. Sessions that did not answer the previous ping, are closed or fail the send
     * are dropped; every other session gets a new ping.
     *
     * @return number of sessions dropped
     */
    public int pingAll() {
        int dropped = 0;
        for (Map.Entry<String, Connection> entry : connections.entrySet()) {
            Connection connection = entry.getValue();
            WebSocketSession session = connection.session;
            if (!session.isOpen() || !connection.alive) {
                log.debug("WebSocket session {} stopped answering, dropping it", entry.getKey());
                connections.remove(entry.getKey());
                closeQuietly(session, CloseStatus.SESSION_NOT_RELIABLE);
                dropped++;
                continue;
            }
            connection.alive = false;
            try {
                session.sendMessage(new PingMessage());
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping websocket session {}: {}", entry.getKey(), e.getMessage());
                connections.remove(entry.getKey());
                closeQuietly(session, CloseStatus.SESSION_NOT_RELIABLE);
                dropped++;
            }
        }
        return dropped;
    }

    @Override
    public void start() {
        running = true;
        log.debug("WebSocket connection registry started");
    }

    @Override
    public void stop() {
        running = false;
        List<Connection> open = new ArrayList<>(connections.values());
        connections.clear();
        open.forEach(c -> closeQuietly(c.session, CloseStatus.GOING_AWAY));
        log.debug("WebSocket connection registry stopped, {} session(s) closed", open.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.debug("Closing websocket session {} failed: {}", session.getId(), e.getMessage());
        }
    }

    private static final class Connection {
        private final WebSocketSession session;
        private final Set<String> keys = ConcurrentHashMap.newKeySet();
        private volatile boolean alive = true;

        private Connection(WebSocketSession session) {
            this.session = session;
        }

        private boolean matchesAny(Collection<String> candidates) {
            for (String key : candidates) {
                if (keys.contains(key)) {
                    return true;
                }
            }
            return false;
        }
    }
}
