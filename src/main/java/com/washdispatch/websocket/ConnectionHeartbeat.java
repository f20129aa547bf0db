package com.washdispatch.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionHeartbeat {

    private final ConnectionRegistry registry;

    @Scheduled(fixedDelayString = "${app.websocket.ping-interval-ms:30000}",
            initialDelayString = "${app.websocket.ping-interval-ms:30000}")
    public void ping() {
        int dropped = registry.pingAll();
        if (dropped > 0) {
            log.info("Heartbeat dropped {} dead websocket session(s), {} open", dropped, registry.size());
        }
    }
}
