package com.washdispatch.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.washdispatch.service.JobEventType;
import com.washdispatch.service.JobNotification;
import com.washdispatch.service.JobNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pushes job updates to subscribed sessions. New pool jobs go only to the cleaners chosen by dispatch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketJobNotifier implements JobNotifier {

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    @Override
    public void notify(JobNotification notification) {
        Collection<String> keys;
        String type;
        if (notification.getEvent() == JobEventType.JOB_AVAILABLE) {
            keys = notification.getRecipientCleanerIds().stream().map(ConnectionRegistry::cleanerKey).toList();
            type = "job_available";
        } else {
            keys = ConnectionRegistry.keysFor(notification.getJob());
            type = "job_update";
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        body.put("event", notification.getEvent().name().toLowerCase(Locale.ROOT));
        body.put("job", notification.getJob());

        int delivered = registry.broadcast(keys, toJson(body));
        log.debug("{} for job {} pushed to {} session(s)", type, notification.getJob().getId(), delivered);
    }

    private String toJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job update could not be serialized", e);
        }
    }
}
