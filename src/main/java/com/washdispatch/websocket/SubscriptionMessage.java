package com.washdispatch.websocket;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Client frame: {"type":"subscribe"|"unsubscribe", "jobId"?, "customerId"?, "cleanerId"?, "companyId"?}
 */
@Getter
@Setter
public class SubscriptionMessage {
    private String type;
    private Long jobId;
    private Long customerId;
    private Long cleanerId;
    private Long companyId;

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        if (jobId != null) keys.add(ConnectionRegistry.jobKey(jobId));
        if (customerId != null) keys.add(ConnectionRegistry.customerKey(customerId));
        if (cleanerId != null) keys.add(ConnectionRegistry.cleanerKey(cleanerId));
        if (companyId != null) keys.add(ConnectionRegistry.companyKey(companyId));
        return keys;
    }
}
