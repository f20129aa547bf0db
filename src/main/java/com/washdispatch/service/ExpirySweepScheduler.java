package com.washdispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch.expiry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweepScheduler {

    private final ExpirySweeper expirySweeper;

    @Scheduled(fixedDelayString = "${dispatch.expiry.sweep-interval-ms:60000}",
            initialDelayString = "${dispatch.expiry.sweep-interval-ms:60000}")
    public void runSweep() {
        expirySweeper.sweep();
    }
}
