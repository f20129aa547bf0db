package com.washdispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch.duty-timeout", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleDutySweepScheduler {

    private final StaleDutySweeper staleDutySweeper;

    @Scheduled(fixedDelayString = "${dispatch.duty-timeout.sweep-interval-ms:60000}",
            initialDelayString = "${dispatch.duty-timeout.sweep-interval-ms:60000}")
    public void runSweep() {
        staleDutySweeper.sweep();
    }
}
