package com.washdispatch.service;

import com.washdispatch.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationFanout {

    private final List<JobNotifier> notifiers;

    // never inside the job lock: only runs once the publishing transaction committed
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onJobNotification(JobNotification notification) {
        deliver(notification);
    }

    public void deliver(JobNotification notification) {
        for (JobNotifier notifier : notifiers) {
            try {
                notifier.notify(notification);
            } catch (RuntimeException e) {
                log.warn("Notifier {} failed for {}: {}",
                        notifier.getClass().getSimpleName(), notification, e.getMessage());
            }
        }
    }
}
