package com.washdispatch.service;

/**
 * A delivery channel for job events. Implementations may throw; the fan-out logs and moves on.
 */
public interface JobNotifier {

    void notify(JobNotification notification);
}
