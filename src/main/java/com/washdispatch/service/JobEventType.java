package com.washdispatch.service;

public enum JobEventType {
    JOB_PAID,
    JOB_AVAILABLE,          // targeted at eligible cleaners only
    JOB_ASSIGNED,
    JOB_STARTED,
    JOB_COMPLETED,
    JOB_CANCELLED,
    JOB_REFUNDED,
    JOB_REFUNDED_UNATTENDED
}
