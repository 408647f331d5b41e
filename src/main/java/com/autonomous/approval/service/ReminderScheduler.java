package com.autonomous.approval.service;

import java.time.Instant;

/**
 * Schedules one-shot reminder tasks. Implementations must make
 * {@link ReminderHandle#cancel()} idempotent.
 */
public interface ReminderScheduler {

    ReminderHandle schedule(Runnable task, Instant at);
}
