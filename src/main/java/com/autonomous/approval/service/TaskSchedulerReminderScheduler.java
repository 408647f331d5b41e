package com.autonomous.approval.service;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link ReminderScheduler} backed by Spring's {@link TaskScheduler}.
 */
@Component
public class TaskSchedulerReminderScheduler implements ReminderScheduler {

    private final TaskScheduler taskScheduler;

    public TaskSchedulerReminderScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public ReminderHandle schedule(Runnable task, Instant at) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, at);
        return new ReminderHandle() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }
}
