package com.autonomous.approval.service;

public interface ReminderHandle {

    void cancel();

    boolean isCancelled();
}
