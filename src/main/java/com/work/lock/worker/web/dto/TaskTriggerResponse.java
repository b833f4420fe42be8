package com.work.lock.worker.web.dto;

/**
 * executed=false 表示锁被其他实例持有，本次触发被跳过。
 */
public class TaskTriggerResponse {

    private final String task;
    private final boolean executed;

    public TaskTriggerResponse(String task, boolean executed) {
        this.task = task;
        this.executed = executed;
    }

    public String getTask() {
        return task;
    }

    public boolean isExecuted() {
        return executed;
    }
}
