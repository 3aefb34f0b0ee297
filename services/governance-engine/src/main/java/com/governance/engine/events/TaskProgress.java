package com.governance.engine.events;

/**
 * Tracks one named task and reports start, updates and the final outcome with timings.
 */
public final class TaskProgress {

    private final GovernanceEvents events;
    private final String task;
    private final long startedAt;
    private long lastUpdate;

    private TaskProgress(GovernanceEvents events, String task) {
        this.events = events;
        this.task = task;
        this.startedAt = System.currentTimeMillis();
        this.lastUpdate = startedAt;
    }

    public static TaskProgress start(GovernanceEvents events, String task) {
        TaskProgress p = new TaskProgress(events, task);
        events.taskStarted(task);
        return p;
    }

    public void update(String message) {
        long now = System.currentTimeMillis();
        events.taskUpdated(task, message, now - lastUpdate);
        lastUpdate = now;
    }

    public void complete(String message) {
        events.taskCompleted(task, message, System.currentTimeMillis() - startedAt);
    }

    public void fail(String error) {
        events.taskFailed(task, error, System.currentTimeMillis() - startedAt);
    }
}
