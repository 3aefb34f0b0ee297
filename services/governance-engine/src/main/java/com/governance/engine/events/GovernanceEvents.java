package com.governance.engine.events;

import com.governance.engine.model.Severity;

import java.util.Map;

/**
 * Receives semantic progress and result events. Components never format console
 * output themselves; they report here.
 */
public interface GovernanceEvents {

    void taskStarted(String task);

    void taskUpdated(String task, String message, long elapsedMillis);

    void taskCompleted(String task, String message, long totalMillis);

    void taskFailed(String task, String error, long totalMillis);

    /**
     * @param counts findings per severity; severities without findings may be absent
     */
    void summary(String title, int total, Map<Severity, Integer> counts);

    void notice(String message);

    void warning(String message);
}
