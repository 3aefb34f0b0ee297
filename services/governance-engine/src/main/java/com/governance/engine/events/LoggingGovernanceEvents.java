package com.governance.engine.events;

import com.governance.engine.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class LoggingGovernanceEvents implements GovernanceEvents {

    private static final Logger log = LoggerFactory.getLogger("com.governance.engine.events");

    @Override
    public void taskStarted(String task) {
        log.info("Started: {}", task);
    }

    @Override
    public void taskUpdated(String task, String message, long elapsedMillis) {
        log.debug("{}: {} (+{}ms)", task, message, elapsedMillis);
    }

    @Override
    public void taskCompleted(String task, String message, long totalMillis) {
        log.info("{} {} ({}ms total)", task, message, totalMillis);
    }

    @Override
    public void taskFailed(String task, String error, long totalMillis) {
        log.error("{} failed: {} ({}ms total)", task, LogSanitizer.sanitize(error), totalMillis);
    }

    @Override
    public void summary(String title, int total, Map<Severity, Integer> counts) {
        log.info("{}: {} findings", title, total);
        for (Severity s : Severity.values()) {
            int n = counts.getOrDefault(s, 0);
            if (n == 0) {
                continue;
            }
            switch (s) {
                case CRITICAL:
                    log.error("  {}: {}", s, n);
                    break;
                case HIGH:
                    log.warn("  {}: {}", s, n);
                    break;
                default:
                    log.info("  {}: {}", s, n);
            }
        }
    }

    @Override
    public void notice(String message) {
        log.info(LogSanitizer.sanitize(message));
    }

    @Override
    public void warning(String message) {
        log.warn(LogSanitizer.sanitize(message));
    }
}
