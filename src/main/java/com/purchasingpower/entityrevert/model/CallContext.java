package com.purchasingpower.entityrevert.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One bracketed write against the entity store's Git work tree or the mirror
 * database: a speculative revert or a revert-all in {@code JGitRepository}, a
 * table synchronization or a post date stamp in the JDBC mirror classes.
 *
 * Start and end lines go out at debug with an eight-character call id and the
 * elapsed time; key/value details at trace. Failures are logged at error, with
 * the stack trace only at debug since the caller rethrows it.
 *
 * @see com.purchasingpower.entityrevert.util.ExternalCallLogger
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.debug("{} {} → {} [{}] {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                summary == null ? "" : summary);
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.debug("{} {} ← {} [{}] ({}ms) {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                summary == null ? "" : summary);
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.trace("  {}: {}", details[i], details[i + 1]);
        }
    }
}
