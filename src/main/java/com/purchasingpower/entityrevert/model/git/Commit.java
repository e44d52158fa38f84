package com.purchasingpower.entityrevert.model.git;

import java.time.Instant;

/**
 * A commit read from the versioned entity store.
 */
public record Commit(
        String hash,
        String shortMessage,
        String message,
        String authorName,
        String authorEmail,
        Instant date
) {
}
