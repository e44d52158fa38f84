package com.purchasingpower.entityrevert.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validates commit references that arrive from callers before they reach JGit.
 *
 * Only plain hexadecimal object ids are accepted. Revision expressions such as
 * {@code HEAD~3}, {@code main@{1}} or {@code ^!} are rejected so that a revert
 * always targets exactly one, explicitly named commit.
 */
@Slf4j
public final class GitInputValidator {

    private static final Pattern COMMIT_HASH = Pattern.compile("^[0-9a-fA-F]{4,40}$");

    private GitInputValidator() {
    }

    /**
     * Validates an abbreviated or full commit hash.
     *
     * @param commitHash hash supplied by the caller
     * @throws IllegalArgumentException if the hash is blank or not 4-40 hex characters
     */
    public static void validateCommitHash(String commitHash) {
        if (commitHash == null || commitHash.isBlank()) {
            throw new IllegalArgumentException("Commit hash cannot be null or blank");
        }

        if (!COMMIT_HASH.matcher(commitHash).matches()) {
            log.warn("Rejected commit reference: {}", sanitizeForLogging(commitHash));
            throw new IllegalArgumentException(
                    "Invalid commit hash. Expected 4-40 hexadecimal characters, received: "
                            + sanitizeForLogging(commitHash));
        }
    }

    /**
     * Sanitizes user input for safe logging (removes control characters, truncates).
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input.replaceAll("[\\p{Cntrl}]", "?");
        if (sanitized.length() > 60) {
            sanitized = sanitized.substring(0, 60) + "...";
        }
        return sanitized;
    }
}
