package com.purchasingpower.entityrevert.util;

import com.purchasingpower.entityrevert.model.CallContext;
import com.purchasingpower.entityrevert.model.ServiceType;
import org.slf4j.Logger;

import java.util.Collection;

/**
 * Unified logging utility for calls to the Git work tree and the relational mirror.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Abbreviate a commit hash for log lines.
     */
    public static String shortHash(String hash) {
        if (hash == null) {
            return "(null)";
        }
        return hash.length() <= 8 ? hash : hash.substring(0, 8);
    }

    /**
     * Format a collection for logging without dumping hundreds of paths.
     */
    public static String formatCollection(Collection<?> items) {
        if (items == null || items.isEmpty()) {
            return "[]";
        }
        if (items.size() <= 5) {
            return items.toString();
        }
        return "[" + items.size() + " items]";
    }
}
