package com.purchasingpower.entityrevert.model;

/**
 * Enumeration of external collaborators for unified call logging.
 *
 * Used by ExternalCallLogger to tag calls to the Git work tree and
 * the relational mirror with consistent formatting.
 *
 * @see com.purchasingpower.entityrevert.util.ExternalCallLogger
 */
public enum ServiceType {
    GIT("🔷", "Git"),
    MIRROR_DB("🟠", "MirrorDB");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
