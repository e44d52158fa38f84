package com.purchasingpower.entityrevert.model.changeinfo;

/**
 * Discriminant of {@link ChangeInfo}.
 */
public enum ChangeInfoKind {

    /**
     * The commit carries no structured description. Treated as opaque and trusted.
     */
    UNTRACKED,

    /**
     * The commit lists the entities it touched.
     */
    TRACKED
}
