package com.purchasingpower.entityrevert.model.changeinfo;

/**
 * One entry of a {@link CompositeChangeInfo}, serialized as a single {@code VP-Action} trailer.
 */
public interface TrackedChangeInfo {

    /**
     * Scope, action and ids joined by {@code /}, e.g. {@code post/edit/ab12cd34}.
     */
    String getActionTag();

    /**
     * Human readable line used as commit subject when this entry comes first.
     */
    String getDescription();
}
