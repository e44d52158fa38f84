package com.purchasingpower.entityrevert.model.changeinfo;

/**
 * Structured description of what a commit changed, derived from its message.
 *
 * <p>Exactly two variants exist, told apart by {@link #getKind()}:
 * {@link UntrackedChangeInfo} and {@link CompositeChangeInfo}.
 */
public interface ChangeInfo {

    String ACTION_TRAILER = "VP-Action";

    ChangeInfoKind getKind();

    /**
     * Renders the full commit message, subject line plus trailers.
     */
    String getCommitMessage();
}
