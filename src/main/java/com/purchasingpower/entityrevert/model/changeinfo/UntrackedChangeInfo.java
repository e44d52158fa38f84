package com.purchasingpower.entityrevert.model.changeinfo;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A commit made outside of the entity store's tooling, e.g. a manual edit.
 */
@ToString
@EqualsAndHashCode
public final class UntrackedChangeInfo implements ChangeInfo {

    private final String commitMessage;

    public UntrackedChangeInfo(String commitMessage) {
        this.commitMessage = commitMessage == null ? "" : commitMessage;
    }

    @Override
    public ChangeInfoKind getKind() {
        return ChangeInfoKind.UNTRACKED;
    }

    @Override
    public String getCommitMessage() {
        return commitMessage;
    }
}
