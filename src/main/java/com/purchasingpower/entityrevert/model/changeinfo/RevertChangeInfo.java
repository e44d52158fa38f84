package com.purchasingpower.entityrevert.model.changeinfo;

import com.google.common.base.Preconditions;

/**
 * Marks a commit produced by an undo or a rollback.
 */
public record RevertChangeInfo(RevertAction action, String commitHash) implements TrackedChangeInfo {

    public static final String SCOPE = "versionpress";

    public enum RevertAction {
        UNDO("undo"),
        ROLLBACK("rollback");

        private final String tag;

        RevertAction(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        public static RevertAction fromTag(String tag) {
            for (RevertAction action : values()) {
                if (action.tag.equals(tag)) {
                    return action;
                }
            }
            return null;
        }
    }

    public RevertChangeInfo {
        Preconditions.checkNotNull(action, "Revert action cannot be null");
        Preconditions.checkArgument(commitHash != null && !commitHash.isBlank(), "Commit hash cannot be blank");
    }

    public static RevertChangeInfo undo(String commitHash) {
        return new RevertChangeInfo(RevertAction.UNDO, commitHash);
    }

    public static RevertChangeInfo rollback(String commitHash) {
        return new RevertChangeInfo(RevertAction.ROLLBACK, commitHash);
    }

    @Override
    public String getActionTag() {
        return SCOPE + "/" + action.getTag() + "/" + commitHash;
    }

    @Override
    public String getDescription() {
        String shortHash = commitHash.length() > 7 ? commitHash.substring(0, 7) : commitHash;
        return action == RevertAction.UNDO
                ? "Reverted change " + shortHash
                : "Rolled back to " + shortHash;
    }
}
