package com.purchasingpower.entityrevert.model;

/**
 * Terminal outcome of an undo or rollback.
 *
 * <p>Expected failures are reported through this closed set instead of exceptions.
 *
 * <pre>
 * clean? ──no──▶ NOT_CLEAN_WORKING_DIRECTORY
 *   │
 * apply ──conflict──▶ MERGE_CONFLICT            (undo only)
 *   │
 * references ok? ──no──▶ VIOLATED_REFERENTIAL_INTEGRITY   (undo only, aborted)
 *   │
 * anything staged? ──no──▶ NOTHING_TO_COMMIT     (rollback only)
 *   │
 * commit + sync ──▶ OK
 * </pre>
 */
public enum RevertStatus {

    /**
     * Committed and synchronized to the relational mirror.
     */
    OK,

    /**
     * The work tree had uncommitted modifications. Nothing was touched.
     */
    NOT_CLEAN_WORKING_DIRECTORY,

    /**
     * The revert could not be applied cleanly. The work tree was restored.
     */
    MERGE_CONFLICT,

    /**
     * The revert applied cleanly but would leave a dangling or orphaned reference.
     * The speculative revert was aborted.
     */
    VIOLATED_REFERENTIAL_INTEGRITY,

    /**
     * Rolling back produced no difference from the current commit.
     */
    NOTHING_TO_COMMIT;

    public boolean isSuccess() {
        return this == OK;
    }
}
