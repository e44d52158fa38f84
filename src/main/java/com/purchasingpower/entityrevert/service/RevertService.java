package com.purchasingpower.entityrevert.service;

import com.purchasingpower.entityrevert.model.RevertStatus;

public interface RevertService {

    /**
     * Undo a single commit, refusing if the result would break referential integrity.
     *
     * @param commitHash commit to undo
     * @return terminal status; only {@link RevertStatus#OK} leaves a new commit behind
     * @throws IllegalArgumentException if the hash is malformed
     */
    RevertStatus revert(String commitHash);

    /**
     * Roll the store back to the state of {@code commitHash}, as one new commit.
     *
     * <p>Unlike {@link #revert(String)} the resulting state is not checked for
     * referential integrity: a historical state is assumed to have been consistent.
     *
     * @param commitHash commit whose tree becomes the new state
     * @return terminal status
     * @throws IllegalArgumentException if the hash is malformed
     */
    RevertStatus revertAll(String commitHash);
}
