package com.purchasingpower.entityrevert.service;

import com.purchasingpower.entityrevert.model.changeinfo.ChangeInfo;

/**
 * Finalizes pending changes of the entity store as a commit.
 */
public interface Committer {

    /**
     * Associates the change description that the next {@link #commit()} records.
     */
    void forceChangeInfo(ChangeInfo changeInfo);

    /**
     * Stages all pending changes and commits them with the forced change description.
     *
     * @return hash of the new commit
     * @throws IllegalStateException if no change description was forced
     */
    String commit();
}
