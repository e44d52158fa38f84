package com.purchasingpower.entityrevert.service;

import com.purchasingpower.entityrevert.model.git.Commit;

import java.util.List;

/**
 * Version-control operations the revert engine needs from the entity store's repository.
 */
public interface GitRepository {

    /**
     * @return true if there are no staged, modified or untracked files
     */
    boolean isCleanWorkingDirectory();

    /**
     * Get list of files changed in a revision range
     *
     * @param gitDiffRange {@code from..to}, or a single revision meaning {@code rev..HEAD}
     * @return repository-relative paths; deleted files report their old path
     */
    List<String> getModifiedFiles(String gitDiffRange);

    Commit getCommit(String commitHash);

    /**
     * Applies the inverse of one commit to the index and work tree without committing.
     *
     * @return false on conflict; the work tree is then already restored to HEAD
     */
    boolean revert(String commitHash);

    /**
     * Discards a speculatively applied revert, restoring HEAD exactly.
     */
    void abortRevert();

    /**
     * Stages the full tree of {@code commitHash} on top of HEAD without committing.
     */
    void revertAll(String commitHash);

    /**
     * @return true if the index or work tree differs from HEAD
     */
    boolean willCommit();
}
