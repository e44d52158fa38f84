package com.purchasingpower.entityrevert.service.impl;

import com.purchasingpower.entityrevert.model.RevertStatus;
import com.purchasingpower.entityrevert.model.changeinfo.ChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.ChangeInfoKind;
import com.purchasingpower.entityrevert.model.changeinfo.CompositeChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.EntityChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.RevertChangeInfo;
import com.purchasingpower.entityrevert.model.git.Commit;
import com.purchasingpower.entityrevert.service.Committer;
import com.purchasingpower.entityrevert.service.GitRepository;
import com.purchasingpower.entityrevert.service.RevertService;
import com.purchasingpower.entityrevert.service.changeinfo.ChangeInfoMatcher;
import com.purchasingpower.entityrevert.service.schema.DbSchemaInfo;
import com.purchasingpower.entityrevert.service.sync.ChangeSetClassifier;
import com.purchasingpower.entityrevert.service.sync.PostChangeDateUpdater;
import com.purchasingpower.entityrevert.service.sync.SynchronizationProcess;
import com.purchasingpower.entityrevert.service.validation.ReferenceIntegrityChecker;
import com.purchasingpower.entityrevert.util.ExternalCallLogger;
import com.purchasingpower.entityrevert.util.GitInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Undo and rollback of entity-store commits.
 *
 * <p>Nothing is final until {@link Committer#commit()}; before that the only
 * effect is on the work tree, and every failure exit restores it. Mirror
 * synchronization runs after the commit and is not compensated if it fails.
 *
 * <p>Callers must not run two reverts against the same store concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevertServiceImpl implements RevertService {

    private final GitRepository repository;
    private final Committer committer;
    private final DbSchemaInfo dbSchemaInfo;
    private final ReferenceIntegrityChecker referenceIntegrityChecker;
    private final ChangeSetClassifier changeSetClassifier;
    private final SynchronizationProcess synchronizationProcess;
    private final PostChangeDateUpdater postChangeDateUpdater;

    @Override
    public RevertStatus revert(String commitHash) {
        GitInputValidator.validateCommitHash(commitHash);
        log.info("Undo of {} requested", ExternalCallLogger.shortHash(commitHash));

        if (!repository.isCleanWorkingDirectory()) {
            log.warn("Undo of {} refused: work tree has uncommitted changes", ExternalCallLogger.shortHash(commitHash));
            return RevertStatus.NOT_CLEAN_WORKING_DIRECTORY;
        }

        List<String> modifiedFiles = repository.getModifiedFiles(String.format("%s~1..%s", commitHash, commitHash));
        Commit revertedCommit = repository.getCommit(commitHash);

        if (!repository.revert(commitHash)) {
            log.warn("Undo of {} conflicts with later changes", ExternalCallLogger.shortHash(commitHash));
            return RevertStatus.MERGE_CONFLICT;
        }

        boolean referencesValid;
        try {
            referencesValid = checkReferencesForRevertedCommit(revertedCommit);
        } catch (RuntimeException e) {
            log.error("Validation of undo of {} failed, aborting", ExternalCallLogger.shortHash(commitHash), e);
            repository.abortRevert();
            throw e;
        }

        if (!referencesValid) {
            repository.abortRevert();
            log.warn("Undo of {} would break referential integrity, aborted", ExternalCallLogger.shortHash(commitHash));
            return RevertStatus.VIOLATED_REFERENTIAL_INTEGRITY;
        }

        committer.forceChangeInfo(CompositeChangeInfo.of(RevertChangeInfo.undo(commitHash)));
        committer.commit();

        synchronizeMirror(modifiedFiles);
        log.info("Undo of {} completed", ExternalCallLogger.shortHash(commitHash));
        return RevertStatus.OK;
    }

    @Override
    public RevertStatus revertAll(String commitHash) {
        GitInputValidator.validateCommitHash(commitHash);
        log.info("Rollback to {} requested", ExternalCallLogger.shortHash(commitHash));

        if (!repository.isCleanWorkingDirectory()) {
            log.warn("Rollback to {} refused: work tree has uncommitted changes", ExternalCallLogger.shortHash(commitHash));
            return RevertStatus.NOT_CLEAN_WORKING_DIRECTORY;
        }

        List<String> modifiedFiles = repository.getModifiedFiles(commitHash);

        repository.revertAll(commitHash);

        if (!repository.willCommit()) {
            log.info("Rollback to {}: nothing to commit", ExternalCallLogger.shortHash(commitHash));
            return RevertStatus.NOTHING_TO_COMMIT;
        }

        // no integrity check here: the target is a state the store already had once
        committer.forceChangeInfo(CompositeChangeInfo.of(RevertChangeInfo.rollback(commitHash)));
        committer.commit();

        synchronizeMirror(modifiedFiles);
        log.info("Rollback to {} completed", ExternalCallLogger.shortHash(commitHash));
        return RevertStatus.OK;
    }

    private boolean checkReferencesForRevertedCommit(Commit revertedCommit) {
        ChangeInfo changeInfo = ChangeInfoMatcher.buildChangeInfo(revertedCommit.message());

        if (changeInfo.getKind() == ChangeInfoKind.UNTRACKED) {
            log.debug("Commit {} is untracked, skipping reference checks", ExternalCallLogger.shortHash(revertedCommit.hash()));
            return true;
        }

        for (EntityChangeInfo entityChange : ((CompositeChangeInfo) changeInfo).getEntityChanges()) {
            if (!dbSchemaInfo.isEntity(entityChange.entityName())) {
                // plugin/theme actions and the like carry no entity graph
                log.debug("Skipping non-entity change {}", entityChange.getActionTag());
                continue;
            }
            if (!referenceIntegrityChecker.checkEntityReferences(
                    entityChange.entityName(), entityChange.entityId(), entityChange.parentId())) {
                return false;
            }
        }
        return true;
    }

    private void synchronizeMirror(List<String> modifiedFiles) {
        List<String> entitiesToSynchronize = changeSetClassifier.detectEntitiesToSynchronize(modifiedFiles);
        synchronizationProcess.synchronize(entitiesToSynchronize);

        List<String> affectedPosts = changeSetClassifier.getAffectedPosts(modifiedFiles);
        postChangeDateUpdater.updateChangeDateForPosts(affectedPosts);
    }
}
