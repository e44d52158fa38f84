package com.purchasingpower.entityrevert.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.entityrevert.exception.RepositoryOperationException;
import com.purchasingpower.entityrevert.model.changeinfo.ChangeInfo;
import com.purchasingpower.entityrevert.service.Committer;
import com.purchasingpower.entityrevert.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.revwalk.RevCommit;

import java.io.File;
import java.io.IOException;

@Slf4j
public class GitCommitter implements Committer {

    private final File workTree;
    private final String authorName;
    private final String authorEmail;

    private ChangeInfo forcedChangeInfo;

    public GitCommitter(File workTree, String authorName, String authorEmail) {
        this.workTree = workTree;
        this.authorName = authorName;
        this.authorEmail = authorEmail;
    }

    @Override
    public void forceChangeInfo(ChangeInfo changeInfo) {
        this.forcedChangeInfo = Preconditions.checkNotNull(changeInfo, "Change info cannot be null");
    }

    @Override
    public String commit() {
        if (forcedChangeInfo == null) {
            throw new IllegalStateException("No change info to commit");
        }

        ChangeInfo changeInfo = forcedChangeInfo;
        forcedChangeInfo = null;

        try (Git git = Git.open(workTree)) {
            // new and modified files, then removals
            git.add().addFilepattern(".").call();
            git.add().addFilepattern(".").setUpdate(true).call();

            RevCommit commit = git.commit()
                    .setMessage(changeInfo.getCommitMessage())
                    .setAuthor(authorName, authorEmail)
                    .setCommitter(authorName, authorEmail)
                    .setSign(false)
                    .call();

            log.info("Committed {}: {}", ExternalCallLogger.shortHash(commit.getName()), commit.getShortMessage());
            return commit.getName();
        } catch (IOException | GitAPIException e) {
            throw new RepositoryOperationException("commit", "Failed to commit: " + e.getMessage(), e);
        }
    }
}
