package com.purchasingpower.entityrevert.service.impl;

import com.purchasingpower.entityrevert.exception.RepositoryOperationException;
import com.purchasingpower.entityrevert.model.CallContext;
import com.purchasingpower.entityrevert.model.ServiceType;
import com.purchasingpower.entityrevert.model.git.Commit;
import com.purchasingpower.entityrevert.service.GitRepository;
import com.purchasingpower.entityrevert.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.RmCommand;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.merge.MergeStrategy;
import org.eclipse.jgit.merge.ResolveMerger;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.FileTreeIterator;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link GitRepository} over Eclipse JGit, operating on a local work tree.
 *
 * A revert is applied the way {@code git revert --no-commit} does it: a three-way
 * merge with the reverted commit as base, HEAD as ours and the commit's parent as
 * theirs, written into index and work tree. Every other failure is wrapped in
 * {@link RepositoryOperationException}.
 */
@Slf4j
public class JGitRepository implements GitRepository {

    private static final String RANGE_SEPARATOR = "..";

    private final File workTree;

    public JGitRepository(File workTree) {
        this.workTree = workTree;
    }

    @Override
    public boolean isCleanWorkingDirectory() {
        try (Git git = Git.open(workTree)) {
            Status status = git.status().call();
            if (!status.isClean()) {
                log.debug("Work tree not clean: {} uncommitted, {} untracked",
                        status.getUncommittedChanges().size(), status.getUntracked().size());
            }
            return status.isClean();
        } catch (IOException | GitAPIException e) {
            throw new RepositoryOperationException("status", "Failed to read work tree status", e);
        }
    }

    @Override
    public List<String> getModifiedFiles(String gitDiffRange) {
        String fromRevision;
        String toRevision;
        int separator = gitDiffRange.indexOf(RANGE_SEPARATOR);
        if (separator >= 0) {
            fromRevision = gitDiffRange.substring(0, separator);
            toRevision = gitDiffRange.substring(separator + RANGE_SEPARATOR.length());
        } else {
            fromRevision = gitDiffRange;
            toRevision = Constants.HEAD;
        }

        try (Git git = Git.open(workTree)) {
            Repository repository = git.getRepository();

            List<DiffEntry> diffs = git.diff()
                    .setOldTree(prepareTreeParser(repository, fromRevision))
                    .setNewTree(prepareTreeParser(repository, toRevision))
                    .setShowNameAndStatusOnly(true)
                    .call();

            List<String> modifiedFiles = diffs.stream()
                    .map(diff -> diff.getChangeType() == DiffEntry.ChangeType.DELETE ? diff.getOldPath() : diff.getNewPath())
                    .collect(Collectors.toList());

            log.debug("{} files modified in {}", modifiedFiles.size(), gitDiffRange);
            return modifiedFiles;
        } catch (IOException | GitAPIException e) {
            throw new RepositoryOperationException("diff", "Failed to compute modified files for " + gitDiffRange, e);
        }
    }

    @Override
    public Commit getCommit(String commitHash) {
        try (Git git = Git.open(workTree); RevWalk walk = new RevWalk(git.getRepository())) {
            RevCommit commit = walk.parseCommit(resolve(git.getRepository(), commitHash));
            return new Commit(
                    commit.getName(),
                    commit.getShortMessage(),
                    commit.getFullMessage(),
                    commit.getAuthorIdent().getName(),
                    commit.getAuthorIdent().getEmailAddress(),
                    Instant.ofEpochSecond(commit.getCommitTime()));
        } catch (IOException e) {
            throw new RepositoryOperationException("log", "Failed to read commit " + commitHash, e);
        }
    }

    @Override
    public boolean revert(String commitHash) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.GIT, "Revert", log);
        call.logRequest("Reverting " + ExternalCallLogger.shortHash(commitHash));

        try (Git git = Git.open(workTree); RevWalk walk = new RevWalk(git.getRepository())) {
            Repository repository = git.getRepository();
            RevCommit srcCommit = walk.parseCommit(resolve(repository, commitHash));
            if (srcCommit.getParentCount() == 0) {
                log.warn("Cannot revert root commit {}", ExternalCallLogger.shortHash(commitHash));
                call.logResponse("Root commit, nothing applied");
                return false;
            }

            RevCommit srcParent = walk.parseCommit(srcCommit.getParent(0));
            RevCommit headCommit = walk.parseCommit(resolve(repository, Constants.HEAD));

            ResolveMerger merger = (ResolveMerger) MergeStrategy.RECURSIVE.newMerger(repository);
            merger.setWorkingTreeIterator(new FileTreeIterator(repository));
            merger.setBase(srcCommit.getTree());
            merger.setCommitNames(new String[]{"BASE", "HEAD", "revert " + srcCommit.abbreviate(7).name()});

            if (merger.merge(headCommit, srcParent)) {
                call.logResponse("Applied to work tree");
                return true;
            }

            log.warn("Revert of {} conflicts: unmerged={}, failing={}",
                    ExternalCallLogger.shortHash(commitHash), merger.getUnmergedPaths(), merger.getFailingPaths());
            restoreHead(git);
            call.logResponse("Conflict, work tree restored");
            return false;
        } catch (IOException | GitAPIException e) {
            call.logError("Revert failed", e);
            throw new RepositoryOperationException("revert", "Failed to revert " + commitHash, e);
        }
    }

    @Override
    public void abortRevert() {
        try (Git git = Git.open(workTree)) {
            restoreHead(git);
            log.info("Speculative revert aborted, work tree back at HEAD");
        } catch (IOException | GitAPIException e) {
            throw new RepositoryOperationException("reset", "Failed to abort revert", e);
        }
    }

    @Override
    public void revertAll(String commitHash) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.GIT, "RevertAll", log);
        call.logRequest("Restoring tree of " + ExternalCallLogger.shortHash(commitHash));

        try (Git git = Git.open(workTree)) {
            Repository repository = git.getRepository();
            resolve(repository, commitHash);

            List<String> addedSince = git.diff()
                    .setOldTree(prepareTreeParser(repository, commitHash))
                    .setNewTree(prepareTreeParser(repository, Constants.HEAD))
                    .setShowNameAndStatusOnly(true)
                    .call()
                    .stream()
                    .filter(diff -> diff.getChangeType() == DiffEntry.ChangeType.ADD)
                    .map(DiffEntry::getNewPath)
                    .collect(Collectors.toList());

            git.checkout().setStartPoint(commitHash).setAllPaths(true).call();

            if (!addedSince.isEmpty()) {
                RmCommand rm = git.rm();
                addedSince.forEach(rm::addFilepattern);
                rm.call();
            }

            call.logResponse("Tree restored", "Removed", addedSince.size());
        } catch (IOException | GitAPIException e) {
            call.logError("Rollback failed", e);
            throw new RepositoryOperationException("revert-all", "Failed to restore tree of " + commitHash, e);
        }
    }

    @Override
    public boolean willCommit() {
        return !isCleanWorkingDirectory();
    }

    private static void restoreHead(Git git) throws GitAPIException {
        git.reset().setMode(ResetCommand.ResetType.HARD).setRef(Constants.HEAD).call();
        git.clean().setCleanDirectories(true).call();
    }

    private static ObjectId resolve(Repository repository, String revision) throws IOException {
        ObjectId id = repository.resolve(revision);
        if (id == null) {
            throw new RepositoryOperationException("rev-parse", "Unknown revision: " + revision);
        }
        return id;
    }

    /**
     * Prepare tree parser for diff computation. The parent of a root commit
     * ({@code <root>~1}) is read as the empty tree.
     */
    private static AbstractTreeIterator prepareTreeParser(Repository repository, String revision) throws IOException {
        ObjectId commitId = repository.resolve(revision);
        if (commitId == null) {
            if (revision.endsWith("~1") || revision.endsWith("^")) {
                return new EmptyTreeIterator();
            }
            throw new RepositoryOperationException("rev-parse", "Unknown revision: " + revision);
        }

        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(commitId);
            RevTree tree = walk.parseTree(commit.getTree().getId());

            CanonicalTreeParser treeParser = new CanonicalTreeParser();
            try (ObjectReader reader = repository.newObjectReader()) {
                treeParser.reset(reader, tree.getId());
            }
            return treeParser;
        }
    }
}
