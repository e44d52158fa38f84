package com.purchasingpower.entityrevert.service.impl;

import com.purchasingpower.entityrevert.exception.RepositoryOperationException;
import com.purchasingpower.entityrevert.model.git.Commit;
import com.purchasingpower.entityrevert.support.EntityStoreFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JGit Repository Tests")
class JGitRepositoryTest {

    private static final String POST_FILE = "vpdb/posts/ab/ab12cd34.ini";
    private static final String OTHER_POST_FILE = "vpdb/posts/ff/ff00aa11.ini";

    @TempDir
    Path workTree;

    private EntityStoreFixture store;
    private JGitRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        store = EntityStoreFixture.create(workTree);
        repository = new JGitRepository(workTree.toFile());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Fresh commit leaves a clean work tree")
    void committedTree_ShouldBeClean() {
        assertThat(repository.isCleanWorkingDirectory()).isTrue();
        assertThat(repository.willCommit()).isFalse();
    }

    @Test
    @DisplayName("Modified and untracked files make the work tree dirty")
    void modifiedOrUntrackedFiles_ShouldBeDirty() throws Exception {
        store.writeFile("notes.txt", "scratch\n");
        assertThat(repository.isCleanWorkingDirectory()).isFalse();

        Files.delete(workTree.resolve("notes.txt"));
        store.writeFile("README.md", "changed\n");
        assertThat(repository.isCleanWorkingDirectory()).isFalse();
        assertThat(repository.willCommit()).isTrue();
    }

    @Test
    @DisplayName("Modified files of a single commit, deletions by old path")
    void modifiedFiles_ShouldListAddedModifiedAndDeletedPaths() throws Exception {
        // Given
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"A\"\n");
        store.writeFile(OTHER_POST_FILE, "[post:ff00aa11]\npost_title = \"B\"\n");
        String first = store.commit("Add posts");

        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"A2\"\n");
        Files.delete(workTree.resolve(OTHER_POST_FILE));
        String second = store.commit("Edit and delete");

        // When
        List<String> inSecond = repository.getModifiedFiles(second + "~1.." + second);
        List<String> sinceFirst = repository.getModifiedFiles(first);

        // Then
        assertThat(inSecond).containsExactlyInAnyOrder(POST_FILE, OTHER_POST_FILE);
        assertThat(sinceFirst).containsExactlyInAnyOrder(POST_FILE, OTHER_POST_FILE);
        assertThat(repository.getModifiedFiles(second)).isEmpty();
    }

    @Test
    @DisplayName("Range over the root commit compares with the empty tree")
    void rootCommitRange_ShouldListAllFiles() {
        String root = store.head();

        assertThat(repository.getModifiedFiles(root + "~1.." + root)).containsExactly("README.md");
    }

    @Test
    @DisplayName("Commit details are read from history")
    void getCommit_ShouldReturnMessageAndAuthor() throws Exception {
        store.writeFile(POST_FILE, "[post:ab12cd34]\n");
        String hash = store.commit("Created post ab12cd34\n\nVP-Action: post/create/ab12cd34\n");

        Commit commit = repository.getCommit(hash.substring(0, 10));

        assertThat(commit.hash()).isEqualTo(hash);
        assertThat(commit.shortMessage()).isEqualTo("Created post ab12cd34");
        assertThat(commit.message()).contains("VP-Action: post/create/ab12cd34");
        assertThat(commit.authorName()).isEqualTo(EntityStoreFixture.AUTHOR_NAME);
    }

    @Test
    @DisplayName("Unknown revision is reported as a repository error")
    void unknownRevision_ShouldThrow() {
        assertThatThrownBy(() -> repository.getCommit("deadbeefdeadbeef"))
                .isInstanceOf(RepositoryOperationException.class)
                .hasMessageContaining("deadbeefdeadbeef");
    }

    @Test
    @DisplayName("Revert applies the inverse change without committing")
    void revert_ShouldApplyInverseToWorkTree() throws Exception {
        // Given
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"A\"\n");
        store.commit("Add post");
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"B\"\n");
        String edit = store.commit("Edit post");

        // When
        boolean applied = repository.revert(edit);

        // Then
        assertThat(applied).isTrue();
        assertThat(store.readFile(POST_FILE)).contains("post_title = \"A\"");
        assertThat(store.head()).isEqualTo(edit);
        assertThat(repository.willCommit()).isTrue();
    }

    @Test
    @DisplayName("Abort restores the work tree to HEAD")
    void abortRevert_ShouldRestoreHead() throws Exception {
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"A\"\n");
        String add = store.commit("Add post");
        assertThat(repository.revert(add)).isTrue();
        assertThat(workTree.resolve(POST_FILE)).doesNotExist();

        repository.abortRevert();

        assertThat(store.readFile(POST_FILE)).isEqualTo("[post:ab12cd34]\npost_title = \"A\"\n");
        assertThat(repository.isCleanWorkingDirectory()).isTrue();
    }

    @Test
    @DisplayName("Conflicting revert returns false and leaves HEAD untouched")
    void conflictingRevert_ShouldRestoreAndReturnFalse() throws Exception {
        // Given: the same line edited twice after creation
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"A\"\n");
        store.commit("Add post");
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"B\"\n");
        String middle = store.commit("Edit to B");
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"C\"\n");
        String head = store.commit("Edit to C");

        // When
        boolean applied = repository.revert(middle);

        // Then
        assertThat(applied).isFalse();
        assertThat(store.head()).isEqualTo(head);
        assertThat(store.readFile(POST_FILE)).isEqualTo("[post:ab12cd34]\npost_title = \"C\"\n");
        assertThat(repository.isCleanWorkingDirectory()).isTrue();
    }

    @Test
    @DisplayName("Root commit cannot be reverted")
    void rootCommit_ShouldNotRevert() {
        assertThat(repository.revert(store.head())).isFalse();
        assertThat(repository.isCleanWorkingDirectory()).isTrue();
    }

    @Test
    @DisplayName("Revert all restores the old tree including removal of newer files")
    void revertAll_ShouldRestoreTargetTree() throws Exception {
        // Given
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"A\"\n");
        String target = store.commit("Add post");
        store.writeFile(POST_FILE, "[post:ab12cd34]\npost_title = \"B\"\n");
        store.writeFile(OTHER_POST_FILE, "[post:ff00aa11]\n");
        store.commit("Edit and add");
        Files.delete(workTree.resolve("README.md"));
        store.commit("Remove readme");

        // When
        repository.revertAll(target);

        // Then
        assertThat(store.readFile(POST_FILE)).contains("post_title = \"A\"");
        assertThat(workTree.resolve(OTHER_POST_FILE)).doesNotExist();
        assertThat(workTree.resolve("README.md")).exists();
        assertThat(repository.willCommit()).isTrue();
    }

    @Test
    @DisplayName("Revert all to HEAD changes nothing")
    void revertAllToHead_ShouldLeaveNothingToCommit() {
        repository.revertAll(store.head());

        assertThat(repository.willCommit()).isFalse();
    }
}
