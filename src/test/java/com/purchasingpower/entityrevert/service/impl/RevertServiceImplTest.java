package com.purchasingpower.entityrevert.service.impl;

import com.purchasingpower.entityrevert.exception.StorageException;
import com.purchasingpower.entityrevert.model.RevertStatus;
import com.purchasingpower.entityrevert.model.changeinfo.EntityChangeInfo;
import com.purchasingpower.entityrevert.model.storage.Entity;
import com.purchasingpower.entityrevert.service.sync.ChangeSetClassifier;
import com.purchasingpower.entityrevert.service.sync.PostChangeDateUpdater;
import com.purchasingpower.entityrevert.service.sync.SynchronizationProcess;
import com.purchasingpower.entityrevert.service.validation.ReferenceIntegrityChecker;
import com.purchasingpower.entityrevert.service.validation.ScanningIncomingReferenceFinder;
import com.purchasingpower.entityrevert.support.EntityStoreFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Undo and rollback against a real Git repository and INI store.
 * The mirror is replaced by recorders.
 */
@DisplayName("Revert Service Tests")
class RevertServiceImplTest {

    private static final String POST_ID = "ab12cd34";
    private static final String POST_FILE = "vpdb/posts/ab/ab12cd34.ini";
    private static final String COMMENT_ID = "cc00dd11";
    private static final String COMMENT_FILE = "vpdb/comments/cc/cc00dd11.ini";

    @TempDir
    Path workTree;

    private EntityStoreFixture store;
    private RevertServiceImpl revertService;

    private final List<List<String>> synchronizedTypes = new ArrayList<>();
    private final List<List<String>> stampedPosts = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        store = EntityStoreFixture.create(workTree);

        ReferenceIntegrityChecker checker = new ReferenceIntegrityChecker(
                store.getSchemaInfo(),
                store.getStorageFactory(),
                new ScanningIncomingReferenceFinder(store.getSchemaInfo(), store.getStorageFactory()));
        SynchronizationProcess synchronizationProcess = synchronizedTypes::add;
        PostChangeDateUpdater postChangeDateUpdater = stampedPosts::add;

        revertService = new RevertServiceImpl(
                new JGitRepository(workTree.toFile()),
                new GitCommitter(workTree.toFile(), "VersionPress", "versionpress@localhost"),
                store.getSchemaInfo(),
                checker,
                new ChangeSetClassifier(),
                synchronizationProcess,
                postChangeDateUpdater);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    // ======================================================================
    // UNDO
    // ======================================================================

    @Test
    @DisplayName("Undo of an edit restores the previous value, commits and synchronizes")
    void undoEdit_ShouldCommitAndSynchronize() throws Exception {
        // Given
        store.save("post", post("Original"));
        store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.save("post", post("Changed"));
        String edit = store.commit(EntityChangeInfo.of("post", "edit", POST_ID));

        // When
        RevertStatus status = revertService.revert(edit);

        // Then
        assertThat(status).isEqualTo(RevertStatus.OK);
        assertThat(store.storage("post").loadEntity(POST_ID, null).getString("post_title")).contains("Original");
        assertThat(store.head()).isNotEqualTo(edit);
        assertThat(store.headCommit().getFullMessage()).contains("VP-Action: versionpress/undo/" + edit);
        assertThat(store.isClean()).isTrue();

        assertThat(synchronizedTypes).hasSize(1);
        assertThat(synchronizedTypes.get(0)).containsOnly("post", "postmeta");
        assertThat(stampedPosts).containsExactly(List.of(POST_ID));
    }

    @Test
    @DisplayName("Undo that deletes a still-referenced post is refused and leaves the tree untouched")
    void undoCreateOfReferencedPost_ShouldViolateIntegrity() throws Exception {
        // Given: a comment created after the post still points to it
        store.save("post", post("Hello"));
        String createPost = store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.save("comment", comment(POST_ID));
        String head = store.commit(EntityChangeInfo.of("comment", "create", COMMENT_ID));
        String postFileBefore = store.readFile(POST_FILE);
        String commentFileBefore = store.readFile(COMMENT_FILE);

        // When
        RevertStatus status = revertService.revert(createPost);

        // Then
        assertThat(status).isEqualTo(RevertStatus.VIOLATED_REFERENTIAL_INTEGRITY);
        assertThat(store.head()).isEqualTo(head);
        assertThat(store.isClean()).isTrue();
        assertThat(store.readFile(POST_FILE)).isEqualTo(postFileBefore);
        assertThat(store.readFile(COMMENT_FILE)).isEqualTo(commentFileBefore);
        assertThat(synchronizedTypes).isEmpty();
        assertThat(stampedPosts).isEmpty();
    }

    @Test
    @DisplayName("Undo of an unreferenced post creation deletes it")
    void undoCreateOfUnreferencedPost_ShouldSucceed() throws Exception {
        store.save("post", post("Hello"));
        String createPost = store.commit(EntityChangeInfo.of("post", "create", POST_ID));

        RevertStatus status = revertService.revert(createPost);

        assertThat(status).isEqualTo(RevertStatus.OK);
        assertThat(store.storage("post").exists(POST_ID, null)).isFalse();
        assertThat(stampedPosts).containsExactly(List.of(POST_ID));
    }

    @Test
    @DisplayName("Undo on a dirty work tree writes nothing")
    void undoOnDirtyTree_ShouldRefuse() throws Exception {
        // Given
        store.save("post", post("Original"));
        store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.save("post", post("Changed"));
        String edit = store.commit(EntityChangeInfo.of("post", "edit", POST_ID));
        store.writeFile("vpdb/options.ini", "[option:blogname]\noption_value = \"Draft\"\n");

        // When
        RevertStatus status = revertService.revert(edit);

        // Then
        assertThat(status).isEqualTo(RevertStatus.NOT_CLEAN_WORKING_DIRECTORY);
        assertThat(store.head()).isEqualTo(edit);
        assertThat(store.readFile("vpdb/options.ini")).isEqualTo("[option:blogname]\noption_value = \"Draft\"\n");
        assertThat(store.storage("post").loadEntity(POST_ID, null).getString("post_title")).contains("Changed");
        assertThat(synchronizedTypes).isEmpty();
        assertThat(stampedPosts).isEmpty();
    }

    @Test
    @DisplayName("Undo conflicting with a later edit reports a merge conflict")
    void undoOverwrittenEdit_ShouldConflict() throws Exception {
        // Given
        store.save("post", post("A"));
        store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.save("post", post("B"));
        String middle = store.commit(EntityChangeInfo.of("post", "edit", POST_ID));
        store.save("post", post("C"));
        String head = store.commit(EntityChangeInfo.of("post", "edit", POST_ID));

        // When
        RevertStatus status = revertService.revert(middle);

        // Then
        assertThat(status).isEqualTo(RevertStatus.MERGE_CONFLICT);
        assertThat(store.head()).isEqualTo(head);
        assertThat(store.isClean()).isTrue();
        assertThat(store.storage("post").loadEntity(POST_ID, null).getString("post_title")).contains("C");
        assertThat(synchronizedTypes).isEmpty();
    }

    @Test
    @DisplayName("Untracked commit is undone without reference checks")
    void undoUntrackedCommit_ShouldSkipValidation() throws Exception {
        // Given: the post came in through a manual commit and is referenced later
        store.save("post", post("Imported"));
        String manual = store.commit("Imported content by hand");
        store.save("comment", comment(POST_ID));
        store.commit(EntityChangeInfo.of("comment", "create", COMMENT_ID));

        // When
        RevertStatus status = revertService.revert(manual);

        // Then: accepted even though the comment now dangles
        assertThat(status).isEqualTo(RevertStatus.OK);
        assertThat(store.storage("post").exists(POST_ID, null)).isFalse();
        assertThat(store.storage("comment").exists(COMMENT_ID, null)).isTrue();
    }

    @Test
    @DisplayName("Non-entity actions in a commit are not validated")
    void undoCommitWithPluginAction_ShouldValidateOnlyEntities() throws Exception {
        // Given: one commit activating a plugin and creating an option
        store.save("option", new Entity("blogname").set("option_value", "My Site"));
        String mixed = store.commit("""
                Activated plugin akismet (+1 more)

                VP-Action: plugin/activate/akismet
                VP-Action: option/create/blogname
                """);

        // When
        RevertStatus status = revertService.revert(mixed);

        // Then
        assertThat(status).isEqualTo(RevertStatus.OK);
        assertThat(store.storage("option").exists("blogname", null)).isFalse();
        assertThat(synchronizedTypes.get(0)).containsExactly("option");
        assertThat(store.isClean()).isTrue();
    }

    @Test
    @DisplayName("Failure while validating aborts the undo before rethrowing")
    void undoWithUnreadableStore_ShouldRestoreTreeAndRethrow() throws Exception {
        // Given: a post, then a hand-made commit leaving a corrupt comment file
        store.save("post", post("Hello"));
        String createPost = store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.writeFile(COMMENT_FILE, "this is not an ini file\n");
        String head = store.commit("Broken import");

        // When: undoing the post scans comments for references to it
        assertThatThrownBy(() -> revertService.revert(createPost))
                .isInstanceOf(StorageException.class);

        // Then
        assertThat(store.head()).isEqualTo(head);
        assertThat(store.isClean()).isTrue();
        assertThat(store.storage("post").exists(POST_ID, null)).isTrue();
        assertThat(synchronizedTypes).isEmpty();
        assertThat(stampedPosts).isEmpty();
    }

    @Test
    @DisplayName("Root commit cannot be undone")
    void undoRootCommit_ShouldConflict() throws Exception {
        String root = store.git().log().call().iterator().next().getName();

        assertThat(revertService.revert(root)).isEqualTo(RevertStatus.MERGE_CONFLICT);
        assertThat(store.isClean()).isTrue();
    }

    @Test
    @DisplayName("Malformed hash is rejected before touching the repository")
    void invalidHash_ShouldThrow() {
        assertThatThrownBy(() -> revertService.revert("HEAD~1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> revertService.revertAll(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ======================================================================
    // ROLLBACK
    // ======================================================================

    @Test
    @DisplayName("Rollback restores the target state and commits")
    void rollback_ShouldRestoreTargetState() throws Exception {
        // Given
        store.save("post", post("Original"));
        String target = store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.save("post", post("Changed"));
        store.save("user", new Entity("ee55ff66").set("user_login", "admin"));
        store.commit(EntityChangeInfo.of("post", "edit", POST_ID), EntityChangeInfo.of("user", "create", "ee55ff66"));

        // When
        RevertStatus status = revertService.revertAll(target);

        // Then
        assertThat(status).isEqualTo(RevertStatus.OK);
        assertThat(store.storage("post").loadEntity(POST_ID, null).getString("post_title")).contains("Original");
        assertThat(store.storage("user").exists("ee55ff66", null)).isFalse();
        assertThat(store.headCommit().getFullMessage()).contains("VP-Action: versionpress/rollback/" + target);
        assertThat(store.isClean()).isTrue();

        assertThat(synchronizedTypes.get(0)).containsOnly("post", "postmeta", "user", "usermeta");
        assertThat(stampedPosts).containsExactly(List.of(POST_ID));
    }

    @Test
    @DisplayName("Rollback to HEAD has nothing to commit")
    void rollbackToHead_ShouldReportNothingToCommit() throws Exception {
        store.save("post", post("Hello"));
        String head = store.commit(EntityChangeInfo.of("post", "create", POST_ID));

        RevertStatus status = revertService.revertAll(head);

        assertThat(status).isEqualTo(RevertStatus.NOTHING_TO_COMMIT);
        assertThat(store.head()).isEqualTo(head);
        assertThat(store.isClean()).isTrue();
        assertThat(synchronizedTypes).isEmpty();
    }

    @Test
    @DisplayName("Rollback on a dirty work tree writes nothing")
    void rollbackOnDirtyTree_ShouldRefuse() throws Exception {
        store.save("post", post("Hello"));
        String head = store.commit(EntityChangeInfo.of("post", "create", POST_ID));
        store.writeFile("scratch.txt", "wip\n");

        assertThat(revertService.revertAll(head)).isEqualTo(RevertStatus.NOT_CLEAN_WORKING_DIRECTORY);
        assertThat(store.head()).isEqualTo(head);
    }

    @Test
    @DisplayName("Rollback skips the reference check that undo performs")
    void rollback_ShouldNotValidateReferences() throws Exception {
        // Given: C1 leaves a comment pointing to a post that does not exist yet, C2 creates the post
        store.save("comment", comment(POST_ID));
        String danglingComment = store.commit("Comment added by hand");
        store.save("post", post("Late post"));
        String createPost = store.commit(EntityChangeInfo.of("post", "create", POST_ID));

        // When / Then: undoing the post creation is refused
        assertThat(revertService.revert(createPost)).isEqualTo(RevertStatus.VIOLATED_REFERENTIAL_INTEGRITY);
        assertThat(store.head()).isEqualTo(createPost);

        // When / Then: rolling back to C1 reaches the same dangling state and is accepted
        assertThat(revertService.revertAll(danglingComment)).isEqualTo(RevertStatus.OK);
        assertThat(store.storage("post").exists(POST_ID, null)).isFalse();
        assertThat(store.storage("comment").exists(COMMENT_ID, null)).isTrue();
    }

    private static Entity post(String title) {
        return new Entity(POST_ID).set("post_title", title).set("post_status", "publish");
    }

    private static Entity comment(String postId) {
        return new Entity(COMMENT_ID).set("comment_content", "Nice post").set("vp_comment_post_ID", postId);
    }
}
