package com.purchasingpower.entityrevert.service.impl;

import com.purchasingpower.entityrevert.model.changeinfo.CompositeChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.RevertChangeInfo;
import com.purchasingpower.entityrevert.support.EntityStoreFixture;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Git Committer Tests")
class GitCommitterTest {

    @TempDir
    Path workTree;

    private EntityStoreFixture store;
    private GitCommitter committer;

    @BeforeEach
    void setUp() throws Exception {
        store = EntityStoreFixture.create(workTree);
        committer = new GitCommitter(workTree.toFile(), "VersionPress", "versionpress@localhost");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Commit stages additions and removals with the forced message")
    void commit_ShouldRecordAllChangesWithForcedMessage() throws Exception {
        // Given
        store.writeFile("vpdb/options.ini", "[option:blogname]\noption_value = \"Site\"\n");
        Files.delete(workTree.resolve("README.md"));
        committer.forceChangeInfo(CompositeChangeInfo.of(RevertChangeInfo.undo("0123456789abcdef")));

        // When
        String hash = committer.commit();

        // Then
        RevCommit head = store.headCommit();
        assertThat(head.getName()).isEqualTo(hash);
        assertThat(head.getFullMessage())
                .startsWith("Reverted change 0123456")
                .contains("VP-Action: versionpress/undo/0123456789abcdef");
        assertThat(head.getAuthorIdent().getName()).isEqualTo("VersionPress");
        assertThat(head.getCommitterIdent().getEmailAddress()).isEqualTo("versionpress@localhost");
        assertThat(store.isClean()).isTrue();
    }

    @Test
    @DisplayName("Forced change info is used once")
    void commit_ShouldClearForcedChangeInfo() {
        store.writeFile("vpdb/options.ini", "[option:blogname]\n");
        committer.forceChangeInfo(CompositeChangeInfo.of(RevertChangeInfo.rollback("abcdef12")));
        committer.commit();

        assertThatThrownBy(committer::commit)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Commit without forced change info is rejected")
    void commitWithoutChangeInfo_ShouldThrow() {
        assertThatThrownBy(committer::commit)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No change info");
    }
}
