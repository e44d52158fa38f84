package com.purchasingpower.entityrevert.service.sync;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the paths touched by a revert to the entity types the mirror must reload
 * and to the posts whose modification date must be bumped.
 */
@Component
public class ChangeSetClassifier {

    private static final Pattern POST_FILE = Pattern.compile("(?:^|/)posts/[^/]+/([^/]+)\\.ini$");

    /**
     * Entity types to synchronize. May contain duplicates; synchronization is idempotent.
     */
    public List<String> detectEntitiesToSynchronize(List<String> modifiedFiles) {
        List<String> entitiesToSynchronize = new ArrayList<>();

        if (wasModified(modifiedFiles, "posts")) {
            entitiesToSynchronize.add("post");
            entitiesToSynchronize.add("postmeta");
        }

        if (wasModified(modifiedFiles, "comments")) {
            entitiesToSynchronize.add("comment");
            entitiesToSynchronize.add("post"); // comment_count lives on the post row
        }

        if (wasModified(modifiedFiles, "users.ini")) {
            entitiesToSynchronize.add("user");
            entitiesToSynchronize.add("usermeta");
        }

        if (wasModified(modifiedFiles, "terms.ini")) {
            entitiesToSynchronize.add("term");
            entitiesToSynchronize.add("term_taxonomy");
        }

        if (wasModified(modifiedFiles, "options.ini")) {
            entitiesToSynchronize.add("option");
        }

        return entitiesToSynchronize;
    }

    /**
     * Ids of posts whose file sits directly in a {@code posts/<dir>/} directory.
     * Other paths are ignored.
     */
    public List<String> getAffectedPosts(List<String> modifiedFiles) {
        List<String> posts = new ArrayList<>();
        for (String file : modifiedFiles) {
            Matcher matcher = POST_FILE.matcher(file);
            if (matcher.find()) {
                posts.add(matcher.group(1));
            }
        }
        return posts;
    }

    private static boolean wasModified(List<String> modifiedFiles, String pathPart) {
        return modifiedFiles.stream().anyMatch(file -> file.contains(pathPart));
    }
}
