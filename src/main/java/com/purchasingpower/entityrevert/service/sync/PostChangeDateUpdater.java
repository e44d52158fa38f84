package com.purchasingpower.entityrevert.service.sync;

import java.util.List;

/**
 * Stamps the modification date of mirrored posts.
 */
public interface PostChangeDateUpdater {

    /**
     * Sets local and GMT modification time of every listed post to now.
     *
     * @param vpIds file-store ids of the posts
     */
    void updateChangeDateForPosts(List<String> vpIds);
}
