package com.purchasingpower.entityrevert.service.changeinfo;

import com.purchasingpower.entityrevert.model.changeinfo.ChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.CompositeChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.EntityChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.RevertChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.TrackedChangeInfo;
import com.purchasingpower.entityrevert.model.changeinfo.UntrackedChangeInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses commit messages back into {@link ChangeInfo}.
 *
 * Only {@code VP-Action} trailers are read. A message without any valid trailer
 * is untracked.
 */
@Slf4j
public final class ChangeInfoMatcher {

    private static final Pattern ACTION_LINE =
            Pattern.compile("^" + ChangeInfo.ACTION_TRAILER + ":\\s*(\\S+)\\s*$", Pattern.MULTILINE);

    private ChangeInfoMatcher() {
    }

    public static ChangeInfo buildChangeInfo(String commitMessage) {
        if (commitMessage == null) {
            return new UntrackedChangeInfo("");
        }

        List<TrackedChangeInfo> entries = new ArrayList<>();
        Matcher matcher = ACTION_LINE.matcher(commitMessage);
        while (matcher.find()) {
            TrackedChangeInfo entry = parseActionTag(matcher.group(1));
            if (entry != null) {
                entries.add(entry);
            }
        }

        if (entries.isEmpty()) {
            return new UntrackedChangeInfo(commitMessage);
        }
        return new CompositeChangeInfo(entries);
    }

    private static TrackedChangeInfo parseActionTag(String tag) {
        String[] parts = tag.split("/");
        if (parts.length < 3 || parts.length > 4 || Arrays.stream(parts).anyMatch(String::isEmpty)) {
            log.warn("Skipping malformed {} trailer: {}", ChangeInfo.ACTION_TRAILER, tag);
            return null;
        }

        if (RevertChangeInfo.SCOPE.equals(parts[0])) {
            RevertChangeInfo.RevertAction action = RevertChangeInfo.RevertAction.fromTag(parts[1]);
            if (action == null || parts.length != 3) {
                log.warn("Skipping unknown revert trailer: {}", tag);
                return null;
            }
            return new RevertChangeInfo(action, parts[2]);
        }

        String parentId = parts.length == 4 ? parts[3] : null;
        return new EntityChangeInfo(parts[0], parts[1], parts[2], parentId);
    }
}
