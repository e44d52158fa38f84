package com.purchasingpower.entityrevert.model.changeinfo;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Ordered list of tracked changes made by one commit.
 *
 * Serialized as a subject line followed by one {@code VP-Action} trailer per entry:
 * <pre>
 * Edited post ab12cd34
 *
 * VP-Action: post/edit/ab12cd34
 * VP-Action: postmeta/create/99ff00aa/ab12cd34
 * </pre>
 */
@ToString
@EqualsAndHashCode
public final class CompositeChangeInfo implements ChangeInfo {

    private final List<TrackedChangeInfo> entries;

    public CompositeChangeInfo(List<? extends TrackedChangeInfo> entries) {
        Preconditions.checkNotNull(entries, "Entries cannot be null");
        Preconditions.checkArgument(!entries.isEmpty(), "A tracked change needs at least one entry");
        this.entries = List.copyOf(entries);
    }

    public static CompositeChangeInfo of(TrackedChangeInfo... entries) {
        return new CompositeChangeInfo(List.of(entries));
    }

    @Override
    public ChangeInfoKind getKind() {
        return ChangeInfoKind.TRACKED;
    }

    public List<TrackedChangeInfo> getEntries() {
        return entries;
    }

    /**
     * Entity entries only, in commit order.
     */
    public List<EntityChangeInfo> getEntityChanges() {
        return entries.stream()
                .filter(EntityChangeInfo.class::isInstance)
                .map(EntityChangeInfo.class::cast)
                .toList();
    }

    @Override
    public String getCommitMessage() {
        StringBuilder message = new StringBuilder(entries.get(0).getDescription());
        if (entries.size() > 1) {
            message.append(" (+").append(entries.size() - 1).append(" more)");
        }
        message.append("\n\n");
        for (TrackedChangeInfo entry : entries) {
            message.append(ACTION_TRAILER).append(": ").append(entry.getActionTag()).append('\n');
        }
        return message.toString();
    }
}
