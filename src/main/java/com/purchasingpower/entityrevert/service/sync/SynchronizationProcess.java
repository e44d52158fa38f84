package com.purchasingpower.entityrevert.service.sync;

import java.util.List;

/**
 * Pushes the file-store state of the given entity types into the relational mirror.
 *
 * Must be idempotent and accept duplicates or a superset of the types that changed.
 */
public interface SynchronizationProcess {

    void synchronize(List<String> entityNames);
}
