package io.github.fabb.fxtree.hierarchy;

import io.github.fabb.fxtree.common.data.StableId;

/**
 * A node needed by a running operation no longer resolves.
 * Never escapes {@link HierarchyMutator}: the operation aborts and returns its empty result.
 */
class NodeVanishedException extends RuntimeException {
    private final StableId stableId;

    NodeVanishedException(StableId stableId, String step) {
        super("Node " + stableId + " no longer resolves (" + step + ")", null, false, false);
        this.stableId = stableId;
    }

    StableId getStableId() {
        return stableId;
    }
}
