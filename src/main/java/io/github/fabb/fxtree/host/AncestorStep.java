package io.github.fabb.fxtree.host;

import io.github.fabb.fxtree.common.data.StableId;

/**
 * One level of an ancestor walk: a node and its 0-based position in its parent's child list
 * (or in the track's top-level list).
 */
public record AncestorStep(StableId stableId, int positionInParent) {
}
