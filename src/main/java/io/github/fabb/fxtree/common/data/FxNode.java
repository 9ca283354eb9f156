package io.github.fabb.fxtree.common.data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Short-lived view of one node, captured in a single batch of host reads.
 * Holds no host handle; re-query by {@link #stableId()} after any structural edit.
 */
public record FxNode(
    StableId stableId,
    String displayName,
    NodeKind kind,
    HierarchyPath path,         // Nullable - null when the name carries no path
    boolean container,
    StableId parentId,          // Nullable - null for top-level nodes
    int positionInParent,
    int childCount
) {

    public boolean isTopLevel() {
        return parentId == null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stable_id", stableId.value());
        result.put("name", displayName);
        result.put("kind", kind.name().toLowerCase());
        result.put("path", path != null ? path.prefix() : null);
        result.put("is_container", container);
        result.put("parent_id", parentId != null ? parentId.value() : null);
        result.put("position", positionInParent);
        result.put("child_count", childCount);
        return result;
    }
}
