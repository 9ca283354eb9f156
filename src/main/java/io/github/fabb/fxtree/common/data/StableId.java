package io.github.fabb.fxtree.common.data;

import java.util.Objects;

/**
 * Host-assigned identity of one effect node (GUID-equivalent).
 * Survives reordering, sibling edits and parent restructuring, but not deletion of the node itself.
 */
public record StableId(String value) {

    public StableId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("StableId must not be blank");
        }
    }

    public static StableId of(String value) {
        return new StableId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
