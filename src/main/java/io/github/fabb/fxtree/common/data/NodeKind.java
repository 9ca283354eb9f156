package io.github.fabb.fxtree.common.data;

/**
 * Logical kind of a node. Always derived from the display name and structural context, never stored.
 */
public enum NodeKind {
    RACK,
    CHAIN,
    DEVICE,
    MIXER,
    PLAIN
}
