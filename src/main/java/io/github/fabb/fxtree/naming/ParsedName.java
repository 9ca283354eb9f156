package io.github.fabb.fxtree.naming;

import io.github.fabb.fxtree.common.data.HierarchyPath;

/**
 * Result of decoding a structured display name.
 */
public record ParsedName(
    ComponentRole role,
    HierarchyPath path,
    Integer modulatorIdx,   // Nullable - only for DEVICE_MODULATOR
    String label            // Nullable - absent for mixers, utilities and unlabelled chains
) {
}
