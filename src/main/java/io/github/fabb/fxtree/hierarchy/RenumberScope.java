package io.github.fabb.fxtree.hierarchy;

import io.github.fabb.fxtree.common.data.StableId;

import java.util.Objects;

/**
 * Sibling set a renumbering pass rewrites.
 */
public record RenumberScope(
    Level level,
    StableId containerId // Nullable - null for TRACK_ROOT
) {

    public enum Level {
        /** Standalone devices at track level. */
        TRACK_ROOT,
        /** Devices inside one chain. */
        CHAIN_DEVICES,
        /** Chains inside one rack, cascading into their devices. */
        RACK_CHAINS
    }

    public RenumberScope {
        Objects.requireNonNull(level, "level");
        if (level != Level.TRACK_ROOT && containerId == null) {
            throw new IllegalArgumentException(level + " needs a container id");
        }
    }

    public static RenumberScope trackRoot() {
        return new RenumberScope(Level.TRACK_ROOT, null);
    }

    public static RenumberScope chainDevices(StableId chainId) {
        return new RenumberScope(Level.CHAIN_DEVICES, chainId);
    }

    public static RenumberScope rackChains(StableId rackId) {
        return new RenumberScope(Level.RACK_CHAINS, rackId);
    }
}
