package io.github.fabb.fxtree.common.data;

/**
 * Position of a node in the logical tree: {@code (rackIdx, chainIdx, deviceIdx)}.
 * A field is only set if all shallower fields are set, except for standalone devices
 * which carry a device index alone.
 */
public record HierarchyPath(
    Integer rackIdx,    // Nullable
    Integer chainIdx,   // Nullable
    Integer deviceIdx   // Nullable
) {

    /** Largest index a name can carry. */
    public static final int MAX_INDEX = 999_999_999;

    public HierarchyPath {
        requireIndex(rackIdx, "rackIdx");
        requireIndex(chainIdx, "chainIdx");
        requireIndex(deviceIdx, "deviceIdx");
        if (chainIdx != null && rackIdx == null) {
            throw new IllegalArgumentException("chainIdx requires rackIdx");
        }
        if (deviceIdx != null && rackIdx != null && chainIdx == null) {
            throw new IllegalArgumentException("deviceIdx inside a rack requires chainIdx");
        }
        if (rackIdx == null && deviceIdx == null) {
            throw new IllegalArgumentException("path must set rackIdx or deviceIdx");
        }
    }

    public static HierarchyPath rack(int rackIdx) {
        return new HierarchyPath(rackIdx, null, null);
    }

    public static HierarchyPath chain(int rackIdx, int chainIdx) {
        return new HierarchyPath(rackIdx, chainIdx, null);
    }

    public static HierarchyPath device(int rackIdx, int chainIdx, int deviceIdx) {
        return new HierarchyPath(rackIdx, chainIdx, deviceIdx);
    }

    public static HierarchyPath standaloneDevice(int deviceIdx) {
        return new HierarchyPath(null, null, deviceIdx);
    }

    public boolean isRackPath() {
        return rackIdx != null && chainIdx == null;
    }

    public boolean isChainPath() {
        return chainIdx != null && deviceIdx == null;
    }

    public boolean isDevicePath() {
        return deviceIdx != null;
    }

    public boolean isStandalone() {
        return rackIdx == null;
    }

    /**
     * Returns the path with the device index replaced or appended.
     * Only valid on chain paths, device paths and standalone device paths.
     */
    public HierarchyPath withDevice(int newDeviceIdx) {
        if (rackIdx == null) {
            return standaloneDevice(newDeviceIdx);
        }
        return device(rackIdx, chainIdx, newDeviceIdx);
    }

    /**
     * Structural prefix without label, e.g. {@code R1_C2_D3} or {@code D4}.
     */
    public String prefix() {
        StringBuilder prefix = new StringBuilder();
        if (rackIdx != null) {
            prefix.append('R').append(rackIdx);
            if (chainIdx != null) {
                prefix.append("_C").append(chainIdx);
            }
            if (deviceIdx != null) {
                prefix.append("_D").append(deviceIdx);
            }
        } else {
            prefix.append('D').append(deviceIdx);
        }
        return prefix.toString();
    }

    @Override
    public String toString() {
        return prefix();
    }

    private static void requireIndex(Integer value, String field) {
        if (value != null && (value < 1 || value > MAX_INDEX)) {
            throw new IllegalArgumentException(field + " must be between 1 and " + MAX_INDEX + ": " + value);
        }
    }
}
