package io.github.fabb.fxtree.naming;

import io.github.fabb.fxtree.common.data.NodeKind;

/**
 * Role encoded by a structured display name, one per row of the naming grammar.
 */
public enum ComponentRole {
    MIXER(NodeKind.MIXER),
    DEVICE_UTILITY(NodeKind.PLAIN),
    DEVICE_MODULATOR(NodeKind.PLAIN),
    DEVICE_FX(NodeKind.PLAIN),
    DEVICE(NodeKind.DEVICE),
    CHAIN(NodeKind.CHAIN),
    RACK(NodeKind.RACK);

    private final NodeKind kind;

    ComponentRole(NodeKind kind) {
        this.kind = kind;
    }

    /**
     * Node kind of a name with this role. Device sub-parts are plain plugins.
     */
    public NodeKind kind() {
        return kind;
    }

    public boolean isDeviceSubPart() {
        return this == DEVICE_FX || this == DEVICE_UTILITY || this == DEVICE_MODULATOR;
    }
}
