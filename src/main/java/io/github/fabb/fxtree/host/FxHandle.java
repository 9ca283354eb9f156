package io.github.fabb.fxtree.host;

/**
 * Transient host reference to one effect node.
 * Valid for one batch of host calls only: any structural edit may invalidate it,
 * silently or with a {@link HostAccessException}. Never keep one across a mutation;
 * re-derive it from the node's StableId through {@link HandleResolver}.
 *
 * @param address    Host-specific address (flat index or encoded container address)
 * @param generation Host edit generation the address was issued in
 */
public record FxHandle(int address, long generation) {

    @Override
    public String toString() {
        return String.format("FxHandle[0x%X@%d]", address, generation);
    }
}
