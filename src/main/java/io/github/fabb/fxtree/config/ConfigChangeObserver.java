package io.github.fabb.fxtree.config;

/**
 * Observer notified when a runtime-adjustable hierarchy limit changes.
 */
public interface ConfigChangeObserver {

    /**
     * Called when the integrity depth ceiling changes.
     *
     * @param oldDepth The previous ceiling
     * @param newDepth The new ceiling
     */
    void onMaxNestingDepthChanged(int oldDepth, int newDepth);

    /**
     * Called when the per-rack chain limit changes.
     *
     * @param oldLimit The previous limit
     * @param newLimit The new limit
     */
    void onMaxChainsPerRackChanged(int oldLimit, int newLimit);
}
