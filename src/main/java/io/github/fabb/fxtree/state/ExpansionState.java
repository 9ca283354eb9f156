package io.github.fabb.fxtree.state;

import io.github.fabb.fxtree.common.data.StableId;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-session expansion and chain-selection state, keyed by stable identity.
 *
 * <p>The two maps are independent and no entry is derived from another: changing one rack's
 * entry never reads or writes any other rack's, nested or not. Entries are never evicted
 * automatically; the owner calls {@link #forget(StableId)} for identities that stopped resolving.
 */
public class ExpansionState {
    private final Map<StableId, Boolean> expanded = new HashMap<>();
    private final Map<StableId, StableId> selectedChains = new HashMap<>();

    public void setExpanded(StableId id, boolean isExpanded) {
        expanded.put(id, isExpanded);
    }

    /**
     * @return the stored flag; nodes never touched are collapsed
     */
    public boolean isExpanded(StableId id) {
        return expanded.getOrDefault(id, Boolean.FALSE);
    }

    public void toggleExpanded(StableId id) {
        setExpanded(id, !isExpanded(id));
    }

    public void setSelectedChain(StableId rackId, StableId chainId) {
        if (chainId == null) {
            selectedChains.remove(rackId);
        } else {
            selectedChains.put(rackId, chainId);
        }
    }

    public Optional<StableId> getSelectedChain(StableId rackId) {
        return Optional.ofNullable(selectedChains.get(rackId));
    }

    public void clearSelectedChain(StableId rackId) {
        selectedChains.remove(rackId);
    }

    /**
     * Drops every entry keyed by {@code id}, and selections pointing at it.
     *
     * @return true if anything was removed
     */
    public boolean forget(StableId id) {
        boolean removed = expanded.remove(id) != null;
        removed |= selectedChains.remove(id) != null;
        removed |= selectedChains.values().removeIf(id::equals);
        return removed;
    }

    /**
     * Every identity the state currently refers to, as key or selected chain.
     */
    public Set<StableId> trackedIds() {
        Set<StableId> ids = new HashSet<>(expanded.keySet());
        ids.addAll(selectedChains.keySet());
        ids.addAll(selectedChains.values());
        return ids;
    }

    public void clear() {
        expanded.clear();
        selectedChains.clear();
    }
}
