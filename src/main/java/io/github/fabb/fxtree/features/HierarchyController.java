package io.github.fabb.fxtree.features;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.fabb.fxtree.classify.IntegrityChecker;
import io.github.fabb.fxtree.classify.IntegrityReport;
import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.hierarchy.HierarchyMutator;
import io.github.fabb.fxtree.hierarchy.RenumberScope;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.state.ExpansionState;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Controller for the hierarchy features.
 * Bridges UI and automation collaborators to the mutator, keeping expansion and selection
 * state in step with what each operation created or removed.
 */
public class HierarchyController {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final HierarchyMutator mutator;
    private final HandleResolver resolver;
    private final IntegrityChecker integrityChecker;
    private final ExpansionState expansionState;
    private final Logger logger;
    private int lastFlatCount = -1;

    /**
     * Creates a new HierarchyController instance.
     *
     * @param mutator          The mutator performing structural edits
     * @param resolver         The resolver for read-only queries
     * @param integrityChecker The checker behind {@link #verifyIntegrity()}
     * @param expansionState   The session's expansion and selection state
     * @param logger           The logger for logging operations
     */
    public HierarchyController(HierarchyMutator mutator, HandleResolver resolver, IntegrityChecker integrityChecker,
                               ExpansionState expansionState, Logger logger) {
        this.mutator = mutator;
        this.resolver = resolver;
        this.integrityChecker = integrityChecker;
        this.expansionState = expansionState;
        this.logger = logger;
    }

    public ExpansionState getExpansionState() {
        return expansionState;
    }

    /**
     * Adds a rack at track level and expands it.
     */
    public Optional<FxNode> addRack(int position) {
        return call("addRack", () -> {
            Optional<FxNode> rack = mutator.addRackToTrack(position);
            rack.ifPresent(r -> expansionState.setExpanded(r.stableId(), true));
            return rack;
        });
    }

    /**
     * Appends a rack to a chain and expands it.
     */
    public Optional<FxNode> addRackToChain(StableId chainId) {
        return call("addRackToChain", () -> {
            Optional<FxNode> rack = mutator.addRackToChain(chainId);
            rack.ifPresent(r -> expansionState.setExpanded(r.stableId(), true));
            return rack;
        });
    }

    /**
     * Adds a chain, optionally with a first device, then expands the rack and selects the chain.
     *
     * @param plugin First device's plugin, or null for an empty chain
     */
    public Optional<FxNode> addChain(StableId rackId, String plugin) {
        return call("addChain", () -> {
            Optional<FxNode> chain = mutator.addChainToRack(rackId, Optional.ofNullable(plugin));
            chain.ifPresent(c -> showChain(rackId, c.stableId()));
            return chain;
        });
    }

    /**
     * Appends a device to a chain, then expands the owning rack and selects the chain.
     */
    public Optional<FxNode> addDeviceToChain(StableId chainId, String plugin) {
        return call("addDeviceToChain", () -> {
            Optional<FxNode> device = mutator.addDeviceToChain(chainId, plugin);
            if (device.isPresent()) {
                resolver.describe(chainId)
                    .map(FxNode::parentId)
                    .ifPresent(rackId -> showChain(rackId, chainId));
            }
            return device;
        });
    }

    public Optional<FxNode> addDeviceToTrack(String plugin, int position) {
        return call("addDeviceToTrack", () -> mutator.addDeviceToTrack(plugin, position));
    }

    /**
     * Nests a rack in a rack. The outer rack is expanded with the auto chain selected, and the
     * inner rack is expanded too.
     */
    public Optional<FxNode> addNestedRack(StableId parentRackId) {
        return call("addNestedRack", () -> {
            Optional<FxNode> inner = mutator.addNestedRackToRack(parentRackId);
            inner.ifPresent(rack -> {
                if (rack.parentId() != null) {
                    showChain(parentRackId, rack.parentId());
                }
                expansionState.setExpanded(rack.stableId(), true);
            });
            return inner;
        });
    }

    /**
     * Dissolves a chain into devices and drops state held for the chain, and for its rack if
     * that was deleted as well.
     */
    public List<FxNode> convertChainToDevices(StableId chainId) {
        return call("convertChainToDevices", () -> {
            StableId rackId = resolver.describe(chainId).map(FxNode::parentId).orElse(null);
            List<FxNode> devices = mutator.convertChainToDevices(chainId);
            if (!resolver.exists(chainId)) {
                expansionState.forget(chainId);
            }
            if (rackId != null && !resolver.exists(rackId)) {
                expansionState.forget(rackId);
            }
            return devices;
        });
    }

    /**
     * Wraps a standalone device in a rack, expands the rack and selects its chain.
     */
    public Optional<FxNode> convertDeviceToRack(StableId deviceId) {
        return call("convertDeviceToRack", () -> {
            Optional<FxNode> rack = mutator.convertDeviceToRack(deviceId);
            rack.ifPresent(r -> resolver.children(r.stableId()).stream()
                .filter(child -> child.kind() == NodeKind.CHAIN)
                .findFirst()
                .ifPresent(chain -> showChain(r.stableId(), chain.stableId())));
            return rack;
        });
    }

    public int renumber(RenumberScope scope) {
        return call("renumber", () -> mutator.renumber(scope));
    }

    public boolean reorderChain(StableId rackId, StableId chainId, StableId beforeChainId) {
        return call("reorderChain", () -> mutator.reorderChainInRack(rackId, chainId, beforeChainId));
    }

    /**
     * Moves a chain to another rack; the chain stays selected, now in the target rack.
     */
    public boolean moveChain(StableId sourceRackId, StableId targetRackId, StableId chainId, StableId beforeChainId) {
        return call("moveChain", () -> {
            boolean moved = mutator.moveChainBetweenRacks(sourceRackId, targetRackId, chainId, beforeChainId);
            if (moved) {
                if (expansionState.getSelectedChain(sourceRackId).filter(chainId::equals).isPresent()) {
                    expansionState.clearSelectedChain(sourceRackId);
                }
                showChain(targetRackId, chainId);
            }
            return moved;
        });
    }

    public boolean delete(StableId id) {
        return call("delete", () -> {
            boolean deleted = mutator.delete(id);
            if (deleted) {
                expansionState.forget(id);
            }
            return deleted;
        });
    }

    /**
     * Checks the host's flat effect count and prunes stale state when it changed.
     * Meant to be called once per frame.
     *
     * @return number of state entries dropped
     */
    public int poll() {
        return call("poll", () -> {
            int count = resolver.getHost().flatCount();
            if (count == lastFlatCount) {
                return 0;
            }
            logger.debug("HierarchyController: Effect count changed from " + lastFlatCount + " to " + count);
            lastFlatCount = count;
            return pruneExpansionState();
        });
    }

    /**
     * Drops expansion and selection entries whose identities no longer resolve.
     *
     * @return number of identities dropped
     */
    public int pruneExpansionState() {
        Set<StableId> live = new HashSet<>();
        for (FxNode node : resolver.flatten()) {
            live.add(node.stableId());
        }
        int pruned = 0;
        for (StableId id : expansionState.trackedIds()) {
            if (!live.contains(id) && expansionState.forget(id)) {
                pruned++;
            }
        }
        if (pruned > 0) {
            logger.info("HierarchyController: Pruned state for " + pruned + " vanished node(s)");
        }
        return pruned;
    }

    public IntegrityReport verifyIntegrity() {
        return call("verifyIntegrity", integrityChecker::verify);
    }

    /**
     * Renders the whole track as nested maps: {@code stable_id}, {@code name}, {@code kind},
     * {@code path}, {@code expanded}, {@code children}.
     */
    public List<Map<String, Object>> describeTree() {
        return call("describeTree", () -> {
            List<FxNode> nodes = resolver.flatten();
            Map<StableId, List<Map<String, Object>>> childrenOf = new LinkedHashMap<>();
            List<Map<String, Object>> roots = new ArrayList<>();
            for (FxNode node : nodes) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("stable_id", node.stableId().value());
                entry.put("name", node.displayName());
                entry.put("kind", node.kind().name().toLowerCase());
                entry.put("path", node.path() != null ? node.path().prefix() : null);
                entry.put("expanded", expansionState.isExpanded(node.stableId()));
                List<Map<String, Object>> children = new ArrayList<>();
                entry.put("children", children);
                childrenOf.put(node.stableId(), children);

                if (node.parentId() == null || !childrenOf.containsKey(node.parentId())) {
                    roots.add(entry);
                } else {
                    childrenOf.get(node.parentId()).add(entry);
                }
            }
            return roots;
        });
    }

    /**
     * {@link #describeTree()} as indented JSON.
     */
    public String exportTreeJson() {
        List<Map<String, Object>> tree = describeTree();
        try {
            return OBJECT_MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            logger.error("HierarchyController: Failed to serialize tree: " + e.getMessage());
            throw new HierarchyException(ErrorCode.INTERNAL_ERROR, "exportTreeJson", e.getMessage(), e);
        }
    }

    private void showChain(StableId rackId, StableId chainId) {
        expansionState.setExpanded(rackId, true);
        expansionState.setSelectedChain(rackId, chainId);
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (HierarchyException e) {
            logger.error("HierarchyController: Error in " + operation + ": " + e.getMessage());
            throw e; // Re-throw HierarchyException as-is
        } catch (Exception e) {
            logger.error("HierarchyController: Unexpected error in " + operation + ": " + e.getMessage());
            throw new HierarchyException(ErrorCode.INTERNAL_ERROR, operation, e.getMessage(), e);
        }
    }
}
