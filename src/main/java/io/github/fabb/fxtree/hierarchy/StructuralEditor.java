package io.github.fabb.fxtree.hierarchy;

import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.host.AncestorStep;
import io.github.fabb.fxtree.host.EffectHost;
import io.github.fabb.fxtree.host.FxHandle;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.host.HostAccessException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-step host edits addressed by stable identity.
 * Every method resolves the handles it needs immediately before its host call
 * and holds none of them afterwards.
 */
class StructuralEditor {
    private final HandleResolver resolver;
    private final EffectHost host;
    private final Logger logger;

    StructuralEditor(HandleResolver resolver, Logger logger) {
        this.resolver = resolver;
        this.host = resolver.getHost();
        this.logger = logger;
    }

    FxNode require(StableId id, String step) {
        return resolver.describe(id).orElseThrow(() -> new NodeVanishedException(id, step));
    }

    FxHandle handle(StableId id, String step) {
        return resolver.resolve(id).orElseThrow(() -> new NodeVanishedException(id, step));
    }

    int clampTopLevel(int position) {
        int count = host.topLevelCount();
        return position < 0 || position > count ? count : position;
    }

    /**
     * Creates an empty named container.
     *
     * @param parentId Container to place it in, or null for the track root
     * @param position Position among the parent's children
     * @return identity of the new container
     */
    StableId createContainer(String operation, String name, StableId parentId, int position) {
        int createAt = parentId == null ? clampTopLevel(position) : host.topLevelCount();
        Optional<FxHandle> created = host.addContainer(createAt);
        if (created.isEmpty()) {
            throw new HierarchyException(ErrorCode.CONTAINER_CREATE_FAILED, operation,
                "Host refused to create container '" + name + "'", details("name", name));
        }
        StableId id = host.stableIdOf(created.get());
        host.rename(created.get(), name);
        logger.debug("StructuralEditor: Created container '" + name + "' (" + id + ")");
        if (parentId != null) {
            moveInto(operation, id, parentId, position);
        }
        return id;
    }

    /**
     * Adds a host plugin and names it.
     *
     * @param parentId Container to place it in, or null for the track root
     * @return identity of the new plugin
     * @throws HierarchyException CONTAINER_CREATE_FAILED if the host refuses the plugin
     */
    StableId createPlugin(String operation, String pluginName, String name, StableId parentId, int position) {
        return tryCreatePlugin(operation, pluginName, name, parentId, position)
            .orElseThrow(() -> new HierarchyException(ErrorCode.CONTAINER_CREATE_FAILED, operation,
                "Host refused to add plugin '" + pluginName + "'", details("plugin", pluginName)));
    }

    Optional<StableId> tryCreatePlugin(String operation, String pluginName, String name, StableId parentId, int position) {
        int createAt = parentId == null ? clampTopLevel(position) : host.topLevelCount();
        Optional<FxHandle> created = host.addPlugin(pluginName, createAt);
        if (created.isEmpty()) {
            return Optional.empty();
        }
        StableId id = host.stableIdOf(created.get());
        host.rename(created.get(), name);
        logger.debug("StructuralEditor: Added plugin '" + pluginName + "' as '" + name + "' (" + id + ")");
        if (parentId != null) {
            moveInto(operation, id, parentId, position);
        }
        return Optional.of(id);
    }

    /**
     * Moves a node into a container and confirms it landed there.
     *
     * @throws HierarchyException CHILD_MOVE_FAILED if the host refuses, or the node ends up elsewhere
     */
    void moveInto(String operation, StableId childId, StableId containerId, int position) {
        FxHandle container = handle(containerId, "move target");
        FxHandle child = handle(childId, "move source");
        int count = host.childCount(container);
        int target = position < 0 || position > count ? count : position;
        boolean moved;
        try {
            moved = host.moveIntoContainer(child, container, target);
        } catch (HostAccessException e) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Host rejected move of " + childId + " into " + containerId + ": " + e.getMessage(),
                details("child", childId.value(), "container", containerId.value()), e);
        }
        if (!moved) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Host refused to move " + childId + " into " + containerId,
                details("child", childId.value(), "container", containerId.value()));
        }
        StableId landedIn = require(childId, "after move").parentId();
        if (!containerId.equals(landedIn)) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Node " + childId + " landed in " + landedIn + " instead of " + containerId,
                details("child", childId.value(), "container", containerId.value(),
                    "actual_parent", landedIn != null ? landedIn.value() : null));
        }
    }

    void moveToTopLevel(String operation, StableId id, int position) {
        FxHandle fx = handle(id, "move to track");
        boolean moved;
        try {
            moved = host.moveToTopLevel(fx, clampTopLevel(position));
        } catch (HostAccessException e) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Host rejected move of " + id + " to the track: " + e.getMessage(), details("child", id.value()), e);
        }
        if (!moved) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Host refused to move " + id + " to the track", details("child", id.value()));
        }
        FxNode landed = require(id, "after move to track");
        if (!landed.isTopLevel()) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Node " + id + " is still inside " + landed.parentId(), details("child", id.value()));
        }
    }

    boolean rename(StableId id, String name) {
        FxHandle fx = handle(id, "rename");
        if (name.equals(host.nameOf(fx))) {
            return false;
        }
        if (!host.rename(fx, name)) {
            logger.warn("StructuralEditor: Host refused to rename " + id + " to '" + name + "'");
            return false;
        }
        logger.debug("StructuralEditor: Renamed " + id + " to '" + name + "'");
        return true;
    }

    void delete(String operation, StableId id) {
        FxHandle fx = handle(id, "delete");
        if (!host.delete(fx)) {
            throw new HierarchyException(ErrorCode.DELETE_FAILED, operation,
                "Host refused to delete " + id, details("stable_id", id.value()));
        }
        if (resolver.resolve(id).isPresent()) {
            throw new HierarchyException(ErrorCode.DELETE_FAILED, operation,
                "Node " + id + " still present after delete", details("stable_id", id.value()));
        }
        logger.debug("StructuralEditor: Deleted " + id);
    }

    /**
     * Ancestors of a node, innermost first, the node itself excluded.
     */
    List<StableId> lineage(StableId id) {
        List<AncestorStep> steps = resolver.ancestorPath(id)
            .orElseThrow(() -> new NodeVanishedException(id, "lineage"));
        List<StableId> ancestors = new ArrayList<>();
        for (int i = 1; i < steps.size(); i++) {
            ancestors.add(steps.get(i).stableId());
        }
        return ancestors;
    }

    /**
     * Re-resolves a node and checks its ancestors are exactly the expected ones.
     *
     * @throws HierarchyException CHILD_MOVE_FAILED when the node popped out to a different ancestor
     */
    void verifyLineage(String operation, StableId id, List<StableId> expected) {
        List<StableId> actual = lineage(id);
        if (!actual.equals(expected)) {
            throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, operation,
                "Node " + id + " has ancestors " + actual + ", expected " + expected,
                details("stable_id", id.value(), "expected", expected.toString(), "actual", actual.toString()));
        }
    }

    /**
     * Checks a node sits directly in {@code parentId}, which itself still has {@code parentLineage}.
     */
    void verifyPlacement(String operation, StableId id, StableId parentId, List<StableId> parentLineage) {
        List<StableId> expected = new ArrayList<>();
        expected.add(parentId);
        expected.addAll(parentLineage);
        verifyLineage(operation, id, expected);
    }

    static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
