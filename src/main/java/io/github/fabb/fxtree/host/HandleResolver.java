package io.github.fabb.fxtree.host;

import io.github.fabb.fxtree.classify.ContainerClassifier;
import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.HierarchyPath;
import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.config.ConfigManager;
import io.github.fabb.fxtree.naming.NamingCodec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Re-acquires fresh host handles from stable identities and reconstructs ancestry.
 *
 * <p>Contract: after any call that changes the host's container tree, every handle obtained
 * before that call, for the edited subtree and every subtree containing it, is discarded.
 * Callers re-resolve by {@link StableId} before their next host call. Nothing in this class
 * caches a handle between calls.
 *
 * <p>Reads that hit inconsistent host data right after a write are retried
 * up to {@link ConfigManager#getResolveRetries()} times within the same call.
 */
public class HandleResolver {
    private final EffectHost host;
    private final ConfigManager configManager;
    private final ContainerClassifier classifier;
    private final Logger logger;

    /**
     * Creates a new HandleResolver instance.
     *
     * @param host          The host effect list
     * @param configManager Source of retry and depth limits
     * @param classifier    Classifier used to derive node kinds for views
     * @param logger        The logger for logging operations
     */
    public HandleResolver(EffectHost host, ConfigManager configManager, ContainerClassifier classifier, Logger logger) {
        this.host = host;
        this.configManager = configManager;
        this.classifier = classifier;
        this.logger = logger;
    }

    public EffectHost getHost() {
        return host;
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    /**
     * Finds the current handle of a node anywhere on the track.
     *
     * @param id The node's stable identity
     * @return a fresh handle, or empty if the node no longer exists
     */
    public Optional<FxHandle> resolve(StableId id) {
        return resolve(id, null);
    }

    /**
     * Finds the current handle of a node below a search root.
     *
     * @param id         The node's stable identity
     * @param searchRoot Subtree to search (the root itself included), or null for the whole track
     * @return a fresh handle, or empty if the node (or the search root) no longer exists
     */
    public Optional<FxHandle> resolve(StableId id, StableId searchRoot) {
        if (id == null) {
            return Optional.empty();
        }
        int attempts = configManager.getResolveRetries() + 1;
        HostAccessException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return scan(id, searchRoot);
            } catch (HostAccessException e) {
                lastFailure = e;
                logger.debug("HandleResolver: Read failed while resolving " + id
                    + " (attempt " + attempt + "/" + attempts + "): " + e.getMessage());
            }
        }
        logger.warn("HandleResolver: Giving up resolving " + id + " after " + attempts
            + " attempts: " + lastFailure.getMessage());
        return Optional.empty();
    }

    public boolean exists(StableId id) {
        return resolve(id).isPresent();
    }

    private Optional<FxHandle> scan(StableId id, StableId searchRoot) {
        Deque<FxHandle> pending = new ArrayDeque<>();
        if (searchRoot == null) {
            int count = host.topLevelCount();
            for (int i = count - 1; i >= 0; i--) {
                pending.push(host.topLevelAt(i));
            }
        } else {
            Optional<FxHandle> root = scan(searchRoot, null);
            if (root.isEmpty()) {
                return Optional.empty();
            }
            pending.push(root.get());
        }

        Set<StableId> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            FxHandle current = pending.pop();
            StableId currentId = host.stableIdOf(current);
            if (!visited.add(currentId)) {
                continue;
            }
            if (currentId.equals(id)) {
                return Optional.of(current);
            }
            if (host.isContainer(current)) {
                int childCount = host.childCount(current);
                for (int i = childCount - 1; i >= 0; i--) {
                    pending.push(host.childAt(current, i));
                }
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Ancestry
    // ------------------------------------------------------------------

    /**
     * Walks parent links outward from a handle to the track root.
     * The first entry is the node itself, the last one its top-level ancestor.
     * Always derived fresh; the handle must come from the current batch.
     *
     * @param handle A handle obtained since the last structural edit
     * @return the ancestor path, innermost first
     */
    public List<AncestorStep> ancestorPath(FxHandle handle) {
        return withReadRetry("ancestorPath", () -> walkAncestors(handle));
    }

    /**
     * Resolves a node and walks its ancestors in one batch.
     *
     * @return the ancestor path, innermost first, or empty if the node no longer exists
     */
    public Optional<List<AncestorStep>> ancestorPath(StableId id) {
        return resolve(id).map(this::ancestorPath);
    }

    private List<AncestorStep> walkAncestors(FxHandle handle) {
        List<AncestorStep> steps = new ArrayList<>();
        Set<StableId> seen = new HashSet<>();
        FxHandle current = handle;
        while (current != null) {
            StableId currentId = host.stableIdOf(current);
            if (!seen.add(currentId)) {
                throw new HierarchyException(ErrorCode.INTEGRITY_VIOLATION, "ancestorPath",
                    "Circular parent chain at " + currentId, Map.of("stable_id", currentId.value()));
            }
            if (steps.size() > configManager.getMaxNestingDepth()) {
                throw new HierarchyException(ErrorCode.INTEGRITY_VIOLATION, "ancestorPath",
                    "Ancestor chain deeper than " + configManager.getMaxNestingDepth(),
                    Map.of("stable_id", currentId.value()));
            }
            Optional<FxHandle> parent = host.parentOf(current);
            steps.add(new AncestorStep(currentId, positionIn(parent.orElse(null), currentId)));
            current = parent.orElse(null);
        }
        return steps;
    }

    private int positionIn(FxHandle parent, StableId childId) {
        int count = parent == null ? host.topLevelCount() : host.childCount(parent);
        for (int i = 0; i < count; i++) {
            FxHandle sibling = parent == null ? host.topLevelAt(i) : host.childAt(parent, i);
            if (childId.equals(host.stableIdOf(sibling))) {
                return i;
            }
        }
        return -1;
    }

    // ------------------------------------------------------------------
    // Views
    // ------------------------------------------------------------------

    /**
     * Captures a view of a node by stable identity.
     *
     * @return the view, or empty if the node no longer exists
     */
    public Optional<FxNode> describe(StableId id) {
        Optional<FxHandle> handle = resolve(id);
        if (handle.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(view(handle.get()));
        } catch (HostAccessException e) {
            // Handle went stale between resolve and read; resolve again once
            logger.debug("HandleResolver: Re-resolving " + id + " after stale read: " + e.getMessage());
            return resolve(id).map(this::view);
        }
    }

    /**
     * Builds a view from a handle of the current batch. Kind is derived top-down along the ancestry.
     */
    public FxNode view(FxHandle handle) {
        List<FxHandle> lineage = new ArrayList<>();
        FxHandle current = handle;
        while (current != null && lineage.size() <= configManager.getMaxNestingDepth()) {
            lineage.add(current);
            current = host.parentOf(current).orElse(null);
        }
        Collections.reverse(lineage);

        NodeKind parentKind = null;
        StableId parentId = null;
        for (int i = 0; i < lineage.size() - 1; i++) {
            FxHandle ancestor = lineage.get(i);
            parentKind = classifier.classifyInContext(host.nameOf(ancestor), host.isContainer(ancestor), parentKind);
            parentId = host.stableIdOf(ancestor);
        }
        FxHandle parentHandle = lineage.size() > 1 ? lineage.get(lineage.size() - 2) : null;
        StableId id = host.stableIdOf(handle);
        return view(handle, parentId, parentKind, positionIn(parentHandle, id));
    }

    private FxNode view(FxHandle handle, StableId parentId, NodeKind parentKind, int position) {
        String name = host.nameOf(handle);
        boolean container = host.isContainer(handle);
        NodeKind kind = classifier.classifyInContext(name, container, parentKind);
        HierarchyPath path = NamingCodec.decode(name).orElse(null);
        int childCount = container ? host.childCount(handle) : 0;
        return new FxNode(host.stableIdOf(handle), name, kind, path, container, parentId, position, childCount);
    }

    /**
     * Views of the track's top-level nodes, in order.
     */
    public List<FxNode> topLevel() {
        return withReadRetry("topLevel", () -> {
            List<FxNode> nodes = new ArrayList<>();
            int count = host.topLevelCount();
            for (int i = 0; i < count; i++) {
                nodes.add(view(host.topLevelAt(i), null, null, i));
            }
            return nodes;
        });
    }

    /**
     * Views of a container's children, in order.
     *
     * @return the children, or an empty list if the container no longer exists
     */
    public List<FxNode> children(StableId containerId) {
        for (int attempt = 0; attempt <= configManager.getResolveRetries(); attempt++) {
            Optional<FxHandle> container = resolve(containerId);
            if (container.isEmpty()) {
                return List.of();
            }
            try {
                return childViews(container.get());
            } catch (HostAccessException e) {
                logger.debug("HandleResolver: Retrying children of " + containerId + ": " + e.getMessage());
            }
        }
        throw new HierarchyException(ErrorCode.HOST_READ_FAILED, "children",
            "Could not read children of " + containerId);
    }

    private List<FxNode> childViews(FxHandle container) {
        FxNode parent = view(container);
        if (!parent.container()) {
            return List.of();
        }
        List<FxNode> nodes = new ArrayList<>();
        int count = host.childCount(container);
        for (int i = 0; i < count; i++) {
            nodes.add(view(host.childAt(container, i), parent.stableId(), parent.kind(), i));
        }
        return nodes;
    }

    /**
     * Depth-first, pre-order view of the whole track.
     */
    public List<FxNode> flatten() {
        return withReadRetry("flatten", () -> {
            List<FxNode> nodes = new ArrayList<>();
            Set<StableId> visited = new HashSet<>();
            int count = host.topLevelCount();
            for (int i = 0; i < count; i++) {
                collect(host.topLevelAt(i), null, null, i, nodes, visited);
            }
            return nodes;
        });
    }

    private void collect(FxHandle handle, StableId parentId, NodeKind parentKind, int position,
                         List<FxNode> out, Set<StableId> visited) {
        FxNode node = view(handle, parentId, parentKind, position);
        if (!visited.add(node.stableId())) {
            return;
        }
        out.add(node);
        if (node.container()) {
            for (int i = 0; i < node.childCount(); i++) {
                collect(host.childAt(handle, i), node.stableId(), node.kind(), i, out, visited);
            }
        }
    }

    /**
     * First node in depth-first order whose display name satisfies the predicate.
     */
    public Optional<FxNode> findFirstByName(Predicate<String> namePredicate) {
        return flatten().stream().filter(node -> namePredicate.test(node.displayName())).findFirst();
    }

    /**
     * Display names of every node on the track.
     */
    public List<String> allNames() {
        List<String> names = new ArrayList<>();
        for (FxNode node : flatten()) {
            names.add(node.displayName());
        }
        return names;
    }

    private <T> T withReadRetry(String operation, Supplier<T> read) {
        int attempts = configManager.getResolveRetries() + 1;
        HostAccessException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return read.get();
            } catch (HostAccessException e) {
                lastFailure = e;
                logger.debug("HandleResolver: " + operation + " read failed (attempt " + attempt + "/" + attempts
                    + "): " + e.getMessage());
            }
        }
        throw new HierarchyException(ErrorCode.HOST_READ_FAILED, operation,
            "Host read failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
    }
}
