package io.github.fabb.fxtree.host;

import io.github.fabb.fxtree.common.data.StableId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory effect host for tests.
 *
 * <p>Top-level effects are addressed by their index. Nested effects use an encoded address,
 * {@code 0x2000000 + (i0+1) + (i1+1)*M0 + (i2+1)*M0*M1 ...}, where {@code M0} is the top-level
 * count plus one and {@code Mj} the child count of the j-th container on the path plus one.
 * Every structural edit bumps the generation. In strict mode reading a handle from an older
 * generation throws; in lenient mode the address is silently decoded against the current tree,
 * which may name a different effect than the one it was issued for.
 */
public class SimulatedEffectHost implements EffectHost {
    static final int NESTED_BASE = 0x2000000;

    private static final class Node {
        final StableId guid;
        String name;
        final boolean container;
        Node parent;
        final List<Node> children = new ArrayList<>();

        Node(StableId guid, String name, boolean container) {
            this.guid = guid;
            this.name = name;
            this.container = container;
        }
    }

    private final List<Node> topLevel = new ArrayList<>();
    private final List<String> consoleLines = new ArrayList<>();
    private final List<String> undoLabels = new ArrayList<>();
    private final Set<String> refusedPlugins = new HashSet<>();
    private final Map<StableId, StableId> reportedParentOverrides = new HashMap<>();
    private long generation;
    private int guidCounter;
    private boolean strict = true;
    private boolean refuseContainers;
    private boolean refuseMoves;
    private int failingReads;
    private int openUndoBlocks;
    private int structuralEdits;

    // ------------------------------------------------------------------
    // Test controls
    // ------------------------------------------------------------------

    public SimulatedEffectHost strict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public long getGeneration() {
        return generation;
    }

    public int getStructuralEdits() {
        return structuralEdits;
    }

    public void refuseContainers(boolean refuse) {
        this.refuseContainers = refuse;
    }

    public void refusePlugin(String pluginName) {
        refusedPlugins.add(pluginName);
    }

    public void refuseMoves(boolean refuse) {
        this.refuseMoves = refuse;
    }

    /**
     * Makes the next {@code count} read calls fail with a transient error.
     */
    public void failNextReads(int count) {
        this.failingReads = count;
    }

    /**
     * Makes {@link #parentOf(FxHandle)} report a wrong parent for one effect.
     */
    public void overrideReportedParent(StableId child, StableId reportedParent) {
        reportedParentOverrides.put(child, reportedParent);
    }

    public List<String> getConsoleLines() {
        return Collections.unmodifiableList(consoleLines);
    }

    public List<String> getUndoLabels() {
        return Collections.unmodifiableList(undoLabels);
    }

    public int getOpenUndoBlocks() {
        return openUndoBlocks;
    }

    // ------------------------------------------------------------------
    // Seeding and inspection by identity
    // ------------------------------------------------------------------

    public StableId seedContainer(String name, StableId parent) {
        return seed(name, true, parent);
    }

    public StableId seedPlugin(String name, StableId parent) {
        return seed(name, false, parent);
    }

    private StableId seed(String name, boolean container, StableId parentId) {
        Node node = new Node(nextGuid(), name, container);
        if (parentId == null) {
            topLevel.add(node);
        } else {
            Node parent = find(parentId).orElseThrow(() -> new IllegalArgumentException("No node " + parentId));
            parent.children.add(node);
            node.parent = parent;
        }
        bump();
        return node.guid;
    }

    public boolean contains(StableId id) {
        return find(id).isPresent();
    }

    public Optional<StableId> findByName(String name) {
        for (Node node : allNodes()) {
            if (node.name.equals(name)) {
                return Optional.of(node.guid);
            }
        }
        return Optional.empty();
    }

    public String nameOf(StableId id) {
        return require(id).name;
    }

    /**
     * Actual parent, or null for top-level effects.
     */
    public StableId actualParentOf(StableId id) {
        Node parent = require(id).parent;
        return parent == null ? null : parent.guid;
    }

    public List<String> childNames(StableId id) {
        List<String> names = new ArrayList<>();
        for (Node child : require(id).children) {
            names.add(child.name);
        }
        return names;
    }

    public List<String> topLevelNames() {
        List<String> names = new ArrayList<>();
        for (Node node : topLevel) {
            names.add(node.name);
        }
        return names;
    }

    public List<String> allNames() {
        List<String> names = new ArrayList<>();
        for (Node node : allNodes()) {
            names.add(node.name);
        }
        return names;
    }

    /**
     * A handle for the current generation.
     */
    public FxHandle handleFor(StableId id) {
        return handleOf(require(id));
    }

    // ------------------------------------------------------------------
    // EffectHost reads
    // ------------------------------------------------------------------

    @Override
    public int topLevelCount() {
        read();
        return topLevel.size();
    }

    @Override
    public FxHandle topLevelAt(int index) {
        read();
        if (index < 0 || index >= topLevel.size()) {
            throw new HostAccessException("Top-level index out of range: " + index);
        }
        return new FxHandle(index, generation);
    }

    @Override
    public int flatCount() {
        read();
        return allNodes().size();
    }

    @Override
    public StableId stableIdOf(FxHandle fx) {
        return node(fx).guid;
    }

    @Override
    public String nameOf(FxHandle fx) {
        return node(fx).name;
    }

    @Override
    public boolean isContainer(FxHandle fx) {
        return node(fx).container;
    }

    @Override
    public Optional<FxHandle> parentOf(FxHandle fx) {
        Node node = node(fx);
        StableId override = reportedParentOverrides.get(node.guid);
        if (override != null) {
            return Optional.of(handleOf(require(override)));
        }
        return node.parent == null ? Optional.empty() : Optional.of(handleOf(node.parent));
    }

    @Override
    public int childCount(FxHandle container) {
        return node(container).children.size();
    }

    @Override
    public FxHandle childAt(FxHandle container, int index) {
        Node parent = node(container);
        if (index < 0 || index >= parent.children.size()) {
            throw new HostAccessException("Child index out of range: " + index);
        }
        return handleOf(parent.children.get(index));
    }

    // ------------------------------------------------------------------
    // EffectHost writes
    // ------------------------------------------------------------------

    @Override
    public boolean rename(FxHandle fx, String name) {
        node(fx).name = name;
        return true;
    }

    @Override
    public Optional<FxHandle> addContainer(int position) {
        if (refuseContainers) {
            return Optional.empty();
        }
        Node node = new Node(nextGuid(), "Container", true);
        insert(topLevel, node, position);
        node.parent = null;
        bump();
        return Optional.of(handleOf(node));
    }

    @Override
    public Optional<FxHandle> addPlugin(String pluginName, int position) {
        if (refusedPlugins.contains(pluginName)) {
            return Optional.empty();
        }
        Node node = new Node(nextGuid(), pluginName, false);
        insert(topLevel, node, position);
        bump();
        return Optional.of(handleOf(node));
    }

    @Override
    public boolean moveIntoContainer(FxHandle child, FxHandle container, int position) {
        if (refuseMoves) {
            return false;
        }
        Node target = node(container);
        Node moving = node(child);
        if (!target.container || isSelfOrAncestor(moving, target)) {
            return false;
        }
        detach(moving);
        insert(target.children, moving, position);
        moving.parent = target;
        bump();
        return true;
    }

    @Override
    public boolean moveToTopLevel(FxHandle fx, int position) {
        if (refuseMoves) {
            return false;
        }
        Node moving = node(fx);
        detach(moving);
        insert(topLevel, moving, position);
        moving.parent = null;
        bump();
        return true;
    }

    @Override
    public boolean delete(FxHandle fx) {
        Node node = node(fx);
        detach(node);
        bump();
        return true;
    }

    @Override
    public void beginUndoBlock() {
        openUndoBlocks++;
    }

    @Override
    public void endUndoBlock(String description) {
        openUndoBlocks--;
        undoLabels.add(description);
    }

    @Override
    public void println(String line) {
        consoleLines.add(line);
    }

    // ------------------------------------------------------------------
    // Addressing
    // ------------------------------------------------------------------

    private FxHandle handleOf(Node node) {
        List<Integer> indices = new ArrayList<>();
        Node current = node;
        while (current.parent != null) {
            indices.add(0, current.parent.children.indexOf(current));
            current = current.parent;
        }
        int topIndex = topLevel.indexOf(current);
        if (topIndex < 0) {
            throw new HostAccessException("Effect " + node.guid + " is not on the track");
        }
        if (indices.isEmpty()) {
            return new FxHandle(topIndex, generation);
        }
        long address = topIndex + 1L;
        long multiplier = topLevel.size() + 1L;
        Node level = current;
        for (int index : indices) {
            address += (index + 1L) * multiplier;
            multiplier *= level.children.size() + 1L;
            level = level.children.get(index);
        }
        return new FxHandle(Math.toIntExact(NESTED_BASE + address), generation);
    }

    private Node decode(int address) {
        if (address < NESTED_BASE) {
            if (address < 0 || address >= topLevel.size()) {
                throw new HostAccessException("No top-level effect at " + address);
            }
            return topLevel.get(address);
        }
        long remaining = (long) address - NESTED_BASE;
        long radix = topLevel.size() + 1L;
        int digit = (int) (remaining % radix);
        remaining /= radix;
        if (digit == 0 || digit > topLevel.size()) {
            throw new HostAccessException(String.format("Invalid address 0x%X", address));
        }
        Node current = topLevel.get(digit - 1);
        while (remaining > 0) {
            radix = current.children.size() + 1L;
            digit = (int) (remaining % radix);
            remaining /= radix;
            if (!current.container || digit == 0 || digit > current.children.size()) {
                throw new HostAccessException(String.format("Invalid address 0x%X", address));
            }
            current = current.children.get(digit - 1);
        }
        return current;
    }

    private Node node(FxHandle fx) {
        read();
        if (fx == null) {
            throw new HostAccessException("Null handle");
        }
        if (strict && fx.generation() != generation) {
            throw new HostAccessException("Stale handle " + fx + ", current generation " + generation);
        }
        return decode(fx.address());
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void read() {
        if (failingReads > 0) {
            failingReads--;
            throw new HostAccessException("Transient read failure");
        }
    }

    private void bump() {
        generation++;
        structuralEdits++;
    }

    private StableId nextGuid() {
        guidCounter++;
        return StableId.of(String.format("{00000000-0000-0000-0000-%012d}", guidCounter));
    }

    private void detach(Node node) {
        if (node.parent != null) {
            node.parent.children.remove(node);
        } else {
            topLevel.remove(node);
        }
    }

    private static void insert(List<Node> list, Node node, int position) {
        if (position < 0 || position > list.size()) {
            list.add(node);
        } else {
            list.add(position, node);
        }
    }

    private static boolean isSelfOrAncestor(Node candidate, Node node) {
        Node current = node;
        while (current != null) {
            if (current == candidate) {
                return true;
            }
            current = current.parent;
        }
        return false;
    }

    private Optional<Node> find(StableId id) {
        for (Node node : allNodes()) {
            if (node.guid.equals(id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private Node require(StableId id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("No effect " + id));
    }

    private List<Node> allNodes() {
        List<Node> nodes = new ArrayList<>();
        for (Node node : topLevel) {
            collect(node, nodes);
        }
        return nodes;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children) {
            collect(child, out);
        }
    }
}
