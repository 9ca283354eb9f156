package io.github.fabb.fxtree.hierarchy;

import io.github.fabb.fxtree.classify.IntegrityChecker;
import io.github.fabb.fxtree.classify.IntegrityReport;
import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.HierarchyPath;
import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.common.logging.StructuredLogger;
import io.github.fabb.fxtree.config.ConfigManager;
import io.github.fabb.fxtree.host.EffectHost;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.host.HostAccessException;
import io.github.fabb.fxtree.naming.NamingCodec;
import io.github.fabb.fxtree.naming.ParsedName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Creates, moves, wraps and flattens racks, chains and devices.
 *
 * <p>Every operation follows the same skeleton: capture the stable identities it needs,
 * perform one host edit, re-resolve every identity still needed, validate, repeat.
 * No host handle survives a structural edit.
 *
 * <p>Failure semantics:
 * <ul>
 *   <li>A node that stops resolving aborts the operation, which returns its empty result.</li>
 *   <li>A node of the wrong kind is a no-op with the empty result.</li>
 *   <li>A host refusal throws {@link HierarchyException}. Edits already committed stay committed.</li>
 * </ul>
 * Each operation runs inside one host undo block.
 */
public class HierarchyMutator {
    private final HandleResolver resolver;
    private final IntegrityChecker integrityChecker;
    private final ConfigManager configManager;
    private final Logger logger;
    private final StructuredLogger structuredLogger;
    private final StructuralEditor editor;
    private final DeviceAssembler assembler;

    /**
     * Creates a new HierarchyMutator instance.
     *
     * @param resolver         Resolver for the track's host
     * @param integrityChecker Checker used for the defensive pre-check
     * @param configManager    Limits and host plugin names
     * @param logger           The logger for logging operations
     */
    public HierarchyMutator(HandleResolver resolver, IntegrityChecker integrityChecker,
                            ConfigManager configManager, Logger logger) {
        this.resolver = resolver;
        this.integrityChecker = integrityChecker;
        this.configManager = configManager;
        this.logger = logger;
        this.structuredLogger = new StructuredLogger(logger, "HierarchyMutator");
        this.editor = new StructuralEditor(resolver, logger);
        this.assembler = new DeviceAssembler(editor, resolver, configManager, logger);
    }

    // ------------------------------------------------------------------
    // Racks
    // ------------------------------------------------------------------

    /**
     * Adds a rack, with its mixer, at track level.
     *
     * @param position Track-level position, or -1 to append
     * @return the new rack
     */
    public Optional<FxNode> addRackToTrack(int position) {
        String op = "addRackToTrack";
        return execute(op, "Add Rack", StructuralEditor.details("position", position), Optional.empty(), () -> {
            StableId rackId = buildRack(op, null, editor.clampTopLevel(position));
            return resolver.describe(rackId);
        });
    }

    /**
     * Appends a rack to a chain, after the chain's existing children.
     *
     * @param chainId The chain
     * @return the new rack, or empty if the chain is gone or is not a chain
     */
    public Optional<FxNode> addRackToChain(StableId chainId) {
        String op = "addRackToChain";
        return execute(op, "Add Rack to Chain", StructuralEditor.details("chain", chainId), Optional.empty(), () -> {
            FxNode chain = editor.require(chainId, "chain");
            if (chain.kind() != NodeKind.CHAIN) {
                return wrongKind(op, chain, NodeKind.CHAIN, Optional.empty());
            }
            List<StableId> chainLineage = editor.lineage(chainId);
            List<StableId> existing = childIds(chainId);

            StableId rackId = buildRack(op, chainId, existing.size());

            editor.verifyLineage(op, chainId, chainLineage);
            editor.verifyPlacement(op, rackId, chainId, chainLineage);
            List<StableId> after = childIds(chainId);
            after.remove(rackId);
            if (!after.equals(existing)) {
                throw new HierarchyException(ErrorCode.CHILD_MOVE_FAILED, op,
                    "Children of chain " + chainId + " changed while adding a rack",
                    StructuralEditor.details("expected", existing.toString(), "actual", after.toString()));
            }
            return resolver.describe(rackId);
        });
    }

    /**
     * Nests a new rack inside a rack, wrapped in a newly created chain.
     *
     * @param parentRackId The outer rack
     * @return the inner rack, or empty if the outer rack is gone or is not a rack
     */
    public Optional<FxNode> addNestedRackToRack(StableId parentRackId) {
        String op = "addNestedRackToRack";
        return execute(op, "Add Nested Rack", StructuralEditor.details("rack", parentRackId), Optional.empty(), () -> {
            FxNode parentRack = editor.require(parentRackId, "parent rack");
            if (parentRack.kind() != NodeKind.RACK) {
                return wrongKind(op, parentRack, NodeKind.RACK, Optional.empty());
            }
            List<StableId> rackLineage = editor.lineage(parentRackId);

            StableId chainId = buildChain(op, parentRack);
            editor.verifyPlacement(op, chainId, parentRackId, rackLineage);

            StableId innerRackId = buildRack(op, chainId, 0);

            // Outer rack, auto chain and inner rack all re-resolved after the deepest edit
            List<StableId> chainLineage = prepend(parentRackId, rackLineage);
            editor.verifyLineage(op, parentRackId, rackLineage);
            editor.verifyLineage(op, chainId, chainLineage);
            editor.verifyPlacement(op, innerRackId, chainId, chainLineage);
            return resolver.describe(innerRackId);
        });
    }

    private StableId buildRack(String op, StableId parentChainId, int position) {
        int rackIdx = requireFreeIndex(op, "rack",
            NamingCodec.nextFreeIndex(resolver.allNames(), parsed -> parsed.path().rackIdx()), 1);
        HierarchyPath rackPath = HierarchyPath.rack(rackIdx);
        StableId rackId = editor.createContainer(op,
            NamingCodec.encode(rackPath, NodeKind.RACK, configManager.getDefaultRackLabel()), parentChainId, position);
        editor.createPlugin(op, configManager.getMixerPluginName(),
            NamingCodec.encode(rackPath, NodeKind.MIXER, null), rackId, 0);
        logger.info("HierarchyMutator: Built rack " + rackPath + (parentChainId != null ? " in " + parentChainId : ""));
        return rackId;
    }

    // ------------------------------------------------------------------
    // Chains
    // ------------------------------------------------------------------

    /**
     * Adds a chain to a rack, just before the rack's mixer.
     *
     * @param rackId The rack
     * @param plugin Plugin to add as the chain's first device, if any
     * @return the new chain, or empty if the rack is gone or is not a rack
     * @throws HierarchyException CHAIN_LIMIT_EXCEEDED when the rack is full
     */
    public Optional<FxNode> addChainToRack(StableId rackId, Optional<String> plugin) {
        String op = "addChainToRack";
        Map<String, Object> params = StructuralEditor.details("rack", rackId, "plugin", plugin.orElse(null));
        return execute(op, "Add Chain", params, Optional.empty(), () -> {
            FxNode rack = editor.require(rackId, "rack");
            if (rack.kind() != NodeKind.RACK) {
                return wrongKind(op, rack, NodeKind.RACK, Optional.empty());
            }
            List<StableId> rackLineage = editor.lineage(rackId);

            StableId chainId = buildChain(op, rack);
            editor.verifyPlacement(op, chainId, rackId, rackLineage);

            if (plugin.isPresent()) {
                FxNode chain = editor.require(chainId, "new chain");
                HierarchyPath devicePath = HierarchyPath.device(chain.path().rackIdx(), chain.path().chainIdx(), 1);
                StableId deviceId = assembler.assemble(op, plugin.get(), devicePath, chainId, 0);
                List<StableId> chainLineage = prepend(rackId, rackLineage);
                editor.verifyLineage(op, chainId, chainLineage);
                editor.verifyPlacement(op, deviceId, chainId, chainLineage);
            }
            return resolver.describe(chainId);
        });
    }

    public Optional<FxNode> addChainToRack(StableId rackId) {
        return addChainToRack(rackId, Optional.empty());
    }

    private StableId buildChain(String op, FxNode rack) {
        List<FxNode> children = resolver.children(rack.stableId());
        int chainIdx = NamingCodec.nextFreeIndex(namesOfKind(children, NodeKind.CHAIN), parsed -> parsed.path().chainIdx());
        int limit = configManager.getMaxChainsPerRack();
        requireFreeIndex(op, "chain", chainIdx, 1);
        if (chainIdx > limit) {
            throw new HierarchyException(ErrorCode.CHAIN_LIMIT_EXCEEDED, op,
                "Rack " + rack.displayName() + " cannot take chain " + chainIdx + " (limit " + limit + ")",
                StructuralEditor.details("rack", rack.stableId().value(), "limit", limit));
        }
        HierarchyPath chainPath = HierarchyPath.chain(rack.path().rackIdx(), chainIdx);
        StableId chainId = editor.createContainer(op, NamingCodec.encode(chainPath, NodeKind.CHAIN, null),
            rack.stableId(), mixerPosition(children));
        logger.info("HierarchyMutator: Built chain " + chainPath);
        return chainId;
    }

    /**
     * Moves a chain before another chain of the same rack and renumbers the rack's chains.
     *
     * @param rackId        The rack
     * @param chainId       The chain to move
     * @param beforeChainId Chain to move before, or null to move to the end
     * @return true if the chain is now in place
     */
    public boolean reorderChainInRack(StableId rackId, StableId chainId, StableId beforeChainId) {
        String op = "reorderChainInRack";
        Map<String, Object> params = StructuralEditor.details("rack", rackId, "chain", chainId, "before", beforeChainId);
        return execute(op, "Reorder Chain", params, Boolean.FALSE, () -> {
            FxNode rack = editor.require(rackId, "rack");
            FxNode chain = editor.require(chainId, "chain");
            if (rack.kind() != NodeKind.RACK || chain.kind() != NodeKind.CHAIN || !rackId.equals(chain.parentId())) {
                logger.warn("HierarchyMutator: " + chain.displayName() + " is not a chain of " + rack.displayName());
                return Boolean.FALSE;
            }
            List<FxNode> children = resolver.children(rackId);
            int chainPos = chain.positionInParent();
            int dest = destinationBefore(children, beforeChainId);
            if (dest > chainPos) {
                dest--;
            }
            if (dest == chainPos) {
                return Boolean.TRUE;
            }
            List<StableId> rackLineage = editor.lineage(rackId);
            editor.moveToTopLevel(op, chainId, -1);
            editor.moveInto(op, chainId, rackId, dest);
            editor.verifyLineage(op, rackId, rackLineage);
            renumberChains(editor.require(rackId, "renumber"));
            return Boolean.TRUE;
        });
    }

    /**
     * Moves a chain from one rack to another and renumbers both racks' chains.
     *
     * @param sourceRackId  The rack currently holding the chain
     * @param targetRackId  The rack to move the chain into
     * @param chainId       The chain
     * @param beforeChainId Target-rack chain to move before, or null to append before the mixer
     * @return true if the chain moved
     * @throws HierarchyException CHAIN_LIMIT_EXCEEDED when the target rack is full
     */
    public boolean moveChainBetweenRacks(StableId sourceRackId, StableId targetRackId,
                                         StableId chainId, StableId beforeChainId) {
        String op = "moveChainBetweenRacks";
        Map<String, Object> params = StructuralEditor.details("source", sourceRackId, "target", targetRackId,
            "chain", chainId, "before", beforeChainId);
        return execute(op, "Move Chain", params, Boolean.FALSE, () -> {
            FxNode source = editor.require(sourceRackId, "source rack");
            FxNode target = editor.require(targetRackId, "target rack");
            FxNode chain = editor.require(chainId, "chain");
            if (source.kind() != NodeKind.RACK || target.kind() != NodeKind.RACK
                || chain.kind() != NodeKind.CHAIN || !sourceRackId.equals(chain.parentId())) {
                logger.warn("HierarchyMutator: Cannot move " + chain.displayName() + " from "
                    + source.displayName() + " to " + target.displayName());
                return Boolean.FALSE;
            }
            if (sourceRackId.equals(targetRackId)) {
                return Boolean.FALSE;
            }
            List<StableId> targetLineage = editor.lineage(targetRackId);
            if (targetLineage.contains(chainId)) {
                logger.warn("HierarchyMutator: Rack " + target.displayName() + " is nested inside " + chain.displayName());
                return Boolean.FALSE;
            }
            List<FxNode> targetChildren = resolver.children(targetRackId);
            int limit = configManager.getMaxChainsPerRack();
            if (namesOfKind(targetChildren, NodeKind.CHAIN).size() >= limit) {
                throw new HierarchyException(ErrorCode.CHAIN_LIMIT_EXCEEDED, op,
                    "Rack " + target.displayName() + " already holds " + limit + " chains",
                    StructuralEditor.details("rack", targetRackId.value(), "limit", limit));
            }
            int dest = destinationBefore(targetChildren, beforeChainId);
            List<StableId> sourceLineage = editor.lineage(sourceRackId);

            editor.moveToTopLevel(op, chainId, -1);
            editor.moveInto(op, chainId, targetRackId, dest);

            editor.verifyLineage(op, targetRackId, targetLineage);
            editor.verifyLineage(op, sourceRackId, sourceLineage);
            renumberChains(editor.require(targetRackId, "renumber target"));
            renumberChains(editor.require(sourceRackId, "renumber source"));
            return Boolean.TRUE;
        });
    }

    private static int destinationBefore(List<FxNode> rackChildren, StableId beforeChainId) {
        if (beforeChainId != null) {
            for (FxNode child : rackChildren) {
                if (child.stableId().equals(beforeChainId) && child.kind() == NodeKind.CHAIN) {
                    return child.positionInParent();
                }
            }
        }
        return mixerPosition(rackChildren);
    }

    private static int mixerPosition(List<FxNode> rackChildren) {
        for (FxNode child : rackChildren) {
            if (child.kind() == NodeKind.MIXER) {
                return child.positionInParent();
            }
        }
        return rackChildren.size();
    }

    // ------------------------------------------------------------------
    // Devices
    // ------------------------------------------------------------------

    /**
     * Appends a device wrapping {@code plugin} to a chain.
     *
     * @return the new device, or empty if the chain is gone or is not a chain
     * @throws HierarchyException CONTAINER_CREATE_FAILED if the host refuses the plugin
     */
    public Optional<FxNode> addDeviceToChain(StableId chainId, String plugin) {
        String op = "addDeviceToChain";
        return execute(op, "Add Device", StructuralEditor.details("chain", chainId, "plugin", plugin), Optional.empty(), () -> {
            FxNode chain = editor.require(chainId, "chain");
            if (chain.kind() != NodeKind.CHAIN) {
                return wrongKind(op, chain, NodeKind.CHAIN, Optional.empty());
            }
            List<StableId> chainLineage = editor.lineage(chainId);
            List<FxNode> children = resolver.children(chainId);
            int deviceIdx = requireFreeIndex(op, "device",
                NamingCodec.nextFreeIndex(namesOfKind(children, NodeKind.DEVICE), parsed -> parsed.path().deviceIdx()), 1);
            HierarchyPath devicePath = HierarchyPath.device(chain.path().rackIdx(), chain.path().chainIdx(), deviceIdx);

            StableId deviceId = assembler.assemble(op, plugin, devicePath, chainId, children.size());

            editor.verifyLineage(op, chainId, chainLineage);
            editor.verifyPlacement(op, deviceId, chainId, chainLineage);
            return resolver.describe(deviceId);
        });
    }

    /**
     * Adds a standalone device wrapping {@code plugin} at track level.
     *
     * @param position Track-level position, or -1 to append
     * @return the new device
     */
    public Optional<FxNode> addDeviceToTrack(String plugin, int position) {
        String op = "addDeviceToTrack";
        return execute(op, "Add Device", StructuralEditor.details("plugin", plugin, "position", position), Optional.empty(), () -> {
            int deviceIdx = requireFreeIndex(op, "device", NamingCodec.nextFreeIndex(
                standaloneDeviceNames(resolver.topLevel()), parsed -> parsed.path().deviceIdx()), 1);
            StableId deviceId = assembler.assemble(op, plugin, HierarchyPath.standaloneDevice(deviceIdx), null,
                editor.clampTopLevel(position));
            return resolver.describe(deviceId);
        });
    }

    // ------------------------------------------------------------------
    // Conversions
    // ------------------------------------------------------------------

    /**
     * Dissolves a chain: its children move, in order, to the level where the chain's rack sits
     * (the track root, or the outer chain of a nested rack), taking the rack's place.
     * Devices are renamed for their new level; nested racks keep their names.
     * The chain is deleted, and so is its rack if only the mixer remains.
     * An empty chain is simply deleted and its rack left in place.
     *
     * @param chainId The chain
     * @return the extracted devices in order; empty, with no host edit, if the node is not a chain
     */
    public List<FxNode> convertChainToDevices(StableId chainId) {
        String op = "convertChainToDevices";
        return execute(op, "Convert Chain to Devices", StructuralEditor.details("chain", chainId), List.of(), () -> {
            FxNode chain = editor.require(chainId, "chain");
            if (chain.kind() != NodeKind.CHAIN) {
                return wrongKind(op, chain, NodeKind.CHAIN, List.<FxNode>of());
            }
            FxNode rack = chain.parentId() == null ? null : editor.require(chain.parentId(), "rack");
            StableId destinationId;
            int insertAt;
            if (rack != null && rack.kind() == NodeKind.RACK) {
                destinationId = rack.parentId();
                insertAt = rack.positionInParent();
            } else {
                destinationId = chain.parentId();
                insertAt = chain.positionInParent();
            }

            List<FxNode> children = resolver.children(chainId);
            if (children.isEmpty()) {
                logger.info("HierarchyMutator: Deleting empty chain " + chain.displayName());
                editor.delete(op, chainId);
                return List.<FxNode>of();
            }
            List<StableId> destinationLineage = destinationId == null ? List.of() : editor.lineage(destinationId);
            IntFunction<HierarchyPath> pathAtDestination = devicePathFactory(op, destinationId);
            int nextDeviceIdx = destinationId == null
                ? NamingCodec.nextFreeIndex(standaloneDeviceNames(resolver.topLevel()), parsed -> parsed.path().deviceIdx())
                : NamingCodec.nextFreeIndex(namesOfKind(resolver.children(destinationId), NodeKind.DEVICE),
                    parsed -> parsed.path().deviceIdx());
            requireFreeIndex(op, "device", nextDeviceIdx, countOfKind(children, NodeKind.DEVICE));

            List<StableId> extracted = new ArrayList<>();
            int position = insertAt;
            for (FxNode child : children) {
                if (destinationId == null) {
                    editor.moveToTopLevel(op, child.stableId(), position);
                } else {
                    editor.moveInto(op, child.stableId(), destinationId, position);
                }
                position++;
                if (child.kind() == NodeKind.DEVICE) {
                    assembler.renameTree(child.stableId(), pathAtDestination.apply(nextDeviceIdx++));
                    extracted.add(child.stableId());
                }
            }

            editor.delete(op, chainId);
            if (rack != null && rack.kind() == NodeKind.RACK) {
                deleteRackIfOnlyMixerRemains(op, rack.stableId());
            }
            if (destinationId != null) {
                editor.verifyLineage(op, destinationId, destinationLineage);
            }
            logger.info("HierarchyMutator: Extracted " + extracted.size() + " device(s) from " + chain.displayName());
            return extracted.stream()
                .map(resolver::describe)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        });
    }

    private IntFunction<HierarchyPath> devicePathFactory(String op, StableId destinationId) {
        if (destinationId == null) {
            return HierarchyPath::standaloneDevice;
        }
        FxNode destination = editor.require(destinationId, "destination");
        if (destination.kind() != NodeKind.CHAIN) {
            throw new HierarchyException(ErrorCode.INTEGRITY_VIOLATION, op,
                "Rack sits in " + destination.displayName() + ", which is not a chain",
                StructuralEditor.details("stable_id", destinationId.value()));
        }
        int rackIdx = destination.path().rackIdx();
        int chainIdx = destination.path().chainIdx();
        return deviceIdx -> HierarchyPath.device(rackIdx, chainIdx, deviceIdx);
    }

    private void deleteRackIfOnlyMixerRemains(String op, StableId rackId) {
        List<FxNode> remaining = resolver.children(rackId);
        boolean onlyMixer = remaining.stream().allMatch(child -> child.kind() == NodeKind.MIXER);
        if (remaining.size() <= 1 && onlyMixer) {
            logger.info("HierarchyMutator: Deleting rack " + rackId + " left with no chains");
            editor.delete(op, rackId);
        }
    }

    /**
     * Wraps a standalone device in a new rack at the device's position: rack, one chain,
     * and the device as the chain's first device, renamed {@code R<n>_C1_D1}.
     *
     * @param deviceId A top-level device
     * @return the new rack, or empty without any host edit if the node is not a standalone device
     */
    public Optional<FxNode> convertDeviceToRack(StableId deviceId) {
        String op = "convertDeviceToRack";
        return execute(op, "Convert Device to Rack", StructuralEditor.details("device", deviceId), Optional.empty(), () -> {
            FxNode device = editor.require(deviceId, "device");
            if (device.kind() != NodeKind.DEVICE || !device.isTopLevel() || !device.path().isStandalone()) {
                return wrongKind(op, device, NodeKind.DEVICE, Optional.empty());
            }

            StableId rackId = buildRack(op, null, device.positionInParent());
            FxNode rack = editor.require(rackId, "new rack");
            StableId chainId = buildChain(op, rack);
            editor.moveInto(op, deviceId, chainId, 0);

            FxNode chain = editor.require(chainId, "new chain");
            assembler.renameTree(deviceId, HierarchyPath.device(rack.path().rackIdx(), chain.path().chainIdx(), 1));

            editor.verifyPlacement(op, chainId, rackId, List.of());
            editor.verifyPlacement(op, deviceId, chainId, List.of(rackId));
            return resolver.describe(rackId);
        });
    }

    // ------------------------------------------------------------------
    // Renumbering
    // ------------------------------------------------------------------

    /**
     * Rewrites the indices of a sibling set to be contiguous from 1, in host order.
     * Rack-named containers are never relabelled and do not take a slot.
     *
     * @return number of nodes renamed; 0 when the scope's container is gone or of the wrong kind
     */
    public int renumber(RenumberScope scope) {
        String op = "renumber";
        Map<String, Object> params = StructuralEditor.details("level", scope.level(), "container", scope.containerId());
        return execute(op, "Renumber", params, 0, () -> {
            switch (scope.level()) {
                case TRACK_ROOT:
                    return renumberDevices(resolver.topLevel(), HierarchyPath::standaloneDevice);
                case CHAIN_DEVICES: {
                    FxNode chain = editor.require(scope.containerId(), "chain");
                    if (chain.kind() != NodeKind.CHAIN) {
                        return wrongKind(op, chain, NodeKind.CHAIN, 0);
                    }
                    int rackIdx = chain.path().rackIdx();
                    int chainIdx = chain.path().chainIdx();
                    return renumberDevices(resolver.children(chain.stableId()),
                        deviceIdx -> HierarchyPath.device(rackIdx, chainIdx, deviceIdx));
                }
                case RACK_CHAINS: {
                    FxNode rack = editor.require(scope.containerId(), "rack");
                    if (rack.kind() != NodeKind.RACK) {
                        return wrongKind(op, rack, NodeKind.RACK, 0);
                    }
                    return renumberChains(rack);
                }
                default:
                    throw new IllegalStateException("Unknown renumber level " + scope.level());
            }
        });
    }

    private int renumberDevices(List<FxNode> siblings, IntFunction<HierarchyPath> pathFor) {
        int renamed = 0;
        int next = 1;
        for (FxNode node : siblings) {
            if (NamingCodec.isRackName(node.displayName())) {
                continue;
            }
            if (node.kind() != NodeKind.DEVICE) {
                continue;
            }
            HierarchyPath target = pathFor.apply(next++);
            if (!target.equals(node.path())) {
                renamed += assembler.renameTree(node.stableId(), target);
            }
        }
        return renamed;
    }

    private int renumberChains(FxNode rack) {
        int rackIdx = rack.path().rackIdx();
        int renamed = 0;
        int next = 1;
        for (FxNode child : resolver.children(rack.stableId())) {
            if (child.kind() != NodeKind.CHAIN) {
                continue;
            }
            HierarchyPath chainPath = HierarchyPath.chain(rackIdx, next++);
            if (!chainPath.equals(child.path())) {
                ParsedName parsed = NamingCodec.parse(child.displayName()).orElseThrow();
                if (editor.rename(child.stableId(), NamingCodec.reencode(parsed, chainPath))) {
                    renamed++;
                }
            }
            for (FxNode device : resolver.children(child.stableId())) {
                if (NamingCodec.isRackName(device.displayName()) || device.kind() != NodeKind.DEVICE) {
                    continue;
                }
                HierarchyPath devicePath = HierarchyPath.device(rackIdx, chainPath.chainIdx(), device.path().deviceIdx());
                if (!devicePath.equals(device.path())) {
                    renamed += assembler.renameTree(device.stableId(), devicePath);
                }
            }
        }
        return renamed;
    }

    // ------------------------------------------------------------------
    // Delete
    // ------------------------------------------------------------------

    /**
     * Deletes a node and, through the host, everything below it. Mixers cannot be deleted on their own.
     *
     * @return true if the node was deleted; false if it was already gone or is a mixer
     */
    public boolean delete(StableId id) {
        String op = "delete";
        return execute(op, "Delete", StructuralEditor.details("stable_id", id), Boolean.FALSE, () -> {
            FxNode node = editor.require(id, "delete");
            if (node.kind() == NodeKind.MIXER) {
                logger.warn("HierarchyMutator: Refusing to delete mixer " + node.displayName() + " on its own");
                return Boolean.FALSE;
            }
            editor.delete(op, id);
            return Boolean.TRUE;
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T execute(String operation, String undoLabel, Map<String, Object> params, T emptyResult, Supplier<T> body) {
        String operationId = structuredLogger.generateOperationId();
        StructuredLogger.TimedOperation timedOp = structuredLogger.startTimedOperation(operationId, operation, params);

        if (configManager.isDefensiveIntegrityChecks()) {
            IntegrityReport report = integrityChecker.verify();
            if (report.hasStructuralViolations()) {
                HierarchyException e = report.toException(operation);
                timedOp.completeWithError(e.getErrorCode().getCode(), e.getMessage());
                throw e;
            }
        }

        EffectHost host = resolver.getHost();
        host.beginUndoBlock();
        try {
            T result = body.get();
            timedOp.complete(summarize(result));
            return result;
        } catch (NodeVanishedException e) {
            structuredLogger.logOperationWarning(operationId,
                operation + " aborted, " + e.getStableId() + " no longer resolves");
            timedOp.complete(summarize(emptyResult));
            return emptyResult;
        } catch (HierarchyException e) {
            timedOp.completeWithError(e.getErrorCode().getCode(), e.getMessage());
            throw e;
        } catch (HostAccessException e) {
            timedOp.completeWithError(ErrorCode.HOST_READ_FAILED.getCode(), e.getMessage());
            throw new HierarchyException(ErrorCode.HOST_READ_FAILED, operation, e.getMessage(), e);
        } finally {
            host.endUndoBlock(configManager.getUndoPrefix() + ": " + undoLabel);
        }
    }

    private static int requireFreeIndex(String operation, String what, int firstIdx, int count) {
        if (count > 0 && firstIdx > HierarchyPath.MAX_INDEX - count + 1) {
            throw new HierarchyException(ErrorCode.CONTAINER_CREATE_FAILED, operation,
                "No free " + what + " index left, " + what + " indices stop at " + HierarchyPath.MAX_INDEX,
                StructuralEditor.details("next_index", firstIdx, "needed", count));
        }
        return firstIdx;
    }

    private static int countOfKind(List<FxNode> nodes, NodeKind kind) {
        return (int) nodes.stream().filter(node -> node.kind() == kind).count();
    }

    private <T> T wrongKind(String operation, FxNode node, NodeKind expected, T emptyResult) {
        logger.warn("HierarchyMutator: " + operation + " expects a " + expected.name().toLowerCase()
            + ", got " + node.kind().name().toLowerCase() + " '" + node.displayName() + "'");
        return emptyResult;
    }

    private static Object summarize(Object result) {
        if (result instanceof Optional) {
            return ((Optional<?>) result).map(value -> value instanceof FxNode ? ((FxNode) value).displayName() : value)
                .orElse("none");
        }
        if (result instanceof Collection) {
            return ((Collection<?>) result).size() + " node(s)";
        }
        return result;
    }

    private List<StableId> childIds(StableId containerId) {
        return resolver.children(containerId).stream().map(FxNode::stableId).collect(Collectors.toList());
    }

    private static List<String> namesOfKind(List<FxNode> nodes, NodeKind kind) {
        return nodes.stream().filter(node -> node.kind() == kind).map(FxNode::displayName).collect(Collectors.toList());
    }

    private static List<String> standaloneDeviceNames(List<FxNode> topLevel) {
        return topLevel.stream()
            .filter(node -> node.kind() == NodeKind.DEVICE && node.path().isStandalone())
            .map(FxNode::displayName)
            .collect(Collectors.toList());
    }

    private static List<StableId> prepend(StableId head, List<StableId> tail) {
        List<StableId> list = new ArrayList<>(tail.size() + 1);
        list.add(head);
        list.addAll(tail);
        return list;
    }
}
