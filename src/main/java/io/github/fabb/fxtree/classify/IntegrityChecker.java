package io.github.fabb.fxtree.classify;

import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.config.ConfigManager;
import io.github.fabb.fxtree.host.EffectHost;
import io.github.fabb.fxtree.host.FxHandle;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.host.HostAccessException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only diagnostic walk over the host's container tree.
 * Never mutates the host.
 */
public class IntegrityChecker {
    private final HandleResolver resolver;
    private final ContainerClassifier classifier;
    private final ConfigManager configManager;
    private final Logger logger;

    public IntegrityChecker(HandleResolver resolver, ContainerClassifier classifier,
                            ConfigManager configManager, Logger logger) {
        this.resolver = resolver;
        this.classifier = classifier;
        this.configManager = configManager;
        this.logger = logger;
    }

    /**
     * Checks the whole track.
     *
     * @return the report; empty violations means the tree is consistent
     * @throws HierarchyException with HOST_READ_FAILED if the host cannot be read
     */
    public IntegrityReport verify() {
        EffectHost host = resolver.getHost();
        try {
            List<Frame> roots = new ArrayList<>();
            int count = host.topLevelCount();
            for (int i = 0; i < count; i++) {
                roots.add(new Frame(host.topLevelAt(i), null, null, 1));
            }
            return walk(host, roots);
        } catch (HostAccessException e) {
            throw new HierarchyException(ErrorCode.HOST_READ_FAILED, "verifyIntegrity",
                "Host read failed during integrity walk: " + e.getMessage(), e);
        }
    }

    /**
     * Checks the subtree below one node, the node included.
     *
     * @param rootId The subtree root
     * @return the report, or empty if the root no longer resolves
     */
    public Optional<IntegrityReport> verify(StableId rootId) {
        EffectHost host = resolver.getHost();
        Optional<FxHandle> root = resolver.resolve(rootId);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        try {
            Optional<FxHandle> parent = host.parentOf(root.get());
            StableId parentId = parent.map(host::stableIdOf).orElse(null);
            NodeKind parentKind = parent.map(p -> resolver.view(p).kind()).orElse(null);
            int depth = resolver.ancestorPath(root.get()).size();
            return Optional.of(walk(host, List.of(new Frame(root.get(), parentId, parentKind, depth))));
        } catch (HostAccessException e) {
            throw new HierarchyException(ErrorCode.HOST_READ_FAILED, "verifyIntegrity",
                "Host read failed during integrity walk: " + e.getMessage(), e);
        }
    }

    /**
     * Checks the whole track and throws on the first report with violations.
     *
     * @throws HierarchyException with INTEGRITY_VIOLATION listing every violation found
     */
    public void verifyOrThrow() {
        IntegrityReport report = verify();
        if (!report.isOk()) {
            throw report.toException("verifyIntegrity");
        }
    }

    private IntegrityReport walk(EffectHost host, List<Frame> roots) {
        int maxDepth = configManager.getMaxNestingDepth();
        List<IntegrityViolation> violations = new ArrayList<>();
        Set<StableId> visited = new HashSet<>();
        Deque<Frame> pending = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }

        int checked = 0;
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            StableId id = host.stableIdOf(frame.handle);
            if (!visited.add(id)) {
                violations.add(new IntegrityViolation(IntegrityViolation.Type.CIRCULAR_REFERENCE, id,
                    "Node " + id + " reached twice"));
                continue;
            }
            checked++;

            StableId reportedParent = host.parentOf(frame.handle).map(host::stableIdOf).orElse(null);
            if (frame.expectedParent == null ? reportedParent != null : !frame.expectedParent.equals(reportedParent)) {
                violations.add(new IntegrityViolation(IntegrityViolation.Type.PARENT_MISMATCH, id,
                    "Node " + id + " reports parent " + reportedParent + " but sits in " + frame.expectedParent));
            }

            if (frame.depth > maxDepth) {
                violations.add(new IntegrityViolation(IntegrityViolation.Type.MAX_DEPTH_EXCEEDED, id,
                    "Node " + id + " at depth " + frame.depth + " exceeds " + maxDepth));
                continue;
            }

            String name = host.nameOf(frame.handle);
            boolean container = host.isContainer(frame.handle);
            NodeKind kind = classifier.classifyInContext(name, container, frame.parentKind);
            if (kind == NodeKind.RACK && frame.parentKind != null && frame.parentKind != NodeKind.CHAIN) {
                violations.add(new IntegrityViolation(IntegrityViolation.Type.RACK_PARENT_INVALID, id,
                    "Rack '" + name + "' sits directly in a " + frame.parentKind.name().toLowerCase()));
            }
            if (!container) {
                continue;
            }

            int childCount = host.childCount(frame.handle);
            int mixers = 0;
            for (int i = childCount - 1; i >= 0; i--) {
                FxHandle child = host.childAt(frame.handle, i);
                if (kind == NodeKind.RACK
                    && classifier.classifyInContext(host.nameOf(child), host.isContainer(child), kind) == NodeKind.MIXER) {
                    mixers++;
                }
                pending.push(new Frame(child, id, kind, frame.depth + 1));
            }
            if (kind == NodeKind.RACK && mixers != 1) {
                violations.add(new IntegrityViolation(IntegrityViolation.Type.MIXER_COUNT_MISMATCH, id,
                    "Rack '" + name + "' has " + mixers + " mixers"));
            }
        }

        if (!violations.isEmpty()) {
            logger.warn("IntegrityChecker: " + violations.size() + " violation(s) in " + checked + " nodes");
        } else {
            logger.debug("IntegrityChecker: " + checked + " nodes consistent");
        }
        return new IntegrityReport(violations, checked);
    }

    private static final class Frame {
        final FxHandle handle;
        final StableId expectedParent;
        final NodeKind parentKind;
        final int depth;

        Frame(FxHandle handle, StableId expectedParent, NodeKind parentKind, int depth) {
            this.handle = handle;
            this.expectedParent = expectedParent;
            this.parentKind = parentKind;
            this.depth = depth;
        }
    }
}
