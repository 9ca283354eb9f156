package io.github.fabb.fxtree.classify;

import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.naming.NamingCodec;

/**
 * Derives a node's kind from its display name and structural context.
 * Kind is never stored; callers recompute it whenever they need it.
 */
public class ContainerClassifier {

    /**
     * Classifies a node.
     * <ul>
     *   <li>A mixer is recognised by name alone, never by position.</li>
     *   <li>Rack, chain and device names only count on containers.</li>
     *   <li>A chain-shaped container whose parent is neither a rack nor the track root is plain.</li>
     *   <li>A container without a decodable name is plain, at any depth.</li>
     * </ul>
     *
     * @param name        The node's display name
     * @param isContainer The host's container flag
     * @param parentKind  Kind of the parent, or null for a top-level node
     * @return the kind
     */
    public NodeKind classifyInContext(String name, boolean isContainer, NodeKind parentKind) {
        NodeKind byName = NamingCodec.classify(name);
        switch (byName) {
            case MIXER:
                return NodeKind.MIXER;
            case CHAIN:
                if (!isContainer) {
                    return NodeKind.PLAIN;
                }
                return parentKind == null || parentKind == NodeKind.RACK ? NodeKind.CHAIN : NodeKind.PLAIN;
            case RACK:
            case DEVICE:
                return isContainer ? byName : NodeKind.PLAIN;
            default:
                return NodeKind.PLAIN;
        }
    }
}
