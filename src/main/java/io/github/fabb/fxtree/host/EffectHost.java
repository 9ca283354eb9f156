package io.github.fabb.fxtree.host;

import io.github.fabb.fxtree.common.HostConsole;
import io.github.fabb.fxtree.common.data.StableId;

import java.util.Optional;

/**
 * The host application's effect list for one track.
 *
 * <p>The host exposes effects as a flat, ordered, mutable list in which containers hold
 * children. Nodes are addressed by {@link FxHandle}s that every structural edit
 * (add, move, delete) may invalidate, for the edited node, its siblings and every container
 * nested below any of its ancestors. {@link #rename(FxHandle, String)} is not a structural
 * edit. Read methods throw {@link HostAccessException} when a handle cannot be read.
 *
 * <p>No ordering or atomicity guarantee is given across calls.
 */
public interface EffectHost extends HostConsole {

    // Reads

    int topLevelCount();

    FxHandle topLevelAt(int index);

    /**
     * Total number of effects on the track, containers and their descendants included.
     */
    int flatCount();

    StableId stableIdOf(FxHandle fx);

    String nameOf(FxHandle fx);

    boolean isContainer(FxHandle fx);

    /**
     * @return the containing container, or empty for top-level effects
     */
    Optional<FxHandle> parentOf(FxHandle fx);

    int childCount(FxHandle container);

    FxHandle childAt(FxHandle container, int index);

    // Non-structural write

    boolean rename(FxHandle fx, String name);

    // Structural writes; each invalidates outstanding handles

    /**
     * Adds an empty container at track level.
     *
     * @param position Insert position, or -1 to append
     * @return the new container, or empty if the host refused
     */
    Optional<FxHandle> addContainer(int position);

    /**
     * Instantiates a plugin at track level.
     *
     * @param pluginName Host plugin identifier, e.g. {@code "VST: ReaComp (Cockos)"}
     * @param position   Insert position, or -1 to append
     * @return the new effect, or empty if the host refused
     */
    Optional<FxHandle> addPlugin(String pluginName, int position);

    /**
     * Moves an effect into a container, removing it from wherever it currently is.
     *
     * @param position Child position, or -1 to append
     * @return false if the host rejected the move
     */
    boolean moveIntoContainer(FxHandle child, FxHandle container, int position);

    /**
     * Moves an effect out of its container to track level.
     *
     * @param position Track-level position, or -1 to append
     * @return false if the host rejected the move
     */
    boolean moveToTopLevel(FxHandle fx, int position);

    /**
     * Deletes an effect. Containers are deleted together with all their descendants.
     */
    boolean delete(FxHandle fx);

    // Undo bracketing

    void beginUndoBlock();

    void endUndoBlock(String description);
}
