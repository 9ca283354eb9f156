package io.github.fabb.fxtree.hierarchy;

import io.github.fabb.fxtree.FxTreeSession;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.host.SimulatedEffectHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for reordering chains within a rack and moving them between racks.
 */
class ChainReorderTest {

    private SimulatedEffectHost host;
    private FxTreeSession session;
    private HierarchyMutator mutator;

    private StableId rack;
    private StableId c1;
    private StableId c2;
    private StableId c3;

    @BeforeEach
    void setUp() {
        host = new SimulatedEffectHost();
        session = new FxTreeSession(host);
        mutator = session.getMutator();

        rack = mutator.addRackToTrack(-1).orElseThrow().stableId();
        c1 = addChain(rack, "VST: ReaComp (Cockos)");
        c2 = addChain(rack, "VST: ReaEQ (Cockos)");
        c3 = addChain(rack, "VST: ReaXcomp (Cockos)");
    }

    private StableId addChain(StableId rackId, String plugin) {
        return mutator.addChainToRack(rackId, Optional.ofNullable(plugin)).orElseThrow().stableId();
    }

    private List<StableId> chainOrder(StableId rackId) {
        return session.getResolver().children(rackId).stream()
            .map(FxNode::stableId)
            .collect(Collectors.toList());
    }

    private StableId firstChild(StableId containerId) {
        return session.getResolver().children(containerId).get(0).stableId();
    }

    @Test
    void testMoveChainToFront() {
        StableId mixer = chainOrder(rack).get(3);

        assertTrue(mutator.reorderChainInRack(rack, c3, c1));

        assertEquals(List.of(c3, c1, c2, mixer), chainOrder(rack));
        assertEquals(List.of("R1_C1", "R1_C2", "R1_C3", "_R1_M"), host.childNames(rack));
        assertEquals("R1_C1_D1: ReaXcomp", host.nameOf(firstChild(c3)));
        assertEquals("R1_C2_D1: ReaComp", host.nameOf(firstChild(c1)));
        assertEquals(List.of("R1_C1_D1_FX: ReaXcomp", "R1_C1_D1_Util"), host.childNames(firstChild(c3)));
    }

    @Test
    void testMoveChainToEnd() {
        assertTrue(mutator.reorderChainInRack(rack, c1, null));

        assertEquals(List.of(c2, c3, c1), chainOrder(rack).subList(0, 3));
        assertEquals("R1_C3", host.nameOf(c1));
        assertEquals("_R1_M", host.childNames(rack).get(3));
    }

    @Test
    void testReorderIntoSamePlaceIsNoOp() {
        int edits = host.getStructuralEdits();

        assertTrue(mutator.reorderChainInRack(rack, c1, c2));

        assertEquals(edits, host.getStructuralEdits());
        assertEquals("R1_C1", host.nameOf(c1));
    }

    @Test
    void testReorderRejectsForeignChain() {
        StableId other = mutator.addRackToTrack(-1).orElseThrow().stableId();
        StableId foreign = addChain(other, null);

        assertFalse(mutator.reorderChainInRack(rack, foreign, c1));
        assertFalse(mutator.reorderChainInRack(rack, rack, c1));
        assertEquals(other, host.actualParentOf(foreign));
    }

    @Test
    void testMoveChainBetweenRacks() {
        StableId target = mutator.addRackToTrack(-1).orElseThrow().stableId();
        StableId t1 = addChain(target, "VST: ReaDelay (Cockos)");

        assertTrue(mutator.moveChainBetweenRacks(rack, target, c1, null));

        assertEquals(List.of("R2_C1", "R2_C2", "_R2_M"), host.childNames(target));
        assertEquals(target, host.actualParentOf(c1));
        assertEquals("R2_C2", host.nameOf(c1));
        assertEquals("R2_C2_D1: ReaComp", host.nameOf(firstChild(c1)));
        assertEquals("R2_C1", host.nameOf(t1));
        assertEquals(List.of("R1_C1", "R1_C2", "_R1_M"), host.childNames(rack));
        assertEquals("R1_C1_D1: ReaEQ", host.nameOf(firstChild(c2)));
        assertTrue(session.getIntegrityChecker().verify().isOk());
    }

    @Test
    void testMoveChainBeforeTargetChain() {
        StableId target = mutator.addRackToTrack(-1).orElseThrow().stableId();
        StableId t1 = addChain(target, null);

        assertTrue(mutator.moveChainBetweenRacks(rack, target, c2, t1));

        assertEquals(List.of(c2, t1), chainOrder(target).subList(0, 2));
        assertEquals("R2_C1", host.nameOf(c2));
        assertEquals("R2_C2", host.nameOf(t1));
    }

    @Test
    void testMoveIntoRackNestedInsideChainIsRejected() {
        StableId inner = mutator.addRackToChain(c1).orElseThrow().stableId();
        int edits = host.getStructuralEdits();

        assertFalse(mutator.moveChainBetweenRacks(rack, inner, c1, null));

        assertEquals(edits, host.getStructuralEdits());
        assertEquals(rack, host.actualParentOf(c1));
    }

    @Test
    void testMoveIntoSameRackIsRejected() {
        assertFalse(mutator.moveChainBetweenRacks(rack, rack, c1, null));
    }

    @Test
    void testMoveIntoFullRack() {
        StableId target = mutator.addRackToTrack(-1).orElseThrow().stableId();
        addChain(target, null);
        session.getConfigManager().setMaxChainsPerRack(1);

        HierarchyException e = assertThrows(HierarchyException.class,
            () -> mutator.moveChainBetweenRacks(rack, target, c1, null));

        assertEquals(ErrorCode.CHAIN_LIMIT_EXCEEDED, e.getErrorCode());
        assertEquals(rack, host.actualParentOf(c1));
    }

    @Test
    void testRefusedMoveSurfacesChildMoveFailed() {
        host.refuseMoves(true);

        HierarchyException e = assertThrows(HierarchyException.class,
            () -> mutator.reorderChainInRack(rack, c3, c1));

        assertEquals(ErrorCode.CHILD_MOVE_FAILED, e.getErrorCode());
        assertEquals(0, host.getOpenUndoBlocks());
    }
}
