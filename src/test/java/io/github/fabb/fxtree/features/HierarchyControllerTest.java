package io.github.fabb.fxtree.features;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.github.fabb.fxtree.FxTreeSession;
import io.github.fabb.fxtree.classify.IntegrityChecker;
import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.HierarchyPath;
import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;
import io.github.fabb.fxtree.hierarchy.HierarchyMutator;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.host.SimulatedEffectHost;
import io.github.fabb.fxtree.state.ExpansionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HierarchyController.
 */
class HierarchyControllerTest {

    private static final StableId RACK = StableId.of("rack");
    private static final StableId CHAIN = StableId.of("chain");
    private static final StableId INNER = StableId.of("inner");

    @Mock
    private HierarchyMutator mutator;

    @Mock
    private HandleResolver resolver;

    @Mock
    private IntegrityChecker integrityChecker;

    @Mock
    private Logger logger;

    private ExpansionState expansionState;
    private HierarchyController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        expansionState = new ExpansionState();
        controller = new HierarchyController(mutator, resolver, integrityChecker, expansionState, logger);
    }

    private static FxNode rack(StableId id, int rackIdx, StableId parentId) {
        return new FxNode(id, "R" + rackIdx + ": Rack", NodeKind.RACK, HierarchyPath.rack(rackIdx), true, parentId, 0, 1);
    }

    private static FxNode chain(StableId id, StableId rackId) {
        return new FxNode(id, "R1_C1", NodeKind.CHAIN, HierarchyPath.chain(1, 1), true, rackId, 0, 0);
    }

    @Test
    void testAddRackExpandsIt() {
        when(mutator.addRackToTrack(-1)).thenReturn(Optional.of(rack(RACK, 1, null)));

        Optional<FxNode> result = controller.addRack(-1);

        assertTrue(result.isPresent());
        assertTrue(expansionState.isExpanded(RACK));
    }

    @Test
    void testAddChainSelectsIt() {
        when(mutator.addChainToRack(RACK, Optional.of("VST: ReaComp"))).thenReturn(Optional.of(chain(CHAIN, RACK)));

        controller.addChain(RACK, "VST: ReaComp");

        assertTrue(expansionState.isExpanded(RACK));
        assertEquals(Optional.of(CHAIN), expansionState.getSelectedChain(RACK));
    }

    @Test
    void testEmptyResultLeavesStateAlone() {
        when(mutator.addChainToRack(RACK, Optional.empty())).thenReturn(Optional.empty());

        controller.addChain(RACK, null);

        assertTrue(expansionState.trackedIds().isEmpty());
    }

    @Test
    void testAddDeviceToChainShowsOwningRack() {
        FxNode device = new FxNode(StableId.of("device"), "R1_C1_D1: ReaComp", NodeKind.DEVICE,
            HierarchyPath.device(1, 1, 1), true, CHAIN, 0, 2);
        when(mutator.addDeviceToChain(CHAIN, "VST: ReaComp")).thenReturn(Optional.of(device));
        when(resolver.describe(CHAIN)).thenReturn(Optional.of(chain(CHAIN, RACK)));

        controller.addDeviceToChain(CHAIN, "VST: ReaComp");

        assertTrue(expansionState.isExpanded(RACK));
        assertEquals(Optional.of(CHAIN), expansionState.getSelectedChain(RACK));
    }

    @Test
    void testAddNestedRackExpandsBothLevels() {
        when(mutator.addNestedRackToRack(RACK)).thenReturn(Optional.of(rack(INNER, 2, CHAIN)));

        controller.addNestedRack(RACK);

        assertTrue(expansionState.isExpanded(RACK));
        assertTrue(expansionState.isExpanded(INNER));
        assertEquals(Optional.of(CHAIN), expansionState.getSelectedChain(RACK));
    }

    @Test
    void testMoveChainUpdatesSelection() {
        StableId target = StableId.of("target");
        expansionState.setSelectedChain(RACK, CHAIN);
        when(mutator.moveChainBetweenRacks(RACK, target, CHAIN, null)).thenReturn(true);

        assertTrue(controller.moveChain(RACK, target, CHAIN, null));

        assertTrue(expansionState.getSelectedChain(RACK).isEmpty());
        assertEquals(Optional.of(CHAIN), expansionState.getSelectedChain(target));
    }

    @Test
    void testDeleteForgetsState() {
        expansionState.setExpanded(RACK, true);
        when(mutator.delete(RACK)).thenReturn(true);

        assertTrue(controller.delete(RACK));

        assertFalse(expansionState.trackedIds().contains(RACK));
    }

    @Test
    void testHierarchyExceptionPassesThrough() {
        HierarchyException failure = new HierarchyException(ErrorCode.CHAIN_LIMIT_EXCEEDED, "addChainToRack", "full");
        when(mutator.addChainToRack(eq(RACK), any())).thenThrow(failure);

        HierarchyException e = assertThrows(HierarchyException.class, () -> controller.addChain(RACK, null));

        assertSame(failure, e);
        verify(logger).error(contains("Error in addChain"));
    }

    @Test
    void testUnexpectedExceptionIsWrapped() {
        when(mutator.delete(RACK)).thenThrow(new IllegalStateException("boom"));

        HierarchyException e = assertThrows(HierarchyException.class, () -> controller.delete(RACK));

        assertEquals(ErrorCode.INTERNAL_ERROR, e.getErrorCode());
        assertEquals("delete", e.getOperation());
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void testPollPrunesVanishedNodes() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        FxTreeSession session = new FxTreeSession(host);
        HierarchyController real = session.getController();
        StableId rackId = real.addRack(-1).orElseThrow().stableId();
        StableId chainId = real.addChain(rackId, null).orElseThrow().stableId();
        real.poll();
        assertEquals(0, real.poll());

        session.getMutator().delete(chainId);

        assertEquals(1, real.poll());
        assertTrue(session.getExpansionState().getSelectedChain(rackId).isEmpty());
        assertTrue(session.getExpansionState().isExpanded(rackId));
        assertEquals(0, real.poll());
    }

    @Test
    void testConvertChainToDevicesForgetsRemovedNodes() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        FxTreeSession session = new FxTreeSession(host);
        HierarchyController real = session.getController();
        StableId rackId = real.addRack(-1).orElseThrow().stableId();
        StableId chainId = real.addChain(rackId, "VST: ReaComp (Cockos)").orElseThrow().stableId();

        List<FxNode> devices = real.convertChainToDevices(chainId);

        assertEquals(1, devices.size());
        assertTrue(session.getExpansionState().trackedIds().isEmpty());
    }

    @Test
    void testConvertDeviceToRackSelectsChain() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        FxTreeSession session = new FxTreeSession(host);
        HierarchyController real = session.getController();
        StableId deviceId = real.addDeviceToTrack("VST: ReaComp (Cockos)", -1).orElseThrow().stableId();

        StableId rackId = real.convertDeviceToRack(deviceId).orElseThrow().stableId();

        assertTrue(session.getExpansionState().isExpanded(rackId));
        assertEquals(Optional.of(host.actualParentOf(deviceId)), session.getExpansionState().getSelectedChain(rackId));
    }

    @Test
    void testExportTreeJson() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        FxTreeSession session = new FxTreeSession(host);
        HierarchyController real = session.getController();
        StableId rackId = real.addRack(-1).orElseThrow().stableId();
        real.addChain(rackId, "VST: ReaComp (Cockos)");

        JsonArray roots = JsonParser.parseString(real.exportTreeJson()).getAsJsonArray();

        assertEquals(1, roots.size());
        JsonObject rack = roots.get(0).getAsJsonObject();
        assertEquals(rackId.value(), rack.get("stable_id").getAsString());
        assertEquals("rack", rack.get("kind").getAsString());
        assertEquals("R1", rack.get("path").getAsString());
        assertTrue(rack.get("expanded").getAsBoolean());
        JsonArray rackChildren = rack.getAsJsonArray("children");
        assertEquals(2, rackChildren.size());
        JsonObject chainNode = rackChildren.get(0).getAsJsonObject();
        assertEquals("chain", chainNode.get("kind").getAsString());
        assertEquals("mixer", rackChildren.get(1).getAsJsonObject().get("kind").getAsString());
        JsonObject device = chainNode.getAsJsonArray("children").get(0).getAsJsonObject();
        assertEquals("R1_C1_D1: ReaComp", device.get("name").getAsString());
        assertEquals("R1_C1_D1", device.get("path").getAsString());
        JsonObject fx = device.getAsJsonArray("children").get(0).getAsJsonObject();
        assertEquals("plain", fx.get("kind").getAsString());
        assertFalse(fx.get("expanded").getAsBoolean());
    }

    @Test
    void testVerifyIntegrityDelegates() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        FxTreeSession session = new FxTreeSession(host);
        host.seedContainer("R1: Rack", null);

        assertFalse(session.getController().verifyIntegrity().isOk());
    }
}
