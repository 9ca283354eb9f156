package io.github.fabb.fxtree.host;

import io.github.fabb.fxtree.common.data.StableId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the simulated host's addressing, which the hierarchy tests rely on.
 */
class SimulatedEffectHostTest {

    @Test
    void testNestedAddressesDecodeToTheSameEffect() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        StableId rack = host.seedContainer("R1: Rack", null);
        StableId chain = host.seedContainer("R1_C1", rack);
        StableId device = host.seedContainer("R1_C1_D1: ReaComp", chain);
        host.seedPlugin("_R1_M", rack);

        FxHandle handle = host.handleFor(device);

        assertTrue(handle.address() >= SimulatedEffectHost.NESTED_BASE);
        assertEquals(device, host.stableIdOf(handle));
        assertEquals(chain, host.stableIdOf(host.parentOf(handle).orElseThrow()));
    }

    @Test
    void testStrictModeRejectsStaleHandles() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        StableId first = host.seedPlugin("A", null);
        FxHandle stale = host.handleFor(first);

        host.addPlugin("B", 0);

        assertThrows(HostAccessException.class, () -> host.nameOf(stale));
    }

    @Test
    void testLenientModeSilentlyAddressesAnotherEffect() {
        SimulatedEffectHost host = new SimulatedEffectHost().strict(false);
        StableId rack = host.seedContainer("R1: Rack", null);
        StableId chain = host.seedContainer("R1_C1", rack);
        host.seedContainer("R1_C2", rack);
        FxHandle staleChain = host.handleFor(chain);

        // A new first child shifts the old address onto the previous sibling
        host.moveIntoContainer(host.addContainer(-1).orElseThrow(), host.handleFor(rack), 0);

        assertNotEquals(chain, host.stableIdOf(staleChain));
    }

    @Test
    void testRenameDoesNotInvalidateHandles() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        StableId fx = host.seedPlugin("A", null);
        FxHandle handle = host.handleFor(fx);

        assertTrue(host.rename(handle, "B"));

        assertEquals("B", host.nameOf(handle));
    }

    @Test
    void testMoveIntoOwnDescendantIsRejected() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        StableId outer = host.seedContainer("outer", null);
        StableId inner = host.seedContainer("inner", outer);

        assertFalse(host.moveIntoContainer(host.handleFor(outer), host.handleFor(inner), 0));
        assertEquals(outer, host.actualParentOf(inner));
    }
}
