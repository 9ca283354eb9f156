package io.github.fabb.fxtree;

import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.config.ConfigManager;
import io.github.fabb.fxtree.config.JsonConfigManager;
import io.github.fabb.fxtree.host.SimulatedEffectHost;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FxTreeSession.
 */
class FxTreeSessionTest {

    @Test
    void testDefaultsAreLoaded() {
        SimulatedEffectHost host = new SimulatedEffectHost();

        try (FxTreeSession session = new FxTreeSession(host)) {
            assertEquals(64, session.getConfigManager().getMaxNestingDepth());
            assertEquals(31, session.getConfigManager().getMaxChainsPerRack());
            assertSame(host, session.getHost());
            assertSame(session.getExpansionState(), session.getController().getExpansionState());
        }
        assertTrue(host.getConsoleLines().contains("[FxTree] INFO: FxTree session opened (0 effects on track)"));
        assertTrue(host.getConsoleLines().contains("[FxTree] INFO: FxTree session closed"));
    }

    @Test
    void testCustomConfiguration() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        String json = "{\"undoPrefix\": \"Racks\", \"defaultRackLabel\": \"Bus\"}";
        ConfigManager config = new JsonConfigManager(new Logger(host),
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        FxTreeSession session = new FxTreeSession(host, config);
        session.getMutator().addRackToTrack(-1);

        assertEquals("R1: Bus", host.topLevelNames().get(0));
        assertEquals("Racks: Add Rack", host.getUndoLabels().get(0));
    }

    @Test
    void testConfigChangesAreLoggedUntilClose() {
        SimulatedEffectHost host = new SimulatedEffectHost();
        FxTreeSession session = new FxTreeSession(host);

        session.getConfigManager().setMaxChainsPerRack(8);
        assertTrue(host.getConsoleLines().contains("[FxTree] INFO: FxTree session: Chain limit changed from 31 to 8"));

        session.close();
        session.getConfigManager().setMaxNestingDepth(10);
        assertFalse(host.getConsoleLines().stream().anyMatch(line -> line.contains("Nesting depth ceiling changed")));
    }

    @Test
    void testCloseClearsStateAndIsIdempotent() {
        FxTreeSession session = new FxTreeSession(new SimulatedEffectHost());
        session.getExpansionState().setExpanded(StableId.of("x"), true);

        session.close();
        session.close();

        assertTrue(session.isClosed());
        assertTrue(session.getExpansionState().trackedIds().isEmpty());
    }
}
