package io.github.fabb.fxtree;

import io.github.fabb.fxtree.classify.ContainerClassifier;
import io.github.fabb.fxtree.classify.IntegrityChecker;
import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.config.ConfigChangeObserver;
import io.github.fabb.fxtree.config.ConfigManager;
import io.github.fabb.fxtree.config.JsonConfigManager;
import io.github.fabb.fxtree.features.HierarchyController;
import io.github.fabb.fxtree.hierarchy.HierarchyMutator;
import io.github.fabb.fxtree.host.EffectHost;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.state.ExpansionState;

/**
 * One hierarchy session for one track.
 * Owns the primary components and the session's expansion state.
 */
public class FxTreeSession implements ConfigChangeObserver, AutoCloseable {
    private final EffectHost host;
    private final Logger logger;
    private final ConfigManager configManager;
    private final HandleResolver resolver;
    private final IntegrityChecker integrityChecker;
    private final HierarchyMutator mutator;
    private final ExpansionState expansionState;
    private final HierarchyController controller;
    private boolean closed;

    /**
     * Creates a session with the classpath default configuration.
     *
     * @param host The track's effect host
     */
    public FxTreeSession(EffectHost host) {
        this(host, null);
    }

    /**
     * Creates a session.
     *
     * @param host          The track's effect host
     * @param configManager Configuration, or null to load the classpath defaults
     */
    public FxTreeSession(EffectHost host, ConfigManager configManager) {
        this.host = host;
        this.logger = new Logger(host);
        this.configManager = configManager != null ? configManager : new JsonConfigManager(logger);
        logger.setDebugEnabled(this.configManager.isDebugLogging());

        ContainerClassifier classifier = new ContainerClassifier();
        this.resolver = new HandleResolver(host, this.configManager, classifier, logger);
        this.integrityChecker = new IntegrityChecker(resolver, classifier, this.configManager, logger);
        this.mutator = new HierarchyMutator(resolver, integrityChecker, this.configManager, logger);
        this.expansionState = new ExpansionState();
        this.controller = new HierarchyController(mutator, resolver, integrityChecker, expansionState, logger);

        this.configManager.addObserver(this);
        logger.info("FxTree session opened (" + host.flatCount() + " effects on track)");
    }

    public EffectHost getHost() {
        return host;
    }

    public HierarchyController getController() {
        return controller;
    }

    public HierarchyMutator getMutator() {
        return mutator;
    }

    public HandleResolver getResolver() {
        return resolver;
    }

    public IntegrityChecker getIntegrityChecker() {
        return integrityChecker;
    }

    public ExpansionState getExpansionState() {
        return expansionState;
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public Logger getLogger() {
        return logger;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void onMaxNestingDepthChanged(int oldDepth, int newDepth) {
        logger.info("FxTree session: Nesting depth ceiling changed from " + oldDepth + " to " + newDepth);
    }

    @Override
    public void onMaxChainsPerRackChanged(int oldLimit, int newLimit) {
        logger.info("FxTree session: Chain limit changed from " + oldLimit + " to " + newLimit);
    }

    /**
     * Tears the session down: expansion and selection state is cleared.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        configManager.removeObserver(this);
        expansionState.clear();
        logger.info("FxTree session closed");
    }
}
