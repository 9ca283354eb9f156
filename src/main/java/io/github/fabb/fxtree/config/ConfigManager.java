package io.github.fabb.fxtree.config;

/**
 * Read access to hierarchy settings, plus setters for the values that may change at runtime.
 * Setters notify registered {@link ConfigChangeObserver}s when the value actually changes.
 */
public interface ConfigManager {

    int getMaxNestingDepth();

    void setMaxNestingDepth(int maxNestingDepth);

    int getMaxChainsPerRack();

    void setMaxChainsPerRack(int maxChainsPerRack);

    /**
     * Number of extra read attempts allowed right after a host write.
     */
    int getResolveRetries();

    void setResolveRetries(int resolveRetries);

    boolean isDefensiveIntegrityChecks();

    void setDefensiveIntegrityChecks(boolean enabled);

    /**
     * Host plugin name of the per-rack mixer.
     */
    String getMixerPluginName();

    /**
     * Host plugin name of the per-device utility helper.
     */
    String getUtilityPluginName();

    String getDefaultRackLabel();

    /**
     * Prefix of every undo block label.
     */
    String getUndoPrefix();

    boolean isDebugLogging();

    void setDebugLogging(boolean debugLogging);

    void addObserver(ConfigChangeObserver observer);

    void removeObserver(ConfigChangeObserver observer);
}
