package io.github.fabb.fxtree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ConfigManager backed by a JSON settings document.
 * Classpath defaults from {@value #DEFAULTS_RESOURCE} are loaded first; an optional override
 * stream is then merged over them key by key.
 */
public class JsonConfigManager implements ConfigManager {
    public static final String DEFAULTS_RESOURCE = "fxtree-defaults.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Logger logger;
    private final HierarchySettings settings;
    private final List<ConfigChangeObserver> observers = new CopyOnWriteArrayList<>();

    /**
     * Creates a manager from the classpath defaults only.
     *
     * @param logger The logger for logging configuration changes
     */
    public JsonConfigManager(Logger logger) {
        this(logger, null);
    }

    /**
     * Creates a manager from the classpath defaults merged with an override document.
     *
     * @param logger    The logger for logging configuration changes
     * @param overrides JSON override stream, or null. The stream is closed after reading.
     */
    public JsonConfigManager(Logger logger, InputStream overrides) {
        this.logger = logger;
        this.settings = loadDefaults();
        if (overrides != null) {
            applyOverrides(overrides);
        }
        logger.setDebugEnabled(settings.isDebugLogging());
        logger.info("JsonConfigManager: Loaded settings (maxNestingDepth=" + settings.getMaxNestingDepth()
            + ", maxChainsPerRack=" + settings.getMaxChainsPerRack()
            + ", resolveRetries=" + settings.getResolveRetries() + ")");
    }

    private HierarchySettings loadDefaults() {
        try (InputStream in = JsonConfigManager.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("JsonConfigManager: " + DEFAULTS_RESOURCE + " not found on classpath, using built-in defaults");
                return new HierarchySettings();
            }
            return OBJECT_MAPPER.readValue(in, HierarchySettings.class);
        } catch (IOException e) {
            throw new HierarchyException(ErrorCode.INVALID_PARAMETER, "loadConfig",
                "Could not parse " + DEFAULTS_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    private void applyOverrides(InputStream overrides) {
        ObjectReader updater = OBJECT_MAPPER.readerForUpdating(settings);
        try (InputStream in = overrides) {
            updater.readValue(in);
        } catch (IOException e) {
            throw new HierarchyException(ErrorCode.INVALID_PARAMETER, "loadConfig",
                "Could not parse configuration overrides: " + e.getMessage(), e);
        }
        validate("maxNestingDepth", settings.getMaxNestingDepth(), 1);
        validate("maxChainsPerRack", settings.getMaxChainsPerRack(), 1);
        validate("resolveRetries", settings.getResolveRetries(), 0);
    }

    private static void validate(String key, int value, int minimum) {
        if (value < minimum) {
            throw new HierarchyException(ErrorCode.INVALID_PARAMETER, "loadConfig",
                key + " must be at least " + minimum + ", got " + value, Map.of("key", key, "value", value));
        }
    }

    @Override
    public int getMaxNestingDepth() {
        return settings.getMaxNestingDepth();
    }

    @Override
    public void setMaxNestingDepth(int maxNestingDepth) {
        validate("maxNestingDepth", maxNestingDepth, 1);
        int oldDepth = settings.getMaxNestingDepth();
        if (oldDepth == maxNestingDepth) {
            return;
        }
        settings.setMaxNestingDepth(maxNestingDepth);
        logger.info("JsonConfigManager: maxNestingDepth changed from " + oldDepth + " to " + maxNestingDepth);
        for (ConfigChangeObserver observer : observers) {
            observer.onMaxNestingDepthChanged(oldDepth, maxNestingDepth);
        }
    }

    @Override
    public int getMaxChainsPerRack() {
        return settings.getMaxChainsPerRack();
    }

    @Override
    public void setMaxChainsPerRack(int maxChainsPerRack) {
        validate("maxChainsPerRack", maxChainsPerRack, 1);
        int oldLimit = settings.getMaxChainsPerRack();
        if (oldLimit == maxChainsPerRack) {
            return;
        }
        settings.setMaxChainsPerRack(maxChainsPerRack);
        logger.info("JsonConfigManager: maxChainsPerRack changed from " + oldLimit + " to " + maxChainsPerRack);
        for (ConfigChangeObserver observer : observers) {
            observer.onMaxChainsPerRackChanged(oldLimit, maxChainsPerRack);
        }
    }

    @Override
    public int getResolveRetries() {
        return settings.getResolveRetries();
    }

    @Override
    public void setResolveRetries(int resolveRetries) {
        validate("resolveRetries", resolveRetries, 0);
        settings.setResolveRetries(resolveRetries);
    }

    @Override
    public boolean isDefensiveIntegrityChecks() {
        return settings.isDefensiveIntegrityChecks();
    }

    @Override
    public void setDefensiveIntegrityChecks(boolean enabled) {
        settings.setDefensiveIntegrityChecks(enabled);
    }

    @Override
    public String getMixerPluginName() {
        return settings.getMixerPluginName();
    }

    @Override
    public String getUtilityPluginName() {
        return settings.getUtilityPluginName();
    }

    @Override
    public String getDefaultRackLabel() {
        return settings.getDefaultRackLabel();
    }

    @Override
    public String getUndoPrefix() {
        return settings.getUndoPrefix();
    }

    @Override
    public boolean isDebugLogging() {
        return settings.isDebugLogging();
    }

    @Override
    public void setDebugLogging(boolean debugLogging) {
        settings.setDebugLogging(debugLogging);
        logger.setDebugEnabled(debugLogging);
    }

    @Override
    public void addObserver(ConfigChangeObserver observer) {
        if (observer != null && !observers.contains(observer)) {
            observers.add(observer);
        }
    }

    @Override
    public void removeObserver(ConfigChangeObserver observer) {
        observers.remove(observer);
    }
}
