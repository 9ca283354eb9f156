package io.github.fabb.fxtree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON-bound settings document. Absent keys keep the field defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HierarchySettings {
    @JsonProperty("maxNestingDepth")
    private int maxNestingDepth = 64;

    @JsonProperty("maxChainsPerRack")
    private int maxChainsPerRack = 31;

    @JsonProperty("resolveRetries")
    private int resolveRetries = 2;

    @JsonProperty("defensiveIntegrityChecks")
    private boolean defensiveIntegrityChecks = true;

    @JsonProperty("mixerPluginName")
    private String mixerPluginName = "JS: FxTree/FxTree_Mixer";

    @JsonProperty("utilityPluginName")
    private String utilityPluginName = "JS: FxTree/FxTree_Utility";

    @JsonProperty("defaultRackLabel")
    private String defaultRackLabel = "Rack";

    @JsonProperty("undoPrefix")
    private String undoPrefix = "FxTree";

    @JsonProperty("debugLogging")
    private boolean debugLogging;

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getMaxChainsPerRack() {
        return maxChainsPerRack;
    }

    public void setMaxChainsPerRack(int maxChainsPerRack) {
        this.maxChainsPerRack = maxChainsPerRack;
    }

    public int getResolveRetries() {
        return resolveRetries;
    }

    public void setResolveRetries(int resolveRetries) {
        this.resolveRetries = resolveRetries;
    }

    public boolean isDefensiveIntegrityChecks() {
        return defensiveIntegrityChecks;
    }

    public void setDefensiveIntegrityChecks(boolean defensiveIntegrityChecks) {
        this.defensiveIntegrityChecks = defensiveIntegrityChecks;
    }


    public String getMixerPluginName() {
        return mixerPluginName;
    }

    public void setMixerPluginName(String mixerPluginName) {
        this.mixerPluginName = mixerPluginName;
    }

    public String getUtilityPluginName() {
        return utilityPluginName;
    }

    public void setUtilityPluginName(String utilityPluginName) {
        this.utilityPluginName = utilityPluginName;
    }

    public String getDefaultRackLabel() {
        return defaultRackLabel;
    }

    public void setDefaultRackLabel(String defaultRackLabel) {
        this.defaultRackLabel = defaultRackLabel;
    }

    public String getUndoPrefix() {
        return undoPrefix;
    }

    public void setUndoPrefix(String undoPrefix) {
        this.undoPrefix = undoPrefix;
    }

    public boolean isDebugLogging() {
        return debugLogging;
    }

    public void setDebugLogging(boolean debugLogging) {
        this.debugLogging = debugLogging;
    }
}
