package io.github.fabb.fxtree.hierarchy;

import io.github.fabb.fxtree.common.Logger;
import io.github.fabb.fxtree.common.data.FxNode;
import io.github.fabb.fxtree.common.data.HierarchyPath;
import io.github.fabb.fxtree.common.data.NodeKind;
import io.github.fabb.fxtree.common.data.StableId;
import io.github.fabb.fxtree.config.ConfigManager;
import io.github.fabb.fxtree.host.HandleResolver;
import io.github.fabb.fxtree.naming.NamingCodec;
import io.github.fabb.fxtree.naming.ParsedName;

import java.util.Optional;

/**
 * Builds device containers and keeps a device's internal parts named after the device.
 *
 * <p>Layout of a device container: the main plugin wrapper ({@code ..._FX: label}) at child 0,
 * the utility helper ({@code ..._Util}) at child 1, then any modulators ({@code ..._M<j>: label}).
 */
class DeviceAssembler {
    private final StructuralEditor editor;
    private final HandleResolver resolver;
    private final ConfigManager configManager;
    private final Logger logger;

    DeviceAssembler(StructuralEditor editor, HandleResolver resolver, ConfigManager configManager, Logger logger) {
        this.editor = editor;
        this.resolver = resolver;
        this.configManager = configManager;
        this.logger = logger;
    }

    /**
     * Creates a device around a plugin. The plugin is instantiated first, so a refused plugin
     * leaves the track untouched.
     *
     * @param pluginName Host plugin identifier
     * @param devicePath Path the device's name encodes
     * @param parentId   Chain to place the device in, or null for the track root
     * @param position   Position among the parent's children
     * @return identity of the device container
     */
    StableId assemble(String operation, String pluginName, HierarchyPath devicePath, StableId parentId, int position) {
        String label = NamingCodec.shortPluginName(pluginName);
        StableId fxId = editor.createPlugin(operation, pluginName, NamingCodec.encodeDeviceFx(devicePath, label), null, -1);
        StableId deviceId = editor.createContainer(operation,
            NamingCodec.encode(devicePath, NodeKind.DEVICE, label), parentId, position);
        editor.moveInto(operation, fxId, deviceId, 0);

        Optional<StableId> utility = editor.tryCreatePlugin(operation, configManager.getUtilityPluginName(),
            NamingCodec.encodeDeviceUtility(devicePath), deviceId, 1);
        if (utility.isEmpty()) {
            logger.warn("DeviceAssembler: Host refused utility plugin '" + configManager.getUtilityPluginName()
                + "', device " + devicePath + " has no utility");
        }
        logger.info("DeviceAssembler: Assembled device " + devicePath + " around '" + label + "'");
        return deviceId;
    }

    /**
     * Renames a device and its internal parts to a new path, keeping every label.
     * Nested racks inside the device keep their names.
     *
     * @return number of nodes renamed
     */
    int renameTree(StableId deviceId, HierarchyPath newPath) {
        FxNode device = editor.require(deviceId, "rename device");
        int renamed = 0;
        String deviceName = NamingCodec.parse(device.displayName())
            .filter(parsed -> parsed.role().kind() == NodeKind.DEVICE)
            .map(parsed -> NamingCodec.reencode(parsed, newPath))
            .orElseGet(() -> NamingCodec.encode(newPath, NodeKind.DEVICE, NamingCodec.stripPrefixes(device.displayName())));
        if (editor.rename(deviceId, deviceName)) {
            renamed++;
        }

        for (FxNode part : resolver.children(deviceId)) {
            Optional<ParsedName> parsed = NamingCodec.parse(part.displayName());
            if (parsed.isEmpty() || !parsed.get().role().isDeviceSubPart()) {
                continue;
            }
            if (editor.rename(part.stableId(), NamingCodec.reencode(parsed.get(), newPath))) {
                renamed++;
            }
        }
        return renamed;
    }
}
