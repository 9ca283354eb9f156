package io.github.fabb.fxtree.naming;

import io.github.fabb.fxtree.common.data.HierarchyPath;
import io.github.fabb.fxtree.common.data.NodeKind;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes hierarchy paths into host display names and back.
 * Pure and stateless: no host calls, never throws on malformed input.
 *
 * <p>Grammar, first match wins:
 * <pre>
 * _R&lt;n&gt;_M                        mixer of rack n
 * R&lt;n&gt;_C&lt;m&gt;_D&lt;k&gt;_Util            utility of nested device
 * R&lt;n&gt;_C&lt;m&gt;_D&lt;k&gt;_M&lt;j&gt;: label      j-th modulator of nested device
 * R&lt;n&gt;_C&lt;m&gt;_D&lt;k&gt;_FX: label        main plugin of nested device
 * R&lt;n&gt;_C&lt;m&gt;_D&lt;k&gt;: label           nested device
 * R&lt;n&gt;_C&lt;m&gt;[: label]              chain m of rack n
 * R&lt;n&gt;: label                    rack n
 * D&lt;k&gt;_Util                       utility of standalone device
 * D&lt;k&gt;_M&lt;j&gt;: label               j-th modulator of standalone device
 * D&lt;k&gt;_FX: label                 main plugin of standalone device
 * D&lt;k&gt;: label                    standalone device
 * </pre>
 */
public final class NamingCodec {

    public static final String DEFAULT_RACK_LABEL = "Rack";
    public static final String DEFAULT_DEVICE_LABEL = "Device";
    public static final String LABEL_SEPARATOR = ": ";

    // Positive, no leading zeros, at most HierarchyPath.MAX_INDEX
    private static final String IDX = "([1-9]\\d{0,8})";
    private static final String LABEL = ": (.*)";
    private static final String NESTED = "R" + IDX + "_C" + IDX + "_D" + IDX;
    private static final String STANDALONE = "D" + IDX;

    private static final Pattern MIXER = Pattern.compile("^_R" + IDX + "_M$");
    private static final Pattern NESTED_UTIL = Pattern.compile("^" + NESTED + "_Util$");
    private static final Pattern NESTED_MOD = Pattern.compile("^" + NESTED + "_M" + IDX + LABEL + "$", Pattern.DOTALL);
    private static final Pattern NESTED_FX = Pattern.compile("^" + NESTED + "_FX" + LABEL + "$", Pattern.DOTALL);
    private static final Pattern NESTED_DEVICE = Pattern.compile("^" + NESTED + LABEL + "$", Pattern.DOTALL);
    private static final Pattern CHAIN = Pattern.compile("^R" + IDX + "_C" + IDX + "(?:" + LABEL + ")?$", Pattern.DOTALL);
    private static final Pattern RACK = Pattern.compile("^R" + IDX + LABEL + "$", Pattern.DOTALL);
    private static final Pattern STANDALONE_UTIL = Pattern.compile("^" + STANDALONE + "_Util$");
    private static final Pattern STANDALONE_MOD = Pattern.compile("^" + STANDALONE + "_M" + IDX + LABEL + "$", Pattern.DOTALL);
    private static final Pattern STANDALONE_FX = Pattern.compile("^" + STANDALONE + "_FX" + LABEL + "$", Pattern.DOTALL);
    private static final Pattern STANDALONE_DEVICE = Pattern.compile("^" + STANDALONE + LABEL + "$", Pattern.DOTALL);

    private static final List<Pattern> PLUGIN_FORMAT_PREFIXES = List.of(
        Pattern.compile("^VST3?i?: "),
        Pattern.compile("^AUi?: "),
        Pattern.compile("^JS: "),
        Pattern.compile("^CLAPi?: ")
    );
    private static final Pattern JS_PATH = Pattern.compile("^.+/");
    private static final Pattern MANUFACTURER_SUFFIX = Pattern.compile("\\s*\\([^)]+\\)\\s*$");
    private static final Pattern SHORT_PATH = Pattern.compile("_([DCMR]\\d+)$");

    private NamingCodec() {
    }

    // ------------------------------------------------------------------
    // Encoding
    // ------------------------------------------------------------------

    /**
     * Builds the display name of a rack, chain, device or mixer.
     *
     * @param path  The node's path; must have the shape the kind requires
     * @param kind  RACK, CHAIN, DEVICE or MIXER
     * @param label Human label; ignored for mixers, optional for chains
     * @return the display name
     * @throws IllegalArgumentException if the path shape does not fit the kind, or kind is PLAIN
     */
    public static String encode(HierarchyPath path, NodeKind kind, String label) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case RACK:
                requireShape(path.isRackPath(), path, kind);
                return "R" + path.rackIdx() + LABEL_SEPARATOR + orDefault(label, DEFAULT_RACK_LABEL);
            case CHAIN:
                requireShape(path.isChainPath(), path, kind);
                String chain = "R" + path.rackIdx() + "_C" + path.chainIdx();
                return label == null || label.isEmpty() ? chain : chain + LABEL_SEPARATOR + label;
            case DEVICE:
                requireShape(path.isDevicePath(), path, kind);
                return path.prefix() + LABEL_SEPARATOR + orDefault(label, DEFAULT_DEVICE_LABEL);
            case MIXER:
                requireShape(path.isRackPath(), path, kind);
                return "_R" + path.rackIdx() + "_M";
            default:
                throw new IllegalArgumentException("Plain nodes have no structured name");
        }
    }

    public static String encodeDeviceFx(HierarchyPath devicePath, String label) {
        requireShape(devicePath.isDevicePath(), devicePath, NodeKind.DEVICE);
        return devicePath.prefix() + "_FX" + LABEL_SEPARATOR + orDefault(label, DEFAULT_DEVICE_LABEL);
    }

    public static String encodeDeviceUtility(HierarchyPath devicePath) {
        requireShape(devicePath.isDevicePath(), devicePath, NodeKind.DEVICE);
        return devicePath.prefix() + "_Util";
    }

    public static String encodeModulator(HierarchyPath devicePath, int modulatorIdx, String label) {
        requireShape(devicePath.isDevicePath(), devicePath, NodeKind.DEVICE);
        if (modulatorIdx < 1) {
            throw new IllegalArgumentException("modulatorIdx must be positive: " + modulatorIdx);
        }
        return devicePath.prefix() + "_M" + modulatorIdx + LABEL_SEPARATOR + orDefault(label, "Modulator");
    }

    /**
     * Re-encodes a parsed name under a different path, keeping its role and label.
     * Used when renumbering rewrites a device together with its sub-parts.
     */
    public static String reencode(ParsedName parsed, HierarchyPath newPath) {
        switch (parsed.role()) {
            case DEVICE_FX:
                return encodeDeviceFx(newPath, parsed.label());
            case DEVICE_UTILITY:
                return encodeDeviceUtility(newPath);
            case DEVICE_MODULATOR:
                return encodeModulator(newPath, parsed.modulatorIdx(), parsed.label());
            default:
                return encode(newPath, parsed.role().kind(), parsed.label());
        }
    }

    // ------------------------------------------------------------------
    // Decoding
    // ------------------------------------------------------------------

    /**
     * Parses a display name against the grammar.
     *
     * @param name The display name (may be null)
     * @return the parsed name, or empty if no grammar row matches
     */
    public static Optional<ParsedName> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Matcher m;
        if ((m = MIXER.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.MIXER, HierarchyPath.rack(idx(m, 1)), null, null));
        }
        if ((m = NESTED_UTIL.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE_UTILITY, nestedPath(m), null, null));
        }
        if ((m = NESTED_MOD.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE_MODULATOR, nestedPath(m), idx(m, 4), m.group(5)));
        }
        if ((m = NESTED_FX.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE_FX, nestedPath(m), null, m.group(4)));
        }
        if ((m = NESTED_DEVICE.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE, nestedPath(m), null, m.group(4)));
        }
        // Chain must be tried before rack: a chain name starts with a rack prefix
        if ((m = CHAIN.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.CHAIN,
                HierarchyPath.chain(idx(m, 1), idx(m, 2)), null, m.group(3)));
        }
        if ((m = RACK.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.RACK, HierarchyPath.rack(idx(m, 1)), null, m.group(2)));
        }
        if ((m = STANDALONE_UTIL.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE_UTILITY,
                HierarchyPath.standaloneDevice(idx(m, 1)), null, null));
        }
        if ((m = STANDALONE_MOD.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE_MODULATOR,
                HierarchyPath.standaloneDevice(idx(m, 1)), idx(m, 2), m.group(3)));
        }
        if ((m = STANDALONE_FX.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE_FX,
                HierarchyPath.standaloneDevice(idx(m, 1)), null, m.group(2)));
        }
        if ((m = STANDALONE_DEVICE.matcher(name)).matches()) {
            return Optional.of(new ParsedName(ComponentRole.DEVICE,
                HierarchyPath.standaloneDevice(idx(m, 1)), null, m.group(2)));
        }
        return Optional.empty();
    }

    /**
     * Decodes the path a display name encodes.
     *
     * @param name The display name (may be null)
     * @return the path, or empty if the name is not structured
     */
    public static Optional<HierarchyPath> decode(String name) {
        return parse(name).map(ParsedName::path);
    }

    /**
     * Name-only classification. Device sub-parts and unstructured names are PLAIN.
     */
    public static NodeKind classify(String name) {
        return parse(name).map(parsed -> parsed.role().kind()).orElse(NodeKind.PLAIN);
    }

    public static boolean isRackName(String name) {
        return classify(name) == NodeKind.RACK;
    }

    public static boolean isChainName(String name) {
        return classify(name) == NodeKind.CHAIN;
    }

    public static boolean isDeviceName(String name) {
        return classify(name) == NodeKind.DEVICE;
    }

    public static boolean isMixerName(String name) {
        return classify(name) == NodeKind.MIXER;
    }

    public static boolean isUtilityName(String name) {
        return parse(name).map(parsed -> parsed.role() == ComponentRole.DEVICE_UTILITY).orElse(false);
    }

    /**
     * Human label of a structured name, or empty when there is none.
     */
    public static Optional<String> labelOf(String name) {
        return parse(name).map(ParsedName::label);
    }

    // ------------------------------------------------------------------
    // Index allocation
    // ------------------------------------------------------------------

    /**
     * Scans sibling names and returns {@code max + 1} of the extracted indices, or 1 if none.
     * Indices freed mid-sequence are never reused.
     *
     * @param existingNames Names to scan; unstructured names are skipped
     * @param extractor     Picks the relevant index from a parsed name, or null to skip it
     * @return the next free index
     */
    public static int nextFreeIndex(Collection<String> existingNames, Function<ParsedName, Integer> extractor) {
        int max = 0;
        for (String name : existingNames) {
            Optional<ParsedName> parsed = parse(name);
            if (parsed.isEmpty()) {
                continue;
            }
            Integer idx = extractor.apply(parsed.get());
            if (idx != null && idx > max) {
                max = idx;
            }
        }
        return max + 1;
    }

    // ------------------------------------------------------------------
    // Display helpers
    // ------------------------------------------------------------------

    /**
     * Short plugin label: strips the format prefix (case-sensitive), JS path and manufacturer suffix.
     * Unrecognised input is returned unchanged; null becomes the empty string.
     */
    public static String shortPluginName(String fullName) {
        if (fullName == null) {
            return "";
        }
        String name = stripFormatPrefix(fullName);
        name = JS_PATH.matcher(name).replaceFirst("");
        name = MANUFACTURER_SUFFIX.matcher(name).replaceFirst("");
        return name;
    }

    /**
     * Strips the structural prefix and the plugin format prefix, leaving the bare label.
     */
    public static String stripPrefixes(String name) {
        if (name == null) {
            return "";
        }
        String label = parse(name)
            .filter(parsed -> parsed.label() != null)
            .map(ParsedName::label)
            .orElse(name);
        label = stripFormatPrefix(label);
        return MANUFACTURER_SUFFIX.matcher(label).replaceFirst("");
    }

    /**
     * Local part of a path string: {@code R1_C1 -> C1}, {@code R1_C1_D2 -> D2}, {@code R2 -> R2}.
     */
    public static String shortPath(String fullPath) {
        if (fullPath == null || fullPath.isEmpty()) {
            return "";
        }
        Matcher m = SHORT_PATH.matcher(fullPath);
        return m.find() ? m.group(1) : fullPath;
    }

    private static String stripFormatPrefix(String name) {
        for (Pattern prefix : PLUGIN_FORMAT_PREFIXES) {
            Matcher m = prefix.matcher(name);
            if (m.find()) {
                return name.substring(m.end());
            }
        }
        return name;
    }

    private static HierarchyPath nestedPath(Matcher m) {
        return HierarchyPath.device(idx(m, 1), idx(m, 2), idx(m, 3));
    }

    private static int idx(Matcher m, int group) {
        return Integer.parseInt(m.group(group));
    }

    private static String orDefault(String label, String fallback) {
        return label == null ? fallback : label;
    }

    private static void requireShape(boolean ok, HierarchyPath path, NodeKind kind) {
        if (!ok) {
            throw new IllegalArgumentException("Path " + path + " does not fit kind " + kind);
        }
    }
}
