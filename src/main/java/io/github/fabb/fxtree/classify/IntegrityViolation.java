package io.github.fabb.fxtree.classify;

import io.github.fabb.fxtree.common.data.StableId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One integrity problem found by {@link IntegrityChecker}.
 */
public record IntegrityViolation(
    Type type,
    StableId stableId, // Nullable
    String message
) {

    public enum Type {
        CIRCULAR_REFERENCE(true),
        PARENT_MISMATCH(true),
        MAX_DEPTH_EXCEEDED(true),
        MIXER_COUNT_MISMATCH(false),
        RACK_PARENT_INVALID(false);

        private final boolean structural;

        Type(boolean structural) {
            this.structural = structural;
        }

        /**
         * Whether the host tree itself is broken, as opposed to a naming or layout inconsistency.
         */
        public boolean isStructural() {
            return structural;
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.name());
        map.put("stable_id", stableId != null ? stableId.value() : null);
        map.put("message", message);
        return map;
    }
}
