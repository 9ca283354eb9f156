package io.github.fabb.fxtree.classify;

import io.github.fabb.fxtree.common.error.ErrorCode;
import io.github.fabb.fxtree.common.error.HierarchyException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of an integrity walk.
 */
public record IntegrityReport(
    List<IntegrityViolation> violations,
    int nodesChecked
) {

    public IntegrityReport {
        violations = List.copyOf(violations);
    }

    public boolean isOk() {
        return violations.isEmpty();
    }

    public boolean hasStructuralViolations() {
        return violations.stream().anyMatch(v -> v.type().isStructural());
    }

    public List<IntegrityViolation> violationsOf(IntegrityViolation.Type type) {
        return violations.stream().filter(v -> v.type() == type).collect(Collectors.toList());
    }

    /**
     * Converts a failed report into an INTEGRITY_VIOLATION exception listing every violation.
     *
     * @param operation The operation that detected the problem
     */
    public HierarchyException toException(String operation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violations", toMap().get("violations"));
        String first = violations.isEmpty() ? "none"
            : violations.get(0).type() + " " + violations.get(0).message();
        return new HierarchyException(ErrorCode.INTEGRITY_VIOLATION, operation,
            violations.size() + " integrity violation(s), first: " + first, details);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ok", isOk());
        map.put("nodes_checked", nodesChecked);
        List<Map<String, Object>> list = new ArrayList<>();
        for (IntegrityViolation violation : violations) {
            list.add(violation.toMap());
        }
        map.put("violations", list);
        return map;
    }
}
