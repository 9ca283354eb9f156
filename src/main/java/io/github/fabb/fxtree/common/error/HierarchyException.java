package io.github.fabb.fxtree.common.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception raised when the host rejects a structural edit or the tree fails verification.
 * Carries an {@link ErrorCode}, the failing operation and optional details.
 */
public class HierarchyException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String operation;
    private final Map<String, Object> details;

    public HierarchyException(ErrorCode errorCode, String operation, String message) {
        this(errorCode, operation, message, Collections.emptyMap(), null);
    }

    public HierarchyException(ErrorCode errorCode, String operation, String message, Map<String, Object> details) {
        this(errorCode, operation, message, details, null);
    }

    public HierarchyException(ErrorCode errorCode, String operation, String message, Throwable cause) {
        this(errorCode, operation, message, Collections.emptyMap(), cause);
    }

    public HierarchyException(ErrorCode errorCode, String operation, String message,
                              Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.operation = operation;
        this.details = details == null ? Collections.emptyMap() : new LinkedHashMap<>(details);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    @Override
    public String toString() {
        return "HierarchyException[" + errorCode.getCode() + "] " + operation + ": " + getMessage();
    }
}
