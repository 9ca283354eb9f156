package io.github.fabb.fxtree.common.error;

/**
 * Error codes for hierarchy operations.
 */
public enum ErrorCode {
    // Resolution
    NOT_FOUND("NOT_FOUND"),
    WRONG_KIND("WRONG_KIND"),
    HOST_READ_FAILED("HOST_READ_FAILED"),

    // Host refusals
    CONTAINER_CREATE_FAILED("CONTAINER_CREATE_FAILED"),
    CHILD_MOVE_FAILED("CHILD_MOVE_FAILED"),
    DELETE_FAILED("DELETE_FAILED"),
    CHAIN_LIMIT_EXCEEDED("CHAIN_LIMIT_EXCEEDED"),

    // Diagnostics
    INTEGRITY_VIOLATION("INTEGRITY_VIOLATION"),

    // Generic
    INVALID_PARAMETER("INVALID_PARAMETER"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
