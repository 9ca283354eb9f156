package io.github.fabb.fxtree.common.logging;

import io.github.fabb.fxtree.common.Logger;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Structured logging on top of {@link Logger}.
 * Tags each hierarchy operation with an operation id and reports its duration.
 */
public class StructuredLogger {
    private final Logger baseLogger;
    private final String component;
    private final AtomicLong operationCounter = new AtomicLong();

    public StructuredLogger(Logger baseLogger, String component) {
        this.baseLogger = baseLogger;
        this.component = component;
    }

    public Logger getBaseLogger() {
        return baseLogger;
    }

    /**
     * Generates a new operation id, unique within this logger.
     *
     * @return an id of the form {@code op-<n>}
     */
    public String generateOperationId() {
        return "op-" + operationCounter.incrementAndGet();
    }

    /**
     * Logs the start of an operation and returns a handle to report its outcome.
     *
     * @param operationId The id from {@link #generateOperationId()}
     * @param operation   The operation name
     * @param parameters  Operation parameters to log (may be empty)
     * @return the timed operation
     */
    public TimedOperation startTimedOperation(String operationId, String operation, Map<String, Object> parameters) {
        baseLogger.info(component + ": [" + operationId + "] " + operation + " started" + formatParameters(parameters));
        return new TimedOperation(operationId, operation, System.nanoTime());
    }

    public void logOperationWarning(String operationId, String message) {
        baseLogger.warn(component + ": [" + operationId + "] " + message);
    }

    private static String formatParameters(Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }
        return parameters.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", ", " (", ")"));
    }

    /**
     * A running operation. Exactly one of the completion methods should be called.
     */
    public class TimedOperation {
        private final String operationId;
        private final String operation;
        private final long startNanos;

        TimedOperation(String operationId, String operation, long startNanos) {
            this.operationId = operationId;
            this.operation = operation;
            this.startNanos = startNanos;
        }

        public String getOperationId() {
            return operationId;
        }

        public void complete(Object result) {
            baseLogger.info(component + ": [" + operationId + "] " + operation + " completed in "
                + elapsedMillis() + "ms" + (result != null ? " -> " + result : ""));
        }

        public void completeWithError(String errorCode, String message) {
            baseLogger.error(component + ": [" + operationId + "] " + operation + " failed in "
                + elapsedMillis() + "ms [" + errorCode + "] " + message);
        }

        private long elapsedMillis() {
            return (System.nanoTime() - startNanos) / 1_000_000L;
        }
    }
}
