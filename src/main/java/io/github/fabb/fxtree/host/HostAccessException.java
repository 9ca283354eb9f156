package io.github.fabb.fxtree.host;

/**
 * Thrown by an {@link EffectHost} when a handle cannot be read, typically because it went stale.
 */
public class HostAccessException extends RuntimeException {

    public HostAccessException(String message) {
        super(message);
    }

    public HostAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
