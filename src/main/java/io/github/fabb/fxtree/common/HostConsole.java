package io.github.fabb.fxtree.common;

/**
 * Console output channel provided by the host application.
 */
@FunctionalInterface
public interface HostConsole {

    /**
     * Prints a single line to the host's script console.
     *
     * @param message The line to print
     */
    void println(String message);
}
