package io.github.fabb.fxtree.common;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Logger that writes through the host console.
 * Every line is prefixed with the project tag and the level.
 */
public class Logger {
    private static final String PREFIX = "[FxTree] ";

    private final HostConsole console;
    private volatile boolean debugEnabled;

    /**
     * Creates a new Logger instance.
     *
     * @param console The host console to print to
     */
    public Logger(HostConsole console) {
        this.console = console;
    }

    public void setDebugEnabled(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void info(String message) {
        console.println(PREFIX + "INFO: " + message);
    }

    public void warn(String message) {
        console.println(PREFIX + "WARN: " + message);
    }

    public void error(String message) {
        console.println(PREFIX + "ERROR: " + message);
    }

    /**
     * Logs an error together with the stack trace of its cause.
     *
     * @param message   The error message
     * @param throwable The cause
     */
    public void error(String message, Throwable throwable) {
        console.println(PREFIX + "ERROR: " + message);
        if (throwable != null) {
            StringWriter trace = new StringWriter();
            throwable.printStackTrace(new PrintWriter(trace));
            console.println(trace.toString());
        }
    }

    public void debug(String message) {
        if (debugEnabled) {
            console.println(PREFIX + "DEBUG: " + message);
        }
    }
}
