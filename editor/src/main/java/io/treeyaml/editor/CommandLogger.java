// file: src/main/java/io/treeyaml/editor/CommandLogger.java
package io.treeyaml.editor;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for command-level logging.
 *
 * Responsibilities:
 *  - One INFO line per editor command: name, argument, outcome and tree size.
 *  - WARNING (with stack trace) for unexpected exceptions surfaced by the console loop.
 *
 * Rejected notation is a normal user outcome and stays at INFO.
 */
public final class CommandLogger {
    private static final Logger log = Logger.getLogger(CommandLogger.class.getName());

    private CommandLogger() {
        // utility
    }

    /**
     * Log a completed command.
     *
     * @param command command name (insert, delete, parse, ...)
     * @param arg     argument as given, or null when the command takes none
     * @param result  outcome returned to the caller
     * @param size    node count of the tree after the command
     */
    public static void logCommand(String command, Object arg, CommandResult result, int size) {
        String msg = String.format(
                "cmd=%s%s -> %s (size=%d)",
                command,
                arg != null ? " arg=" + arg : "",
                result.message(),
                size
        );
        log.log(Level.INFO, msg);
    }

    /**
     * Log a console line that blew up with something other than a user error.
     *
     * @param line  the input line being executed
     * @param error the exception
     */
    public static void logFailure(String line, Throwable error) {
        log.log(Level.WARNING, "command failed: " + line, error);
    }
}
