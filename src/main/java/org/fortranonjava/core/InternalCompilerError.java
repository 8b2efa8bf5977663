package org.fortranonjava.core;

import java.io.Serial;

/**
 * Raised when a pass finds its input inconsistent with guarantees that an
 * earlier phase should have established, such as a label DO whose terminal
 * statement never appears in its block, or a token index outside its
 * TokenSequence.
 * <p>
 * This is not a user error. It extends {@link Error} so that it is never
 * absorbed by handlers that collect ordinary compilation failures, and the
 * running pass is abandoned with no partial tree handed downstream.
 */
public class InternalCompilerError extends Error {
    @Serial
    private static final long serialVersionUID = 1L;

    public InternalCompilerError(String message) {
        super("INTERNAL: " + message);
    }

    public InternalCompilerError(String message, Throwable cause) {
        super("INTERNAL: " + message, cause);
    }

    /**
     * Fails with a formatted message when the condition does not hold.
     *
     * @param condition the invariant being asserted
     * @param format    a {@link String#format} pattern
     * @param args      pattern arguments
     */
    public static void check(boolean condition, String format, Object... args) {
        if (!condition) {
            throw new InternalCompilerError(String.format(format, args));
        }
    }

    public static InternalCompilerError die(String format, Object... args) {
        return new InternalCompilerError(String.format(format, args));
    }
}
