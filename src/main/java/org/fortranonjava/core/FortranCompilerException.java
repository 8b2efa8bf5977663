package org.fortranonjava.core;

import java.io.Serial;

/**
 * FortranCompilerException reports problems with the compiler's own inputs
 * that are not source-level diagnostics, such as an unreadable source file or
 * a malformed options document.
 */
public class FortranCompilerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Detailed error message that includes the origin of the problem, if known
    private final String errorMessage;

    public FortranCompilerException(String message) {
        super(message);
        this.errorMessage = message.endsWith("\n") ? message : message + "\n";
    }

    /**
     * Constructs an exception that names the file being processed.
     *
     * @param fileName the file in which the problem occurred
     * @param message  the detail message describing the error
     * @param cause    the underlying failure
     */
    public FortranCompilerException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.errorMessage = message + " in " + fileName + "\n";
    }

    @Override
    public String getMessage() {
        return errorMessage;
    }
}
