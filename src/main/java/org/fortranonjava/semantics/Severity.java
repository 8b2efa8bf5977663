package org.fortranonjava.semantics;

/**
 * Severity of a user-facing diagnostic. Only errors make a compilation fail.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    PORTABILITY("portability");

    private final String text;

    Severity(String text) {
        this.text = text;
    }

    public boolean isFatal() {
        return this == ERROR;
    }

    @Override
    public String toString() {
        return text;
    }
}
