package org.fortranonjava.provenance;

/**
 * A one-based line and column within a named file.
 */
public record SourcePosition(String fileName, int line, int column) {
    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
