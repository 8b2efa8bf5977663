package org.fortranonjava.provenance;

/**
 * One contiguous region of the provenance space and what it covers.
 */
public interface Origin {

    /**
     * The provenances allocated to this origin.
     */
    ProvenanceRange covers();

    /**
     * The provenance of the construct that introduced this origin, or an empty
     * range for the main source file.
     */
    ProvenanceRange replaces();

    char charAt(long offset);

    /**
     * A whole source file, included from {@code replaces} (empty for the main file).
     */
    record Inclusion(ProvenanceRange covers, SourceFile source, ProvenanceRange replaces) implements Origin {
        @Override
        public char charAt(long offset) {
            return source.getContent().charAt((int) offset);
        }
    }

    /**
     * The expansion text of one macro invocation.
     */
    record MacroExpansion(ProvenanceRange covers, ProvenanceRange definition, ProvenanceRange replaces,
                          String expansion) implements Origin {
        @Override
        public char charAt(long offset) {
            return expansion.charAt((int) offset);
        }
    }

    /**
     * Text supplied by the compiler itself.
     */
    record CompilerInsertion(ProvenanceRange covers, String text) implements Origin {
        @Override
        public ProvenanceRange replaces() {
            return ProvenanceRange.EMPTY;
        }

        @Override
        public char charAt(long offset) {
            return text.charAt((int) offset);
        }
    }
}
