package org.fortranonjava.semantics;

import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A diagnostic about the source: its severity, the provenance range it is
 * anchored at, and its text.
 */
public record Message(Severity severity, ProvenanceRange location, String text) {
    @Override
    public String toString() {
        return severity + " " + location + ": " + text;
    }
}
