package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A numeric literal, kept as its source text.
 */
public class NumberNode extends AbstractNode {
    public final String value;

    public NumberNode(String value, ProvenanceRange source) {
        this.value = value;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
