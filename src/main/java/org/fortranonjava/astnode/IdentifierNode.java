package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A name used as a variable or other designator.
 */
public class IdentifierNode extends AbstractNode {
    public final String name;

    public IdentifierNode(String name, ProvenanceRange source) {
        this.name = name;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
