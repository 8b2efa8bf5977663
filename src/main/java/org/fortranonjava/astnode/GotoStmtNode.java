package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * An unconditional {@code GO TO target} statement. The target is a
 * reference to another statement's label, not a structural edge.
 */
public class GotoStmtNode extends ActionStmtNode {
    public final int target;

    public GotoStmtNode(int label, int target, ProvenanceRange source) {
        super(label);
        this.target = target;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
