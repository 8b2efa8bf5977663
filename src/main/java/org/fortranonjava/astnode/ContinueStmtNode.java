package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A CONTINUE statement. It does nothing; a labeled CONTINUE keeps its label
 * defined as a branch or loop target.
 */
public class ContinueStmtNode extends ActionStmtNode {
    public ContinueStmtNode(int label, ProvenanceRange source) {
        super(label);
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
