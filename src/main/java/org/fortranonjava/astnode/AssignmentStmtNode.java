package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * An assignment statement, {@code variable = expr}.
 */
public class AssignmentStmtNode extends ActionStmtNode {
    public final Node variable;
    public final Node expr;

    public AssignmentStmtNode(int label, Node variable, Node expr, ProvenanceRange source) {
        super(label);
        this.variable = variable;
        this.expr = expr;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
