package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A single-statement IF, {@code IF (condition) action}.
 * The action statement is unlabeled.
 */
public class IfStmtNode extends ActionStmtNode {
    public final Node condition;
    public final ActionStmtNode action;

    public IfStmtNode(int label, Node condition, ActionStmtNode action, ProvenanceRange source) {
        super(label);
        this.condition = condition;
        this.action = action;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
