package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A block DO construct: DO statement, body, END DO statement.
 */
public class DoConstructNode extends AbstractNode {
    public final NonLabelDoStmtNode doStmt;
    public final BlockNode body;
    public final EndDoStmtNode endDo;

    public DoConstructNode(NonLabelDoStmtNode doStmt, BlockNode body, EndDoStmtNode endDo, ProvenanceRange source) {
        this.doStmt = doStmt;
        this.body = body;
        this.endDo = endDo;
        this.source = source;
    }

    public String getName() {
        return doStmt.constructName;
    }

    public boolean isDoConcurrent() {
        return doStmt.loopControl != null && doStmt.loopControl.kind == LoopControlNode.Kind.CONCURRENT;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
