package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * The opening statement of a block DO construct, {@code [name:] DO [loop-control]}.
 */
public class NonLabelDoStmtNode extends StatementNode {
    public final String constructName;
    public final LoopControlNode loopControl;

    public NonLabelDoStmtNode(int label, String constructName, LoopControlNode loopControl, ProvenanceRange source) {
        super(label);
        this.constructName = constructName;
        this.loopControl = loopControl;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
