package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * A legacy label DO statement, {@code [name:] DO doLabel [,] [loop-control]}.
 * The loop body runs up to and including the statement labeled {@code doLabel}.
 * The parser leaves the body flat in the enclosing block; canonicalization
 * rewrites it into a {@link DoConstructNode}.
 */
public class LabelDoStmtNode extends StatementNode {
    public final String constructName;
    public final int doLabel;
    public final LoopControlNode loopControl;

    public LabelDoStmtNode(int label, String constructName, int doLabel, LoopControlNode loopControl,
                           ProvenanceRange source) {
        super(label);
        this.constructName = constructName;
        this.doLabel = doLabel;
        this.loopControl = loopControl;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
