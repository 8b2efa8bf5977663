package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * An {@code END DO [name]} statement. Normally it closes a
 * {@link DoConstructNode}; a labeled one may also appear bare in a block as the
 * terminal statement of a label DO loop.
 */
public class EndDoStmtNode extends StatementNode {
    public final String constructName;

    public EndDoStmtNode(int label, String constructName, ProvenanceRange source) {
        super(label);
        this.constructName = constructName;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
