package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * An {@code EXIT [construct-name]} statement. Without a name it leaves the
 * innermost DO construct.
 */
public class ExitStmtNode extends ActionStmtNode {
    public final String constructName;

    public ExitStmtNode(int label, String constructName, ProvenanceRange source) {
        super(label);
        this.constructName = constructName;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
