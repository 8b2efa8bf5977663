package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * The IfConstructNode class represents a block IF construct,
 * {@code [name:] IF (condition) THEN ... [ELSE ...] END IF [name]}.
 * The elseBlock is null when there is no ELSE part.
 */
public class IfConstructNode extends AbstractNode {
    public final String constructName;
    public final Node condition;
    public final BlockNode thenBlock;
    public final BlockNode elseBlock;

    public IfConstructNode(String constructName, Node condition, BlockNode thenBlock, BlockNode elseBlock,
                           ProvenanceRange source) {
        this.constructName = constructName;
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
