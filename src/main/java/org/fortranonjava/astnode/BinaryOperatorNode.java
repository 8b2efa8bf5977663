package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * The BinaryOperatorNode class represents a binary operation, such as
 * {@code a + b} or {@code k == 5}.
 */
public class BinaryOperatorNode extends AbstractNode {
    public final String operator;
    public final Node left;
    public final Node right;

    public BinaryOperatorNode(String operator, Node left, Node right, ProvenanceRange source) {
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
