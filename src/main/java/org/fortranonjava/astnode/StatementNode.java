package org.fortranonjava.astnode;

/**
 * Base class of statements: nodes that can carry a statement label.
 * A label of 0 means the statement is unlabeled.
 */
public abstract class StatementNode extends AbstractNode {
    public int label;

    protected StatementNode(int label) {
        this.label = label;
    }

    public boolean hasLabel() {
        return label > 0;
    }
}
