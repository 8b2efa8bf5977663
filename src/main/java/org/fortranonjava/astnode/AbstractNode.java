package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.PrintVisitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * Abstract base class for parse tree nodes that includes the provenance range
 * of the source text the node was parsed from. The range is used for
 * diagnostics pointing to the exact location in the original source.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public ProvenanceRange source;

    @Override
    public ProvenanceRange getSource() {
        return source;
    }

    @Override
    public void setSource(ProvenanceRange source) {
        this.source = source;
    }

    /**
     * Returns a string representation of the subtree rooted at this node.
     *
     * @return a string representation of the parse tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
