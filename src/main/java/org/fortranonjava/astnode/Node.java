package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * The Node interface represents a node in the parse tree.
 * Every node can be visited by a Visitor and may carry the provenance range
 * of the source text it was parsed from, for diagnostics.
 */
public interface Node {
    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    /**
     * @return the provenance range of this node, or null if it has none
     */
    ProvenanceRange getSource();

    void setSource(ProvenanceRange source);
}
