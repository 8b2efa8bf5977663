package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

import java.util.List;

/**
 * The root of a parse tree: the program units of one compiled unit, in source order.
 */
public class ProgramNode extends AbstractNode {
    public final List<ProgramUnitNode> units;

    public ProgramNode(List<ProgramUnitNode> units, ProvenanceRange source) {
        this.units = units;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
