package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

import java.util.List;

/**
 * A main program or subprogram, with its execution part.
 */
public class ProgramUnitNode extends AbstractNode {

    public enum Kind {
        PROGRAM, SUBROUTINE, FUNCTION
    }

    public final Kind kind;
    public final String name;
    public final List<String> dummyArguments;
    public final BlockNode executionPart;

    public ProgramUnitNode(Kind kind, String name, List<String> dummyArguments, BlockNode executionPart,
                           ProvenanceRange source) {
        this.kind = kind;
        this.name = name;
        this.dummyArguments = dummyArguments;
        this.executionPart = executionPart;
        this.source = source;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
