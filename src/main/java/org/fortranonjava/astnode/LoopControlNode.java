package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

/**
 * The loop control of a DO statement: counted bounds
 * ({@code i = lower, upper [, step]}), {@code WHILE (condition)}, or a
 * {@code CONCURRENT (i = lower:upper[:step])} header.
 */
public class LoopControlNode extends AbstractNode {

    public enum Kind {
        BOUNDS, WHILE, CONCURRENT
    }

    public final Kind kind;
    public final String variable;
    public final Node lower;
    public final Node upper;
    public final Node step;
    public final Node condition;

    private LoopControlNode(Kind kind, String variable, Node lower, Node upper, Node step, Node condition,
                            ProvenanceRange source) {
        this.kind = kind;
        this.variable = variable;
        this.lower = lower;
        this.upper = upper;
        this.step = step;
        this.condition = condition;
        this.source = source;
    }

    public static LoopControlNode bounds(String variable, Node lower, Node upper, Node step, ProvenanceRange source) {
        return new LoopControlNode(Kind.BOUNDS, variable, lower, upper, step, null, source);
    }

    public static LoopControlNode whileLoop(Node condition, ProvenanceRange source) {
        return new LoopControlNode(Kind.WHILE, null, null, null, null, condition, source);
    }

    public static LoopControlNode concurrent(String variable, Node lower, Node upper, Node step,
                                             ProvenanceRange source) {
        return new LoopControlNode(Kind.CONCURRENT, variable, lower, upper, step, null, source);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
