package org.fortranonjava.astvisitor;

import org.fortranonjava.astnode.*;

/**
 * The Visitor interface declares one visit method per parse tree node kind.
 * Nodes call back the method matching their own class from {@code accept}.
 */
public interface Visitor {
    void visit(ProgramNode node);

    void visit(ProgramUnitNode node);

    void visit(BlockNode node);

    void visit(LabelDoStmtNode node);

    void visit(NonLabelDoStmtNode node);

    void visit(EndDoStmtNode node);

    void visit(DoConstructNode node);

    void visit(IfConstructNode node);

    void visit(IfStmtNode node);

    void visit(ContinueStmtNode node);

    void visit(AssignmentStmtNode node);

    void visit(GotoStmtNode node);

    void visit(ExitStmtNode node);

    void visit(LoopControlNode node);

    void visit(IdentifierNode node);

    void visit(NumberNode node);

    void visit(BinaryOperatorNode node);
}
