package org.fortranonjava.astvisitor;

import org.fortranonjava.astnode.*;

/**
 * Depth-first walk of a parse tree that calls a {@link ParseTreeMutator}'s
 * {@code pre} hook on entering each node and its {@code post} hook on leaving it.
 * <p>
 * Children are visited in declaration order, which is source order, so
 * diagnostics come out in source order and a {@code post(BlockNode)} hook sees
 * every nested block already processed.
 * <p>
 * Usage:
 * <pre>
 *   ParseTreeWalker.walk(program, new CanonicalizationOfDoLoops(ctx));
 * </pre>
 */
public class ParseTreeWalker implements Visitor {
    private final ParseTreeMutator mutator;

    public ParseTreeWalker(ParseTreeMutator mutator) {
        this.mutator = mutator;
    }

    public static void walk(Node root, ParseTreeMutator mutator) {
        if (root != null) {
            root.accept(new ParseTreeWalker(mutator));
        }
    }

    private void walkChild(Node child) {
        if (child != null) {
            child.accept(this);
        }
    }

    @Override
    public void visit(ProgramNode node) {
        if (mutator.pre(node)) {
            for (ProgramUnitNode unit : node.units) {
                walkChild(unit);
            }
            mutator.post(node);
        }
    }

    @Override
    public void visit(ProgramUnitNode node) {
        if (mutator.pre(node)) {
            walkChild(node.executionPart);
            mutator.post(node);
        }
    }

    @Override
    public void visit(BlockNode node) {
        if (mutator.pre(node)) {
            BlockNode.Element next;
            for (BlockNode.Element element = node.begin(); element != node.end(); element = next) {
                // Capture the successor first; nothing is held once post() starts
                next = element.getNext();
                walkChild(element.getNode());
            }
            mutator.post(node);
        }
    }

    @Override
    public void visit(LabelDoStmtNode node) {
        if (mutator.pre(node)) {
            walkChild(node.loopControl);
            mutator.post(node);
        }
    }

    @Override
    public void visit(NonLabelDoStmtNode node) {
        if (mutator.pre(node)) {
            walkChild(node.loopControl);
            mutator.post(node);
        }
    }

    @Override
    public void visit(EndDoStmtNode node) {
        if (mutator.pre(node)) {
            mutator.post(node);
        }
    }

    @Override
    public void visit(DoConstructNode node) {
        if (mutator.pre(node)) {
            walkChild(node.doStmt);
            walkChild(node.body);
            walkChild(node.endDo);
            mutator.post(node);
        }
    }

    @Override
    public void visit(IfConstructNode node) {
        if (mutator.pre(node)) {
            walkChild(node.condition);
            walkChild(node.thenBlock);
            walkChild(node.elseBlock);
            mutator.post(node);
        }
    }

    @Override
    public void visit(IfStmtNode node) {
        if (mutator.pre(node)) {
            walkChild(node.condition);
            walkChild(node.action);
            mutator.post(node);
        }
    }

    @Override
    public void visit(ContinueStmtNode node) {
        if (mutator.pre(node)) {
            mutator.post(node);
        }
    }

    @Override
    public void visit(AssignmentStmtNode node) {
        if (mutator.pre(node)) {
            walkChild(node.variable);
            walkChild(node.expr);
            mutator.post(node);
        }
    }

    @Override
    public void visit(GotoStmtNode node) {
        if (mutator.pre(node)) {
            mutator.post(node);
        }
    }

    @Override
    public void visit(ExitStmtNode node) {
        if (mutator.pre(node)) {
            mutator.post(node);
        }
    }

    @Override
    public void visit(LoopControlNode node) {
        if (mutator.pre(node)) {
            walkChild(node.lower);
            walkChild(node.upper);
            walkChild(node.step);
            walkChild(node.condition);
            mutator.post(node);
        }
    }

    @Override
    public void visit(IdentifierNode node) {
        if (mutator.pre(node)) {
            mutator.post(node);
        }
    }

    @Override
    public void visit(NumberNode node) {
        if (mutator.pre(node)) {
            mutator.post(node);
        }
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        if (mutator.pre(node)) {
            walkChild(node.left);
            walkChild(node.right);
            mutator.post(node);
        }
    }
}
