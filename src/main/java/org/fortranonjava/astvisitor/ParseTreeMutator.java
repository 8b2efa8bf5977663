package org.fortranonjava.astvisitor;

import org.fortranonjava.astnode.*;

/**
 * Hooks called by {@link ParseTreeWalker} around each node.
 * <p>
 * For every node kind, {@code pre} runs before the node's children are walked;
 * returning false means the hook handled the whole subtree, and neither the
 * children nor {@code post} are visited. {@code post} runs after every child has
 * been completely walked. Both default to no-ops, so a pass overrides only the
 * kinds it cares about.
 * <p>
 * {@code post(BlockNode)} may insert, remove or splice elements of that block.
 */
public interface ParseTreeMutator {
    default boolean pre(ProgramNode node) {
        return true;
    }

    default void post(ProgramNode node) {
    }

    default boolean pre(ProgramUnitNode node) {
        return true;
    }

    default void post(ProgramUnitNode node) {
    }

    default boolean pre(BlockNode node) {
        return true;
    }

    default void post(BlockNode node) {
    }

    default boolean pre(LabelDoStmtNode node) {
        return true;
    }

    default void post(LabelDoStmtNode node) {
    }

    default boolean pre(NonLabelDoStmtNode node) {
        return true;
    }

    default void post(NonLabelDoStmtNode node) {
    }

    default boolean pre(EndDoStmtNode node) {
        return true;
    }

    default void post(EndDoStmtNode node) {
    }

    default boolean pre(DoConstructNode node) {
        return true;
    }

    default void post(DoConstructNode node) {
    }

    default boolean pre(IfConstructNode node) {
        return true;
    }

    default void post(IfConstructNode node) {
    }

    default boolean pre(IfStmtNode node) {
        return true;
    }

    default void post(IfStmtNode node) {
    }

    default boolean pre(ContinueStmtNode node) {
        return true;
    }

    default void post(ContinueStmtNode node) {
    }

    default boolean pre(AssignmentStmtNode node) {
        return true;
    }

    default void post(AssignmentStmtNode node) {
    }

    default boolean pre(GotoStmtNode node) {
        return true;
    }

    default void post(GotoStmtNode node) {
    }

    default boolean pre(ExitStmtNode node) {
        return true;
    }

    default void post(ExitStmtNode node) {
    }

    default boolean pre(LoopControlNode node) {
        return true;
    }

    default void post(LoopControlNode node) {
    }

    default boolean pre(IdentifierNode node) {
        return true;
    }

    default void post(IdentifierNode node) {
    }

    default boolean pre(NumberNode node) {
        return true;
    }

    default void post(NumberNode node) {
    }

    default boolean pre(BinaryOperatorNode node) {
        return true;
    }

    default void post(BinaryOperatorNode node) {
    }
}
