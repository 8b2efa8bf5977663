package org.fortranonjava.semantics;

import org.fortranonjava.astnode.IfStmtNode;
import org.fortranonjava.astvisitor.ParseTreeMutator;

/**
 * Reports an IF statement whose action statement is itself an IF statement.
 */
public class IfStmtChecker implements ParseTreeMutator {
    private final SemanticsContext ctx;

    public IfStmtChecker(SemanticsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void post(IfStmtNode ifStmt) {
        if (ifStmt.action instanceof IfStmtNode nested) {
            ctx.sayError(nested.source, "IF statement is not allowed in IF statement");
        }
    }
}
