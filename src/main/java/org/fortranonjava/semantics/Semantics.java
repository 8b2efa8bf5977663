package org.fortranonjava.semantics;

import org.fortranonjava.astnode.ProgramNode;
import org.fortranonjava.astrefactor.CanonicalizationOfDoLoops;
import org.fortranonjava.astvisitor.ParseTreeMutator;
import org.fortranonjava.astvisitor.ParseTreeWalker;
import org.fortranonjava.core.Configuration;

import java.util.List;

/**
 * Runs the shape normalization and the statement checkers over a program,
 * one after the other.
 * <p>
 * Usage:
 * <pre>
 *   SemanticsContext ctx = new SemanticsContext(options, allSources);
 *   boolean ok = new Semantics(ctx).perform(program);
 * </pre>
 */
public class Semantics {
    private final SemanticsContext ctx;

    public Semantics(SemanticsContext ctx) {
        this.ctx = ctx;
    }

    public SemanticsContext getContext() {
        return ctx;
    }

    /**
     * Canonicalizes label DO loops in place, then runs every checker.
     *
     * @return true if no fatal message was reported
     */
    public boolean perform(ProgramNode program) {
        ctx.logDebug(Configuration.getBanner());
        CanonicalizationOfDoLoops.canonicalizeDo(program, ctx);
        for (ParseTreeMutator checker : createCheckers()) {
            ctx.logDebug("semantics: running " + checker.getClass().getSimpleName());
            ParseTreeWalker.walk(program, checker);
        }
        return !ctx.anyFatalError();
    }

    private List<ParseTreeMutator> createCheckers() {
        return List.of(new IfStmtChecker(ctx), new DoConcurrentExitChecker(ctx));
    }
}
