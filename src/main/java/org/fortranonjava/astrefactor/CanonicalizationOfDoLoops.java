package org.fortranonjava.astrefactor;

import org.fortranonjava.astnode.*;
import org.fortranonjava.astvisitor.LabelReferenceCollector;
import org.fortranonjava.astvisitor.ParseTreeMutator;
import org.fortranonjava.astvisitor.ParseTreeWalker;
import org.fortranonjava.core.Configuration;
import org.fortranonjava.core.InternalCompilerError;
import org.fortranonjava.provenance.ProvenanceRange;
import org.fortranonjava.semantics.SemanticsContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites legacy label DO loops into block DO constructs.
 * <p>
 * The parser leaves a label DO statement and the statements of its body flat in
 * the enclosing block, ending with the statement that bears the loop's terminal
 * label. Each block is scanned once, after all of its nested blocks have been
 * converted: label DO statements are stacked, and a labeled statement closes
 * every stacked loop, innermost first, whose terminal label it bears. Several
 * nested loops may share one terminal statement:
 * <pre>
 *       DO 10 I = 1, N
 *       DO 10 J = 1, M
 *    10 A(I, J) = 0
 * </pre>
 * becomes two nested DO constructs, the J loop inside the I loop, each ending
 * with an unlabeled END DO.
 * <p>
 * A label DO whose terminal statement is not in its block means label
 * resolution upstream is broken; that is an {@link InternalCompilerError}.
 */
public class CanonicalizationOfDoLoops implements ParseTreeMutator {

    private static final boolean TRACE = Configuration.isTraceEnabled(Configuration.TRACE_CANONICALIZE_ENV);

    private final SemanticsContext ctx;

    // Statements whose labels ended at least one label DO loop, by program unit;
    // statement labels are local to their unit
    private final Map<ProgramUnitNode, List<StatementNode>> loopTerminators = new IdentityHashMap<>();
    // Terminators seen outside any program unit, when a walk starts below one
    private final List<StatementNode> unscopedTerminators = new ArrayList<>();
    private ProgramUnitNode currentUnit;
    private int convertedLoops;

    public CanonicalizationOfDoLoops(SemanticsContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Converts every label DO loop in the program, then drops terminal
     * statement labels that nothing else refers to.
     *
     * @param program the parse tree, rewritten in place
     * @param ctx     context supplying options and debug logging
     */
    public static void canonicalizeDo(ProgramNode program, SemanticsContext ctx) {
        CanonicalizationOfDoLoops mutator = new CanonicalizationOfDoLoops(ctx);
        ParseTreeWalker.walk(program, mutator);
        if (ctx.getCompilerOptions().pruneDoTerminatorLabels) {
            mutator.pruneTerminatorLabels(program);
        }
        ctx.logDebug("canonicalizeDo: converted " + mutator.convertedLoops + " label DO loops");
    }

    public int getConvertedLoops() {
        return convertedLoops;
    }

    public List<StatementNode> getLoopTerminators() {
        List<StatementNode> all = new ArrayList<>(unscopedTerminators);
        for (List<StatementNode> terminators : loopTerminators.values()) {
            all.addAll(terminators);
        }
        return all;
    }

    /**
     * Removes the labels of loop terminal statements that are no longer
     * referenced once the label DO statements are gone. References are only
     * looked for in the program unit that owns the terminator; terminators
     * found outside any unit are checked against {@code root}.
     */
    public void pruneTerminatorLabels(Node root) {
        for (Map.Entry<ProgramUnitNode, List<StatementNode>> entry : loopTerminators.entrySet()) {
            pruneUnreferenced(entry.getValue(), LabelReferenceCollector.collect(entry.getKey()));
        }
        if (!unscopedTerminators.isEmpty()) {
            pruneUnreferenced(unscopedTerminators, LabelReferenceCollector.collect(root));
        }
    }

    private void pruneUnreferenced(List<StatementNode> terminators, Set<Integer> referenced) {
        for (StatementNode terminator : terminators) {
            if (terminator.hasLabel() && !referenced.contains(terminator.label)) {
                ctx.logDebug("canonicalizeDo: dropping unreferenced label " + terminator.label);
                terminator.label = 0;
            }
        }
    }

    @Override
    public boolean pre(ProgramUnitNode unit) {
        currentUnit = unit;
        return true;
    }

    @Override
    public void post(ProgramUnitNode unit) {
        currentUnit = null;
    }

    /**
     * When a block element is a label DO statement, returns its terminal
     * label, else zero.
     */
    private static int getLabelDoLoopLabel(Node node) {
        if (node instanceof LabelDoStmtNode labelDo) {
            return labelDo.doLabel;
        }
        return 0;
    }

    /**
     * A bare END DO in a block is there because the parser found its label on an
     * earlier label DO statement. Replace it with a CONTINUE so that the label
     * remains defined. Returns the label, or zero.
     */
    private static int replaceEndDoStmt(BlockNode.Element element) {
        if (element.getNode() instanceof EndDoStmtNode endDo) {
            InternalCompilerError.check(endDo.hasLabel(), "unlabeled END DO in block");
            element.setNode(new ContinueStmtNode(endDo.label, endDo.source));
            return endDo.label;
        }
        return 0;
    }

    /**
     * The statement whose label can end a loop: a labeled action statement, or
     * the END DO of a DO construct when it is labeled. Null if there is none.
     */
    private static StatementNode getPossibleLoopEnd(Node node) {
        if (node instanceof ActionStmtNode action && action.hasLabel()) {
            return action;
        } else if (node instanceof DoConstructNode doConstruct && doConstruct.endDo.hasLabel()) {
            return doConstruct.endDo;
        }
        return null;
    }

    private static ProvenanceRange cover(ProvenanceRange a, ProvenanceRange b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : a.cover(b);
    }

    /**
     * Moves the statements after the label DO, up to but not including
     * {@code nextAfterLoop}, into a new body, and replaces the label DO in place
     * with a DO construct holding the same label, name, loop control and body.
     */
    private void convertToBlockDoConstruct(BlockNode block, BlockNode.Element labelDoElement,
                                           BlockNode.Element nextAfterLoop) {
        LabelDoStmtNode labelDo = (LabelDoStmtNode) labelDoElement.getNode();
        BlockNode body = block.extract(labelDoElement.getNext(), nextAfterLoop);
        NonLabelDoStmtNode doStmt = new NonLabelDoStmtNode(
                labelDo.label, labelDo.constructName, labelDo.loopControl, labelDo.source);
        EndDoStmtNode endDo = new EndDoStmtNode(0, null, null);
        labelDoElement.setNode(new DoConstructNode(doStmt, body, endDo, cover(labelDo.source, body.source)));
        convertedLoops++;
        if (TRACE) {
            System.err.println("TRACE canonicalizeDo: DO " + labelDo.doLabel + " at " + labelDo.source
                    + " -> block DO with " + body.size() + " statements");
        }
    }

    /**
     * Converts the label DO loops of one block in place. Every nested block has
     * already been converted.
     */
    @Override
    public void post(BlockNode block) {
        Deque<BlockNode.Element> pendingDoLoopStack = new ArrayDeque<>();
        BlockNode.Element blockEnd = block.end();
        BlockNode.Element next;
        for (BlockNode.Element element = block.begin(); element != blockEnd; element = next) {
            // Capture the next element now, before "element" can be moved into a loop body
            next = element.getNext();
            if (getLabelDoLoopLabel(element.getNode()) > 0) {
                pendingDoLoopStack.push(element);
                continue;
            }
            int endDoLabel = replaceEndDoStmt(element);
            if (endDoLabel > 0) {
                InternalCompilerError.check(!pendingDoLoopStack.isEmpty(),
                        "END DO with label %d has no pending label DO", endDoLabel);
                InternalCompilerError.check(endDoLabel == getLabelDoLoopLabel(pendingDoLoopStack.peek().getNode()),
                        "END DO with label %d does not match innermost label DO %d",
                        endDoLabel, getLabelDoLoopLabel(pendingDoLoopStack.peek().getNode()));
            }
            StatementNode loopEnd = getPossibleLoopEnd(element.getNode());
            if (loopEnd == null) {
                continue;
            }
            // Several label DO loops may end here; close them innermost first
            while (!pendingDoLoopStack.isEmpty()) {
                BlockNode.Element doElement = pendingDoLoopStack.peek();
                if (getLabelDoLoopLabel(doElement.getNode()) != loopEnd.label) {
                    break;
                }
                convertToBlockDoConstruct(block, doElement, next);
                InternalCompilerError.check(doElement.getNext() == next,
                        "loop body extraction left statements behind label %d", loopEnd.label);
                if (currentUnit == null) {
                    unscopedTerminators.add(loopEnd);
                } else {
                    loopTerminators.computeIfAbsent(currentUnit, unit -> new ArrayList<>()).add(loopEnd);
                }
                pendingDoLoopStack.pop();
            }
        }
        if (!pendingDoLoopStack.isEmpty()) {
            throw InternalCompilerError.die(
                    "CanonicalizationOfDoLoops: %d loops remain stacked at end of block; topmost label is %d",
                    pendingDoLoopStack.size(), getLabelDoLoopLabel(pendingDoLoopStack.peek().getNode()));
        }
    }
}
