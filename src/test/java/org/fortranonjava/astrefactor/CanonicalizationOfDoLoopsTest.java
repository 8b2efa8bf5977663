package org.fortranonjava.astrefactor;

import org.fortranonjava.CompilerOptions;
import org.fortranonjava.astnode.*;
import org.fortranonjava.astvisitor.ParseTreeWalker;
import org.fortranonjava.core.InternalCompilerError;
import org.fortranonjava.semantics.SemanticsContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalizationOfDoLoopsTest {

    private TreeBuilder tb;
    private CompilerOptions options;

    @BeforeEach
    void setUp() {
        tb = new TreeBuilder();
        options = new CompilerOptions();
    }

    private BlockNode canonicalize(ProgramNode program) {
        CanonicalizationOfDoLoops.canonicalizeDo(program, new SemanticsContext(options, null));
        return program.units.get(0).executionPart;
    }

    private static DoConstructNode doConstructAt(BlockNode block, int index) {
        Node node = block.getElements().get(index);
        assertInstanceOf(DoConstructNode.class, node, "expected a DO construct at " + index + " in\n" + block);
        return (DoConstructNode) node;
    }

    @Test
    public void testSimpleLabelDoBecomesBlockDo() {
        LabelDoStmtNode labelDo = tb.labelDo(10, "i");
        AssignmentStmtNode body = tb.assign("a", "0");
        ContinueStmtNode terminator = tb.cont(10);
        AssignmentStmtNode after = tb.assign("b", "1");
        BlockNode block = canonicalize(tb.program(labelDo, body, terminator, after));

        assertEquals(2, block.size());
        DoConstructNode loop = doConstructAt(block, 0);
        assertSame(after, block.getElements().get(1));
        assertEquals(List.of(body, terminator), loop.body.getElements());
        assertSame(labelDo.loopControl, loop.doStmt.loopControl);
        assertFalse(loop.endDo.hasLabel());
        assertNull(loop.endDo.constructName);
        assertNull(loop.endDo.source);
    }

    @Test
    public void testSharedTerminatorNestsInnerLoopInsideOuter() {
        LabelDoStmtNode outer = tb.labelDo(10, "i");
        LabelDoStmtNode inner = tb.labelDo(10, "j");
        AssignmentStmtNode body = tb.assign("a", "0");
        ContinueStmtNode terminator = tb.cont(10);
        BlockNode block = canonicalize(tb.program(outer, inner, body, terminator));

        assertEquals(1, block.size());
        DoConstructNode outerLoop = doConstructAt(block, 0);
        assertEquals("i", outerLoop.doStmt.loopControl.variable);
        assertEquals(1, outerLoop.body.size());
        DoConstructNode innerLoop = doConstructAt(outerLoop.body, 0);
        assertEquals("j", innerLoop.doStmt.loopControl.variable);
        assertEquals(List.of(body, terminator), innerLoop.body.getElements());
        assertFalse(outerLoop.endDo.hasLabel());
        assertFalse(innerLoop.endDo.hasLabel());
    }

    @Test
    public void testDistinctLabelsNestInStackOrder() {
        LabelDoStmtNode outer = tb.labelDo(10, "i");
        LabelDoStmtNode inner = tb.labelDo(20, "j");
        AssignmentStmtNode body = tb.assign("a", "0");
        ContinueStmtNode innerEnd = tb.cont(20);
        AssignmentStmtNode between = tb.assign("b", "1");
        ContinueStmtNode outerEnd = tb.cont(10);
        BlockNode block = canonicalize(tb.program(outer, inner, body, innerEnd, between, outerEnd));

        assertEquals(1, block.size());
        DoConstructNode outerLoop = doConstructAt(block, 0);
        assertEquals(3, outerLoop.body.size());
        DoConstructNode innerLoop = doConstructAt(outerLoop.body, 0);
        assertEquals(List.of(body, innerEnd), innerLoop.body.getElements());
        assertSame(between, outerLoop.body.getElements().get(1));
        assertSame(outerEnd, outerLoop.body.getElements().get(2));
    }

    @Test
    public void testBareEndDoIsReplacedByContinue() {
        LabelDoStmtNode labelDo = tb.labelDo(20, "i");
        AssignmentStmtNode body = tb.assign("a", "0");
        EndDoStmtNode endDo = tb.endDo(20);
        BlockNode block = canonicalize(tb.program(labelDo, body, endDo));

        DoConstructNode loop = doConstructAt(block, 0);
        assertEquals(2, loop.body.size());
        Node last = loop.body.getElements().get(1);
        assertInstanceOf(ContinueStmtNode.class, last);
        assertEquals(endDo.source, last.getSource());
    }

    @Test
    public void testUnreferencedTerminatorLabelIsDropped() {
        ContinueStmtNode terminator = tb.cont(10);
        BlockNode block = canonicalize(tb.program(tb.labelDo(10, "i"), tb.assign("a", "0"), terminator));

        assertEquals(1, block.size());
        assertFalse(terminator.hasLabel());
    }

    @Test
    public void testTerminatorLabelKeptWhenGotoRefersToIt() {
        LabelDoStmtNode labelDo = tb.labelDo(10, "i");
        IfStmtNode skip = tb.ifStmt("c", tb.gotoStmt(10));
        ContinueStmtNode terminator = tb.cont(10);
        canonicalize(tb.program(labelDo, skip, terminator));

        assertEquals(10, terminator.label);
    }

    @Test
    public void testGotoInOtherUnitDoesNotKeepTerminatorLabel() {
        ContinueStmtNode loopEnd = tb.cont(10);
        ContinueStmtNode jumpTarget = tb.cont(10);
        ProgramNode program = tb.program(
                tb.subroutine("a", tb.labelDo(10, "i"), tb.assign("x", "1"), loopEnd),
                tb.subroutine("b", tb.gotoStmt(10), jumpTarget));
        CanonicalizationOfDoLoops.canonicalizeDo(program, new SemanticsContext(options, null));

        assertFalse(loopEnd.hasLabel());
        assertEquals(10, jumpTarget.label);
    }

    @Test
    public void testTerminatorLabelKeptWhenGotoInSameUnit() {
        ContinueStmtNode firstEnd = tb.cont(10);
        ContinueStmtNode secondEnd = tb.cont(10);
        ProgramNode program = tb.program(
                tb.subroutine("a", tb.labelDo(10, "i"), tb.assign("x", "1"), firstEnd),
                tb.subroutine("b", tb.labelDo(10, "j"), tb.ifStmt("c", tb.gotoStmt(10)), secondEnd));
        CanonicalizationOfDoLoops.canonicalizeDo(program, new SemanticsContext(options, null));

        assertFalse(firstEnd.hasLabel());
        assertEquals(10, secondEnd.label);
    }

    @Test
    public void testTerminatorsFoundBelowUnitArePrunedAgainstWalkRoot() {
        CanonicalizationOfDoLoops mutator = new CanonicalizationOfDoLoops(new SemanticsContext(options, null));
        ContinueStmtNode terminator = tb.cont(10);
        BlockNode block = tb.block(tb.labelDo(10, "i"), tb.assign("a", "0"), terminator);
        ParseTreeWalker.walk(block, mutator);
        mutator.pruneTerminatorLabels(block);

        assertEquals(1, mutator.getLoopTerminators().size());
        assertFalse(terminator.hasLabel());
    }

    @Test
    public void testTerminatorLabelKeptWhenPruningDisabled() {
        options.pruneDoTerminatorLabels = false;
        ContinueStmtNode terminator = tb.cont(10);
        canonicalize(tb.program(tb.labelDo(10, "i"), tb.assign("a", "0"), terminator));

        assertEquals(10, terminator.label);
    }

    @Test
    public void testLabelAndNameOfLabelDoMoveToNewDoStatement() {
        LabelDoStmtNode labelDo = tb.labelDo(5, "outer", 10, "i");
        BlockNode block = canonicalize(tb.program(labelDo, tb.assign("a", "0"), tb.cont(10)));

        DoConstructNode loop = doConstructAt(block, 0);
        assertEquals(5, loop.doStmt.label);
        assertEquals("outer", loop.getName());
        assertSame(labelDo.source, loop.doStmt.source);
    }

    @Test
    public void testConstructSourceCoversHeaderThroughTerminator() {
        LabelDoStmtNode labelDo = tb.labelDo(10, "i");
        AssignmentStmtNode body = tb.assign("a", "0");
        ContinueStmtNode terminator = tb.cont(10);
        BlockNode block = canonicalize(tb.program(labelDo, body, terminator));

        DoConstructNode loop = doConstructAt(block, 0);
        assertEquals(labelDo.source.start(), loop.source.start());
        assertEquals(terminator.source.end(), loop.source.end());
        assertEquals(body.source.start(), loop.body.source.start());
    }

    @Test
    public void testDoConstructWithLabeledEndDoTerminatesLabelDo() {
        LabelDoStmtNode outer = tb.labelDo(50, "i");
        DoConstructNode inner = tb.doLoopEndingAt(50, "j", tb.assign("a", "0"));
        BlockNode block = canonicalize(tb.program(outer, inner));

        assertEquals(1, block.size());
        DoConstructNode outerLoop = doConstructAt(block, 0);
        assertEquals(List.of(inner), outerLoop.body.getElements());
        assertFalse(inner.endDo.hasLabel());
    }

    @Test
    public void testLoopsInNestedBlocksAreConverted() {
        LabelDoStmtNode outer = tb.labelDo(30, "i");
        LabelDoStmtNode inner = tb.labelDo(40, "j");
        AssignmentStmtNode body = tb.assign("a", "0");
        ContinueStmtNode innerEnd = tb.cont(40);
        IfConstructNode ifConstruct = tb.ifConstruct(null, inner, body, innerEnd);
        ContinueStmtNode outerEnd = tb.cont(30);
        BlockNode block = canonicalize(tb.program(outer, ifConstruct, outerEnd));

        DoConstructNode outerLoop = doConstructAt(block, 0);
        assertEquals(List.of(ifConstruct, outerEnd), outerLoop.body.getElements());
        assertEquals(1, ifConstruct.thenBlock.size());
        DoConstructNode innerLoop = doConstructAt(ifConstruct.thenBlock, 0);
        assertEquals(List.of(body, innerEnd), innerLoop.body.getElements());
    }

    @Test
    public void testLabeledStatementWithOtherLabelDoesNotCloseLoop() {
        ContinueStmtNode unrelated = tb.cont(99);
        GotoStmtNode jump = tb.gotoStmt(99);
        ContinueStmtNode terminator = tb.cont(10);
        BlockNode block = canonicalize(tb.program(tb.labelDo(10, "i"), unrelated, jump, terminator));

        DoConstructNode loop = doConstructAt(block, 0);
        assertEquals(List.of(unrelated, jump, terminator), loop.body.getElements());
        assertEquals(99, unrelated.label);
    }

    @Test
    public void testSequentialLoopsStaySiblings() {
        BlockNode block = canonicalize(tb.program(
                tb.labelDo(10, "i"), tb.assign("a", "0"), tb.cont(10),
                tb.labelDo(20, "j"), tb.assign("b", "0"), tb.cont(20)));

        assertEquals(2, block.size());
        assertEquals("i", doConstructAt(block, 0).doStmt.loopControl.variable);
        assertEquals("j", doConstructAt(block, 1).doStmt.loopControl.variable);
    }

    @Test
    public void testBlockWithoutLabelDoIsUnchanged() {
        AssignmentStmtNode a = tb.assign("a", "0");
        ContinueStmtNode c = tb.cont(7);
        BlockNode block = canonicalize(tb.program(a, c));

        assertEquals(List.of(a, c), block.getElements());
        assertEquals(7, c.label);
    }

    @Test
    public void testMissingTerminatorIsInternalError() {
        ProgramNode program = tb.program(tb.labelDo(60, "i"), tb.assign("a", "0"));

        InternalCompilerError error = assertThrows(InternalCompilerError.class, () -> canonicalize(program));
        assertTrue(error.getMessage().contains("60"), error.getMessage());
    }

    @Test
    public void testTerminatorInNestedBlockIsInternalError() {
        ProgramNode program = tb.program(tb.labelDo(60, "i"), tb.ifConstruct(null, tb.cont(60)));

        assertThrows(InternalCompilerError.class, () -> canonicalize(program));
    }

    @Test
    public void testConversionCountIsReported() {
        CanonicalizationOfDoLoops mutator = new CanonicalizationOfDoLoops(new SemanticsContext(options, null));
        ProgramNode program = tb.program(tb.labelDo(10, "i"), tb.labelDo(10, "j"), tb.cont(10));
        ParseTreeWalker.walk(program, mutator);

        assertEquals(2, mutator.getConvertedLoops());
        assertEquals(2, mutator.getLoopTerminators().size());
    }
}
