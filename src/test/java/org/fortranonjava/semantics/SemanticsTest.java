package org.fortranonjava.semantics;

import org.fortranonjava.CompilerOptions;
import org.fortranonjava.astnode.*;
import org.fortranonjava.core.Configuration;
import org.fortranonjava.provenance.AllSources;
import org.fortranonjava.provenance.ProvenanceRange;
import org.fortranonjava.provenance.SourceFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticsTest {

    private TreeBuilder tb;
    private CompilerOptions options;
    private PrintStream originalOut;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        tb = new TreeBuilder();
        options = new CompilerOptions();
        originalOut = System.out;
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    public void testCleanProgramPasses() {
        ProgramNode program = tb.program(tb.labelDo(10, "i"), tb.assign("a", "0"), tb.cont(10));
        Semantics semantics = new Semantics(new SemanticsContext(options, null));

        assertTrue(semantics.perform(program));
        assertInstanceOf(DoConstructNode.class, program.units.get(0).executionPart.getElements().get(0));
        assertTrue(semantics.getContext().getMessages().isEmpty());
    }

    @Test
    public void testCheckersSeeCanonicalLoops() {
        // DO 10 CONCURRENT (i = 1:n); IF (x) EXIT; 10 CONTINUE
        ProgramNode program = tb.program(
                tb.labelDoConcurrent(10, "i"), tb.ifStmt("x", tb.exit(null)), tb.cont(10));
        Semantics semantics = new Semantics(new SemanticsContext(options, null));

        assertFalse(semantics.perform(program));
        assertEquals(1, semantics.getContext().getMessages().size());
    }

    @Test
    public void testMessagesFromAllCheckers() {
        ProgramNode program = tb.program(
                tb.ifStmt("x", tb.ifStmt("y", tb.assign("a", "1"))),
                tb.doConcurrent(null, "i", tb.exit(null)));
        SemanticsContext ctx = new SemanticsContext(options, null);

        assertFalse(new Semantics(ctx).perform(program));
        assertEquals(2, ctx.getMessages().count(Severity.ERROR));
    }

    @Test
    public void testWarningsAreFatalOnlyWhenRequested() {
        SemanticsContext ctx = new SemanticsContext(options, null);
        ctx.sayWarning(tb.range(3), "obsolescent feature");
        assertFalse(ctx.anyFatalError());

        options.warningsAsErrors = true;
        assertTrue(ctx.anyFatalError());
    }

    @Test
    public void testDebugOutputIncludesSourcePosition() {
        options.debugEnabled = true;
        AllSources allSources = new AllSources();
        ProvenanceRange file = allSources.addMainFile(new SourceFile("t.f90", "x = 1\nif (a) if (b) y = 2\n"));
        SemanticsContext ctx = new SemanticsContext(options, allSources);

        ctx.sayError(new ProvenanceRange(file.start().offsetBy(13), 12), "IF statement is not allowed in IF statement");

        String output = outputStream.toString();
        assertTrue(output.contains("t.f90:2:8"), output);
        assertTrue(output.contains("IF statement is not allowed"), output);
    }

    @Test
    public void testDebugOutputStartsWithBanner() {
        options.debugEnabled = true;
        new Semantics(new SemanticsContext(options, null)).perform(tb.program(tb.assign("a", "1")));

        assertTrue(outputStream.toString().startsWith(Configuration.getBanner()), outputStream.toString());
    }

    @Test
    public void testNoDebugOutputByDefault() {
        new Semantics(new SemanticsContext(options, null)).perform(
                tb.program(tb.labelDo(10, "i"), tb.cont(10)));

        assertEquals("", outputStream.toString());
    }
}
