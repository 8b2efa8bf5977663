package org.fortranonjava;

import org.fortranonjava.core.FortranCompilerException;
import org.fortranonjava.core.IntrinsicTypeDefaultKinds.TypeCategory;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerOptionsTest {

    @Test
    public void testDefaults() {
        CompilerOptions options = CompilerOptions.fromYaml("");

        assertFalse(options.debugEnabled);
        assertFalse(options.warningsAsErrors);
        assertTrue(options.pruneDoTerminatorLabels);
        assertEquals(4, options.defaultKinds.getDefaultKind(TypeCategory.INTEGER));
    }

    @Test
    public void testOptionsFromYamlString() {
        CompilerOptions options = CompilerOptions.fromYaml(
                "debugEnabled: true\n" +
                        "warningsAsErrors: true\n" +
                        "fileName: prog.f90\n" +
                        "defaultKinds:\n" +
                        "  integer: 8\n" +
                        "  real: 8\n");

        assertTrue(options.debugEnabled);
        assertTrue(options.warningsAsErrors);
        assertEquals("prog.f90", options.fileName);
        assertEquals(8, options.defaultKinds.getDefaultKind(TypeCategory.INTEGER));
        assertEquals(8, options.defaultKinds.getDefaultKind(TypeCategory.COMPLEX));
    }

    @Test
    public void testOptionsFromResourceFile() {
        InputStream in = getClass().getClassLoader().getResourceAsStream("compiler-options.yaml");
        assertNotNull(in);

        CompilerOptions options = CompilerOptions.fromYaml(in, "compiler-options.yaml");

        assertFalse(options.pruneDoTerminatorLabels);
        assertEquals(2, options.defaultKinds.getDefaultKind(TypeCategory.CHARACTER));
        assertEquals(16, options.defaultKinds.doublePrecisionKind());
    }

    @Test
    public void testUnknownOptionIsRejected() {
        FortranCompilerException e = assertThrows(FortranCompilerException.class,
                () -> CompilerOptions.fromYaml("optimize: 3"));
        assertTrue(e.getMessage().contains("optimize"), e.getMessage());
    }

    @Test
    public void testBadValuesAreRejected() {
        assertThrows(FortranCompilerException.class, () -> CompilerOptions.fromYaml("debugEnabled: maybe"));
        assertThrows(FortranCompilerException.class, () -> CompilerOptions.fromYaml("defaultKinds: {integer: 3}"));
        assertThrows(FortranCompilerException.class, () -> CompilerOptions.fromYaml("defaultKinds: 4"));
        assertThrows(FortranCompilerException.class, () -> CompilerOptions.fromYaml("- a list"));
        assertThrows(FortranCompilerException.class, () -> CompilerOptions.fromYaml("key: [unclosed"));
    }

    @Test
    public void testCloneIsIndependentForFlags() {
        CompilerOptions options = new CompilerOptions();
        CompilerOptions copy = options.clone();
        copy.debugEnabled = true;

        assertFalse(options.debugEnabled);
        assertTrue(copy.toString().contains("debugEnabled=true"));
    }
}
