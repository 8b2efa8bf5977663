package org.fortranonjava.lexer;

import org.fortranonjava.provenance.AllSources;
import org.fortranonjava.provenance.Provenance;
import org.fortranonjava.provenance.ProvenanceRange;
import org.fortranonjava.provenance.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<String> tokenTexts(TokenSequence ts) {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < ts.sizeInTokens(); i++) {
            texts.add(ts.tokenAt(i).toString());
        }
        return texts;
    }

    static Stream<Arguments> provideInputs() {
        return Stream.of(
                Arguments.of("a**b", List.of("a", "**", "b")),
                Arguments.of("x=>y", List.of("x", "=>", "y")),
                Arguments.of("a /= b", List.of("a", " ", "/=", " ", "b")),
                Arguments.of("integer :: n", List.of("integer", " ", "::", " ", "n")),
                Arguments.of("'it''s'", List.of("'it''s'")),
                Arguments.of("\"q\"", List.of("\"q\"")),
                Arguments.of("1.5E10", List.of("1", ".", "5", "E10")),
                Arguments.of("do 10 i\n", List.of("do", " ", "10", " ", "i", "\n")),
                Arguments.of("x ! hi\ny", List.of("x", " ", "! hi", "\n", "y")),
                Arguments.of("größe = 1", List.of("größe", " ", "=", " ", "1"))
        );
    }

    @ParameterizedTest
    @MethodSource("provideInputs")
    void testTokenSplitting(String input, List<String> expected) {
        assertEquals(expected, tokenTexts(new Lexer(input, new Provenance(1)).tokenize()));
    }

    @Test
    public void testCarriageReturnIsDropped() {
        TokenSequence ts = new Lexer("a\r\nb", new Provenance(10)).tokenize();

        assertEquals(List.of("a", "\n", "b"), tokenTexts(ts));
        assertEquals(new Provenance(12), ts.getTokenProvenance(1));
        assertEquals(2, ts.getProvenanceMappings().entryCount());
    }

    @Test
    public void testUnterminatedLiteralStopsAtNewline() {
        assertEquals(List.of("'abc", "\n", "x"), tokenTexts(new Lexer("'abc\nx", new Provenance(1)).tokenize()));
    }

    @Test
    public void testTokenizeRegistersMainFile() {
        AllSources allSources = new AllSources();
        SourceFile file = new SourceFile("main.f90", "a = 1\n");

        TokenSequence ts = Lexer.tokenize(allSources, file);

        assertEquals(1, allSources.getOrigins().size());
        ProvenanceRange range = allSources.getOrigins().get(0).covers();
        assertEquals(range.start(), ts.getTokenProvenance(0));
        assertEquals('=', allSources.charAt(ts.getTokenProvenance(2)));
        assertEquals("main.f90:1:3", allSources.getSourcePosition(ts.getTokenProvenance(2)).toString());
    }

    @Test
    public void testEveryCharacterMapsBackToItsSource() {
        AllSources allSources = new AllSources();
        SourceFile file = new SourceFile("loop.f90",
                "      DO 10 I = 1, N\r\n   10 A(I) = 'x''y' ! done\n      END\n");

        TokenSequence ts = Lexer.tokenize(allSources, file);

        for (int t = 0; t < ts.sizeInTokens(); t++) {
            CharBlock token = ts.tokenAt(t);
            for (int o = 0; o < token.length(); o++) {
                assertEquals(token.charAt(o), allSources.charAt(ts.getTokenProvenance(t, o)),
                        "token " + t + " offset " + o);
            }
        }
        ts.toLowerCase().removeBlanks().clipComment();
        for (int t = 0; t < ts.sizeInTokens(); t++) {
            char original = allSources.charAt(ts.getTokenProvenance(t));
            assertEquals(Character.toLowerCase(ts.tokenAt(t).charAt(0)), Character.toLowerCase(original));
        }
    }
}
