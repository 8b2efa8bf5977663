package org.fortranonjava.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.fortranonjava.provenance.AllSources;
import org.fortranonjava.provenance.Provenance;
import org.fortranonjava.provenance.ProvenanceRange;
import org.fortranonjava.provenance.SourceFile;

/**
 * Splits text into preprocessing tokens inside a {@link TokenSequence}, giving
 * each character the provenance of its position in the text.
 * <p>
 * Tokens are: runs of blanks, identifiers, runs of decimal digits, character
 * literals (with doubled quotes as escapes), a {@code '!'} comment running to
 * the end of the line, a newline, and operators. Statements are not recognized
 * here; that is the parser's job.
 * <p>
 * NOTE:
 * The Lexer is optimized for speed rather than accuracy.
 * <p>
 * 1.5E10   // A real constant is split as `1`, `.`, `5`, `E10`
 * <p>
 * Consumers re-join such tokens as needed.
 */
public class Lexer {
    // Array to mark operator characters
    private static final boolean[] isOperator;

    static {
        isOperator = new boolean[128];
        for (char c : "=+-*/(),.:;%&<>[]?$@#\\^`{|}~".toCharArray()) {
            isOperator[c] = true;
        }
    }

    // Input characters to be tokenized
    private final CharSequence input;
    // Provenance of input.charAt(0)
    private final Provenance origin;
    private final TokenSequence tokens = new TokenSequence();
    // Current position in the input
    private int position;
    private final int length;

    public Lexer(CharSequence input, Provenance origin) {
        this.input = input;
        this.origin = origin;
        this.length = input.length();
        this.position = 0;
    }

    /**
     * Registers a file as the main source of a unit and tokenizes it.
     */
    public static TokenSequence tokenize(AllSources allSources, SourceFile file) {
        ProvenanceRange range = allSources.addMainFile(file);
        return new Lexer(file.getContent(), range.start()).tokenize();
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    private int getCurrentCodePoint() {
        return Character.codePointAt(input, position);
    }

    public TokenSequence tokenize() {
        while (position < length) {
            nextToken();
        }
        return tokens;
    }

    private void put(int from) {
        for (int j = from; j < position; j++) {
            tokens.putNextTokenChar(input.charAt(j), origin.offsetBy(j));
        }
        tokens.closeToken();
    }

    private void nextToken() {
        int start = position;
        char current = input.charAt(position);

        if (current == '\r') {
            // Carriage returns are dropped, so their provenance never appears
            position++;
            return;
        } else if (current == '\n') {
            position++;
        } else if (isBlank(current)) {
            while (position < length && isBlank(input.charAt(position))) {
                position++;
            }
        } else if (current >= '0' && current <= '9') {
            while (position < length && input.charAt(position) >= '0' && input.charAt(position) <= '9') {
                position++;
            }
        } else if (current == '\'' || current == '"') {
            consumeCharacterLiteral(current);
        } else if (current == '!') {
            while (position < length && input.charAt(position) != '\n') {
                position++;
            }
        } else if (isIdentifierStart(getCurrentCodePoint())) {
            consumeIdentifier();
        } else if (current < 128 && isOperator[current]) {
            consumeOperator();
        } else {
            position += Character.charCount(getCurrentCodePoint());
        }
        put(start);
    }

    private void consumeCharacterLiteral(char quote) {
        position++;
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\n') {
                // Unterminated; the parser reports it
                return;
            }
            position++;
            if (c == quote) {
                if (position < length && input.charAt(position) == quote) {
                    position++;
                } else {
                    return;
                }
            }
        }
    }

    private void consumeIdentifier() {
        position += Character.charCount(getCurrentCodePoint());
        while (position < length) {
            int cp = getCurrentCodePoint();
            if (isIdentifierPart(cp)) {
                position += Character.charCount(cp);
            } else {
                break;
            }
        }
    }

    private void consumeOperator() {
        char current = input.charAt(position);
        char next = position + 1 < length ? input.charAt(position + 1) : '\0';
        switch (current) {
            case '*':
                position += next == '*' ? 2 : 1;
                break;
            case '/':
                position += next == '/' || next == '=' ? 2 : 1;
                break;
            case '=':
                position += next == '=' || next == '>' ? 2 : 1;
                break;
            case '<':
            case '>':
                position += next == '=' ? 2 : 1;
                break;
            case ':':
                position += next == ':' ? 2 : 1;
                break;
            default:
                position++;
        }
    }
}
