package org.fortranonjava.lexer;

import com.ibm.icu.lang.UCharacter;
import org.fortranonjava.core.InternalCompilerError;
import org.fortranonjava.provenance.CookedSource;
import org.fortranonjava.provenance.OffsetToProvenanceMappings;
import org.fortranonjava.provenance.Provenance;
import org.fortranonjava.provenance.ProvenanceRange;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A buffer holding a contiguous sequence of characters that has been
 * partitioned into preprocessing tokens, along with the provenance of every
 * character.
 * <p>
 * Characters are appended one token at a time: {@link #putNextTokenChar}
 * accumulates the currently open token and {@link #closeToken()} ends it. The
 * last token always extends to the end of the buffer. Later text passes edit
 * the buffer in place (case folding, blank removal, comment clipping); each
 * edit keeps the characters, token boundaries and provenance mapping mutually
 * consistent.
 * <p>
 * Access to a token or character outside the sequence is an
 * {@link InternalCompilerError}: it means the calling pass disagrees with its
 * own token sequence.
 */
public class TokenSequence {
    private List<Integer> start = new ArrayList<>();
    private int nextStart = 0;
    private StringBuilder chars = new StringBuilder();
    private OffsetToProvenanceMappings provenances = new OffsetToProvenanceMappings();

    public TokenSequence() {
    }

    public TokenSequence(TokenSequence that) {
        put(that);
    }

    public TokenSequence(TokenSequence that, int at, int count) {
        put(that, at, count);
    }

    public TokenSequence(CharSequence s, Provenance provenance) {
        put(s, provenance);
    }

    public boolean isEmpty() {
        return start.isEmpty();
    }

    public void clear() {
        start.clear();
        nextStart = 0;
        chars.setLength(0);
        provenances.clear();
    }

    public void shrinkToFit() {
        ((ArrayList<Integer>) start).trimToSize();
        chars.trimToSize();
        provenances.shrinkToFit();
    }

    public void swap(TokenSequence that) {
        List<Integer> tmpStart = start;
        start = that.start;
        that.start = tmpStart;
        int tmpNext = nextStart;
        nextStart = that.nextStart;
        that.nextStart = tmpNext;
        StringBuilder tmpChars = chars;
        chars = that.chars;
        that.chars = tmpChars;
        OffsetToProvenanceMappings tmpProv = provenances;
        provenances = that.provenances;
        that.provenances = tmpProv;
    }

    public int sizeInTokens() {
        return start.size();
    }

    public int sizeInChars() {
        return chars.length();
    }

    public OffsetToProvenanceMappings getProvenanceMappings() {
        return provenances;
    }

    public CharBlock toCharBlock() {
        return new CharBlock(chars, 0, chars.length());
    }

    @Override
    public String toString() {
        return chars.toString();
    }

    private void checkToken(int token) {
        InternalCompilerError.check(token >= 0 && token < start.size(),
                "token %d out of range in sequence of %d tokens", token, start.size());
    }

    private int tokenBytes(int token) {
        int end = token + 1 >= start.size() ? chars.length() : start.get(token + 1);
        return end - start.get(token);
    }

    public int tokenStart(int token) {
        checkToken(token);
        return start.get(token);
    }

    public CharBlock tokenAt(int token) {
        checkToken(token);
        return new CharBlock(chars, start.get(token), tokenBytes(token));
    }

    public char charAt(int j) {
        InternalCompilerError.check(j >= 0 && j < chars.length(),
                "character %d out of range in sequence of %d characters", j, chars.length());
        return chars.charAt(j);
    }

    /**
     * Overwrites one character in place; its provenance is unchanged.
     */
    public void setCharAt(int j, char ch) {
        charAt(j);
        chars.setCharAt(j, ch);
    }

    public CharBlock currentOpenToken() {
        return new CharBlock(chars, nextStart, chars.length() - nextStart);
    }

    /**
     * Returns the index of the first token at or after {@code at} that is not
     * blank, or the token count if there is none.
     */
    public int skipBlanks(int at) {
        int tokens = start.size();
        for (; at < tokens; ++at) {
            if (!tokenAt(at).isBlank()) {
                return at;
            }
        }
        return tokens;
    }

    public void putNextTokenChar(char ch, Provenance provenance) {
        chars.append(ch);
        provenances.put(ProvenanceRange.single(provenance));
    }

    public void closeToken() {
        InternalCompilerError.check(nextStart < chars.length(), "closing an empty token at offset %d", nextStart);
        start.add(nextStart);
        nextStart = chars.length();
    }

    /**
     * Reopens the token closed by the immediately preceding {@link #closeToken()},
     * so that more characters can be appended to it.
     */
    public void reopenLastToken() {
        InternalCompilerError.check(!start.isEmpty(), "no token to reopen");
        nextStart = start.remove(start.size() - 1);
    }

    /**
     * Removes the last token, its characters, any characters of the open token
     * after it, and their provenances. Used by the lexer to back up.
     */
    public void removeLastToken() {
        InternalCompilerError.check(!start.isEmpty(), "no token to remove");
        popBack();
    }

    public void popBack() {
        InternalCompilerError.check(!start.isEmpty(), "no token to pop");
        int newLength = start.remove(start.size() - 1);
        int bytes = chars.length() - newLength;
        nextStart = newLength;
        chars.setLength(newLength);
        provenances.removeLastBytes(bytes);
    }

    public void put(TokenSequence that) {
        if (nextStart < chars.length()) {
            start.add(nextStart);
        }
        int offset = chars.length();
        for (int st : that.start) {
            start.add(st + offset);
        }
        chars.append(that.chars);
        nextStart = chars.length();
        provenances.put(that.provenances);
    }

    /**
     * Appends the tokens of {@code that}, giving their characters consecutive
     * provenances from {@code range}, which must be exactly as long as the tokens.
     */
    public void put(TokenSequence that, ProvenanceRange range) {
        long offset = 0;
        int tokens = that.sizeInTokens();
        for (int j = 0; j < tokens; ++j) {
            CharBlock tok = that.tokenAt(j);
            put(tok, range.offsetMember(offset));
            offset += tok.length();
        }
        InternalCompilerError.check(offset == range.size(),
                "token sequence of %d characters put with a provenance range of size %d", offset, range.size());
    }

    /**
     * Appends {@code tokens} tokens of {@code that} starting with token {@code at},
     * keeping their provenances.
     */
    public void put(TokenSequence that, int at, int tokens) {
        ProvenanceRange provenance = ProvenanceRange.EMPTY;
        long offset = 0;
        for (; tokens-- > 0; ++at) {
            CharBlock tok = that.tokenAt(at);
            int tokBytes = tok.length();
            for (int j = 0; j < tokBytes; ++j) {
                if (offset == provenance.size()) {
                    provenance = that.provenances.map(that.start.get(at) + j);
                    offset = 0;
                }
                putNextTokenChar(tok.charAt(j), provenance.offsetMember(offset++));
            }
            closeToken();
        }
    }

    /**
     * Appends one token whose characters have the consecutive provenances
     * {@code provenance, provenance + 1, ...}. An empty run appends nothing.
     */
    public void put(CharSequence s, Provenance provenance) {
        if (s.length() == 0) {
            return;
        }
        chars.append(s);
        provenances.put(new ProvenanceRange(provenance, s.length()));
        closeToken();
    }

    public Provenance getTokenProvenance(int token) {
        return getTokenProvenance(token, 0);
    }

    public Provenance getTokenProvenance(int token, int offset) {
        checkToken(token);
        InternalCompilerError.check(offset >= 0 && offset < tokenBytes(token),
                "offset %d out of range in token %d of %d characters", offset, token, tokenBytes(token));
        return provenances.map(start.get(token) + offset).start();
    }

    public ProvenanceRange getTokenProvenanceRange(int token) {
        return getTokenProvenanceRange(token, 0);
    }

    /**
     * Returns the provenances of a token from {@code offset} onward, truncated
     * where the token's provenance stops being contiguous.
     */
    public ProvenanceRange getTokenProvenanceRange(int token, int offset) {
        checkToken(token);
        InternalCompilerError.check(offset >= 0 && offset < tokenBytes(token),
                "offset %d out of range in token %d of %d characters", offset, token, tokenBytes(token));
        ProvenanceRange range = provenances.map(start.get(token) + offset);
        return range.prefix(tokenBytes(token) - offset);
    }

    /**
     * Returns the range from the provenance of the first character of token
     * {@code token} to the end of the provenance of the last character of the
     * last of {@code tokens} tokens. Only meaningful when those tokens came from
     * one contiguous region of the source.
     */
    public ProvenanceRange getIntervalProvenanceRange(int token, int tokens) {
        if (tokens == 0) {
            return ProvenanceRange.EMPTY;
        }
        checkToken(token);
        checkToken(token + tokens - 1);
        int last = token + tokens - 1;
        ProvenanceRange first = provenances.map(start.get(token));
        ProvenanceRange end = provenances.map(start.get(last) + tokenBytes(last) - 1);
        return ProvenanceRange.single(first.start()).cover(ProvenanceRange.single(end.start()));
    }

    public ProvenanceRange getProvenanceRange() {
        return getIntervalProvenanceRange(0, start.size());
    }

    private static boolean isDecimalDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private void lowerCaseAt(int j) {
        char ch = chars.charAt(j);
        if (!Character.isSurrogate(ch)) {
            int lower = UCharacter.toLowerCase(ch);
            if (lower <= Character.MAX_VALUE) {
                chars.setCharAt(j, (char) lower);
            }
        }
    }

    /**
     * Folds letters to lower case in place, except inside character literals and
     * Hollerith payloads. Token boundaries and provenances are unchanged.
     */
    public TokenSequence toLowerCase() {
        int tokens = start.size();
        int charCount = chars.length();
        int atToken = 0;
        for (int j = 0; j < charCount; ) {
            int tokenEnd = atToken + 1 < tokens ? start.get(++atToken) : charCount;
            int p = j;
            int limit = tokenEnd;
            j = tokenEnd;
            char last = chars.charAt(limit - 1);
            if (isDecimalDigit(chars.charAt(p))) {
                while (p < limit && isDecimalDigit(chars.charAt(p))) {
                    ++p;
                }
                if (p >= limit) {
                    // plain digit string
                } else if (chars.charAt(p) == 'h' || chars.charAt(p) == 'H') {
                    // Hollerith
                    chars.setCharAt(p, 'h');
                } else if (chars.charAt(p) == '_') {
                    // kind-prefixed character literal (e.g., 1_"ABC")
                } else {
                    // exponent
                    for (; p < limit; ++p) {
                        lowerCaseAt(p);
                    }
                }
            } else if (last == '\'' || last == '"') {
                if (chars.charAt(p) == last) {
                    // Character literal without prefix
                } else if (p + 1 < limit && chars.charAt(p + 1) == last) {
                    // BOZ-prefixed constant
                    for (; p < limit; ++p) {
                        lowerCaseAt(p);
                    }
                } else {
                    // Literal with kind-param prefix name (e.g., K_"ABC")
                    for (; p < limit && chars.charAt(p) != last; ++p) {
                        lowerCaseAt(p);
                    }
                }
            } else {
                for (; p < limit; ++p) {
                    lowerCaseAt(p);
                }
            }
        }
        return this;
    }

    public boolean hasBlanks() {
        return hasBlanks(0);
    }

    public boolean hasBlanks(int firstChar) {
        int tokens = sizeInTokens();
        for (int j = 0; j < tokens; ++j) {
            if (start.get(j) >= firstChar && tokenAt(j).isBlank()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasRedundantBlanks() {
        return hasRedundantBlanks(0);
    }

    public boolean hasRedundantBlanks(int firstChar) {
        int tokens = sizeInTokens();
        boolean lastWasBlank = false;
        for (int j = 0; j < tokens; ++j) {
            boolean isBlank = tokenAt(j).isBlank();
            if (isBlank && lastWasBlank && start.get(j) >= firstChar) {
                return true;
            }
            lastWasBlank = isBlank;
        }
        return false;
    }

    public TokenSequence removeBlanks() {
        return removeBlanks(0);
    }

    /**
     * Deletes every blank token that starts at or after {@code firstChar},
     * together with its provenance.
     */
    public TokenSequence removeBlanks(int firstChar) {
        int tokens = sizeInTokens();
        TokenSequence result = new TokenSequence();
        for (int j = 0; j < tokens; ++j) {
            if (!tokenAt(j).isBlank() || start.get(j) < firstChar) {
                result.put(this, j, 1);
            }
        }
        swap(result);
        return this;
    }

    public TokenSequence removeRedundantBlanks() {
        return removeRedundantBlanks(0);
    }

    /**
     * Deletes each blank token that directly follows another blank token and
     * starts at or after {@code firstChar}, together with its provenance.
     */
    public TokenSequence removeRedundantBlanks(int firstChar) {
        int tokens = sizeInTokens();
        TokenSequence result = new TokenSequence();
        boolean lastWasBlank = false;
        for (int j = 0; j < tokens; ++j) {
            boolean isBlank = tokenAt(j).isBlank();
            if (!isBlank || !lastWasBlank || start.get(j) < firstChar) {
                result.put(this, j, 1);
            }
            lastWasBlank = isBlank;
        }
        swap(result);
        return this;
    }

    public TokenSequence clipComment() {
        return clipComment(false);
    }

    /**
     * Truncates the sequence at the first token whose first non-blank character
     * is {@code '!'}, dropping that token and everything after it. Only the first
     * non-blank character of each token is examined and quoting context is not
     * tracked. With {@code skipFirst}, the first such token is kept (e.g. a
     * directive sentinel) and the next one clips.
     */
    public TokenSequence clipComment(boolean skipFirst) {
        int tokens = sizeInTokens();
        for (int j = 0; j < tokens; ++j) {
            if (tokenAt(j).firstNonBlank() == '!') {
                if (skipFirst) {
                    skipFirst = false;
                } else {
                    TokenSequence result = new TokenSequence();
                    result.put(this, 0, j);
                    swap(result);
                    return this;
                }
            }
        }
        return this;
    }

    /**
     * Appends the characters and their provenances to the cooked source.
     */
    public void emit(CookedSource cooked) {
        cooked.put(chars);
        cooked.putProvenanceMappings(provenances);
    }

    public void dump(Appendable out) {
        try {
            out.append("TokenSequence has ").append(String.valueOf(chars.length()))
                    .append(" chars; nextStart ").append(String.valueOf(nextStart)).append('\n');
            for (int j = 0; j < start.size(); ++j) {
                out.append('[').append(String.valueOf(j)).append("] @ ")
                        .append(String.valueOf(start.get(j))).append(" '")
                        .append(tokenAt(j)).append("'\n");
            }
            out.append(provenances.toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
