package org.fortranonjava.lexer;

/**
 * A borrowed view of {@code length} characters starting at {@code begin} in a
 * buffer owned by someone else, usually a {@link TokenSequence} or a
 * {@link org.fortranonjava.provenance.CookedSource}.
 * <p>
 * The view reads through to the buffer, so it sees in-place edits such as case
 * folding. It must not be used after its owner has removed or moved the
 * characters it covers.
 */
public final class CharBlock implements CharSequence {
    private final CharSequence buffer;
    private final int begin;
    private final int length;

    public CharBlock(CharSequence buffer, int begin, int length) {
        if (begin < 0 || length < 0 || begin + length > buffer.length()) {
            throw new IndexOutOfBoundsException("view [" + begin + ", " + (begin + length)
                    + ") exceeds buffer of length " + buffer.length());
        }
        this.buffer = buffer;
        this.begin = begin;
        this.length = length;
    }

    public CharSequence getBuffer() {
        return buffer;
    }

    public int getBegin() {
        return begin;
    }

    public int getEnd() {
        return begin + length;
    }

    @Override
    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    @Override
    public char charAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("index " + index + " in view of length " + length);
        }
        return buffer.charAt(begin + index);
    }

    @Override
    public CharBlock subSequence(int start, int end) {
        if (start < 0 || end > length || start > end) {
            throw new IndexOutOfBoundsException("subsequence [" + start + ", " + end + ") of view of length " + length);
        }
        return new CharBlock(buffer, begin + start, end - start);
    }

    static boolean isBlankChar(char ch) {
        return ch == ' ' || ch == '\t';
    }

    /**
     * True when every character is a blank (an empty view counts as blank).
     */
    public boolean isBlank() {
        for (int j = 0; j < length; j++) {
            if (!isBlankChar(buffer.charAt(begin + j))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the first character that is not a blank, or a blank if there is none.
     */
    public char firstNonBlank() {
        for (int j = 0; j < length; j++) {
            char ch = buffer.charAt(begin + j);
            if (!isBlankChar(ch)) {
                return ch;
            }
        }
        return ' ';
    }

    public boolean contentEquals(CharSequence that) {
        if (that.length() != length) {
            return false;
        }
        for (int j = 0; j < length; j++) {
            if (that.charAt(j) != buffer.charAt(begin + j)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return buffer.subSequence(begin, begin + length).toString();
    }
}
