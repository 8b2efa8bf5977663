package org.fortranonjava.provenance;

import org.fortranonjava.core.FortranCompilerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The content of one source file, with a table of line start offsets for
 * translating character offsets into line and column numbers.
 */
public class SourceFile {
    private final String path;
    private final String content;
    private final int[] lineStart;

    public SourceFile(String path, String content) {
        this.path = path;
        this.content = content;
        this.lineStart = computeLineStarts(content);
    }

    public static SourceFile read(Path file) {
        try {
            return new SourceFile(file.toString(), Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FortranCompilerException(file.toString(), "Cannot open source file", e);
        }
    }

    private static int[] computeLineStarts(String content) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i + 1 < content.length()) {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String getPath() {
        return path;
    }

    public String getContent() {
        return content;
    }

    public int bytes() {
        return content.length();
    }

    public int lines() {
        return lineStart.length;
    }

    public int getLineStartOffset(int lineNumber) {
        return lineStart[lineNumber - 1];
    }

    /**
     * Returns the one-based line and column of a character offset.
     */
    public SourcePosition findOffsetLineAndColumn(int at) {
        int index = Arrays.binarySearch(lineStart, at);
        if (index < 0) {
            index = -index - 2;
        }
        return new SourcePosition(path, index + 1, at - lineStart[index] + 1);
    }
}
