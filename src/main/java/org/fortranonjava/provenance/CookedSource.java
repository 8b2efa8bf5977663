package org.fortranonjava.provenance;

import org.fortranonjava.core.InternalCompilerError;
import org.fortranonjava.lexer.CharBlock;

/**
 * The normalized text of a compiled unit as handed to the parser, with the
 * provenance of each of its characters.
 * <p>
 * Text is appended while the unit is prescanned and then {@link #marshal()}ed;
 * afterwards, views into the cooked text (such as the source ranges captured by
 * parse tree nodes) can be translated back to provenance.
 */
public class CookedSource {
    private final AllSources allSources;
    private final StringBuilder buffer = new StringBuilder();
    private final OffsetToProvenanceMappings provenanceMap = new OffsetToProvenanceMappings();
    private String data;

    public CookedSource(AllSources allSources) {
        this.allSources = allSources;
    }

    public AllSources getAllSources() {
        return allSources;
    }

    public void put(CharSequence chars) {
        InternalCompilerError.check(data == null, "cooked source is already marshaled");
        buffer.append(chars);
    }

    public void putProvenanceMappings(OffsetToProvenanceMappings mappings) {
        InternalCompilerError.check(data == null, "cooked source is already marshaled");
        provenanceMap.put(mappings);
    }

    /**
     * Freezes the text; the character count must match the provenance mapping.
     */
    public void marshal() {
        InternalCompilerError.check(buffer.length() == provenanceMap.size(),
                "cooked source has %d characters but %d mapped provenances",
                buffer.length(), provenanceMap.size());
        data = buffer.toString();
    }

    public String getData() {
        InternalCompilerError.check(data != null, "cooked source is not yet marshaled");
        return data;
    }

    public CharBlock getCharBlock(int begin, int length) {
        return new CharBlock(getData(), begin, length);
    }

    public ProvenanceRange getProvenanceRange(int begin, int length) {
        if (length == 0) {
            return ProvenanceRange.EMPTY;
        }
        ProvenanceRange first = provenanceMap.map(begin);
        ProvenanceRange last = provenanceMap.map(begin + length - 1);
        return ProvenanceRange.single(first.start()).cover(ProvenanceRange.single(last.start()));
    }

    /**
     * Translates a view into the cooked text back to provenance, from the start
     * of its first character to the end of its last.
     */
    public ProvenanceRange getProvenanceRange(CharBlock block) {
        InternalCompilerError.check(block.getBuffer() == data,
                "character block does not point into the cooked source");
        return getProvenanceRange(block.getBegin(), block.length());
    }

    public OffsetToProvenanceMappings getProvenanceMap() {
        return provenanceMap;
    }
}
