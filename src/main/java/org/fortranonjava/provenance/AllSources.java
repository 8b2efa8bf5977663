package org.fortranonjava.provenance;

import org.fortranonjava.core.InternalCompilerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The provenance space of one compiled unit.
 * <p>
 * Every source file, macro expansion and compiler insertion gets its own
 * contiguous range of provenances, allocated in order. The space only grows
 * while the unit is being lexed; {@link #freeze()} then makes it read-only, and
 * a frozen instance can be shared by later phases without synchronization.
 * Provenance 0 is never allocated so that it can stand for "no provenance".
 */
public class AllSources {
    // Origins keyed by the first provenance they cover
    private final TreeMap<Long, Origin> origins = new TreeMap<>();
    private final List<Origin> originList = new ArrayList<>();
    private long nextOffset = 1;
    private boolean frozen;

    public ProvenanceRange addIncludedFile(SourceFile source, ProvenanceRange from) {
        ProvenanceRange covers = allocate(source.bytes());
        register(new Origin.Inclusion(covers, source, from));
        return covers;
    }

    public ProvenanceRange addMainFile(SourceFile source) {
        return addIncludedFile(source, ProvenanceRange.EMPTY);
    }

    public ProvenanceRange addMacroCall(ProvenanceRange definition, ProvenanceRange use, String expansion) {
        ProvenanceRange covers = allocate(expansion.length());
        register(new Origin.MacroExpansion(covers, definition, use, expansion));
        return covers;
    }

    public ProvenanceRange addCompilerInsertion(String text) {
        ProvenanceRange covers = allocate(text.length());
        register(new Origin.CompilerInsertion(covers, text));
        return covers;
    }

    private ProvenanceRange allocate(int size) {
        if (frozen) {
            throw new IllegalStateException("provenance space is frozen");
        }
        // Empty origins still get one provenance so that each origin is addressable
        long allocated = Math.max(size, 1);
        ProvenanceRange range = new ProvenanceRange(new Provenance(nextOffset), size);
        nextOffset += allocated;
        return range;
    }

    private void register(Origin origin) {
        origins.put(origin.covers().start().offset(), origin);
        originList.add(origin);
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Total extent of the space, including the reserved provenance 0.
     */
    public long size() {
        return nextOffset;
    }

    public List<Origin> getOrigins() {
        return Collections.unmodifiableList(originList);
    }

    public boolean isValid(Provenance p) {
        return findOrigin(p) != null;
    }

    public Origin getOrigin(Provenance p) {
        Origin origin = findOrigin(p);
        InternalCompilerError.check(origin != null, "provenance %s is not in any origin", p);
        return origin;
    }

    private Origin findOrigin(Provenance p) {
        Map.Entry<Long, Origin> entry = origins.floorEntry(p.offset());
        if (entry == null) {
            return null;
        }
        Origin origin = entry.getValue();
        return origin.covers().contains(p) ? origin : null;
    }

    /**
     * Returns the original character at a provenance.
     */
    public char charAt(Provenance p) {
        Origin origin = getOrigin(p);
        return origin.charAt(origin.covers().memberOffset(p));
    }

    /**
     * Translates a provenance into a file, line and column. Positions inside a
     * macro expansion resolve to the macro invocation; compiler insertions have
     * no file and report their own text offset.
     */
    public SourcePosition getSourcePosition(Provenance p) {
        Origin origin = getOrigin(p);
        long offset = origin.covers().memberOffset(p);
        if (origin instanceof Origin.Inclusion inclusion) {
            return inclusion.source().findOffsetLineAndColumn((int) offset);
        } else if (origin instanceof Origin.MacroExpansion macro) {
            return getSourcePosition(macro.replaces().start());
        } else {
            return new SourcePosition("<compiler-inserted>", 1, (int) offset + 1);
        }
    }

    /**
     * Returns the chain of positions from a provenance out through every
     * INCLUDE line and macro invocation that led to it, innermost first.
     */
    public List<SourcePosition> getPath(Provenance p) {
        List<SourcePosition> path = new ArrayList<>();
        Provenance at = p;
        while (true) {
            Origin origin = getOrigin(at);
            if (origin instanceof Origin.Inclusion inclusion) {
                path.add(inclusion.source().findOffsetLineAndColumn((int) origin.covers().memberOffset(at)));
            }
            ProvenanceRange replaces = origin.replaces();
            if (replaces.empty()) {
                return path;
            }
            at = replaces.start();
        }
    }

    /**
     * Returns the text that a provenance range covers, which must lie within a
     * single origin.
     */
    public String getText(ProvenanceRange range) {
        if (range.empty()) {
            return "";
        }
        Origin origin = getOrigin(range.start());
        InternalCompilerError.check(origin.covers().contains(range),
                "range %s crosses origins", range);
        StringBuilder sb = new StringBuilder();
        long first = origin.covers().memberOffset(range.start());
        for (long j = 0; j < range.size(); j++) {
            sb.append(origin.charAt(first + j));
        }
        return sb.toString();
    }
}
