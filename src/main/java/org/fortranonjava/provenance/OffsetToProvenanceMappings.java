package org.fortranonjava.provenance;

import org.fortranonjava.core.InternalCompilerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps offsets in a character buffer to provenances, as a run-length
 * compressed list of contiguous mappings.
 * <p>
 * Entries are ordered by buffer offset, cover {@code [0, size())} without gaps
 * or overlap, and no two adjacent entries are contiguous in both the buffer and
 * the provenance space.
 */
public class OffsetToProvenanceMappings {

    /**
     * One run of buffer characters whose provenances are consecutive.
     */
    public record ContiguousProvenanceMapping(long start, ProvenanceRange range) {
    }

    private final List<ContiguousProvenanceMapping> provenanceMap = new ArrayList<>();

    public long size() {
        if (provenanceMap.isEmpty()) {
            return 0;
        }
        ContiguousProvenanceMapping last = provenanceMap.get(provenanceMap.size() - 1);
        return last.start() + last.range().size();
    }

    public int entryCount() {
        return provenanceMap.size();
    }

    public List<ContiguousProvenanceMapping> entries() {
        return Collections.unmodifiableList(provenanceMap);
    }

    public void clear() {
        provenanceMap.clear();
    }

    public void shrinkToFit() {
        ((ArrayList<ContiguousProvenanceMapping>) provenanceMap).trimToSize();
    }

    /**
     * Appends the provenances of the next {@code range.size()} buffer characters,
     * extending the last entry when the range continues it.
     */
    public void put(ProvenanceRange range) {
        if (range.empty()) {
            return;
        }
        if (provenanceMap.isEmpty()) {
            provenanceMap.add(new ContiguousProvenanceMapping(0, range));
            return;
        }
        int lastIndex = provenanceMap.size() - 1;
        ContiguousProvenanceMapping last = provenanceMap.get(lastIndex);
        ProvenanceRange merged = last.range().annexIfPredecessor(range);
        if (merged != null) {
            provenanceMap.set(lastIndex, new ContiguousProvenanceMapping(last.start(), merged));
        } else {
            provenanceMap.add(new ContiguousProvenanceMapping(last.start() + last.range().size(), range));
        }
    }

    public void put(OffsetToProvenanceMappings that) {
        for (ContiguousProvenanceMapping map : that.provenanceMap) {
            put(map.range());
        }
    }

    /**
     * Returns the provenance of the character at {@code at} together with the
     * provenances of the characters that follow it within the same entry.
     *
     * @param at a buffer offset in {@code [0, size())}
     */
    public ProvenanceRange map(long at) {
        InternalCompilerError.check(at >= 0 && at < size(),
                "offset %d out of range for provenance mapping of size %d", at, size());
        // Binary search for the last entry starting at or before "at"
        int low = 0;
        int count = provenanceMap.size();
        while (count > 1) {
            int mid = low + (count >> 1);
            if (provenanceMap.get(mid).start() > at) {
                count = mid - low;
            } else {
                count -= mid - low;
                low = mid;
            }
        }
        ContiguousProvenanceMapping found = provenanceMap.get(low);
        return found.range().suffix(at - found.start());
    }

    /**
     * Drops the mappings of the last {@code bytes} buffer characters.
     */
    public void removeLastBytes(long bytes) {
        while (bytes > 0) {
            InternalCompilerError.check(!provenanceMap.isEmpty(),
                    "removing %d more bytes from an empty provenance mapping", bytes);
            int lastIndex = provenanceMap.size() - 1;
            ContiguousProvenanceMapping last = provenanceMap.get(lastIndex);
            long chars = last.range().size();
            if (bytes < chars) {
                provenanceMap.set(lastIndex,
                        new ContiguousProvenanceMapping(last.start(), last.range().prefix(chars - bytes)));
                return;
            }
            provenanceMap.remove(lastIndex);
            bytes -= chars;
        }
    }

    /**
     * Merges adjacent entries that are contiguous in both buffer and provenance.
     * A no-op on a mapping that is already compressed.
     *
     * @return true if any entries were merged
     */
    public boolean compress() {
        if (provenanceMap.size() < 2) {
            return false;
        }
        List<ContiguousProvenanceMapping> old = new ArrayList<>(provenanceMap);
        provenanceMap.clear();
        for (ContiguousProvenanceMapping map : old) {
            put(map.range());
        }
        return provenanceMap.size() != old.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ContiguousProvenanceMapping map : provenanceMap) {
            sb.append("  offsets [").append(map.start()).append("..")
                    .append(map.start() + map.range().size()).append(") -> ")
                    .append(map.range()).append('\n');
        }
        return sb.toString();
    }
}
