package org.fortranonjava.provenance;

import org.fortranonjava.core.InternalCompilerError;

/**
 * Half-open interval {@code [start, start + size)} of provenances.
 * Instances are immutable; operations that grow or shrink a range return a new one.
 */
public record ProvenanceRange(Provenance start, long size) {

    public static final ProvenanceRange EMPTY = new ProvenanceRange(new Provenance(0), 0);

    public ProvenanceRange {
        if (size < 0) {
            throw new IllegalArgumentException("negative range size " + size);
        }
    }

    public static ProvenanceRange of(long start, long size) {
        return new ProvenanceRange(new Provenance(start), size);
    }

    public static ProvenanceRange single(Provenance p) {
        return new ProvenanceRange(p, 1);
    }

    public boolean empty() {
        return size == 0;
    }

    public Provenance end() {
        return start.offsetBy(size);
    }

    /**
     * The final member of a non-empty range.
     */
    public Provenance last() {
        InternalCompilerError.check(size > 0, "last() of empty range %s", this);
        return start.offsetBy(size - 1);
    }

    public boolean contains(Provenance p) {
        return p.offset() >= start.offset() && p.offset() < start.offset() + size;
    }

    public boolean contains(ProvenanceRange that) {
        return contains(that.start) && (that.size == 0 || contains(that.last()));
    }

    public Provenance offsetMember(long n) {
        return start.offsetBy(n);
    }

    public long memberOffset(Provenance p) {
        return p.distanceFrom(start);
    }

    public ProvenanceRange prefix(long n) {
        return new ProvenanceRange(start, Math.min(size, n));
    }

    public ProvenanceRange suffix(long n) {
        long skip = Math.min(size, n);
        return new ProvenanceRange(start.offsetBy(skip), size - skip);
    }

    public boolean immediatelyPrecedes(ProvenanceRange that) {
        return start.offset() + size == that.start.offset();
    }

    /**
     * Merges {@code that} onto the end of this range when it starts exactly where
     * this one ends.
     *
     * @return the merged range, or null when the ranges are not contiguous
     */
    public ProvenanceRange annexIfPredecessor(ProvenanceRange that) {
        if (immediatelyPrecedes(that)) {
            return new ProvenanceRange(start, size + that.size);
        }
        return null;
    }

    /**
     * Smallest range that includes both ranges and everything between them.
     */
    public ProvenanceRange cover(ProvenanceRange that) {
        if (empty()) {
            return that;
        }
        if (that.empty()) {
            return this;
        }
        long lo = Math.min(start.offset(), that.start.offset());
        long hi = Math.max(start.offset() + size, that.start.offset() + that.size);
        return ProvenanceRange.of(lo, hi - lo);
    }

    @Override
    public String toString() {
        return "[" + start.offset() + ".." + (start.offset() + size) + ")";
    }
}
