package org.fortranonjava.provenance;

/**
 * A coordinate in the provenance space of one compiled unit: every character
 * of every file, macro expansion and compiler insertion has a distinct value.
 * Only offset arithmetic within a range is meaningful.
 */
public record Provenance(long offset) implements Comparable<Provenance> {

    public Provenance {
        if (offset < 0) {
            throw new IllegalArgumentException("negative provenance " + offset);
        }
    }

    public Provenance offsetBy(long n) {
        return new Provenance(offset + n);
    }

    public long distanceFrom(Provenance that) {
        return offset - that.offset;
    }

    @Override
    public int compareTo(Provenance that) {
        return Long.compare(offset, that.offset);
    }

    @Override
    public String toString() {
        return "@" + offset;
    }
}
