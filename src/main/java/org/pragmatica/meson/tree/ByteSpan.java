package org.pragmatica.meson.tree;

/**
 * A range of source offsets from start (inclusive) to end (exclusive). Offsets count UTF-16
 * chars of the decoded source text, not bytes of the encoded file.
 */
public record ByteSpan(int start, int end) {

    public ByteSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static ByteSpan of(int start, int end) {
        return new ByteSpan(start, end);
    }

    public static ByteSpan at(int offset) {
        return new ByteSpan(offset, offset);
    }

    public int length() {
        return end - start;
    }

    /**
     * Whether the offset lies inside this span. The end is treated as inclusive so that
     * text touching the end of a node still counts as part of it.
     */
    public boolean touches(int offset) {
        return start <= offset && offset <= end;
    }

    public boolean encloses(ByteSpan other) {
        return start <= other.start && other.end <= end;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
