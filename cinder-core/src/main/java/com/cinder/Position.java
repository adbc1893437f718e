package com.cinder;

/**
 * Half-open span {@code [start, end)} of character offsets into the source text.
 */
public record Position(int start, int end) {

    public static final Position NONE = new Position(0, 0);

    public Position {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * Returns the text this span covers in {@code source}.
     */
    public String slice(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
