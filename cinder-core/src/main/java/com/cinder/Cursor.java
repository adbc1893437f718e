package com.cinder;

import java.util.Objects;
import java.util.Optional;

/**
 * Read position over a source string with non-consuming lookahead.
 */
public class Cursor {

    private final String source;
    private int position = 0;

    public Cursor(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public Optional<Character> peek() {
        return peekAhead(0);
    }

    /**
     * Character {@code n} positions past the current one, or empty when that falls outside the source.
     */
    public Optional<Character> peekAhead(int n) {
        int index = position + n;
        if (n < 0 || index < 0 || index >= source.length()) {
            return Optional.empty();
        }
        return Optional.of(source.charAt(index));
    }

    /**
     * Moves forward {@code n} characters. Callers must not step past the end; if they do, the
     * position stops at the end of the source. A negative {@code n} leaves the position unchanged.
     */
    public void advance(int n) {
        if (n <= 0) {
            return;
        }
        position = (int) Math.min((long) position + n, source.length());
    }

    public boolean eof() {
        return position >= source.length();
    }

    public int cursor() {
        return position;
    }

    public String source() {
        return source;
    }
}
