package com.cinder;

import java.util.Locale;
import java.util.Objects;

/**
 * A message recorded against a span of the source.
 */
public record Diagnostic(Severity severity, String message, Position span) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(span, "span");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats as {@code error[3..5]: message}, followed by the offending text when the span
     * lies inside {@code source}.
     */
    public String format(String source) {
        String head = severity.name().toLowerCase(Locale.ROOT) + "[" + span + "]: " + message;
        if (source == null || span.length() == 0 || span.end() > source.length()) {
            return head;
        }
        return head + " (near '" + span.slice(source) + "')";
    }
}
