package com.cinder;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link Supervisor} that keeps every diagnostic reported during a run.
 *
 * <p>Reporting is synchronized so a diagnostic recorded on another thread cancels a running
 * lexer at its next token boundary.</p>
 */
public class ErrorSupervisor implements Supervisor {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private volatile boolean errors = false;

    public synchronized void report(String message, Position span) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, span));
        errors = true;
    }

    /**
     * Records a warning. Warnings never cancel.
     */
    public synchronized void warn(String message, Position span) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, span));
    }

    @Override
    public boolean hasErrors() {
        return errors;
    }

    public synchronized int errorCount() {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public synchronized List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public synchronized void clear() {
        diagnostics.clear();
        errors = false;
    }
}
