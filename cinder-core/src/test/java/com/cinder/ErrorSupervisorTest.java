package com.cinder;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorSupervisorTest {

    @Test
    void testStartsClean() {
        ErrorSupervisor supervisor = new ErrorSupervisor();
        assertFalse(supervisor.hasErrors());
        assertEquals(0, supervisor.errorCount());
        assertTrue(supervisor.diagnostics().isEmpty());
    }

    @Test
    void testErrorsAndWarnings() {
        ErrorSupervisor supervisor = new ErrorSupervisor();
        supervisor.warn("shadowed name", new Position(0, 1));
        assertFalse(supervisor.hasErrors());

        supervisor.report("expected ';'", new Position(4, 5));
        assertTrue(supervisor.hasErrors());
        assertEquals(1, supervisor.errorCount());

        List<Diagnostic> diagnostics = supervisor.diagnostics();
        assertEquals(2, diagnostics.size());
        assertEquals(Diagnostic.Severity.WARNING, diagnostics.get(0).severity());
        assertEquals("expected ';'", diagnostics.get(1).message());
    }

    @Test
    void testDiagnosticsSnapshotIsUnmodifiable() {
        ErrorSupervisor supervisor = new ErrorSupervisor();
        supervisor.report("boom", Position.NONE);
        assertThrows(UnsupportedOperationException.class, () -> supervisor.diagnostics().clear());
    }

    @Test
    void testClear() {
        ErrorSupervisor supervisor = new ErrorSupervisor();
        supervisor.report("boom", Position.NONE);
        supervisor.clear();
        assertFalse(supervisor.hasErrors());
        assertTrue(supervisor.diagnostics().isEmpty());
    }

    @Test
    void testFormat() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.ERROR, "unexpected token", new Position(3, 5));
        assertEquals("error[3..5]: unexpected token (near '->')", diagnostic.format("fn -> x"));
        assertEquals("error[3..5]: unexpected token", diagnostic.format(null));
        assertEquals("error[3..5]: unexpected token", diagnostic.format("fn"));
    }

    @Test
    void testFormatIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.WARNING, "m", Position.NONE);
            assertEquals("warning[0..0]: m", diagnostic.format(null));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
