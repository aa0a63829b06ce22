package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.Diagnostic;

import java.util.List;

public class UnitParseException extends AdaframeException {

    private final List<Diagnostic> diagnostics;

    public UnitParseException(String filename, List<Diagnostic> diagnostics) {
        super("Could not parse " + filename + describe(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String describe(List<Diagnostic> diagnostics) {
        return diagnostics.isEmpty() ? "" : ": " + diagnostics.get(0);
    }
}
