package me.christianrobert.vbtranspiler.transpiler.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Errors and warnings of one validation run. The report is valid when it has no errors.
 */
public class ValidationReport {

    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;

    public ValidationReport(List<Diagnostic> errors, List<Diagnostic> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static ValidationReport clean() {
        return new ValidationReport(List.of(), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public List<String> getErrorMessages() {
        return messages(errors);
    }

    public List<String> getWarningMessages() {
        return messages(warnings);
    }

    private static List<String> messages(List<Diagnostic> diagnostics) {
        List<String> messages = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            messages.add(diagnostic.getMessage());
        }
        return messages;
    }

    @Override
    public String toString() {
        return "ValidationReport{errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
    }
}
