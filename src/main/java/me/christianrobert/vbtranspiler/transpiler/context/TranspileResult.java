package me.christianrobert.vbtranspiler.transpiler.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a transpile request.
 *
 * <p>Carries the produced code (also on validation failure, for inspection), warnings, errors and
 * the method that produced the code. The method is null when the request failed before any
 * conversion path ran (unsupported language, parse failure).</p>
 */
public class TranspileResult {

    private final boolean success;
    private final String code;
    private final List<String> warnings;
    private final List<String> errors;
    private final TranspileMethod method;

    private TranspileResult(boolean success, String code, List<String> warnings, List<String> errors, TranspileMethod method) {
        this.success = success;
        this.code = code;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.method = method;
    }

    /**
     * Creates a successful result.
     */
    public static TranspileResult success(String code, List<String> warnings, TranspileMethod method) {
        return new TranspileResult(true, code, warnings, Collections.emptyList(), method);
    }

    /**
     * Creates a result whose output failed validation. The code is still returned.
     */
    public static TranspileResult invalid(String code, List<String> warnings, List<String> errors, TranspileMethod method) {
        return new TranspileResult(false, code, warnings, errors, method);
    }

    /**
     * Creates a failed result for a request that never reached a conversion path.
     */
    public static TranspileResult failure(String sourceCode, List<String> warnings, String errorMessage) {
        return new TranspileResult(false, sourceCode, warnings, List.of(errorMessage), null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static TranspileResult failure(String sourceCode, TranspileException exception) {
        return new TranspileResult(false, sourceCode, Collections.emptyList(), List.of(exception.getMessage()), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getCode() {
        return code;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getErrors() {
        return errors;
    }

    public TranspileMethod getMethod() {
        return method;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranspileResult{success=true, method=" + method + ", warnings=" + warnings.size() + "}";
        } else {
            return "TranspileResult{success=false, method=" + method + ", errors=" + errors + "}";
        }
    }
}
