package me.christianrobert.vbtranspiler.transpiler.ai;

/**
 * Outcome of one call to the AI rewrite service. Failures are values, not exceptions:
 * the caller falls back to the rule-based rewrite.
 */
public class AiRewriteResult {

    private final boolean success;
    private final String code;
    private final String errorMessage;

    private AiRewriteResult(boolean success, String code, String errorMessage) {
        this.success = success;
        this.code = code;
        this.errorMessage = errorMessage;
    }

    public static AiRewriteResult success(String code) {
        return new AiRewriteResult(true, code, null);
    }

    public static AiRewriteResult failure(String errorMessage) {
        return new AiRewriteResult(false, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return success ? "AiRewriteResult{success, " + code.length() + " chars}" : "AiRewriteResult{failure: " + errorMessage + "}";
    }
}
