package me.christianrobert.vbtranspiler.transpiler.ai;

/**
 * Outcome of a connection test. The status code is null when no HTTP response was received.
 */
public class AiConnectionResult {

    private final boolean success;
    private final Integer statusCode;
    private final String message;

    public AiConnectionResult(boolean success, Integer statusCode, String message) {
        this.success = success;
        this.statusCode = statusCode;
        this.message = message;
    }

    public boolean isSuccess() {
        return success;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getMessage() {
        return message;
    }
}
