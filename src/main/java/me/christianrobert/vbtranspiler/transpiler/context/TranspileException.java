package me.christianrobert.vbtranspiler.transpiler.context;

/**
 * Exception thrown when a transpilation cannot be carried out at all:
 * unsupported languages or language pairs, misconfigured rule tables.
 * Captures the source code and context of the failure.
 */
public class TranspileException extends RuntimeException {

    private final String sourceCode;
    private final String context;

    public TranspileException(String message) {
        super(message);
        this.sourceCode = null;
        this.context = null;
    }

    public TranspileException(String message, Throwable cause) {
        super(message, cause);
        this.sourceCode = null;
        this.context = null;
    }

    public TranspileException(String message, String sourceCode, String context) {
        super(message);
        this.sourceCode = sourceCode;
        this.context = context;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including context and source code.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        if (sourceCode != null) {
            sb.append("\nSource: ").append(sourceCode);
        }
        return sb.toString();
    }
}
