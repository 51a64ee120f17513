package me.christianrobert.vbtranspiler.transpiler.validation;

/**
 * A validation finding anchored at a 1-based line. Line 0 means the whole input.
 */
public class Diagnostic {

    private final int line;
    private final String message;

    public Diagnostic(int line, String message) {
        this.line = line;
        this.message = message;
    }

    public static Diagnostic general(String message) {
        return new Diagnostic(0, message);
    }

    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return line > 0 ? "line " + line + ": " + message : message;
    }
}
