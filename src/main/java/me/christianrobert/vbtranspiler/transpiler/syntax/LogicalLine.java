package me.christianrobert.vbtranspiler.transpiler.syntax;

/**
 * One logical source line after normalisation.
 *
 * <p>A logical line may span several physical lines (VB line continuations, a C# brace moved up
 * onto its header). It always keeps the 1-based number of the first physical line it came from,
 * so diagnostics point at the original source.</p>
 */
public class LogicalLine {

    private final int lineNumber;
    private final String code;     // trimmed, comment removed, may be empty
    private final String comment;  // text after the comment leader, null if none
    private final String raw;      // original text (trimmed), comment included

    public LogicalLine(int lineNumber, String code, String comment, String raw) {
        this.lineNumber = lineNumber;
        this.code = code == null ? "" : code.trim();
        this.comment = comment;
        this.raw = raw == null ? "" : raw.trim();
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getCode() {
        return code;
    }

    public String getComment() {
        return comment;
    }

    public String getRaw() {
        return raw;
    }

    public boolean hasCode() {
        return !code.isEmpty();
    }

    public boolean hasComment() {
        return comment != null;
    }

    public boolean isBlank() {
        return code.isEmpty() && comment == null;
    }

    public LogicalLine withCode(String newCode, String newRaw) {
        return new LogicalLine(lineNumber, newCode, comment, newRaw);
    }

    @Override
    public String toString() {
        return "LogicalLine{" + lineNumber + ": '" + code + "'" + (comment != null ? ", comment='" + comment + "'" : "") + "}";
    }
}
