package me.christianrobert.vbtranspiler.transpiler.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing source code.
 * Either a tree, a list of syntax errors, or the information that no parser exists for the language.
 */
public class ParseResult {

    private final SyntaxNode tree;
    private final List<String> errors;
    private final String originalCode;
    private final boolean available;

    private ParseResult(SyntaxNode tree, List<String> errors, String originalCode, boolean available) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.originalCode = originalCode;
        this.available = available;
    }

    public static ParseResult success(SyntaxNode tree, String originalCode) {
        return new ParseResult(tree, Collections.emptyList(), originalCode, true);
    }

    public static ParseResult failure(List<String> errors, String originalCode) {
        return new ParseResult(null, errors, originalCode, true);
    }

    /**
     * The parser has no grammar for the language. Callers fall back to line scanning.
     */
    public static ParseResult unavailable(String originalCode) {
        return new ParseResult(null, Collections.emptyList(), originalCode, false);
    }

    /**
     * Gets the root node, null unless parsing succeeded.
     */
    public SyntaxNode getTree() {
        return tree;
    }

    /**
     * Gets the list of syntax errors encountered during parsing.
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getOriginalCode() {
        return originalCode;
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Checks if parsing was successful (a tree and no errors).
     */
    public boolean isSuccess() {
        return available && tree != null && errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", available=" + available + ", errors=" + errors.size() + "}";
    }
}
