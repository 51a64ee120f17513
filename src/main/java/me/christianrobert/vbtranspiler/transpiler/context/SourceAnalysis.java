package me.christianrobert.vbtranspiler.transpiler.context;

import me.christianrobert.vbtranspiler.transpiler.semantic.SemanticSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of a parse request: the exported syntax tree and the semantic summary of the source.
 */
public class SourceAnalysis {

    private final boolean success;
    private final Map<String, Object> ast;
    private final SemanticSummary summary;
    private final String astTree;
    private final List<String> warnings;
    private final String errorMessage;

    private SourceAnalysis(boolean success, Map<String, Object> ast, SemanticSummary summary, String astTree,
                           List<String> warnings, String errorMessage) {
        this.success = success;
        this.ast = ast;
        this.summary = summary;
        this.astTree = astTree;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful analysis.
     *
     * @param astTree Text rendering of the tree, null unless requested
     */
    public static SourceAnalysis success(Map<String, Object> ast, SemanticSummary summary, String astTree,
                                        List<String> warnings) {
        return new SourceAnalysis(true, ast, summary, astTree, warnings, null);
    }

    public static SourceAnalysis failure(String errorMessage) {
        return new SourceAnalysis(false, null, null, null, Collections.emptyList(), errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getAst() {
        return ast;
    }

    public SemanticSummary getSummary() {
        return summary;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        if (success) {
            return "SourceAnalysis{success=true, summary=" + summary + "}";
        }
        return "SourceAnalysis{success=false, error='" + errorMessage + "'}";
    }
}
