package me.christianrobert.vbtranspiler.transpiler.semantic;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.parser.SyntaxNode;
import me.christianrobert.vbtranspiler.transpiler.syntax.DeclarationPatterns;
import me.christianrobert.vbtranspiler.transpiler.syntax.DeclarationPatterns.Declaration;
import me.christianrobert.vbtranspiler.transpiler.syntax.LineNormalizer;
import me.christianrobert.vbtranspiler.transpiler.syntax.LogicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Extracts a {@link SemanticSummary} from source code.
 *
 * <p>When a syntax tree is available the declaration nodes of the tree are visited in pre-order;
 * otherwise every logical line is classified against the declaration patterns. Both paths anchor
 * entries at 1-based source lines and keep source order.</p>
 *
 * <p>Constructors are reported as methods without return type. Fields with an access modifier
 * are reported as properties.</p>
 */
@ApplicationScoped
public class SemanticExtractor {

    private static final Logger log = LoggerFactory.getLogger(SemanticExtractor.class);

    private static final Set<String> DECLARATION_KINDS = Set.of(
            "class_declaration", "method_declaration", "constructor_declaration",
            "property_declaration", "field_declaration");
    private static final int MAX_FALLBACK_NAME_LENGTH = 50;

    /**
     * Extracts the summary.
     *
     * @param code Source code
     * @param language Language of the source
     * @param tree Parsed tree of the same source, or null to scan lines
     * @return The summary, empty if nothing is declared
     */
    public SemanticSummary extract(String code, Language language, SyntaxNode tree) {
        SemanticSummary summary = tree != null
                ? fromTree(tree, language)
                : fromLines(code, language);
        log.debug("Extracted {} from {} source ({})", summary, language.getDisplayName(),
                tree != null ? "syntax tree" : "line scan");
        return summary;
    }

    private SemanticSummary fromTree(SyntaxNode root, Language language) {
        SemanticSummary.Builder builder = SemanticSummary.builder();
        visit(root, language, builder);
        return builder.build();
    }

    private void visit(SyntaxNode node, Language language, SemanticSummary.Builder builder) {
        if (DECLARATION_KINDS.contains(node.getKind())) {
            Declaration declaration = DeclarationPatterns.classify(node.getText(), language);
            if (declaration != null) {
                record(declaration, node.getStartLine(), builder);
            } else {
                recordByKind(node, builder);
            }
        }
        for (SyntaxNode child : node.getChildren()) {
            visit(child, language, builder);
        }
    }

    private SemanticSummary fromLines(String code, Language language) {
        SemanticSummary.Builder builder = SemanticSummary.builder();
        List<LogicalLine> lines = LineNormalizer.normalize(code, language);
        for (LogicalLine line : lines) {
            if (!line.hasCode()) {
                continue;
            }
            Declaration declaration = DeclarationPatterns.classify(line.getCode(), language);
            if (declaration != null) {
                record(declaration, line.getLineNumber(), builder);
            }
        }
        return builder.build();
    }

    private static void record(Declaration declaration, int line, SemanticSummary.Builder builder) {
        switch (declaration.getType()) {
            case CLASS:
                builder.addClass(declaration.getName(), line);
                break;
            case METHOD:
            case CONSTRUCTOR:
                builder.addMethod(declaration.getName(), line, declaration.getTypeName());
                break;
            case PROPERTY:
            case FIELD:
                builder.addProperty(declaration.getName(), line, declaration.getTypeName());
                break;
            default:
                throw new IllegalStateException("Unknown declaration type: " + declaration.getType());
        }
    }

    /**
     * Node kind says declaration but its text does not match a pattern: report the text itself.
     */
    private static void recordByKind(SyntaxNode node, SemanticSummary.Builder builder) {
        String text = node.getText();
        String name = text.length() > MAX_FALLBACK_NAME_LENGTH ? text.substring(0, MAX_FALLBACK_NAME_LENGTH) : text;
        switch (node.getKind()) {
            case "class_declaration":
                builder.addClass(name, node.getStartLine());
                break;
            case "method_declaration":
            case "constructor_declaration":
                builder.addMethod(name, node.getStartLine(), null);
                break;
            default:
                builder.addProperty(name, node.getStartLine(), null);
                break;
        }
    }
}
