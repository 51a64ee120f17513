package me.christianrobert.vbtranspiler.transpiler.parser;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockEvent;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockSyntax;
import me.christianrobert.vbtranspiler.transpiler.syntax.DeclarationPatterns;
import me.christianrobert.vbtranspiler.transpiler.syntax.LineNormalizer;
import me.christianrobert.vbtranspiler.transpiler.syntax.LogicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds a structural syntax tree from block boundaries and declaration patterns.
 *
 * <p>This is not a grammar: every logical line becomes one node, and block openers become parent
 * nodes of the lines up to their closer. That is enough for semantic extraction, AST display and
 * the AI request context for all three languages.</p>
 *
 * <p>The parser is tolerant. Unmatched closers are ignored and blocks still open at the end of
 * input are closed at the last line; reporting imbalance is the validator's job. Only blank input
 * is rejected.</p>
 *
 * <p>Node kinds: {@code compilation_unit}, {@code class_declaration}, {@code method_declaration},
 * {@code constructor_declaration}, {@code property_declaration}, {@code field_declaration},
 * {@code if_statement}, {@code loop_statement}, {@code block}, {@code clause},
 * {@code statement}, {@code comment}.</p>
 */
@ApplicationScoped
public class LineStructureParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(LineStructureParser.class);

    private static final Set<String> ACCESSOR_LABELS = Set.of("get", "set", "let", "init", "add", "remove");

    @Override
    public ParseResult parse(String code, Language language) {
        if (code == null || code.isBlank()) {
            return ParseResult.failure(List.of("Empty source code"), code);
        }

        List<LogicalLine> lines = LineNormalizer.normalize(code, language);
        BlockSyntax syntax = BlockSyntax.forLanguage(language);
        TreeAssembly assembly = new TreeAssembly();

        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            if (!line.hasCode()) {
                assembly.addLeaf("comment", line.getRaw(), line.getLineNumber());
                continue;
            }

            LogicalLine next = nextCodeLine(lines, i + 1);
            List<BlockEvent> events = syntax.scan(line, next, assembly.currentLabel());
            if (events.isEmpty()) {
                assembly.addLeaf(leafKind(line.getCode(), language), line.getCode(), line.getLineNumber());
                continue;
            }

            boolean headerUsed = false;
            for (BlockEvent event : events) {
                switch (event.getType()) {
                    case OPEN:
                        String kind = headerUsed ? "block" : openKind(event, line.getCode(), language);
                        assembly.open(kind, headerUsed ? "{" : line.getCode(), line.getLineNumber(), event);
                        headerUsed = true;
                        break;
                    case CLOSE:
                        assembly.close(event, line.getLineNumber());
                        break;
                    case CONTINUE:
                        assembly.addLeaf("clause", line.getCode(), line.getLineNumber());
                        headerUsed = true;
                        break;
                    default:
                        throw new IllegalStateException("Unknown block event: " + event.getType());
                }
            }
        }

        int lastLine = lines.isEmpty() ? 1 : lines.get(lines.size() - 1).getLineNumber();
        SyntaxNode tree = assembly.finish(lastLine);
        log.debug("Parsed {} logical lines of {} into {} nodes", lines.size(), language.getDisplayName(), assembly.nodeCount());
        return ParseResult.success(tree, code);
    }

    private static LogicalLine nextCodeLine(List<LogicalLine> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (lines.get(i).hasCode()) {
                return lines.get(i);
            }
        }
        return null;
    }

    private static String leafKind(String code, Language language) {
        DeclarationPatterns.Declaration declaration = DeclarationPatterns.classify(code, language);
        if (declaration == null) {
            return "statement";
        }
        return declarationKind(declaration.getType());
    }

    private static String openKind(BlockEvent event, String code, Language language) {
        switch (event.getKind()) {
            case CLASS:
                return "class_declaration";
            case CONDITIONAL:
                return "if_statement";
            case LOOP:
                return "loop_statement";
            case METHOD:
                String label = event.getLabel().toLowerCase(Locale.ROOT);
                if (ACCESSOR_LABELS.contains(label)) {
                    return "block";
                }
                DeclarationPatterns.Declaration declaration = DeclarationPatterns.classify(code, language);
                if (declaration != null) {
                    return declarationKind(declaration.getType());
                }
                return "property".equals(label) ? "property_declaration" : "method_declaration";
            default:
                return "block";
        }
    }

    private static String declarationKind(DeclarationPatterns.DeclarationType type) {
        switch (type) {
            case CLASS:
                return "class_declaration";
            case METHOD:
                return "method_declaration";
            case CONSTRUCTOR:
                return "constructor_declaration";
            case PROPERTY:
                return "property_declaration";
            case FIELD:
                return "field_declaration";
            default:
                return "statement";
        }
    }

    /**
     * Open node stack of one parse call. Ids are sequential per call.
     */
    private static class TreeAssembly {
        private final SyntaxNode.Builder root;
        private final List<SyntaxNode.Builder> nodes = new ArrayList<>();
        private final List<BlockEvent> openers = new ArrayList<>();
        private int nextId = 1;

        TreeAssembly() {
            root = new SyntaxNode.Builder(newId(), SyntaxNode.COMPILATION_UNIT, "", 1);
        }

        private String newId() {
            return "n" + nextId++;
        }

        int nodeCount() {
            return nextId - 1;
        }

        String currentLabel() {
            return openers.isEmpty() ? null : openers.get(openers.size() - 1).getLabel();
        }

        private SyntaxNode.Builder current() {
            return nodes.isEmpty() ? root : nodes.get(nodes.size() - 1);
        }

        void addLeaf(String kind, String text, int line) {
            current().addChild(new SyntaxNode.Builder(newId(), kind, text, line));
        }

        void open(String kind, String text, int line, BlockEvent opener) {
            SyntaxNode.Builder node = new SyntaxNode.Builder(newId(), kind, text, line);
            current().addChild(node);
            nodes.add(node);
            openers.add(opener);
        }

        void close(BlockEvent closer, int line) {
            for (int i = openers.size() - 1; i >= 0; i--) {
                BlockKind openKind = openers.get(i).getKind();
                if (closer.accepts(openKind)) {
                    while (nodes.size() > i) {
                        nodes.remove(nodes.size() - 1).endLine(line);
                        openers.remove(openers.size() - 1);
                    }
                    return;
                }
            }
            log.trace("Ignoring unmatched closer at line {}", line);
        }

        SyntaxNode finish(int lastLine) {
            for (SyntaxNode.Builder open : nodes) {
                open.endLine(lastLine);
            }
            nodes.clear();
            openers.clear();
            root.endLine(lastLine);
            return root.build();
        }
    }
}
