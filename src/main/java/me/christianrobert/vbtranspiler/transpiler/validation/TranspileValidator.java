package me.christianrobert.vbtranspiler.transpiler.validation;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.core.tools.CodeCleaner;
import me.christianrobert.vbtranspiler.transpiler.rewrite.BlockFrame;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteOutcome;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockEvent;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockSyntax;
import me.christianrobert.vbtranspiler.transpiler.syntax.LineNormalizer;
import me.christianrobert.vbtranspiler.transpiler.syntax.LogicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks rewrite results and source text. Never modifies its input.
 *
 * <p>After a rewrite, blocks left open are errors ("unclosed block started at line N", one per
 * block, in opening order), and empty output for non-blank input is an error. Source-language
 * tokens that survived in the target text are warnings.</p>
 *
 * <p>Live validation of unconverted source only checks block balance: unclosed blocks and
 * unmatched closers are errors. Inputs shorter than {@value #SHORT_CODE_LENGTH} characters get a
 * warning.</p>
 */
@ApplicationScoped
public class TranspileValidator {

    private static final Logger log = LoggerFactory.getLogger(TranspileValidator.class);

    static final int SHORT_CODE_LENGTH = 10;

    /**
     * Validates the result of one rewrite pass.
     *
     * @param sourceText Text the pass was given
     * @param outcome Result of the pass
     * @param source Source language of the pass
     * @param target Target language of the pass
     * @return Errors for structural problems, warnings for leftover tokens
     */
    public ValidationReport validateRewrite(String sourceText, RewriteOutcome outcome, Language source, Language target) {
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();

        for (BlockFrame frame : outcome.getOpenFrames()) {
            errors.add(unclosed(frame.getOpenedAtLine()));
        }
        if (sourceText != null && !sourceText.isBlank() && outcome.getCode().isBlank()) {
            errors.add(Diagnostic.general("no output produced"));
        }

        Pattern leftovers = LeftoverTokens.forDirection(source, target);
        if (leftovers != null) {
            findLeftovers(outcome.getCode(), source, target, leftovers, warnings);
        }

        ValidationReport report = new ValidationReport(errors, warnings);
        log.debug("Validated {} -> {} rewrite: {}", source.getDisplayName(), target.getDisplayName(), report);
        return report;
    }

    private static void findLeftovers(String code, Language source, Language target, Pattern leftovers,
                                      List<Diagnostic> warnings) {
        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int commentStart = CodeCleaner.findLineCommentStart(line, target);
            if (commentStart >= 0) {
                line = line.substring(0, commentStart);
            }
            if (line.isBlank()) {
                continue;
            }
            Matcher matcher = leftovers.matcher(CodeCleaner.blankStringLiterals(line, target));
            if (matcher.find()) {
                int lineNumber = i + 1;
                warnings.add(new Diagnostic(lineNumber, "leftover " + source.getDisplayName() + " token '"
                        + matcher.group().trim() + "' at output line " + lineNumber));
            }
        }
    }

    /**
     * Validates unconverted source text.
     *
     * @param code Source text
     * @param language Its language
     * @return Block balance errors and the short input warning
     */
    public ValidationReport validateSource(String code, Language language) {
        if (code == null || code.isBlank()) {
            return new ValidationReport(List.of(Diagnostic.general("Empty source code")), List.of());
        }

        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        List<LogicalLine> lines = LineNormalizer.normalize(code, language);
        BlockSyntax syntax = BlockSyntax.forLanguage(language);
        List<BlockEvent> openers = new ArrayList<>();
        List<Integer> openedAt = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (!line.hasCode()) {
                continue;
            }
            String enclosingLabel = openers.isEmpty() ? null : openers.get(openers.size() - 1).getLabel();
            for (BlockEvent event : syntax.scan(line, nextCodeLine(lines, i + 1), enclosingLabel)) {
                switch (event.getType()) {
                    case OPEN:
                        openers.add(event);
                        openedAt.add(line.getLineNumber());
                        break;
                    case CLOSE:
                        int index = findNearest(openers, event);
                        if (index < 0) {
                            errors.add(new Diagnostic(line.getLineNumber(), "unmatched closer at line " + line.getLineNumber()));
                        } else {
                            openers.remove(index);
                            openedAt.remove(index);
                        }
                        break;
                    case CONTINUE:
                        if (findNearest(openers, event) < 0) {
                            warnings.add(new Diagnostic(line.getLineNumber(),
                                    "unmatched continuation at line " + line.getLineNumber()));
                        }
                        break;
                    default:
                        throw new IllegalStateException("Unknown block event: " + event.getType());
                }
            }
        }

        for (Integer line : openedAt) {
            errors.add(unclosed(line));
        }
        if (code.strip().length() < SHORT_CODE_LENGTH) {
            warnings.add(Diagnostic.general("Code is very short"));
        }

        ValidationReport report = new ValidationReport(errors, warnings);
        log.debug("Validated {} source: {}", language.getDisplayName(), report);
        return report;
    }

    private static int findNearest(List<BlockEvent> openers, BlockEvent event) {
        for (int i = openers.size() - 1; i >= 0; i--) {
            if (event.accepts(openers.get(i).getKind())) {
                return i;
            }
        }
        return -1;
    }

    private static LogicalLine nextCodeLine(List<LogicalLine> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (lines.get(i).hasCode()) {
                return lines.get(i);
            }
        }
        return null;
    }

    private static Diagnostic unclosed(int line) {
        return new Diagnostic(line, "unclosed block started at line " + line);
    }
}
