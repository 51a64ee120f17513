package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;
import me.christianrobert.vbtranspiler.transpiler.syntax.LineNormalizer;
import me.christianrobert.vbtranspiler.transpiler.syntax.LogicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Rewrites source text line by line with a rule table while tracking open blocks.
 *
 * <p>For every logical line the token substitutions are applied, then the first matching rule
 * is rendered at the current depth (stack size times the indent size) and its stack effect is
 * applied:</p>
 * <ul>
 *   <li>Push: the line opens a block. For brace targets of keyword sources {@code " {"} is appended.</li>
 *   <li>Pop: the nearest block of the rule's kind is closed, blocks above it stay open. A mismatch
 *       with the innermost block is a warning. Without template, a closer for the target style is
 *       synthesised ({@code }}, {@code End Sub}, {@code Next}, ...). Without any open block of the
 *       kind the line is passed through with the warning "unmatched closer at line N".</li>
 *   <li>Reopen: the next clause of an open block ({@code } else {}, {@code Catch ex}) is emitted at
 *       the depth of that block.</li>
 * </ul>
 * <p>Lines no rule matches are passed through re-indented with one warning each. Blank lines are kept,
 * comments get the target comment leader. The rewriter never fails on input; structural problems are
 * left on the returned stack for the validator.</p>
 *
 * <p>Instances are stateless; every call works on its own stack.</p>
 */
public class BlockTrackingRewriter {

    private static final Logger log = LoggerFactory.getLogger(BlockTrackingRewriter.class);

    public static final int DEFAULT_INDENT_SIZE = 4;
    private static final int MAX_NESTED_STATEMENTS = 2;

    private final int indentSize;

    public BlockTrackingRewriter() {
        this(DEFAULT_INDENT_SIZE);
    }

    public BlockTrackingRewriter(int indentSize) {
        this.indentSize = Math.max(0, indentSize);
    }

    /**
     * Rewrites source text starting with an empty block stack.
     */
    public RewriteOutcome rewrite(String source, RuleTable table) {
        return rewrite(source, table, new BlockStack());
    }

    /**
     * Rewrites source text.
     *
     * @param source Source text in the table's source language
     * @param table Rules of the conversion direction
     * @param initialStack Blocks considered open before the first line; copied, never modified
     * @return Produced text, warnings and the blocks left open
     */
    public RewriteOutcome rewrite(String source, RuleTable table, BlockStack initialStack) {
        Pass pass = new Pass(table, new BlockStack(initialStack.getFrames()));
        RewriteOutcome outcome = pass.run(source == null ? "" : source);
        log.debug("Rewrote {} -> {}: {}", table.getSource().getDisplayName(), table.getTarget().getDisplayName(), outcome);
        return outcome;
    }

    /**
     * State of one rewrite call.
     */
    private class Pass {
        private final RuleTable table;
        private final BlockStack stack;
        private final TemplateRenderer renderer;
        private final String targetLeader;
        private final List<String> output = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private int nestedStatements = 0;

        Pass(RuleTable table, BlockStack stack) {
            this.table = table;
            this.stack = stack;
            this.renderer = new TemplateRenderer(table.getDialect(), stack, this::convertStatement);
            this.targetLeader = table.getTarget().getCommentLeader();
        }

        RewriteOutcome run(String source) {
            List<LogicalLine> lines = LineNormalizer.normalize(source, table.getSource());
            List<String> codes = new ArrayList<>(lines.size());
            for (LogicalLine line : lines) {
                codes.add(table.substitute(line.getCode()));
            }

            for (int i = 0; i < lines.size(); i++) {
                LogicalLine line = lines.get(i);
                if (line.isBlank()) {
                    output.add("");
                    continue;
                }
                if (!line.hasCode()) {
                    output.add(indent(stack.size()) + targetLeader + line.getComment());
                    continue;
                }

                String code = codes.get(i);
                BlockFrame innermost = stack.peek();
                RuleTable.RuleMatch match = table.findRule(code, nextCode(lines, codes, i + 1),
                        innermost != null ? innermost.getLabel() : null);
                if (match == null) {
                    emit(line.getRaw(), "", stack.size());
                    warnings.add(unmatchedLine(line));
                    continue;
                }
                String trailing = line.hasComment() ? " " + targetLeader + line.getComment() : "";
                apply(match, line, code, trailing);
                if (match.getRule().isUnconverted()) {
                    warnings.add(unmatchedLine(line));
                }
            }
            return new RewriteOutcome(String.join("\n", output), warnings, stack.getFrames());
        }

        private String unmatchedLine(LogicalLine line) {
            return "no rule matched at line " + line.getLineNumber() + ", passed through verbatim: " + line.getRaw();
        }

        private String nextCode(List<LogicalLine> lines, List<String> codes, int from) {
            for (int i = from; i < lines.size(); i++) {
                if (lines.get(i).hasCode()) {
                    return codes.get(i);
                }
            }
            return null;
        }

        private void apply(RuleTable.RuleMatch match, LogicalLine line, String code, String trailing) {
            RewriteRule rule = match.getRule();
            Matcher matcher = match.getMatcher();
            BlockStackOp op = rule.getSideEffect();

            switch (op.getType()) {
                case NONE:
                    emit(renderer.render(rule.getTemplate(), matcher), trailing, stack.size());
                    break;
                case PUSH:
                    String header = renderer.render(rule.getTemplate(), matcher);
                    if (table.delimiterStylesDiffer() && table.getTarget().isBraceDelimited()) {
                        header = header + " {";
                    }
                    emit(header, trailing, stack.size());
                    String name = rule.getNameGroup() > 0 ? matcher.group(rule.getNameGroup()) : null;
                    stack.push(new BlockFrame(op.getKind(), line.getLineNumber(), op.getLabel(), name));
                    break;
                case POP:
                    close(op.getKind(), rule, matcher, line, code, trailing);
                    break;
                case POP_ANY:
                    close(null, rule, matcher, line, code, trailing);
                    break;
                case REOPEN:
                    reopen(op.getKind(), rule, matcher, line, trailing);
                    break;
                default:
                    throw new IllegalStateException("Unknown block stack operation: " + op);
            }
        }

        private void close(BlockKind kind, RewriteRule rule, Matcher matcher, LogicalLine line, String code, String trailing) {
            int index = stack.findNearest(kind);
            if (index < 0) {
                emit(line.getRaw(), "", stack.size());
                warnings.add("unmatched closer at line " + line.getLineNumber());
                return;
            }
            BlockFrame innermost = stack.peek();
            BlockFrame frame = stack.get(index);
            if (frame != innermost) {
                warnings.add("mismatched closer at line " + line.getLineNumber() + ": closes " + frame.getLabel()
                        + " opened at line " + frame.getOpenedAtLine() + ", innermost open block is "
                        + innermost.getLabel() + " opened at line " + innermost.getOpenedAtLine());
            }

            String text;
            if (rule.getTemplate() != null) {
                text = renderer.render(rule.getTemplate(), matcher);
            } else if (table.delimiterStylesDiffer()) {
                text = synthesizeCloser(frame);
            } else {
                text = code;
            }
            stack.removeAt(index);
            emit(text, trailing, stack.size());
        }

        private void reopen(BlockKind kind, RewriteRule rule, Matcher matcher, LogicalLine line, String trailing) {
            int index = stack.findNearest(kind);
            if (index < 0) {
                emit(line.getRaw(), "", stack.size());
                warnings.add("unmatched continuation at line " + line.getLineNumber());
                return;
            }
            if (index != stack.size() - 1) {
                BlockFrame innermost = stack.peek();
                warnings.add("mismatched continuation at line " + line.getLineNumber() + ": innermost open block is "
                        + innermost.getLabel() + " opened at line " + innermost.getOpenedAtLine());
            }
            emit(renderer.render(rule.getTemplate(), matcher), trailing, index);
        }

        private String synthesizeCloser(BlockFrame frame) {
            if (table.getTarget().isBraceDelimited()) {
                return "}";
            }
            String label = frame.getLabel();
            if (label == null) {
                // anonymous block, nothing to close in keyword syntax
                return "";
            }
            switch (label) {
                case "For":
                    return "Next";
                case "Do":
                    return "Loop";
                default:
                    return "End " + label;
            }
        }

        /**
         * Converts a nested statement ({@code If x Then y}) with the plain statement rules of the table.
         */
        private String convertStatement(String statement) {
            if (nestedStatements >= MAX_NESTED_STATEMENTS) {
                return statement;
            }
            nestedStatements++;
            try {
                for (RewriteRule rule : table.getRules()) {
                    if (rule.getSideEffect().getType() != BlockStackOp.Type.NONE) {
                        continue;
                    }
                    Matcher matcher = rule.match(statement, null, null);
                    if (matcher != null) {
                        return renderer.render(rule.getTemplate(), matcher);
                    }
                }
                return statement;
            } finally {
                nestedStatements--;
            }
        }

        private void emit(String text, String trailing, int depth) {
            if (text.isEmpty() && trailing.isEmpty()) {
                // rule consumed the line without output
                return;
            }
            String prefix = indent(depth);
            String[] parts = text.split("\n", -1);
            for (int i = 0; i < parts.length; i++) {
                String part = parts[i].isEmpty() ? "" : prefix + parts[i];
                output.add(i == 0 ? part + trailing : part);
            }
        }

        private String indent(int depth) {
            return " ".repeat(depth * indentSize);
        }
    }
}
