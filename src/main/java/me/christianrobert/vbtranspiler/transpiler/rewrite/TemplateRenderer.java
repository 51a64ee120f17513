package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.DialectConverter;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands the placeholders of a rule template.
 *
 * <ul>
 *   <li>{@code {n}} capture group n, {@code {0}} the whole line</li>
 *   <li>{@code {mod:n}} member modifiers, {@code {tmod:n}} type modifiers, {@code {pmod:n}} property
 *       modifiers ({@code ReadOnly} and {@code WriteOnly} dropped)</li>
 *   <li>{@code {type:n}} type name, {@code {as:n}} optional VB {@code As} clause</li>
 *   <li>{@code {params:n}} parameter list, {@code {tparams:n}} generic type parameters,
 *       {@code {cond:n}} condition</li>
 *   <li>{@code {line:n}} a nested single statement, converted with the same table</li>
 *   <li>{@code {class}}, {@code {method}} names of the enclosing class and method,
 *       {@code {loop}} keyword of the enclosing loop</li>
 * </ul>
 *
 * Group values are inserted literally; braces in them are never expanded.
 */
class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{(?:(mod|tmod|pmod|type|tparams|params|cond|as|line):)?(\\d+|class|method|loop)\\}");

    private static final Pattern PROPERTY_ONLY_MODIFIERS = Pattern.compile("\\b(?:ReadOnly|WriteOnly)\\b\\s*",
            Pattern.CASE_INSENSITIVE);

    private final DialectConverter dialect;
    private final BlockStack stack;
    private final UnaryOperator<String> statementConverter;

    TemplateRenderer(DialectConverter dialect, BlockStack stack, UnaryOperator<String> statementConverter) {
        this.dialect = dialect;
        this.stack = stack;
        this.statementConverter = statementConverter;
    }

    String render(String template, Matcher match) {
        Matcher placeholder = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (placeholder.find()) {
            String value = expand(placeholder.group(1), placeholder.group(2), match);
            placeholder.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        placeholder.appendTail(sb);
        return sb.toString();
    }

    private String expand(String conversion, String reference, Matcher match) {
        switch (reference) {
            case "class":
                return frameName(BlockKind.CLASS);
            case "method":
                return frameName(BlockKind.METHOD);
            case "loop":
                BlockFrame loop = stack.nearest(BlockKind.LOOP);
                return loop != null ? loop.getLabel() : "Do";
            default:
                break;
        }

        int group = Integer.parseInt(reference);
        String value = group <= match.groupCount() ? match.group(group) : null;
        if (conversion == null) {
            return value != null ? value : "";
        }
        switch (conversion) {
            case "mod":
                return dialect.modifiers(value, false);
            case "tmod":
                return dialect.modifiers(value, true);
            case "pmod":
                return dialect.modifiers(value == null ? null : PROPERTY_ONLY_MODIFIERS.matcher(value).replaceAll(""), false);
            case "type":
                return dialect.type(value);
            case "tparams":
                return dialect.typeParameters(value);
            case "params":
                return dialect.parameters(value);
            case "cond":
                return dialect.condition(value);
            case "as":
                return dialect.asClause(value);
            case "line":
                return value != null ? statementConverter.apply(value.trim()) : "";
            default:
                throw new IllegalArgumentException("Unknown template conversion: " + conversion);
        }
    }

    /**
     * Name of the innermost named block of a kind. Accessor blocks carry no name of their own.
     */
    private String frameName(BlockKind kind) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            BlockFrame frame = stack.get(i);
            if (frame.getKind() == kind && frame.getName() != null) {
                return frame.getName();
            }
        }
        return "";
    }
}
