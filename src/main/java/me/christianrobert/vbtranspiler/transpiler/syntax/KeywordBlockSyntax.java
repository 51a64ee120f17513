package me.christianrobert.vbtranspiler.transpiler.syntax;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block boundaries of keyword-paired languages (VB6, VB.NET).
 *
 * <p>Openers are recognised by their leading keyword after optional modifiers, closers by
 * {@code End <Keyword>}, {@code Next}, {@code Loop} and {@code Wend}. A procedure header only
 * opens a block where it has a body: not inside an {@code Interface}, not when it is
 * {@code MustOverride}, and a VB.NET {@code Property} only when a {@code Get} or {@code Set}
 * follows.</p>
 */
public class KeywordBlockSyntax implements BlockSyntax {

    static final String MODIFIERS = "(?:(?:Public|Private|Protected|Friend|Shared|Static|Overrides|Overridable"
            + "|MustOverride|NotOverridable|MustInherit|NotInheritable|Overloads|Shadows|Partial|ReadOnly"
            + "|WriteOnly|Async|Default|Iterator|Global|Widening|Narrowing)\\s+)*";

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final Pattern END_BLOCK = Pattern.compile("^End\\s+(\\w+)\\b.*$", CI);
    private static final Pattern NEXT = Pattern.compile("^Next\\b.*$", CI);
    private static final Pattern LOOP = Pattern.compile("^Loop\\b.*$", CI);
    private static final Pattern WEND = Pattern.compile("^Wend\\b.*$", CI);

    private static final Pattern ELSE_IF = Pattern.compile("^Else\\s*If\\b.*\\bThen$", CI);
    private static final Pattern ELSE = Pattern.compile("^Else$", CI);
    private static final Pattern CASE = Pattern.compile("^Case\\b.*$", CI);
    private static final Pattern CATCH = Pattern.compile("^Catch\\b.*$", CI);
    private static final Pattern FINALLY = Pattern.compile("^Finally$", CI);

    private static final Pattern NAMESPACE = Pattern.compile("^Namespace\\s+[\\w.]+$", CI);
    private static final Pattern TYPE_BLOCK = Pattern.compile(
            "^" + MODIFIERS + "(Class|Module|Structure|Interface|Enum)\\s+\\w+.*$", CI);
    private static final Pattern VB6_TYPE = Pattern.compile("^(?:(?:Public|Private)\\s+)?Type\\s+\\w+$", CI);
    private static final Pattern PROCEDURE = Pattern.compile("^(" + MODIFIERS + ")(Sub|Function|Operator)\\s+\\w+.*$", CI);
    private static final Pattern PROPERTY = Pattern.compile("^(" + MODIFIERS + ")Property\\s+(?:(Get|Let|Set)\\s+)?\\w+.*$", CI);
    private static final Pattern ACCESSOR = Pattern.compile(
            "^(?:(?:Public|Private|Protected|Friend)\\s+)*(Get|Set|Let)\\s*(?:\\(.*\\))?$", CI);
    private static final Pattern ACCESSOR_START = Pattern.compile(
            "^(?:(?:Public|Private|Protected|Friend)\\s+)*(Get|Set)\\b.*$", CI);
    private static final Pattern MULTI_LINE_IF = Pattern.compile("^If\\b.*\\bThen$", CI);
    private static final Pattern SELECT = Pattern.compile("^Select\\s+Case\\b.*$", CI);
    private static final Pattern FOR = Pattern.compile("^For\\b.*$", CI);
    private static final Pattern DO = Pattern.compile("^Do\\b.*$", CI);
    private static final Pattern WHILE = Pattern.compile("^While\\b.*$", CI);
    private static final Pattern TRY = Pattern.compile("^Try$", CI);
    private static final Pattern OTHER_BLOCK = Pattern.compile("^(Using|With|SyncLock)\\b.*$", CI);

    private static final Map<String, BlockKind> CLOSER_KINDS = Map.ofEntries(
            Map.entry("class", BlockKind.CLASS),
            Map.entry("module", BlockKind.CLASS),
            Map.entry("structure", BlockKind.CLASS),
            Map.entry("interface", BlockKind.CLASS),
            Map.entry("type", BlockKind.CLASS),
            Map.entry("sub", BlockKind.METHOD),
            Map.entry("function", BlockKind.METHOD),
            Map.entry("operator", BlockKind.METHOD),
            Map.entry("property", BlockKind.METHOD),
            Map.entry("get", BlockKind.METHOD),
            Map.entry("set", BlockKind.METHOD),
            Map.entry("if", BlockKind.CONDITIONAL),
            Map.entry("select", BlockKind.CONDITIONAL),
            Map.entry("while", BlockKind.LOOP),
            Map.entry("namespace", BlockKind.OTHER),
            Map.entry("enum", BlockKind.OTHER),
            Map.entry("try", BlockKind.OTHER),
            Map.entry("using", BlockKind.OTHER),
            Map.entry("with", BlockKind.OTHER),
            Map.entry("synclock", BlockKind.OTHER));

    @Override
    public List<BlockEvent> scan(LogicalLine line, LogicalLine next, String enclosingLabel) {
        BlockEvent event = classify(line.getCode(), next, enclosingLabel);
        return event == null ? Collections.emptyList() : List.of(event);
    }

    private BlockEvent classify(String code, LogicalLine next, String enclosingLabel) {
        if (code.isEmpty()) {
            return null;
        }

        // closers
        Matcher end = END_BLOCK.matcher(code);
        if (end.matches()) {
            String keyword = end.group(1).toLowerCase(Locale.ROOT);
            BlockKind kind = CLOSER_KINDS.get(keyword);
            return kind != null ? BlockEvent.close(kind, canonical(end.group(1))) : null;
        }
        if (NEXT.matcher(code).matches()) {
            return BlockEvent.close(BlockKind.LOOP, "For");
        }
        if (LOOP.matcher(code).matches()) {
            return BlockEvent.close(BlockKind.LOOP, "Do");
        }
        if (WEND.matcher(code).matches()) {
            return BlockEvent.close(BlockKind.LOOP, "While");
        }

        // clause continuations
        if (ELSE_IF.matcher(code).matches()) {
            return BlockEvent.continuation(BlockKind.CONDITIONAL, "ElseIf");
        }
        if (ELSE.matcher(code).matches()) {
            return BlockEvent.continuation(BlockKind.CONDITIONAL, "Else");
        }
        if (CASE.matcher(code).matches()) {
            return BlockEvent.continuation(BlockKind.CONDITIONAL, "Case");
        }
        if (CATCH.matcher(code).matches()) {
            return BlockEvent.continuation(BlockKind.OTHER, "Catch");
        }
        if (FINALLY.matcher(code).matches()) {
            return BlockEvent.continuation(BlockKind.OTHER, "Finally");
        }

        // openers
        if (NAMESPACE.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.OTHER, "Namespace");
        }
        Matcher typeBlock = TYPE_BLOCK.matcher(code);
        if (typeBlock.matches()) {
            String keyword = canonical(typeBlock.group(1));
            return BlockEvent.open("Enum".equals(keyword) ? BlockKind.OTHER : BlockKind.CLASS, keyword);
        }
        if (VB6_TYPE.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.CLASS, "Type");
        }

        boolean inInterface = "Interface".equals(enclosingLabel);
        Matcher procedure = PROCEDURE.matcher(code);
        if (procedure.matches()) {
            if (inInterface || isAbstract(procedure.group(1))) {
                return null;
            }
            return BlockEvent.open(BlockKind.METHOD, canonical(procedure.group(2)));
        }
        Matcher property = PROPERTY.matcher(code);
        if (property.matches()) {
            if (inInterface || isAbstract(property.group(1))) {
                return null;
            }
            // VB6 Property Get/Let/Set always has a body, VB.NET only when accessors follow
            boolean vb6Accessor = property.group(2) != null;
            boolean hasAccessors = next != null && ACCESSOR_START.matcher(next.getCode()).matches();
            return vb6Accessor || hasAccessors ? BlockEvent.open(BlockKind.METHOD, "Property") : null;
        }
        Matcher accessor = ACCESSOR.matcher(code);
        if (accessor.matches() && "Property".equals(enclosingLabel)) {
            return BlockEvent.open(BlockKind.METHOD, canonical(accessor.group(1)));
        }

        if (MULTI_LINE_IF.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.CONDITIONAL, "If");
        }
        if (SELECT.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.CONDITIONAL, "Select");
        }
        if (FOR.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.LOOP, "For");
        }
        if (DO.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.LOOP, "Do");
        }
        if (WHILE.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.LOOP, "While");
        }
        if (TRY.matcher(code).matches()) {
            return BlockEvent.open(BlockKind.OTHER, "Try");
        }
        Matcher other = OTHER_BLOCK.matcher(code);
        if (other.matches()) {
            return BlockEvent.open(BlockKind.OTHER, canonical(other.group(1)));
        }
        return null;
    }

    private static boolean isAbstract(String modifiers) {
        return modifiers != null && modifiers.toLowerCase(Locale.ROOT).contains("mustoverride");
    }

    /**
     * Keyword with VB casing, e.g. "end sub" yields "Sub", "synclock" yields "SyncLock".
     */
    static String canonical(String keyword) {
        String lower = keyword.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "synclock":
                return "SyncLock";
            case "elseif":
                return "ElseIf";
            default:
                return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
        }
    }
}
