package me.christianrobert.vbtranspiler.transpiler.syntax;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.core.tools.CodeCleaner;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block boundaries of brace-paired languages (C#).
 *
 * <p>Braces inside string and char literals are ignored. The first {@code {} on a line is
 * classified by the text in front of it, later ones on the same line (initialisers, inline
 * accessors) count as {@link BlockKind#OTHER}. A {@code }} closes whatever is open. A line of
 * the form {@code } else ... {} is reported as one continuation instead of a close and an open.</p>
 */
public class BraceBlockSyntax implements BlockSyntax {

    private static final Pattern CONTINUATION = Pattern.compile("^}\\s*(else|catch|finally)\\b[^{}]*\\{$");

    private static final Pattern TYPE_HEADER = Pattern.compile("\\b(class|struct|interface|record)\\s+\\w+");
    private static final Pattern NAMESPACE_HEADER = Pattern.compile("^namespace\\b");
    private static final Pattern ENUM_HEADER = Pattern.compile("\\benum\\s+\\w+");
    private static final Pattern CONDITIONAL_HEADER = Pattern.compile("^(if|else|switch)\\b");
    private static final Pattern LOOP_HEADER = Pattern.compile("^(for|foreach|while|do)\\b");
    private static final Pattern OTHER_HEADER = Pattern.compile("^(try|catch|finally|using|lock|checked|unchecked|unsafe|fixed)\\b");
    private static final Pattern ACCESSOR_HEADER = Pattern.compile(
            "^(?:(?:public|private|protected|internal)\\s+)*(get|set|init|add|remove)$");

    @Override
    public List<BlockEvent> scan(LogicalLine line, LogicalLine next, String enclosingLabel) {
        String code = CodeCleaner.blankStringLiterals(line.getCode(), Language.CSHARP);
        List<BlockEvent> events = new ArrayList<>();
        if (code.isEmpty()) {
            return events;
        }

        Matcher continuation = CONTINUATION.matcher(code);
        if (continuation.matches()) {
            String keyword = continuation.group(1);
            BlockKind kind = "else".equals(keyword) ? BlockKind.CONDITIONAL : BlockKind.OTHER;
            events.add(BlockEvent.continuation(kind, keyword));
            return events;
        }

        boolean firstOpen = true;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                if (firstOpen) {
                    events.add(classifyHeader(code.substring(0, i).trim()));
                    firstOpen = false;
                } else {
                    events.add(BlockEvent.open(BlockKind.OTHER, "block"));
                }
            } else if (c == '}') {
                events.add(BlockEvent.closeAny());
            }
        }
        return events;
    }

    private BlockEvent classifyHeader(String header) {
        // "} else {" leftovers and bare blocks
        String text = header.startsWith("}") ? header.substring(1).trim() : header;
        if (text.isEmpty()) {
            return BlockEvent.open(BlockKind.OTHER, "block");
        }

        Matcher type = TYPE_HEADER.matcher(text);
        if (type.find()) {
            return BlockEvent.open(BlockKind.CLASS, type.group(1));
        }
        if (NAMESPACE_HEADER.matcher(text).find()) {
            return BlockEvent.open(BlockKind.OTHER, "namespace");
        }
        if (ENUM_HEADER.matcher(text).find()) {
            return BlockEvent.open(BlockKind.OTHER, "enum");
        }
        Matcher conditional = CONDITIONAL_HEADER.matcher(text);
        if (conditional.find()) {
            return BlockEvent.open(BlockKind.CONDITIONAL, conditional.group(1));
        }
        Matcher loop = LOOP_HEADER.matcher(text);
        if (loop.find()) {
            return BlockEvent.open(BlockKind.LOOP, loop.group(1));
        }
        Matcher other = OTHER_HEADER.matcher(text);
        if (other.find()) {
            return BlockEvent.open(BlockKind.OTHER, other.group(1));
        }
        Matcher accessor = ACCESSOR_HEADER.matcher(text);
        if (accessor.matches()) {
            return BlockEvent.open(BlockKind.METHOD, accessor.group(1));
        }

        DeclarationPatterns.Declaration declaration = DeclarationPatterns.classify(text, Language.CSHARP);
        if (declaration != null) {
            switch (declaration.getType()) {
                case METHOD:
                case CONSTRUCTOR:
                    return BlockEvent.open(BlockKind.METHOD, "method");
                case PROPERTY:
                    return BlockEvent.open(BlockKind.METHOD, "property");
                default:
                    break;
            }
        }
        return BlockEvent.open(BlockKind.OTHER, "block");
    }
}
