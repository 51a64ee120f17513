package me.christianrobert.vbtranspiler.transpiler.syntax;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.core.tools.CodeCleaner;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns source text into logical lines.
 *
 * <p>Physical lines are split on line breaks and comments are separated from code. Afterwards a
 * few layout differences that would otherwise defeat line-by-line matching are evened out:</p>
 * <ul>
 *   <li>VB: {@code _} line continuations are joined, {@code Inherits}/{@code Implements} lines
 *       directly after a class header are merged into the header, statements separated by
 *       {@code :} are split into one line each (single-line {@code If} and labels excepted)</li>
 *   <li>C#: a lone {@code {} is moved up onto its header (Allman to K&amp;R), a lone {@code }}
 *       followed by {@code else}, {@code catch}, {@code finally} or a do-while tail is merged
 *       with that line, {@code /* ... *&#47;} blocks become comment lines</li>
 * </ul>
 */
public class LineNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern VB_REM = Pattern.compile("^REM(\\s.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern VB_CLASS_HEADER = Pattern.compile(
            "^(?:(?:Public|Private|Protected|Friend|Partial|MustInherit|NotInheritable|Shadows)\\s+)*(?:Class|Structure|Interface)\\s+\\w+.*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern VB_INHERITANCE = Pattern.compile("^(Inherits|Implements)\\s+.+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern VB_COLON_INHERITANCE = Pattern.compile("\\s*:\\s*(Inherits|Implements)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern VB_SINGLE_LINE_IF = Pattern.compile("^If\\b.*\\bThen\\s+\\S.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern VB_IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Set<String> VB_ONE_WORD_STATEMENTS = Set.of(
            "else", "next", "loop", "wend", "do", "try", "finally", "return", "stop", "end", "beep");
    private static final Pattern CS_CONTINUATION = Pattern.compile(
            "^(?:else\\b|catch\\b|finally\\b|while\\s*\\(.*\\)\\s*;$)");

    private LineNormalizer() {
    }

    /**
     * Normalises source text into logical lines.
     *
     * @param source Source text, may be null
     * @param language Language of the source, decides comment syntax and block layout rules
     * @return Logical lines in source order, one per physical line unless lines were merged
     */
    public static List<LogicalLine> normalize(String source, Language language) {
        if (source == null || source.isEmpty()) {
            return new ArrayList<>();
        }
        String[] physical = LINE_BREAK.split(source, -1);
        List<LogicalLine> lines = splitComments(physical, language);

        if (language.isKeywordDelimited()) {
            lines = joinContinuations(lines);
            lines = mergeInheritance(lines);
            lines = splitStatements(lines, language);
        } else {
            lines = attachOpeningBraces(lines);
            lines = mergeContinuationChains(lines);
        }
        return lines;
    }

    private static List<LogicalLine> splitComments(String[] physical, Language language) {
        List<LogicalLine> lines = new ArrayList<>(physical.length);
        boolean inBlockComment = false;

        for (int i = 0; i < physical.length; i++) {
            String text = physical[i];
            String trimmed = text.trim();
            int lineNumber = i + 1;

            if (language.isBraceDelimited() && (inBlockComment || trimmed.startsWith("/*"))) {
                String body = inBlockComment ? trimmed : trimmed.substring(2);
                String rest = "";
                int close = body.indexOf("*/");
                if (close >= 0) {
                    rest = body.substring(close + 2).trim();
                    body = body.substring(0, close);
                    inBlockComment = false;
                } else {
                    inBlockComment = true;
                }
                body = body.trim();
                if (body.startsWith("*")) {
                    body = body.substring(1).trim();
                }
                lines.add(new LogicalLine(lineNumber, rest, body.isEmpty() ? "" : " " + body, trimmed));
                continue;
            }

            if (language.isKeywordDelimited() && VB_REM.matcher(trimmed).matches()) {
                lines.add(new LogicalLine(lineNumber, "", trimmed.substring(3), trimmed));
                continue;
            }

            int commentStart = CodeCleaner.findLineCommentStart(text, language);
            if (commentStart >= 0) {
                String code = text.substring(0, commentStart);
                String comment = text.substring(commentStart + language.getCommentLeader().length());
                lines.add(new LogicalLine(lineNumber, code, comment, trimmed));
            } else {
                lines.add(new LogicalLine(lineNumber, text, null, trimmed));
            }
        }
        return lines;
    }

    private static List<LogicalLine> joinContinuations(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());
        LogicalLine pending = null;

        for (LogicalLine line : lines) {
            if (pending != null) {
                String head = pending.getCode();
                head = head.substring(0, head.length() - 1).trim();
                String joinedCode = head + " " + line.getCode();
                String joinedRaw = pending.getRaw() + " " + line.getRaw();
                String comment = line.hasComment() ? line.getComment() : pending.getComment();
                pending = new LogicalLine(pending.getLineNumber(), joinedCode, comment, joinedRaw);
            } else {
                pending = line;
            }

            if (!endsWithContinuation(pending.getCode())) {
                result.add(pending);
                pending = null;
            }
        }
        if (pending != null) {
            // dangling continuation on the last line
            result.add(pending);
        }
        return result;
    }

    private static boolean endsWithContinuation(String code) {
        return code.equals("_") || code.endsWith(" _");
    }

    private static List<LogicalLine> mergeInheritance(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());

        for (LogicalLine line : lines) {
            String code = line.getCode();
            Matcher colon = VB_COLON_INHERITANCE.matcher(code);
            if (VB_CLASS_HEADER.matcher(code).matches() && colon.find()) {
                line = line.withCode(colon.replaceAll(" $1"), line.getRaw());
                code = line.getCode();
            }

            if (VB_INHERITANCE.matcher(code).matches()) {
                int headerIndex = previousCodeLine(result);
                if (headerIndex >= 0 && VB_CLASS_HEADER.matcher(result.get(headerIndex).getCode()).matches()) {
                    LogicalLine header = result.get(headerIndex);
                    result.set(headerIndex, header.withCode(header.getCode() + " " + code, header.getRaw() + " " + line.getRaw()));
                    continue;
                }
            }
            result.add(line);
        }
        return result;
    }

    private static List<LogicalLine> splitStatements(List<LogicalLine> lines, Language language) {
        List<LogicalLine> result = new ArrayList<>(lines.size());

        for (LogicalLine line : lines) {
            String code = line.getCode();
            List<Integer> separators = statementSeparators(code, language);
            if (separators.isEmpty() || VB_SINGLE_LINE_IF.matcher(code).matches()) {
                result.add(line);
                continue;
            }

            List<String> statements = new ArrayList<>();
            int start = 0;
            for (int separator : separators) {
                statements.add(code.substring(start, separator).trim());
                start = separator + 1;
            }
            statements.add(code.substring(start).trim());

            // a leading label keeps its colon
            String first = statements.get(0);
            if (VB_IDENTIFIER.matcher(first).matches() && !VB_ONE_WORD_STATEMENTS.contains(first.toLowerCase(Locale.ROOT))) {
                statements.set(0, first + ":");
            }
            statements.removeIf(String::isEmpty);
            if (statements.isEmpty()) {
                result.add(line);
                continue;
            }

            for (int i = 0; i < statements.size(); i++) {
                String statement = statements.get(i);
                String comment = i == statements.size() - 1 ? line.getComment() : null;
                result.add(new LogicalLine(line.getLineNumber(), statement, comment, statement));
            }
        }
        return result;
    }

    /**
     * Positions of {@code :} outside string literals that separate statements. {@code :=} of named
     * arguments is not a separator.
     */
    private static List<Integer> statementSeparators(String code, Language language) {
        List<Integer> separators = new ArrayList<>();
        if (code.indexOf(':') < 0) {
            return separators;
        }
        String masked = CodeCleaner.blankStringLiterals(code, language);
        for (int i = 0; i < masked.length(); i++) {
            if (masked.charAt(i) == ':' && (i + 1 >= masked.length() || masked.charAt(i + 1) != '=')) {
                separators.add(i);
            }
        }
        return separators;
    }

    private static List<LogicalLine> attachOpeningBraces(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());

        for (LogicalLine line : lines) {
            if (line.getCode().equals("{")) {
                int headerIndex = previousCodeLine(result);
                if (headerIndex >= 0) {
                    LogicalLine header = result.get(headerIndex);
                    String headerCode = header.getCode();
                    boolean attachable = !headerCode.endsWith(";") && !headerCode.endsWith("{") && !headerCode.endsWith("}")
                            && !(header.hasComment() && line.hasComment());
                    if (attachable) {
                        String comment = header.hasComment() ? header.getComment() : line.getComment();
                        result.set(headerIndex, new LogicalLine(header.getLineNumber(), headerCode + " {", comment,
                                header.getRaw() + " " + line.getRaw()));
                        continue;
                    }
                }
            }
            result.add(line);
        }
        return result;
    }

    private static List<LogicalLine> mergeContinuationChains(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());

        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (line.getCode().equals("}") && !line.hasComment()) {
                int next = i + 1;
                while (next < lines.size() && lines.get(next).isBlank()) {
                    next++;
                }
                if (next < lines.size() && CS_CONTINUATION.matcher(lines.get(next).getCode()).find()) {
                    LogicalLine tail = lines.get(next);
                    result.add(new LogicalLine(line.getLineNumber(), "} " + tail.getCode(), tail.getComment(),
                            line.getRaw() + " " + tail.getRaw()));
                    i = next;
                    continue;
                }
            }
            result.add(line);
        }
        return result;
    }

    /**
     * Index of the last line with code, skipping blank lines only.
     * A comment line in between stops the search.
     */
    private static int previousCodeLine(List<LogicalLine> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            LogicalLine candidate = lines.get(i);
            if (candidate.hasCode()) {
                return i;
            }
            if (!candidate.isBlank()) {
                return -1;
            }
        }
        return -1;
    }
}
