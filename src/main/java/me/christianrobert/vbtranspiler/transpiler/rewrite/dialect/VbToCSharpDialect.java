package me.christianrobert.vbtranspiler.transpiler.rewrite.dialect;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.core.tools.CodeCleaner;
import me.christianrobert.vbtranspiler.core.tools.TypeConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VB.NET fragments to C#.
 */
public class VbToCSharpDialect implements DialectConverter {

    private static final Pattern PARAMETER = Pattern.compile(
            "^(?:(Optional)\\s+)?(?:(ByVal|ByRef|ParamArray)\\s+)?(\\w+)(\\(\\))?(?:\\s+As\\s+(?:New\\s+)?(.+?))?(?:\\s*=\\s*(.+))?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AS_CONSTRAINT = Pattern.compile("\\s+As\\s+.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE_EQUALS = Pattern.compile("(?<![=!<>+\\-*/&|])=(?![=>])");

    @Override
    public String type(String type) {
        if (type == null || type.isBlank()) {
            return "object";
        }
        return TypeConverter.toCSharp(type.trim());
    }

    @Override
    public String modifiers(String modifiers, boolean typeLevel) {
        if (modifiers == null || modifiers.isBlank()) {
            return "";
        }
        List<String> converted = new ArrayList<>();
        for (String modifier : modifiers.trim().split("\\s+")) {
            converted.add(modifier(modifier));
        }
        return DialectConverter.joinModifiers(converted);
    }

    private static String modifier(String vbModifier) {
        switch (vbModifier.toLowerCase(Locale.ROOT)) {
            case "public":
                return "public";
            case "private":
                return "private";
            case "protected":
                return "protected";
            case "friend":
                return "internal";
            case "shared":
            case "static":
                return "static";
            case "overrides":
                return "override";
            case "overridable":
                return "virtual";
            case "mustoverride":
            case "mustinherit":
                return "abstract";
            case "notoverridable":
            case "notinheritable":
                return "sealed";
            case "shadows":
                return "new";
            case "partial":
                return "partial";
            case "readonly":
                return "readonly";
            case "const":
                return "const";
            case "async":
                return "async";
            default:
                // Overloads, Dim, WriteOnly, Default, Iterator have no C# keyword
                return "";
        }
    }

    @Override
    public String parameters(String parameters) {
        if (parameters == null || parameters.isBlank()) {
            return "";
        }
        List<String> converted = new ArrayList<>();
        for (String parameter : TypeConverter.splitTopLevel(parameters, ',')) {
            converted.add(parameter(parameter.trim()));
        }
        return String.join(", ", converted);
    }

    private String parameter(String parameter) {
        Matcher m = PARAMETER.matcher(parameter);
        if (!m.matches()) {
            return parameter;
        }
        StringBuilder sb = new StringBuilder();
        String passing = m.group(2);
        if ("ByRef".equalsIgnoreCase(passing)) {
            sb.append("ref ");
        } else if ("ParamArray".equalsIgnoreCase(passing)) {
            sb.append("params ");
        }
        sb.append(type(m.group(5)));
        if (m.group(4) != null) {
            sb.append("[]");
        }
        sb.append(' ').append(m.group(3));
        if (m.group(6) != null) {
            sb.append(" = ").append(m.group(6).trim());
        }
        return sb.toString();
    }

    @Override
    public String condition(String condition) {
        if (condition == null) {
            return "";
        }
        return CodeCleaner.mapOutsideStrings(condition.trim(), Language.VBNET,
                code -> SINGLE_EQUALS.matcher(code).replaceAll("=="));
    }

    @Override
    public String asClause(String type) {
        return type(type);
    }

    @Override
    public String typeParameters(String typeParameters) {
        if (typeParameters == null || typeParameters.isBlank()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (String parameter : TypeConverter.splitTopLevel(typeParameters, ',')) {
            // constraints (Of T As Class) are dropped
            String name = AS_CONSTRAINT.matcher(parameter.trim()).replaceFirst("");
            names.add(name.replaceFirst("(?i)^In\\s+", "in ").replaceFirst("(?i)^Out\\s+", "out "));
        }
        return "<" + String.join(", ", names) + ">";
    }
}
