package me.christianrobert.vbtranspiler.transpiler.rewrite.dialect;

import me.christianrobert.vbtranspiler.core.tools.TypeConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C# fragments to VB.NET.
 */
public class CSharpToVbDialect implements DialectConverter {

    private static final Pattern PARAMETER = Pattern.compile(
            "^(?:(ref|out|params|this|in)\\s+)?([\\w.]+(?:\\s*<.+>)?(?:\\[\\])*\\??)\\s+(\\w+)(?:\\s*=\\s*(.+))?$");

    @Override
    public String type(String type) {
        if (type == null || type.isBlank()) {
            return "Object";
        }
        return TypeConverter.toVbNet(type.trim());
    }

    @Override
    public String modifiers(String modifiers, boolean typeLevel) {
        if (modifiers == null || modifiers.isBlank()) {
            return "";
        }
        List<String> converted = new ArrayList<>();
        for (String modifier : modifiers.trim().split("\\s+")) {
            converted.add(modifier(modifier, typeLevel));
        }
        return DialectConverter.joinModifiers(converted);
    }

    private static String modifier(String csModifier, boolean typeLevel) {
        switch (csModifier.toLowerCase(Locale.ROOT)) {
            case "public":
                return "Public";
            case "private":
                return "Private";
            case "protected":
                return "Protected";
            case "internal":
                return "Friend";
            case "static":
                return "Shared";
            case "override":
                return "Overrides";
            case "virtual":
                return "Overridable";
            case "abstract":
                return typeLevel ? "MustInherit" : "MustOverride";
            case "sealed":
                return typeLevel ? "NotInheritable" : "NotOverridable";
            case "new":
                return "Shadows";
            case "partial":
                return "Partial";
            case "readonly":
                return "ReadOnly";
            case "const":
                return "Const";
            case "async":
                return "Async";
            default:
                // extern, unsafe, volatile
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
        String passing = m.group(1);
        if (m.group(4) != null) {
            sb.append("Optional ");
        }
        if ("ref".equals(passing) || "out".equals(passing)) {
            sb.append("ByRef ");
        } else if ("params".equals(passing)) {
            sb.append("ParamArray ");
        }
        sb.append(m.group(3)).append(" As ").append(type(m.group(2)));
        if (m.group(4) != null) {
            sb.append(" = ").append(m.group(4).trim());
        }
        return sb.toString();
    }

    @Override
    public String condition(String condition) {
        return condition == null ? "" : condition.trim();
    }

    @Override
    public String asClause(String type) {
        if (type == null || type.isBlank() || "var".equals(type.trim())) {
            return "";
        }
        return " As " + type(type);
    }

    @Override
    public String typeParameters(String typeParameters) {
        if (typeParameters == null || typeParameters.isBlank()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (String parameter : TypeConverter.splitTopLevel(typeParameters, ',')) {
            names.add(parameter.trim().replaceFirst("^in\\s+", "In ").replaceFirst("^out\\s+", "Out "));
        }
        return "(Of " + String.join(", ", names) + ")";
    }
}
