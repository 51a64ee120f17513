package me.christianrobert.vbtranspiler.transpiler.rewrite.dialect;

import me.christianrobert.vbtranspiler.core.tools.TypeConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VB6 fragments to VB.NET. Parameters without passing mode were ByRef in VB6 and say so explicitly.
 */
public class Vb6ToVbNetDialect implements DialectConverter {

    static final Pattern PARAMETER = Pattern.compile(
            "^(?:(Optional)\\s+)?(?:(ByVal|ByRef|ParamArray)\\s+)?(\\w+)(\\(\\))?(?:\\s+As\\s+(.+?))?(?:\\s*=\\s*(.+))?$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String type(String type) {
        return type == null ? "" : TypeConverter.vb6ToVbNet(type);
    }

    @Override
    public String modifiers(String modifiers, boolean typeLevel) {
        if (modifiers == null || modifiers.isBlank()) {
            return "";
        }
        return modifiers.trim().replaceAll("\\s+", " ") + " ";
    }

    @Override
    public String parameters(String parameters) {
        return convertParameters(parameters, "ByRef", this);
    }

    static String convertParameters(String parameters, String defaultPassing, DialectConverter converter) {
        if (parameters == null || parameters.isBlank()) {
            return "";
        }
        List<String> converted = new ArrayList<>();
        for (String parameter : TypeConverter.splitTopLevel(parameters, ',')) {
            Matcher m = PARAMETER.matcher(parameter.trim());
            if (!m.matches()) {
                converted.add(parameter.trim());
                continue;
            }
            StringBuilder sb = new StringBuilder();
            if (m.group(1) != null) {
                sb.append("Optional ");
            }
            sb.append(m.group(2) != null ? m.group(2) : defaultPassing).append(' ');
            sb.append(m.group(3));
            if (m.group(4) != null) {
                sb.append("()");
            }
            if (m.group(5) != null) {
                sb.append(" As ").append(converter.type(m.group(5)));
            }
            if (m.group(6) != null) {
                sb.append(" = ").append(m.group(6).trim());
            }
            converted.add(sb.toString());
        }
        return String.join(", ", converted);
    }

    @Override
    public String condition(String condition) {
        return condition == null ? "" : condition.trim();
    }

    @Override
    public String asClause(String type) {
        if (type == null || type.isBlank()) {
            return "";
        }
        return " As " + type(type);
    }

    /**
     * VB6 has no generics.
     */
    @Override
    public String typeParameters(String typeParameters) {
        return "";
    }
}
