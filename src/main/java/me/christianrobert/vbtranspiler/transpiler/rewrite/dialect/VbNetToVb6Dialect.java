package me.christianrobert.vbtranspiler.transpiler.rewrite.dialect;

import me.christianrobert.vbtranspiler.core.tools.TypeConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * VB.NET fragments to VB6. Parameters without passing mode were ByVal in VB.NET and say so
 * explicitly; modifiers VB6 does not know are dropped.
 */
public class VbNetToVb6Dialect implements DialectConverter {

    private static final Set<String> VB6_MODIFIERS = Set.of("public", "private", "friend", "static", "global");

    @Override
    public String type(String type) {
        return type == null ? "" : TypeConverter.vbNetToVb6(type);
    }

    @Override
    public String modifiers(String modifiers, boolean typeLevel) {
        if (modifiers == null || modifiers.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String modifier : modifiers.trim().split("\\s+")) {
            String lower = modifier.toLowerCase(Locale.ROOT);
            if (VB6_MODIFIERS.contains(lower)) {
                kept.add(modifier);
            } else if ("protected".equals(lower)) {
                kept.add("Private");
            }
        }
        return DialectConverter.joinModifiers(kept);
    }

    @Override
    public String parameters(String parameters) {
        return Vb6ToVbNetDialect.convertParameters(parameters, "ByVal", this);
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
