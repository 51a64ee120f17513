package me.christianrobert.vbtranspiler.transpiler.syntax;

import me.christianrobert.vbtranspiler.core.model.Language;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single line of code as a declaration.
 *
 * <p>Recognises type declarations (class, module, structure, interface, VB6 Type), procedures
 * with optional return type, constructors, properties and fields. Fields need an explicit
 * access modifier so that locals ({@code Dim x}, {@code int x = 0;}) are not reported.</p>
 */
public final class DeclarationPatterns {

    public enum DeclarationType {
        CLASS,
        METHOD,
        CONSTRUCTOR,
        PROPERTY,
        FIELD
    }

    /**
     * A recognised declaration. {@code typeName} is the return type of a method or the type of a
     * property/field, null where the source states none. C# {@code void} methods report "void",
     * VB {@code Sub}s report null.
     */
    public static final class Declaration {
        private final DeclarationType type;
        private final String name;
        private final String typeName;

        Declaration(DeclarationType type, String name, String typeName) {
            this.type = type;
            this.name = name;
            this.typeName = typeName;
        }

        public DeclarationType getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        public String getTypeName() {
            return typeName;
        }

        @Override
        public String toString() {
            return type + " " + name + (typeName != null ? " : " + typeName : "");
        }
    }

    private static final int CI = Pattern.CASE_INSENSITIVE;

    // ========== VB ==========

    private static final String VB_MODS = KeywordBlockSyntax.MODIFIERS;

    private static final Pattern VB_CLASS = Pattern.compile(
            "^" + VB_MODS + "(?:Class|Module|Structure|Interface|Type)\\s+(\\w+)\\b.*$", CI);
    private static final Pattern VB_CONSTRUCTOR = Pattern.compile(
            "^" + VB_MODS + "Sub\\s+New\\b.*$", CI);
    private static final Pattern VB_METHOD = Pattern.compile(
            "^" + VB_MODS + "(Sub|Function)\\s+(\\w+)\\s*(?:\\((.*?)\\))?\\s*(?:As\\s+(.+?))?\\s*(?:(?:Handles|Implements)\\s+.*)?$", CI);
    private static final Pattern VB_PROPERTY = Pattern.compile(
            "^" + VB_MODS + "Property\\s+(?:(?:Get|Let|Set)\\s+)?(\\w+)\\s*(?:\\((.*?)\\))?\\s*(?:As\\s+(?:New\\s+)?(.+?))?\\s*(?:=.*)?(?:\\s+Implements\\s+.*)?$", CI);
    private static final Pattern VB_FIELD = Pattern.compile(
            "^(?:Public|Private|Protected|Friend|Global)\\s+(?:(?:Shared|ReadOnly|Shadows|Const|WithEvents|Dim|Protected|Friend|Static)\\s+)*"
                    + "(\\w+)(?:\\(\\s*\\d*\\s*\\))?\\s*(?:As\\s+(?:New\\s+)?(.+?))?\\s*(?:=.*)?$", CI);

    private static final Set<String> VB_RESERVED = Set.of(
            "sub", "function", "property", "class", "module", "structure", "interface", "enum", "type",
            "declare", "event", "delegate", "operator", "const", "overrides", "overridable", "mustoverride",
            "sealed", "partial", "shared", "readonly", "namespace", "custom");

    // ========== C# ==========

    private static final String CS_MODS = "(?:(?:public|private|protected|internal|static|abstract|sealed|partial|virtual"
            + "|override|readonly|async|extern|unsafe|new|const|volatile)\\s+)*";
    private static final String CS_TYPE = "([\\w.]+(?:\\s*<.+?>)?(?:\\[\\])*\\??)";

    private static final Pattern CS_CLASS = Pattern.compile(
            "^" + CS_MODS + "(?:class|struct|interface|record)\\s+(\\w+)\\b.*$");
    private static final Pattern CS_CONSTRUCTOR = Pattern.compile(
            "^(?:(?:public|private|protected|internal|static)\\s+)+(\\w+)\\s*\\((.*?)\\)\\s*(?::\\s*(?:base|this)\\s*\\(.*?\\))?\\s*(?:\\{.*)?$");
    private static final Pattern CS_METHOD = Pattern.compile(
            "^" + CS_MODS + CS_TYPE + "\\s+(\\w+)\\s*(?:<[^>]*>)?\\s*\\((.*?)\\)\\s*(?:where\\s+.+?)?\\s*(?:\\{.*|;|=>.*)?$");
    private static final Pattern CS_PROPERTY = Pattern.compile(
            "^" + CS_MODS + CS_TYPE + "\\s+(\\w+)\\s*(?:\\{.*|=>.*)?$");
    private static final Pattern CS_FIELD = Pattern.compile(
            "^(?:public|private|protected|internal)\\s+" + CS_MODS + CS_TYPE + "\\s+(\\w+)\\s*(?:=.*)?;$");

    private static final Set<String> CS_RESERVED = Set.of(
            "return", "new", "throw", "await", "else", "case", "goto", "yield", "using", "if", "while", "for",
            "foreach", "switch", "catch", "lock", "do", "var", "class", "struct", "interface", "namespace",
            "enum", "record", "event", "delegate", "public", "private", "protected", "internal", "static",
            "abstract", "sealed", "partial", "virtual", "override", "readonly", "async", "extern", "unsafe",
            "const", "volatile", "operator", "implicit", "explicit", "get", "set", "try", "finally", "base", "this");

    private DeclarationPatterns() {
    }

    /**
     * Classifies a line of code.
     *
     * @param code Trimmed code without comments
     * @param language Language of the code
     * @return The declaration, or null if the line declares nothing
     */
    public static Declaration classify(String code, Language language) {
        if (code == null || code.isEmpty()) {
            return null;
        }
        return language.isKeywordDelimited() ? classifyVb(code) : classifyCSharp(code);
    }

    private static Declaration classifyVb(String code) {
        Matcher m = VB_CLASS.matcher(code);
        if (m.matches()) {
            return new Declaration(DeclarationType.CLASS, m.group(1), null);
        }
        if (VB_CONSTRUCTOR.matcher(code).matches()) {
            return new Declaration(DeclarationType.CONSTRUCTOR, "New", null);
        }
        m = VB_METHOD.matcher(code);
        if (m.matches()) {
            boolean isFunction = m.group(1).equalsIgnoreCase("Function");
            String returnType = isFunction ? trimToNull(m.group(4)) : null;
            return new Declaration(DeclarationType.METHOD, m.group(2), returnType);
        }
        m = VB_PROPERTY.matcher(code);
        if (m.matches()) {
            return new Declaration(DeclarationType.PROPERTY, m.group(1), trimToNull(m.group(3)));
        }
        m = VB_FIELD.matcher(code);
        if (m.matches() && !VB_RESERVED.contains(m.group(1).toLowerCase(Locale.ROOT))) {
            return new Declaration(DeclarationType.FIELD, m.group(1), trimToNull(m.group(2)));
        }
        return null;
    }

    private static Declaration classifyCSharp(String code) {
        Matcher m = CS_CLASS.matcher(code);
        if (m.matches()) {
            return new Declaration(DeclarationType.CLASS, m.group(1), null);
        }
        m = CS_CONSTRUCTOR.matcher(code);
        if (m.matches() && !CS_RESERVED.contains(m.group(1))) {
            return new Declaration(DeclarationType.CONSTRUCTOR, m.group(1), null);
        }
        m = CS_METHOD.matcher(code);
        if (m.matches() && isTypeAndName(m.group(1), m.group(2))) {
            return new Declaration(DeclarationType.METHOD, m.group(2), m.group(1));
        }
        m = CS_FIELD.matcher(code);
        if (m.matches() && isTypeAndName(m.group(1), m.group(2))) {
            return new Declaration(DeclarationType.FIELD, m.group(2), m.group(1));
        }
        m = CS_PROPERTY.matcher(code);
        if (m.matches() && isTypeAndName(m.group(1), m.group(2))) {
            return new Declaration(DeclarationType.PROPERTY, m.group(2), m.group(1));
        }
        return null;
    }

    private static boolean isTypeAndName(String type, String name) {
        return !CS_RESERVED.contains(type) && !CS_RESERVED.contains(name);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
