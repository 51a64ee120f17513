package me.christianrobert.vbtranspiler.transpiler.rewrite.dialect;

/**
 * Converts the declaration fragments that rule templates refer to through typed placeholders.
 * One implementation per direction.
 */
public interface DialectConverter {

    /**
     * {@code {type:n}}: a type name.
     */
    String type(String type);

    /**
     * {@code {mod:n}} and {@code {tmod:n}}: a modifier list.
     *
     * @param modifiers Source modifiers separated by whitespace, may be null
     * @param typeLevel True for class level modifiers, where {@code abstract} means {@code MustInherit}
     * @return Target modifiers followed by one space, or an empty string
     */
    String modifiers(String modifiers, boolean typeLevel);

    /**
     * {@code {params:n}}: the text between the parentheses of a parameter list.
     */
    String parameters(String parameters);

    /**
     * {@code {cond:n}}: a boolean condition.
     */
    String condition(String condition);

    /**
     * {@code {as:n}}: an optional type turned into a VB {@code As} clause (with leading space),
     * or the plain type name for brace targets.
     */
    String asClause(String type);

    /**
     * {@code {tparams:n}}: the type parameters of a generic method, {@code T, U} in C# or
     * {@code Of T, U} in VB.NET without the keyword.
     *
     * @return The target type parameter list including its brackets, or an empty string
     */
    String typeParameters(String typeParameters);

    static String joinModifiers(Iterable<String> modifiers) {
        StringBuilder sb = new StringBuilder();
        for (String modifier : modifiers) {
            if (!modifier.isEmpty()) {
                sb.append(modifier).append(' ');
            }
        }
        return sb.toString();
    }
}
