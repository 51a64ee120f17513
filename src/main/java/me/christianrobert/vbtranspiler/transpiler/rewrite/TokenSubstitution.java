package me.christianrobert.vbtranspiler.transpiler.rewrite;

import java.util.regex.Pattern;

/**
 * Token level replacement applied to the code part of a line before rules are matched.
 * Never applied inside string literals and never touches the block stack.
 */
public final class TokenSubstitution {

    private final Pattern pattern;
    private final String replacement;

    private TokenSubstitution(Pattern pattern, String replacement) {
        this.pattern = pattern;
        this.replacement = replacement;
    }

    /**
     * Case-insensitive substitution. The replacement may use {@code $n} group references.
     */
    public static TokenSubstitution of(String regex, String replacement) {
        return new TokenSubstitution(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    /**
     * Case-sensitive substitution, for C# sources where case carries meaning.
     */
    public static TokenSubstitution exact(String regex, String replacement) {
        return new TokenSubstitution(Pattern.compile(regex), replacement);
    }

    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return pattern.pattern() + " -> " + replacement;
    }
}
