package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of a rule table: a pattern matched against a whole trimmed code line, the template
 * that replaces the line, and the rule's effect on the block stack.
 *
 * <p>Patterns are case-insensitive. A rule may additionally require the next code line to match
 * ({@link #followedBy(String)}) or the innermost open block to carry a label ({@link #within(String)}),
 * and may name the block it opens after a capture group ({@link #named(int)}). A POP rule without
 * template lets the rewriter synthesise the closer.</p>
 *
 * <p>Rules are immutable; the builder-style methods return modified copies.</p>
 */
public final class RewriteRule {

    private final Pattern matchPattern;
    private final String template;
    private final BlockStackOp sideEffect;
    private final Pattern followedBy;
    private final String within;
    private final int nameGroup;
    private final boolean unconverted;

    private RewriteRule(Pattern matchPattern, String template, BlockStackOp sideEffect, Pattern followedBy,
                        String within, int nameGroup, boolean unconverted) {
        this.matchPattern = matchPattern;
        this.template = template;
        this.sideEffect = sideEffect;
        this.followedBy = followedBy;
        this.within = within;
        this.nameGroup = nameGroup;
        this.unconverted = unconverted;
    }

    public static RewriteRule rule(String regex, String template) {
        return new RewriteRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), template, BlockStackOp.none(), null, null,
                0, false);
    }

    /**
     * A closing rule that only consumes the line; the closer is synthesised.
     */
    public static RewriteRule closer(String regex, BlockKind kind) {
        return rule(regex, null).pop(kind);
    }

    public RewriteRule push(BlockKind kind, String label) {
        return withSideEffect(BlockStackOp.push(kind, label));
    }

    public RewriteRule pop(BlockKind kind) {
        return withSideEffect(BlockStackOp.pop(kind));
    }

    public RewriteRule popAny() {
        return withSideEffect(BlockStackOp.popAny());
    }

    public RewriteRule reopen(BlockKind kind) {
        return withSideEffect(BlockStackOp.reopen(kind));
    }

    public RewriteRule named(int group) {
        return new RewriteRule(matchPattern, template, sideEffect, followedBy, within, group, unconverted);
    }

    public RewriteRule followedBy(String regex) {
        return new RewriteRule(matchPattern, template, sideEffect, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                within, nameGroup, unconverted);
    }

    /**
     * Restricts the rule to lines directly inside a block with the given label (enum members, accessors).
     */
    public RewriteRule within(String label) {
        return new RewriteRule(matchPattern, template, sideEffect, followedBy, label, nameGroup, unconverted);
    }

    /**
     * Marks a fallback rule that only tracks the block structure of a line it cannot convert.
     * The line is still reported as unmatched.
     */
    public RewriteRule unconverted() {
        return new RewriteRule(matchPattern, template, sideEffect, followedBy, within, nameGroup, true);
    }

    private RewriteRule withSideEffect(BlockStackOp op) {
        return new RewriteRule(matchPattern, template, op, followedBy, within, nameGroup, unconverted);
    }

    /**
     * Matches a code line, and the next code line and enclosing block if the rule has guards.
     *
     * @param code Trimmed code line after token substitution
     * @param nextCode Next code line, null at end of input
     * @param enclosingLabel Label of the innermost open block, null at top level
     * @return The matcher positioned on the match, or null if the rule does not apply
     */
    public Matcher match(String code, String nextCode, String enclosingLabel) {
        if (within != null && !within.equalsIgnoreCase(enclosingLabel)) {
            return null;
        }
        Matcher matcher = matchPattern.matcher(code);
        if (!matcher.matches()) {
            return null;
        }
        if (followedBy != null && (nextCode == null || !followedBy.matcher(nextCode).matches())) {
            return null;
        }
        return matcher;
    }

    /**
     * @return The replacement template, null for closers whose text is synthesised
     */
    public String getTemplate() {
        return template;
    }

    public BlockStackOp getSideEffect() {
        return sideEffect;
    }

    public int getNameGroup() {
        return nameGroup;
    }

    public boolean isUnconverted() {
        return unconverted;
    }

    @Override
    public String toString() {
        return "RewriteRule{" + matchPattern.pattern() + " -> " + template + ", " + sideEffect + "}";
    }
}
