package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.core.tools.CodeCleaner;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.DialectConverter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Ordered rules and token substitutions for one conversion direction.
 * Immutable and shared by all requests for the same language pair.
 */
public final class RuleTable {

    private final Language source;
    private final Language target;
    private final List<RewriteRule> rules;
    private final List<TokenSubstitution> substitutions;
    private final DialectConverter dialect;
    private final String advisory;

    public RuleTable(Language source, Language target, List<RewriteRule> rules, List<TokenSubstitution> substitutions,
                     DialectConverter dialect, String advisory) {
        this.source = source;
        this.target = target;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.substitutions = Collections.unmodifiableList(new ArrayList<>(substitutions));
        this.dialect = dialect;
        this.advisory = advisory;
        checkRules();
    }

    private void checkRules() {
        for (RewriteRule rule : rules) {
            BlockStackOp.Type type = rule.getSideEffect().getType();
            boolean closer = type == BlockStackOp.Type.POP || type == BlockStackOp.Type.POP_ANY;
            if (rule.getTemplate() == null && !closer) {
                throw new TranspileException("Rule without template must close a block", null,
                        source.getDisplayName() + " -> " + target.getDisplayName() + ": " + rule);
            }
        }
    }

    public Language getSource() {
        return source;
    }

    public Language getTarget() {
        return target;
    }

    public List<RewriteRule> getRules() {
        return rules;
    }

    public DialectConverter getDialect() {
        return dialect;
    }

    /**
     * @return Review hint added to every rule-based result of this direction
     */
    public String getAdvisory() {
        return advisory;
    }

    public boolean delimiterStylesDiffer() {
        return source.getDelimiterStyle() != target.getDelimiterStyle();
    }

    /**
     * Applies the token substitutions to the code outside string literals.
     */
    public String substitute(String code) {
        if (substitutions.isEmpty() || code.isEmpty()) {
            return code;
        }
        return CodeCleaner.mapOutsideStrings(code, source, segment -> {
            String result = segment;
            for (TokenSubstitution substitution : substitutions) {
                result = substitution.apply(result);
            }
            return result;
        });
    }

    /**
     * Finds the first rule matching a line.
     *
     * @param code Substituted code line
     * @param nextCode Substituted next code line, null at end of input
     * @param enclosingLabel Label of the innermost open block, null at top level
     * @return The match, or null if no rule applies
     */
    public RuleMatch findRule(String code, String nextCode, String enclosingLabel) {
        for (RewriteRule rule : rules) {
            Matcher matcher = rule.match(code, nextCode, enclosingLabel);
            if (matcher != null) {
                return new RuleMatch(rule, matcher);
            }
        }
        return null;
    }

    /**
     * A rule together with the matcher positioned on the line it matched.
     */
    public static final class RuleMatch {
        private final RewriteRule rule;
        private final Matcher matcher;

        RuleMatch(RewriteRule rule, Matcher matcher) {
            this.rule = rule;
            this.matcher = matcher;
        }

        public RewriteRule getRule() {
            return rule;
        }

        public Matcher getMatcher() {
            return matcher;
        }
    }

    @Override
    public String toString() {
        return "RuleTable{" + source + " -> " + target + ", rules=" + rules.size() + "}";
    }
}
