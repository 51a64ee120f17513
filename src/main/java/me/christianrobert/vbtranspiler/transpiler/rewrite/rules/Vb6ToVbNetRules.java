package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTableProvider;
import me.christianrobert.vbtranspiler.transpiler.rewrite.TokenSubstitution;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.Vb6ToVbNetDialect;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;

/**
 * VB6 to VB.NET.
 *
 * <p>Most VB6 statements are valid VB.NET and are copied. Declarations are rewritten for the
 * changed type widths and the ByRef default, {@code Type} becomes {@code Structure}, {@code Wend}
 * becomes {@code End While}, and {@code Set}/{@code Let} assignments lose their keyword. Property
 * procedures are copied unchanged; {@code GoSub}, {@code Return} and the {@code DefType}
 * statements have no rule.</p>
 */
@ApplicationScoped
public class Vb6ToVbNetRules implements RuleTableProvider {

    static final String ADVISORY = "Manual review recommended: Some VB6 features may not be directly compatible with VB.NET";

    private static final String MODS = "((?:(?:Public|Private|Friend|Static|Global)\\s+)*)";
    private static final String PARAMS = "(?:\\(((?:[^()]|\\([^()]*\\))*)\\))?";

    @Override
    public Language getSource() {
        return Language.VB6;
    }

    @Override
    public Language getTarget() {
        return Language.VBNET;
    }

    @Override
    public RuleTable createTable() {
        return new RuleTable(Language.VB6, Language.VBNET, rules(), substitutions(), new Vb6ToVbNetDialect(), ADVISORY);
    }

    private static List<TokenSubstitution> substitutions() {
        List<TokenSubstitution> substitutions = new ArrayList<>();
        substitutions.add(TokenSubstitution.of("^Global\\b", "Public"));
        return substitutions;
    }

    private static List<RewriteRule> rules() {
        List<RewriteRule> rules = new ArrayList<>();

        // ========== File level ==========
        rules.add(rule("^(?:VERSION|Attribute|BEGIN|Begin)\\b.*$", "' {0}"));
        rules.add(rule("^Option\\s+Explicit$", "Option Explicit On"));
        rules.add(rule("^Option\\s+(?:Base|Private)\\b.*$", "' {0}"));

        // ========== User defined types ==========
        rules.add(rule("^" + MODS + "Type\\s+(\\w+)$", "{mod:1}Structure {2}").push(BlockKind.CLASS, "Structure").named(2));
        rules.add(rule("^(\\w+)(\\(.*\\))?\\s+As\\s+(\\w+)(?:\\s*\\*\\s*\\d+)?$", "Public {1}{2} As {type:3}")
                .within("Structure"));
        rules.add(rule("^End\\s+Type$", "End Structure").pop(BlockKind.CLASS));

        // ========== Procedures ==========
        rules.add(rule("^" + MODS + "Property\\s+(?:Get|Let|Set)\\s+(\\w+).*$", "{0}").push(BlockKind.METHOD, "Property").named(2));
        rules.add(rule("^" + MODS + "Function\\s+(\\w+)\\s*" + PARAMS + "(?:\\s+As\\s+(\\w+(?:\\(\\))?))?$",
                "{mod:1}Function {2}({params:3}){as:4}").push(BlockKind.METHOD, "Function").named(2));
        rules.add(rule("^" + MODS + "Sub\\s+(\\w+)\\s*" + PARAMS + "$", "{mod:1}Sub {2}({params:3})")
                .push(BlockKind.METHOD, "Sub").named(2));
        rules.add(rule("^End\\s+(?:Sub|Function|Property)$", "{0}").pop(BlockKind.METHOD));

        // ========== Blocks ==========
        rules.add(rule("^While\\s+(.+)$", "While {1}").push(BlockKind.LOOP, "While"));
        rules.add(rule("^Wend$", "End While").pop(BlockKind.LOOP));
        rules.addAll(VbStructureRules.identityBlocks());

        // ========== Declarations ==========
        String variable = "^(Dim|Private|Public|Static)\\s+(\\w+)(\\(.*?\\))?";
        rules.add(rule(variable + "\\s+As\\s+New\\s+([\\w.]+)$", "{1} {2}{3} As New {type:4}()"));
        rules.add(rule(variable + "\\s+As\\s+([\\w.]+)(?:\\s*\\*\\s*\\d+)?$", "{1} {2}{3} As {type:4}"));
        rules.add(rule(variable + "$", "{1} {2}{3} As Object"));
        rules.add(rule("^((?:(?:Public|Private)\\s+)?)Const\\s+(\\w+)\\s+As\\s+(\\w+)\\s*=\\s*(.+)$",
                "{1}Const {2} As {type:3} = {4}"));

        // ========== Statements ==========
        rules.add(rule("^(?:Set|Let)\\s+(\\w[\\w.()]*)\\s*=\\s*(.+)$", "{1} = {2}"));
        rules.add(rule("^Debug\\.Print\\s+(.+)$", "Debug.WriteLine({1})"));
        rules.add(rule("^Debug\\.Print$", "Debug.WriteLine(\"\")"));
        rules.add(rule("^Call\\s+(\\w[\\w.]*)$", "{1}()"));
        rules.add(rule("^Call\\s+(.+)$", "{1}"));
        rules.add(rule("^(?!(?:GoSub|Return|LSet|RSet|Def(?:Int|Lng|Sng|Dbl|Cur|Str|Bool|Byte|Date|Obj|Var))\\b)(.+)$", "{0}"));
        return rules;
    }
}
