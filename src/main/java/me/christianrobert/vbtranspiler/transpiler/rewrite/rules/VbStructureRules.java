package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;

/**
 * Block statements VB6 and VB.NET spell the same way. They are copied unchanged but still
 * tracked, so both VB directions report unbalanced input like the C# directions do.
 */
final class VbStructureRules {

    private VbStructureRules() {
    }

    static List<RewriteRule> identityBlocks() {
        List<RewriteRule> rules = new ArrayList<>();
        rules.add(rule("^If\\s+.+\\s+Then$", "{0}").push(BlockKind.CONDITIONAL, "If"));
        rules.add(rule("^Select\\s+Case\\s+.+$", "{0}").push(BlockKind.CONDITIONAL, "Select"));
        rules.add(rule("^(?:ElseIf\\s+.+\\s+Then|Else|Case\\s+.+)$", "{0}").reopen(BlockKind.CONDITIONAL));
        rules.add(rule("^End\\s+(?:If|Select)$", "{0}").pop(BlockKind.CONDITIONAL));
        rules.add(rule("^For\\s+.+$", "{0}").push(BlockKind.LOOP, "For"));
        rules.add(rule("^Next(?:\\s+.*)?$", "{0}").pop(BlockKind.LOOP));
        rules.add(rule("^Do(?:\\s+(?:While|Until)\\s+.+)?$", "{0}").push(BlockKind.LOOP, "Do"));
        rules.add(rule("^Loop(?:\\s+(?:While|Until)\\s+.+)?$", "{0}").pop(BlockKind.LOOP));
        rules.add(rule("^With\\s+.+$", "{0}").push(BlockKind.OTHER, "With"));
        rules.add(rule("^End\\s+With$", "{0}").pop(BlockKind.OTHER));
        rules.add(rule("^(?:(?:Public|Private|Friend)\\s+)?Enum\\s+\\w+.*$", "{0}").push(BlockKind.OTHER, "Enum"));
        rules.add(rule("^End\\s+Enum$", "{0}").pop(BlockKind.OTHER));
        return rules;
    }
}
