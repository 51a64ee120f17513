package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.core.model.Language;

/**
 * Supplies the rule table of one conversion direction.
 */
public interface RuleTableProvider {

    Language getSource();

    Language getTarget();

    RuleTable createTable();
}
