package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTableProvider;
import me.christianrobert.vbtranspiler.transpiler.rewrite.TokenSubstitution;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.VbToCSharpDialect;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.closer;
import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;

/**
 * VB.NET to C#.
 *
 * <p>Rules see the line after token substitution, so operators and literals are already in C#
 * form ({@code AndAlso} is {@code &&}, {@code Nothing} is {@code null}, {@code New} is {@code new}).
 * Select Case and With blocks have no rule and are passed through with a warning.</p>
 */
@ApplicationScoped
public class VbNetToCSharpRules implements RuleTableProvider {

    static final String ADVISORY = "Converted VB.NET to C#. Review Option Strict and type conversions.";

    private static final String MODIFIER_WORDS = "(?:Public|Private|Protected|Friend|Shared|Static|Overrides|Overridable"
            + "|MustOverride|NotOverridable|MustInherit|NotInheritable|Overloads|Shadows|Partial|ReadOnly|WriteOnly"
            + "|Async|Default|Iterator)\\s+";
    private static final String MODS = "((?:" + MODIFIER_WORDS + ")*)";
    private static final String REQUIRED_MODS = "((?:" + MODIFIER_WORDS + ")+)";
    private static final String TYPE = "[\\w.]+(?:\\(Of\\s+[^)]+\\))?";
    private static final String PARAMS = "\\(((?:[^()]|\\([^()]*\\))*)\\)";
    private static final String TYPE_PARAMS = "(?:\\(Of\\s+([^)]+)\\)\\s*)?";
    private static final String ACCESSOR = "^(?:(?:Public|Private|Protected|Friend)\\s+)*(?:Get|Set)\\b.*$";

    @Override
    public Language getSource() {
        return Language.VBNET;
    }

    @Override
    public Language getTarget() {
        return Language.CSHARP;
    }

    @Override
    public RuleTable createTable() {
        return new RuleTable(Language.VBNET, Language.CSHARP, rules(), substitutions(), new VbToCSharpDialect(), ADVISORY);
    }

    private static List<TokenSubstitution> substitutions() {
        List<TokenSubstitution> substitutions = new ArrayList<>();
        substitutions.add(TokenSubstitution.of("\\bIsNot\\s+Nothing\\b", "!= null"));
        substitutions.add(TokenSubstitution.of("\\bIs\\s+Nothing\\b", "== null"));
        substitutions.add(TokenSubstitution.of("\\bIsNot\\b", "!="));
        substitutions.add(TokenSubstitution.of("\\bIs\\b", "=="));
        substitutions.add(TokenSubstitution.of("\\bTypeOf\\s+(.+?)\\s+==\\s+", "$1 is "));
        substitutions.add(TokenSubstitution.of("\\s&=\\s*", " += "));
        substitutions.add(TokenSubstitution.of("\\s&\\s", " + "));
        substitutions.add(TokenSubstitution.of("\\bAndAlso\\b", "&&"));
        substitutions.add(TokenSubstitution.of("\\bOrElse\\b", "||"));
        substitutions.add(TokenSubstitution.of("\\bAnd\\b", "&"));
        substitutions.add(TokenSubstitution.of("\\bOr\\b", "|"));
        substitutions.add(TokenSubstitution.of("\\bXor\\b", "^"));
        substitutions.add(TokenSubstitution.of("\\bNot\\b\\s*", "!"));
        substitutions.add(TokenSubstitution.of("<>", "!="));
        substitutions.add(TokenSubstitution.of("\\bMod\\b", "%"));
        substitutions.add(TokenSubstitution.of("\\bNothing\\b", "null"));
        substitutions.add(TokenSubstitution.of("\\bTrue\\b", "true"));
        substitutions.add(TokenSubstitution.of("\\bFalse\\b", "false"));
        substitutions.add(TokenSubstitution.of("\\bMe\\b", "this"));
        substitutions.add(TokenSubstitution.of("\\bMyBase\\b", "base"));
        substitutions.add(TokenSubstitution.of("\\bNew\\b", "new"));
        substitutions.add(TokenSubstitution.of("\\bAwait\\b", "await"));
        return substitutions;
    }

    private static List<RewriteRule> rules() {
        List<RewriteRule> rules = new ArrayList<>();

        // ========== File level ==========
        rules.add(rule("^Option\\s+.+$", "// {0}"));
        rules.add(rule("^Imports\\s+(\\w+)\\s*=\\s*([\\w.]+)$", "using {1} = {2};"));
        rules.add(rule("^Imports\\s+([\\w.]+)$", "using {1};"));
        rules.add(rule("^Namespace\\s+([\\w.]+)$", "namespace {1}").push(BlockKind.OTHER, "Namespace"));
        rules.add(rule("^(?:Inherits|Implements)\\s+.+$", "// {0}"));

        // ========== Types ==========
        String classHeader = "^" + MODS + "Class\\s+((\\w+)(?:\\(Of\\s+[^)]+\\))?)";
        rules.add(rule(classHeader + "\\s+Inherits\\s+(" + TYPE + ")\\s+Implements\\s+(.+)$",
                "{tmod:1}class {type:2} : {type:4}, {5}").push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule(classHeader + "\\s+Inherits\\s+(" + TYPE + ")$",
                "{tmod:1}class {type:2} : {type:4}").push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule(classHeader + "\\s+Implements\\s+(.+)$",
                "{tmod:1}class {type:2} : {4}").push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule(classHeader + "$", "{tmod:1}class {type:2}").push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule("^" + MODS + "Module\\s+(\\w+)$", "{tmod:1}static class {2}")
                .push(BlockKind.CLASS, "Module").named(2));
        rules.add(rule("^" + MODS + "Structure\\s+(\\w+)\\s+Implements\\s+(.+)$", "{tmod:1}struct {2} : {3}")
                .push(BlockKind.CLASS, "Structure").named(2));
        rules.add(rule("^" + MODS + "Structure\\s+(\\w+)$", "{tmod:1}struct {2}")
                .push(BlockKind.CLASS, "Structure").named(2));
        rules.add(rule("^" + MODS + "Interface\\s+(\\w+)\\s+Inherits\\s+(.+)$", "{tmod:1}interface {2} : {3}")
                .push(BlockKind.CLASS, "Interface").named(2));
        rules.add(rule("^" + MODS + "Interface\\s+(\\w+)$", "{tmod:1}interface {2}")
                .push(BlockKind.CLASS, "Interface").named(2));
        rules.add(rule("^" + MODS + "Enum\\s+(\\w+)\\s+As\\s+(\\w+)$", "{tmod:1}enum {2} : {type:3}")
                .push(BlockKind.OTHER, "Enum"));
        rules.add(rule("^" + MODS + "Enum\\s+(\\w+)$", "{tmod:1}enum {2}").push(BlockKind.OTHER, "Enum"));
        rules.add(rule("^(\\w+)\\s*=\\s*(.+)$", "{1} = {2},").within("Enum"));
        rules.add(rule("^(\\w+)$", "{1},").within("Enum"));

        // ========== Interface and abstract members ==========
        rules.add(rule("^" + MODS + "Function\\s+(\\w+)\\s*" + TYPE_PARAMS + "(?:" + PARAMS + ")?(?:\\s+As\\s+(.+?))?$",
                "{type:5} {2}{tparams:3}({params:4});").within("Interface"));
        rules.add(rule("^" + MODS + "Sub\\s+(\\w+)\\s*" + TYPE_PARAMS + "(?:" + PARAMS + ")?$",
                "void {2}{tparams:3}({params:4});").within("Interface"));
        rules.add(rule("^((?:\\w+\\s+)*?)ReadOnly\\s+((?:\\w+\\s+)*)Property\\s+(\\w+)(?:\\(\\))?(?:\\s+As\\s+(.+))?$",
                "{type:4} {3} { get; }").within("Interface"));
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)(?:\\(\\))?(?:\\s+As\\s+(.+))?$",
                "{type:3} {2} { get; set; }").within("Interface"));
        String mustOverride = "^((?:\\w+\\s+)*?MustOverride\\s+(?:\\w+\\s+)*)";
        rules.add(rule(mustOverride + "Function\\s+(\\w+)\\s*" + TYPE_PARAMS + "(?:" + PARAMS + ")?(?:\\s+As\\s+(.+?))?$",
                "{mod:1}{type:5} {2}{tparams:3}({params:4});"));
        rules.add(rule(mustOverride + "Sub\\s+(\\w+)\\s*" + TYPE_PARAMS + "(?:" + PARAMS + ")?$",
                "{mod:1}void {2}{tparams:3}({params:4});"));
        rules.add(rule(mustOverride + "Property\\s+(\\w+)(?:\\(\\))?(?:\\s+As\\s+(.+))?$",
                "{pmod:1}{type:3} {2} { get; set; }"));

        // ========== Methods and properties ==========
        rules.add(rule("^" + MODS + "Sub\\s+new\\s*(?:" + PARAMS + ")?$", "{mod:1}{class}({params:2})")
                .push(BlockKind.METHOD, "Sub"));
        rules.add(rule("^" + MODS + "Function\\s+(\\w+)\\s*" + TYPE_PARAMS + "(?:" + PARAMS + ")?(?:\\s+As\\s+(.+?))?"
                        + "(?:\\s+(?:Handles|Implements)\\s+.+)?$",
                "{mod:1}{type:5} {2}{tparams:3}({params:4})").push(BlockKind.METHOD, "Function").named(2));
        rules.add(rule("^" + MODS + "Sub\\s+(\\w+)\\s*" + TYPE_PARAMS + "(?:" + PARAMS + ")?(?:\\s+(?:Handles|Implements)\\s+.+)?$",
                "{mod:1}void {2}{tparams:3}({params:4})").push(BlockKind.METHOD, "Sub").named(2));
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)\\s*(?:" + PARAMS + ")?(?:\\s+As\\s+(.+?))?$",
                "{pmod:1}{type:4} {2}").followedBy(ACCESSOR).push(BlockKind.METHOD, "Property").named(2));
        String readOnlyProperty = "^((?:\\w+\\s+)*?ReadOnly\\s+(?:\\w+\\s+)*)Property\\s+(\\w+)(?:\\(\\))?\\s+As\\s+(.+?)";
        rules.add(rule(readOnlyProperty + "\\s*=\\s*(.+)$", "{pmod:1}{type:3} {2} { get; } = {4};"));
        rules.add(rule(readOnlyProperty + "$", "{pmod:1}{type:3} {2} { get; }"));
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)(?:\\(\\))?\\s+As\\s+new\\s+(" + TYPE + ")(?:\\((.*)\\))?$",
                "{pmod:1}{type:3} {2} { get; set; } = new {type:3}({4});"));
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)(?:\\(\\))?(?:\\s+As\\s+(.+?))?\\s*=\\s*(.+)$",
                "{pmod:1}{type:3} {2} { get; set; } = {4};"));
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)(?:\\(\\))?(?:\\s+As\\s+(.+))?$",
                "{pmod:1}{type:3} {2} { get; set; }"));
        rules.add(rule("^(?:(Public|Private|Protected|Friend)\\s+)?Get$", "{mod:1}get")
                .within("Property").push(BlockKind.METHOD, "Get"));
        rules.add(rule("^(?:(Public|Private|Protected|Friend)\\s+)?Set(?:\\s*\\(.*\\))?$", "{mod:1}set")
                .within("Property").push(BlockKind.METHOD, "Set"));
        rules.add(rule("^" + REQUIRED_MODS + "Event\\s+(\\w+)\\s+As\\s+(.+)$", "{mod:1}event {type:3} {2};"));

        // ========== Block closers ==========
        rules.add(closer("^End\\s+(?:Sub|Function|Property|Get|Set|Operator)$", BlockKind.METHOD));
        rules.add(closer("^End\\s+(?:Class|Module|Structure|Interface)$", BlockKind.CLASS));
        rules.add(closer("^End\\s+(?:Namespace|Enum|Try|Using|SyncLock)$", BlockKind.OTHER));
        rules.add(closer("^End\\s+If$", BlockKind.CONDITIONAL));
        rules.add(closer("^End\\s+While$", BlockKind.LOOP));
        rules.add(closer("^Next(?:\\s+\\w+)?$", BlockKind.LOOP));
        rules.add(closer("^Loop$", BlockKind.LOOP));
        rules.add(rule("^Loop\\s+While\\s+(.+)$", "} while ({cond:1});").pop(BlockKind.LOOP));
        rules.add(rule("^Loop\\s+Until\\s+(.+)$", "} while (!({cond:1}));").pop(BlockKind.LOOP));

        // ========== Conditionals ==========
        rules.add(rule("^If\\s+(.+?)\\s+Then$", "if ({cond:1})").push(BlockKind.CONDITIONAL, "If"));
        rules.add(rule("^If\\s+(.+?)\\s+Then\\s+(.+?)\\s+Else\\s+(.+)$", "if ({cond:1}) {line:2} else {line:3}"));
        rules.add(rule("^If\\s+(.+?)\\s+Then\\s+(.+)$", "if ({cond:1}) {line:2}"));
        rules.add(rule("^ElseIf\\s+(.+?)\\s+Then$", "} else if ({cond:1}) {").reopen(BlockKind.CONDITIONAL));
        rules.add(rule("^Else$", "} else {").reopen(BlockKind.CONDITIONAL));

        // ========== Loops ==========
        rules.add(rule("^For\\s+Each\\s+(\\w+)\\s+As\\s+(.+?)\\s+In\\s+(.+)$", "foreach ({type:2} {1} in {3})")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule("^For\\s+Each\\s+(\\w+)\\s+In\\s+(.+)$", "foreach (var {1} in {2})").push(BlockKind.LOOP, "For"));
        String typedFor = "^For\\s+(\\w+)\\s+As\\s+(\\w+)\\s*=\\s*(.+?)\\s+To\\s+(.+?)";
        rules.add(rule(typedFor + "\\s+Step\\s+-\\s*(.+)$", "for ({type:2} {1} = {3}; {1} >= {4}; {1} -= {5})")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(typedFor + "\\s+Step\\s+(.+)$", "for ({type:2} {1} = {3}; {1} <= {4}; {1} += {5})")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(typedFor + "$", "for ({type:2} {1} = {3}; {1} <= {4}; {1}++)").push(BlockKind.LOOP, "For"));
        String untypedFor = "^For\\s+(\\w+)\\s*=\\s*(.+?)\\s+To\\s+(.+?)";
        rules.add(rule(untypedFor + "\\s+Step\\s+-\\s*(.+)$", "for ({1} = {2}; {1} >= {3}; {1} -= {4})")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(untypedFor + "\\s+Step\\s+(.+)$", "for ({1} = {2}; {1} <= {3}; {1} += {4})")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(untypedFor + "$", "for ({1} = {2}; {1} <= {3}; {1}++)").push(BlockKind.LOOP, "For"));
        rules.add(rule("^While\\s+(.+)$", "while ({cond:1})").push(BlockKind.LOOP, "While"));
        rules.add(rule("^Do\\s+While\\s+(.+)$", "while ({cond:1})").push(BlockKind.LOOP, "Do"));
        rules.add(rule("^Do\\s+Until\\s+(.+)$", "while (!({cond:1}))").push(BlockKind.LOOP, "Do"));
        rules.add(rule("^Do$", "do").push(BlockKind.LOOP, "Do"));
        rules.add(rule("^Exit\\s+(?:For|Do|While)$", "break;"));
        rules.add(rule("^Continue\\s+(?:For|Do|While)$", "continue;"));

        // ========== Exceptions and resources ==========
        rules.add(rule("^Try$", "try").push(BlockKind.OTHER, "Try"));
        rules.add(rule("^Catch\\s+(\\w+)\\s+As\\s+(.+?)\\s+When\\s+(.+)$", "} catch ({type:2} {1}) when ({cond:3}) {")
                .reopen(BlockKind.OTHER));
        rules.add(rule("^Catch\\s+(\\w+)\\s+As\\s+(.+)$", "} catch ({type:2} {1}) {").reopen(BlockKind.OTHER));
        rules.add(rule("^Catch$", "} catch {").reopen(BlockKind.OTHER));
        rules.add(rule("^Finally$", "} finally {").reopen(BlockKind.OTHER));
        rules.add(rule("^Using\\s+(\\w+)\\s+As\\s+new\\s+(" + TYPE + ")(?:\\((.*)\\))?$",
                "using (var {1} = new {type:2}({3}))").push(BlockKind.OTHER, "Using"));
        rules.add(rule("^Using\\s+(\\w+)(?:\\s+As\\s+(.+?))?\\s*=\\s*(.+)$", "using (var {1} = {3})")
                .push(BlockKind.OTHER, "Using"));
        rules.add(rule("^Using\\s+(.+)$", "using ({1})").push(BlockKind.OTHER, "Using"));
        rules.add(rule("^SyncLock\\s+(.+)$", "lock ({1})").push(BlockKind.OTHER, "SyncLock"));
        rules.add(rule("^Throw\\s+(.+)$", "throw {1};"));
        rules.add(rule("^Throw$", "throw;"));

        // ========== Declarations ==========
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+)\\s+As\\s+new\\s+(" + TYPE + ")(?:\\((.*)\\))?$",
                "var {1} = new {type:2}({3});"));
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+)\\(\\)\\s+As\\s+(.+?)\\s*=\\s*(.+)$", "{type:2}[] {1} = {3};"));
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+)\\((.+)\\)\\s+As\\s+(.+)$", "{type:3}[] {1} = new {type:3}[{2} + 1];"));
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+)\\s+As\\s+(.+?)\\s*=\\s*(.+)$", "{type:2} {1} = {3};"));
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+(?:\\s*,\\s*\\w+)*)\\s+As\\s+(.+)$", "{type:2} {1};"));
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+)\\s*=\\s*(.+)$", "var {1} = {2};"));
        rules.add(rule("^(?:Dim|Static)\\s+(\\w+)$", "object {1};"));
        rules.add(rule("^Const\\s+(\\w+)\\s+As\\s+(.+?)\\s*=\\s*(.+)$", "const {type:2} {1} = {3};"));
        rules.add(rule("^Const\\s+(\\w+)\\s*=\\s*(.+)$", "var {1} = {2};"));
        rules.add(rule("^" + REQUIRED_MODS + "Const\\s+(\\w+)(?:\\s+As\\s+(.+?))?\\s*=\\s*(.+)$",
                "{mod:1}const {type:3} {2} = {4};"));
        String field = "^" + REQUIRED_MODS + "(?:Dim\\s+|WithEvents\\s+)?(\\w+)";
        rules.add(rule(field + "\\s+As\\s+new\\s+(" + TYPE + ")(?:\\((.*)\\))?$", "{mod:1}{type:3} {2} = new {type:3}({4});"));
        rules.add(rule(field + "\\s+As\\s+(.+?)\\s*=\\s*(.+)$", "{mod:1}{type:3} {2} = {4};"));
        rules.add(rule(field + "\\s+As\\s+(.+)$", "{mod:1}{type:3} {2};"));

        // ========== Statements ==========
        rules.add(rule("^Return\\s+(.+)$", "return {1};"));
        rules.add(rule("^(?:Return|Exit\\s+(?:Sub|Function|Property))$", "return;"));
        rules.add(rule("^Call\\s+([\\w.]+)$", "{1}();"));
        rules.add(rule("^Call\\s+(.+)$", "{1};"));
        rules.add(rule("^RaiseEvent\\s+(\\w+)\\s*\\((.*)\\)$", "{1}?.Invoke({2});"));
        rules.add(rule("^RaiseEvent\\s+(\\w+)$", "{1}?.Invoke();"));
        rules.add(rule("^AddHandler\\s+(.+?)\\s*,\\s*AddressOf\\s+(.+)$", "{1} += {2};"));
        rules.add(rule("^RemoveHandler\\s+(.+?)\\s*,\\s*AddressOf\\s+(.+)$", "{1} -= {2};"));
        rules.add(rule("^await\\s+(.+)$", "await {1};"));
        rules.add(rule("^([\\w.]+(?:\\([^()]*\\))?(?:\\.\\w+)*)\\s*([+\\-*/]?=)\\s*(.+)$", "{1} {2} {3};"));
        rules.add(rule("^([\\w.]+\\s*\\(.*\\)[\\w.()]*)$", "{1};"));
        rules.add(rule("^(?!(?:End|Stop|Resume)$)([\\w.]+)$", "{1}();"));
        return rules;
    }
}
