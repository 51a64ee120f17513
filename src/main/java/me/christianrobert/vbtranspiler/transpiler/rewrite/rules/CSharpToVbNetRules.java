package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTableProvider;
import me.christianrobert.vbtranspiler.transpiler.rewrite.TokenSubstitution;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.CSharpToVbDialect;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;

/**
 * C# to VB.NET.
 *
 * <p>The line normalizer has already moved opening braces onto their header line and merged
 * {@code }} with a following {@code else}, {@code catch}, {@code finally} or {@code while}, so block
 * headers end with {@code {} and continuations start with {@code }}. A bare brace opens an
 * anonymous block whose closer produces no output. Any other header no rule converts opens such a
 * block too, so its braces stay balanced, but the line is reported as unmatched.</p>
 */
@ApplicationScoped
public class CSharpToVbNetRules implements RuleTableProvider {

    static final String ADVISORY = "Converted C# to VB.NET. Review semicolons and brackets.";

    private static final String MODIFIER_WORDS = "(?:public|private|protected|internal|static|abstract|sealed|partial"
            + "|virtual|override|readonly|async|extern|unsafe|volatile|new)\\s+";
    private static final String MODS = "((?:" + MODIFIER_WORDS + ")*)";
    private static final String REQUIRED_MODS = "((?:" + MODIFIER_WORDS + ")+)";
    private static final String NOT_A_TYPE = "(?!(?:return|throw|await|new|else|goto|yield|case|using|var|lock|delete)\\b)";
    private static final String TYPE = NOT_A_TYPE + "[\\w.]+(?:<.+?>)?(?:\\[\\])*\\??";
    private static final String ACCESSOR = "^(?:(?:public|private|protected|internal)\\s+)?(?:get|set|init)\\b.*$";
    private static final String TYPE_PARAMS = "(?:<([^>]+)>)?";

    @Override
    public Language getSource() {
        return Language.CSHARP;
    }

    @Override
    public Language getTarget() {
        return Language.VBNET;
    }

    @Override
    public RuleTable createTable() {
        return new RuleTable(Language.CSHARP, Language.VBNET, rules(), substitutions(), new CSharpToVbDialect(), ADVISORY);
    }

    private static List<TokenSubstitution> substitutions() {
        List<TokenSubstitution> substitutions = new ArrayList<>();
        substitutions.add(TokenSubstitution.exact("&&", "AndAlso"));
        substitutions.add(TokenSubstitution.exact("\\|\\|", "OrElse"));
        substitutions.add(TokenSubstitution.exact("==\\s*null\\b", "Is Nothing"));
        substitutions.add(TokenSubstitution.exact("!=\\s*null\\b", "IsNot Nothing"));
        substitutions.add(TokenSubstitution.exact("!=", "<>"));
        substitutions.add(TokenSubstitution.exact("==", "="));
        substitutions.add(TokenSubstitution.exact("!(?!=)", "Not "));
        substitutions.add(TokenSubstitution.exact("\\bnull\\b", "Nothing"));
        substitutions.add(TokenSubstitution.exact("\\btrue\\b", "True"));
        substitutions.add(TokenSubstitution.exact("\\bfalse\\b", "False"));
        substitutions.add(TokenSubstitution.exact("\\bthis\\b", "Me"));
        substitutions.add(TokenSubstitution.exact("\\bbase\\.", "MyBase."));
        substitutions.add(TokenSubstitution.exact("\\bnew\\s+(?=[\\w.]+\\s*[(<\\[{])", "New "));
        substitutions.add(TokenSubstitution.exact("\\s%\\s", " Mod "));
        substitutions.add(TokenSubstitution.exact("\\bawait\\b", "Await"));
        return substitutions;
    }

    private static List<RewriteRule> rules() {
        List<RewriteRule> rules = new ArrayList<>();

        // ========== File level ==========
        rules.add(rule("^using\\s+(\\w+)\\s*=\\s*([\\w.]+)\\s*;$", "Imports {1} = {2}"));
        rules.add(rule("^using\\s+(?:static\\s+)?([\\w.]+)\\s*;$", "Imports {1}"));
        rules.add(rule("^namespace\\s+([\\w.]+)\\s*\\{$", "Namespace {1}").push(BlockKind.OTHER, "Namespace"));
        rules.add(rule("^#region\\s*(.*)$", "#Region \"{1}\""));
        rules.add(rule("^#endregion.*$", "#End Region"));
        rules.add(rule("^\\[(.+)\\]$", "<{1}>"));

        // ========== Block continuations and closers ==========
        rules.add(rule("^}\\s*else\\s+if\\s*\\((.+)\\)\\s*\\{$", "ElseIf {cond:1} Then").reopen(BlockKind.CONDITIONAL));
        rules.add(rule("^}\\s*else\\s*\\{$", "Else").reopen(BlockKind.CONDITIONAL));
        rules.add(rule("^}\\s*catch\\s*\\(\\s*(" + TYPE + ")\\s+(\\w+)\\s*\\)\\s*\\{$", "Catch {2} As {type:1}")
                .reopen(BlockKind.OTHER));
        rules.add(rule("^}\\s*catch\\s*\\(\\s*(" + TYPE + ")\\s*\\)\\s*\\{$", "Catch ex As {type:1}").reopen(BlockKind.OTHER));
        rules.add(rule("^}\\s*catch\\s*\\{$", "Catch").reopen(BlockKind.OTHER));
        rules.add(rule("^}\\s*finally\\s*\\{$", "Finally").reopen(BlockKind.OTHER));
        rules.add(rule("^}\\s*while\\s*\\((.+)\\)\\s*;$", "Loop While {cond:1}").pop(BlockKind.LOOP));
        rules.add(rule("^};?$", null).popAny());

        // ========== Conditionals ==========
        rules.add(rule("^if\\s*\\((.+)\\)\\s*\\{$", "If {cond:1} Then").push(BlockKind.CONDITIONAL, "If"));
        rules.add(rule("^if\\s*\\((.+?)\\)\\s*(\\w.*;)$", "If {cond:1} Then {line:2}"));
        rules.add(rule("^switch\\s*\\((.+)\\)\\s*\\{$", "Select Case {1}").push(BlockKind.CONDITIONAL, "Select"));
        rules.add(rule("^case\\s+(.+?)\\s*:$", "Case {1}").within("Select"));
        rules.add(rule("^default\\s*:$", "Case Else").within("Select"));
        rules.add(rule("^break\\s*;$", "").within("Select"));

        // ========== Loops ==========
        String counted = "^for\\s*\\(\\s*(?:int|var|long)\\s+(\\w+)\\s*=\\s*(.+?)\\s*;\\s*\\1\\s*";
        rules.add(rule(counted + "<\\s*(.+?)\\s*;\\s*\\1\\s*\\+\\+\\s*\\)\\s*\\{$", "For {1} As Integer = {2} To {3} - 1")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(counted + "<=\\s*(.+?)\\s*;\\s*\\1\\s*\\+\\+\\s*\\)\\s*\\{$", "For {1} As Integer = {2} To {3}")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(counted + ">=\\s*(.+?)\\s*;\\s*\\1\\s*--\\s*\\)\\s*\\{$", "For {1} As Integer = {2} To {3} Step -1")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule(counted + ">\\s*(.+?)\\s*;\\s*\\1\\s*--\\s*\\)\\s*\\{$", "For {1} As Integer = {2} To {3} + 1 Step -1")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule("^foreach\\s*\\(\\s*var\\s+(\\w+)\\s+in\\s+(.+)\\)\\s*\\{$", "For Each {1} In {2}")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule("^foreach\\s*\\(\\s*(" + TYPE + ")\\s+(\\w+)\\s+in\\s+(.+)\\)\\s*\\{$", "For Each {2} As {type:1} In {3}")
                .push(BlockKind.LOOP, "For"));
        rules.add(rule("^while\\s*\\((.+)\\)\\s*\\{$", "While {cond:1}").push(BlockKind.LOOP, "While"));
        rules.add(rule("^do\\s*\\{$", "Do").push(BlockKind.LOOP, "Do"));
        rules.add(rule("^break\\s*;$", "Exit {loop}"));
        rules.add(rule("^continue\\s*;$", "Continue {loop}"));

        // ========== Exceptions and resources ==========
        rules.add(rule("^try\\s*\\{$", "Try").push(BlockKind.OTHER, "Try"));
        rules.add(rule("^using\\s*\\(\\s*(?:var|" + TYPE + ")\\s+(\\w+)\\s*=\\s*(.+)\\)\\s*\\{$", "Using {1} = {2}")
                .push(BlockKind.OTHER, "Using"));
        rules.add(rule("^lock\\s*\\((.+)\\)\\s*\\{$", "SyncLock {1}").push(BlockKind.OTHER, "SyncLock"));
        rules.add(rule("^throw\\s*;$", "Throw"));
        rules.add(rule("^throw\\s+(.+);$", "Throw {1}"));
        rules.add(rule("^return\\s*;$", "Return"));
        rules.add(rule("^return\\s+(.+);$", "Return {1}"));
        rules.add(rule("^yield\\s+return\\s+(.+);$", "Yield {1}"));
        rules.add(rule("^Await\\s+(.+);$", "Await {1}"));

        // ========== Types ==========
        rules.add(rule("^(public|internal|private)?\\s*static\\s+class\\s+(\\w+)\\s*\\{$", "{tmod:1}Module {2}")
                .push(BlockKind.CLASS, "Module").named(2));
        String classHeader = "^" + MODS + "class\\s+((\\w+)(?:<[^>]+>)?)";
        rules.add(rule(classHeader + "\\s*:\\s*(" + TYPE + ")\\s*\\{$", "{tmod:1}Class {type:2} : Inherits {type:4}")
                .push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule(classHeader + "\\s*:\\s*(.+?)\\s*\\{$", "{tmod:1}Class {type:2} : Inherits {4}")
                .push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule(classHeader + "\\s*\\{$", "{tmod:1}Class {type:2}").push(BlockKind.CLASS, "Class").named(3));
        rules.add(rule("^" + MODS + "struct\\s+(\\w+)\\s*:\\s*(.+?)\\s*\\{$", "{tmod:1}Structure {2} : Implements {3}")
                .push(BlockKind.CLASS, "Structure").named(2));
        rules.add(rule("^" + MODS + "struct\\s+(\\w+)\\s*\\{$", "{tmod:1}Structure {2}")
                .push(BlockKind.CLASS, "Structure").named(2));
        rules.add(rule("^" + MODS + "interface\\s+(\\w+)\\s*:\\s*(.+?)\\s*\\{$", "{tmod:1}Interface {2} : Inherits {3}")
                .push(BlockKind.CLASS, "Interface").named(2));
        rules.add(rule("^" + MODS + "interface\\s+(\\w+)\\s*\\{$", "{tmod:1}Interface {2}")
                .push(BlockKind.CLASS, "Interface").named(2));
        rules.add(rule("^" + MODS + "enum\\s+(\\w+)\\s*:\\s*(\\w+)\\s*\\{$", "{tmod:1}Enum {2} As {type:3}")
                .push(BlockKind.OTHER, "Enum"));
        rules.add(rule("^" + MODS + "enum\\s+(\\w+)\\s*\\{$", "{tmod:1}Enum {2}").push(BlockKind.OTHER, "Enum"));
        rules.add(rule("^(\\w+)\\s*=\\s*(.+?)\\s*,?$", "{1} = {2}").within("Enum"));
        rules.add(rule("^(\\w+)\\s*,?$", "{1}").within("Enum"));

        // ========== Interface members ==========
        rules.add(rule("^(" + TYPE + ")\\s+(\\w+)\\s*\\{\\s*get;\\s*}$", "ReadOnly Property {2} As {type:1}")
                .within("Interface"));
        rules.add(rule("^(" + TYPE + ")\\s+(\\w+)\\s*\\{\\s*get;\\s*set;\\s*}$", "Property {2} As {type:1}")
                .within("Interface"));
        rules.add(rule("^void\\s+(\\w+)" + TYPE_PARAMS + "\\s*\\((.*)\\)\\s*;$", "Sub {1}{tparams:2}({params:3})")
                .within("Interface"));
        rules.add(rule("^(" + TYPE + ")\\s+(\\w+)" + TYPE_PARAMS + "\\s*\\((.*)\\)\\s*;$",
                "Function {2}{tparams:3}({params:4}) As {type:1}").within("Interface"));

        // ========== Constructors ==========
        String constructor = "^((?:(?:public|private|protected|internal|static)\\s+)+)(\\w+)\\s*\\((.*?)\\)\\s*";
        rules.add(rule(constructor + ":\\s*base\\s*\\((.*)\\)\\s*\\{$", "{mod:1}Sub New({params:3})\n    MyBase.New({4})")
                .push(BlockKind.METHOD, "Sub"));
        rules.add(rule(constructor + ":\\s*Me\\s*\\((.*)\\)\\s*\\{$", "{mod:1}Sub New({params:3})\n    Me.New({4})")
                .push(BlockKind.METHOD, "Sub"));
        rules.add(rule(constructor + "\\{$", "{mod:1}Sub New({params:3})").push(BlockKind.METHOD, "Sub"));

        // ========== Properties ==========
        String property = "^" + MODS + "(" + TYPE + ")\\s+(\\w+)\\s*";
        rules.add(rule(property + "\\{\\s*get;\\s*(?:(?:private|protected|internal)\\s+)?set;\\s*}\\s*=\\s*(.+);$",
                "{mod:1}Property {3} As {type:2} = {4}"));
        rules.add(rule(property + "\\{\\s*get;\\s*(?:(?:private|protected|internal)\\s+)?set;\\s*}$",
                "{mod:1}Property {3} As {type:2}"));
        rules.add(rule(property + "\\{\\s*get;\\s*}(?:\\s*=\\s*(.+);)?$", "{mod:1}ReadOnly Property {3} As {type:2}"));
        rules.add(rule(property + "\\{$", "{mod:1}Property {3} As {type:2}").followedBy(ACCESSOR)
                .push(BlockKind.METHOD, "Property").named(3));
        rules.add(rule(property + "=>\\s*(.+);$",
                "{mod:1}ReadOnly Property {3} As {type:2}\n    Get\n        Return {4}\n    End Get\nEnd Property"));
        rules.add(rule("^(?:(public|private|protected|internal)\\s+)?get\\s*\\{$", "{mod:1}Get")
                .within("Property").push(BlockKind.METHOD, "Get"));
        rules.add(rule("^(?:(public|private|protected|internal)\\s+)?set\\s*\\{$", "{mod:1}Set")
                .within("Property").push(BlockKind.METHOD, "Set"));
        rules.add(rule("^get\\s*(?:\\{\\s*return\\s+(.+?);\\s*}|=>\\s*(.+?);)$", "Get\n    Return {1}{2}\nEnd Get")
                .within("Property"));
        rules.add(rule("^set\\s*(?:\\{\\s*(.+?;)\\s*}|=>\\s*(.+?;))$", "Set\n    {line:1}{line:2}\nEnd Set")
                .within("Property"));

        // ========== Methods ==========
        String sub = "^" + MODS + "void\\s+(\\w+)" + TYPE_PARAMS + "\\s*\\((.*)\\)\\s*";
        String function = "^" + MODS + "(" + TYPE + ")\\s+(\\w+)" + TYPE_PARAMS + "\\s*\\((.*)\\)\\s*";
        rules.add(rule(sub + "\\{$", "{mod:1}Sub {2}{tparams:3}({params:4})").push(BlockKind.METHOD, "Sub").named(2));
        rules.add(rule(function + "\\{$", "{mod:1}Function {3}{tparams:4}({params:5}) As {type:2}")
                .push(BlockKind.METHOD, "Function").named(3));
        rules.add(rule(sub + "=>\\s*(.+;)$", "{mod:1}Sub {2}{tparams:3}({params:4})\n    {line:5}\nEnd Sub"));
        rules.add(rule(function + "=>\\s*(.+);$",
                "{mod:1}Function {3}{tparams:4}({params:5}) As {type:2}\n    Return {6}\nEnd Function"));
        rules.add(rule(sub + ";$", "{mod:1}Sub {2}{tparams:3}({params:4})"));
        rules.add(rule(function + ";$", "{mod:1}Function {3}{tparams:4}({params:5}) As {type:2}"));

        // ========== Fields and locals ==========
        rules.add(rule("^" + MODS + "const\\s+(" + TYPE + ")\\s+(\\w+)\\s*=\\s*(.+);$", "{mod:1}Const {3} As {type:2} = {4}"));
        rules.add(rule("^const\\s+(" + TYPE + ")\\s+(\\w+)\\s*=\\s*(.+);$", "Const {2} As {type:1} = {3}"));
        String field = "^" + REQUIRED_MODS + "(" + TYPE + ")\\s+(\\w+)\\s*";
        rules.add(rule(field + "=\\s*New\\s+(" + TYPE + ")\\s*\\((.*)\\);$", "{mod:1}{3} As New {type:4}({5})"));
        rules.add(rule(field + "=\\s*(.+);$", "{mod:1}{3} As {type:2} = {4}"));
        rules.add(rule(field + ";$", "{mod:1}{3} As {type:2}"));
        rules.add(rule("^(?:var|" + TYPE + ")\\s+(\\w+)\\s*=\\s*New\\s+(" + TYPE + ")\\s*\\((.*)\\);$", "Dim {1} As New {type:2}({3})"));
        rules.add(rule("^var\\s+(\\w+)\\s*=\\s*(.+);$", "Dim {1} = {2}"));
        rules.add(rule("^(" + TYPE + ")\\s+(\\w+)\\s*=\\s*(.+);$", "Dim {2} As {type:1} = {3}"));
        rules.add(rule("^(" + TYPE + ")\\s+(\\w+)\\s*;$", "Dim {2} As {type:1}"));

        // ========== Statements ==========
        rules.add(rule("^(\\w[\\w.]*)\\s*\\+\\+\\s*;$", "{1} += 1"));
        rules.add(rule("^\\+\\+\\s*(\\w[\\w.]*)\\s*;$", "{1} += 1"));
        rules.add(rule("^(\\w[\\w.]*)\\s*--\\s*;$", "{1} -= 1"));
        rules.add(rule("^--\\s*(\\w[\\w.]*)\\s*;$", "{1} -= 1"));
        rules.add(rule("^([\\w.\\[\\]]+)\\s*([+\\-*/]?=)\\s*(.+);$", "{1} {2} {3}"));
        rules.add(rule("^(.+);$", "{1}"));
        rules.add(rule("^\\{$", "").push(BlockKind.OTHER, null));
        rules.add(rule("^(.+?)\\s*\\{$", "{1}").push(BlockKind.OTHER, null).unconverted());
        return rules;
    }
}
