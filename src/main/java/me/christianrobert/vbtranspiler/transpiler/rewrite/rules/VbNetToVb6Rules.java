package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTableProvider;
import me.christianrobert.vbtranspiler.transpiler.rewrite.TokenSubstitution;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.VbNetToVb6Dialect;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;

/**
 * VB.NET to VB6.
 *
 * <p>Namespaces and class headers survive as comments, modules become a {@code VB_Name}
 * attribute, structures become user defined types and property blocks are split into
 * {@code Property Get} and {@code Property Let} procedures. {@code Return} assigns the function
 * name and exits. Structured exception handling, {@code Using}, {@code SyncLock} and
 * {@code Continue} have no VB6 form and are passed through with a warning.</p>
 */
@ApplicationScoped
public class VbNetToVb6Rules implements RuleTableProvider {

    static final String ADVISORY = "Converted VB.NET to VB6. Review error handling and object assignments (Set).";

    private static final String MODS = "((?:(?:Public|Private|Protected|Friend|Shared|Overrides|Overridable|Overloads"
            + "|NotOverridable|MustInherit|NotInheritable|Partial|ReadOnly|WriteOnly|Shadows)\\s+)*)";
    private static final String PARAMS = "(?:\\(((?:[^()]|\\([^()]*\\))*)\\))?";
    // VB6 has no generics, type parameter lists are dropped
    private static final String TYPE_PARAMS = "(?:\\(Of\\s+[^)]+\\)\\s*)?";
    private static final String ACCESSOR = "^(?:(?:Public|Private|Protected|Friend)\\s+)*(?:Get|Set)\\b.*$";

    @Override
    public Language getSource() {
        return Language.VBNET;
    }

    @Override
    public Language getTarget() {
        return Language.VB6;
    }

    @Override
    public RuleTable createTable() {
        return new RuleTable(Language.VBNET, Language.VB6, rules(), substitutions(), new VbNetToVb6Dialect(), ADVISORY);
    }

    private static List<TokenSubstitution> substitutions() {
        List<TokenSubstitution> substitutions = new ArrayList<>();
        substitutions.add(TokenSubstitution.of("\\bAndAlso\\b", "And"));
        substitutions.add(TokenSubstitution.of("\\bOrElse\\b", "Or"));
        substitutions.add(TokenSubstitution.of("(\\w[\\w.]*)\\s+IsNot\\s+Nothing\\b", "Not $1 Is Nothing"));
        substitutions.add(TokenSubstitution.of("\\bString\\.Empty\\b", "\"\""));
        substitutions.add(TokenSubstitution.of("\\b(?:Console|Debug)\\.WriteLine\\b", "Debug.Print"));
        return substitutions;
    }

    private static List<RewriteRule> rules() {
        List<RewriteRule> rules = new ArrayList<>();

        // ========== File level ==========
        rules.add(rule("^Option\\s+Explicit(?:\\s+On)?$", "Option Explicit"));
        rules.add(rule("^(?:Option|Imports)\\s+.+$", "' {0}"));
        rules.add(rule("^Namespace\\s+.+$", "' {0}").push(BlockKind.OTHER, "Namespace"));
        rules.add(rule("^End\\s+Namespace$", "' {0}").pop(BlockKind.OTHER));

        // ========== Types ==========
        rules.add(rule("^" + MODS + "Class\\s+(\\w+).*$", "' Class {2}").push(BlockKind.CLASS, "Class").named(2));
        rules.add(rule("^End\\s+Class$", "' End Class").pop(BlockKind.CLASS));
        rules.add(rule("^" + MODS + "Module\\s+(\\w+)$", "Attribute VB_Name = \"{2}\"").push(BlockKind.CLASS, "Module").named(2));
        rules.add(rule("^End\\s+Module$", "").pop(BlockKind.CLASS));
        rules.add(rule("^" + MODS + "Structure\\s+(\\w+)$", "{mod:1}Type {2}").push(BlockKind.CLASS, "Structure").named(2));
        rules.add(rule("^(?:Public|Private|Friend|Dim)\\s+(\\w+)(\\(\\))?\\s+As\\s+(.+)$", "{1}{2} As {type:3}")
                .within("Structure"));
        rules.add(rule("^End\\s+Structure$", "End Type").pop(BlockKind.CLASS));

        // ========== Properties ==========
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)\\s*(?:\\(\\))?(?:\\s+As\\s+.+)?$", "").followedBy(ACCESSOR)
                .push(BlockKind.METHOD, "Property").named(2));
        rules.add(rule("^(?:(?:Public|Private|Protected|Friend)\\s+)?Get$", "Public Property Get {method}()")
                .within("Property").push(BlockKind.METHOD, "Get"));
        rules.add(rule("^(?:(?:Public|Private|Protected|Friend)\\s+)?Set\\s*\\(\\s*(?:ByVal\\s+)?(\\w+)\\s+As\\s+(.+?)\\s*\\)$",
                "Public Property Let {method}(ByVal {1} As {type:2})").within("Property").push(BlockKind.METHOD, "Set"));
        rules.add(rule("^(?:(?:Public|Private|Protected|Friend)\\s+)?Set(?:\\s*\\(\\s*\\))?$",
                "Public Property Let {method}(ByVal value As Variant)").within("Property").push(BlockKind.METHOD, "Set"));
        rules.add(rule("^End\\s+(?:Get|Set)$", "End Property").pop(BlockKind.METHOD));
        rules.add(rule("^End\\s+Property$", "").pop(BlockKind.METHOD));
        rules.add(rule("^" + MODS + "Property\\s+(\\w+)(?:\\(\\))?\\s+As\\s+(?:New\\s+)?([\\w.]+)(?:\\s*=.*)?$",
                "{mod:1}{2} As {type:3}"));

        // ========== Procedures ==========
        rules.add(rule("^" + MODS + "Sub\\s+New\\s*" + PARAMS + "$", "Private Sub Class_Initialize()")
                .push(BlockKind.METHOD, "Sub"));
        rules.add(rule("^" + MODS + "Function\\s+(\\w+)\\s*" + TYPE_PARAMS + PARAMS + "(?:\\s+As\\s+(.+?))?(?:\\s+(?:Handles|Implements)\\s+.+)?$",
                "{mod:1}Function {2}({params:3}){as:4}").push(BlockKind.METHOD, "Function").named(2));
        rules.add(rule("^" + MODS + "Sub\\s+(\\w+)\\s*" + TYPE_PARAMS + PARAMS + "(?:\\s+(?:Handles|Implements)\\s+.+)?$",
                "{mod:1}Sub {2}({params:3})").push(BlockKind.METHOD, "Sub").named(2));
        rules.add(rule("^End\\s+(?:Sub|Function)$", "{0}").pop(BlockKind.METHOD));
        rules.add(rule("^Return\\s+(.+)$", "{method} = {1}\nExit Property").within("Get"));
        rules.add(rule("^Return\\s+(.+)$", "{method} = {1}\nExit Function"));
        rules.add(rule("^Return$", "Exit Sub"));

        // ========== Blocks ==========
        rules.add(rule("^While\\s+(.+)$", "While {1}").push(BlockKind.LOOP, "While"));
        rules.add(rule("^End\\s+While$", "Wend").pop(BlockKind.LOOP));
        rules.addAll(VbStructureRules.identityBlocks());

        // ========== Declarations ==========
        String variable = "^(Dim|Private|Public|Static|Friend)\\s+(\\w+)(\\(\\))?";
        rules.add(rule(variable + "\\s+As\\s+New\\s+([\\w.]+)(?:\\(.*\\))?$", "{1} {2}{3} As New {type:4}"));
        rules.add(rule("^Dim\\s+(\\w+)\\s+As\\s+(.+?)\\s*=\\s*(.+)$", "Dim {1} As {type:2}\n{1} = {3}"));
        rules.add(rule("^Dim\\s+(\\w+)\\s*=\\s*(.+)$", "Dim {1}\n{1} = {2}"));
        rules.add(rule(variable + "\\s+As\\s+([\\w.]+(?:\\(\\))?)$", "{1} {2}{3} As {type:4}"));
        rules.add(rule("^((?:(?:Public|Private)\\s+)?)Const\\s+(\\w+)\\s+As\\s+(\\w+)\\s*=\\s*(.+)$",
                "{1}Const {2} As {type:3} = {4}"));

        // ========== Statements ==========
        rules.add(rule("^Throw\\s+New\\s+\\w*Exception\\((.*)\\)$", "Err.Raise vbObjectError + 513, , {1}"));
        rules.add(rule("^([\\w.]+(?:\\([^()]*\\))?)\\s*([+\\-*/&])=\\s*(.+)$", "{1} = {1} {2} {3}"));
        rules.add(rule("^(?!(?:Try|Catch|Finally|End\\s+Try|Using|End\\s+Using|Throw|Continue|SyncLock|End\\s+SyncLock"
                + "|Inherits|Implements|Exit\\s+While)\\b)(.+)$", "{0}"));
        return rules;
    }
}
