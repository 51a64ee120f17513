package me.christianrobert.vbtranspiler.transpiler.validation;

import me.christianrobert.vbtranspiler.core.model.Language;

import java.util.regex.Pattern;

/**
 * Source-language tokens that should not survive a conversion, per direction.
 */
final class LeftoverTokens {

    private static final Pattern VB_IN_CSHARP = Pattern.compile(
            "\\b(?:Dim|ByVal|ByRef|Then|ElseIf|Wend|AndAlso|OrElse|Nothing"
                    + "|End\\s+(?:If|Sub|Function|Class|Module|While|Select|Try|Property|Structure|Using))\\b");
    private static final Pattern CSHARP_IN_VB = Pattern.compile(
            ";\\s*$|^\\s*[{}]\\s*$|&&|\\|\\||==|!=|\\+\\+|\\b(?:void|null|var)\\b");
    private static final Pattern VB6_IN_VBNET = Pattern.compile(
            "\\b(?:Wend|GoSub|Variant|Currency|Property\\s+(?:Get|Let|Set)|Def(?:Int|Lng|Sng|Dbl|Cur|Str|Bool|Byte|Date|Obj|Var))\\b"
                    + "|^\\s*Set\\s+\\w+\\s*=",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern VBNET_IN_VB6 = Pattern.compile(
            "\\b(?:Try|Catch|Finally|Using|AndAlso|OrElse|IsNot|Return|Throw|Continue|SyncLock|Imports|Inherits|Implements)\\b",
            Pattern.CASE_INSENSITIVE);

    private LeftoverTokens() {
    }

    /**
     * @return Pattern of leftover tokens, or null if the direction has no direct rules
     */
    static Pattern forDirection(Language source, Language target) {
        if (target == Language.CSHARP && source != Language.CSHARP) {
            return VB_IN_CSHARP;
        }
        if (source == Language.CSHARP && target != Language.CSHARP) {
            return CSHARP_IN_VB;
        }
        if (source == Language.VB6 && target == Language.VBNET) {
            return VB6_IN_VBNET;
        }
        if (source == Language.VBNET && target == Language.VB6) {
            return VBNET_IN_VB6;
        }
        return null;
    }
}
