package me.christianrobert.vbtranspiler.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages understood by the transpiler.
 *
 * <p>Language tags arriving over the API are normalised case-insensitively with spaces and
 * dots removed, so "VB.NET", "vb net" and "vbnet" all resolve to {@link #VBNET}.</p>
 */
public enum Language {

    VB6("vb", "VB", DelimiterStyle.KEYWORD_PAIRED, "'"),
    VBNET("vbnet", "VB.NET", DelimiterStyle.KEYWORD_PAIRED, "'"),
    CSHARP("csharp", "C#", DelimiterStyle.BRACE_PAIRED, "//");

    private final String tag;
    private final String displayName;
    private final DelimiterStyle delimiterStyle;
    private final String commentLeader;

    Language(String tag, String displayName, DelimiterStyle delimiterStyle, String commentLeader) {
        this.tag = tag;
        this.displayName = displayName;
        this.delimiterStyle = delimiterStyle;
        this.commentLeader = commentLeader;
    }

    public String getTag() {
        return tag;
    }

    public String getDisplayName() {
        return displayName;
    }

    public DelimiterStyle getDelimiterStyle() {
        return delimiterStyle;
    }

    public String getCommentLeader() {
        return commentLeader;
    }

    public boolean isKeywordDelimited() {
        return delimiterStyle == DelimiterStyle.KEYWORD_PAIRED;
    }

    public boolean isBraceDelimited() {
        return delimiterStyle == DelimiterStyle.BRACE_PAIRED;
    }

    /**
     * Resolves a caller supplied language tag.
     *
     * @param rawTag Tag such as "vb", "VB.NET", "c#", "c_sharp"
     * @return The language, or empty if the tag is unknown or null
     */
    public static Optional<Language> fromTag(String rawTag) {
        if (rawTag == null) {
            return Optional.empty();
        }
        String normalized = rawTag.toLowerCase(Locale.ROOT).replace(" ", "").replace(".", "");
        switch (normalized) {
            case "vb":
            case "vb6":
                return Optional.of(VB6);
            case "vbnet":
                return Optional.of(VBNET);
            case "csharp":
            case "c#":
            case "c_sharp":
            case "cs":
                return Optional.of(CSHARP);
            default:
                return Optional.empty();
        }
    }
}
