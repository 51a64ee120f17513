package me.christianrobert.vbtranspiler.core.model;

/**
 * How a language marks the start and end of a syntactic scope.
 */
public enum DelimiterStyle {
    KEYWORD_PAIRED,  // Class ... End Class, For ... Next
    BRACE_PAIRED     // { ... }
}
