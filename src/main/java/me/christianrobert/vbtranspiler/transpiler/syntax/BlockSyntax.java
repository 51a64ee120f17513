package me.christianrobert.vbtranspiler.transpiler.syntax;

import me.christianrobert.vbtranspiler.core.model.Language;

import java.util.List;

/**
 * Recognises block boundaries of one delimiter style on logical lines.
 * Used by the line structure parser and by the source-side validator.
 */
public interface BlockSyntax {

    /**
     * Scans one logical line for block events.
     *
     * @param line The line to scan
     * @param next The next line with code, null at end of input
     * @param enclosingLabel Label of the innermost open block, null at top level
     * @return Events in line order, empty for plain statements
     */
    List<BlockEvent> scan(LogicalLine line, LogicalLine next, String enclosingLabel);

    static BlockSyntax forLanguage(Language language) {
        return language.isKeywordDelimited() ? new KeywordBlockSyntax() : new BraceBlockSyntax();
    }
}
