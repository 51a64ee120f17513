package me.christianrobert.vbtranspiler.transpiler.parser;

import me.christianrobert.vbtranspiler.core.model.Language;

/**
 * Produces a syntax tree for source code.
 */
public interface SourceParser {

    /**
     * Parses source code.
     *
     * @param code Source code
     * @param language Language of the source
     * @return A tree, a parse failure, or {@link ParseResult#unavailable(String)} when the
     *         language is not supported by this parser
     */
    ParseResult parse(String code, Language language);
}
