package me.christianrobert.vbtranspiler.transpiler.syntax;

/**
 * Family of an open syntactic block. Openers and closers must agree on the family.
 */
public enum BlockKind {
    CLASS,
    METHOD,
    CONDITIONAL,
    LOOP,
    OTHER
}
