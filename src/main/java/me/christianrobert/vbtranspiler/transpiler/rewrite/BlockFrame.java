package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

/**
 * One open block on the rewriter's stack.
 *
 * <p>{@code label} is the VB keyword family of the block ({@code Sub}, {@code For}, {@code Try}, ...)
 * and is what a keyword closer is synthesised from. {@code name} is the declared name of a class or
 * method block, null for anonymous blocks.</p>
 */
public class BlockFrame {

    private final BlockKind kind;
    private final int openedAtLine;
    private final String label;
    private final String name;

    public BlockFrame(BlockKind kind, int openedAtLine, String label, String name) {
        this.kind = kind;
        this.openedAtLine = openedAtLine;
        this.label = label;
        this.name = name;
    }

    public BlockKind getKind() {
        return kind;
    }

    public int getOpenedAtLine() {
        return openedAtLine;
    }

    public String getLabel() {
        return label;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return kind + "(" + label + (name != null ? " " + name : "") + " @" + openedAtLine + ")";
    }
}
