package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

/**
 * Effect of a rewrite rule on the block stack.
 *
 * <ul>
 *   <li>{@code NONE} plain statement</li>
 *   <li>{@code PUSH} opens a block of {@code kind}, {@code label} names its keyword family</li>
 *   <li>{@code POP} closes the nearest block of {@code kind}</li>
 *   <li>{@code POP_ANY} closes the innermost block whatever its kind (a bare brace)</li>
 *   <li>{@code REOPEN} starts the next clause of the nearest block of {@code kind}
 *       ({@code Else}, {@code Catch}) without changing depth</li>
 * </ul>
 */
public final class BlockStackOp {

    public enum Type {
        NONE,
        PUSH,
        POP,
        POP_ANY,
        REOPEN
    }

    private static final BlockStackOp NONE = new BlockStackOp(Type.NONE, null, null);
    private static final BlockStackOp POP_ANY = new BlockStackOp(Type.POP_ANY, null, null);

    private final Type type;
    private final BlockKind kind;
    private final String label;

    private BlockStackOp(Type type, BlockKind kind, String label) {
        this.type = type;
        this.kind = kind;
        this.label = label;
    }

    public static BlockStackOp none() {
        return NONE;
    }

    public static BlockStackOp push(BlockKind kind, String label) {
        return new BlockStackOp(Type.PUSH, kind, label);
    }

    public static BlockStackOp pop(BlockKind kind) {
        return new BlockStackOp(Type.POP, kind, null);
    }

    public static BlockStackOp popAny() {
        return POP_ANY;
    }

    public static BlockStackOp reopen(BlockKind kind) {
        return new BlockStackOp(Type.REOPEN, kind, null);
    }

    public Type getType() {
        return type;
    }

    public BlockKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        switch (type) {
            case PUSH:
                return "Push(" + kind + ", " + label + ")";
            case POP:
            case REOPEN:
                return (type == Type.POP ? "Pop(" : "Reopen(") + kind + ")";
            default:
                return type.name();
        }
    }
}
