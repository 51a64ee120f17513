package me.christianrobert.vbtranspiler.transpiler.syntax;

/**
 * A block boundary found on a logical line.
 *
 * <p>{@code OPEN} starts a block, {@code CLOSE} ends one and {@code CONTINUE} starts the next
 * clause of an open block ({@code Else}, {@code Catch}, {@code } else {}) without changing depth.</p>
 */
public class BlockEvent {

    public enum Type {
        OPEN,
        CLOSE,
        CONTINUE
    }

    private final Type type;
    private final BlockKind kind;
    private final String label;

    public BlockEvent(Type type, BlockKind kind, String label) {
        this.type = type;
        this.kind = kind;
        this.label = label;
    }

    public static BlockEvent open(BlockKind kind, String label) {
        return new BlockEvent(Type.OPEN, kind, label);
    }

    public static BlockEvent close(BlockKind kind, String label) {
        return new BlockEvent(Type.CLOSE, kind, label);
    }

    /**
     * A closer that fits any open block (a bare C# brace).
     */
    public static BlockEvent closeAny() {
        return new BlockEvent(Type.CLOSE, null, "}");
    }

    public static BlockEvent continuation(BlockKind kind, String label) {
        return new BlockEvent(Type.CONTINUE, kind, label);
    }

    public Type getType() {
        return type;
    }

    /**
     * @return The block family, null when the event fits any family
     */
    public BlockKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    public boolean accepts(BlockKind openKind) {
        return kind == null || kind == openKind;
    }

    @Override
    public String toString() {
        return type + "(" + (kind != null ? kind : "ANY") + ", " + label + ")";
    }
}
