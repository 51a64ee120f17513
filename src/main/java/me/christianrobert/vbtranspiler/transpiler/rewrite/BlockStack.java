package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stack of open blocks, owned by a single rewrite invocation.
 * Index 0 is the outermost frame; the index of a frame is also its indentation depth.
 */
public class BlockStack {

    private final List<BlockFrame> frames = new ArrayList<>();

    public BlockStack() {
    }

    public BlockStack(List<BlockFrame> initial) {
        frames.addAll(initial);
    }

    public void push(BlockFrame frame) {
        frames.add(frame);
    }

    /**
     * @return The innermost frame, null if the stack is empty
     */
    public BlockFrame peek() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * Finds the innermost frame of a kind.
     *
     * @param kind Kind to look for, null matches any frame
     * @return Index of the frame, -1 if there is none
     */
    public int findNearest(BlockKind kind) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (kind == null || frames.get(i).getKind() == kind) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return The innermost frame of a kind, null if there is none
     */
    public BlockFrame nearest(BlockKind kind) {
        int index = findNearest(kind);
        return index >= 0 ? frames.get(index) : null;
    }

    public BlockFrame get(int index) {
        return frames.get(index);
    }

    /**
     * Removes a frame. Frames above it stay open.
     */
    public BlockFrame removeAt(int index) {
        return frames.remove(index);
    }

    /**
     * @return Snapshot of the frames, outermost first
     */
    public List<BlockFrame> getFrames() {
        return Collections.unmodifiableList(new ArrayList<>(frames));
    }

    @Override
    public String toString() {
        return "BlockStack" + frames;
    }
}
