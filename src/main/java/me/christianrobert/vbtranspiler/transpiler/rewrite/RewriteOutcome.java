package me.christianrobert.vbtranspiler.transpiler.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of one rewrite pass: the produced text, warnings, and the blocks still open at the end of input.
 */
public class RewriteOutcome {

    private final String code;
    private final List<String> warnings;
    private final List<BlockFrame> openFrames;

    public RewriteOutcome(String code, List<String> warnings, List<BlockFrame> openFrames) {
        this.code = code;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.openFrames = Collections.unmodifiableList(new ArrayList<>(openFrames));
    }

    public String getCode() {
        return code;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * @return Frames left on the stack, outermost first; empty for balanced input
     */
    public List<BlockFrame> getOpenFrames() {
        return openFrames;
    }

    public boolean isBalanced() {
        return openFrames.isEmpty();
    }

    @Override
    public String toString() {
        return "RewriteOutcome{lines=" + code.split("\n", -1).length + ", warnings=" + warnings.size()
                + ", openFrames=" + openFrames + "}";
    }
}
