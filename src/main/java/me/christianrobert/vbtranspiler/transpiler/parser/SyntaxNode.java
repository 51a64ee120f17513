package me.christianrobert.vbtranspiler.transpiler.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a parsed syntax tree.
 * Immutable once built; the tree of one parse call is rooted at a {@code compilation_unit} node.
 * Line numbers are 1-based.
 */
public class SyntaxNode {

    public static final String COMPILATION_UNIT = "compilation_unit";

    private final String id;
    private final String kind;
    private final String text;
    private final int startLine;
    private final int endLine;
    private final List<SyntaxNode> children;

    public SyntaxNode(String id, String kind, String text, int startLine, int endLine, List<SyntaxNode> children) {
        this.id = id;
        this.kind = kind;
        this.text = text != null ? text : "";
        this.startLine = startLine;
        this.endLine = endLine;
        this.children = children != null ? Collections.unmodifiableList(new ArrayList<>(children)) : Collections.emptyList();
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return "SyntaxNode{" + id + ", " + kind + ", lines " + startLine + "-" + endLine
                + ", children=" + children.size() + "}";
    }

    /**
     * Mutable counterpart used while a tree is assembled.
     * The end line of an open node is only known once its closer is seen.
     */
    public static class Builder {
        private final String id;
        private final String kind;
        private final String text;
        private final int startLine;
        private int endLine;
        private final List<Builder> children = new ArrayList<>();

        public Builder(String id, String kind, String text, int startLine) {
            this.id = id;
            this.kind = kind;
            this.text = text;
            this.startLine = startLine;
            this.endLine = startLine;
        }

        public Builder addChild(Builder child) {
            children.add(child);
            return this;
        }

        public Builder endLine(int line) {
            this.endLine = Math.max(startLine, line);
            return this;
        }

        public String getKind() {
            return kind;
        }

        public SyntaxNode build() {
            List<SyntaxNode> built = new ArrayList<>(children.size());
            for (Builder child : children) {
                built.add(child.build());
            }
            return new SyntaxNode(id, kind, text, startLine, endLine, built);
        }
    }
}
