package com.measure.compiler.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural address of a node: the child indices from the root.
 * The same path addresses the same position in an edited copy of a tree.
 */
public final class TreePath {
    private static final TreePath ROOT = new TreePath(List.of());
    private static final Pattern SEGMENT = Pattern.compile("\\.children\\[(\\d+)]");

    private final List<Integer> indices;

    private TreePath(List<Integer> indices) {
        this.indices = indices;
    }

    public static TreePath root() {
        return ROOT;
    }

    /**
     * Parse the rendered form, e.g. {@code root.children[1].children[0]}.
     * @param text Rendered path
     * @return The parsed path
     */
    public static TreePath parse(String text) {
        if (text == null || !text.startsWith("root")) {
            throw new IllegalArgumentException("Not a tree path: " + text);
        }
        String rest = text.substring("root".length());
        Matcher matcher = SEGMENT.matcher(rest);
        List<Integer> parsed = new ArrayList<>();
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw new IllegalArgumentException("Not a tree path: " + text);
            }
            parsed.add(Integer.parseInt(matcher.group(1)));
            consumed = matcher.end();
        }
        if (consumed != rest.length()) {
            throw new IllegalArgumentException("Not a tree path: " + text);
        }
        return new TreePath(Collections.unmodifiableList(parsed));
    }

    public TreePath child(int index) {
        List<Integer> next = new ArrayList<>(indices);
        next.add(index);
        return new TreePath(Collections.unmodifiableList(next));
    }

    public List<Integer> getIndices() {
        return indices;
    }

    public boolean isRoot() {
        return indices.isEmpty();
    }

    public int depth() {
        return indices.size();
    }

    public TreePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("Root has no parent");
        }
        return new TreePath(Collections.unmodifiableList(new ArrayList<>(indices.subList(0, indices.size() - 1))));
    }

    public int lastIndex() {
        if (isRoot()) {
            throw new IllegalStateException("Root has no index");
        }
        return indices.get(indices.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreePath that)) return false;
        return indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indices);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("root");
        for (int index : indices) {
            sb.append(".children[").append(index).append(']');
        }
        return sb.toString();
    }
}
