package com.challenges.jhtml.path;

/**
 * What to look for: a path plus optional exact {@code class} and {@code id} values.
 * Empty strings mean "no constraint"; {@code null} is treated as empty.
 */
public record NodePath(String path, String cssClass, String id) {

    public NodePath {
        path = normalizeNull(path);
        cssClass = normalizeNull(cssClass);
        id = normalizeNull(id);
    }

    public static NodePath of(String path) {
        return new NodePath(path, "", "");
    }

    public NodePath withClass(String cssClass) {
        return new NodePath(path, cssClass, id);
    }

    public NodePath withId(String id) {
        return new NodePath(path, cssClass, id);
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }
}
