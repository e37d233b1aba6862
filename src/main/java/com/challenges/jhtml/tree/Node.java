package com.challenges.jhtml.tree;

import com.challenges.jhtml.html.HtmlToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * One element of a document tree.
 * <p>
 * Children are owned by their parent and kept in document order. The parent link is only
 * used to walk upwards; it is {@code null} for the root.
 */
public final class Node {
    private final String tagName;
    private final MutableMap<String, String> attributes;
    private final Node parent;
    private final MutableList<Node> children = Lists.mutable.empty();

    Node(String tagName, Iterable<HtmlToken.Attribute> attributes, Node parent) {
        this.tagName = tagName;
        this.parent = parent;
        // first occurrence fixes the position, last occurrence wins the value
        this.attributes = MapAdapter.adapt(new LinkedHashMap<String, String>());
        for (HtmlToken.Attribute attribute : attributes) {
            this.attributes.put(attribute.key(), attribute.value());
        }
    }

    public String tagName() {
        return tagName;
    }

    public MutableMap<String, String> attributes() {
        return attributes;
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Node parent() {
        return parent;
    }

    public MutableList<Node> children() {
        return children;
    }

    public boolean isRoot() {
        return parent == null;
    }

    void appendChild(Node child) {
        children.add(child);
    }

    /**
     * Exact match on the {@code class} attribute; an empty argument always matches.
     */
    public boolean hasClass(String cssClass) {
        if (cssClass == null || cssClass.isEmpty()) {
            return true;
        }
        return cssClass.equals(attributes.get("class"));
    }

    public boolean hasId(String id) {
        if (id == null || id.isEmpty()) {
            return true;
        }
        return id.equals(attributes.get("id"));
    }

    /**
     * Depth-first search of this node and its descendants for the first element named {@code tag}.
     *
     * @return the match, or {@code null}
     */
    public Node findTag(String tag) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.tagName.equals(tag)) {
                return node;
            }
            pushChildren(stack, node);
        }
        return null;
    }

    /**
     * Walks from this node up through its ancestors and returns the first one named {@code tag},
     * this node included.
     *
     * @return the match, or {@code null}
     */
    public Node findTagReverse(String tag) {
        for (Node node = this; node != null; node = node.parent) {
            if (node.tagName.equals(tag)) {
                return node;
            }
        }
        return null;
    }

    /**
     * All descendants in pre-order, not including this node.
     */
    public MutableList<Node> flattenChildren() {
        MutableList<Node> nodes = Lists.mutable.empty();
        Deque<Node> stack = new ArrayDeque<>();
        pushChildren(stack, this);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            nodes.add(node);
            pushChildren(stack, node);
        }
        return nodes;
    }

    /**
     * The tag names from the root down to this node, e.g. {@code /html/body/p}.
     */
    public String path() {
        Deque<String> names = new ArrayDeque<>();
        for (Node node = this; node != null; node = node.parent) {
            names.push(node.tagName);
        }
        return "/" + String.join("/", names);
    }

    /**
     * Pushes the children of {@code node} so that the first child is popped first.
     */
    private static void pushChildren(Deque<Node> stack, Node node) {
        for (int i = node.children.size() - 1; i >= 0; i--) {
            stack.push(node.children.get(i));
        }
    }

    @Override
    public String toString() {
        return "Node{" +
                "tagName='" + tagName + '\'' +
                ", attributes=" + attributes +
                ", children=" + children.size() +
                '}';
    }
}
