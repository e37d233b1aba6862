package com.challenges.jhtml.path;

import com.challenges.jhtml.tree.Node;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Evaluates paths against a {@link Node} tree.
 * <p>
 * A path is matched from its last segment backwards: the last segment names the node itself,
 * and every earlier segment names either the immediate parent (when the following segment is
 * marked with {@code .}) or the nearest node with that name found by walking up from the node
 * itself. Queries never modify the tree and never throw for unmatched or malformed paths.
 */
public class PathMatcher {
    private static final Logger LOG = Logger.getLogger(PathMatcher.class.getName());

    private final PathParser parser;

    public PathMatcher() {
        this(new PathParser());
    }

    public PathMatcher(PathParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    public boolean matchesPath(Node node, String path) {
        return matches(node, parser.parse(path));
    }

    public boolean matches(Node node, PathExpression expression) {
        if (expression.matchesNothing()) {
            return false;
        }
        ImmutableList<PathExpression.Segment> segments = expression.segments();
        if (segments.isEmpty()) {
            return true;
        }

        Node current = node;
        for (int i = segments.size() - 1; ; i--) {
            PathExpression.Segment segment = segments.get(i);
            if (!segment.tagName().equals(current.tagName())) {
                return false;
            }
            if (i == 0) {
                return !expression.absolute() || current.isRoot();
            }

            // an unmarked segment resolves through the node itself and then its ancestors
            current = segment.directChild()
                    ? current.parent()
                    : current.findTagReverse(segments.get(i - 1).tagName());
            if (current == null) {
                return false;
            }
        }
    }

    /**
     * First node, in document order starting with {@code root} itself, matching path, class and id.
     */
    public Optional<Node> findPath(Node root, NodePath query) {
        Predicate<Node> predicate = compile(query);
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (predicate.test(node)) {
                return Optional.of(node);
            }
            pushChildren(stack, node);
        }
        LOG.finer(() -> "No match for " + query);
        return Optional.empty();
    }

    /**
     * Every node under (and including) {@code root} matching path, class and id, in document order.
     */
    public MutableList<Node> findPathAll(Node root, NodePath query) {
        Predicate<Node> predicate = compile(query);
        MutableList<Node> matches = Lists.mutable.empty();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (predicate.test(node)) {
                matches.add(node);
            }
            pushChildren(stack, node);
        }
        LOG.finer(() -> matches.size() + " match(es) for " + query);
        return matches;
    }

    private Predicate<Node> compile(NodePath query) {
        PathExpression expression = parser.parse(query.path());
        return node -> matches(node, expression)
                && node.hasClass(query.cssClass())
                && node.hasId(query.id());
    }

    private static void pushChildren(Deque<Node> stack, Node node) {
        MutableList<Node> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
