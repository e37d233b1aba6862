package com.challenges.jhtml.tree;

import com.challenges.jhtml.html.HtmlToken;

import java.util.Iterator;
import java.util.logging.Logger;

/**
 * Turns a token stream into a {@link Node} tree.
 * <p>
 * The builder assumes well-nested markup and degrades gracefully when it is not:
 * an end tag closes the nearest open element with the same name (and everything opened
 * inside it), an end tag with no such element is ignored, and a self-closing tag with no
 * open element is ignored. A start tag seen after the root has been closed reopens a scope
 * under the root.
 */
public class TreeBuilder {
    private static final Logger LOG = Logger.getLogger(TreeBuilder.class.getName());

    public Node build(Iterable<? extends HtmlToken> tokens) {
        return build(tokens.iterator());
    }

    /**
     * Consumes {@code tokens} up to the end-of-stream token (or until exhausted).
     *
     * @return the root element, or {@code null} when the stream opened no element
     */
    public Node build(Iterator<? extends HtmlToken> tokens) {
        Node root = null;
        Node cursor = null;

        while (tokens.hasNext()) {
            HtmlToken token = tokens.next();
            switch (token.kind()) {
                case START_TAG -> {
                    HtmlToken.StartTag start = (HtmlToken.StartTag) token;
                    if (root == null) {
                        root = new Node(start.name(), start.attributes(), null);
                        cursor = root;
                    } else {
                        Node parent = cursor != null ? cursor : root;
                        Node node = new Node(start.name(), start.attributes(), parent);
                        parent.appendChild(node);
                        cursor = node;
                    }
                }
                case SELF_CLOSING_TAG -> {
                    HtmlToken.SelfClosingTag tag = (HtmlToken.SelfClosingTag) token;
                    if (cursor == null) {
                        LOG.fine(() -> "Ignoring self-closing <" + tag.name() + "/> with no open element");
                    } else {
                        cursor.appendChild(new Node(tag.name(), tag.attributes(), cursor));
                    }
                }
                case END_TAG -> {
                    HtmlToken.EndTag end = (HtmlToken.EndTag) token;
                    Node open = cursor != null ? cursor.findTagReverse(end.name()) : null;
                    if (open != null) {
                        cursor = open.parent();
                    } else {
                        LOG.finer(() -> "Ignoring unmatched </" + end.name() + ">");
                    }
                }
                case TEXT, COMMENT, DOCTYPE -> {
                    // not part of the element tree
                }
                case END_OF_STREAM -> {
                    return root;
                }
            }
        }
        return root;
    }
}
