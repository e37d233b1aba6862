package com.challenges.jhtml.path;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A parsed path such as {@code body/div/.h1}.
 *
 * @param segments       outermost first; empty means "any node" unless {@code matchesNothing}
 * @param absolute       whether the first segment must be the root
 * @param matchesNothing set for paths with an empty segment, which no node satisfies
 */
public record PathExpression(ImmutableList<Segment> segments, boolean absolute, boolean matchesNothing) {

    /**
     * @param tagName     element name to match
     * @param directChild whether this element must be an immediate child of the previous segment
     */
    public record Segment(String tagName, boolean directChild) {
        @Override
        public String toString() {
            return directChild ? "." + tagName : tagName;
        }
    }

    public static PathExpression any() {
        return new PathExpression(Lists.immutable.empty(), false, false);
    }

    public static PathExpression none() {
        return new PathExpression(Lists.immutable.empty(), false, true);
    }

    public boolean matchesAnything() {
        return segments.isEmpty() && !matchesNothing;
    }

    @Override
    public String toString() {
        if (matchesNothing) {
            return "<none>";
        }
        return (absolute ? "/" : "") + segments.makeString("/");
    }
}
