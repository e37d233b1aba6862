package com.challenges.jhtml.path;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.logging.Logger;

/**
 * Parses path strings such as {@code body/div/.h1} into {@link PathExpression}s.
 * <p>
 * A {@code .} prefix marks a segment as a direct child of the previous one, and a leading
 * {@code /} anchors the first segment at the root. A path with an empty segment
 * ({@code div//p}, {@code div/}, {@code .}) is accepted but matches no node.
 */
public class PathParser {
    private static final Logger LOG = Logger.getLogger(PathParser.class.getName());

    public PathExpression parse(String path) {
        if (path == null || path.isEmpty()) {
            return PathExpression.any();
        }

        boolean absolute = path.startsWith("/");
        int start = absolute ? 1 : 0;

        MutableList<PathExpression.Segment> segments = Lists.mutable.empty();
        while (start <= path.length()) {
            int slash = path.indexOf('/', start);
            int end = slash == -1 ? path.length() : slash;
            PathExpression.Segment segment = parseSegment(path, start, end);
            if (segment == null) {
                LOG.fine(() -> "Path '" + path + "' has an empty segment and matches nothing");
                return PathExpression.none();
            }
            segments.add(segment);
            start = end + 1;
        }
        return new PathExpression(segments.toImmutable(), absolute, false);
    }

    private PathExpression.Segment parseSegment(String path, int start, int end) {
        boolean directChild = start < end && path.charAt(start) == '.';
        int nameStart = directChild ? start + 1 : start;
        if (nameStart >= end) {
            return null;
        }
        return new PathExpression.Segment(path.substring(nameStart, end), directChild);
    }
}
