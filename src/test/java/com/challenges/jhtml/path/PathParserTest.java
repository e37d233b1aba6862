package com.challenges.jhtml.path;

import com.challenges.jhtml.JHtmlLoggingConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PathParserTest extends JHtmlLoggingConfig {

    private final PathParser parser = new PathParser();

    @Test
    public void testEmptyPathMatchesAnything() {
        assertTrue(parser.parse("").matchesAnything());
        assertTrue(parser.parse(null).matchesAnything());
    }

    @Test
    public void testSegments() {
        PathExpression expression = parser.parse("body/div/.h1");

        assertFalse(expression.absolute());
        assertEquals(List.of(
                new PathExpression.Segment("body", false),
                new PathExpression.Segment("div", false),
                new PathExpression.Segment("h1", true)
        ), expression.segments().castToList());
        assertEquals("body/div/.h1", expression.toString());
    }

    @Test
    public void testAbsolutePath() {
        PathExpression expression = parser.parse("/html/body");

        assertTrue(expression.absolute());
        assertEquals(2, expression.segments().size());
        assertEquals("/html/body", expression.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"/", "div//p", "div/", ".", "div/.", "//div"})
    public void testEmptySegmentYieldsExpressionMatchingNothing(String path) {
        PathExpression expression = parser.parse(path);

        assertTrue(expression.matchesNothing());
        assertFalse(expression.matchesAnything());
    }
}
