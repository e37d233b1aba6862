package com.challenges.jhtml.tree;

import com.challenges.jhtml.HtmlDocuments;
import com.challenges.jhtml.JHtmlLoggingConfig;
import com.challenges.jhtml.html.HtmlToken;
import com.challenges.jhtml.html.HtmlToken.Attribute;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeBuilderTest extends JHtmlLoggingConfig {

    private final TreeBuilder builder = new TreeBuilder();

    private static HtmlToken start(String name, Attribute... attributes) {
        return HtmlToken.StartTag.of(name, attributes);
    }

    private static HtmlToken end(String name) {
        return new HtmlToken.EndTag(name);
    }

    private static HtmlToken leaf(String name) {
        return HtmlToken.SelfClosingTag.of(name);
    }

    @Test
    public void testBuildsNestedTree() {
        Node root = builder.build(List.of(
                start("html"), start("body"), start("p"), new HtmlToken.Text("Test"), end("p"),
                end("body"), end("html"), new HtmlToken.EndOfStream()));

        assertEquals("html", root.tagName());
        assertTrue(root.isRoot());
        Node body = root.children().getOnly();
        assertEquals("body", body.tagName());
        assertSame(root, body.parent());
        Node p = body.children().getOnly();
        assertEquals("p", p.tagName());
        assertSame(body, p.parent());
        assertTrue(p.children().isEmpty());
    }

    @Test
    public void testEmptyStreamYieldsNull() {
        assertNull(builder.build(List.of(new HtmlToken.EndOfStream())));
        assertNull(builder.build(List.<HtmlToken>of()));
        assertNull(builder.build(List.of(new HtmlToken.Text("just text"), new HtmlToken.EndOfStream())));
    }

    @Test
    public void testStopsAtEndOfStream() {
        Node root = builder.build(List.of(start("div"), new HtmlToken.EndOfStream(), start("p")));

        assertTrue(root.children().isEmpty());
    }

    @Test
    public void testSelfClosingTagsDoNotBecomeParents() {
        Node div = HtmlDocuments.parse("<div><img/><p>X</p></div>");

        assertEquals(List.of("img", "p"), div.children().collect(Node::tagName));
        assertSame(div, div.children().get(0).parent());
        assertSame(div, div.children().get(1).parent());
        assertTrue(div.children().get(0).children().isEmpty());
    }

    @Test
    public void testStrayEndTagIsIgnored() {
        Node div = HtmlDocuments.parse("<div><p>a</span>b</p><p>c</p></div>");

        assertEquals(List.of("p", "p"), div.children().collect(Node::tagName));
    }

    @Test
    public void testEndTagClosesNearestMatchingAncestor() {
        // </div> closes the unclosed <b> and <i> as well
        Node root = HtmlDocuments.parse("<body><div><b><i>x</div><p></p></body>");

        assertEquals(List.of("div", "p"), root.children().collect(Node::tagName));
        Node div = root.children().get(0);
        assertEquals("b", div.children().getOnly().tagName());
        assertEquals("i", div.children().getOnly().children().getOnly().tagName());
    }

    @Test
    public void testUnclosedElementsNestUnderEachOther() {
        Node p = HtmlDocuments.parse("<p>one<br>two<br>three</p>");

        Node br = p.children().getOnly();
        assertEquals("br", br.tagName());
        assertEquals("br", br.children().getOnly().tagName());
    }

    @Test
    public void testSelfClosingBeforeRootIsIgnored() {
        Node root = builder.build(List.of(leaf("meta"), start("html"), end("html"), new HtmlToken.EndOfStream()));

        assertEquals("html", root.tagName());
        assertTrue(root.children().isEmpty());
    }

    @Test
    public void testEndTagBeforeRootIsIgnored() {
        Node root = builder.build(List.of(end("p"), start("div"), leaf("hr"), end("div")));

        assertEquals("div", root.tagName());
        assertEquals("hr", root.children().getOnly().tagName());
    }

    @Test
    public void testSelfClosingAfterClosedRootIsIgnored() {
        Node root = HtmlDocuments.parse("<html></html><img/>");

        assertEquals("html", root.tagName());
        assertTrue(root.children().isEmpty());
    }

    @Test
    public void testStartTagAfterClosedRootReopensUnderRoot() {
        Node root = HtmlDocuments.parse("<html><body></body></html><img/><p>late<br/></p>");

        assertEquals(List.of("body", "p"), root.children().collect(Node::tagName));
        Node p = root.children().get(1);
        assertSame(root, p.parent());
        assertEquals("br", p.children().getOnly().tagName());
    }

    @Test
    public void testRepeatedAttributeLastValueWins() {
        Node a = builder.build(List.of(start("a",
                new Attribute("href", "/one"),
                new Attribute("class", "x"),
                new Attribute("href", "/two"))));

        assertEquals(2, a.attributes().size());
        assertEquals("/two", a.attribute("href").orElseThrow());
        assertEquals(List.of("href", "class"), a.attributes().keysView().toList());
    }

    @Test
    public void testDeeplyNestedDocument() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 20_000; i++) {
            html.append("<div>");
        }
        Node root = HtmlDocuments.parse(html.toString());

        assertEquals(19_999, root.flattenChildren().size());
        assertNotNull(root.findTag("div"));
    }
}
