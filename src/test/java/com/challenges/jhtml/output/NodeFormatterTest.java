package com.challenges.jhtml.output;

import com.challenges.jhtml.HtmlDocuments;
import com.challenges.jhtml.JHtmlLoggingConfig;
import com.challenges.jhtml.tree.Node;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class NodeFormatterTest extends JHtmlLoggingConfig {

    private static final String HTML =
            "<div id=\"main\"><h1 class=\"element\">Testing</h1><img src=\"a.png\" alt=\"A\"/></div>";

    @Test
    public void testStructure() {
        Node root = HtmlDocuments.parse(HTML);

        String structure = new NodeFormatter().structure(root, 0, "  ");

        assertEquals("div #main\n"
                + "  h1 .element\n"
                + "  img\n"
                + "/div\n", structure);
    }

    @Test
    public void testStructureWithIndent() {
        Node root = HtmlDocuments.parse("<ul><li><b></b></li></ul>");
        StringWriter sw = new StringWriter();

        new NodeFormatter().printStructure(root, new PrintWriter(sw), 1, "-");

        assertEquals("-ul\n"
                + "--li\n"
                + "---b\n"
                + "--/li\n"
                + "-/ul\n", sw.toString());
    }

    @Test
    public void testCompactJsonKeepsAttributeOrder() {
        Node img = HtmlDocuments.parse(HTML).findTag("img");

        String json = new NodeFormatter(false, false).toJson(img);

        assertEquals("{\"tag\":\"img\",\"path\":\"/div/img\","
                + "\"attributes\":{\"src\":\"a.png\",\"alt\":\"A\"},\"children\":[]}", json);
    }

    @Test
    public void testCompactJsonSortedKeys() {
        Node img = HtmlDocuments.parse(HTML).findTag("img");

        String json = new NodeFormatter(false, true).toJson(img);

        assertEquals("{\"tag\":\"img\",\"path\":\"/div/img\","
                + "\"attributes\":{\"alt\":\"A\",\"src\":\"a.png\"},\"children\":[]}", json);
    }

    @Test
    public void testJsonIncludesChildren() {
        Node root = HtmlDocuments.parse(HTML);

        String json = new NodeFormatter(false, true).toJson(root);

        assertTrue(json.startsWith("{\"tag\":\"div\",\"path\":\"/div\",\"attributes\":{\"id\":\"main\"},\"children\":[{\"tag\":\"h1\""), json);
        assertTrue(json.contains("\"path\":\"/div/img\""), json);
    }

    @Test
    public void testJsonWithoutChildren() {
        Node root = HtmlDocuments.parse(HTML);

        String json = new NodeFormatter(false, false, false).toJson(root);

        assertEquals("{\"tag\":\"div\",\"path\":\"/div\",\"attributes\":{\"id\":\"main\"}}", json);
    }

    @Test
    public void testPrettyJsonIsMultiLine() {
        Node root = HtmlDocuments.parse(HTML);

        String json = new NodeFormatter().toJson(root);

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"tag\" : \"div\""), json);
    }
}
