package com.challenges.jhtml.output;

import com.challenges.jhtml.tree.Node;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Renders nodes for people: an indented outline of the tree, or JSON.
 */
public class NodeFormatter {
    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private final boolean prettyPrint;
    private final boolean sortKeys;
    private final boolean includeChildren;

    public NodeFormatter() {
        this(true, false, true);
    }

    public NodeFormatter(boolean prettyPrint, boolean sortKeys) {
        this(prettyPrint, sortKeys, true);
    }

    public NodeFormatter(boolean prettyPrint, boolean sortKeys, boolean includeChildren) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
        this.includeChildren = includeChildren;
    }

    /**
     * One line per element, each level indented by one more {@code character}. Elements with
     * children get a closing {@code /tag} line at their own indent.
     */
    public String structure(Node node, int indent, String character) {
        StringBuilder sb = new StringBuilder();
        appendStructure(node, indent, character, sb);
        return sb.toString();
    }

    public void printStructure(Node node, PrintWriter out, int indent, String character) {
        out.print(structure(node, indent, character));
        out.flush();
    }

    private void appendStructure(Node node, int indent, String character, StringBuilder sb) {
        String indentStr = character.repeat(indent);
        sb.append(indentStr).append(node.tagName());
        node.attribute("id").ifPresent(id -> sb.append(" #").append(id));
        node.attribute("class").ifPresent(cssClass -> sb.append(" .").append(cssClass));
        sb.append('\n');

        if (node.children().isEmpty()) {
            return;
        }
        for (Node child : node.children()) {
            appendStructure(child, indent + 1, character, sb);
        }
        sb.append(indentStr).append('/').append(node.tagName()).append('\n');
    }

    public String toJson(Node node) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            writeNode(generator, node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render " + node.path() + " as JSON", e);
        }
        return out.toString();
    }

    private void writeNode(JsonGenerator generator, Node node) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("tag", node.tagName());
        generator.writeStringField("path", node.path());

        generator.writeObjectFieldStart("attributes");
        MutableList<Pair<String, String>> entries = sortKeys
                ? node.attributes().keyValuesView().toSortedListBy(Pair::getOne)
                : node.attributes().keyValuesView().toList();
        for (Pair<String, String> entry : entries) {
            generator.writeStringField(entry.getOne(), entry.getTwo());
        }
        generator.writeEndObject();

        if (includeChildren) {
            generator.writeArrayFieldStart("children");
            for (Node child : node.children()) {
                writeNode(generator, child);
            }
            generator.writeEndArray();
        }
        generator.writeEndObject();
    }
}
