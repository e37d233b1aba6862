package com.challenges.jhtml.html;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Lazily splits HTML text into {@link HtmlToken}s.
 * <p>
 * This is a lexer only: it applies no nesting or implicit-closing rules and does not
 * decode entities. Tag and attribute names are lower-cased, attribute values are kept
 * verbatim. The stream always ends with exactly one {@link HtmlToken.EndOfStream}; a read
 * failure ends it early and is reported through {@link #failure()}.
 */
public class HtmlTokenizer implements Iterator<HtmlToken> {
    private static final Logger LOG = Logger.getLogger(HtmlTokenizer.class.getName());

    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of(
            "script", "style", "textarea", "title", "xmp",
            "iframe", "noembed", "noframes", "noscript");

    private static final int NONE = -2;

    private final Reader reader;
    private final Deque<HtmlToken> pending = new ArrayDeque<>();
    private int lookahead = NONE;
    private boolean exhausted;
    private boolean finished;
    private String rawTextElement;
    private IOException failure;

    public HtmlTokenizer(Reader reader) {
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
    }

    public static HtmlTokenizer of(String html) {
        return new HtmlTokenizer(new StringReader(html));
    }

    /**
     * The read error that ended the stream, if it did not end cleanly.
     */
    public Optional<IOException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public HtmlToken next() {
        if (finished) {
            throw new NoSuchElementException("Token stream already ended");
        }
        HtmlToken token = pending.isEmpty() ? scan() : pending.poll();
        if (token.kind() == HtmlToken.Kind.END_OF_STREAM) {
            finished = true;
        }
        return token;
    }

    private HtmlToken scan() {
        while (true) {
            if (rawTextElement != null) {
                return scanRawText();
            }
            int c = peek();
            if (c == -1) {
                return new HtmlToken.EndOfStream();
            }
            if (c != '<') {
                return scanText(new StringBuilder());
            }
            read();
            HtmlToken token = scanMarkup();
            if (token != null) {
                return token;
            }
        }
    }

    // Called after '<'. Returns null for markup that produces no token.
    private HtmlToken scanMarkup() {
        int c = peek();
        if (isLetter(c)) {
            return scanStartTag();
        }
        switch (c) {
            case '/':
                read();
                return scanEndTag();
            case '!':
                read();
                return scanDeclaration();
            case '?':
                return new HtmlToken.Comment(readUntil('>'));
            default:
                return scanText(new StringBuilder("<"));
        }
    }

    private HtmlToken scanStartTag() {
        String name = readName();
        MutableList<HtmlToken.Attribute> attributes = Lists.mutable.empty();
        boolean selfClosing = false;
        while (true) {
            skipWhitespace();
            int c = peek();
            if (c == -1) {
                break;
            }
            if (c == '>') {
                read();
                break;
            }
            if (c == '/') {
                read();
                if (peek() == '>') {
                    read();
                    selfClosing = true;
                    break;
                }
                continue;
            }
            attributes.add(readAttribute());
        }

        if (selfClosing) {
            return new HtmlToken.SelfClosingTag(name, attributes);
        }
        if (RAW_TEXT_ELEMENTS.contains(name)) {
            rawTextElement = name;
        }
        return new HtmlToken.StartTag(name, attributes);
    }

    private HtmlToken scanEndTag() {
        int c = peek();
        if (c == '>') {
            read();
            return null;
        }
        if (c == -1) {
            return scanText(new StringBuilder("</"));
        }
        if (!isLetter(c)) {
            return new HtmlToken.Comment(readUntil('>'));
        }
        String name = readName();
        // end tags carry no attributes worth keeping
        readUntil('>');
        return new HtmlToken.EndTag(name);
    }

    private HtmlToken scanDeclaration() {
        if (peek() == '-') {
            read();
            if (peek() == '-') {
                read();
                return new HtmlToken.Comment(readComment());
            }
            return new HtmlToken.Comment("-" + readUntil('>'));
        }
        String body = readUntil('>');
        if (body.regionMatches(true, 0, "doctype", 0, 7)) {
            return new HtmlToken.Doctype(body.substring(7).trim());
        }
        return new HtmlToken.Comment(body);
    }

    private HtmlToken scanText(StringBuilder sb) {
        int c;
        while ((c = peek()) != -1 && c != '<') {
            sb.append((char) read());
        }
        return new HtmlToken.Text(sb.toString());
    }

    private HtmlToken scanRawText() {
        String closing = "</" + rawTextElement;
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = read()) != -1) {
            sb.append((char) c);
            if (endsWithIgnoreCase(sb, closing) && isTagBoundary(peek())) {
                sb.setLength(sb.length() - closing.length());
                readUntil('>');
                pending.add(new HtmlToken.EndTag(rawTextElement));
                break;
            }
        }
        rawTextElement = null;

        if (sb.length() > 0) {
            return new HtmlToken.Text(sb.toString());
        }
        return pending.isEmpty() ? new HtmlToken.EndOfStream() : pending.poll();
    }

    private HtmlToken.Attribute readAttribute() {
        StringBuilder key = new StringBuilder();
        key.append((char) read());
        int c;
        while ((c = peek()) != -1 && !isWhitespace(c) && c != '/' && c != '>' && c != '=') {
            key.append((char) read());
        }
        skipWhitespace();

        String value = "";
        if (peek() == '=') {
            read();
            skipWhitespace();
            value = readAttributeValue();
        }
        return new HtmlToken.Attribute(key.toString().toLowerCase(Locale.ROOT), value);
    }

    private String readAttributeValue() {
        int c = peek();
        if (c == '"' || c == '\'') {
            read();
            return readUntil((char) c);
        }
        StringBuilder sb = new StringBuilder();
        while ((c = peek()) != -1 && !isWhitespace(c) && c != '>') {
            sb.append((char) read());
        }
        return sb.toString();
    }

    private String readName() {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = peek()) != -1 && !isWhitespace(c) && c != '/' && c != '>') {
            sb.append((char) read());
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private String readComment() {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = read()) != -1) {
            sb.append((char) c);
            int n = sb.length();
            if (n >= 3 && sb.charAt(n - 1) == '>' && sb.charAt(n - 2) == '-' && sb.charAt(n - 3) == '-') {
                sb.setLength(n - 3);
                break;
            }
        }
        return sb.toString();
    }

    /**
     * Consumes up to and including {@code end}; returns what came before it.
     */
    private String readUntil(char end) {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = read()) != -1 && c != end) {
            sb.append((char) c);
        }
        return sb.toString();
    }

    private void skipWhitespace() {
        while (isWhitespace(peek())) {
            read();
        }
    }

    private int peek() {
        if (lookahead == NONE) {
            lookahead = readChar();
        }
        return lookahead;
    }

    private int read() {
        int c = peek();
        lookahead = NONE;
        return c;
    }

    private int readChar() {
        if (exhausted) {
            return -1;
        }
        try {
            int c = reader.read();
            if (c == -1) {
                exhausted = true;
            }
            return c;
        } catch (IOException e) {
            failure = e;
            exhausted = true;
            LOG.fine(() -> "Token stream ended by read failure: " + e.getMessage());
            return -1;
        }
    }

    private static boolean endsWithIgnoreCase(StringBuilder sb, String suffix) {
        int offset = sb.length() - suffix.length();
        if (offset < 0) {
            return false;
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (Character.toLowerCase(sb.charAt(offset + i)) != suffix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTagBoundary(int c) {
        return c == -1 || c == '>' || c == '/' || isWhitespace(c);
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
