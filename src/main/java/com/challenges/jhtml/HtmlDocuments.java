package com.challenges.jhtml;

import com.challenges.jhtml.fetch.FetchException;
import com.challenges.jhtml.fetch.HtmlFetcher;
import com.challenges.jhtml.html.HtmlTokenizer;
import com.challenges.jhtml.tree.Node;
import com.challenges.jhtml.tree.TreeBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry points that tokenize a document and build its tree in one call.
 * Every method returns {@code null} when the document contains no element.
 */
public final class HtmlDocuments {

    private HtmlDocuments() {
    }

    public static Node parse(String html) {
        return new TreeBuilder().build(HtmlTokenizer.of(html));
    }

    /**
     * @throws IOException if {@code reader} fails before the end of the document
     */
    public static Node parse(Reader reader) throws IOException {
        HtmlTokenizer tokenizer = new HtmlTokenizer(reader);
        Node root = new TreeBuilder().build(tokenizer);
        Optional<IOException> failure = tokenizer.failure();
        if (failure.isPresent()) {
            throw failure.get();
        }
        return root;
    }

    public static Node parse(InputStream in, Charset charset) throws IOException {
        return parse(new InputStreamReader(in, charset));
    }

    public static Node parse(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static Node fetch(String url) throws FetchException {
        return DefaultFetcher.INSTANCE.fetch(url);
    }

    private static final class DefaultFetcher {
        static final HtmlFetcher INSTANCE = new HtmlFetcher();
    }
}
