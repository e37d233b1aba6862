package com.challenges.jhtml.fetch;

import com.challenges.jhtml.html.HtmlTokenizer;
import com.challenges.jhtml.tree.Node;
import com.challenges.jhtml.tree.TreeBuilder;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Downloads a document over HTTP and builds its tree while the body streams in.
 */
public class HtmlFetcher {
    private static final Logger LOG = Logger.getLogger(HtmlFetcher.class.getName());

    private final FetchSettings settings;
    private final OkHttpClient client;
    private final TreeBuilder builder = new TreeBuilder();

    public HtmlFetcher() {
        this(FetchSettings.defaults());
    }

    public HtmlFetcher(FetchSettings settings) {
        this(settings, new OkHttpClient.Builder()
                .connectTimeout(settings.connectTimeout())
                .readTimeout(settings.readTimeout())
                .callTimeout(settings.callTimeout())
                .build());
    }

    public HtmlFetcher(FetchSettings settings, OkHttpClient client) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    /**
     * @return the root element of the page, or {@code null} if the body contains no element
     * @throws FetchException if the URL is invalid, the request fails, the server answers with a
     *                        non-2xx status or the body cannot be read to the end
     */
    public Node fetch(String url) throws FetchException {
        HttpUrl httpUrl = url == null ? null : HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new FetchException("Not an http(s) URL: " + url, url, FetchException.NO_STATUS, null);
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .header("User-Agent", settings.userAgent())
                .get()
                .build();

        LOG.fine(() -> "GET " + httpUrl);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new FetchException("HTTP " + response.code() + " - " + response.message(),
                        url, response.code(), null);
            }
            ResponseBody body = response.body();
            if (body == null) {
                return null;
            }

            HtmlTokenizer tokenizer = new HtmlTokenizer(body.charStream());
            Node root = builder.build(tokenizer);
            Optional<IOException> failure = tokenizer.failure();
            if (failure.isPresent()) {
                throw new FetchException("Failed to read body of " + url + ": " + failure.get().getMessage(),
                        url, response.code(), failure.get());
            }
            LOG.fine(() -> "Parsed " + url + " (HTTP " + response.code() + ")");
            return root;
        } catch (IOException e) {
            throw new FetchException("Request to " + url + " failed: " + e.getMessage(),
                    url, FetchException.NO_STATUS, e);
        }
    }
}
