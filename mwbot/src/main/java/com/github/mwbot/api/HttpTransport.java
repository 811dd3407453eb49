package com.github.mwbot.api;

import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Form-encoded HTTP transport with a per-instance cookie jar, so that a login survives
 * across calls of the same session.
 */
public class HttpTransport extends AbstractTransport {
    private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded; charset=UTF-8";

    private final Logger logger;
    private final HttpClient client;

    public HttpTransport() {
        this(HttpClient.newBuilder()
            .cookieHandler(new CookieManager())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    public HttpTransport(HttpClient client) {
        logger = Logger.getLogger("mwbot.transport");
        this.client = client;
    }

    @Override
    protected CompletableFuture<Object> dispatch(ApiRequest request) throws IOException {
        var options = request.getOptions();
        var method = options.getMethod().toUpperCase();
        var query = new LinkedHashMap<>(ParameterEncoder.preprocess(options.getQuery()));
        final HttpRequest.BodyPublisher body;

        if ("GET".equals(method)) {
            query.putAll(request.getForm());
            body = HttpRequest.BodyPublishers.noBody();
        } else {
            body = HttpRequest.BodyPublishers.ofString(ParameterEncoder.urlEncode(request.getForm()));
        }

        var builder = HttpRequest.newBuilder(appendQuery(options.getUri(), query))
            .timeout(options.getTimeout())
            .method(method, body);

        if (!"GET".equals(method)) {
            builder.header("Content-Type", FORM_CONTENT_TYPE);
        }

        options.getHeaders().forEach(builder::header);

        logger.logp(Level.FINE, "HttpTransport", "dispatch", request.toString());

        return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
            .thenApply(HttpResponse::body)
            .thenApply(HttpTransport::decode)
            .exceptionallyCompose(HttpTransport::toIOException);
    }

    /**
     * Decodes a response body. JSON objects and arrays are parsed, anything else is
     * handed back as the raw string for the caller to reject.
     */
    public static Object decode(String body) {
        var trimmed = StringUtils.trimToEmpty(body);

        try {
            if (trimmed.startsWith("{")) {
                return new JSONObject(trimmed);
            } else if (trimmed.startsWith("[")) {
                return new JSONArray(trimmed);
            }
        } catch (JSONException e) {
            return body;
        }

        return body;
    }

    private static URI appendQuery(URI uri, Map<String, String> query) {
        if (query.isEmpty()) {
            return uri;
        }

        var separator = uri.getRawQuery() == null ? "?" : "&";
        return URI.create(uri.toString() + separator + ParameterEncoder.urlEncode(query));
    }

    private static CompletableFuture<Object> toIOException(Throwable t) {
        var cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;

        if (cause instanceof IOException) {
            return CompletableFuture.failedFuture(cause);
        } else {
            return CompletableFuture.failedFuture(new IOException(cause.getMessage(), cause));
        }
    }
}
