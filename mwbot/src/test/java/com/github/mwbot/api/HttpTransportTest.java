package com.github.mwbot.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.mwbot.main.Mwbot;
import com.github.mwbot.main.MwbotOptions;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

class HttpTransportTest {
    private HttpServer server;
    private URI apiUrl;

    private final AtomicReference<String> method = new AtomicReference<>();
    private final AtomicReference<String> query = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();
    private final AtomicReference<String> contentType = new AtomicReference<>();
    private final AtomicReference<String> userAgent = new AtomicReference<>();
    private volatile String responseBody = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/w/api.php", this::handle);
        server.start();
        apiUrl = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/w/api.php");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        method.set(exchange.getRequestMethod());
        query.set(exchange.getRequestURI().getRawQuery());
        body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
        userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));

        var bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length);

        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> form(String... pairs) {
        var map = new LinkedHashMap<String, String>();

        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }

        return map;
    }

    @Test
    void postsFormEncodedBody() {
        responseBody = "{\"query\":{\"general\":{\"sitename\":\"Test\"}}}";
        var transport = new HttpTransport();
        var options = RequestOptions.defaults().withUri(apiUrl).withHeader("User-Agent", "test agent");

        var response = transport.send(new ApiRequest(form("action", "query", "titles", "A b|C&d"), options)).join();

        assertEquals("Test", ((JSONObject) response).getJSONObject("query").getJSONObject("general").getString("sitename"));
        assertEquals("POST", method.get());
        assertNull(query.get());
        assertEquals("action=query&titles=A+b%7CC%26d", body.get());
        assertTrue(contentType.get().startsWith("application/x-www-form-urlencoded"));
        assertEquals("test agent", userAgent.get());
        assertEquals(1, transport.getStatistics().getFulfilled());
    }

    @Test
    void getAppendsFormToQueryString() {
        var options = RequestOptions.empty().withUri(apiUrl).withMethod("GET").withQueryParam("origin", "*");

        new HttpTransport().send(new ApiRequest(form("action", "query"), options)).join();

        assertEquals("GET", method.get());
        assertEquals("origin=*&action=query", query.get());
        assertEquals("", body.get());
    }

    @Test
    void returnsUndecodableBodyAsString() {
        responseBody = "<!DOCTYPE html><html>Wiki down</html>";

        var response = new HttpTransport().send(new ApiRequest(form("action", "query"), RequestOptions.defaults().withUri(apiUrl))).join();

        assertEquals("<!DOCTYPE html><html>Wiki down</html>", response);
    }

    @Test
    void connectionFailureIsIOException() {
        var unreachable = URI.create("http://127.0.0.1:1/w/api.php");
        var transport = new HttpTransport();

        var e = assertThrows(CompletionException.class,
            () -> transport.send(new ApiRequest(form("action", "query"), RequestOptions.defaults().withUri(unreachable))).join());

        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(1, transport.getStatistics().getRejected());
    }

    @Test
    void decodesJson() {
        assertInstanceOf(JSONObject.class, HttpTransport.decode(" {\"a\":1}\n"));
        assertInstanceOf(JSONArray.class, HttpTransport.decode("[1,2]"));
        assertEquals("{broken", HttpTransport.decode("{broken"));
        assertEquals("", HttpTransport.decode(""));
    }

    @Test
    void engineRejectsHtmlResponse() {
        responseBody = "<html>Service unavailable</html>";
        var mwb = new Mwbot(MwbotOptions.builder().apiUrl(apiUrl).silent(true).build());

        var e = assertThrows(CompletionException.class, () -> mwb.request(Map.of("action", "query")).join());

        assertEquals(InvalidResponseException.CODE, assertInstanceOf(InvalidResponseException.class, e.getCause()).getCode());
        assertTrue(body.get().contains("format=json"));
        assertTrue(body.get().contains("formatversion=2"));
    }
}
