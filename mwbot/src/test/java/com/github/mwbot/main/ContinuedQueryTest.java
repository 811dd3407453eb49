package com.github.mwbot.main;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.mwbot.api.FakeTransport;
import com.github.mwbot.api.MwApiException;

class ContinuedQueryTest {
    private static final Map<String, Object> QUERY = Map.of(
        "action", "query", "list", "categorymembers", "cmtitle", "Category:Foo", "cmlimit", "max");

    private FakeTransport transport;
    private Mwbot mwb;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        mwb = new Mwbot(MwbotOptions.builder().apiUrl("https://wiki.example.org/w/api.php").silent(true).build(), transport);
    }

    private void respondWithEndlessContinuation() {
        var counter = new AtomicInteger();

        transport.otherwise(request -> {
            int n = counter.incrementAndGet();
            return new JSONObject()
                .put("continue", new JSONObject().put("continue", "-||").put("cmcontinue", "page|" + n))
                .put("query", new JSONObject().put("categorymembers", new JSONArray().put(n)));
        });
    }

    @Test
    void stopsAtCallLimit() {
        respondWithEndlessContinuation();

        var responses = mwb.continuedQuery(QUERY, 3).join();

        assertEquals(3, responses.size());
        assertEquals(3, transport.getRequests().size());

        for (int i = 0; i < 3; i++) {
            assertEquals(i + 1, responses.get(i).getJSONObject("query").getJSONArray("categorymembers").getInt(0));
        }
    }

    @Test
    void usesDefaultLimit() {
        respondWithEndlessContinuation();

        assertEquals(10, mwb.continuedQuery(QUERY).join().size());
    }

    @Test
    void mergesContinuationIntoNextRequest() {
        respondWithEndlessContinuation();

        mwb.continuedQuery(QUERY, 3).join();

        var requests = transport.getRequests();
        assertFalse(requests.get(0).getForm().containsKey("cmcontinue"));
        assertEquals("page|1", requests.get(1).getForm().get("cmcontinue"));
        assertEquals("page|2", requests.get(2).getForm().get("cmcontinue"));
        assertEquals("-||", requests.get(2).getForm().get("continue"));
        assertEquals("Category:Foo", requests.get(2).getForm().get("cmtitle"));
    }

    @Test
    void stopsWhenServerHasNoMoreResults() {
        transport
            .respond("{\"continue\":{\"cmcontinue\":\"x\",\"continue\":\"-||\"},\"query\":{}}")
            .respond("{\"batchcomplete\":true,\"query\":{}}");

        var responses = mwb.continuedQuery(QUERY, 5).join();

        assertEquals(2, responses.size());
        assertEquals(2, transport.getRequests().size());
    }

    @Test
    void failsOnError() {
        transport
            .respond("{\"continue\":{\"cmcontinue\":\"x\",\"continue\":\"-||\"},\"query\":{}}")
            .respond(FakeTransport.error("badcontinue", "Invalid continue param."));

        var e = assertThrows(CompletionException.class, () -> mwb.continuedQuery(QUERY, 5).join());

        var cause = assertInstanceOf(MwApiException.class, e.getCause());
        assertEquals("badcontinue", cause.getCode());
        assertEquals(2, transport.getRequests().size());
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> mwb.continuedQuery(QUERY, 0));
    }
}
