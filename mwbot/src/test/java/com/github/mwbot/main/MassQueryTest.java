package com.github.mwbot.main;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.mwbot.api.FakeTransport;
import com.github.mwbot.api.MwApiException;

class MassQueryTest {
    private FakeTransport transport;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
    }

    private Mwbot newBot(boolean highLimit) {
        var options = MwbotOptions.builder()
            .apiUrl("https://wiki.example.org/w/api.php")
            .hasApiHighLimit(highLimit)
            .silent(true)
            .build();
        return new Mwbot(options, transport);
    }

    private static List<String> titles(int count) {
        return IntStream.range(0, count).mapToObj(i -> "Page " + i).collect(Collectors.toList());
    }

    private List<Integer> chunkSizes(String field) {
        return transport.getRequests().stream()
            .map(r -> r.getForm().get(field).split("\\|").length)
            .collect(Collectors.toList());
    }

    @Test
    void splitsIntoHighLimitChunks() {
        transport.otherwise(request -> new JSONObject("{\"query\":{}}"));

        var outcomes = newBot(true).massQuery(Map.of("action", "query", "titles", titles(1050))).join();

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.stream().allMatch(o -> o.isSuccess()));
        assertEquals(List.of(500, 500, 50), chunkSizes("titles"));
        assertTrue(transport.getRequests().get(2).getForm().get("titles").startsWith("Page 1000|"));
    }

    @Test
    void splitsIntoLowLimitChunks() {
        transport.otherwise(request -> new JSONObject("{\"query\":{}}"));

        var query = Map.<String, Object>of("action", "query", "pageids", IntStream.range(1, 121).toArray());
        var outcomes = newBot(false).massQuery(query, "pageids").join();

        assertEquals(3, outcomes.size());
        assertEquals(List.of(50, 50, 20), chunkSizes("pageids"));
    }

    @Test
    void recordsFailedChunkAndContinues() {
        transport
            .respond("{\"query\":{\"n\":1}}")
            .respond(FakeTransport.error("internal_api_error_DBQueryError", "Database query error."))
            .respond("{\"query\":{\"n\":3}}");

        var outcomes = newBot(false).massQuery(Map.of("action", "query", "titles", titles(120))).join();

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertFalse(outcomes.get(1).isSuccess());
        assertTrue(outcomes.get(2).isSuccess());
        assertEquals(3, outcomes.get(2).getResponse().getJSONObject("query").getInt("n"));

        var error = assertInstanceOf(MwApiException.class, outcomes.get(1).getError());
        assertEquals("internal_api_error_DBQueryError", error.getCode());
    }

    @Test
    void tooManyValuesIsFatal() {
        transport
            .respond("{\"query\":{}}")
            .respond(FakeTransport.error("toomanyvalues", "Too many values supplied for parameter \"titles\"."));

        var future = newBot(true).massQuery(Map.of("action", "query", "titles", titles(1050)));
        var e = assertThrows(CompletionException.class, future::join);

        assertInstanceOf(MwbotConfigurationException.class, e.getCause());
        assertInstanceOf(MwApiException.class, e.getCause().getCause());
        assertEquals(2, transport.getRequests().size());
    }

    @Test
    void finishesManyChunksAnsweredSynchronously() throws Exception {
        transport.otherwise(request -> new JSONObject("{\"query\":{}}"));

        var outcomes = newBot(false).massQuery(Map.of("action", "query", "titles", titles(400_000)))
            .get(30, TimeUnit.SECONDS);

        assertEquals(8_000, outcomes.size());
        assertTrue(outcomes.stream().allMatch(o -> o.isSuccess()));
        assertEquals(8_000, transport.getRequests().size());
    }

    @Test
    void emptyListSendsNothing() {
        var outcomes = newBot(true).massQuery(Map.of("action", "query", "titles", new ArrayList<String>())).join();

        assertTrue(outcomes.isEmpty());
        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    void rejectsScalarBatchField() {
        var mwb = newBot(true);

        assertThrows(IllegalArgumentException.class, () -> mwb.massQuery(Map.of("action", "query", "titles", "Foo")));
    }
}
