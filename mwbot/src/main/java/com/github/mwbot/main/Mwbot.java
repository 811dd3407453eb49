package com.github.mwbot.main;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.security.auth.login.CredentialNotFoundException;
import javax.security.auth.login.FailedLoginException;

import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;
import org.json.JSONObject;

import com.github.mwbot.api.ApiRequest;
import com.github.mwbot.api.CallStatistics;
import com.github.mwbot.api.ChunkOutcome;
import com.github.mwbot.api.HttpTransport;
import com.github.mwbot.api.InvalidResponseException;
import com.github.mwbot.api.MwApiException;
import com.github.mwbot.api.ParameterEncoder;
import com.github.mwbot.api.RequestOptions;
import com.github.mwbot.api.Transport;
import com.github.mwbot.batch.BatchOperation;
import com.github.mwbot.batch.BatchProgress;
import com.github.mwbot.batch.BatchResult;
import com.github.mwbot.batch.BatchWorker;
import com.github.mwbot.batch.SeriesBatchOperation;
import com.github.mwbot.title.NamespaceTable;
import com.github.mwbot.utils.PageContainer;

/**
 * Client session of a MediaWiki API endpoint. One instance owns its token, login record,
 * namespace table and call statistics; create one instance per wiki and account.
 * <p>
 * Every call is asynchronous. Stale tokens ({@code badtoken}) and replication lag
 * ({@code maxlag}) are recovered from transparently, any other API error fails the
 * returned future with a {@link MwApiException}.
 */
public class Mwbot {
    public static final String BADTOKEN = "badtoken";
    public static final String MAXLAG = "maxlag";
    public static final String TOOMANYVALUES = "toomanyvalues";

    private static final String SITEINFO_PROPS = "general|namespaces|namespacealiases";

    private final Logger logger;
    private final Transport transport;
    private final SessionState session = new SessionState();
    private final NamespaceTable namespaces = new NamespaceTable();

    private volatile MwbotOptions options;
    private volatile RequestOptions requestOptions;

    public Mwbot(MwbotOptions options, Transport transport) {
        logger = Logger.getLogger("mwbot");
        this.transport = Objects.requireNonNull(transport);
        this.options = Objects.requireNonNull(options);
        requestOptions = RequestOptions.defaults().withHeader("User-Agent", options.getUserAgent());
    }

    public Mwbot(MwbotOptions options) {
        this(options, new HttpTransport());
    }

    public static Mwbot newSession(String apiUrl) {
        return new Mwbot(MwbotOptions.builder().apiUrl(apiUrl).build());
    }

    /* configuration */

    public MwbotOptions getOptions() {
        return options;
    }

    public void setOptions(MwbotOptions customOptions) {
        options = options.merge(customOptions);
    }

    public void setApiUrl(String apiUrl) {
        setOptions(MwbotOptions.builder().apiUrl(apiUrl).build());
    }

    public RequestOptions getRequestOptions() {
        return requestOptions;
    }

    public void setRequestOptions(RequestOptions customRequestOptions) {
        requestOptions = requestOptions.merge(customRequestOptions);
    }

    public void setDefaultParams(Map<String, ?> params) {
        requestOptions = requestOptions.withFormParams(params);
    }

    /**
     * See <a href="https://meta.wikimedia.org/wiki/User-Agent_policy">User-Agent policy</a>,
     * required on Wikimedia wikis.
     */
    public void setUserAgent(String userAgent) {
        requestOptions = requestOptions.withHeader("User-Agent", userAgent);
    }

    public SessionState getSession() {
        return session;
    }

    public NamespaceTable getNamespaces() {
        return namespaces;
    }

    public CallStatistics getStatistics() {
        return transport.getStatistics();
    }

    /* core requests */

    public CompletableFuture<JSONObject> request(Map<String, ?> params) {
        return request(params, null);
    }

    /**
     * Sends an API request. Options are combined as defaults, then instance options, then
     * {@code customRequestOptions}; {@code params} override the default form parameters.
     *
     * @param params API parameters; sequences are pipe-joined, {@code false} and {@code null} are omitted
     * @param customRequestOptions per-call transport options, may be {@code null}
     * @return the decoded response object
     */
    public CompletableFuture<JSONObject> request(Map<String, ?> params, RequestOptions customRequestOptions) {
        var opts = RequestOptions.empty()
            .withUri(options.getApiUrl())
            .merge(requestOptions)
            .merge(customRequestOptions);

        var form = new LinkedHashMap<String, Object>(opts.getForm());

        if (params != null) {
            form.putAll(params);
        }

        var request = new ApiRequest(ParameterEncoder.preprocess(form), opts);
        return new RequestExecution(request).start();
    }

    /**
     * Drives one logical request through its attempts. Attempts never overlap: the next
     * one is dispatched from the completion of the previous one.
     */
    private final class RequestExecution {
        private final CompletableFuture<JSONObject> result = new CompletableFuture<>();
        private ApiRequest current;
        private int tokenRefreshes;

        RequestExecution(ApiRequest request) {
            current = request;
        }

        CompletableFuture<JSONObject> start() {
            dispatch();
            return result;
        }

        private void dispatch() {
            transport.send(current).whenComplete((body, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                    return;
                }

                try {
                    classify(body);
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        }

        private void classify(Object body) {
            if (!(body instanceof JSONObject response)) {
                result.completeExceptionally(new InvalidResponseException(body, current));
                return;
            }

            var error = response.optJSONObject("error");

            if (error == null) {
                result.complete(response);
                return;
            }

            var code = error.optString("code");

            if (BADTOKEN.equals(code) && tokenRefreshes < options.getBadtokenMaxRetries()) {
                tokenRefreshes++;
                refreshTokenAndResend();
            } else if (MAXLAG.equals(code) && current.getRetryNumber() < options.getMaxlagMaxRetries()) {
                var pause = options.getMaxlagPause();
                log(Level.WARNING, "request", String.format(
                    "Encountered maxlag error, waiting for %d seconds before retrying", pause.toSeconds()));
                current = current.nextRetry();
                var executor = CompletableFuture.delayedExecutor(pause.toMillis(), TimeUnit.MILLISECONDS);
                CompletableFuture.runAsync(this::dispatch, executor);
            } else {
                result.completeExceptionally(MwApiException.fromErrorResponse(response, current));
            }
        }

        private void refreshTokenAndResend() {
            log(Level.WARNING, "request", "Encountered badtoken error, fetching a new token");

            getCsrfToken().whenComplete((token, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    current = current.withToken(token);
                    dispatch();
                }
            });
        }
    }

    /* session */

    public CompletableFuture<Map<String, Object>> login(String username, String password) {
        setOptions(MwbotOptions.builder().credentials(username, password).build());
        return login();
    }

    /**
     * Logs in with the configured bot password. The login token request also fetches
     * siteinfo, which replaces the namespace table of this session.
     *
     * @return the login record
     */
    public CompletableFuture<Map<String, Object>> login() {
        var opts = options;

        if (opts.getUsername() == null || opts.getPassword() == null || opts.getApiUrl() == null) {
            return CompletableFuture.failedFuture(new CredentialNotFoundException("Incomplete login credentials!"));
        }

        var loginString = opts.getUsername() + "@" + StringUtils.remove(opts.getApiUrl().toString(), "/api.php");

        var tokenParams = new LinkedHashMap<String, Object>();
        tokenParams.put("action", "query");
        tokenParams.put("meta", "tokens|siteinfo");
        tokenParams.put("type", "login");
        tokenParams.put("siprop", SITEINFO_PROPS);
        // assertions fail until logged in
        tokenParams.put("assert", null);

        return request(tokenParams).thenCompose(response -> {
            var tokens = path(response, "query", "tokens");

            if (tokens == null || !tokens.has("logintoken")) {
                log(Level.SEVERE, "login", "Login failed with invalid response: " + loginString);
                return CompletableFuture.<JSONObject>failedFuture(new FailedLoginException("Failed to get login token"));
            }

            session.mergeState(tokens);
            namespaces.processNamespaceData(response);

            var loginParams = new LinkedHashMap<String, Object>();
            loginParams.put("action", "login");
            loginParams.put("lgname", opts.getUsername());
            loginParams.put("lgpassword", opts.getPassword());
            loginParams.put("lgtoken", tokens.getString("logintoken"));
            loginParams.put("assert", null);
            return request(loginParams);
        }).thenCompose(response -> {
            var login = response.optJSONObject("login");

            if (login != null && "Success".equals(login.optString("result"))) {
                session.mergeState(login);
                session.setLoggedIn(true);
                log(Level.INFO, "login", "Login successful: " + loginString);
                return CompletableFuture.completedFuture(session.getState());
            }

            var reason = login != null && login.has("result") ? login.getString("result") : "Unknown reason";
            log(Level.SEVERE, "login", "Login failed: " + loginString);
            return CompletableFuture.<Map<String, Object>>failedFuture(new FailedLoginException("Could not login: " + reason));
        });
    }

    public CompletableFuture<String> loginGetToken() {
        return login().thenCompose(state -> getCsrfToken());
    }

    public CompletableFuture<JSONObject> logout() {
        return request(Map.of("action", "logout", "token", session.getCsrfToken())).thenApply(response -> {
            session.setLoggedIn(false);
            return response;
        });
    }

    /**
     * Fetches an edit token, also valid for most other write actions.
     */
    public CompletableFuture<String> getCsrfToken() {
        return request(Map.of("action", "query", "meta", "tokens", "type", "csrf")).thenCompose(response -> {
            var tokens = path(response, "query", "tokens");

            if (tokens == null || !tokens.has("csrftoken")) {
                return CompletableFuture.<String>failedFuture(
                    new MwApiException("notoken", "Could not get edit token", response, null));
            }

            session.setCsrfToken(tokens.getString("csrftoken"));
            session.mergeState(tokens);
            return CompletableFuture.completedFuture(session.getCsrfToken());
        });
    }

    /**
     * Loads namespace data without logging in.
     */
    public CompletableFuture<JSONObject> getSiteInfo() {
        return request(Map.of("action", "query", "meta", "siteinfo", "siprop", SITEINFO_PROPS)).thenApply(response -> {
            namespaces.processNamespaceData(response);
            return response;
        });
    }

    public CompletableFuture<String> getServerTime() {
        return request(Map.of("action", "query", "curtimestamp", 1))
            .thenApply(response -> response.getString("curtimestamp"));
    }

    /* bulk processing */

    public CompletableFuture<List<JSONObject>> continuedQuery(Map<String, ?> query) {
        return continuedQuery(query, options.getContinuedQueryLimit());
    }

    /**
     * Sends a query and keeps following its continuation until the server reports no
     * more results or {@code limit} calls have been made. Any failed call fails the whole
     * sequence.
     *
     * @param query the API query
     * @param limit maximum number of API calls
     * @return responses of the individual calls, in call order
     */
    public CompletableFuture<List<JSONObject>> continuedQuery(Map<String, ?> query, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }

        return continuedQuery(new LinkedHashMap<String, Object>(query), 1, limit, new ArrayList<>());
    }

    private CompletableFuture<List<JSONObject>> continuedQuery(Map<String, Object> query, int count, int limit,
            List<JSONObject> responses) {
        return request(query).thenCompose(response -> {
            log(Level.INFO, "continuedQuery", "Got part " + count + " of continuous API query");
            responses.add(response);

            var cont = response.optJSONObject("continue");

            if (cont != null && count < limit) {
                var next = new LinkedHashMap<>(query);

                for (var key : cont.keySet()) {
                    next.put(key, cont.get(key));
                }

                return continuedQuery(next, count + 1, limit, responses);
            }

            return CompletableFuture.completedFuture(responses);
        });
    }

    public CompletableFuture<List<ChunkOutcome>> massQuery(Map<String, ?> query) {
        return massQuery(query, "titles");
    }

    /**
     * Sends a query whose multi-value field holds more values than one call accepts
     * (500 with apihighlimits, 50 otherwise). The values are split into consecutive
     * chunks, sent one chunk after another.
     * <p>
     * A chunk that fails is recorded in its slot. A {@code toomanyvalues} error means the
     * account lacks apihighlimits and fails the whole operation with a
     * {@link MwbotConfigurationException}.
     *
     * @param query the API query, {@code batchFieldName} holding a collection or array
     * @param batchFieldName name of the multi-value field
     * @return one outcome per chunk, in input order
     */
    public CompletableFuture<List<ChunkOutcome>> massQuery(Map<String, ?> query, String batchFieldName) {
        var values = query.get(batchFieldName);

        if (!ParameterEncoder.isSequence(values)) {
            throw new IllegalArgumentException("Multi-value field " + batchFieldName + " must hold a sequence");
        }

        var chunks = ListUtils.partition(new ArrayList<Object>(ParameterEncoder.asList(values)), options.getBatchSize());
        var outcomes = new ArrayList<ChunkOutcome>(chunks.size());
        var result = new CompletableFuture<List<ChunkOutcome>>();

        sendChunks(new LinkedHashMap<String, Object>(query), batchFieldName, chunks, 0, outcomes, result);
        return result;
    }

    /**
     * Sends the chunks from {@code from} onwards, one after another. Chunks answered
     * synchronously are recorded in place; a pending chunk resumes the loop from its completion.
     */
    private void sendChunks(Map<String, Object> query, String batchFieldName, List<List<Object>> chunks, int from,
            List<ChunkOutcome> outcomes, CompletableFuture<List<ChunkOutcome>> result) {
        for (int idx = from; idx < chunks.size(); idx++) {
            final int next = idx + 1;
            var chunkQuery = new LinkedHashMap<>(query);
            chunkQuery.put(batchFieldName, chunks.get(idx));

            var recorded = request(chunkQuery)
                .handle((response, error) -> recordChunk(next, chunks.size(), response, error, outcomes, result))
                .exceptionally(failure -> {
                    result.completeExceptionally(unwrap(failure));
                    return false;
                });

            if (!recorded.isDone()) {
                recorded.thenAccept(proceed -> {
                    if (proceed) {
                        sendChunks(query, batchFieldName, chunks, next, outcomes, result);
                    }
                });
                return;
            }

            if (!recorded.join()) {
                return;
            }
        }

        result.complete(outcomes);
    }

    /**
     * @return {@code false} if the error aborted the whole mass query
     */
    private boolean recordChunk(int number, int total, JSONObject response, Throwable error, List<ChunkOutcome> outcomes,
            CompletableFuture<List<ChunkOutcome>> result) {
        if (error == null) {
            outcomes.add(ChunkOutcome.success(response));
            return true;
        }

        var cause = unwrap(error);

        if (cause instanceof MwApiException e && TOOMANYVALUES.equals(e.getCode())) {
            result.completeExceptionally(new MwbotConfigurationException(
                "Your account doesn't have apihighlimit right. Set the option hasApiHighLimit as false", e));
            return false;
        }

        log(Level.WARNING, "massQuery", String.format("Chunk %d of %d failed: %s", number, total, cause.getMessage()));
        outcomes.add(ChunkOutcome.failure(cause));
        return true;
    }

    public <T> CompletableFuture<BatchResult> batchOperation(List<? extends T> list, BatchWorker<? super T> worker) {
        return batchOperation(list, worker, options.getBatchConcurrency());
    }

    /**
     * Runs {@code worker} over {@code list} with at most {@code concurrency} items in flight.
     * Worker failures are counted, not propagated.
     *
     * @throws IllegalStateException the worker returned {@code null} for an item of the first group
     */
    public <T> CompletableFuture<BatchResult> batchOperation(List<? extends T> list, BatchWorker<? super T> worker,
            int concurrency) {
        return BatchOperation.run(list, worker, concurrency, progressLogger("batchOperation"));
    }

    public <T> CompletableFuture<BatchResult> seriesBatchOperation(List<? extends T> list, BatchWorker<? super T> worker) {
        return seriesBatchOperation(list, worker, options.getSeriesDelay());
    }

    /**
     * Runs {@code worker} over {@code list} one item at a time, waiting {@code delay}
     * between items.
     *
     * @throws IllegalStateException the worker returned {@code null} for the first item
     */
    public <T> CompletableFuture<BatchResult> seriesBatchOperation(List<? extends T> list, BatchWorker<? super T> worker,
            Duration delay) {
        return SeriesBatchOperation.run(list, worker, delay, progressLogger("seriesBatchOperation"));
    }

    private Consumer<BatchProgress> progressLogger(String method) {
        return progress -> log(Level.INFO, method, progress.toStatusText());
    }

    /* pages */

    public CompletableFuture<JSONObject> save(String title, String content, String summary) {
        return save(title, content, summary, null);
    }

    /**
     * Edits a page without loading it first. No edit conflict detection.
     */
    public CompletableFuture<JSONObject> save(String title, String content, String summary, Map<String, ?> options) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "edit");
        params.put("title", title);
        params.put("text", content);
        params.put("summary", summary);
        params.put("token", session.getCsrfToken());
        putAll(params, options);
        return request(params).thenApply(data -> data.getJSONObject("edit"));
    }

    public CompletableFuture<JSONObject> create(String title, String content, String summary, Map<String, ?> options) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "edit");
        params.put("title", title);
        params.put("text", content);
        params.put("summary", summary);
        params.put("createonly", true);
        params.put("token", session.getCsrfToken());
        putAll(params, options);
        return request(params).thenApply(data -> data.getJSONObject("edit"));
    }

    public CompletableFuture<JSONObject> newSection(String title, String header, String message,
            Map<String, ?> additionalParams) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "edit");
        params.put("title", title);
        params.put("section", "new");
        params.put("summary", header);
        params.put("text", message);
        params.put("token", session.getCsrfToken());
        putAll(params, additionalParams);
        return request(params).thenApply(data -> data.getJSONObject("edit"));
    }

    /**
     * Loads the current revision of a page, applies {@code transform} to it and saves the
     * result, guarded against edit conflicts by the base and start timestamps.
     *
     * @param title page title
     * @param transform maps the current revision to the edit parameters, e.g. {@code text}
     * and {@code summary}
     * @return the {@code edit} part of the response
     */
    public CompletableFuture<JSONObject> edit(String title, Function<PageContainer, ? extends Map<String, ?>> transform) {
        var query = new LinkedHashMap<String, Object>();
        query.put("action", "query");
        query.put("prop", "revisions");
        query.put("rvprop", List.of("content", "timestamp"));
        query.put("rvslots", "main");
        query.put("formatversion", "2");
        query.put("curtimestamp", true);
        query.put("titles", title);

        return request(query).thenCompose(data -> {
            var pages = path(data, "query") != null ? data.getJSONObject("query").optJSONArray("pages") : null;

            if (pages == null || pages.isEmpty()) {
                return CompletableFuture.<JSONObject>failedFuture(new MwApiException("unknown", "No pages in response", data, null));
            }

            var page = pages.getJSONObject(0);

            if (page.optBoolean("invalid")) {
                return CompletableFuture.<JSONObject>failedFuture(new MwApiException("invalidtitle", "Invalid title: " + title, data, null));
            }

            if (page.optBoolean("missing")) {
                return CompletableFuture.<JSONObject>failedFuture(new MwApiException("nocreate-missing", "Page does not exist: " + title, data, null));
            }

            var current = PageContainer.fromQueryPage(page, data.optString("curtimestamp", null));

            var params = new LinkedHashMap<String, Object>();
            params.put("action", "edit");
            params.put("formatversion", "2");
            params.putAll(current.conflictGuard());
            params.put("nocreate", true);
            params.put("token", session.getCsrfToken());
            params.put("title", title);
            putAll(params, transform.apply(current));
            return request(params);
        }).thenApply(data -> data.getJSONObject("edit"));
    }

    public CompletableFuture<List<JSONObject>> read(List<String> titles, Map<String, ?> options) {
        return read(titles, "titles", options);
    }

    public CompletableFuture<List<JSONObject>> readByIds(List<Long> pageids, Map<String, ?> options) {
        return read(pageids, "pageids", options);
    }

    private CompletableFuture<List<JSONObject>> read(List<?> pages, String field, Map<String, ?> options) {
        var query = new LinkedHashMap<String, Object>();
        query.put("action", "query");
        query.put("prop", "revisions");
        query.put("rvprop", "content");
        query.put("redirects", "1");
        query.put(field, pages);
        putAll(query, options);

        return massQuery(query, field).thenCompose(outcomes -> {
            List<JSONObject> list = new ArrayList<>();

            for (var outcome : outcomes) {
                if (!outcome.isSuccess()) {
                    return CompletableFuture.<List<JSONObject>>failedFuture(outcome.getError());
                }

                var arr = outcome.getResponse().getJSONObject("query").getJSONArray("pages");

                for (int i = 0; i < arr.length(); i++) {
                    list.add(arr.getJSONObject(i));
                }
            }

            return CompletableFuture.completedFuture(list);
        });
    }

    public CompletableFuture<JSONObject> delete(String title, String summary, Map<String, ?> options) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "delete");
        params.put("title", title);
        params.put("reason", summary);
        params.put("token", session.getCsrfToken());
        putAll(params, options);
        return request(params).thenApply(data -> data.getJSONObject("delete"));
    }

    /**
     * Restores all deleted revisions of a page.
     */
    public CompletableFuture<JSONObject> undelete(String title, String summary, Map<String, ?> options) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "undelete");
        params.put("title", title);
        params.put("reason", summary);
        params.put("token", session.getCsrfToken());
        putAll(params, options);
        return request(params).thenApply(data -> data.getJSONObject("undelete"));
    }

    public CompletableFuture<JSONObject> move(String fromtitle, String totitle, String summary, Map<String, ?> options) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "move");
        params.put("from", fromtitle);
        params.put("to", totitle);
        params.put("reason", summary);
        params.put("movetalk", 1);
        params.put("token", session.getCsrfToken());
        putAll(params, options);
        return request(params).thenApply(data -> data.getJSONObject("move"));
    }

    public CompletableFuture<Object> purge(List<String> titles, Map<String, ?> options) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "purge");
        params.put("titles", titles);
        putAll(params, options);
        return request(params).thenApply(data -> data.get("purge"));
    }

    public CompletableFuture<JSONObject> rollback(String page, String user, Map<String, ?> options) {
        return request(Map.of("action", "query", "meta", "tokens", "type", "rollback")).thenCompose(data -> {
            var params = new LinkedHashMap<String, Object>();
            params.put("action", "rollback");
            params.put("title", page);
            params.put("user", user);
            params.put("token", data.getJSONObject("query").getJSONObject("tokens").getString("rollbacktoken"));
            putAll(params, options);
            return request(params);
        }).thenApply(data -> data.getJSONObject("rollback"));
    }

    public CompletableFuture<String> parseWikitext(String content, Map<String, ?> additionalParams) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "parse");
        params.put("text", content);
        params.put("formatversion", 2);
        params.put("contentmodel", "wikitext");
        putAll(params, additionalParams);
        return request(params).thenApply(data -> data.getJSONObject("parse").getString("text"));
    }

    public CompletableFuture<String> parseTitle(String title, Map<String, ?> additionalParams) {
        var params = new LinkedHashMap<String, Object>();
        params.put("action", "parse");
        params.put("page", title);
        params.put("formatversion", 2);
        params.put("contentmodel", "wikitext");
        putAll(params, additionalParams);
        return request(params).thenApply(data -> data.getJSONObject("parse").getString("text"));
    }

    /**
     * @return titles of the first batch of pages starting with {@code prefix}
     * @throws IllegalArgumentException the prefix is not a valid title
     */
    public CompletableFuture<List<String>> getPagesByPrefix(String prefix, Map<String, ?> otherParams) {
        var title = namespaces.newFromText(prefix);

        if (title == null) {
            throw new IllegalArgumentException("invalid prefix for getPagesByPrefix: " + prefix);
        }

        var params = new LinkedHashMap<String, Object>();
        params.put("action", "query");
        params.put("list", "allpages");
        params.put("apprefix", title.getMain());
        params.put("apnamespace", title.getNamespace());
        params.put("aplimit", "max");
        putAll(params, otherParams);

        return request(params).thenApply(data -> {
            var pages = data.getJSONObject("query").getJSONArray("allpages");
            var titles = new ArrayList<String>(pages.length());

            for (int i = 0; i < pages.length(); i++) {
                titles.add(pages.getJSONObject(i).getString("title"));
            }

            return titles;
        });
    }

    /**
     * @param category category name, the namespace prefix is optional
     * @throws IllegalArgumentException the name is not a valid title
     */
    public CompletableFuture<JSONObject> getPagesInCategory(String category, Map<String, ?> otherParams) {
        var title = namespaces.newFromText(category);

        if (title == null) {
            throw new IllegalArgumentException("invalid category name: " + category);
        }

        if (title.getNamespace() == NamespaceTable.MAIN_NAMESPACE) {
            title = title.inNamespace(NamespaceTable.CATEGORY_NAMESPACE);
        }

        var params = new LinkedHashMap<String, Object>();
        params.put("action", "query");
        params.put("list", "categorymembers");
        params.put("cmtitle", title.toText());
        params.put("cmlimit", "max");
        putAll(params, otherParams);
        return request(params);
    }

    /* supplementary */

    /**
     * Runs a Semantic MediaWiki ASK query. The response is not classified.
     */
    public CompletableFuture<Object> askQuery(String query, URI apiUrl, RequestOptions customRequestOptions) {
        var opts = RequestOptions.get(apiUrl != null ? apiUrl : options.getApiUrl())
            .withHeader("User-Agent", options.getUserAgent())
            .withQueryParam("action", "ask")
            .withQueryParam("format", "json")
            .withQueryParam("query", query)
            .merge(customRequestOptions);

        return transport.send(new ApiRequest(Map.of(), opts));
    }

    /**
     * Runs a SPARQL query, e.g. against the Wikidata query service. The response is not classified.
     */
    public CompletableFuture<Object> sparqlQuery(String query, URI endpointUrl, RequestOptions customRequestOptions) {
        var opts = RequestOptions.get(endpointUrl != null ? endpointUrl : options.getApiUrl())
            .withHeader("User-Agent", options.getUserAgent())
            .withQueryParam("format", "json")
            .withQueryParam("query", query)
            .merge(customRequestOptions);

        return transport.send(new ApiRequest(Map.of(), opts));
    }

    /* utilities */

    private void log(Level level, String method, String text) {
        if (level.intValue() <= Level.INFO.intValue() && options.isSilent()) {
            return;
        }

        logger.logp(level, "Mwbot", method, text);
    }

    private static JSONObject path(JSONObject object, String... keys) {
        var current = object;

        for (var key : keys) {
            if (current == null) {
                return null;
            }

            current = current.optJSONObject(key);
        }

        return current;
    }

    private static void putAll(Map<String, Object> params, Map<String, ?> extra) {
        if (extra != null) {
            params.putAll(extra);
        }
    }

    static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }

        return t;
    }
}
