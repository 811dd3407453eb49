package com.github.mwbot.utils;

import java.io.Serializable;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.json.JSONObject;

/**
 * Snapshot of the latest revision of a page, taken right before an edit. The revision
 * timestamp and the time the snapshot was taken guard the follow-up edit against conflicts.
 */
public final class PageContainer implements Serializable {
    private static final long serialVersionUID = 6813720588617359904L;

    private final String title;
    private final int namespace;
    private final String text;
    private final OffsetDateTime timestamp;
    private final OffsetDateTime startTimestamp;

    public PageContainer(String title, int namespace, String text, OffsetDateTime timestamp, OffsetDateTime startTimestamp) {
        this.title = Objects.requireNonNull(title);
        this.namespace = namespace;
        this.text = Objects.requireNonNull(text);
        this.timestamp = Objects.requireNonNull(timestamp);
        this.startTimestamp = startTimestamp;
    }

    /**
     * Reads a page entry of a {@code prop=revisions} query. Both the slot layout
     * ({@code rvslots=main}) and the legacy top-level {@code content} are accepted.
     *
     * @param page one element of {@code query.pages}
     * @param curtimestamp the {@code curtimestamp} of the response, may be {@code null}
     */
    public static PageContainer fromQueryPage(JSONObject page, String curtimestamp) {
        var revision = page.getJSONArray("revisions").getJSONObject(0);
        var slots = revision.optJSONObject("slots");
        var main = slots != null ? slots.optJSONObject("main") : null;
        var content = main != null ? main.optString("content") : revision.optString("content");

        return new PageContainer(page.getString("title"), page.optInt("ns"), content,
            OffsetDateTime.parse(revision.getString("timestamp")),
            curtimestamp != null ? OffsetDateTime.parse(curtimestamp) : null);
    }

    public String getTitle() {
        return title;
    }

    public int getNamespace() {
        return namespace;
    }

    public String getText() {
        return text;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public OffsetDateTime getStartTimestamp() {
        return startTimestamp;
    }

    /**
     * @return {@code basetimestamp} and, if known, {@code starttimestamp} edit parameters
     */
    public Map<String, String> conflictGuard() {
        var params = new LinkedHashMap<String, String>();
        params.put("basetimestamp", format(timestamp));

        if (startTimestamp != null) {
            params.put("starttimestamp", format(startTimestamp));
        }

        return params;
    }

    private static String format(OffsetDateTime dateTime) {
        return DateTimeFormatter.ISO_INSTANT.format(dateTime.toInstant());
    }

    @Override
    public String toString() {
        return String.format("[%s @ %s, %d bytes]", title, format(timestamp), text.length());
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, timestamp);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof PageContainer pc) {
            return title.equals(pc.title) && timestamp.equals(pc.timestamp);
        } else {
            return false;
        }
    }
}
