package com.github.mwbot.title;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Namespace names, aliases and title rules of one wiki. Starts with the canonical
 * English namespaces and is replaced by site data through {@link #processNamespaceData(JSONObject)}.
 */
public class NamespaceTable {
    public static final int MEDIA_NAMESPACE = -2;
    public static final int SPECIAL_NAMESPACE = -1;
    public static final int MAIN_NAMESPACE = 0;
    public static final int FILE_NAMESPACE = 6;
    public static final int CATEGORY_NAMESPACE = 14;

    // MediaWiki's $wgLegalTitleChars with the byte range widened to the whole BMP
    private static final String DEFAULT_LEGAL_TITLE_CHARS = " %!\"$&'()*,\\-./0-9:;=?@A-Z\\\\^_`a-z~\\u0080-\\uFFFF+";
    private static final Pattern P_WHITESPACE = Pattern.compile("[ _\\u00A0\\u1680\\u180E\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000]+");
    private static final Pattern P_PREFIX = Pattern.compile("^(.+?)_*:_*(.*)$");
    private static final Pattern P_RELATIVE = Pattern.compile("^\\.{1,2}(?:/|$)|/\\.{1,2}(?:/|$)");
    private static final int MAX_TITLE_BYTES = 255;

    private static final String[] CANONICAL_NAMES = {
        "", "Talk", "User", "User talk", "Project", "Project talk", "File", "File talk",
        "MediaWiki", "MediaWiki talk", "Template", "Template talk", "Help", "Help talk",
        "Category", "Category talk"
    };

    private final Map<Integer, String> idNameMap = new HashMap<>();
    private final Map<String, Integer> nameIdMap = new HashMap<>();
    private final Set<Integer> caseSensitive = new HashSet<>();
    private Pattern illegalChars;
    private String legalTitleChars;

    public NamespaceTable() {
        idNameMap.put(MEDIA_NAMESPACE, "Media");
        idNameMap.put(SPECIAL_NAMESPACE, "Special");

        for (int i = 0; i < CANONICAL_NAMES.length; i++) {
            idNameMap.put(i, CANONICAL_NAMES[i]);
        }

        idNameMap.forEach((id, name) -> nameIdMap.put(normalizeName(name), id));
        nameIdMap.put("image", FILE_NAMESPACE);
        setLegalTitleChars(DEFAULT_LEGAL_TITLE_CHARS);
    }

    /**
     * Replaces the namespace data with the one found in a siteinfo response
     * ({@code siprop=general|namespaces|namespacealiases}). Both response format
     * versions are accepted.
     *
     * @param response a decoded API response containing {@code query.namespaces}
     * @throws IllegalArgumentException the response has no namespace data
     */
    public synchronized void processNamespaceData(JSONObject response) {
        var query = response.optJSONObject("query");

        if (query == null || query.optJSONObject("namespaces") == null) {
            throw new IllegalArgumentException("No namespace data in siteinfo response");
        }

        var namespaces = query.getJSONObject("namespaces");

        idNameMap.clear();
        nameIdMap.clear();
        caseSensitive.clear();

        for (var key : namespaces.keySet()) {
            var ns = namespaces.getJSONObject(key);
            var id = ns.optInt("id", Integer.parseInt(key));
            var name = ns.has("name") ? ns.getString("name") : ns.optString("*");

            idNameMap.put(id, name);
            nameIdMap.put(normalizeName(name), id);

            if (ns.has("canonical")) {
                nameIdMap.put(normalizeName(ns.getString("canonical")), id);
            }

            if ("case-sensitive".equals(ns.optString("case"))) {
                caseSensitive.add(id);
            }
        }

        var aliases = query.optJSONArray("namespacealiases");

        if (aliases == null) {
            aliases = new JSONArray();
        }

        for (int i = 0; i < aliases.length(); i++) {
            var alias = aliases.getJSONObject(i);
            var name = alias.has("alias") ? alias.getString("alias") : alias.optString("*");
            nameIdMap.put(normalizeName(name), alias.getInt("id"));
        }

        var general = query.optJSONObject("general");

        if (general != null && general.has("legaltitlechars")) {
            // the API reports the raw byte range of the UTF-8 encoding
            setLegalTitleChars(general.getString("legaltitlechars").replace("\\x80-\\xFF", "\\u0080-\\uFFFF"));
        }
    }

    /**
     * Parses a title string.
     *
     * @param text a title, with or without namespace prefix
     * @return the parsed title, or {@code null} if the text is not a valid title
     */
    public Title newFromText(String text) {
        return newFromText(text, MAIN_NAMESPACE);
    }

    public synchronized Title newFromText(String text, int defaultNamespace) {
        if (text == null) {
            return null;
        }

        var title = StringUtils.strip(P_WHITESPACE.matcher(text).replaceAll("_"), "_");
        int namespace = defaultNamespace;

        if (title.startsWith(":")) {
            namespace = MAIN_NAMESPACE;
            title = StringUtils.stripStart(title.substring(1), "_");
        }

        var m = P_PREFIX.matcher(title);

        if (m.matches()) {
            var id = nameIdMap.get(normalizeName(m.group(1)));

            if (id != null) {
                namespace = id;
                title = m.group(2);
            }
        }

        int fragment = title.indexOf('#');

        if (fragment != -1) {
            title = StringUtils.stripEnd(title.substring(0, fragment), "_");
        }

        if (title.isEmpty() || illegalChars.matcher(title).find() || P_RELATIVE.matcher(title).find() ||
                title.contains("~~~")) {
            return null;
        }

        if (namespace != SPECIAL_NAMESPACE && title.getBytes(StandardCharsets.UTF_8).length > MAX_TITLE_BYTES) {
            return null;
        }

        if (!caseSensitive.contains(namespace)) {
            title = StringUtils.capitalize(title);
        }

        return new Title(namespace, title, this);
    }

    public synchronized String getNamespaceName(int id) {
        return idNameMap.get(id);
    }

    public synchronized Integer getNamespaceId(String name) {
        return nameIdMap.get(normalizeName(name));
    }

    public synchronized Map<String, Integer> getNameIdMap() {
        return Map.copyOf(nameIdMap);
    }

    public synchronized String getLegalTitleChars() {
        return legalTitleChars;
    }

    private void setLegalTitleChars(String chars) {
        legalTitleChars = chars;
        illegalChars = Pattern.compile("[^" + chars + "]|%[0-9A-Fa-f]{2}|&[A-Za-z0-9\\u0080-\\uFFFF]+;|&#x?[0-9A-Fa-f]+;");
    }

    private static String normalizeName(String name) {
        return name.trim().replace(' ', '_').toLowerCase(Locale.ROOT);
    }
}
