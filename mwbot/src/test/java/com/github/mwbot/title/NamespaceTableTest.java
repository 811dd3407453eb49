package com.github.mwbot.title;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NamespaceTableTest {
    private final NamespaceTable table = new NamespaceTable();

    @Test
    void parsesNamespacePrefix() {
        var title = table.newFromText("User talk:some_body");

        assertEquals(3, title.getNamespace());
        assertEquals("Some_body", title.getDbKey());
        assertEquals("Some body", title.getMain());
        assertEquals("User talk:Some body", title.toText());
    }

    @Test
    void unknownPrefixStaysInMainNamespace() {
        var title = table.newFromText("Foo: bar");

        assertEquals(NamespaceTable.MAIN_NAMESPACE, title.getNamespace());
        assertEquals("Foo:_bar", title.getDbKey());
    }

    @Test
    void leadingColonStillResolvesPrefix() {
        assertEquals(NamespaceTable.CATEGORY_NAMESPACE, table.newFromText(":Category:Foo").getNamespace());
        assertEquals(NamespaceTable.MAIN_NAMESPACE, table.newFromText(":Foo", NamespaceTable.CATEGORY_NAMESPACE).getNamespace());
    }

    @Test
    void usesDefaultNamespaceWithoutPrefix() {
        var title = table.newFromText("Foo", NamespaceTable.CATEGORY_NAMESPACE);

        assertEquals("Category:Foo", title.toText());
    }

    @Test
    void imageIsAliasOfFile() {
        assertEquals("File:Example.png", table.newFromText("image:example.png").toText());
    }

    @Test
    void dropsFragmentAndNormalizesWhitespace() {
        var title = table.newFromText("  help: Contents   of__page#Section ");

        assertEquals("Help:Contents of page", title.toText());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "#Section", "a<b", "a[b]", "a{b}", "A%20B", "&amp;", "&#123;", "./x", "a/../b", "Sig ~~~", "Talk:"})
    void rejectsInvalidTitles(String text) {
        assertNull(table.newFromText(text));
    }

    @Test
    void rejectsOverlongTitles() {
        assertNull(table.newFromText("a".repeat(256)));
        assertEquals(255, table.newFromText("a".repeat(255)).getDbKey().length());
    }

    @Test
    void equalityIgnoresInputForm() {
        assertEquals(table.newFromText("Talk:foo bar"), table.newFromText("talk:Foo_bar"));
        assertNotEquals(table.newFromText("Talk:Foo"), table.newFromText("Foo"));
    }

    @Test
    void appliesSiteData() {
        table.processNamespaceData(new JSONObject("""
            {"query": {
              "general": {"legaltitlechars": " %!\\"$&'()*,\\\\-.\\\\/0-9:;=?@A-Z\\\\\\\\^_`a-z~\\\\x80-\\\\xFF+"},
              "namespaces": {
                "0": {"id": 0, "name": "", "case": "first-letter"},
                "6": {"id": 6, "name": "Archivo", "canonical": "File", "case": "first-letter"},
                "14": {"id": 14, "name": "Categoría", "canonical": "Category", "case": "first-letter"},
                "100": {"id": 100, "name": "apéndice", "case": "case-sensitive"}
              },
              "namespacealiases": [{"id": 6, "alias": "Imagen"}]
            }}
            """));

        assertEquals("Archivo:Foo.png", table.newFromText("imagen:foo.png").toText());
        assertEquals("Archivo:Foo.png", table.newFromText("File:foo.png").toText());
        assertEquals("Categoría:Ñandú", table.newFromText("categoría:ñandú").toText());
        assertEquals("apéndice:lista", table.newFromText("Apéndice:lista").toText());
        assertTrue(table.getLegalTitleChars().endsWith("~\\u0080-\\uFFFF+"));
        assertNull(table.getNamespaceId("Talk"));
        assertEquals(NamespaceTable.MAIN_NAMESPACE, table.newFromText("Talk:Foo").getNamespace());
    }

    @Test
    void acceptsLegacyResponseFormat() {
        table.processNamespaceData(new JSONObject("""
            {"query": {
              "namespaces": {
                "0": {"id": 0, "*": "", "case": "first-letter"},
                "4": {"id": 4, "*": "Wikcionario", "canonical": "Project", "case": "first-letter"}
              },
              "namespacealiases": [{"id": 4, "*": "WN"}]
            }}
            """));

        assertEquals(4, table.newFromText("WN:Portada").getNamespace());
        assertEquals("Wikcionario:Portada", table.newFromText("project:portada").toText());
    }

    @Test
    void rejectsResponseWithoutNamespaces() {
        assertThrows(IllegalArgumentException.class, () -> table.processNamespaceData(new JSONObject("{\"query\":{}}")));
    }
}
