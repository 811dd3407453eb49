package com.github.mwbot.title;

import java.util.Objects;

/**
 * A validated page title, split into namespace id and main part. The main part is held
 * in its underscored form.
 */
public final class Title {
    private final int namespace;
    private final String dbKey;
    private final NamespaceTable table;

    Title(int namespace, String dbKey, NamespaceTable table) {
        this.namespace = namespace;
        this.dbKey = Objects.requireNonNull(dbKey);
        this.table = Objects.requireNonNull(table);
    }

    public int getNamespace() {
        return namespace;
    }

    public String getDbKey() {
        return dbKey;
    }

    public String getMain() {
        return dbKey.replace('_', ' ');
    }

    public String getPrefixedText() {
        var prefix = table.getNamespaceName(namespace);

        if (prefix == null || prefix.isEmpty()) {
            return getMain();
        } else {
            return prefix + ":" + getMain();
        }
    }

    public String toText() {
        return getPrefixedText();
    }

    public Title inNamespace(int namespace) {
        return new Title(namespace, dbKey, table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, dbKey);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof Title t) {
            return namespace == t.namespace && dbKey.equals(t.dbKey);
        } else {
            return false;
        }
    }

    @Override
    public String toString() {
        return getPrefixedText();
    }
}
