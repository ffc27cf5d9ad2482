package com.entity.network.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Inlines {@code $name} parameters into a Cypher string as literals. Strings are
 * single-quoted with backslashes and quotes escaped; JSON-encoded properties such as
 * metadata and aliases travel through here as plain strings.
 */
final class CypherLiterals {

    private CypherLiterals() {
    }

    static String inline(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        // longest names first so that $id never rewrites the prefix of $idList
        List<String> names = new ArrayList<>(params.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());
        String bound = query;
        for (String name : names) {
            bound = bound.replace("$" + name, literal(params.get(name)));
        }
        return bound;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        String text = value.toString();
        StringBuilder quoted = new StringBuilder(text.length() + 2).append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '\'') {
                quoted.append('\\');
            }
            quoted.append(c);
        }
        return quoted.append('\'').toString();
    }
}
