package com.premwatch.ingest.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Paging block returned alongside list endpoints.
 * FootyStats sends {@code current_page}/{@code max_page}; camelCase is accepted too.
 */
public record Pager(int currentPage, int maxPage) {

    /**
     * Parse a pager node, or null if the node is absent or carries no max page.
     */
    public static Pager from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode max = first(node, "max_page", "maxPage");
        if (max == null || !max.canConvertToInt()) {
            return null;
        }
        JsonNode current = first(node, "current_page", "currentPage");
        int currentPage = current != null && current.canConvertToInt() ? current.asInt() : 1;
        return new Pager(currentPage, max.asInt());
    }

    public boolean hasMorePages() {
        return maxPage > currentPage;
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}
