package com.premwatch.ingest.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.premwatch.ingest.store.DataRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Successful payload from the remote API: the {@code data} node plus an optional pager.
 * {@code data} may be a list, a single object, or missing altogether; {@link #records()}
 * folds all of these into a plain record list.
 */
public record ApiResponse(JsonNode data, Pager pager) {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    /**
     * Wrap a parsed response body.
     */
    public static ApiResponse parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            return empty();
        }
        return new ApiResponse(root.get("data"), Pager.from(root.get("pager")));
    }

    public static ApiResponse of(JsonNode data) {
        return new ApiResponse(data, null);
    }

    public static ApiResponse empty() {
        return new ApiResponse(null, null);
    }

    /**
     * Normalized records: one per object element of an array, or one for an object.
     * Anything else (absent, null, scalar) yields an empty list.
     */
    public List<DataRecord> records() {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return Collections.emptyList();
        }
        ObjectMapper mapper = HttpClientFactory.getMapper();
        List<DataRecord> records = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode element : data) {
                if (element.isObject()) {
                    records.add(DataRecord.of(mapper.convertValue(element, FIELDS)));
                }
            }
        } else if (data.isObject()) {
            records.add(DataRecord.of(mapper.convertValue(data, FIELDS)));
        }
        return records;
    }

    public boolean hasData() {
        return !records().isEmpty();
    }

    /**
     * Append another page's data array to this one. Non-array data is not pageable,
     * so this response is returned unchanged.
     */
    public ApiResponse append(ApiResponse nextPage) {
        if (data == null || !data.isArray()) {
            return this;
        }
        ArrayNode combined = JsonNodeFactory.instance.arrayNode();
        combined.addAll((ArrayNode) data);
        if (nextPage.data() != null && nextPage.data().isArray()) {
            combined.addAll((ArrayNode) nextPage.data());
        }
        return new ApiResponse(combined, pager);
    }
}
