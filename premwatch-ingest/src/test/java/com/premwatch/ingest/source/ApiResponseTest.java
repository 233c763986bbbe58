package com.premwatch.ingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.premwatch.ingest.store.DataRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiResponseTest {

    private static JsonNode json(String text) throws Exception {
        return HttpClientFactory.getMapper().readTree(text);
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("Should read data array and snake_case pager")
        void readsDataAndPager() throws Exception {
            // When
            ApiResponse response = ApiResponse.parse(json("""
                {"success": true, "pager": {"current_page": 1, "max_page": 3}, "data": [{"id": 1}, {"id": 2}]}
                """));

            // Then
            assertEquals(new Pager(1, 3), response.pager());
            assertTrue(response.pager().hasMorePages());
            assertEquals(2, response.records().size());
        }

        @Test
        @DisplayName("Should accept camelCase pager fields")
        void readsCamelCasePager() throws Exception {
            ApiResponse response = ApiResponse.parse(json("""
                {"pager": {"currentPage": 2, "maxPage": 2}, "data": []}
                """));

            assertEquals(new Pager(2, 2), response.pager());
            assertFalse(response.pager().hasMorePages());
        }

        @Test
        @DisplayName("Should treat missing data as empty")
        void missingDataIsEmpty() throws Exception {
            ApiResponse response = ApiResponse.parse(json("{\"success\": false}"));

            assertFalse(response.hasData());
            assertTrue(response.records().isEmpty());
            assertNull(response.pager());
        }

        @Test
        @DisplayName("Should treat a non-object body as empty")
        void nonObjectBodyIsEmpty() throws Exception {
            assertFalse(ApiResponse.parse(json("[1, 2]")).hasData());
            assertFalse(ApiResponse.parse(null).hasData());
        }
    }

    @Nested
    @DisplayName("Records")
    class RecordTests {

        @Test
        @DisplayName("Should turn object data into one record")
        void objectDataIsOneRecord() throws Exception {
            // When
            List<DataRecord> records = ApiResponse.of(json("{\"title\": \"BTTS\", \"top\": [1, 2]}")).records();

            // Then
            assertEquals(1, records.size());
            assertEquals("BTTS", records.get(0).get("title"));
            assertEquals(List.of(1, 2), records.get(0).get("top"));
        }

        @Test
        @DisplayName("Should skip non-object array elements")
        void skipsScalarElements() throws Exception {
            List<DataRecord> records = ApiResponse.of(json("[{\"id\": 1}, 5, \"x\", null]")).records();

            assertEquals(1, records.size());
        }

        @Test
        @DisplayName("Should keep nested objects as maps")
        void keepsNestedObjects() throws Exception {
            DataRecord record = ApiResponse.of(json("{\"id\": 1, \"stats\": {\"wins\": 3}}")).records().get(0);

            assertEquals(Map.of("wins", 3), record.get("stats"));
        }

        @Test
        @DisplayName("Should append array pages in order")
        void appendsPages() throws Exception {
            // Given
            ApiResponse first = ApiResponse.of(json("[{\"id\": 1}]"));
            ApiResponse second = ApiResponse.of(json("[{\"id\": 2}, {\"id\": 3}]"));

            // When
            List<DataRecord> records = first.append(second).records();

            // Then
            assertEquals(List.of(1, 2, 3), records.stream().map(DataRecord::identity).toList());
        }
    }
}
