package com.premwatch.ingest.store;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Semantic kind of a record value. Decides the SQLite storage class of a column
 * the first time the column is written; never re-derived afterwards.
 */
public enum ColumnKind {
    INTEGER("INTEGER"),
    REAL("REAL"),
    TEXT("TEXT"),
    /** Objects and arrays, stored as canonical JSON text. */
    STRUCTURED("TEXT");

    private final String storageClass;

    ColumnKind(String storageClass) {
        this.storageClass = storageClass;
    }

    /**
     * SQL type used in CREATE TABLE / ALTER TABLE.
     */
    public String getStorageClass() {
        return storageClass;
    }

    /**
     * Classify a record value. Null and unknown types fall back to TEXT.
     */
    public static ColumnKind of(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger || value instanceof Boolean) {
            return INTEGER;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return REAL;
        }
        if (value instanceof Map || value instanceof Collection || (value != null && value.getClass().isArray())) {
            return STRUCTURED;
        }
        return TEXT;
    }

    /**
     * Kind for a column found in the database but missing from the catalog,
     * based on its declared SQL type.
     */
    public static ColumnKind fromDeclaredType(String declaredType) {
        if (declaredType == null) {
            return TEXT;
        }
        String type = declaredType.toUpperCase(Locale.ROOT);
        if (type.contains("INT")) {
            return INTEGER;
        }
        if (type.contains("REAL") || type.contains("FLOA") || type.contains("DOUB")) {
            return REAL;
        }
        return TEXT;
    }
}
