package com.blissengine.compose;

/**
 * 导致无法产生组合的致命错误。
 */
public record CompositionError(Kind kind, String message) {

    public enum Kind {
        MISSING_FIELD,
        NOT_FOUND
    }

    public static CompositionError missingField(String field) {
        return new CompositionError(Kind.MISSING_FIELD, "missing required field: " + field);
    }

    public static CompositionError notFound(String message) {
        return new CompositionError(Kind.NOT_FOUND, message);
    }
}
