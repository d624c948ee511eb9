package com.semaphore.migrator.migration.transform.model;

import lombok.Value;

/**
 * Outcome of coercing one document value to its column category: either the coerced literal, or
 * the escaped-text fallback together with the reason it was needed.
 */
@Value
public class CoercionResult {

    SqlLiteral literal;
    boolean fallback;
    String fallbackReason;

    public static CoercionResult coerced(SqlLiteral literal) {
        return new CoercionResult(literal, false, null);
    }

    public static CoercionResult fallback(SqlLiteral literal, String reason) {
        return new CoercionResult(literal, true, reason);
    }
}
