package com.semaphore.migrator.migration.transform.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Either a {@link Row} or a skip with its reason. Coercion fallbacks that fired while building the
 * row are carried as warnings.
 */
@Value
@Builder
public class TransformOutcome {

    Row row;
    SkipReason skipReason;
    String detail;

    /**
     * Identifier of the record in the source export, when it has one.
     */
    String originalId;

    /**
     * Table of the unresolved parent for {@link SkipReason#MISSING_PARENT}.
     */
    String referencedTable;

    @Singular
    List<String> warnings;

    public boolean isSkipped() {
        return skipReason != null;
    }

    public static TransformOutcome skip(SkipReason reason, String originalId, String detail) {
        return TransformOutcome.builder()
                .skipReason(reason)
                .originalId(originalId)
                .detail(detail)
                .build();
    }
}
