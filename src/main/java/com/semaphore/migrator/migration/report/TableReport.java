package com.semaphore.migrator.migration.report;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.semaphore.migrator.migration.transform.model.SkipReason;

import lombok.Getter;

/**
 * Counts for one processed table: documents discovered, rows emitted, rows skipped by reason.
 */
@Getter
public class TableReport {

    private final String tableName;
    private int documentsDiscovered;
    private int rowsEmitted;
    private int fallbackCoercions;
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

    public TableReport(String tableName) {
        this.tableName = tableName;
    }

    public void addDiscovered(int count) {
        documentsDiscovered += count;
    }

    public void recordEmitted() {
        rowsEmitted++;
    }

    public void recordSkipped(SkipReason reason) {
        recordSkipped(reason, 1);
    }

    public void recordSkipped(SkipReason reason, int count) {
        if (count > 0) {
            skipped.merge(reason, count, Integer::sum);
        }
    }

    public void recordFallbacks(int count) {
        fallbackCoercions += count;
    }

    public int getRowsSkipped() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getSkipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }

    public Map<SkipReason, Integer> getSkipped() {
        return Collections.unmodifiableMap(skipped);
    }
}
